package com.pharmacy.fraud.scoring;

import com.pharmacy.fraud.model.RunConfiguration;
import org.junit.jupiter.api.Test;

import java.util.SortedMap;
import java.util.TreeMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OutlierAnalyzerTest {

    private final OutlierAnalyzer analyzer = new OutlierAnalyzer();
    private final RunConfiguration config = RunConfiguration.builder().build();

    @Test
    void assess_twoSigmaAboveMean_scoresTwoThirds() {
        // mean 0.5, population sigma 0.2
        SortedMap<String, Double> scores = scores(0.9, 0.3, 0.3, 0.7, 0.3, 0.7, 0.3, 0.5, 0.5, 0.5);

        SortedMap<String, OutlierAssessment> assessments = analyzer.assess(scores, config);

        OutlierAssessment top = assessments.get("PH-00");
        assertThat(top.getZScore()).isCloseTo(2.0, within(1e-9));
        assertThat(top.getScore()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(top.isAboveMean()).isTrue();
        assertThat(assessments.get("PH-01").getZScore()).isCloseTo(-1.0, within(1e-9));
        assertThat(assessments.get("PH-01").isAboveMean()).isFalse();
        assertThat(assessments.get("PH-07").getScore()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void assess_extremeOutlier_scoreCapsAtOne() {
        SortedMap<String, Double> scores = new TreeMap<>();
        for (int i = 0; i < 99; i++) {
            scores.put(String.format("PH-%03d", i), 0.1);
        }
        scores.put("PH-999", 1.0);

        assertThat(analyzer.assess(scores, config).get("PH-999").getScore()).isEqualTo(1.0);
    }

    @Test
    void assess_singleEntity_isNeutral() {
        SortedMap<String, OutlierAssessment> assessments = analyzer.assess(scores(0.9), config);

        assertThat(assessments.get("PH-00")).isEqualTo(OutlierAssessment.NEUTRAL);
    }

    @Test
    void assess_emptyPopulation_isEmpty() {
        assertThat(analyzer.assess(new TreeMap<>(), config)).isEmpty();
    }

    @Test
    void assess_identicalScores_allNeutral() {
        SortedMap<String, OutlierAssessment> assessments = analyzer.assess(scores(0.4, 0.4, 0.4), config);

        assertThat(assessments.values()).containsOnly(OutlierAssessment.NEUTRAL);
    }

    private static SortedMap<String, Double> scores(double... values) {
        SortedMap<String, Double> scores = new TreeMap<>();
        for (int i = 0; i < values.length; i++) {
            scores.put(String.format("PH-%02d", i), values[i]);
        }
        return scores;
    }
}
