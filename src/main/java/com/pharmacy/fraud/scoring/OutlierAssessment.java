package com.pharmacy.fraud.scoring;

import lombok.Value;

@Value
public class OutlierAssessment {

    public static final OutlierAssessment NEUTRAL = new OutlierAssessment(0.0, 0.0);

    double zScore;
    double score;

    /**
     * Only deviation above the population mean indicates fraud risk.
     */
    public boolean isAboveMean() {
        return zScore > 0.0;
    }
}
