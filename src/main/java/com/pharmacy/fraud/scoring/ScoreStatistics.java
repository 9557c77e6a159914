package com.pharmacy.fraud.scoring;

import java.util.Collection;

/**
 * Population statistics over score collections. Callers pass values in a fixed order
 * so repeated runs produce bit-identical results.
 */
public final class ScoreStatistics {

    // Deviations below this are floating-point noise, not variation
    public static final double EPSILON = 1e-12;

    private ScoreStatistics() {}

    public static double mean(Collection<Double> values) {
        if (values.isEmpty()) return 0.0;
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    /**
     * Population standard deviation (divides by n, not n - 1).
     */
    public static double populationStdDev(Collection<Double> values) {
        if (values.size() < 2) return 0.0;
        double mean = mean(values);
        double squares = 0.0;
        for (double v : values) {
            double d = v - mean;
            squares += d * d;
        }
        return Math.sqrt(squares / values.size());
    }

    public static double clampUnit(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
