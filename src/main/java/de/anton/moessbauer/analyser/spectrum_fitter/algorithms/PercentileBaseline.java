package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import java.util.Arrays;

/**
 * Constant baseline at a high percentile of the signal for transmission input
 * (or the complementary low percentile for absorption input).
 */
public class PercentileBaseline implements BaselineEstimator {

    private final double percentile;

    /** @param percentile Percentile in (50, 100], e.g. 95. */
    public PercentileBaseline(double percentile) {
        if (percentile <= 50 || percentile > 100) throw new IllegalArgumentException("Percentile must be in (50, 100].");
        this.percentile = percentile;
    }

    @Override
    public double[] estimate(double[] velocities, double[] signal, boolean transmissionLike) {
        double p = transmissionLike ? percentile : 100.0 - percentile;
        double level = SignalStatistics.percentile(signal, Math.max(p, 1e-6));
        double[] baseline = new double[signal.length];
        Arrays.fill(baseline, level);
        return baseline;
    }
}
