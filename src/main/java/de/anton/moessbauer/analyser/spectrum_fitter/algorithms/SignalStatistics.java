package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.util.Arrays;

/**
 * Robust summary statistics used by the normalizer and the site count estimator.
 */
public final class SignalStatistics {

    /** Scales a median absolute deviation to a Gaussian standard deviation. */
    public static final double MAD_TO_SIGMA = 1.4826;

    private SignalStatistics() { throw new IllegalStateException("Utility class"); }

    public static double median(double[] values) {
        if (values.length == 0) return Double.NaN;
        return new Median().evaluate(values);
    }

    /** @param p Percentile in (0, 100]. */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) return Double.NaN;
        return new Percentile().evaluate(values, p);
    }

    /** @return 1.4826 · median(|x - median(x)|). */
    public static double robustSigma(double[] values) {
        if (values.length == 0) return Double.NaN;
        double med = median(values);
        double[] dev = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            dev[i] = Math.abs(values[i] - med);
        }
        return MAD_TO_SIGMA * median(dev);
    }

    public static double peakToPeak(double[] values) {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (double v : values) { min = Math.min(min, v); max = Math.max(max, v); }
        return max - min;
    }

    public static double max(double[] values) {
        return Arrays.stream(values).max().orElse(Double.NaN);
    }

    public static double mean(double[] values) {
        return Arrays.stream(values).average().orElse(Double.NaN);
    }

    /** Number of points in each outer wing for a given fraction, at least 2. */
    public static int wingCount(int n, double fraction) {
        return Math.max(2, Math.min(n / 2, (int) Math.ceil(n * fraction)));
    }

    /** @return The first and last {@code wingCount} values, concatenated. */
    public static double[] wings(double[] values, double fraction) {
        int k = wingCount(values.length, fraction);
        double[] out = new double[2 * k];
        System.arraycopy(values, 0, out, 0, k);
        System.arraycopy(values, values.length - k, out, k, k);
        return out;
    }
}
