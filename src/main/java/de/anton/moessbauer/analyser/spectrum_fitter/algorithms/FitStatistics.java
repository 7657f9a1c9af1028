package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import java.util.OptionalDouble;

/**
 * Goodness-of-fit statistics.
 */
public final class FitStatistics {

    private FitStatistics() { throw new IllegalStateException("Utility class"); }

    /** @return Σ ((observed - fitted) / sigma)². */
    public static double chiSquared(double[] observed, double[] fitted, double[] sigma) {
        if (observed.length != fitted.length || observed.length != sigma.length) {
            throw new IllegalArgumentException("Arrays must have equal length.");
        }
        double sum = 0.0;
        for (int i = 0; i < observed.length; i++) {
            double r = (observed[i] - fitted[i]) / sigma[i];
            sum += r * r;
        }
        return sum;
    }

    /** @return χ² / (n - p), or empty if n - p ≤ 0. */
    public static OptionalDouble reducedChiSquared(double chiSquared, int dataPoints, int variables) {
        int dof = dataPoints - variables;
        return dof > 0 ? OptionalDouble.of(chiSquared / dof) : OptionalDouble.empty();
    }
}
