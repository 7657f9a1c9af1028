package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.Objects;

/**
 * One named model parameter with its bounds. Before the fit {@code value == initialValue} and
 * {@code stdError} is NaN; after the fit {@code value} is optimized and {@code stdError} is set
 * where the covariance defines it.
 */
public record FitParameter(String name, double value, double initialValue, double min, double max,
                           boolean vary, double stdError) {

    public static final String BASELINE_OFFSET = "baseline_offset";
    public static final String ISOMER_SHIFT = "isomer_shift";
    public static final String QUADRUPOLE_SPLITTING = "quadrupole_splitting";
    public static final String LINE_WIDTH = "line_width";
    public static final String AMPLITUDE = "amplitude";
    public static final String GAUSSIAN_WIDTH = "gaussian_width";
    public static final String FRACTION = "fraction";

    public FitParameter {
        Objects.requireNonNull(name, "name");
        if (min > max) {
            throw new IllegalArgumentException("Lower bound exceeds upper bound for " + name);
        }
    }

    public static FitParameter initial(String name, double value, double min, double max) {
        double seeded = Math.max(min, Math.min(max, value));
        return new FitParameter(name, seeded, seeded, min, max, true, Double.NaN);
    }

    /** @return The per-site name, e.g. {@code site2_line_width}. */
    public static String siteName(int siteNumber, String suffix) {
        return "site" + siteNumber + "_" + suffix;
    }

    public FitParameter withSeed(double newValue) {
        return new FitParameter(name, newValue, newValue, min, max, vary, stdError);
    }

    public FitParameter withBounds(double newMin, double newMax) {
        return new FitParameter(name, value, initialValue, newMin, newMax, vary, stdError);
    }

    public FitParameter withVary(boolean newVary) {
        return new FitParameter(name, value, initialValue, min, max, newVary, stdError);
    }

    public FitParameter withResult(double fitted, double error) {
        return new FitParameter(name, fitted, initialValue, min, max, vary, error);
    }

    public boolean hasStdError() {
        return !Double.isNaN(stdError);
    }
}
