package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds absorption maxima above a noise-adaptive threshold.
 * The signal is smoothed with a quadratic Savitzky-Golay filter; the noise level is the robust
 * standard deviation of (signal - smoothed). A local maximum of the smoothed signal is a peak if it
 * exceeds baseLevel + noiseMultiplier · noise (never less than {@link #MIN_RELATIVE_HEIGHT} of the
 * highest point above baseLevel) and stands out from the surrounding signal by the same margin
 * (its prominence). Of two peaks closer than {@code minSeparation} only the higher one is kept.
 */
public class PeakDetector {

    private static final Logger logger = LoggerFactory.getLogger(PeakDetector.class);
    /** Floor of the threshold relative to the highest smoothed point, for noise-free input. */
    public static final double MIN_RELATIVE_HEIGHT = 0.02;

    private final int smoothingWindow;
    private final double noiseMultiplier;
    private final double minSeparation;
    private final double wingFraction;

    public PeakDetector(int smoothingWindow, double noiseMultiplier, double minSeparation, double wingFraction) {
        if (noiseMultiplier <= 0) throw new IllegalArgumentException("Noise multiplier must be positive.");
        if (minSeparation < 0) throw new IllegalArgumentException("Minimum separation must not be negative.");
        this.smoothingWindow = smoothingWindow;
        this.noiseMultiplier = noiseMultiplier;
        this.minSeparation = minSeparation;
        this.wingFraction = wingFraction;
    }

    /**
     * @param velocities Strictly increasing velocities.
     * @param absorption Absorption, positive at resonance.
     */
    public PeakSearch detect(double[] velocities, double[] absorption) {
        int n = absorption.length;
        double[] smoothed = SavitzkyGolay.smooth(absorption, Math.min(smoothingWindow, oddAtMost(n)));
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            residual[i] = absorption[i] - smoothed[i];
        }
        double noise = SignalStatistics.robustSigma(residual);
        double base = SignalStatistics.median(SignalStatistics.wings(smoothed, wingFraction));
        double margin = Math.max(noiseMultiplier * noise, MIN_RELATIVE_HEIGHT * (SignalStatistics.max(smoothed) - base));
        double threshold = base + margin;
        logger.debug("Peak search: base={}, noise={}, threshold={}", base, noise, threshold);

        List<Peak> candidates = new ArrayList<>();
        for (int i = 1; i < n - 1; i++) {
            if (smoothed[i] > smoothed[i - 1] && smoothed[i] >= smoothed[i + 1] && smoothed[i] > threshold
                    && prominence(smoothed, i) >= margin) {
                candidates.add(new Peak(i, velocities[i], smoothed[i] - base, halfHeightWidth(velocities, smoothed, i, base)));
            }
        }

        candidates.sort(Comparator.comparingDouble(Peak::height).reversed().thenComparingInt(Peak::index));
        List<Peak> accepted = new ArrayList<>();
        for (Peak candidate : candidates) {
            boolean separated = accepted.stream()
                .allMatch(p -> Math.abs(p.velocity() - candidate.velocity()) >= minSeparation);
            if (separated) {
                accepted.add(candidate);
            } else {
                logger.trace("Dropping peak at {} mm/s, too close to a higher one", candidate.velocity());
            }
        }
        accepted.sort(Comparator.comparingDouble(Peak::velocity));
        logger.debug("Peak search found {} peaks ({} candidates)", accepted.size(), candidates.size());
        return new PeakSearch(accepted, noise, base, threshold);
    }

    /**
     * Width at half height above {@code base}, interpolated linearly between samples.
     * If only one side crosses half height the width is twice that half width.
     */
    static double halfHeightWidth(double[] v, double[] y, int peak, double base) {
        double half = base + (y[peak] - base) / 2.0;
        double left = Double.NaN;
        for (int i = peak; i > 0; i--) {
            if (y[i - 1] <= half) {
                left = interpolate(v[i - 1], y[i - 1], v[i], y[i], half);
                break;
            }
        }
        double right = Double.NaN;
        for (int i = peak; i < y.length - 1; i++) {
            if (y[i + 1] <= half) {
                right = interpolate(v[i], y[i], v[i + 1], y[i + 1], half);
                break;
            }
        }
        if (!Double.isNaN(left) && !Double.isNaN(right)) return right - left;
        if (!Double.isNaN(left)) return 2.0 * (v[peak] - left);
        if (!Double.isNaN(right)) return 2.0 * (right - v[peak]);
        return Double.NaN;
    }

    /**
     * Height of a maximum above the higher of the two lowest points reached before the signal
     * rises above the maximum again (or the array ends) on either side.
     */
    static double prominence(double[] y, int peak) {
        double leftMin = y[peak];
        for (int i = peak - 1; i >= 0 && y[i] <= y[peak]; i--) {
            leftMin = Math.min(leftMin, y[i]);
        }
        double rightMin = y[peak];
        for (int i = peak + 1; i < y.length && y[i] <= y[peak]; i++) {
            rightMin = Math.min(rightMin, y[i]);
        }
        return y[peak] - Math.max(leftMin, rightMin);
    }

    private static double interpolate(double x0, double y0, double x1, double y1, double level) {
        if (y1 == y0) return (x0 + x1) / 2.0;
        return x0 + (level - y0) * (x1 - x0) / (y1 - y0);
    }

    private static int oddAtMost(int n) {
        int w = n % 2 == 0 ? n - 1 : n;
        return Math.max(3, w);
    }
}
