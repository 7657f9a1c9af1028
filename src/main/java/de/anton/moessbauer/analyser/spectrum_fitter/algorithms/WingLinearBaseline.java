package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * Straight line fitted by least squares through the outer wings of the spectrum
 * (the first and last {@code wingFraction} of the points). Wing points further than
 * {@link #REJECT_SIGMAS} robust standard deviations from the first line are dropped once
 * and the line is refitted.
 */
public class WingLinearBaseline implements BaselineEstimator {

    private static final Logger logger = LoggerFactory.getLogger(WingLinearBaseline.class);
    static final double REJECT_SIGMAS = 3.0;

    private final double wingFraction;

    public WingLinearBaseline(double wingFraction) {
        if (wingFraction <= 0 || wingFraction >= 0.5) throw new IllegalArgumentException("Wing fraction must be in (0, 0.5).");
        this.wingFraction = wingFraction;
    }

    @Override
    public double[] estimate(double[] velocities, double[] signal, boolean transmissionLike) {
        int n = signal.length;
        int k = SignalStatistics.wingCount(n, wingFraction);
        int[] wing = new int[2 * k];
        for (int i = 0; i < k; i++) {
            wing[i] = i;
            wing[k + i] = n - k + i;
        }

        SimpleRegression first = fit(velocities, signal, wing);
        double[] residuals = Arrays.stream(wing)
            .mapToDouble(i -> signal[i] - first.predict(velocities[i]))
            .toArray();
        double sigma = SignalStatistics.robustSigma(residuals);

        SimpleRegression line = first;
        if (sigma > 0) {
            int[] kept = Arrays.stream(wing)
                .filter(i -> Math.abs(signal[i] - first.predict(velocities[i])) <= REJECT_SIGMAS * sigma)
                .toArray();
            if (kept.length >= 3 && kept.length < wing.length) {
                logger.debug("Wing baseline: rejected {} of {} wing points", wing.length - kept.length, wing.length);
                line = fit(velocities, signal, kept);
            }
        }

        double intercept = line.getIntercept();
        double slope = Double.isNaN(line.getSlope()) ? 0.0 : line.getSlope();
        logger.debug("Wing baseline: intercept={}, slope={}", intercept, slope);
        double[] baseline = new double[n];
        for (int i = 0; i < n; i++) {
            baseline[i] = intercept + slope * velocities[i];
        }
        return baseline;
    }

    private static SimpleRegression fit(double[] x, double[] y, int[] indices) {
        SimpleRegression regression = new SimpleRegression();
        for (int i : indices) {
            regression.addData(x[i], y[i]);
        }
        return regression;
    }
}
