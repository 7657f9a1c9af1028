package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.BaselineEstimator;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.SignalStatistics;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitterSettings;
import de.anton.moessbauer.analyser.spectrum_fitter.model.InvalidSpectrumException;
import de.anton.moessbauer.analyser.spectrum_fitter.model.RawSpectrum;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Comparator;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Turns raw (velocity, signal) samples into a canonical absorption spectrum.
 *
 * Input is classified as transmission-like when its mean is at least half of its largest absolute
 * value; otherwise it is taken as absorption. Transmission in percent (maximum in
 * (percentScaleThreshold, 110]) is divided by 100 when no baseline correction is requested.
 * <ul>
 *   <li>transmission, corrected: absorption = 1 - signal / baseline(v)</li>
 *   <li>transmission, uncorrected: absorption = 1 - signal</li>
 *   <li>absorption, corrected: absorption = signal - baseline(v)</li>
 *   <li>absorption, uncorrected: unchanged</li>
 * </ul>
 * Supplied uncertainties are scaled with the signal; missing ones default to 1.
 */
public class SpectrumNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumNormalizer.class);
    private static final double PERCENT_MAX = 110.0;

    private final FitterSettings settings;
    private final BaselineEstimator baselineEstimator;

    public SpectrumNormalizer(FitterSettings settings) {
        this(settings, BaselineEstimator.forSettings(settings));
    }

    public SpectrumNormalizer(FitterSettings settings, BaselineEstimator baselineEstimator) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.baselineEstimator = Objects.requireNonNull(baselineEstimator, "baselineEstimator");
    }

    /**
     * @throws InvalidSpectrumException If arrays differ in length, contain NaN/Inf, have fewer than
     *                                  the minimum number of points, contain duplicate velocities,
     *                                  non-positive uncertainties or a constant signal.
     */
    public Spectrum normalize(RawSpectrum raw, boolean baselineCorrection) throws InvalidSpectrumException {
        Objects.requireNonNull(raw, "raw spectrum");
        double[] v = raw.getVelocities();
        double[] s = raw.getSignal();
        double[] sigma = raw.getUncertainties();
        validate(v, s, sigma);

        Integer[] order = IntStream.range(0, v.length).boxed().toArray(Integer[]::new);
        Arrays.sort(order, Comparator.comparingDouble(i -> v[i]));
        double[] vs = new double[v.length];
        double[] ss = new double[v.length];
        double[] sig = new double[v.length];
        for (int k = 0; k < order.length; k++) {
            vs[k] = v[order[k]];
            ss[k] = s[order[k]];
            sig[k] = sigma == null ? 1.0 : sigma[order[k]];
        }
        for (int k = 1; k < vs.length; k++) {
            if (vs[k] == vs[k - 1]) {
                throw new InvalidSpectrumException("Duplicate velocity " + vs[k] + " mm/s.");
            }
        }
        if (SignalStatistics.peakToPeak(ss) <= 0) {
            throw new InvalidSpectrumException("Signal is constant; the spectrum has no structure to fit.");
        }

        double maxAbs = Arrays.stream(ss).map(Math::abs).max().orElse(0.0);
        boolean transmissionLike = SignalStatistics.mean(ss) >= 0.5 * maxAbs;
        boolean uncertaintiesSupplied = sigma != null;

        double[] absorption = new double[vs.length];
        if (transmissionLike) {
            if (baselineCorrection) {
                double[] baseline = baselineEstimator.estimate(vs, ss, true);
                for (int k = 0; k < vs.length; k++) {
                    if (!(baseline[k] > 0)) {
                        throw new InvalidSpectrumException("Estimated transmission baseline is not positive at " + vs[k] + " mm/s.");
                    }
                    absorption[k] = 1.0 - ss[k] / baseline[k];
                    if (uncertaintiesSupplied) sig[k] /= baseline[k];
                }
            } else {
                double max = SignalStatistics.max(ss);
                double scale = max > settings.percentScaleThreshold() && max <= PERCENT_MAX ? 100.0 : 1.0;
                if (scale != 1.0) {
                    logger.debug("Transmission looks like percent (max {}), dividing by 100", max);
                }
                for (int k = 0; k < vs.length; k++) {
                    absorption[k] = 1.0 - ss[k] / scale;
                    if (uncertaintiesSupplied) sig[k] /= scale;
                }
            }
        } else if (baselineCorrection) {
            double[] baseline = baselineEstimator.estimate(vs, ss, false);
            for (int k = 0; k < vs.length; k++) {
                absorption[k] = ss[k] - baseline[k];
            }
        } else {
            System.arraycopy(ss, 0, absorption, 0, ss.length);
        }

        logger.debug("Normalized {} points: transmissionInput={}, baselineCorrected={}, uncertainties={}",
            vs.length, transmissionLike, baselineCorrection, uncertaintiesSupplied);
        return new Spectrum(vs, absorption, sig, transmissionLike, baselineCorrection, uncertaintiesSupplied);
    }

    private void validate(double[] v, double[] s, double[] sigma) throws InvalidSpectrumException {
        if (v.length != s.length) {
            throw new InvalidSpectrumException("Velocity and signal columns differ in length (" + v.length + " vs " + s.length + ").");
        }
        if (sigma != null && sigma.length != v.length) {
            throw new InvalidSpectrumException("Uncertainty column has " + sigma.length + " values for " + v.length + " points.");
        }
        if (v.length < settings.minDataPoints()) {
            throw new InvalidSpectrumException("Insufficient data points: " + v.length + " (minimum " + settings.minDataPoints() + ").");
        }
        for (int i = 0; i < v.length; i++) {
            if (!Double.isFinite(v[i]) || !Double.isFinite(s[i])) {
                throw new InvalidSpectrumException("Non-finite value in row " + (i + 1) + ".");
            }
            if (sigma != null && !(Double.isFinite(sigma[i]) && sigma[i] > 0)) {
                throw new InvalidSpectrumException("Uncertainty in row " + (i + 1) + " must be positive and finite.");
            }
        }
    }
}
