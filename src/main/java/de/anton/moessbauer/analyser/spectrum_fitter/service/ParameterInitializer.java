package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.PeakGroup;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.SignalStatistics;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.SpectrumModel;
import de.anton.moessbauer.analyser.spectrum_fitter.model.CustomParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitterSettings;
import de.anton.moessbauer.analyser.spectrum_fitter.model.InvalidOptionsException;
import de.anton.moessbauer.analyser.spectrum_fitter.model.ModelType;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SiteKind;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Seeds and bounds every model parameter.
 *
 * Sites are taken from the strongest peak groups. A doublet group seeds its isomer shift at the
 * midpoint and its splitting at the peak separation; a singlet seeds the isomer shift at the peak
 * and pins the splitting at 0. Sites beyond the detected groups become doublets at the
 * absorption-weighted centroid with growing default splittings. Line widths start from the
 * measured FWHM (or the default) inside [minLineWidth, maxLineWidth]; amplitudes from the peak
 * height. The baseline offset starts at the median of the wings.
 */
public class ParameterInitializer {

    private static final Logger logger = LoggerFactory.getLogger(ParameterInitializer.class);
    private static final Pattern SITE_PREFIX = Pattern.compile("^site([1-9]\\d{0,5})_");

    private final FitterSettings settings;

    public ParameterInitializer(FitterSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * @param spectrum   The normalized spectrum.
     * @param modelType  Line shape of every site.
     * @param siteCount  Number of sites to build.
     * @param groups     Peak groups, strongest first; may hold fewer or more than {@code siteCount}.
     * @param custom     Overrides keyed by parameter name.
     * @throws InvalidOptionsException If a custom parameter is unknown, not finite, has conflicting
     *                                 bounds (after intersection with the physical limits) or a value
     *                                 outside its bounds, or if the free parameters are not fewer
     *                                 than the data points.
     */
    public FitSetup initialize(Spectrum spectrum, ModelType modelType, int siteCount, List<PeakGroup> groups,
                               Map<String, CustomParameter> custom) throws InvalidOptionsException {
        double[] v = spectrum.getVelocities();
        double[] a = spectrum.getAbsorption();
        double vMin = spectrum.minVelocity();
        double vMax = spectrum.maxVelocity();
        double span = vMax - vMin;
        double offset = SignalStatistics.median(SignalStatistics.wings(a, settings.wingFraction()));
        double fallbackAmplitude = Math.max(SignalStatistics.peakToPeak(a), Double.MIN_NORMAL) / (2.0 * siteCount);

        List<SiteKind> kinds = new ArrayList<>(siteCount);
        List<double[]> seeds = new ArrayList<>(siteCount); // {IS, QS, LW, AMP}
        for (int k = 0; k < siteCount; k++) {
            if (k < groups.size()) {
                PeakGroup g = groups.get(k);
                double amplitude = g.height() > 0 ? g.height() : fallbackAmplitude;
                double width = Double.isNaN(g.width()) ? settings.defaultLineWidth() : g.width();
                kinds.add(g.kind());
                seeds.add(new double[]{g.centroid(), g.splitting(), width, amplitude});
            } else {
                int extra = k - groups.size();
                kinds.add(SiteKind.DOUBLET);
                seeds.add(new double[]{weightedCentroid(v, a, offset), settings.defaultQuadrupoleSplitting() * (extra + 1),
                    settings.defaultLineWidth(), fallbackAmplitude});
            }
        }

        // A custom splitting on a singlet turns it into a doublet.
        for (int k = 0; k < siteCount; k++) {
            CustomParameter qs = custom.get(FitParameter.siteName(k + 1, FitParameter.QUADRUPOLE_SPLITTING));
            if (kinds.get(k) == SiteKind.SINGLET && qs != null
                    && (!Boolean.FALSE.equals(qs.vary()) || (qs.value() != null && qs.value() > 0))) {
                kinds.set(k, SiteKind.DOUBLET);
                seeds.get(k)[1] = settings.singletSeedSplitting();
                logger.debug("Site {} released from singlet to doublet by custom splitting", k + 1);
            }
        }

        SpectrumModel model = new SpectrumModel(modelType, settings.voigtMethod(), kinds);
        List<String> names = model.parameterNames();
        List<FitParameter> parameters = new ArrayList<>(names.size());
        for (int k = 0; k < siteCount; k++) {
            double[] seed = seeds.get(k);
            int n = k + 1;
            parameters.add(FitParameter.initial(FitParameter.siteName(n, FitParameter.ISOMER_SHIFT), seed[0], vMin, vMax));
            FitParameter qs = FitParameter.initial(FitParameter.siteName(n, FitParameter.QUADRUPOLE_SPLITTING), seed[1], 0.0, span);
            if (kinds.get(k) == SiteKind.SINGLET) {
                qs = qs.withSeed(0.0).withVary(false);
            }
            parameters.add(qs);
            parameters.add(FitParameter.initial(FitParameter.siteName(n, FitParameter.LINE_WIDTH), seed[2],
                settings.minLineWidth(), settings.maxLineWidth()));
            parameters.add(FitParameter.initial(FitParameter.siteName(n, FitParameter.AMPLITUDE), seed[3], 0.0, Double.POSITIVE_INFINITY));
            if (modelType == ModelType.VOIGT) {
                parameters.add(FitParameter.initial(FitParameter.siteName(n, FitParameter.GAUSSIAN_WIDTH), settings.defaultGaussianWidth(),
                    settings.minGaussianWidth(), settings.maxGaussianWidth()));
            } else if (modelType == ModelType.PSEUDO_VOIGT) {
                parameters.add(FitParameter.initial(FitParameter.siteName(n, FitParameter.FRACTION), settings.defaultMixingFraction(), 0.0, 1.0));
            }
        }
        parameters.add(FitParameter.initial(FitParameter.BASELINE_OFFSET, offset, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY));

        applyCustom(parameters, custom);

        FitSetup setup = new FitSetup(modelType, kinds, parameters);
        int free = setup.freeParameterCount();
        if (spectrum.size() <= free) {
            throw new InvalidOptionsException("Not enough data points (" + spectrum.size() + ") for " + free
                + " free parameters; reduce n_sites or fix parameters.");
        }
        logger.debug("Initialized {} site(s) {} with {} free of {} parameters", siteCount, kinds, free, parameters.size());
        return setup;
    }

    private void applyCustom(List<FitParameter> parameters, Map<String, CustomParameter> custom) throws InvalidOptionsException {
        for (Map.Entry<String, CustomParameter> entry : custom.entrySet()) {
            String name = entry.getKey();
            CustomParameter cp = entry.getValue();
            int index = indexOf(parameters, name);
            if (index < 0) {
                throw new InvalidOptionsException("Unknown custom parameter '" + name + "'. Known parameters: "
                    + parameters.stream().map(FitParameter::name).reduce((x, y) -> x + ", " + y).orElse(""));
            }
            FitParameter p = parameters.get(index);
            requireFinite(name, "value", cp.value());
            requireFinite(name, "min", cp.min());
            requireFinite(name, "max", cp.max());
            double[] limits = physicalLimits(name);
            double min = Math.max(cp.min() != null ? cp.min() : p.min(), limits[0]);
            double max = Math.min(cp.max() != null ? cp.max() : p.max(), limits[1]);
            if (min > max) {
                throw new InvalidOptionsException("Conflicting bounds for '" + name + "': min " + min + " > max " + max + ".");
            }
            double value;
            if (cp.value() != null) {
                value = cp.value();
                if (value < min || value > max) {
                    throw new InvalidOptionsException("Value " + value + " of '" + name + "' lies outside [" + min + ", " + max + "].");
                }
            } else {
                value = Math.max(min, Math.min(max, p.value()));
            }
            boolean vary = cp.vary() != null ? cp.vary() : p.vary();
            FitParameter updated = new FitParameter(name, value, value, min, max, vary, Double.NaN);
            parameters.set(index, updated);
            logger.debug("Custom parameter {} -> value={}, bounds=[{}, {}], vary={}", name, value, min, max, vary);
        }
    }

    private static void requireFinite(String name, String field, Double value) throws InvalidOptionsException {
        if (value != null && !Double.isFinite(value)) {
            throw new InvalidOptionsException("Custom " + field + " of '" + name + "' must be finite, got " + value + ".");
        }
    }

    /**
     * Hard limits a custom range is intersected with: widths stay at or above their physical minimum,
     * splittings and amplitudes non-negative, mixing fractions in [0, 1].
     */
    private double[] physicalLimits(String name) {
        if (name.endsWith("_" + FitParameter.LINE_WIDTH)) return new double[]{settings.minLineWidth(), Double.POSITIVE_INFINITY};
        if (name.endsWith("_" + FitParameter.GAUSSIAN_WIDTH)) return new double[]{settings.minGaussianWidth(), Double.POSITIVE_INFINITY};
        if (name.endsWith("_" + FitParameter.QUADRUPOLE_SPLITTING) || name.endsWith("_" + FitParameter.AMPLITUDE)) {
            return new double[]{0.0, Double.POSITIVE_INFINITY};
        }
        if (name.endsWith("_" + FitParameter.FRACTION)) return new double[]{0.0, 1.0};
        return new double[]{Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY};
    }

    /**
     * @return The overrides that apply to a model of {@code siteCount} sites: global ones and those
     *         of sites 1..siteCount.
     */
    static Map<String, CustomParameter> forSites(Map<String, CustomParameter> custom, int siteCount) {
        Map<String, CustomParameter> kept = new LinkedHashMap<>();
        for (Map.Entry<String, CustomParameter> entry : custom.entrySet()) {
            Matcher m = SITE_PREFIX.matcher(entry.getKey());
            if (!m.find() || Integer.parseInt(m.group(1)) <= siteCount) {
                kept.put(entry.getKey(), entry.getValue());
            }
        }
        return kept;
    }

    private static int indexOf(List<FitParameter> parameters, String name) {
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).name().equals(name)) return i;
        }
        return -1;
    }

    private static double weightedCentroid(double[] v, double[] a, double base) {
        double weight = 0.0;
        double sum = 0.0;
        for (int i = 0; i < v.length; i++) {
            double w = Math.max(0.0, a[i] - base);
            weight += w;
            sum += w * v[i];
        }
        return weight > 0 ? sum / weight : (v[0] + v[v.length - 1]) / 2.0;
    }
}
