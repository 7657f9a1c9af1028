package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable per-request options. Defaults: Lorentzian lines, estimated site count,
 * no baseline correction, no custom parameters, site types left as "Unknown".
 */
public final class AnalysisOptions {

    private final ModelType modelType;
    private final Integer siteCount; // null = estimate
    private final boolean baselineCorrection;
    private final Map<String, CustomParameter> customParams;
    private final boolean classifySites;

    private AnalysisOptions(Builder b) {
        this.modelType = Objects.requireNonNull(b.modelType, "modelType cannot be null");
        this.siteCount = b.siteCount;
        this.baselineCorrection = b.baselineCorrection;
        this.customParams = Collections.unmodifiableMap(new LinkedHashMap<>(b.customParams));
        this.classifySites = b.classifySites;
    }

    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public ModelType getModelType() { return modelType; }

    /** @return The requested site count, or null when it should be estimated. */
    public Integer getSiteCount() { return siteCount; }

    public boolean isBaselineCorrection() { return baselineCorrection; }

    /** @return Unmodifiable map of parameter name to override, in insertion order. */
    public Map<String, CustomParameter> getCustomParams() { return customParams; }

    public boolean isClassifySites() { return classifySites; }

    /**
     * Checks the options against the configured limits.
     *
     * @throws InvalidOptionsException If the site count is outside [1, maxSites].
     */
    public void validate(FitterSettings settings) throws InvalidOptionsException {
        if (siteCount != null && (siteCount < 1 || siteCount > settings.maxSites())) {
            throw new InvalidOptionsException("n_sites must be between 1 and " + settings.maxSites() + ", got " + siteCount + ".");
        }
    }

    /**
     * Reads options from a string-keyed map as a host would receive them in a JSON request.
     * Recognized keys: {@code model_type}, {@code n_sites}, {@code baseline_correction},
     * {@code custom_params}, {@code classify_sites}. Unknown keys are rejected.
     */
    public static AnalysisOptions fromMap(Map<String, ?> raw) throws InvalidOptionsException {
        Builder builder = builder();
        if (raw == null) {
            return builder.build();
        }
        for (Map.Entry<String, ?> entry : raw.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case "model_type":
                    builder.modelType(value == null ? ModelType.LORENTZIAN : ModelType.fromTag(String.valueOf(value)));
                    break;
                case "n_sites":
                    builder.siteCount(toSiteCount(value));
                    break;
                case "baseline_correction":
                    builder.baselineCorrection(toBoolean(key, value));
                    break;
                case "classify_sites":
                    builder.classifySites(toBoolean(key, value));
                    break;
                case "custom_params":
                    if (value == null) break;
                    if (!(value instanceof Map)) {
                        throw new InvalidOptionsException("custom_params must be a mapping of parameter name to settings.");
                    }
                    for (Map.Entry<?, ?> p : ((Map<?, ?>) value).entrySet()) {
                        String name = String.valueOf(p.getKey());
                        Object spec = p.getValue();
                        if (spec instanceof Map) {
                            builder.customParam(name, CustomParameter.fromMap(name, (Map<?, ?>) spec));
                        } else if (spec instanceof Number) {
                            builder.customParam(name, CustomParameter.seed(((Number) spec).doubleValue()));
                        } else {
                            throw new InvalidOptionsException("Custom parameter '" + name + "' must be a number or a mapping.");
                        }
                    }
                    break;
                default:
                    throw new InvalidOptionsException("Unknown option '" + key + "'.");
            }
        }
        return builder.build();
    }

    private static Integer toSiteCount(Object value) throws InvalidOptionsException {
        if (value == null) return null;
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (d != Math.rint(d)) throw new InvalidOptionsException("n_sites must be an integer, got " + value + ".");
            return (int) d;
        }
        try {
            return Integer.parseInt(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new InvalidOptionsException("n_sites must be an integer, got '" + value + "'.");
        }
    }

    private static boolean toBoolean(String key, Object value) throws InvalidOptionsException {
        if (value == null) return false;
        if (value instanceof Boolean) return (Boolean) value;
        String s = String.valueOf(value).trim();
        if (s.equalsIgnoreCase("true")) return true;
        if (s.equalsIgnoreCase("false")) return false;
        throw new InvalidOptionsException(key + " must be a boolean, got '" + value + "'.");
    }

    @Override
    public String toString() {
        return "AnalysisOptions{model=" + modelType.tag() + ", n_sites=" + (siteCount == null ? "auto" : siteCount)
            + ", baseline=" + baselineCorrection + ", custom=" + customParams.keySet() + ", classify=" + classifySites + "}";
    }

    public static final class Builder {
        private ModelType modelType = ModelType.LORENTZIAN;
        private Integer siteCount;
        private boolean baselineCorrection;
        private final Map<String, CustomParameter> customParams = new LinkedHashMap<>();
        private boolean classifySites;

        private Builder() { }

        public Builder modelType(ModelType modelType) { this.modelType = modelType; return this; }
        public Builder siteCount(Integer siteCount) { this.siteCount = siteCount; return this; }
        public Builder baselineCorrection(boolean baselineCorrection) { this.baselineCorrection = baselineCorrection; return this; }
        public Builder classifySites(boolean classifySites) { this.classifySites = classifySites; return this; }

        public Builder customParam(String name, CustomParameter parameter) {
            customParams.put(Objects.requireNonNull(name, "parameter name"), Objects.requireNonNull(parameter, "parameter"));
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }
}
