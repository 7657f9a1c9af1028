package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Goodness of fit and the per-site table of one analysis. Immutable.
 */
public final class FitResult {

    private final ModelType modelType;
    private final double chiSquared;
    private final OptionalDouble reducedChiSquared;
    private final int dataPointCount;
    private final int variableCount;
    private final List<Site> sites;
    private final List<FitParameter> parameters;
    private final boolean converged;
    private final int iterations;
    private final int evaluations;
    private final boolean siteCountEstimated;

    public FitResult(ModelType modelType, double chiSquared, OptionalDouble reducedChiSquared,
                     int dataPointCount, int variableCount, List<Site> sites, List<FitParameter> parameters,
                     boolean converged, int iterations, int evaluations, boolean siteCountEstimated) {
        this.modelType = Objects.requireNonNull(modelType, "modelType");
        if (chiSquared < 0 || Double.isNaN(chiSquared)) {
            throw new IllegalArgumentException("chi-squared must be a non-negative number, got " + chiSquared);
        }
        this.chiSquared = chiSquared;
        this.reducedChiSquared = Objects.requireNonNull(reducedChiSquared, "reducedChiSquared");
        this.dataPointCount = dataPointCount;
        this.variableCount = variableCount;
        this.sites = Collections.unmodifiableList(new ArrayList<>(sites));
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        this.converged = converged;
        this.iterations = iterations;
        this.evaluations = evaluations;
        this.siteCountEstimated = siteCountEstimated;
    }

    public ModelType getModelType() { return modelType; }

    public double getChiSquared() { return chiSquared; }

    /** @return chi² / (n_data_points - n_variables), empty when the degrees of freedom are not positive. */
    public OptionalDouble getReducedChiSquared() { return reducedChiSquared; }

    public int getDataPointCount() { return dataPointCount; }

    public int getVariableCount() { return variableCount; }

    public int getDegreesOfFreedom() { return dataPointCount - variableCount; }

    /** @return Sites ordered by descending relative area. */
    public List<Site> getSites() { return sites; }

    public int getSiteCount() { return sites.size(); }

    /** @return Every model parameter, free or pinned, in model order. */
    public List<FitParameter> getParameters() { return parameters; }

    public Optional<FitParameter> getParameter(String name) {
        return parameters.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    public boolean isConverged() { return converged; }

    public int getIterations() { return iterations; }

    public int getEvaluations() { return evaluations; }

    public boolean isSiteCountEstimated() { return siteCountEstimated; }

    /**
     * Structured input for the external interpretation service: site count, chi-squared
     * and each site's isomer shift, quadrupole splitting, line width and relative area.
     */
    public Map<String, Object> narrativeParameters() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("model_type", modelType.tag());
        out.put("n_sites", sites.size());
        out.put("chi_squared", chiSquared);
        out.put("reduced_chi_squared", reducedChiSquared.isPresent() ? reducedChiSquared.getAsDouble() : null);
        List<Map<String, Object>> siteList = new ArrayList<>();
        for (Site site : sites) {
            Map<String, Object> s = new LinkedHashMap<>();
            s.put("isomer_shift", site.isomerShift());
            s.put("quadrupole_splitting", site.quadrupoleSplitting());
            s.put("line_width", site.lineWidth());
            s.put("relative_area", site.relativeArea());
            s.put("site_type", site.siteType());
            siteList.add(s);
        }
        out.put("sites", siteList);
        return out;
    }
}
