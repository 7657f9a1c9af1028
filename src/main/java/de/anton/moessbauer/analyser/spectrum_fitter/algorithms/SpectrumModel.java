package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import de.anton.moessbauer.analyser.spectrum_fitter.model.FitParameter;
import de.anton.moessbauer.analyser.spectrum_fitter.model.ModelType;
import de.anton.moessbauer.analyser.spectrum_fitter.model.SiteKind;
import de.anton.moessbauer.analyser.spectrum_fitter.model.VoigtMethod;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Composite absorption model: a constant offset plus one singlet or symmetric doublet per site.
 *
 * The parameter vector holds, for every site k in order, isomer shift, quadrupole splitting,
 * line width, amplitude and (Voigt / pseudo-Voigt only) the shape parameter, followed by the
 * global baseline offset. Doublet lines sit at IS ∓ QS/2 with equal width and equal height;
 * a singlet draws one line at IS and ignores its splitting slot.
 */
public final class SpectrumModel {

    public static final int ISOMER_SHIFT = 0;
    public static final int QUADRUPOLE_SPLITTING = 1;
    public static final int LINE_WIDTH = 2;
    public static final int AMPLITUDE = 3;
    public static final int SHAPE = 4;

    private final ModelType modelType;
    private final LineProfile profile;
    private final List<SiteKind> kinds;
    private final int perSite;

    public SpectrumModel(ModelType modelType, VoigtMethod voigtMethod, List<SiteKind> kinds) {
        this.modelType = Objects.requireNonNull(modelType, "modelType");
        this.profile = LineProfiles.forModel(modelType, voigtMethod);
        this.kinds = Collections.unmodifiableList(new ArrayList<>(kinds));
        if (this.kinds.isEmpty()) throw new IllegalArgumentException("A model needs at least one site.");
        this.perSite = profile.hasShapeParameter() ? 5 : 4;
    }

    public ModelType getModelType() { return modelType; }

    public LineProfile getProfile() { return profile; }

    public List<SiteKind> getKinds() { return kinds; }

    public int siteCount() { return kinds.size(); }

    public int parametersPerSite() { return perSite; }

    public int parameterCount() { return kinds.size() * perSite + 1; }

    public int offsetIndex() { return kinds.size() * perSite; }

    /** @param site 0-based site index. */
    public int index(int site, int slot) {
        if (slot >= perSite) throw new IllegalArgumentException(modelType + " has no slot " + slot);
        return site * perSite + slot;
    }

    /** @return Parameter names in vector order, e.g. {@code site1_isomer_shift, ..., baseline_offset}. */
    public List<String> parameterNames() {
        List<String> names = new ArrayList<>(parameterCount());
        for (int k = 0; k < kinds.size(); k++) {
            int number = k + 1;
            names.add(FitParameter.siteName(number, FitParameter.ISOMER_SHIFT));
            names.add(FitParameter.siteName(number, FitParameter.QUADRUPOLE_SPLITTING));
            names.add(FitParameter.siteName(number, FitParameter.LINE_WIDTH));
            names.add(FitParameter.siteName(number, FitParameter.AMPLITUDE));
            if (perSite == 5) {
                names.add(FitParameter.siteName(number, shapeSuffix()));
            }
        }
        names.add(FitParameter.BASELINE_OFFSET);
        return names;
    }

    /** @return "gaussian_width" for Voigt, "fraction" for pseudo-Voigt, null for Lorentzian. */
    public String shapeSuffix() {
        switch (modelType) {
            case VOIGT: return FitParameter.GAUSSIAN_WIDTH;
            case PSEUDO_VOIGT: return FitParameter.FRACTION;
            default: return null;
        }
    }

    /** @return Contribution of one site at velocity v, without the offset. */
    public double siteValue(int site, double v, double[] p) {
        int base = site * perSite;
        double is = p[base + ISOMER_SHIFT];
        double width = p[base + LINE_WIDTH];
        double amplitude = p[base + AMPLITUDE];
        double shape = perSite == 5 ? p[base + SHAPE] : 0.0;
        if (kinds.get(site) == SiteKind.SINGLET) {
            return amplitude * profile.value(v - is, width, shape);
        }
        double half = p[base + QUADRUPOLE_SPLITTING] / 2.0;
        return amplitude * (profile.value(v - is + half, width, shape) + profile.value(v - is - half, width, shape));
    }

    public double value(double v, double[] p) {
        double sum = p[offsetIndex()];
        for (int k = 0; k < kinds.size(); k++) {
            sum += siteValue(k, v, p);
        }
        return sum;
    }

    public double[] evaluate(double[] velocities, double[] p) {
        double[] out = new double[velocities.length];
        for (int i = 0; i < velocities.length; i++) {
            out[i] = value(velocities[i], p);
        }
        return out;
    }

    /** @return Site contribution plus offset at every velocity, for component plots. */
    public double[] evaluateComponent(int site, double[] velocities, double[] p) {
        double offset = p[offsetIndex()];
        double[] out = new double[velocities.length];
        for (int i = 0; i < velocities.length; i++) {
            out[i] = offset + siteValue(site, velocities[i], p);
        }
        return out;
    }

    /** @return Integrated absorption area of one site: lines × unit-line area × amplitude. */
    public double siteArea(int site, double[] p) {
        int base = site * perSite;
        double shape = perSite == 5 ? p[base + SHAPE] : 0.0;
        return kinds.get(site).lineCount() * profile.area(p[base + LINE_WIDTH], shape) * p[base + AMPLITUDE];
    }
}
