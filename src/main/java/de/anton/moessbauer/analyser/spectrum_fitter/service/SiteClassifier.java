package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.model.Site;

/**
 * Labels a site with a likely iron oxidation and spin state from its isomer shift and
 * quadrupole splitting (both mm/s). The ranges overlap for some real compounds, so the
 * label is a hint, not an assignment.
 */
public class SiteClassifier {

    public static final String FE3_LOW_SPIN = "Fe³⁺ (low-spin)";
    public static final String FE3_HIGH_SPIN = "Fe³⁺ (high-spin)";
    public static final String FE2_LOW_SPIN = "Fe²⁺ (low-spin)";
    public static final String FE2_HIGH_SPIN = "Fe²⁺ (high-spin)";

    public String classify(double isomerShift, double quadrupoleSplitting) {
        if (isomerShift >= -0.2 && isomerShift <= 0.5) {
            return quadrupoleSplitting < 0.5 ? FE3_LOW_SPIN : FE3_HIGH_SPIN;
        }
        if (isomerShift >= 0.6 && isomerShift <= 1.5) {
            return quadrupoleSplitting < 1.0 ? FE2_LOW_SPIN : FE2_HIGH_SPIN;
        }
        return Site.UNKNOWN_TYPE;
    }

    public Site classify(Site site) {
        return site.withSiteType(classify(site.isomerShift(), site.quadrupoleSplitting()));
    }
}
