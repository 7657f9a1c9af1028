package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.Objects;

/**
 * One fitted iron environment. Velocities and widths in mm/s; standard errors are NaN when undefined
 * (parameter pinned, at a bound, or without influence on the model).
 *
 * @param index               1-based site number used in parameter names ({@code site{index}_...}).
 * @param kind                Singlet or doublet.
 * @param relativeArea        Percent of the total absorption area; all sites sum to 100.
 * @param absoluteArea        Integrated absorption area of this site.
 * @param siteType            Categorical label, "Unknown" unless classified.
 * @param hyperfineField      Magnetic hyperfine field in T, null for singlets and doublets.
 * @param shapeParameter      Gaussian FWHM (Voigt) or Lorentzian fraction (pseudo-Voigt), null for Lorentzian.
 */
public record Site(
    int index,
    SiteKind kind,
    double isomerShift,
    double isomerShiftError,
    double quadrupoleSplitting,
    double quadrupoleSplittingError,
    double lineWidth,
    double lineWidthError,
    double amplitude,
    double relativeArea,
    double absoluteArea,
    String siteType,
    Double hyperfineField,
    Double shapeParameter
) {

    public static final String UNKNOWN_TYPE = "Unknown";

    public Site {
        Objects.requireNonNull(kind, "kind");
        siteType = siteType == null || siteType.isEmpty() ? UNKNOWN_TYPE : siteType;
    }

    /** @return Line centers: {IS - QS/2, IS + QS/2} for a doublet, {IS} for a singlet. */
    public double[] lineCenters() {
        if (kind == SiteKind.SINGLET) {
            return new double[]{isomerShift};
        }
        double half = quadrupoleSplitting / 2.0;
        return new double[]{isomerShift - half, isomerShift + half};
    }

    public Site withSiteType(String type) {
        return new Site(index, kind, isomerShift, isomerShiftError, quadrupoleSplitting, quadrupoleSplittingError,
            lineWidth, lineWidthError, amplitude, relativeArea, absoluteArea, type, hyperfineField, shapeParameter);
    }

    public String label() {
        return "Site " + index;
    }
}
