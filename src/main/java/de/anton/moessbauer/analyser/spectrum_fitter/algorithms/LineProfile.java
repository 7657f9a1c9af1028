package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

/**
 * A single absorption line shape, normalized to a peak height of 1 at its center.
 * Implementations are stateless and safe to share between threads.
 */
public interface LineProfile {

    /**
     * @param offset Distance from the line center (velocity - center), mm/s.
     * @param width  Full width at half maximum of the Lorentzian part, mm/s.
     * @param shape  Gaussian FWHM (Voigt) or Lorentzian fraction (pseudo-Voigt); ignored by Lorentzian lines.
     * @return Line intensity relative to the peak height.
     */
    double value(double offset, double width, double shape);

    /** @return Integrated area of a line of unit peak height. */
    double area(double width, double shape);

    /** @return True if the profile uses its {@code shape} argument. */
    boolean hasShapeParameter();
}
