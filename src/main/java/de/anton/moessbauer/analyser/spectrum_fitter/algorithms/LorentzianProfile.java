package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

/**
 * Lorentzian line: (Γ/2)² / (x² + (Γ/2)²).
 */
public final class LorentzianProfile implements LineProfile {

    static final LorentzianProfile INSTANCE = new LorentzianProfile();

    private LorentzianProfile() { }

    @Override
    public double value(double offset, double width, double shape) {
        double hw = width / 2.0;
        double hw2 = hw * hw;
        return hw2 / (offset * offset + hw2);
    }

    @Override
    public double area(double width, double shape) {
        return Math.PI * width / 2.0;
    }

    @Override
    public boolean hasShapeParameter() {
        return false;
    }

    /** Lorentzian of the given FWHM, used by the mixed profiles. */
    static double lorentzian(double offset, double width) {
        return INSTANCE.value(offset, width, 0);
    }

    /** Gaussian of the given FWHM with unit peak height. */
    static double gaussian(double offset, double width) {
        return Math.exp(-4.0 * Math.log(2.0) * offset * offset / (width * width));
    }

    /** Area of a unit-height Gaussian of the given FWHM. */
    static double gaussianArea(double width) {
        return width * Math.sqrt(Math.PI / (4.0 * Math.log(2.0)));
    }
}
