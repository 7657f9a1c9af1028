package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

/**
 * Linear mixture η·L + (1-η)·G of a Lorentzian and a Gaussian sharing center and FWHM.
 * The shape argument is the Lorentzian fraction η, clamped to [0, 1].
 */
public final class PseudoVoigtProfile implements LineProfile {

    static final PseudoVoigtProfile INSTANCE = new PseudoVoigtProfile();

    private PseudoVoigtProfile() { }

    @Override
    public double value(double offset, double width, double shape) {
        double eta = clampFraction(shape);
        return eta * LorentzianProfile.lorentzian(offset, width) + (1.0 - eta) * LorentzianProfile.gaussian(offset, width);
    }

    @Override
    public double area(double width, double shape) {
        double eta = clampFraction(shape);
        return eta * Math.PI * width / 2.0 + (1.0 - eta) * LorentzianProfile.gaussianArea(width);
    }

    @Override
    public boolean hasShapeParameter() {
        return true;
    }

    private static double clampFraction(double eta) {
        return Math.max(0.0, Math.min(1.0, eta));
    }
}
