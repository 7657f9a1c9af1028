package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import de.anton.moessbauer.analyser.spectrum_fitter.model.VoigtMethod;

import java.util.Objects;

/**
 * Convolution of a Lorentzian (FWHM = width) with a Gaussian (FWHM = shape), normalized to unit
 * peak height. Evaluated either exactly through the Faddeeva function or with the
 * Thompson-Cox-Hastings pseudo-Voigt equivalent.
 */
public final class VoigtProfile implements LineProfile {

    private static final double FWHM_TO_SIGMA = 1.0 / (2.0 * Math.sqrt(2.0 * Math.log(2.0)));
    private static final double SQRT_2 = Math.sqrt(2.0);
    private static final double SQRT_2PI = Math.sqrt(2.0 * Math.PI);

    private final VoigtMethod method;

    public VoigtProfile(VoigtMethod method) {
        this.method = Objects.requireNonNull(method, "method");
    }

    public VoigtMethod getMethod() {
        return method;
    }

    @Override
    public double value(double offset, double width, double shape) {
        if (method == VoigtMethod.THOMPSON_COX_HASTINGS) {
            double[] fe = tchWidthAndFraction(width, shape);
            return PseudoVoigtProfile.INSTANCE.value(offset, fe[0], fe[1]);
        }
        double sigma = shape * FWHM_TO_SIGMA;
        double gamma = width / 2.0;
        double scale = sigma * SQRT_2;
        double center = Faddeeva.real(0.0, gamma / scale);
        return Faddeeva.real(offset / scale, gamma / scale) / center;
    }

    @Override
    public double area(double width, double shape) {
        if (method == VoigtMethod.THOMPSON_COX_HASTINGS) {
            double[] fe = tchWidthAndFraction(width, shape);
            return PseudoVoigtProfile.INSTANCE.area(fe[0], fe[1]);
        }
        double sigma = shape * FWHM_TO_SIGMA;
        double gamma = width / 2.0;
        double center = Faddeeva.real(0.0, gamma / (sigma * SQRT_2));
        return sigma * SQRT_2PI / center;
    }

    @Override
    public boolean hasShapeParameter() {
        return true;
    }

    /**
     * Thompson, Cox and Hastings, J. Appl. Cryst. 20, 79 (1987).
     *
     * @return {total FWHM, Lorentzian fraction η}.
     */
    static double[] tchWidthAndFraction(double lorentzWidth, double gaussWidth) {
        double g = gaussWidth;
        double l = lorentzWidth;
        double f = Math.pow(Math.pow(g, 5) + 2.69269 * Math.pow(g, 4) * l + 2.42843 * Math.pow(g, 3) * l * l
            + 4.47163 * g * g * Math.pow(l, 3) + 0.07842 * g * Math.pow(l, 4) + Math.pow(l, 5), 0.2);
        double ratio = l / f;
        double eta = 1.36603 * ratio - 0.47719 * ratio * ratio + 0.11116 * ratio * ratio * ratio;
        return new double[]{f, eta};
    }
}
