package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import org.apache.commons.math3.complex.Complex;

/**
 * Faddeeva function w(z) = exp(-z²)·erfc(-iz) in the upper half plane, evaluated with
 * Weideman's rational series (SIAM J. Numer. Anal. 31, 1497 (1994)) with N = 32 terms.
 */
public final class Faddeeva {

    private static final int N = 32;
    private static final double L = Math.sqrt(N / Math.sqrt(2.0));
    private static final double INV_SQRT_PI = 1.0 / Math.sqrt(Math.PI);
    /** Series coefficients a_1..a_N; index 0 unused. */
    private static final double[] COEFFICIENTS = coefficients();

    private Faddeeva() { throw new IllegalStateException("Utility class"); }

    /**
     * @param x Real part of z.
     * @param y Imaginary part of z, must be ≥ 0.
     * @return w(x + iy).
     */
    public static Complex w(double x, double y) {
        double[] out = evaluate(x, y);
        return new Complex(out[0], out[1]);
    }

    /** @return Re w(x + iy), the unnormalized Voigt profile shape. */
    public static double real(double x, double y) {
        return evaluate(x, y)[0];
    }

    private static double[] evaluate(double x, double y) {
        if (y < 0) {
            throw new IllegalArgumentException("Faddeeva series requires Im z >= 0, got " + y);
        }
        // d = L - iz = (L + y) - ix, ratio = (L + iz) / (L - iz)
        double dRe = L + y;
        double dIm = -x;
        double dNorm = dRe * dRe + dIm * dIm;
        double nRe = L - y;
        double nIm = x;
        double rRe = (nRe * dRe + nIm * dIm) / dNorm;
        double rIm = (nIm * dRe - nRe * dIm) / dNorm;

        double pRe = 0.0;
        double pIm = 0.0;
        for (int n = N; n >= 1; n--) {
            double re = pRe * rRe - pIm * rIm + COEFFICIENTS[n];
            pIm = pRe * rIm + pIm * rRe;
            pRe = re;
        }
        // 1/d and 1/d²
        double invRe = dRe / dNorm;
        double invIm = -dIm / dNorm;
        double inv2Re = invRe * invRe - invIm * invIm;
        double inv2Im = 2.0 * invRe * invIm;
        double wRe = 2.0 * (pRe * inv2Re - pIm * inv2Im) + INV_SQRT_PI * invRe;
        double wIm = 2.0 * (pRe * inv2Im + pIm * inv2Re) + INV_SQRT_PI * invIm;
        return new double[]{wRe, wIm};
    }

    /** Real part of the discrete Fourier transform of the mapped Gaussian, computed once. */
    private static double[] coefficients() {
        int m = 2 * N;
        int size = 2 * m;
        double[] samples = new double[size];
        for (int j = 1; j < size; j++) {
            int k = j - m;
            double t = L * Math.tan(k * Math.PI / m / 2.0);
            samples[j] = Math.exp(-t * t) * (L * L + t * t);
        }
        double[] shifted = new double[size];
        for (int i = 0; i < size; i++) {
            shifted[i] = samples[(i + m) % size];
        }
        double[] a = new double[N + 1];
        for (int n = 1; n <= N; n++) {
            double sum = 0.0;
            for (int j = 0; j < size; j++) {
                sum += shifted[j] * Math.cos(2.0 * Math.PI * j * n / size);
            }
            a[n] = sum / size;
        }
        return a;
    }
}
