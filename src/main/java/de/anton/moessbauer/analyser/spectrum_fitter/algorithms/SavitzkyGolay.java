package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

/**
 * Savitzky-Golay smoothing with a quadratic polynomial. The window shrinks symmetrically
 * towards the ends of the signal; the first and last sample are passed through.
 */
public final class SavitzkyGolay {

    private SavitzkyGolay() { throw new IllegalStateException("Utility class"); }

    /**
     * @param signal Evenly sampled signal.
     * @param window Odd window length ≥ 3.
     * @return A new smoothed array of the same length.
     */
    public static double[] smooth(double[] signal, int window) {
        if (window < 3 || window % 2 == 0) {
            throw new IllegalArgumentException("Window must be odd and at least 3, got " + window);
        }
        int n = signal.length;
        int half = window / 2;
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            int m = Math.min(half, Math.min(i, n - 1 - i));
            if (m == 0) {
                out[i] = signal[i];
                continue;
            }
            double[] c = quadraticCoefficients(m);
            double sum = 0.0;
            for (int j = -m; j <= m; j++) {
                sum += c[j + m] * signal[i + j];
            }
            out[i] = sum;
        }
        return out;
    }

    /** Convolution weights for a (2m+1)-point quadratic fit evaluated at the center. */
    static double[] quadraticCoefficients(int m) {
        double norm = (2.0 * m + 3) * (2.0 * m + 1) * (2.0 * m - 1);
        double base = 3.0 * (3.0 * m * m + 3.0 * m - 1);
        double[] c = new double[2 * m + 1];
        for (int j = -m; j <= m; j++) {
            c[j + m] = (base - 15.0 * j * j) / norm;
        }
        return c;
    }
}
