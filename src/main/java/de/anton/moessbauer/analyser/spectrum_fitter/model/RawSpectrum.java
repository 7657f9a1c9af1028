package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.List;
import java.util.Objects;

/**
 * Un-normalized (velocity, signal) samples as delivered by file ingestion, optionally with
 * per-point uncertainties. Order is arbitrary; validation happens in the normalizer.
 */
public final class RawSpectrum {

    private final double[] velocities;
    private final double[] signal;
    private final double[] uncertainties; // null when not supplied

    private RawSpectrum(double[] velocities, double[] signal, double[] uncertainties) {
        this.velocities = Objects.requireNonNull(velocities, "velocities cannot be null").clone();
        this.signal = Objects.requireNonNull(signal, "signal cannot be null").clone();
        this.uncertainties = uncertainties == null ? null : uncertainties.clone();
    }

    public static RawSpectrum of(double[] velocities, double[] signal) {
        return new RawSpectrum(velocities, signal, null);
    }

    public static RawSpectrum of(double[] velocities, double[] signal, double[] uncertainties) {
        return new RawSpectrum(velocities, signal, Objects.requireNonNull(uncertainties, "uncertainties"));
    }

    /** Builds samples from rows of two (velocity, signal) or three (…, uncertainty) numbers. */
    public static RawSpectrum fromRows(List<double[]> rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        int n = rows.size();
        double[] v = new double[n];
        double[] s = new double[n];
        boolean allHaveSigma = n > 0;
        for (double[] row : rows) {
            if (row.length < 3) { allHaveSigma = false; break; }
        }
        double[] sigma = allHaveSigma ? new double[n] : null;
        for (int i = 0; i < n; i++) {
            double[] row = rows.get(i);
            v[i] = row[0];
            s[i] = row[1];
            if (sigma != null) sigma[i] = row[2];
        }
        return new RawSpectrum(v, s, sigma);
    }

    public int size() { return velocities.length; }

    public double[] getVelocities() { return velocities.clone(); }

    public double[] getSignal() { return signal.clone(); }

    /** @return A copy of the uncertainties, or null when none were supplied. */
    public double[] getUncertainties() { return uncertainties == null ? null : uncertainties.clone(); }

    public boolean hasUncertainties() { return uncertainties != null; }
}
