package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.Objects;

/**
 * Canonical absorption spectrum: velocities strictly increasing, absorption positive at resonance,
 * off-resonance level near zero. Immutable; getters return copies.
 */
public final class Spectrum {

    private final double[] velocities;
    private final double[] absorption;
    private final double[] uncertainties;
    private final boolean transmissionInput;
    private final boolean baselineCorrected;
    private final boolean uncertaintiesSupplied;

    public Spectrum(double[] velocities, double[] absorption, double[] uncertainties,
                    boolean transmissionInput, boolean baselineCorrected, boolean uncertaintiesSupplied) {
        Objects.requireNonNull(velocities, "velocities");
        Objects.requireNonNull(absorption, "absorption");
        Objects.requireNonNull(uncertainties, "uncertainties");
        if (velocities.length != absorption.length || velocities.length != uncertainties.length) {
            throw new IllegalArgumentException("Velocity, absorption and uncertainty arrays must have equal length.");
        }
        this.velocities = velocities.clone();
        this.absorption = absorption.clone();
        this.uncertainties = uncertainties.clone();
        this.transmissionInput = transmissionInput;
        this.baselineCorrected = baselineCorrected;
        this.uncertaintiesSupplied = uncertaintiesSupplied;
    }

    public int size() { return velocities.length; }

    public double[] getVelocities() { return velocities.clone(); }

    public double[] getAbsorption() { return absorption.clone(); }

    /** @return Per-point standard deviations; all 1.0 when the input had none. */
    public double[] getUncertainties() { return uncertainties.clone(); }

    public double velocityAt(int i) { return velocities[i]; }

    public double absorptionAt(int i) { return absorption[i]; }

    public double minVelocity() { return velocities[0]; }

    public double maxVelocity() { return velocities[velocities.length - 1]; }

    /** @return True if the input looked like transmission and was converted to absorption. */
    public boolean isTransmissionInput() { return transmissionInput; }

    public boolean isBaselineCorrected() { return baselineCorrected; }

    public boolean isUncertaintiesSupplied() { return uncertaintiesSupplied; }
}
