package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Numeric curves of one fit: observed absorption, fitted curve and residuals on the measured
 * velocities, plus an oversampled fit and per-site components for display. Getters return copies.
 */
public final class Curves {

    private final double[] velocities;
    private final double[] observed;
    private final double[] fitted;
    private final double[] residuals;
    private final double[] smoothVelocities;
    private final double[] smoothFit;
    private final List<double[]> siteComponents; // at smoothVelocities, in FitResult site order

    public Curves(double[] velocities, double[] observed, double[] fitted,
                  double[] smoothVelocities, double[] smoothFit, List<double[]> siteComponents) {
        Objects.requireNonNull(velocities, "velocities");
        Objects.requireNonNull(observed, "observed");
        Objects.requireNonNull(fitted, "fitted");
        if (observed.length != velocities.length || fitted.length != velocities.length) {
            throw new IllegalArgumentException("Observed and fitted curves must match the velocity axis.");
        }
        if (smoothFit.length != smoothVelocities.length) {
            throw new IllegalArgumentException("Smooth fit must match its velocity axis.");
        }
        this.velocities = velocities.clone();
        this.observed = observed.clone();
        this.fitted = fitted.clone();
        this.residuals = new double[velocities.length];
        for (int i = 0; i < velocities.length; i++) {
            residuals[i] = observed[i] - fitted[i];
        }
        this.smoothVelocities = smoothVelocities.clone();
        this.smoothFit = smoothFit.clone();
        List<double[]> copies = new ArrayList<>();
        for (double[] c : siteComponents) {
            if (c.length != smoothVelocities.length) {
                throw new IllegalArgumentException("Site components must match the smooth velocity axis.");
            }
            copies.add(c.clone());
        }
        this.siteComponents = Collections.unmodifiableList(copies);
    }

    public double[] getVelocities() { return velocities.clone(); }

    public double[] getObserved() { return observed.clone(); }

    public double[] getFitted() { return fitted.clone(); }

    /** @return observed - fitted, point by point. */
    public double[] getResiduals() { return residuals.clone(); }

    public double[] getSmoothVelocities() { return smoothVelocities.clone(); }

    public double[] getSmoothFit() { return smoothFit.clone(); }

    public int getSiteComponentCount() { return siteComponents.size(); }

    public double[] getSiteComponent(int i) { return siteComponents.get(i).clone(); }
}
