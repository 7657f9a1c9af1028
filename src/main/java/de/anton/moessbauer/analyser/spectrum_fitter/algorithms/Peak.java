package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

/**
 * A detected absorption maximum.
 *
 * @param index    Sample index of the maximum.
 * @param velocity Velocity of the maximum, mm/s.
 * @param height   Smoothed absorption above the off-resonance level.
 * @param fwhm     Full width at half height, NaN if it could not be measured.
 */
public record Peak(int index, double velocity, double height, double fwhm) {

    public boolean hasWidth() {
        return Double.isFinite(fwhm) && fwhm > 0;
    }
}
