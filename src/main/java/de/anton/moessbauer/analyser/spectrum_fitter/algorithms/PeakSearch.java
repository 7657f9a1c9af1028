package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import java.util.List;

/**
 * Result of a peak search.
 *
 * @param peaks      Accepted peaks ordered by velocity.
 * @param noiseLevel Robust standard deviation of the high-frequency residual.
 * @param baseLevel  Off-resonance level (median of the smoothed wings).
 * @param threshold  Minimum smoothed absorption a peak had to exceed.
 */
public record PeakSearch(List<Peak> peaks, double noiseLevel, double baseLevel, double threshold) {

    public PeakSearch {
        peaks = List.copyOf(peaks);
    }
}
