package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.PeakGroup;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.PeakSearch;

import java.util.List;

/**
 * Outcome of site count estimation.
 *
 * @param siteCount Number of sites, in [1, maxSites].
 * @param groups    Peak groups backing the count, strongest first; empty on fallback.
 * @param search    The underlying peak search.
 * @param fallback  True if no peaks were found and the single-doublet default was used.
 */
public record SiteEstimate(int siteCount, List<PeakGroup> groups, PeakSearch search, boolean fallback) {

    public SiteEstimate {
        groups = List.copyOf(groups);
    }
}
