package de.anton.moessbauer.analyser.spectrum_fitter.service;

import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.DoubletPairer;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.PeakDetector;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.PeakGroup;
import de.anton.moessbauer.analyser.spectrum_fitter.algorithms.PeakSearch;
import de.anton.moessbauer.analyser.spectrum_fitter.model.FitterSettings;
import de.anton.moessbauer.analyser.spectrum_fitter.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Infers the number of iron sites from the peak structure: peaks are detected above a
 * noise-adaptive threshold, paired into symmetric doublets, and every doublet or leftover singlet
 * counts as one site. The count is clamped to [1, maxSites], keeping the strongest groups.
 * Never fails; without any peak it falls back to one doublet.
 */
public class SiteCountEstimator {

    private static final Logger logger = LoggerFactory.getLogger(SiteCountEstimator.class);

    private final FitterSettings settings;
    private final PeakDetector detector;
    private final DoubletPairer pairer;

    public SiteCountEstimator(FitterSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.detector = new PeakDetector(settings.smoothingWindow(), settings.noiseMultiplier(),
            settings.minPeakSeparation(), settings.wingFraction());
        this.pairer = new DoubletPairer(settings.symmetryTolerance(), settings.widthMismatchWeight(),
            settings.separationWeight(), settings.isomerShiftWindowMin(), settings.isomerShiftWindowMax(),
            settings.maxQuadrupoleSplitting());
    }

    public SiteEstimate estimate(Spectrum spectrum) {
        PeakSearch search = detector.detect(spectrum.getVelocities(), spectrum.getAbsorption());
        if (search.peaks().isEmpty()) {
            logger.debug("No peaks above threshold {}; falling back to a single doublet", search.threshold());
            return new SiteEstimate(1, List.of(), search, true);
        }
        double span = spectrum.maxVelocity() - spectrum.minVelocity();
        List<PeakGroup> groups = pairer.pair(search.peaks(), span);
        int count = Math.max(1, Math.min(settings.maxSites(), groups.size()));
        if (groups.size() > count) {
            logger.debug("Found {} peak groups, keeping the {} strongest", groups.size(), count);
        }
        logger.debug("Estimated {} site(s) from {} peaks", count, search.peaks().size());
        return new SiteEstimate(count, groups.subList(0, count), search, false);
    }
}
