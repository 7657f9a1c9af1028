package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import de.anton.moessbauer.analyser.spectrum_fitter.model.SiteKind;

import java.util.List;

/**
 * One or two peaks attributed to a single site: a singlet or a symmetric doublet.
 */
public record PeakGroup(SiteKind kind, List<Peak> peaks) {

    public PeakGroup {
        peaks = List.copyOf(peaks);
        if (peaks.size() != kind.lineCount()) {
            throw new IllegalArgumentException(kind + " needs " + kind.lineCount() + " peaks, got " + peaks.size());
        }
    }

    public static PeakGroup singlet(Peak peak) {
        return new PeakGroup(SiteKind.SINGLET, List.of(peak));
    }

    public static PeakGroup doublet(Peak low, Peak high) {
        return low.velocity() <= high.velocity()
            ? new PeakGroup(SiteKind.DOUBLET, List.of(low, high))
            : new PeakGroup(SiteKind.DOUBLET, List.of(high, low));
    }

    /** @return Midpoint of the lines, the isomer shift seed. */
    public double centroid() {
        return peaks.stream().mapToDouble(Peak::velocity).average().orElse(Double.NaN);
    }

    /** @return Line separation, 0 for a singlet. */
    public double splitting() {
        return kind == SiteKind.SINGLET ? 0.0 : Math.abs(peaks.get(1).velocity() - peaks.get(0).velocity());
    }

    /** @return Mean peak height. */
    public double height() {
        return peaks.stream().mapToDouble(Peak::height).average().orElse(0.0);
    }

    /** @return Sum of peak heights, used to rank groups. */
    public double strength() {
        return peaks.stream().mapToDouble(Peak::height).sum();
    }

    /** @return Mean measured FWHM, NaN if no peak has one. */
    public double width() {
        return peaks.stream().filter(Peak::hasWidth).mapToDouble(Peak::fwhm).average().orElse(Double.NaN);
    }
}
