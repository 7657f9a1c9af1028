package de.anton.moessbauer.analyser.spectrum_fitter.model;

/**
 * Line structure of a site: one line, or a symmetric pair split by the quadrupole interaction.
 */
public enum SiteKind {
    SINGLET(1),
    DOUBLET(2);

    private final int lineCount;

    SiteKind(int lineCount) {
        this.lineCount = lineCount;
    }

    public int lineCount() {
        return lineCount;
    }
}
