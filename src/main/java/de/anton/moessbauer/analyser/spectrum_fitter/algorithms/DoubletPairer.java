package de.anton.moessbauer.analyser.spectrum_fitter.algorithms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pairs peaks into symmetric doublets by greedy lowest-cost assignment.
 *
 * For a candidate pair the cost is
 * heightMismatch + widthMismatchWeight · widthMismatch + separationWeight · separation / span,
 * where mismatches are relative differences. A pair is admissible only if its height mismatch is
 * within the symmetry tolerance, its midpoint lies in the isomer shift window and its separation
 * does not exceed the maximum quadrupole splitting. Pairs are taken cheapest first; equal costs go
 * to the pair with the lower peak indices. Peaks left over become singlets.
 */
public class DoubletPairer {

    private static final Logger logger = LoggerFactory.getLogger(DoubletPairer.class);

    private final double symmetryTolerance;
    private final double widthMismatchWeight;
    private final double separationWeight;
    private final double isomerShiftMin;
    private final double isomerShiftMax;
    private final double maxSplitting;

    public DoubletPairer(double symmetryTolerance, double widthMismatchWeight, double separationWeight,
                         double isomerShiftMin, double isomerShiftMax, double maxSplitting) {
        this.symmetryTolerance = symmetryTolerance;
        this.widthMismatchWeight = widthMismatchWeight;
        this.separationWeight = separationWeight;
        this.isomerShiftMin = isomerShiftMin;
        this.isomerShiftMax = isomerShiftMax;
        this.maxSplitting = maxSplitting;
    }

    private record Candidate(int first, int second, double cost) { }

    /**
     * @param peaks Peaks ordered by velocity.
     * @param span  Width of the velocity axis, used to scale separations.
     * @return Groups ordered by descending strength (ties by ascending centroid).
     */
    public List<PeakGroup> pair(List<Peak> peaks, double span) {
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < peaks.size(); i++) {
            for (int j = i + 1; j < peaks.size(); j++) {
                Peak a = peaks.get(i);
                Peak b = peaks.get(j);
                double heightMismatch = relativeMismatch(a.height(), b.height());
                double separation = Math.abs(b.velocity() - a.velocity());
                double centroid = (a.velocity() + b.velocity()) / 2.0;
                if (heightMismatch > symmetryTolerance || separation > maxSplitting
                        || centroid < isomerShiftMin || centroid > isomerShiftMax) {
                    continue;
                }
                double widthMismatch = a.hasWidth() && b.hasWidth() ? relativeMismatch(a.fwhm(), b.fwhm()) : 0.0;
                double cost = heightMismatch + widthMismatchWeight * widthMismatch
                    + separationWeight * (span > 0 ? separation / span : 0.0);
                candidates.add(new Candidate(i, j, cost));
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::cost)
            .thenComparingInt(Candidate::first)
            .thenComparingInt(Candidate::second));

        boolean[] used = new boolean[peaks.size()];
        List<PeakGroup> groups = new ArrayList<>();
        for (Candidate c : candidates) {
            if (used[c.first()] || used[c.second()]) continue;
            used[c.first()] = true;
            used[c.second()] = true;
            groups.add(PeakGroup.doublet(peaks.get(c.first()), peaks.get(c.second())));
            logger.trace("Paired peaks {} and {} (cost {})", peaks.get(c.first()).velocity(), peaks.get(c.second()).velocity(), c.cost());
        }
        for (int i = 0; i < peaks.size(); i++) {
            if (!used[i]) {
                groups.add(PeakGroup.singlet(peaks.get(i)));
            }
        }
        groups.sort(Comparator.comparingDouble(PeakGroup::strength).reversed()
            .thenComparingDouble(PeakGroup::centroid));
        logger.debug("Pairing produced {} groups from {} peaks", groups.size(), peaks.size());
        return groups;
    }

    private static double relativeMismatch(double a, double b) {
        double max = Math.max(Math.abs(a), Math.abs(b));
        return max > 0 ? Math.abs(a - b) / max : 0.0;
    }
}
