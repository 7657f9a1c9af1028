package de.anton.moessbauer.analyser.spectrum_fitter.model;

import java.util.Objects;

/**
 * Immutable configuration holding every default, bound, tolerance and heuristic threshold
 * used by the analysis pipeline. One instance is threaded through all stages; nothing reads
 * ambient state. Velocities and widths are in mm/s.
 */
public record FitterSettings(
    int minDataPoints,
    int maxSites,
    // Normalizer
    double wingFraction,
    double percentScaleThreshold,
    BaselineMethod baselineMethod,
    double baselinePercentile,
    // Peak detection and pairing
    int smoothingWindow,
    double noiseMultiplier,
    double minPeakSeparation,
    double symmetryTolerance,
    double widthMismatchWeight,
    double separationWeight,
    double isomerShiftWindowMin,
    double isomerShiftWindowMax,
    double maxQuadrupoleSplitting,
    // Seeds and bounds
    double minLineWidth,
    double maxLineWidth,
    double defaultLineWidth,
    double defaultQuadrupoleSplitting,
    double singletSeedSplitting,
    double defaultGaussianWidth,
    double minGaussianWidth,
    double maxGaussianWidth,
    double defaultMixingFraction,
    VoigtMethod voigtMethod,
    // Optimizer
    int maxIterations,
    int maxEvaluations,
    double costRelativeTolerance,
    double parameterRelativeTolerance,
    double jacobianRelativeStep,
    double singularityThreshold,
    double collapseTolerance,
    boolean multiStart,
    // Output
    int oversampleFactor
) {

    /** Natural linewidth of the 14.4 keV transition of 57Fe. */
    public static final double NATURAL_LINE_WIDTH = 0.097;

    public FitterSettings {
        Objects.requireNonNull(baselineMethod, "baselineMethod cannot be null");
        Objects.requireNonNull(voigtMethod, "voigtMethod cannot be null");
        if (minDataPoints < 3) throw new IllegalArgumentException("minDataPoints must be at least 3.");
        if (maxSites < 1) throw new IllegalArgumentException("maxSites must be positive.");
        if (wingFraction <= 0 || wingFraction >= 0.5) throw new IllegalArgumentException("wingFraction must be in (0, 0.5).");
        if (baselinePercentile <= 50 || baselinePercentile > 100) throw new IllegalArgumentException("baselinePercentile must be in (50, 100].");
        if (smoothingWindow < 5 || smoothingWindow % 2 == 0) throw new IllegalArgumentException("smoothingWindow must be odd and >= 5.");
        if (minLineWidth <= 0 || maxLineWidth <= minLineWidth) throw new IllegalArgumentException("Line width bounds must satisfy 0 < min < max.");
        if (minGaussianWidth <= 0 || maxGaussianWidth <= minGaussianWidth) throw new IllegalArgumentException("Gaussian width bounds must satisfy 0 < min < max.");
        if (defaultMixingFraction < 0 || defaultMixingFraction > 1) throw new IllegalArgumentException("defaultMixingFraction must be in [0, 1].");
        if (maxIterations < 1 || maxEvaluations < 1) throw new IllegalArgumentException("Optimizer budgets must be positive.");
        if (oversampleFactor < 1) throw new IllegalArgumentException("oversampleFactor must be at least 1.");
    }

    /** @return The settings used when the host supplies none. */
    public static FitterSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** @return A builder pre-filled with this instance's values. */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.minDataPoints = minDataPoints; b.maxSites = maxSites;
        b.wingFraction = wingFraction; b.percentScaleThreshold = percentScaleThreshold;
        b.baselineMethod = baselineMethod; b.baselinePercentile = baselinePercentile;
        b.smoothingWindow = smoothingWindow; b.noiseMultiplier = noiseMultiplier;
        b.minPeakSeparation = minPeakSeparation; b.symmetryTolerance = symmetryTolerance;
        b.widthMismatchWeight = widthMismatchWeight; b.separationWeight = separationWeight;
        b.isomerShiftWindowMin = isomerShiftWindowMin; b.isomerShiftWindowMax = isomerShiftWindowMax;
        b.maxQuadrupoleSplitting = maxQuadrupoleSplitting;
        b.minLineWidth = minLineWidth; b.maxLineWidth = maxLineWidth; b.defaultLineWidth = defaultLineWidth;
        b.defaultQuadrupoleSplitting = defaultQuadrupoleSplitting; b.singletSeedSplitting = singletSeedSplitting;
        b.defaultGaussianWidth = defaultGaussianWidth; b.minGaussianWidth = minGaussianWidth; b.maxGaussianWidth = maxGaussianWidth;
        b.defaultMixingFraction = defaultMixingFraction; b.voigtMethod = voigtMethod;
        b.maxIterations = maxIterations; b.maxEvaluations = maxEvaluations;
        b.costRelativeTolerance = costRelativeTolerance; b.parameterRelativeTolerance = parameterRelativeTolerance;
        b.jacobianRelativeStep = jacobianRelativeStep; b.singularityThreshold = singularityThreshold;
        b.collapseTolerance = collapseTolerance; b.multiStart = multiStart; b.oversampleFactor = oversampleFactor;
        return b;
    }

    /**
     * Mutable builder; starts from the documented defaults.
     */
    public static final class Builder {
        private int minDataPoints = 10;
        private int maxSites = 6;
        private double wingFraction = 0.15;
        private double percentScaleThreshold = 10.0;
        private BaselineMethod baselineMethod = BaselineMethod.WING_LINEAR;
        private double baselinePercentile = 95.0;
        private int smoothingWindow = 7;
        private double noiseMultiplier = 4.0;
        private double minPeakSeparation = 0.15;
        private double symmetryTolerance = 0.35;
        private double widthMismatchWeight = 0.5;
        private double separationWeight = 0.05;
        private double isomerShiftWindowMin = -1.0;
        private double isomerShiftWindowMax = 2.0;
        private double maxQuadrupoleSplitting = 4.0;
        private double minLineWidth = NATURAL_LINE_WIDTH;
        private double maxLineWidth = 2.0;
        private double defaultLineWidth = 0.25;
        private double defaultQuadrupoleSplitting = 0.5;
        private double singletSeedSplitting = 0.1;
        private double defaultGaussianWidth = 0.1;
        private double minGaussianWidth = 0.01;
        private double maxGaussianWidth = 2.0;
        private double defaultMixingFraction = 0.5;
        private VoigtMethod voigtMethod = VoigtMethod.FADDEEVA;
        private int maxIterations = 500;
        private int maxEvaluations = 5000;
        private double costRelativeTolerance = 1e-10;
        private double parameterRelativeTolerance = 1e-10;
        private double jacobianRelativeStep = 1e-6;
        private double singularityThreshold = 1e-10;
        private double collapseTolerance = 1e-3;
        private boolean multiStart = false;
        private int oversampleFactor = 5;

        private Builder() { }

        public Builder minDataPoints(int v) { this.minDataPoints = v; return this; }
        public Builder maxSites(int v) { this.maxSites = v; return this; }
        public Builder wingFraction(double v) { this.wingFraction = v; return this; }
        public Builder percentScaleThreshold(double v) { this.percentScaleThreshold = v; return this; }
        public Builder baselineMethod(BaselineMethod v) { this.baselineMethod = v; return this; }
        public Builder baselinePercentile(double v) { this.baselinePercentile = v; return this; }
        public Builder smoothingWindow(int v) { this.smoothingWindow = v; return this; }
        public Builder noiseMultiplier(double v) { this.noiseMultiplier = v; return this; }
        public Builder minPeakSeparation(double v) { this.minPeakSeparation = v; return this; }
        public Builder symmetryTolerance(double v) { this.symmetryTolerance = v; return this; }
        public Builder widthMismatchWeight(double v) { this.widthMismatchWeight = v; return this; }
        public Builder separationWeight(double v) { this.separationWeight = v; return this; }
        public Builder isomerShiftWindow(double min, double max) { this.isomerShiftWindowMin = min; this.isomerShiftWindowMax = max; return this; }
        public Builder maxQuadrupoleSplitting(double v) { this.maxQuadrupoleSplitting = v; return this; }
        public Builder lineWidthBounds(double min, double max) { this.minLineWidth = min; this.maxLineWidth = max; return this; }
        public Builder defaultLineWidth(double v) { this.defaultLineWidth = v; return this; }
        public Builder defaultQuadrupoleSplitting(double v) { this.defaultQuadrupoleSplitting = v; return this; }
        public Builder singletSeedSplitting(double v) { this.singletSeedSplitting = v; return this; }
        public Builder defaultGaussianWidth(double v) { this.defaultGaussianWidth = v; return this; }
        public Builder gaussianWidthBounds(double min, double max) { this.minGaussianWidth = min; this.maxGaussianWidth = max; return this; }
        public Builder defaultMixingFraction(double v) { this.defaultMixingFraction = v; return this; }
        public Builder voigtMethod(VoigtMethod v) { this.voigtMethod = v; return this; }
        public Builder maxIterations(int v) { this.maxIterations = v; return this; }
        public Builder maxEvaluations(int v) { this.maxEvaluations = v; return this; }
        public Builder costRelativeTolerance(double v) { this.costRelativeTolerance = v; return this; }
        public Builder parameterRelativeTolerance(double v) { this.parameterRelativeTolerance = v; return this; }
        public Builder jacobianRelativeStep(double v) { this.jacobianRelativeStep = v; return this; }
        public Builder singularityThreshold(double v) { this.singularityThreshold = v; return this; }
        public Builder collapseTolerance(double v) { this.collapseTolerance = v; return this; }
        public Builder multiStart(boolean v) { this.multiStart = v; return this; }
        public Builder oversampleFactor(int v) { this.oversampleFactor = v; return this; }

        public FitterSettings build() {
            return new FitterSettings(minDataPoints, maxSites,
                wingFraction, percentScaleThreshold, baselineMethod, baselinePercentile,
                smoothingWindow, noiseMultiplier, minPeakSeparation, symmetryTolerance,
                widthMismatchWeight, separationWeight, isomerShiftWindowMin, isomerShiftWindowMax,
                maxQuadrupoleSplitting,
                minLineWidth, maxLineWidth, defaultLineWidth, defaultQuadrupoleSplitting, singletSeedSplitting,
                defaultGaussianWidth, minGaussianWidth, maxGaussianWidth, defaultMixingFraction, voigtMethod,
                maxIterations, maxEvaluations, costRelativeTolerance, parameterRelativeTolerance,
                jacobianRelativeStep, singularityThreshold, collapseTolerance, multiStart,
                oversampleFactor);
        }
    }
}
