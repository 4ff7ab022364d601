package com.project.image.comparison.DTOs;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Per-run settings. Built from the configured defaults and overridden by
 * CLI options or form parameters.
 */
public record ComparisonOptions(
        Path outputDir,
        double threshold,
        AlignStrategy align,
        int diffThreshold,
        PreprocessMode preprocessMode,
        boolean contourMode,
        double contourThreshold,
        boolean contourWeightedScore,
        boolean display
) {
    public ComparisonOptions {
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(align, "align");
        Objects.requireNonNull(preprocessMode, "preprocessMode");
        if (threshold < 0 || threshold > 100) {
            throw new IllegalArgumentException("Similarity threshold must be within 0-100, got " + threshold);
        }
        if (diffThreshold < 0 || diffThreshold > 255) {
            throw new IllegalArgumentException("Diff threshold must be within 0-255, got " + diffThreshold);
        }
        if (contourThreshold < 0 || contourThreshold > 1) {
            throw new IllegalArgumentException("Contour threshold must be within 0-1, got " + contourThreshold);
        }
    }

    public boolean cad() {
        return preprocessMode.isCad();
    }

    public ComparisonOptions withAlign(AlignStrategy value) {
        return new ComparisonOptions(outputDir, threshold, value, diffThreshold, preprocessMode,
                contourMode, contourThreshold, contourWeightedScore, display);
    }

    public ComparisonOptions withDiffThreshold(int value) {
        return new ComparisonOptions(outputDir, threshold, align, value, preprocessMode,
                contourMode, contourThreshold, contourWeightedScore, display);
    }

    public ComparisonOptions withOutputDir(Path value) {
        return new ComparisonOptions(value, threshold, align, diffThreshold, preprocessMode,
                contourMode, contourThreshold, contourWeightedScore, display);
    }
}
