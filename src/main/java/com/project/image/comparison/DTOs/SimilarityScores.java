package com.project.image.comparison.DTOs;

import java.util.List;

/**
 * Scorer output. {@code contourSimilarity} is null when contour mode is off.
 * {@code diff} is the absolute grayscale difference the visualizations are drawn from.
 */
public record SimilarityScores(
        double ssim,
        double pixelSimilarity,
        Double contourSimilarity,
        List<ContourMatch> contourMatches,
        double combined,
        boolean similar,
        double threshold,
        Image diff
) {
    public SimilarityScores {
        contourMatches = List.copyOf(contourMatches);
    }

    public boolean contourMode() {
        return contourSimilarity != null;
    }
}
