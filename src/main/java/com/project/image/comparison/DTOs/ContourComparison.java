package com.project.image.comparison.DTOs;

import java.util.List;

/**
 * Result of shape-level matching.
 *
 * @param similarity mean score of the accepted matches scaled to 0-100, 0 without matches
 */
public record ContourComparison(double similarity, List<ContourMatch> matches) {
    public ContourComparison {
        matches = List.copyOf(matches);
    }

    public static ContourComparison empty() {
        return new ContourComparison(0, List.of());
    }
}
