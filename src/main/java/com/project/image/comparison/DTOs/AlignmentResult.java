package com.project.image.comparison.DTOs;

import java.util.Objects;

/**
 * Image 1 registered onto image 2's frame.
 *
 * @param aligned    warped image 1
 * @param reference  image 2, transformed only by the centroid method
 * @param method     method that produced the pair
 * @param confidence SSIM of the pair on a 0-1 scale
 */
public record AlignmentResult(
        Image aligned,
        Image reference,
        AlignmentMethod method,
        double confidence
) {
    public AlignmentResult {
        Objects.requireNonNull(aligned, "aligned");
        Objects.requireNonNull(reference, "reference");
        Objects.requireNonNull(method, "method");
    }
}
