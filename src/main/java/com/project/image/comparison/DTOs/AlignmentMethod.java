package com.project.image.comparison.DTOs;

/** The concrete method that produced an {@link AlignmentResult}. */
public enum AlignmentMethod {
    FEATURE_HOMOGRAPHY,
    ECC_AFFINE,
    HU_MOMENT_SHAPE,
    CENTROID
}
