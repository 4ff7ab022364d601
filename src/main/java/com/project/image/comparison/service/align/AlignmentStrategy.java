package com.project.image.comparison.service.align;

import com.project.image.comparison.DTOs.AlignmentMethod;
import com.project.image.comparison.DTOs.AlignmentResult;
import com.project.image.comparison.DTOs.Image;

import java.util.Optional;

/** One step of the alignment fallback chain. */
public interface AlignmentStrategy {

    AlignmentMethod method();

    /**
     * Registers {@code source} onto {@code reference}'s frame.
     *
     * @return empty when the method cannot produce a transform for this pair
     */
    Optional<AlignmentResult> attempt(Image source, Image reference);
}
