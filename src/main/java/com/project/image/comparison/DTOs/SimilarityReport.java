package com.project.image.comparison.DTOs;

import java.nio.file.Path;
import java.util.List;

public record SimilarityReport(
        String runId,
        Path image1,
        Path image2,
        AlignmentMethod alignmentMethod,
        double alignmentConfidence,
        double ssim,
        double pixelSimilarity,
        Double contourSimilarity,
        int contourMatchCount,
        double combined,
        boolean similar,
        double threshold,
        List<Path> artifacts,
        List<String> failedArtifacts
) {
    public SimilarityReport {
        artifacts = List.copyOf(artifacts);
        failedArtifacts = List.copyOf(failedArtifacts);
    }

    public String verdictLabel() {
        return similar ? "SIMILAR" : "DIFFERENT";
    }
}
