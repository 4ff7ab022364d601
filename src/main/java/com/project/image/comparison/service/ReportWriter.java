package com.project.image.comparison.service;

import com.project.image.comparison.DTOs.AlignmentMethod;
import com.project.image.comparison.DTOs.SimilarityScores;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Locale;

/** Writes the UTF-8 text report of a comparison. */
@Service
public class ReportWriter {

    private final StorageService storage;

    public ReportWriter(StorageService storage) {
        this.storage = storage;
    }

    public Path write(Path outputDir, String filename, Path image1, Path image2,
                      AlignmentMethod method, SimilarityScores scores) {
        Path report = storage.writeText(outputDir, filename, render(image1, image2, method, scores), false);
        if (scores.contourMode()) {
            storage.writeText(outputDir, filename, renderContourSection(scores), true);
        }
        return report;
    }

    public String render(Path image1, Path image2, AlignmentMethod method, SimilarityScores scores) {
        StringBuilder sb = new StringBuilder();
        sb.append("Image 1: ").append(image1).append('\n');
        sb.append("Image 2: ").append(image2).append('\n');
        sb.append("Alignment: ").append(method).append('\n');
        sb.append(line("Structural similarity (SSIM)", scores.ssim()));
        sb.append(line("Pixel similarity", scores.pixelSimilarity()));
        sb.append(line("Combined similarity", scores.combined()));
        sb.append("Verdict: ").append(scores.similar() ? "SIMILAR" : "DIFFERENT")
                .append(" (threshold: ").append(scores.threshold()).append("%)\n");
        return sb.toString();
    }

    public String renderContourSection(SimilarityScores scores) {
        return "\n" + line("Contour similarity", scores.contourSimilarity())
                + "Matched contours: " + scores.contourMatches().size() + "\n";
    }

    private static String line(String label, double percent) {
        return String.format(Locale.ROOT, "%s: %.2f%%\n", label, percent);
    }
}
