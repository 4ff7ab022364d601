package com.project.image.comparison.service;

import com.project.image.comparison.DTOs.AlignmentResult;
import com.project.image.comparison.DTOs.ComparisonOptions;
import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.DTOs.SimilarityReport;
import com.project.image.comparison.DTOs.SimilarityScores;
import com.project.image.comparison.exceptions.StorageException;
import com.project.image.comparison.service.align.ImageAligner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.UUID;

/**
 * One comparison end to end: load, preprocess, align, score, visualize, report.
 * Each call is self-contained; the run id is kept in the logging MDC while it runs.
 */
@Service
public class ImageComparisonService {
    private static final Logger log = LoggerFactory.getLogger(ImageComparisonService.class);

    public static final String RUN_ID_KEY = "runId";

    private final StorageService storage;
    private final ImagePreprocessor preprocessor;
    private final ImageAligner aligner;
    private final SimilarityScorer scorer;
    private final DiffVisualizer visualizer;
    private final ReportWriter reportWriter;

    public ImageComparisonService(StorageService storage, ImagePreprocessor preprocessor, ImageAligner aligner,
                                  SimilarityScorer scorer, DiffVisualizer visualizer, ReportWriter reportWriter) {
        this.storage = storage;
        this.preprocessor = preprocessor;
        this.aligner = aligner;
        this.scorer = scorer;
        this.visualizer = visualizer;
        this.reportWriter = reportWriter;
    }

    public SimilarityReport compare(Path image1, Path image2, ComparisonOptions requested) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(RUN_ID_KEY, runId);
        try {
            log.info("Comparing {} with {}", image1, image2);
            Image raw1 = storage.loadImage(image1);
            Image raw2 = storage.loadImage(image2);

            ComparisonOptions options = preprocessor.applyCadPolicy(requested);
            Image img1 = preprocessor.preprocess(raw1, options.preprocessMode());
            Image img2 = preprocessor.preprocess(raw2, options.preprocessMode());

            // the larger extent per axis, so no detail is lost
            int width = Math.max(img1.width(), img2.width());
            int height = Math.max(img1.height(), img2.height());
            img1 = preprocessor.resizeTo(img1, width, height);
            img2 = preprocessor.resizeTo(img2, width, height);

            AlignmentResult aligned = aligner.align(img1, img2, options.align());
            SimilarityScores scores = scorer.score(aligned, options);

            RunArtifacts artifacts = writeArtifacts(image1, image2, options, aligned, scores);

            log.info("SSIM {}%, pixel {}%, combined {}% -> {} (threshold {}%)",
                    format(scores.ssim()), format(scores.pixelSimilarity()), format(scores.combined()),
                    scores.similar() ? "SIMILAR" : "DIFFERENT", scores.threshold());
            if (!artifacts.failed().isEmpty()) {
                log.warn("{} artifact(s) could not be written: {}", artifacts.failed().size(), artifacts.failed());
            }

            return new SimilarityReport(runId, image1, image2, aligned.method(), aligned.confidence(),
                    scores.ssim(), scores.pixelSimilarity(), scores.contourSimilarity(),
                    scores.contourMatches().size(), scores.combined(), scores.similar(), scores.threshold(),
                    artifacts.written(), artifacts.failed());
        } finally {
            MDC.remove(RUN_ID_KEY);
        }
    }

    private RunArtifacts writeArtifacts(Path image1, Path image2, ComparisonOptions options,
                                        AlignmentResult aligned, SimilarityScores scores) {
        Path outputDir = options.outputDir();
        try {
            storage.prepareDirectory(outputDir);
        } catch (StorageException e) {
            log.error("Output directory unavailable, artifacts will fail: {}", e.getMessage());
        }

        String stem1 = stem(image1);
        String stem2 = stem(image2);
        String pairName = stem1 + "_" + stem2;
        RunArtifacts artifacts = new RunArtifacts();

        String aligned1 = alignedName(stem1, stem2, 1);
        String aligned2 = alignedName(stem2, stem1, 2);
        artifacts.write(aligned1, () -> storage.writeImage(outputDir, aligned1, aligned.aligned().toMat()));
        artifacts.write(aligned2, () -> storage.writeImage(outputDir, aligned2, aligned.reference().toMat()));

        Image composite = visualizer.visualize(aligned, scores, options.diffThreshold(), outputDir, pairName, artifacts);

        artifacts.write(pairName + "_result.txt",
                () -> reportWriter.write(outputDir, pairName + "_result.txt", image1, image2, aligned.method(), scores));

        if (options.display()) {
            visualizer.display(composite);
        }
        return artifacts;
    }

    /** Inputs sharing a stem get their position appended so neither aligned image overwrites the other. */
    static String alignedName(String stem, String otherStem, int position) {
        return stem.equals(otherStem) ? stem + "_" + position + "_aligned.png" : stem + "_aligned.png";
    }

    /** File name without directory and extension. */
    static String stem(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String format(double value) {
        return String.format("%.2f", value);
    }
}
