package com.project.image.comparison.service;

import com.project.image.comparison.DTOs.AlignmentResult;
import com.project.image.comparison.DTOs.ComparisonOptions;
import com.project.image.comparison.DTOs.ContourComparison;
import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.DTOs.SimilarityScores;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Combines structural (SSIM), pixel and optionally contour similarity of an
 * aligned pair into one 0-100 score and a similar/different verdict.
 */
@Service
public class SimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(SimilarityScorer.class);

    private final ImagePreprocessor preprocessor;
    private final SsimCalculator ssimCalculator;
    private final ContourMatcher contourMatcher;

    public SimilarityScorer(ImagePreprocessor preprocessor, SsimCalculator ssimCalculator, ContourMatcher contourMatcher) {
        OpenCVSupport.ensureLoaded();
        this.preprocessor = preprocessor;
        this.ssimCalculator = ssimCalculator;
        this.contourMatcher = contourMatcher;
    }

    public SimilarityScores score(AlignmentResult pair, ComparisonOptions options) {
        Image gray1 = preprocessor.toGray(pair.aligned());
        Image gray2 = preprocessor.toGray(pair.reference());

        double ssim = ssimCalculator.compute(gray1, gray2) * 100;
        Mat diff = new Mat();
        Core.absdiff(gray1.toMat(), gray2.toMat(), diff);
        double pixel = pixelSimilarity(diff);
        double combined = combine(ssim, pixel);

        Double contourSimilarity = null;
        ContourComparison contours = ContourComparison.empty();
        if (options.contourMode()) {
            contours = contourMatcher.compare(pair.aligned(), pair.reference(), options.contourThreshold());
            contourSimilarity = contours.similarity();
            double weighted = contourWeighted(contourSimilarity, ssim, pixel, options.cad());
            log.info("Contour similarity {}% over {} matches, contour-weighted score {}%",
                    String.format("%.2f", contourSimilarity), contours.matches().size(), String.format("%.2f", weighted));
            if (options.contourWeightedScore()) {
                combined = weighted;
            }
        }

        boolean similar = verdict(combined, options.threshold());
        log.debug("SSIM {}, pixel {}, combined {}", ssim, pixel, combined);
        return new SimilarityScores(ssim, pixel, contourSimilarity, contours.matches(), combined,
                similar, options.threshold(), Image.of(diff));
    }

    /** Share of pixels with any intensity difference at all, inverted and scaled to 0-100. */
    public static double pixelSimilarity(Mat absDiff) {
        long total = absDiff.total();
        if (total == 0) {
            return 100.0;
        }
        return (1 - (double) Core.countNonZero(absDiff) / total) * 100;
    }

    public static double combine(double ssim, double pixel) {
        return 0.7 * ssim + 0.3 * pixel;
    }

    /** Line art leans on shape agreement, photographs on structure. */
    public static double contourWeighted(double contour, double ssim, double pixel, boolean cad) {
        if (cad) {
            return 0.5 * contour + 0.3 * ssim + 0.2 * pixel;
        }
        return 0.2 * contour + 0.5 * ssim + 0.3 * pixel;
    }

    public static boolean verdict(double combined, double threshold) {
        return combined >= threshold;
    }
}
