package com.project.image.comparison.config;

import com.project.image.comparison.DTOs.AlignStrategy;
import com.project.image.comparison.DTOs.ComparisonOptions;
import com.project.image.comparison.DTOs.PreprocessMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;

/**
 * Configured defaults for a comparison run; CLI options and form fields
 * override them per run.
 */
@Component
public class ComparisonDefaults {
    private final ComparisonOptions options;

    public ComparisonDefaults(@Value("${app.output.dir:output}") String outputDir,
                              @Value("${app.compare.threshold:90.0}") double threshold,
                              @Value("${app.compare.align:auto}") String align,
                              @Value("${app.compare.diff-threshold:30}") int diffThreshold,
                              @Value("${app.compare.contour-threshold:0.8}") double contourThreshold,
                              // false keeps the verdict on the 0.7 SSIM / 0.3 pixel formula even in contour mode
                              @Value("${app.compare.contour-weighted-score:false}") boolean contourWeightedScore) {
        this.options = new ComparisonOptions(Paths.get(outputDir), threshold, AlignStrategy.fromName(align),
                diffThreshold, PreprocessMode.STANDARD, false, contourThreshold, contourWeightedScore, false);
    }

    public ComparisonOptions options() {
        return options;
    }
}
