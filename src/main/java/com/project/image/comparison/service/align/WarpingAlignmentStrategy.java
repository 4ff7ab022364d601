package com.project.image.comparison.service.align;

import com.project.image.comparison.DTOs.AlignmentResult;
import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.service.ImagePreprocessor;
import com.project.image.comparison.service.OpenCVSupport;
import com.project.image.comparison.service.SsimCalculator;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Base for strategies that estimate a transform from the grayscale pair and
 * warp only the source image. OpenCV errors count as the method failing.
 */
abstract class WarpingAlignmentStrategy implements AlignmentStrategy {
    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final ImagePreprocessor preprocessor;
    private final SsimCalculator ssim;

    protected WarpingAlignmentStrategy(ImagePreprocessor preprocessor, SsimCalculator ssim) {
        OpenCVSupport.ensureLoaded();
        this.preprocessor = preprocessor;
        this.ssim = ssim;
    }

    @Override
    public final Optional<AlignmentResult> attempt(Image source, Image reference) {
        try {
            Mat gray1 = preprocessor.toGray(source).toMat();
            Mat gray2 = preprocessor.toGray(reference).toMat();
            Optional<Transform> transform = estimate(gray1, gray2);
            if (transform.isEmpty()) {
                return Optional.empty();
            }
            log.debug("{} estimated {}", method(), transform.get());
            Image aligned = transform.get().apply(source, reference.width(), reference.height());
            double confidence = ssim.compute(aligned, reference);
            return Optional.of(new AlignmentResult(aligned, reference, method(), confidence));
        } catch (RuntimeException e) {
            log.warn("{} alignment failed: {}", method(), e.getMessage());
            return Optional.empty();
        }
    }

    protected abstract Optional<Transform> estimate(Mat gray1, Mat gray2);
}
