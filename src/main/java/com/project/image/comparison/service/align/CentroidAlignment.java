package com.project.image.comparison.service.align;

import com.project.image.comparison.DTOs.AlignmentMethod;
import com.project.image.comparison.DTOs.AlignmentResult;
import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.service.ImagePreprocessor;
import com.project.image.comparison.service.OpenCVSupport;
import com.project.image.comparison.service.SsimCalculator;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.opencv.imgproc.Moments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Last resort of the chain: moves the intensity centroid of each image to the
 * image centre. Applied to both images and never fails.
 */
@Component
public class CentroidAlignment implements AlignmentStrategy {
    private static final Logger log = LoggerFactory.getLogger(CentroidAlignment.class);

    private static final int BLOCK_SIZE = 11;
    private static final double C = 2;

    private final ImagePreprocessor preprocessor;
    private final SsimCalculator ssim;

    public CentroidAlignment(ImagePreprocessor preprocessor, SsimCalculator ssim) {
        OpenCVSupport.ensureLoaded();
        this.preprocessor = preprocessor;
        this.ssim = ssim;
    }

    @Override
    public AlignmentMethod method() {
        return AlignmentMethod.CENTROID;
    }

    @Override
    public Optional<AlignmentResult> attempt(Image source, Image reference) {
        return Optional.of(align(source, reference));
    }

    public AlignmentResult align(Image source, Image reference) {
        Image centered1 = center(source);
        Image centered2 = center(reference);
        double confidence = ssim.compute(centered1, centered2);
        return new AlignmentResult(centered1, centered2, AlignmentMethod.CENTROID, confidence);
    }

    Image center(Image image) {
        Mat mask = new Mat();
        Imgproc.adaptiveThreshold(preprocessor.toGray(image).toMat(), mask, 255,
                Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C, Imgproc.THRESH_BINARY, BLOCK_SIZE, C);
        Moments m = Imgproc.moments(mask);

        int centerX = image.width() / 2;
        int centerY = image.height() / 2;
        int cx = centerX;
        int cy = centerY;
        if (m.get_m00() != 0) {
            cx = (int) (m.get_m10() / m.get_m00());
            cy = (int) (m.get_m01() / m.get_m00());
        }
        log.debug("Centroid ({}, {}) moved to ({}, {})", cx, cy, centerX, centerY);
        return Transform.translation(centerX - cx, centerY - cy).apply(image, image.width(), image.height());
    }
}
