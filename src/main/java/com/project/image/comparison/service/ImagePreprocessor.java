package com.project.image.comparison.service;

import com.project.image.comparison.DTOs.AlignStrategy;
import com.project.image.comparison.DTOs.ComparisonOptions;
import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.DTOs.PreprocessMode;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Brings raw images onto a common grayscale / size / binarization basis.
 */
@Service
public class ImagePreprocessor {
    private static final Logger log = LoggerFactory.getLogger(ImagePreprocessor.class);

    /** Diff threshold ceiling applied when line-art mode is on. */
    public static final int CAD_MAX_DIFF_THRESHOLD = 15;

    private static final int ENHANCE_BLOCK_SIZE = 9;
    private static final double ENHANCE_C = 2;
    private static final double CANNY_LOW = 50;
    private static final double CANNY_HIGH = 150;

    public ImagePreprocessor() {
        OpenCVSupport.ensureLoaded();
    }

    /** Luminance-weighted grayscale; single-channel input is returned as is. */
    public Image toGray(Image image) {
        if (!image.isColor()) {
            return image;
        }
        Mat gray = new Mat();
        Imgproc.cvtColor(image.toMat(), gray, Imgproc.COLOR_BGR2GRAY);
        return Image.of(gray);
    }

    public Image preprocess(Image image, PreprocessMode mode) {
        if (mode == PreprocessMode.STANDARD) {
            return image;
        }
        Mat gray = toGray(image).toMat();
        Mat binary = new Mat();
        if (mode == PreprocessMode.CAD) {
            double otsu = Imgproc.threshold(gray, binary, 0, 255, Imgproc.THRESH_BINARY | Imgproc.THRESH_OTSU);
            log.debug("Line-art Otsu threshold: {}", otsu);
        } else {
            Imgproc.adaptiveThreshold(gray, binary, 255, Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C,
                    Imgproc.THRESH_BINARY, ENHANCE_BLOCK_SIZE, ENHANCE_C);
            Mat dilated = new Mat();
            Imgproc.dilate(binary, dilated, Mat.ones(2, 2, CvType.CV_8U));
            Mat edges = new Mat();
            Imgproc.Canny(dilated, edges, CANNY_LOW, CANNY_HIGH);
            Core.bitwise_or(binary, edges, binary);
        }
        // keep the caller's channel layout
        if (image.isColor()) {
            Mat bgr = new Mat();
            Imgproc.cvtColor(binary, bgr, Imgproc.COLOR_GRAY2BGR);
            return Image.of(bgr);
        }
        return Image.of(binary);
    }

    public Image resizeTo(Image image, int width, int height) {
        if (image.width() == width && image.height() == height) {
            return image;
        }
        Mat resized = new Mat();
        Imgproc.resize(image.toMat(), resized, new Size(width, height));
        log.debug("Resized {} to {}x{}", image, width, height);
        return Image.of(resized);
    }

    /**
     * Line art rarely carries enough texture for feature matching, so CAD mode
     * also tightens the diff threshold and pins alignment to the centroid method.
     */
    public ComparisonOptions applyCadPolicy(ComparisonOptions options) {
        if (!options.cad()) {
            return options;
        }
        ComparisonOptions adjusted = options;
        if (adjusted.diffThreshold() > CAD_MAX_DIFF_THRESHOLD) {
            log.info("Line-art mode: diff threshold lowered from {} to {}",
                    adjusted.diffThreshold(), CAD_MAX_DIFF_THRESHOLD);
            adjusted = adjusted.withDiffThreshold(CAD_MAX_DIFF_THRESHOLD);
        }
        if (adjusted.align() != AlignStrategy.CENTER) {
            log.info("Line-art mode: alignment switched from {} to center", adjusted.align().cliName());
            adjusted = adjusted.withAlign(AlignStrategy.CENTER);
        }
        return adjusted;
    }
}
