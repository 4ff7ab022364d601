package com.project.image.comparison.service.align;

import com.project.image.comparison.DTOs.AlignmentMethod;
import com.project.image.comparison.service.ImagePreprocessor;
import com.project.image.comparison.service.SsimCalculator;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.TermCriteria;
import org.opencv.video.Video;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Enhanced correlation coefficient maximisation over an affine warp, starting
 * from identity. Works on texture-poor images where keypoints are scarce.
 */
@Component
public class EccAffineAlignment extends WarpingAlignmentStrategy {

    private static final int MAX_ITERATIONS = 2000;
    private static final double EPSILON = 1e-8;
    private static final int GAUSS_FILTER_SIZE = 5;

    public EccAffineAlignment(ImagePreprocessor preprocessor, SsimCalculator ssim) {
        super(preprocessor, ssim);
    }

    @Override
    public AlignmentMethod method() {
        return AlignmentMethod.ECC_AFFINE;
    }

    @Override
    protected Optional<Transform> estimate(Mat gray1, Mat gray2) {
        Mat warp = Mat.eye(2, 3, CvType.CV_32F);
        TermCriteria criteria = new TermCriteria(TermCriteria.EPS + TermCriteria.COUNT, MAX_ITERATIONS, EPSILON);
        double correlation = Video.findTransformECC(gray2, gray1, warp, Video.MOTION_AFFINE, criteria,
                new Mat(), GAUSS_FILTER_SIZE);
        log.debug("ECC correlation {}", correlation);
        // warp maps image 2 coordinates into image 1
        return Optional.of(Transform.inverseAffine(warp));
    }
}
