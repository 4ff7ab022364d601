package com.project.image.comparison.service.align;

import com.project.image.comparison.DTOs.AlignmentMethod;
import com.project.image.comparison.service.ContourMatcher;
import com.project.image.comparison.service.ImagePreprocessor;
import com.project.image.comparison.service.SsimCalculator;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.RotatedRect;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Matches the largest outer shape of both images by Hu moments and derives a
 * rotation + uniform scale + translation from their minimum-area rectangles.
 */
@Component
public class HuMomentShapeAlignment extends WarpingAlignmentStrategy {

    private static final double BINARY_THRESHOLD = 127;
    private static final double MAX_HU_DISTANCE = 1.0;

    public HuMomentShapeAlignment(ImagePreprocessor preprocessor, SsimCalculator ssim) {
        super(preprocessor, ssim);
    }

    @Override
    public AlignmentMethod method() {
        return AlignmentMethod.HU_MOMENT_SHAPE;
    }

    @Override
    protected Optional<Transform> estimate(Mat gray1, Mat gray2) {
        Optional<MatOfPoint> shape1 = largestExternalContour(gray1);
        Optional<MatOfPoint> shape2 = largestExternalContour(gray2);
        if (shape1.isEmpty() || shape2.isEmpty()) {
            log.warn("No outer contour to match shapes on");
            return Optional.empty();
        }

        double distance = ContourMatcher.huDistance(
                ContourMatcher.huMoments(shape1.get()), ContourMatcher.huMoments(shape2.get()));
        if (!(distance < MAX_HU_DISTANCE)) {
            log.info("Shapes differ, Hu distance {}", distance);
            return Optional.empty();
        }

        RotatedRect r1 = Imgproc.minAreaRect(new MatOfPoint2f(shape1.get().toArray()));
        RotatedRect r2 = Imgproc.minAreaRect(new MatOfPoint2f(shape2.get().toArray()));
        double scaleX = r1.size.width > 0 ? r2.size.width / r1.size.width : 1.0;
        double scaleY = r1.size.height > 0 ? r2.size.height / r1.size.height : 1.0;
        double scale = (scaleX + scaleY) / 2.0;
        double angle = r2.angle - r1.angle;

        Mat m = Imgproc.getRotationMatrix2D(r1.center, angle, scale);
        m.put(0, 2, m.get(0, 2)[0] + r2.center.x - r1.center.x);
        m.put(1, 2, m.get(1, 2)[0] + r2.center.y - r1.center.y);
        log.debug("Shape transform: angle {}, scale {}, Hu distance {}", angle, scale, distance);
        return Optional.of(Transform.affine(m));
    }

    private static Optional<MatOfPoint> largestExternalContour(Mat gray) {
        Mat binary = new Mat();
        Imgproc.threshold(gray, binary, BINARY_THRESHOLD, 255, Imgproc.THRESH_BINARY);
        List<MatOfPoint> contours = new ArrayList<>();
        Imgproc.findContours(binary, contours, new Mat(), Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);
        MatOfPoint largest = null;
        double largestArea = -1;
        for (MatOfPoint c : contours) {
            double area = Imgproc.contourArea(c);
            if (area > largestArea) {
                largestArea = area;
                largest = c;
            }
        }
        return Optional.ofNullable(largest);
    }
}
