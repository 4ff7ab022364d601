package com.project.image.comparison.service.align;

import com.project.image.comparison.DTOs.AlignmentMethod;
import com.project.image.comparison.service.ImagePreprocessor;
import com.project.image.comparison.service.SsimCalculator;
import org.opencv.calib3d.Calib3d;
import org.opencv.core.Core;
import org.opencv.core.DMatch;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfDMatch;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.features2d.BFMatcher;
import org.opencv.features2d.ORB;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * ORB keypoints, cross-checked Hamming matches and a RANSAC homography.
 * Recovers translation, rotation, scale and perspective on textured images.
 */
@Component
public class FeatureHomographyAlignment extends WarpingAlignmentStrategy {

    private static final int MAX_FEATURES = 2000;
    private static final float SCALE_FACTOR = 1.2f;
    private static final int PYRAMID_LEVELS = 8;
    private static final int MAX_MATCHES = 100;
    private static final int MIN_MATCHES = 4;
    private static final double RANSAC_REPROJECTION_THRESHOLD = 5.0;

    public FeatureHomographyAlignment(ImagePreprocessor preprocessor, SsimCalculator ssim) {
        super(preprocessor, ssim);
    }

    @Override
    public AlignmentMethod method() {
        return AlignmentMethod.FEATURE_HOMOGRAPHY;
    }

    @Override
    protected Optional<Transform> estimate(Mat gray1, Mat gray2) {
        ORB orb = ORB.create(MAX_FEATURES, SCALE_FACTOR, PYRAMID_LEVELS);
        MatOfKeyPoint keypoints1 = new MatOfKeyPoint();
        MatOfKeyPoint keypoints2 = new MatOfKeyPoint();
        Mat descriptors1 = new Mat();
        Mat descriptors2 = new Mat();
        orb.detectAndCompute(gray1, new Mat(), keypoints1, descriptors1);
        orb.detectAndCompute(gray2, new Mat(), keypoints2, descriptors2);

        if (descriptors1.rows() < MIN_MATCHES || descriptors2.rows() < MIN_MATCHES) {
            log.warn("Too few keypoints for feature alignment: {} / {}", descriptors1.rows(), descriptors2.rows());
            return Optional.empty();
        }

        BFMatcher matcher = BFMatcher.create(Core.NORM_HAMMING, true);
        MatOfDMatch matches = new MatOfDMatch();
        matcher.match(descriptors1, descriptors2, matches);

        List<DMatch> best = new ArrayList<>(matches.toList());
        best.sort(Comparator.comparingDouble(m -> m.distance));
        best = best.subList(0, Math.min(MAX_MATCHES, best.size()));
        if (best.size() < MIN_MATCHES) {
            log.warn("Too few matches for a homography: {}", best.size());
            return Optional.empty();
        }

        KeyPoint[] kp1 = keypoints1.toArray();
        KeyPoint[] kp2 = keypoints2.toArray();
        Point[] src = new Point[best.size()];
        Point[] dst = new Point[best.size()];
        for (int i = 0; i < best.size(); i++) {
            DMatch m = best.get(i);
            src[i] = kp1[m.queryIdx].pt;
            dst[i] = kp2[m.trainIdx].pt;
        }

        Mat homography = Calib3d.findHomography(new MatOfPoint2f(src), new MatOfPoint2f(dst),
                Calib3d.RANSAC, RANSAC_REPROJECTION_THRESHOLD);
        if (homography.empty()) {
            log.warn("Homography estimation failed on {} matches", best.size());
            return Optional.empty();
        }
        log.debug("Homography from {} matches", best.size());
        return Optional.of(Transform.homography(homography));
    }
}
