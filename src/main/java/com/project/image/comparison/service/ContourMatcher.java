package com.project.image.comparison.service;

import com.project.image.comparison.DTOs.Contour;
import com.project.image.comparison.DTOs.ContourComparison;
import com.project.image.comparison.DTOs.ContourMatch;
import com.project.image.comparison.DTOs.Image;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.MatOfPoint2f;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.imgproc.Imgproc;
import org.opencv.imgproc.Moments;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Shape-level comparison: foreground contours of both images are described by
 * area, perimeter and Hu moments and paired greedily.
 */
@Service
public class ContourMatcher {
    private static final Logger log = LoggerFactory.getLogger(ContourMatcher.class);

    /** Contours with an area at or below this many px² are noise. */
    public static final double MIN_CONTOUR_AREA = 100.0;
    private static final double LOG_EPSILON = 1e-10;

    private final ImagePreprocessor preprocessor;

    public ContourMatcher(ImagePreprocessor preprocessor) {
        OpenCVSupport.ensureLoaded();
        this.preprocessor = preprocessor;
    }

    public ContourComparison compare(Image first, Image second, double threshold) {
        List<Contour> contours1 = extract(first);
        List<Contour> contours2 = extract(second);
        log.debug("Contour candidates: {} vs {}", contours1.size(), contours2.size());
        if (contours1.isEmpty() || contours2.isEmpty()) {
            return ContourComparison.empty();
        }

        List<ContourMatch> matches = match(contours1, contours2, threshold);
        if (matches.isEmpty()) {
            return ContourComparison.empty();
        }
        double total = 0;
        for (ContourMatch m : matches) {
            total += m.score();
        }
        return new ContourComparison(total / matches.size() * 100, matches);
    }

    /** External contours of the Otsu-binarized image, speckles removed. */
    public List<Contour> extract(Image image) {
        Mat gray = preprocessor.toGray(image).toMat();
        Mat binary = new Mat();
        Imgproc.threshold(gray, binary, 127, 255, Imgproc.THRESH_BINARY | Imgproc.THRESH_OTSU);

        List<MatOfPoint> found = new ArrayList<>();
        Imgproc.findContours(binary, found, new Mat(), Imgproc.RETR_EXTERNAL, Imgproc.CHAIN_APPROX_SIMPLE);

        List<Contour> kept = new ArrayList<>();
        for (MatOfPoint c : found) {
            double area = Imgproc.contourArea(c);
            if (area > MIN_CONTOUR_AREA) {
                kept.add(describe(c, area));
            }
        }
        return kept;
    }

    /**
     * Greedy assignment: each contour of the first list takes the best-scoring
     * contour of the second list not used yet, if that score clears the threshold.
     */
    public List<ContourMatch> match(List<Contour> first, List<Contour> second, double threshold) {
        boolean[] used = new boolean[second.size()];
        List<ContourMatch> matches = new ArrayList<>();
        for (Contour c1 : first) {
            int bestIdx = -1;
            double best = Double.NEGATIVE_INFINITY;
            for (int j = 0; j < second.size(); j++) {
                if (used[j]) continue;
                double score = matchScore(c1, second.get(j));
                if (score > best) {
                    best = score;
                    bestIdx = j;
                }
            }
            if (bestIdx >= 0 && best > threshold) {
                used[bestIdx] = true;
                matches.add(new ContourMatch(c1, second.get(bestIdx), best));
            }
        }
        return matches;
    }

    /** Mean of the negated Hu distance, the area ratio and the perimeter ratio. */
    public static double matchScore(Contour a, Contour b) {
        double huTerm = -huDistance(a.huMoments(), b.huMoments());
        double areaRatio = Math.min(a.area(), b.area()) / Math.max(a.area(), b.area());
        double perimeterRatio = Math.min(a.perimeter(), b.perimeter()) / Math.max(a.perimeter(), b.perimeter());
        return (huTerm + areaRatio + perimeterRatio) / 3;
    }

    public static double huDistance(double[] first, double[] second) {
        double sum = 0;
        for (int i = 0; i < first.length; i++) {
            sum += Math.abs(Math.log(Math.abs(first[i]) + LOG_EPSILON) - Math.log(Math.abs(second[i]) + LOG_EPSILON));
        }
        return sum;
    }

    public static double[] huMoments(MatOfPoint contour) {
        return huMoments(Imgproc.moments(contour));
    }

    static Contour describe(MatOfPoint contour, double area) {
        Point[] points = contour.toArray();
        double perimeter = Imgproc.arcLength(new MatOfPoint2f(points), true);
        Moments m = Imgproc.moments(contour);
        Point centroid;
        if (m.get_m00() != 0) {
            centroid = new Point(m.get_m10() / m.get_m00(), m.get_m01() / m.get_m00());
        } else {
            Rect box = Imgproc.boundingRect(contour);
            centroid = new Point(box.x + box.width / 2.0, box.y + box.height / 2.0);
        }
        return new Contour(points, area, perimeter, centroid, huMoments(m));
    }

    private static double[] huMoments(Moments m) {
        Mat hu = new Mat();
        Imgproc.HuMoments(m, hu);
        double[] values = new double[7];
        for (int i = 0; i < values.length; i++) {
            values[i] = hu.get(i, 0)[0];
        }
        return values;
    }
}
