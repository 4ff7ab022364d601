package com.project.image.comparison.service;

import com.project.image.comparison.DTOs.AlignmentResult;
import com.project.image.comparison.DTOs.ContourMatch;
import com.project.image.comparison.DTOs.Image;
import com.project.image.comparison.DTOs.SimilarityScores;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.highgui.HighGui;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.GraphicsEnvironment;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * Renders the diagnostic images of a comparison: red diff map, heatmap,
 * side-by-side composite and, in contour mode, the matched contour pairs.
 */
@Service
public class DiffVisualizer {
    private static final Logger log = LoggerFactory.getLogger(DiffVisualizer.class);

    private static final Scalar RED = new Scalar(0, 0, 255);
    private static final Scalar TEXT_COLOR = new Scalar(0, 255, 0);
    private static final double FONT_SCALE = 0.8;
    private static final int FONT_THICKNESS = 2;
    private static final int CONTOUR_THICKNESS = 2;

    private final ImagePreprocessor preprocessor;
    private final StorageService storage;
    private final Random random = new Random();

    public DiffVisualizer(ImagePreprocessor preprocessor, StorageService storage) {
        OpenCVSupport.ensureLoaded();
        this.preprocessor = preprocessor;
        this.storage = storage;
    }

    /**
     * Writes diff, heatmap, composite and contour images for {@code pairName}.
     *
     * @return the composite, for on-screen display
     */
    public Image visualize(AlignmentResult pair, SimilarityScores scores, int diffThreshold,
                           Path outputDir, String pairName, RunArtifacts artifacts) {
        Mat red = redDiff(scores.diff(), diffThreshold);
        artifacts.write(pairName + "_diff_red.png",
                () -> storage.writeImage(outputDir, pairName + "_diff_red.png", red));

        Mat heat = heatmap(scores.diff());
        artifacts.write(pairName + "_diff_heatmap.png",
                () -> storage.writeImage(outputDir, pairName + "_diff_heatmap.png", heat));

        Mat composite = composite(pair, red, scores);
        artifacts.write(pairName + "_comparison.png",
                () -> storage.writeImage(outputDir, pairName + "_comparison.png", composite));

        if (scores.contourMode() && !scores.contourMatches().isEmpty()) {
            Mat matches = contourMatches(pair, scores.contourMatches());
            artifacts.write(pairName + "_contour_matches.png",
                    () -> storage.writeImage(outputDir, pairName + "_contour_matches.png", matches));
        }
        return Image.of(composite);
    }

    /** Black canvas with pure red wherever the absolute difference exceeds {@code threshold}. */
    public Mat redDiff(Image diff, int threshold) {
        Mat gray = preprocessor.toGray(diff).toMat();
        Mat mask = new Mat();
        Imgproc.threshold(gray, mask, threshold, 255, Imgproc.THRESH_BINARY);
        Mat canvas = Mat.zeros(gray.size(), CvType.CV_8UC3);
        canvas.setTo(RED, mask);
        return canvas;
    }

    public Mat heatmap(Image diff) {
        Mat colored = new Mat();
        Imgproc.applyColorMap(preprocessor.toGray(diff).toMat(), colored, Imgproc.COLORMAP_JET);
        return colored;
    }

    /** [aligned image 1 | image 2 | red diff] with the score written on top. */
    public Mat composite(AlignmentResult pair, Mat redDiff, SimilarityScores scores) {
        Mat canvas = new Mat();
        Core.hconcat(List.of(grayAsBgr(pair.aligned()), grayAsBgr(pair.reference()), redDiff), canvas);
        String verdict = scores.similar() ? "SIMILAR" : "DIFFERENT";
        Imgproc.putText(canvas, String.format(Locale.ROOT, "Similarity: %.2f%% (%s)", scores.combined(), verdict),
                new Point(10, 30), Imgproc.FONT_HERSHEY_SIMPLEX, FONT_SCALE, TEXT_COLOR, FONT_THICKNESS);
        Imgproc.putText(canvas, String.format(Locale.ROOT, "SSIM: %.2f%%", scores.ssim()),
                new Point(10, 60), Imgproc.FONT_HERSHEY_SIMPLEX, FONT_SCALE, TEXT_COLOR, FONT_THICKNESS);
        return canvas;
    }

    /** Both images side by side, every matched pair in its own colour and joined at the centroids. */
    public Mat contourMatches(AlignmentResult pair, List<ContourMatch> matches) {
        Mat left = asBgr(pair.aligned());
        Mat right = asBgr(pair.reference());
        int offset = left.cols();
        Mat canvas = Mat.zeros(Math.max(left.rows(), right.rows()), left.cols() + right.cols(), CvType.CV_8UC3);
        left.copyTo(canvas.submat(new Rect(0, 0, left.cols(), left.rows())));
        right.copyTo(canvas.submat(new Rect(offset, 0, right.cols(), right.rows())));

        for (ContourMatch match : matches) {
            Scalar color = new Scalar(random.nextInt(255), random.nextInt(255), random.nextInt(255));
            Imgproc.drawContours(canvas, List.of(match.first().toMatOfPoint()), -1, color, CONTOUR_THICKNESS);
            Imgproc.drawContours(canvas, List.of(match.second().toMatOfPoint(offset, 0)), -1, color, CONTOUR_THICKNESS);
            Point c1 = match.first().centroid();
            Point c2 = match.second().centroid();
            Imgproc.line(canvas, new Point((int) c1.x, (int) c1.y), new Point((int) c2.x + offset, (int) c2.y),
                    color, 1, Imgproc.LINE_AA);
        }
        log.debug("Drew {} contour matches", matches.size());
        return canvas;
    }

    /** Shows the composite in a window and blocks until a key is pressed. */
    public void display(Image composite) {
        if (GraphicsEnvironment.isHeadless()) {
            log.warn("Display requested but no graphics environment is available");
            return;
        }
        HighGui.imshow("Comparison Result", composite.toMat());
        HighGui.waitKey(0);
        HighGui.destroyAllWindows();
    }

    private Mat grayAsBgr(Image image) {
        Mat bgr = new Mat();
        Imgproc.cvtColor(preprocessor.toGray(image).toMat(), bgr, Imgproc.COLOR_GRAY2BGR);
        return bgr;
    }

    private static Mat asBgr(Image image) {
        if (image.isColor()) {
            return image.toMat();
        }
        Mat bgr = new Mat();
        Imgproc.cvtColor(image.toMat(), bgr, Imgproc.COLOR_GRAY2BGR);
        return bgr;
    }
}
