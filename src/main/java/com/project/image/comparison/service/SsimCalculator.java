package com.project.image.comparison.service;

import com.project.image.comparison.DTOs.Image;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

/**
 * Single-scale Structural Similarity Index (SSIM) over 8-bit grayscale data:
 * 7x7 uniform window, sample covariance, mean taken over the pixels whose
 * window lies fully inside the image.
 */
@Component
public class SsimCalculator {

    private static final double K1 = 0.01;
    private static final double K2 = 0.03;
    private static final double DATA_RANGE = 255;
    private static final double C1 = Math.pow(K1 * DATA_RANGE, 2);
    private static final double C2 = Math.pow(K2 * DATA_RANGE, 2);
    private static final int WINDOW_SIZE = 7;

    private final ImagePreprocessor preprocessor;

    public SsimCalculator(ImagePreprocessor preprocessor) {
        this.preprocessor = preprocessor;
    }

    /**
     * @return SSIM in [-1, 1], 1 for identical images
     */
    public double compute(Image first, Image second) {
        if (!first.sameSizeAs(second)) {
            throw new IllegalArgumentException("SSIM needs equally sized images, got " + first + " and " + second);
        }
        Mat x = asDouble(first);
        Mat y = asDouble(second);

        int win = windowSize(first);
        Size window = new Size(win, win);
        int np = win * win;
        double covNorm = np > 1 ? (double) np / (np - 1) : 1.0;

        Mat ux = blur(x, window);
        Mat uy = blur(y, window);
        Mat uxx = blur(product(x, x, 1), window);
        Mat uyy = blur(product(y, y, 1), window);
        Mat uxy = blur(product(x, y, 1), window);

        Mat vx = covariance(uxx, ux, ux, covNorm);
        Mat vy = covariance(uyy, uy, uy, covNorm);
        Mat vxy = covariance(uxy, ux, uy, covNorm);

        Mat a1 = plus(product(ux, uy, 2), C1);
        Mat a2 = new Mat();
        vxy.convertTo(a2, CvType.CV_64F, 2, C2);
        Mat b1 = new Mat();
        Core.add(product(ux, ux, 1), product(uy, uy, 1), b1);
        b1 = plus(b1, C1);
        Mat b2 = new Mat();
        Core.add(vx, vy, b2);
        b2 = plus(b2, C2);

        Mat s = new Mat();
        Core.divide(product(a1, a2, 1), product(b1, b2, 1), s);

        int pad = (win - 1) / 2;
        Mat interior = s.submat(pad, s.rows() - pad, pad, s.cols() - pad);
        return Core.mean(interior).val[0];
    }

    private Mat asDouble(Image image) {
        Mat out = new Mat();
        preprocessor.toGray(image).toMat().convertTo(out, CvType.CV_64F);
        return out;
    }

    private static int windowSize(Image image) {
        int smallest = Math.min(image.width(), image.height());
        if (smallest >= WINDOW_SIZE) {
            return WINDOW_SIZE;
        }
        return smallest % 2 == 1 ? smallest : smallest - 1;
    }

    private static Mat blur(Mat src, Size window) {
        Mat dst = new Mat();
        Imgproc.blur(src, dst, window);
        return dst;
    }

    private static Mat product(Mat a, Mat b, double scale) {
        Mat dst = new Mat();
        Core.multiply(a, b, dst, scale);
        return dst;
    }

    private static Mat plus(Mat a, double value) {
        Mat dst = new Mat();
        Core.add(a, new Scalar(value), dst);
        return dst;
    }

    private static Mat covariance(Mat meanOfProduct, Mat meanA, Mat meanB, double covNorm) {
        Mat dst = new Mat();
        Core.subtract(meanOfProduct, product(meanA, meanB, 1), dst);
        dst.convertTo(dst, CvType.CV_64F, covNorm);
        return dst;
    }
}
