package com.project.image.comparison.service.align;

import com.project.image.comparison.DTOs.Image;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.Arrays;

/**
 * A 2x3 affine or 3x3 homography matrix mapping image 1 into image 2's frame.
 * Coefficients are copied on construction; {@link #apply} always returns a new image.
 */
public final class Transform {

    private enum Kind { AFFINE, HOMOGRAPHY }

    private final Kind kind;
    private final double[] coefficients;
    private final boolean inverseMap;

    private Transform(Kind kind, Mat matrix, boolean inverseMap) {
        int rows = kind == Kind.AFFINE ? 2 : 3;
        if (matrix.rows() != rows || matrix.cols() != 3) {
            throw new IllegalArgumentException(kind + " transform needs a " + rows + "x3 matrix, got "
                    + matrix.rows() + "x" + matrix.cols());
        }
        Mat asDouble = new Mat();
        matrix.convertTo(asDouble, CvType.CV_64F);
        double[] values = new double[rows * 3];
        asDouble.get(0, 0, values);
        this.kind = kind;
        this.coefficients = values;
        this.inverseMap = inverseMap;
    }

    public static Transform homography(Mat h) {
        return new Transform(Kind.HOMOGRAPHY, h, false);
    }

    public static Transform affine(Mat m) {
        return new Transform(Kind.AFFINE, m, false);
    }

    /** Affine matrix that maps destination coordinates back to the source, as ECC produces it. */
    public static Transform inverseAffine(Mat m) {
        return new Transform(Kind.AFFINE, m, true);
    }

    public static Transform translation(double dx, double dy) {
        Mat m = Mat.eye(2, 3, CvType.CV_64F);
        m.put(0, 2, dx);
        m.put(1, 2, dy);
        return affine(m);
    }

    /** Warps {@code source} into a {@code width x height} canvas, black outside the source. */
    public Image apply(Image source, int width, int height) {
        Mat matrix = new Mat(kind == Kind.AFFINE ? 2 : 3, 3, CvType.CV_64F);
        matrix.put(0, 0, coefficients);
        int flags = Imgproc.INTER_LINEAR | (inverseMap ? Imgproc.WARP_INVERSE_MAP : 0);
        Mat warped = new Mat();
        Size size = new Size(width, height);
        if (kind == Kind.AFFINE) {
            Imgproc.warpAffine(source.toMat(), warped, matrix, size, flags, Core.BORDER_CONSTANT);
        } else {
            Imgproc.warpPerspective(source.toMat(), warped, matrix, size, flags, Core.BORDER_CONSTANT);
        }
        return Image.of(warped);
    }

    @Override
    public String toString() {
        return kind + (inverseMap ? "(inverse)" : "") + Arrays.toString(coefficients);
    }
}
