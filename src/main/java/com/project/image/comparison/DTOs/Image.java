package com.project.image.comparison.DTOs;

import org.opencv.core.Mat;

/**
 * Immutable raster image, either 3-channel BGR or 1-channel intensity.
 * The backing {@link Mat} never leaves this class: callers receive copies
 * and every transformation produces a new {@code Image}.
 */
public final class Image {
    private final Mat pixels;

    private Image(Mat pixels) {
        this.pixels = pixels;
    }

    /** Wraps a copy of {@code mat}; the caller keeps ownership of the argument. */
    public static Image of(Mat mat) {
        if (mat == null || mat.empty()) {
            throw new IllegalArgumentException("Image data is empty");
        }
        int channels = mat.channels();
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        return new Image(mat.clone());
    }

    public int width() { return pixels.cols(); }

    public int height() { return pixels.rows(); }

    public int channels() { return pixels.channels(); }

    public boolean isColor() { return pixels.channels() == 3; }

    public boolean sameSizeAs(Image other) {
        return width() == other.width() && height() == other.height();
    }

    /** Returns a fresh copy of the pixel data. */
    public Mat toMat() {
        return pixels.clone();
    }

    @Override
    public String toString() {
        return "Image[" + width() + "x" + height() + "x" + channels() + "]";
    }
}
