package com.project.image.comparison.DTOs;

import org.opencv.core.MatOfPoint;
import org.opencv.core.Point;

/**
 * Boundary of one connected foreground region with its shape descriptors.
 * Points and Hu moments are copied in and out, so instances are immutable.
 */
public record Contour(Point[] points, double area, double perimeter, Point centroid, double[] huMoments) {

    public Contour {
        points = copy(points);
        centroid = centroid.clone();
        huMoments = huMoments.clone();
    }

    @Override
    public Point[] points() {
        return copy(points);
    }

    @Override
    public Point centroid() {
        return centroid.clone();
    }

    @Override
    public double[] huMoments() {
        return huMoments.clone();
    }

    public MatOfPoint toMatOfPoint() {
        return new MatOfPoint(points);
    }

    /** Same contour moved by {@code (dx, dy)}, used when drawing on a wider canvas. */
    public MatOfPoint toMatOfPoint(double dx, double dy) {
        Point[] shifted = new Point[points.length];
        for (int i = 0; i < points.length; i++) {
            shifted[i] = new Point(points[i].x + dx, points[i].y + dy);
        }
        return new MatOfPoint(shifted);
    }

    private static Point[] copy(Point[] src) {
        Point[] out = new Point[src.length];
        for (int i = 0; i < src.length; i++) {
            out[i] = src[i].clone();
        }
        return out;
    }
}
