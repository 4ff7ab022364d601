package com.project.image.comparison.DTOs;

/** A contour of image 1 paired with the contour of image 2 it was greedily matched to. */
public record ContourMatch(Contour first, Contour second, double score) {}
