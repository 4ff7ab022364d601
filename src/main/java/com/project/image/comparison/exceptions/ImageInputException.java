package com.project.image.comparison.exceptions;

/** An input image is missing or cannot be decoded. Always aborts the run. */
public class ImageInputException extends ComparisonException {
    public ImageInputException(String message) { super(message); }
}
