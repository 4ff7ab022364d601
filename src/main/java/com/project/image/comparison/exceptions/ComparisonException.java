package com.project.image.comparison.exceptions;

/** Domain-specific exception for comparison errors. */
public class ComparisonException extends RuntimeException {
    public ComparisonException(String message) { super(message); }
    public ComparisonException(String message, Throwable cause) { super(message, cause); }
}
