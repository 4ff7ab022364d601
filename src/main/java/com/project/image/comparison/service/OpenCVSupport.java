package com.project.image.comparison.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the bundled OpenCV natives once per JVM. Every service touching
 * {@code org.opencv} calls {@link #ensureLoaded()} from its constructor so the
 * classes also work outside a Spring context.
 */
public final class OpenCVSupport {
    private static final Logger log = LoggerFactory.getLogger(OpenCVSupport.class);

    static {
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
        } catch (Exception e) {
            log.error("Failed to load OpenCV", e);
        }
    }

    private OpenCVSupport() {}

    public static void ensureLoaded() {
        // class initialization does the work
    }
}
