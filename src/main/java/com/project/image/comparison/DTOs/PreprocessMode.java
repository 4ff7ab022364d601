package com.project.image.comparison.DTOs;

public enum PreprocessMode {
    /** Images are used as decoded. */
    STANDARD,
    /** Line art binarized with a global Otsu threshold, lines kept as sharp as the input. */
    CAD,
    /** Line art binarized adaptively, thickened and edge-enhanced. */
    CAD_ENHANCE;

    public boolean isCad() {
        return this != STANDARD;
    }

    public static PreprocessMode of(boolean cad, boolean enhance) {
        if (!cad) return STANDARD;
        return enhance ? CAD_ENHANCE : CAD;
    }
}
