package com.phillippitts.photobatch.domain;

/**
 * Input category, decides which pipeline handles a file.
 */
public enum FileKind {
    STANDARD,
    RAW;

    public String tag() {
        return name().toLowerCase();
    }
}
