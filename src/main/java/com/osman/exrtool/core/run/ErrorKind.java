package com.osman.exrtool.core.run;

/**
 * Stage of a frame task that failed. Every kind is scoped to one frame group.
 */
public enum ErrorKind {
    VERSION_PARSE("Failed to parse EXR version"),
    HEADER_PARSE("Failed to parse EXR header"),
    IMAGE_LOAD("Failed to load EXR image"),
    NO_CHANNELS("Frame has no channels"),
    IMAGE_SAVE("Failed to save EXR image");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
