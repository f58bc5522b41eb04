package com.osman.exrtool.core.codec;

/**
 * Sample formats an EXR channel can carry, with their on-disk codes and sizes.
 */
public enum PixelType {
    UINT(0, 4),
    HALF(1, 2),
    FLOAT(2, 4);

    private final int code;
    private final int bytesPerSample;

    PixelType(int code, int bytesPerSample) {
        this.code = code;
        this.bytesPerSample = bytesPerSample;
    }

    public int code() {
        return code;
    }

    public int bytesPerSample() {
        return bytesPerSample;
    }

    public static PixelType fromCode(int code) {
        for (PixelType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown pixel type " + code);
    }
}
