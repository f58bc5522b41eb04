package com.osman.exrtool.core.codec;

/**
 * EXR compression methods. Only the ones with {@link #isSupported()} can be read or written.
 */
public enum Compression {
    NONE(0, true),
    RLE(1, true),
    ZIPS(2, true),
    ZIP(3, true),
    PIZ(4, true),
    PXR24(5, false),
    B44(6, false),
    B44A(7, false),
    DWAA(8, false),
    DWAB(9, false);

    private final int code;
    private final boolean supported;

    Compression(int code, boolean supported) {
        this.code = code;
        this.supported = supported;
    }

    public int code() {
        return code;
    }

    public boolean isSupported() {
        return supported;
    }

    public static Compression fromCode(int code) {
        for (Compression compression : values()) {
            if (compression.code == code) {
                return compression;
            }
        }
        throw new IllegalArgumentException("Unknown compression " + code);
    }
}
