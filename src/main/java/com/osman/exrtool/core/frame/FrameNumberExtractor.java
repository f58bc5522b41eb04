package com.osman.exrtool.core.frame;

import java.nio.file.Path;

/**
 * Pulls the frame number out of an image file name.
 * <p>
 * Only the rightmost run of ASCII digits counts: {@code beauty.1023.exr} is frame 1023,
 * {@code a7b22.exr} is frame 22 and {@code beauty.exr} has no frame.
 */
public final class FrameNumberExtractor {

    // Longest digit run that always fits a long.
    private static final int MAX_DIGITS = 18;

    private FrameNumberExtractor() {
    }

    /**
     * Extracts the frame number from the last path element, ignoring parent directories.
     */
    public static FrameNumber extract(Path file) {
        if (file == null) {
            return FrameNumber.NONE;
        }
        Path name = file.getFileName();
        return extract(name == null ? file.toString() : name.toString());
    }

    public static FrameNumber extract(String fileName) {
        if (fileName == null || fileName.isEmpty()) {
            return FrameNumber.NONE;
        }
        int end = fileName.length();
        while (end > 0 && !isDigit(fileName.charAt(end - 1))) {
            end--;
        }
        int begin = end;
        while (begin > 0 && isDigit(fileName.charAt(begin - 1))) {
            begin--;
        }
        if (begin == end) {
            return FrameNumber.NONE;
        }

        while (begin < end - 1 && fileName.charAt(begin) == '0') {
            begin++;
        }
        if (end - begin > MAX_DIGITS) {
            return FrameNumber.NONE;
        }
        return FrameNumber.of(Long.parseLong(fileName.substring(begin, end)));
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
