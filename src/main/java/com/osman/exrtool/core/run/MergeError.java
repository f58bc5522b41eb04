package com.osman.exrtool.core.run;

import com.osman.exrtool.core.frame.FrameNumber;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One recorded failure.
 *
 * @param kind   failing stage.
 * @param frame  frame group the failure belongs to.
 * @param file   input file for decode failures, output file for save failures, {@code null} otherwise.
 * @param detail codec message, may be {@code null}.
 */
public record MergeError(ErrorKind kind, FrameNumber frame, Path file, String detail) {

    public MergeError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(frame, "frame");
    }

    /**
     * Human readable message: what failed, then the file, then the codec detail, one per line.
     */
    public String message() {
        StringBuilder sb = new StringBuilder();
        if (kind == ErrorKind.NO_CHANNELS) {
            sb.append("Frame ").append(frame).append(" has no channels");
        } else {
            sb.append(kind.description()).append(" (frame ").append(frame).append(')');
        }
        if (file != null) {
            sb.append('\n').append(file);
        }
        if (detail != null && !detail.isBlank()) {
            sb.append('\n').append(detail);
        }
        return sb.toString();
    }
}
