package com.osman.exrtool.core.frame;

import java.util.List;
import java.util.Objects;

/**
 * Files contributing to one output frame, in submission order. Later files win channel name clashes.
 *
 * @param frame frame number shared by the files, possibly {@link FrameNumber#NONE}.
 * @param files contributing files in submission order.
 */
public record FrameGroup(FrameNumber frame, List<InputFileSpec> files) {

    public FrameGroup {
        Objects.requireNonNull(frame, "frame");
        files = List.copyOf(files);
    }
}
