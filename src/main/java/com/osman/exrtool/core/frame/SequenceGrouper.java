package com.osman.exrtool.core.frame;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Buckets input files by the frame number in their names.
 * <p>
 * Groups come back ascending by frame number with the no-frame group, if any, last.
 * Inside a group files keep the order they were submitted in.
 */
public final class SequenceGrouper {

    private SequenceGrouper() {
    }

    public static List<FrameGroup> group(List<InputFileSpec> files) {
        if (files == null || files.isEmpty()) {
            return List.of();
        }

        Map<FrameNumber, List<InputFileSpec>> byFrame = new TreeMap<>();
        for (InputFileSpec file : files) {
            FrameNumber frame = FrameNumberExtractor.extract(file.file());
            byFrame.computeIfAbsent(frame, key -> new ArrayList<>()).add(file);
        }

        List<FrameGroup> groups = new ArrayList<>(byFrame.size());
        byFrame.forEach((frame, members) -> groups.add(new FrameGroup(frame, members)));
        return List.copyOf(groups);
    }
}
