package com.osman.exrtool.core.channel;

import com.osman.exrtool.core.frame.InputFileSpec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Files of one image sequence sharing one channel selection.
 *
 * @param files    sequence files in the order they were added.
 * @param channels channel names requested from every file of the sequence.
 */
public record SequenceSelection(List<Path> files, Set<String> channels) {

    public SequenceSelection {
        Objects.requireNonNull(files, "files");
        if (files.isEmpty()) {
            throw new IllegalArgumentException("A sequence needs at least one file");
        }
        files = List.copyOf(files);
        channels = channels == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(channels));
    }

    public List<InputFileSpec> toFileSpecs() {
        List<InputFileSpec> specs = new ArrayList<>(files.size());
        for (Path file : files) {
            specs.add(new InputFileSpec(file, channels));
        }
        return specs;
    }

    public static List<InputFileSpec> flatten(List<SequenceSelection> sequences) {
        List<InputFileSpec> specs = new ArrayList<>();
        for (SequenceSelection sequence : sequences) {
            specs.addAll(sequence.toFileSpecs());
        }
        return specs;
    }
}
