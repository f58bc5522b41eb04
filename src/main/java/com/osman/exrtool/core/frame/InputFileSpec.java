package com.osman.exrtool.core.frame;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Objects;
import java.util.Set;

/**
 * One submitted input file and the channel names requested from it.
 *
 * @param file     image file to read.
 * @param channels requested channel names, unique and unordered.
 */
public record InputFileSpec(Path file, Set<String> channels) {

    public InputFileSpec {
        Objects.requireNonNull(file, "file");
        channels = channels == null ? Set.of() : Set.copyOf(channels);
    }

    public static InputFileSpec of(Path file, Collection<String> channels) {
        return new InputFileSpec(file, channels == null ? Set.of() : Set.copyOf(channels));
    }

    public boolean wants(String channelName) {
        return channelName != null && channels.contains(channelName);
    }
}
