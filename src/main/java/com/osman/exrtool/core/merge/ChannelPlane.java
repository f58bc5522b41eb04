package com.osman.exrtool.core.merge;

import com.osman.exrtool.core.codec.ExrChannel;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A channel picked for the composite. The sample bytes are borrowed from the decoded source image
 * and are never copied.
 *
 * @param channel channel description as found in the source header.
 * @param samples decoded plane owned by the source image.
 * @param source  file the plane was decoded from.
 */
public record ChannelPlane(ExrChannel channel, byte[] samples, Path source) {

    public ChannelPlane {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(samples, "samples");
    }

    public String name() {
        return channel.name();
    }
}
