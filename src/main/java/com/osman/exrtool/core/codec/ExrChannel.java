package com.osman.exrtool.core.codec;

import java.util.Objects;

/**
 * One entry of an EXR channel list.
 *
 * @param name              channel name, e.g. {@code R} or {@code N.X}.
 * @param pixelType         sample format.
 * @param perceptuallyLinear hint stored in the file, carried through untouched.
 */
public record ExrChannel(String name, PixelType pixelType, boolean perceptuallyLinear) {

    public ExrChannel {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pixelType, "pixelType");
    }

    public ExrChannel(String name, PixelType pixelType) {
        this(name, pixelType, false);
    }
}
