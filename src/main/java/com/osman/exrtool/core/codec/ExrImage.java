package com.osman.exrtool.core.codec;

import java.util.List;

/**
 * Decoded pixel data. Plane {@code i} belongs to channel {@code i} of the header it was loaded with and
 * holds {@code width * height} little-endian samples in scanline order.
 */
public record ExrImage(int width, int height, List<byte[]> planes) {

    public ExrImage {
        planes = List.copyOf(planes);
    }
}
