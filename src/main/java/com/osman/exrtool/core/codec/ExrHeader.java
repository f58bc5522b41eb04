package com.osman.exrtool.core.codec;

import java.util.List;
import java.util.Objects;

/**
 * Header of a single-part scanline EXR file, detached from any native state.
 *
 * @param channels           channel list in file order.
 * @param compression        pixel data compression.
 * @param dataWindow         pixel rectangle stored in the file.
 * @param displayWindow      pixel rectangle meant for display.
 * @param lineOrder          on-disk line order code (0 increasing, 1 decreasing, 2 random).
 * @param pixelAspectRatio   pixel aspect ratio.
 * @param screenWindowCenter two floats, x then y.
 * @param screenWindowWidth  screen window width.
 * @param extraAttributes    attributes the codec carries without interpreting them.
 */
public record ExrHeader(List<ExrChannel> channels,
                        Compression compression,
                        Box2i dataWindow,
                        Box2i displayWindow,
                        int lineOrder,
                        float pixelAspectRatio,
                        float[] screenWindowCenter,
                        float screenWindowWidth,
                        List<ExrAttribute> extraAttributes) {

    public ExrHeader {
        channels = List.copyOf(channels);
        Objects.requireNonNull(compression, "compression");
        Objects.requireNonNull(dataWindow, "dataWindow");
        displayWindow = displayWindow == null ? dataWindow : displayWindow;
        screenWindowCenter = screenWindowCenter == null ? new float[] {0f, 0f} : screenWindowCenter.clone();
        extraAttributes = extraAttributes == null ? List.of() : List.copyOf(extraAttributes);
    }

    /**
     * Minimal header for a fresh image with default display attributes.
     */
    public static ExrHeader create(List<ExrChannel> channels, Compression compression, int width, int height) {
        Box2i window = new Box2i(0, 0, width - 1, height - 1);
        return new ExrHeader(channels, compression, window, window, 0, 1f,
            new float[] {0f, 0f}, 1f, List.of());
    }

    /**
     * Same attributes with a different channel list.
     */
    public ExrHeader withChannels(List<ExrChannel> newChannels) {
        return new ExrHeader(newChannels, compression, dataWindow, displayWindow, lineOrder,
            pixelAspectRatio, screenWindowCenter, screenWindowWidth, extraAttributes);
    }

    @Override
    public float[] screenWindowCenter() {
        return screenWindowCenter.clone();
    }

    public int width() {
        return dataWindow.width();
    }

    public int height() {
        return dataWindow.height();
    }
}
