package com.osman.exrtool.core.codec;

/**
 * Inclusive integer pixel rectangle, as used for the data and display windows.
 */
public record Box2i(int xMin, int yMin, int xMax, int yMax) {

    public int width() {
        return xMax - xMin + 1;
    }

    public int height() {
        return yMax - yMin + 1;
    }

    public boolean isEmpty() {
        return xMax < xMin || yMax < yMin;
    }
}
