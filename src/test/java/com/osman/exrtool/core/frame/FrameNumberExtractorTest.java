package com.osman.exrtool.core.frame;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FrameNumberExtractorTest {

    @Test
    void readsTrailingFrameNumber() {
        assertEquals(FrameNumber.of(1023), FrameNumberExtractor.extract("beauty.1023.exr"));
        assertEquals(FrameNumber.of(7), FrameNumberExtractor.extract("shot_0007.exr"));
        assertEquals(FrameNumber.of(0), FrameNumberExtractor.extract("beauty.0000.exr"));
    }

    @Test
    void onlyRightmostDigitRunCounts() {
        assertEquals(FrameNumber.of(22), FrameNumberExtractor.extract("a7b22.exr"));
        assertEquals(FrameNumber.of(5), FrameNumberExtractor.extract("v2_layer3.5.exr"));
    }

    @Test
    void fileWithoutDigitsHasNoFrame() {
        assertSame(FrameNumber.NONE, FrameNumberExtractor.extract("beauty.exr"));
        assertSame(FrameNumber.NONE, FrameNumberExtractor.extract(""));
        assertSame(FrameNumber.NONE, FrameNumberExtractor.extract((String) null));
    }

    @Test
    void directoriesDoNotContributeDigits() {
        assertSame(FrameNumber.NONE, FrameNumberExtractor.extract(Path.of("renders", "v2", "beauty.exr")));
        assertEquals(FrameNumber.of(12), FrameNumberExtractor.extract(Path.of("shot10", "beauty.12.exr")));
    }

    @Test
    void absurdlyLongDigitRunHasNoFrame() {
        assertSame(FrameNumber.NONE, FrameNumberExtractor.extract("frame.12345678901234567890.exr"));
        assertEquals(FrameNumber.of(42), FrameNumberExtractor.extract("frame.0000000000000000000042.exr"));
    }

    @Test
    void noFrameIsDistinctFromEveryNumberAndSortsLast() {
        assertFalse(FrameNumber.NONE.isPresent());
        assertNotEquals(FrameNumber.NONE, FrameNumber.of(0));
        assertNotEquals(FrameNumber.NONE, FrameNumber.of(4294967295L));
        assertTrue(FrameNumber.NONE.compareTo(FrameNumber.of(Long.MAX_VALUE)) > 0);
        assertTrue(FrameNumber.of(1).compareTo(FrameNumber.of(2)) < 0);
        assertThrows(IllegalStateException.class, FrameNumber.NONE::getAsLong);
    }
}
