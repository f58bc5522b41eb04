package com.osman.exrtool.core.merge;

import com.osman.exrtool.core.frame.FrameNumber;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class OutputPathTemplateTest {

    @Test
    void replacesHashRunWithPaddedFrame() {
        assertEquals("out.0007.exr", new OutputPathTemplate("out.####.exr").resolve(FrameNumber.of(7)));
        assertEquals("out.7.exr", new OutputPathTemplate("out.#.exr").resolve(FrameNumber.of(7)));
    }

    @Test
    void frameWiderThanRunIsNotTruncated() {
        assertEquals("out.12345.exr", new OutputPathTemplate("out.##.exr").resolve(FrameNumber.of(12345)));
    }

    @Test
    void onlyRightmostRunIsReplaced() {
        assertEquals("take##/out.042.exr", new OutputPathTemplate("take##/out.###.exr").resolve(FrameNumber.of(42)));
    }

    @Test
    void templateWithoutHashIsUsedVerbatim() {
        OutputPathTemplate template = new OutputPathTemplate("out.exr");
        assertEquals("out.exr", template.resolve(FrameNumber.of(1)));
        assertEquals("out.exr", template.resolve(FrameNumber.of(2)));
    }

    @Test
    void frameWithoutNumberUsesTemplateVerbatim() {
        assertEquals("out.####.exr", new OutputPathTemplate("out.####.exr").resolve(FrameNumber.NONE));
    }

    @Test
    void rejectsBlankTemplate() {
        assertThrows(IllegalArgumentException.class, () -> new OutputPathTemplate("  "));
    }
}
