package com.osman.exrtool.core.channel;

import com.osman.exrtool.core.codec.ExrCodecException;
import com.osman.exrtool.core.codec.ScriptedExrCodec;
import com.osman.exrtool.core.codec.ScriptedExrCodec.FailAt;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ChannelInspectorTest {

    @Test
    void listsChannelsAndReleasesHeader() throws Exception {
        ScriptedExrCodec codec = new ScriptedExrCodec().addFloatFile(Path.of("a.exr"), (byte) 0, "R", "Z");

        assertEquals(List.of("R", "Z"), new ChannelInspector(codec).channelNames(Path.of("a.exr")));
        assertEquals(0, codec.unreleasedHeaders());
    }

    @Test
    void propagatesDecodeFailure() {
        ScriptedExrCodec codec = new ScriptedExrCodec().addBrokenFile(Path.of("b.exr"), FailAt.HEADER);

        assertThrows(ExrCodecException.class, () -> new ChannelInspector(codec).channelNames(Path.of("b.exr")));
    }
}
