package com.osman.exrtool.core.channel;

import com.osman.exrtool.core.codec.ExrChannel;
import com.osman.exrtool.core.codec.ExrCodec;
import com.osman.exrtool.core.codec.ExrCodecException;
import com.osman.exrtool.core.codec.ExrHeader;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the channel names of a file without loading its pixels.
 */
public final class ChannelInspector {

    private final ExrCodec codec;

    public ChannelInspector(ExrCodec codec) {
        this.codec = codec;
    }

    public List<String> channelNames(Path file) throws ExrCodecException {
        ExrHeader header = codec.readHeader(file, codec.readVersion(file));
        try {
            List<String> names = new ArrayList<>(header.channels().size());
            for (ExrChannel channel : header.channels()) {
                names.add(channel.name());
            }
            return names;
        } finally {
            codec.release(header, null);
        }
    }
}
