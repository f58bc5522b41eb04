package com.osman.exrtool.core.codec;

import java.nio.file.Path;

/**
 * Synchronous EXR file access used by the merge engine. Every call blocks on file I/O.
 * Implementations must be safe to use from several worker threads at once.
 */
public interface ExrCodec {

    ExrVersion readVersion(Path file) throws ExrCodecException;

    ExrHeader readHeader(Path file, ExrVersion version) throws ExrCodecException;

    ExrImage loadImage(Path file, ExrHeader header) throws ExrCodecException;

    void save(Path file, ExrHeader header, ExrImage image) throws ExrCodecException;

    /**
     * Gives back whatever the codec holds for a decoded file. Called once per decoded header,
     * with the image when one was loaded, after the frame it belongs to is done.
     */
    default void release(ExrHeader header, ExrImage image) {
    }
}
