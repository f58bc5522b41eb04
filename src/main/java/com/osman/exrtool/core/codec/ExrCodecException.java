package com.osman.exrtool.core.codec;

/**
 * Raised by an {@link ExrCodec} when a file cannot be parsed, decoded or written.
 */
public class ExrCodecException extends Exception {

    public ExrCodecException(String message) {
        super(message);
    }

    public ExrCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
