package com.osman.exrtool.core.codec;

import java.util.Objects;

/**
 * Header attribute the codec does not interpret; kept as raw bytes and written back on save.
 */
public record ExrAttribute(String name, String type, byte[] value) {

    public ExrAttribute {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        value = value == null ? new byte[0] : value.clone();
    }

    @Override
    public byte[] value() {
        return value.clone();
    }
}
