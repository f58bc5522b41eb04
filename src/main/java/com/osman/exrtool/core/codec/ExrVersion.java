package com.osman.exrtool.core.codec;

/**
 * The version field that follows the EXR magic number.
 */
public record ExrVersion(int version, boolean tiled, boolean longNames, boolean deep, boolean multipart) {
}
