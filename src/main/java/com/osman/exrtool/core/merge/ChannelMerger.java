package com.osman.exrtool.core.merge;

import com.osman.exrtool.core.codec.ExrChannel;
import com.osman.exrtool.core.codec.ExrCodec;
import com.osman.exrtool.core.codec.ExrCodecException;
import com.osman.exrtool.core.codec.ExrHeader;
import com.osman.exrtool.core.codec.ExrImage;
import com.osman.exrtool.core.codec.ExrVersion;
import com.osman.exrtool.core.frame.FrameGroup;
import com.osman.exrtool.core.frame.InputFileSpec;
import com.osman.exrtool.core.run.ErrorCollector;
import com.osman.exrtool.core.run.ErrorKind;
import com.osman.exrtool.core.run.MergeError;
import com.osman.exrtool.core.run.ProgressTracker;
import com.osman.exrtool.logging.AppLogger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds and writes the composite image of one frame group.
 * <p>
 * Files are decoded in group order and their requested channels are merged by name, later files
 * replacing earlier ones. The first decode failure abandons the whole frame; nothing already merged
 * is written. Decoded files are released when the frame is done, whatever happened.
 */
public final class ChannelMerger {

    private static final Logger LOGGER = AppLogger.get();

    private final ExrCodec codec;
    private final OutputPathTemplate outputTemplate;
    private final ProgressTracker progress;
    private final ErrorCollector errors;

    public ChannelMerger(ExrCodec codec,
                         OutputPathTemplate outputTemplate,
                         ProgressTracker progress,
                         ErrorCollector errors) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.outputTemplate = Objects.requireNonNull(outputTemplate, "outputTemplate");
        this.progress = Objects.requireNonNull(progress, "progress");
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    /**
     * Processes the frame group end to end.
     *
     * @return {@code true} when the composite was written.
     */
    public boolean merge(FrameGroup group) {
        List<DecodedFile> decoded = new ArrayList<>(group.files().size());
        try {
            MergedChannelSet merged = new MergedChannelSet();
            for (InputFileSpec file : group.files()) {
                DecodedFile source = decode(group, file);
                if (source == null) {
                    return false;
                }
                decoded.add(source);
                if (!collectChannels(group, source, merged)) {
                    return false;
                }
            }

            if (merged.isEmpty()) {
                errors.record(new MergeError(ErrorKind.NO_CHANNELS, group.frame(), null, null));
                return false;
            }
            return save(group, decoded.get(0).header(), merged);
        } finally {
            releaseAll(decoded);
            progress.advance();
        }
    }

    private DecodedFile decode(FrameGroup group, InputFileSpec file) {
        Path path = file.file();
        ErrorKind stage = ErrorKind.VERSION_PARSE;
        ExrHeader header = null;
        ExrImage image = null;
        try {
            ExrVersion version = codec.readVersion(path);
            stage = ErrorKind.HEADER_PARSE;
            header = codec.readHeader(path, version);
            stage = ErrorKind.IMAGE_LOAD;
            image = codec.loadImage(path, header);
            if (image.planes().size() != header.channels().size()) {
                throw new ExrCodecException("Decoded " + image.planes().size() + " planes for "
                    + header.channels().size() + " channels");
            }
            return new DecodedFile(file, header, image);
        } catch (ExrCodecException | RuntimeException ex) {
            if (header != null) {
                release(header, image);
            }
            errors.record(new MergeError(stage, group.frame(), path, ex.getMessage()));
            LOGGER.log(Level.FINE, "Decode failed for " + path, ex);
            return null;
        } finally {
            progress.advance();
        }
    }

    /**
     * Adds the file's requested channels. A failure here is charged to loading that file.
     */
    private boolean collectChannels(FrameGroup group, DecodedFile source, MergedChannelSet merged) {
        Path path = source.spec().file();
        try {
            List<ExrChannel> channels = source.header().channels();
            List<byte[]> planes = source.image().planes();
            for (int i = 0; i < channels.size(); i++) {
                ExrChannel channel = channels.get(i);
                if (!source.spec().wants(channel.name())) {
                    continue;
                }
                ChannelPlane replaced = merged.put(new ChannelPlane(channel, planes.get(i), path));
                if (replaced != null && replaced.channel().pixelType() != channel.pixelType()) {
                    LOGGER.fine("Channel " + channel.name() + " changes from " + replaced.channel().pixelType()
                        + " to " + channel.pixelType() + " (taken from " + path + ")");
                }
            }
            return true;
        } catch (RuntimeException ex) {
            errors.record(new MergeError(ErrorKind.IMAGE_LOAD, group.frame(), path, ex.getMessage()));
            LOGGER.log(Level.FINE, "Could not merge channels of " + path, ex);
            return false;
        }
    }

    private boolean save(FrameGroup group, ExrHeader template, MergedChannelSet merged) {
        Path output = null;
        try {
            output = outputTemplate.resolvePath(group.frame());
            ExrHeader header = template.withChannels(merged.channels());
            ExrImage image = new ExrImage(header.width(), header.height(), merged.samples());
            codec.save(output, header, image);
            LOGGER.fine("Wrote frame " + group.frame() + " with channels " + merged.names() + " to " + output);
            return true;
        } catch (ExrCodecException | RuntimeException ex) {
            String detail = output == null
                ? "Invalid output path for template " + outputTemplate + ": " + ex.getMessage()
                : ex.getMessage();
            errors.record(new MergeError(ErrorKind.IMAGE_SAVE, group.frame(), output, detail));
            LOGGER.log(Level.FINE, "Save failed for frame " + group.frame(), ex);
            return false;
        }
    }

    private void releaseAll(List<DecodedFile> decoded) {
        for (DecodedFile file : decoded) {
            release(file.header(), file.image());
        }
    }

    private void release(ExrHeader header, ExrImage image) {
        try {
            codec.release(header, image);
        } catch (RuntimeException ex) {
            LOGGER.log(Level.WARNING, "Failed to release decoded image", ex);
        }
    }

    private record DecodedFile(InputFileSpec spec, ExrHeader header, ExrImage image) {
    }
}
