package com.osman.exrtool.core.merge;

import com.osman.exrtool.core.codec.ExrChannel;
import com.osman.exrtool.core.codec.ExrCodec;
import com.osman.exrtool.core.codec.ExrCodecException;
import com.osman.exrtool.core.codec.ExrHeader;
import com.osman.exrtool.core.codec.ExrImage;
import com.osman.exrtool.core.codec.ExrVersion;
import com.osman.exrtool.core.codec.PixelType;
import com.osman.exrtool.core.codec.ScriptedExrCodec;
import com.osman.exrtool.core.codec.ScriptedExrCodec.FailAt;
import com.osman.exrtool.core.codec.ScriptedExrCodec.Saved;
import com.osman.exrtool.core.frame.FrameGroup;
import com.osman.exrtool.core.frame.FrameNumber;
import com.osman.exrtool.core.frame.InputFileSpec;
import com.osman.exrtool.core.run.ErrorCollector;
import com.osman.exrtool.core.run.ErrorKind;
import com.osman.exrtool.core.run.MergeError;
import com.osman.exrtool.core.run.ProgressTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChannelMergerTest {

    private static final Path BEAUTY = Path.of("beauty.0001.exr");
    private static final Path AOV = Path.of("aov.0001.exr");
    private static final Path DEPTH = Path.of("depth.0001.exr");
    private static final Path OUT = Path.of("out.0001.exr");

    private ScriptedExrCodec codec;
    private ErrorCollector errors;

    @BeforeEach
    void setUp() {
        codec = new ScriptedExrCodec();
        errors = new ErrorCollector();
    }

    @Test
    void laterFileWinsForSharedChannel() {
        codec.addFloatFile(BEAUTY, (byte) 1, "R", "G", "B");
        codec.addFloatFile(AOV, (byte) 2, "R");
        ProgressTracker progress = new ProgressTracker(2, 1);

        boolean written = merger(progress).merge(group(
            InputFileSpec.of(BEAUTY, List.of("R", "G", "B")),
            InputFileSpec.of(AOV, List.of("R"))));

        assertTrue(written);
        Saved saved = codec.saved().get(OUT);
        assertEquals(List.of("B", "G", "R"), names(saved));
        assertEquals(1, saved.image().planes().get(0)[0]);
        assertEquals(1, saved.image().planes().get(1)[0]);
        assertEquals(2, saved.image().planes().get(2)[0]);
        assertEquals(0, errors.count());
        assertEquals(3, progress.done());
    }

    @Test
    void onlyRequestedChannelsAreCopied() {
        codec.addFloatFile(BEAUTY, (byte) 1, "R", "G", "B", "A");
        codec.addFloatFile(DEPTH, (byte) 3, "Z", "N.X");

        merger(new ProgressTracker(2, 1)).merge(group(
            InputFileSpec.of(BEAUTY, List.of("A")),
            InputFileSpec.of(DEPTH, List.of("Z", "missing"))));

        assertEquals(List.of("A", "Z"), names(codec.saved().get(OUT)));
    }

    @Test
    void laterPixelTypeReplacesEarlierOne() {
        codec.addFile(BEAUTY, Map.of("Z", PixelType.FLOAT), (byte) 1);
        codec.addFile(DEPTH, Map.of("Z", PixelType.HALF), (byte) 2);

        merger(new ProgressTracker(2, 1)).merge(group(
            InputFileSpec.of(BEAUTY, List.of("Z")),
            InputFileSpec.of(DEPTH, List.of("Z"))));

        ExrChannel channel = codec.saved().get(OUT).header().channels().get(0);
        assertEquals(PixelType.HALF, channel.pixelType());
        assertEquals(4, codec.saved().get(OUT).image().planes().get(0).length);
    }

    @Test
    void frameWithoutSelectedChannelsIsReportedAndNotWritten() {
        codec.addFloatFile(BEAUTY, (byte) 1, "R");
        ProgressTracker progress = new ProgressTracker(1, 1);

        boolean written = merger(progress).merge(group(InputFileSpec.of(BEAUTY, Set.of())));

        assertFalse(written);
        assertTrue(codec.saved().isEmpty());
        List<MergeError> recorded = errors.snapshot();
        assertEquals(1, recorded.size());
        assertEquals(ErrorKind.NO_CHANNELS, recorded.get(0).kind());
        assertEquals(FrameNumber.of(1), recorded.get(0).frame());
        assertEquals("Frame 1 has no channels", recorded.get(0).message());
        assertEquals(2, progress.done());
        assertEquals(0, codec.unreleasedHeaders());
    }

    @Test
    void firstDecodeFailureAbandonsFrame() {
        codec.addFloatFile(BEAUTY, (byte) 1, "R");
        codec.addBrokenFile(AOV, FailAt.LOAD);
        codec.addFloatFile(DEPTH, (byte) 3, "Z");
        ProgressTracker progress = new ProgressTracker(3, 1);

        boolean written = merger(progress).merge(group(
            InputFileSpec.of(BEAUTY, List.of("R")),
            InputFileSpec.of(AOV, List.of("R")),
            InputFileSpec.of(DEPTH, List.of("Z"))));

        assertFalse(written);
        assertTrue(codec.saved().isEmpty());
        assertEquals(List.of(BEAUTY, AOV), codec.versionReads());
        MergeError error = errors.snapshot().get(0);
        assertEquals(ErrorKind.IMAGE_LOAD, error.kind());
        assertEquals(AOV, error.file());
        assertEquals("Failed to load EXR image (frame 1)\naov.0001.exr\ntruncated data", error.message());
        assertEquals(1, errors.count());
        assertEquals(0, codec.unreleasedHeaders());
        // two decode attempts plus the frame itself
        assertEquals(3, progress.done());
    }

    @Test
    void failingStageIsReported() {
        codec.addBrokenFile(BEAUTY, FailAt.VERSION);
        codec.addBrokenFile(AOV, FailAt.HEADER);

        merger(new ProgressTracker(1, 1)).merge(group(InputFileSpec.of(BEAUTY, List.of("R"))));
        merger(new ProgressTracker(1, 1)).merge(group(InputFileSpec.of(AOV, List.of("R"))));

        List<MergeError> recorded = errors.snapshot();
        assertEquals(ErrorKind.VERSION_PARSE, recorded.get(0).kind());
        assertEquals(ErrorKind.HEADER_PARSE, recorded.get(1).kind());
    }

    @Test
    void saveFailureIsRecordedWithOutputPath() {
        codec.addFloatFile(BEAUTY, (byte) 1, "R");
        codec.failSavesWith("disk full");
        ProgressTracker progress = new ProgressTracker(1, 1);

        boolean written = merger(progress).merge(group(InputFileSpec.of(BEAUTY, List.of("R"))));

        assertFalse(written);
        MergeError error = errors.snapshot().get(0);
        assertEquals(ErrorKind.IMAGE_SAVE, error.kind());
        assertEquals(OUT, error.file());
        assertEquals("disk full", error.detail());
        assertEquals(0, codec.unreleasedHeaders());
        assertEquals(2, progress.done());
    }

    @Test
    void unresolvableOutputPathIsRecordedAsSaveFailure() {
        codec.addFloatFile(BEAUTY, (byte) 1, "R");
        ProgressTracker progress = new ProgressTracker(1, 1);
        ChannelMerger merger = new ChannelMerger(codec, new OutputPathTemplate("out\u0000.####.exr"),
            progress, errors);

        boolean written = merger.merge(group(InputFileSpec.of(BEAUTY, List.of("R"))));

        assertFalse(written);
        assertTrue(codec.saved().isEmpty());
        List<MergeError> recorded = errors.snapshot();
        assertEquals(1, recorded.size());
        assertEquals(ErrorKind.IMAGE_SAVE, recorded.get(0).kind());
        assertNull(recorded.get(0).file());
        assertTrue(recorded.get(0).detail().startsWith("Invalid output path"));
        assertEquals(0, codec.unreleasedHeaders());
        assertEquals(2, progress.done());
    }

    @Test
    void imageWithMissingPlanesIsRecordedAsLoadFailure() {
        codec.addFloatFile(BEAUTY, (byte) 1, "R", "G");
        ProgressTracker progress = new ProgressTracker(1, 1);
        ChannelMerger merger = new ChannelMerger(new FirstPlaneOnlyCodec(codec),
            new OutputPathTemplate("out.####.exr"), progress, errors);

        boolean written = merger.merge(group(InputFileSpec.of(BEAUTY, List.of("R", "G"))));

        assertFalse(written);
        assertTrue(codec.saved().isEmpty());
        List<MergeError> recorded = errors.snapshot();
        assertEquals(1, recorded.size());
        assertEquals(ErrorKind.IMAGE_LOAD, recorded.get(0).kind());
        assertEquals(BEAUTY, recorded.get(0).file());
        assertEquals(0, codec.unreleasedHeaders());
        assertEquals(2, progress.done());
    }

    private ChannelMerger merger(ProgressTracker progress) {
        return new ChannelMerger(codec, new OutputPathTemplate("out.####.exr"), progress, errors);
    }

    private static FrameGroup group(InputFileSpec... files) {
        return new FrameGroup(FrameNumber.of(1), List.of(files));
    }

    private static List<String> names(Saved saved) {
        return saved.header().channels().stream().map(ExrChannel::name).toList();
    }

    /**
     * Hands back only the first decoded plane, whatever the header lists.
     */
    private record FirstPlaneOnlyCodec(ExrCodec delegate) implements ExrCodec {

        @Override
        public ExrVersion readVersion(Path file) throws ExrCodecException {
            return delegate.readVersion(file);
        }

        @Override
        public ExrHeader readHeader(Path file, ExrVersion version) throws ExrCodecException {
            return delegate.readHeader(file, version);
        }

        @Override
        public ExrImage loadImage(Path file, ExrHeader header) throws ExrCodecException {
            ExrImage image = delegate.loadImage(file, header);
            return new ExrImage(image.width(), image.height(), image.planes().subList(0, 1));
        }

        @Override
        public void save(Path file, ExrHeader header, ExrImage image) throws ExrCodecException {
            delegate.save(file, header, image);
        }

        @Override
        public void release(ExrHeader header, ExrImage image) {
            delegate.release(header, image);
        }
    }
}
