package com.osman.exrtool.core.codec;

import org.lwjgl.PointerBuffer;
import org.lwjgl.system.MemoryStack;
import org.lwjgl.system.MemoryUtil;
import org.lwjgl.util.tinyexr.EXRAttribute;
import org.lwjgl.util.tinyexr.EXRBox2i;
import org.lwjgl.util.tinyexr.EXRChannelInfo;
import org.lwjgl.util.tinyexr.EXRHeader;
import org.lwjgl.util.tinyexr.EXRImage;
import org.lwjgl.util.tinyexr.EXRVersion;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.IntBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.lwjgl.util.tinyexr.TinyEXR.FreeEXRHeader;
import static org.lwjgl.util.tinyexr.TinyEXR.FreeEXRImage;
import static org.lwjgl.util.tinyexr.TinyEXR.InitEXRHeader;
import static org.lwjgl.util.tinyexr.TinyEXR.InitEXRImage;
import static org.lwjgl.util.tinyexr.TinyEXR.LoadEXRImageFromFile;
import static org.lwjgl.util.tinyexr.TinyEXR.ParseEXRHeaderFromFile;
import static org.lwjgl.util.tinyexr.TinyEXR.ParseEXRVersionFromFile;
import static org.lwjgl.util.tinyexr.TinyEXR.SaveEXRImageToFile;
import static org.lwjgl.util.tinyexr.TinyEXR.TINYEXR_MAX_CUSTOM_ATTRIBUTES;
import static org.lwjgl.util.tinyexr.TinyEXR.TINYEXR_SUCCESS;
import static org.lwjgl.util.tinyexr.TinyEXR.nFreeEXRErrorMessage;

/**
 * {@link ExrCodec} backed by tinyexr through the LWJGL bindings. Handles single-part scanline
 * images with NONE, RLE, ZIPS, ZIP or PIZ compression.
 * <p>
 * Samples are never converted: each channel is requested in the format it is stored in, and planes
 * hold the native (little-endian) bytes tinyexr hands back. Native memory never outlives a call, so
 * the returned headers and images are plain Java values, {@link #release} has nothing to free, and
 * one instance can be shared by all worker threads.
 */
public final class TinyExrCodec implements ExrCodec {

    private static final int NAME_CAPACITY = 255;

    @Override
    public ExrVersion readVersion(Path file) throws ExrCodecException {
        try (MemoryStack stack = MemoryStack.stackPush()) {
            EXRVersion version = EXRVersion.calloc(stack);
            int status = ParseEXRVersionFromFile(version, file.toString());
            if (status != TINYEXR_SUCCESS) {
                throw new ExrCodecException("Cannot read version of " + file + ": " + describe(status));
            }
            return new ExrVersion(version.version(), version.tiled(), version.long_name(),
                version.non_image(), version.multipart());
        }
    }

    @Override
    public ExrHeader readHeader(Path file, ExrVersion version) throws ExrCodecException {
        if (version.tiled()) {
            throw new ExrCodecException("Tiled EXR images are not supported");
        }
        if (version.deep()) {
            throw new ExrCodecException("Deep EXR images are not supported");
        }
        if (version.multipart()) {
            throw new ExrCodecException("Multi-part EXR images are not supported");
        }
        try (MemoryStack stack = MemoryStack.stackPush()) {
            EXRHeader parsed = parseHeader(file, toNative(version, stack), stack);
            try {
                return toHeader(parsed);
            } finally {
                FreeEXRHeader(parsed);
            }
        }
    }

    @Override
    public ExrImage loadImage(Path file, ExrHeader header) throws ExrCodecException {
        try (MemoryStack stack = MemoryStack.stackPush()) {
            EXRVersion version = EXRVersion.calloc(stack);
            int status = ParseEXRVersionFromFile(version, file.toString());
            if (status != TINYEXR_SUCCESS) {
                throw new ExrCodecException("Cannot read version of " + file + ": " + describe(status));
            }
            EXRHeader parsed = parseHeader(file, version, stack);
            try {
                requireSameChannels(file, header, parsed);
                IntBuffer requested = parsed.requested_pixel_types();
                for (int c = 0; c < header.channels().size(); c++) {
                    requested.put(c, header.channels().get(c).pixelType().code());
                }

                EXRImage image = EXRImage.calloc(stack);
                InitEXRImage(image);
                PointerBuffer err = errorSlot(stack);
                check(LoadEXRImageFromFile(image, parsed, file.toString(), err), err, "Cannot load " + file);
                try {
                    return copyPlanes(file, header, image);
                } finally {
                    FreeEXRImage(image);
                }
            } finally {
                FreeEXRHeader(parsed);
            }
        }
    }

    @Override
    public void save(Path file, ExrHeader header, ExrImage image) throws ExrCodecException {
        validateForSave(header, image);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException ex) {
            throw new ExrCodecException("Cannot create directory for " + file + ": " + ex.getMessage(), ex);
        }

        List<ByteBuffer> allocations = new ArrayList<>();
        try (MemoryStack stack = MemoryStack.stackPush()) {
            EXRHeader target = toNative(header, allocations, stack);

            int channelCount = header.channels().size();
            PointerBuffer planes = stack.mallocPointer(channelCount);
            for (int c = 0; c < channelCount; c++) {
                planes.put(c, copyToNative(image.planes().get(c), allocations));
            }
            EXRImage source = EXRImage.calloc(stack);
            InitEXRImage(source);
            source.images(planes);
            source.num_channels(channelCount);
            source.width(image.width());
            source.height(image.height());

            PointerBuffer err = errorSlot(stack);
            check(SaveEXRImageToFile(source, target, file.toString(), err), err, "Cannot write " + file);
        } finally {
            allocations.forEach(MemoryUtil::memFree);
        }
    }

    private static EXRHeader parseHeader(Path file, EXRVersion version, MemoryStack stack) throws ExrCodecException {
        EXRHeader header = EXRHeader.calloc(stack);
        InitEXRHeader(header);
        PointerBuffer err = errorSlot(stack);
        check(ParseEXRHeaderFromFile(header, version, file.toString(), err), err, "Cannot parse header of " + file);
        return header;
    }

    private static EXRVersion toNative(ExrVersion version, MemoryStack stack) {
        return EXRVersion.calloc(stack).set(version.version(), version.tiled(), version.longNames(),
            version.deep(), version.multipart());
    }

    private static ExrHeader toHeader(EXRHeader parsed) throws ExrCodecException {
        List<ExrChannel> channels = new ArrayList<>();
        EXRChannelInfo.Buffer infos = parsed.channels();
        for (int c = 0; c < parsed.num_channels(); c++) {
            EXRChannelInfo info = infos.get(c);
            String name = info.nameString();
            if (info.x_sampling() != 1 || info.y_sampling() != 1) {
                throw new ExrCodecException("Channel '" + name + "' is subsampled, which is not supported");
            }
            channels.add(new ExrChannel(name, pixelType(info.pixel_type()), info.p_linear() != 0));
        }

        List<ExrAttribute> extras = new ArrayList<>();
        EXRAttribute.Buffer attributes = parsed.custom_attributes();
        if (attributes != null) {
            for (int i = 0; i < parsed.num_custom_attributes(); i++) {
                EXRAttribute attribute = attributes.get(i);
                byte[] raw = new byte[attribute.size()];
                ByteBuffer value = attribute.value();
                if (value != null) {
                    value.get(raw);
                }
                extras.add(new ExrAttribute(attribute.nameString(), attribute.typeString(), raw));
            }
        }

        Box2i dataWindow = toBox(parsed.data_window());
        if (dataWindow.isEmpty()) {
            throw new ExrCodecException("Header has no valid data window");
        }
        return new ExrHeader(channels, compression(parsed.compression_type()), dataWindow,
            toBox(parsed.display_window()), parsed.line_order(), parsed.pixel_aspect_ratio(),
            new float[] {parsed.screen_window_center(0), parsed.screen_window_center(1)},
            parsed.screen_window_width(), extras);
    }

    private static EXRHeader toNative(ExrHeader header, List<ByteBuffer> allocations, MemoryStack stack) {
        List<ExrChannel> channels = header.channels();
        EXRChannelInfo.Buffer infos = EXRChannelInfo.calloc(channels.size(), stack);
        IntBuffer pixelTypes = stack.mallocInt(channels.size());
        IntBuffer requested = stack.mallocInt(channels.size());
        for (int c = 0; c < channels.size(); c++) {
            ExrChannel channel = channels.get(c);
            infos.get(c)
                .name(stack.UTF8(channel.name()))
                .pixel_type(channel.pixelType().code())
                .x_sampling(1)
                .y_sampling(1)
                .p_linear((byte) (channel.perceptuallyLinear() ? 1 : 0));
            pixelTypes.put(c, channel.pixelType().code());
            requested.put(c, channel.pixelType().code());
        }

        EXRHeader target = EXRHeader.calloc(stack);
        InitEXRHeader(target);
        target.channels(infos);
        target.pixel_types(pixelTypes);
        target.requested_pixel_types(requested);
        target.num_channels(channels.size());
        target.compression_type(header.compression().code());
        target.line_order(0);
        target.pixel_aspect_ratio(header.pixelAspectRatio());
        float[] center = header.screenWindowCenter();
        target.screen_window_center(0, center[0]);
        target.screen_window_center(1, center[1]);
        target.screen_window_width(header.screenWindowWidth());
        setBox(target.data_window(), header.dataWindow());
        setBox(target.display_window(), header.displayWindow());

        List<ExrAttribute> extras = header.extraAttributes();
        if (!extras.isEmpty()) {
            EXRAttribute.Buffer attributes = EXRAttribute.calloc(extras.size(), stack);
            for (int i = 0; i < extras.size(); i++) {
                ExrAttribute extra = extras.get(i);
                ByteBuffer value = MemoryUtil.memAlloc(extra.value().length);
                allocations.add(value);
                value.put(extra.value()).flip();
                attributes.get(i).set(stack.UTF8(extra.name()), stack.UTF8(extra.type()), value);
            }
            target.custom_attributes(attributes);
            target.num_custom_attributes(extras.size());
        }
        return target;
    }

    private static ByteBuffer copyToNative(byte[] plane, List<ByteBuffer> allocations) {
        ByteBuffer buffer = MemoryUtil.memAlloc(plane.length);
        allocations.add(buffer);
        buffer.put(plane).flip();
        return buffer;
    }

    private static void requireSameChannels(Path file, ExrHeader header, EXRHeader parsed) throws ExrCodecException {
        if (parsed.num_channels() != header.channels().size()) {
            throw new ExrCodecException(file + " has " + parsed.num_channels() + " channels, header lists "
                + header.channels().size());
        }
        EXRChannelInfo.Buffer infos = parsed.channels();
        for (int c = 0; c < parsed.num_channels(); c++) {
            String name = infos.get(c).nameString();
            if (!name.equals(header.channels().get(c).name())) {
                throw new ExrCodecException(file + " channel " + c + " is '" + name + "', header lists '"
                    + header.channels().get(c).name() + "'");
            }
        }
    }

    private static ExrImage copyPlanes(Path file, ExrHeader header, EXRImage image) throws ExrCodecException {
        if (image.width() != header.width() || image.height() != header.height()) {
            throw new ExrCodecException(file + " decoded as " + image.width() + "x" + image.height()
                + " but its data window is " + header.width() + "x" + header.height());
        }
        PointerBuffer images = image.images();
        if (images == null) {
            throw new ExrCodecException(file + " holds no scanline pixel data");
        }
        long samples = (long) image.width() * image.height();
        List<byte[]> planes = new ArrayList<>(header.channels().size());
        for (int c = 0; c < header.channels().size(); c++) {
            long size = samples * header.channels().get(c).pixelType().bytesPerSample();
            if (size > Integer.MAX_VALUE) {
                throw new ExrCodecException("Channel '" + header.channels().get(c).name() + "' is too large");
            }
            byte[] plane = new byte[(int) size];
            MemoryUtil.memByteBuffer(images.get(c), plane.length).get(plane);
            planes.add(plane);
        }
        return new ExrImage(image.width(), image.height(), planes);
    }

    private static void validateForSave(ExrHeader header, ExrImage image) throws ExrCodecException {
        if (!header.compression().isSupported()) {
            throw new ExrCodecException(header.compression() + " compression is not supported");
        }
        List<ExrChannel> channels = header.channels();
        if (channels.isEmpty()) {
            throw new ExrCodecException("Image has no channels");
        }
        if (channels.size() != image.planes().size()) {
            throw new ExrCodecException("Header lists " + channels.size() + " channels but image has "
                + image.planes().size() + " planes");
        }
        if (image.width() != header.width() || image.height() != header.height()) {
            throw new ExrCodecException("Image is " + image.width() + "x" + image.height()
                + " but data window is " + header.width() + "x" + header.height());
        }
        if (header.extraAttributes().size() > TINYEXR_MAX_CUSTOM_ATTRIBUTES) {
            throw new ExrCodecException("Too many attributes to write: " + header.extraAttributes().size());
        }
        for (ExrAttribute attribute : header.extraAttributes()) {
            requireNameFits("Attribute name", attribute.name());
            requireNameFits("Attribute type", attribute.type());
        }
        String previous = null;
        for (int c = 0; c < channels.size(); c++) {
            ExrChannel channel = channels.get(c);
            requireNameFits("Channel name", channel.name());
            if (previous != null && previous.compareTo(channel.name()) >= 0) {
                throw new ExrCodecException("Channel names must be unique and sorted: '" + previous
                    + "' before '" + channel.name() + "'");
            }
            previous = channel.name();
            long expected = (long) header.width() * header.height() * channel.pixelType().bytesPerSample();
            if (image.planes().get(c).length != expected) {
                throw new ExrCodecException("Channel '" + channel.name() + "' has " + image.planes().get(c).length
                    + " bytes, expected " + expected + " (data windows differ?)");
            }
        }
    }

    private static void requireNameFits(String what, String name) throws ExrCodecException {
        if (name.getBytes(StandardCharsets.UTF_8).length > NAME_CAPACITY) {
            throw new ExrCodecException(what + " longer than " + NAME_CAPACITY + " bytes: " + name);
        }
    }

    private static PixelType pixelType(int code) throws ExrCodecException {
        try {
            return PixelType.fromCode(code);
        } catch (IllegalArgumentException ex) {
            throw new ExrCodecException(ex.getMessage(), ex);
        }
    }

    private static Compression compression(int code) throws ExrCodecException {
        Compression compression;
        try {
            compression = Compression.fromCode(code);
        } catch (IllegalArgumentException ex) {
            throw new ExrCodecException(ex.getMessage(), ex);
        }
        if (!compression.isSupported()) {
            throw new ExrCodecException(compression + " compression is not supported");
        }
        return compression;
    }

    private static Box2i toBox(EXRBox2i box) {
        return new Box2i(box.min_x(), box.min_y(), box.max_x(), box.max_y());
    }

    private static void setBox(EXRBox2i target, Box2i box) {
        target.set(box.xMin(), box.yMin(), box.xMax(), box.yMax());
    }

    private static PointerBuffer errorSlot(MemoryStack stack) {
        PointerBuffer err = stack.mallocPointer(1);
        err.put(0, MemoryUtil.NULL);
        return err;
    }

    private static void check(int status, PointerBuffer err, String context) throws ExrCodecException {
        if (status == TINYEXR_SUCCESS) {
            return;
        }
        String detail = describe(status);
        long message = err.get(0);
        if (message != MemoryUtil.NULL) {
            detail = MemoryUtil.memUTF8(message);
            nFreeEXRErrorMessage(message);
        }
        throw new ExrCodecException(context + ": " + detail);
    }

    static String describe(int status) {
        return switch (status) {
            case -1 -> "not an EXR file (bad magic number)";
            case -2 -> "unsupported EXR version";
            case -3 -> "invalid argument";
            case -4 -> "invalid or corrupt data";
            case -5 -> "invalid file";
            case -6 -> "invalid parameter";
            case -7 -> "cannot open file";
            case -8 -> "unsupported format";
            case -9 -> "invalid header";
            case -10 -> "unsupported feature";
            case -11 -> "cannot write file";
            case -12 -> "serialization failed";
            case -13 -> "layer not found";
            case -14 -> "data too large";
            default -> "error " + status;
        };
    }
}
