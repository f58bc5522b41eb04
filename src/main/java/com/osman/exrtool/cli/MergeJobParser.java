package com.osman.exrtool.cli;

import com.osman.exrtool.cli.MergeJob.SequenceArgs;
import com.osman.exrtool.core.channel.ChannelCategory;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns command-line arguments or a JSON job file into a {@link MergeJob}.
 * Malformed input is reported with {@link IllegalArgumentException}.
 */
final class MergeJobParser {

    private MergeJobParser() {
    }

    static MergeJob parseArgs(String[] args, int defaultThreads) throws IOException {
        if (args == null || args.length == 0) {
            throw new IllegalArgumentException("No arguments given");
        }

        String output = null;
        int threads = defaultThreads;
        List<SequenceBuilder> sequences = new ArrayList<>();
        SequenceBuilder current = null;
        boolean collectingFiles = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--batch" -> {
                    if (args.length != 2) {
                        throw new IllegalArgumentException("--batch cannot be combined with other options");
                    }
                    return parseJobFile(Path.of(requireValue(args, ++i, arg)), defaultThreads);
                }
                case "-o", "--output" -> {
                    output = requireValue(args, ++i, arg);
                    collectingFiles = false;
                }
                case "-t", "--threads" -> {
                    threads = parseThreads(requireValue(args, ++i, arg));
                    collectingFiles = false;
                }
                case "--seq" -> {
                    current = new SequenceBuilder();
                    sequences.add(current);
                    collectingFiles = true;
                }
                case "--channels" -> {
                    requireSequence(current, arg).channels.addAll(splitList(requireValue(args, ++i, arg)));
                    collectingFiles = false;
                }
                case "--categories" -> {
                    SequenceBuilder target = requireSequence(current, arg);
                    for (String key : splitList(requireValue(args, ++i, arg))) {
                        target.categories.add(parseCategory(key));
                    }
                    collectingFiles = false;
                }
                default -> {
                    if (arg.startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option " + arg);
                    }
                    if (!collectingFiles) {
                        throw new IllegalArgumentException("Unexpected argument " + arg + " (files must follow --seq)");
                    }
                    current.files.add(Path.of(arg));
                }
            }
        }
        return build(output, threads, sequences);
    }

    static MergeJob parseJobFile(Path jobFile, int defaultThreads) throws IOException {
        try {
            JSONObject root = new JSONObject(Files.readString(jobFile));
            String output = root.optString("output", null);
            int threads = root.has("threads") ? root.getInt("threads") : defaultThreads;
            if (threads < 0) {
                throw new IllegalArgumentException("threads must not be negative: " + threads);
            }

            JSONArray sequencesArray = root.optJSONArray("sequences");
            List<SequenceBuilder> sequences = new ArrayList<>();
            if (sequencesArray != null) {
                Path base = jobFile.toAbsolutePath().getParent();
                for (int i = 0; i < sequencesArray.length(); i++) {
                    JSONObject sequenceObj = sequencesArray.getJSONObject(i);
                    SequenceBuilder builder = new SequenceBuilder();
                    for (String file : strings(sequenceObj.optJSONArray("files"))) {
                        Path path = Path.of(file);
                        builder.files.add(path.isAbsolute() || base == null ? path : base.resolve(path));
                    }
                    builder.channels.addAll(strings(sequenceObj.optJSONArray("channels")));
                    for (String key : strings(sequenceObj.optJSONArray("categories"))) {
                        builder.categories.add(parseCategory(key));
                    }
                    sequences.add(builder);
                }
            }
            return build(output, threads, sequences);
        } catch (JSONException ex) {
            throw new IOException("Failed to parse job file " + jobFile + ": " + ex.getMessage(), ex);
        }
    }

    private static MergeJob build(String output, int threads, List<SequenceBuilder> sequences) {
        if (output == null || output.isBlank()) {
            throw new IllegalArgumentException("No output template given");
        }
        if (sequences.isEmpty()) {
            throw new IllegalArgumentException("No input sequence given");
        }
        List<SequenceArgs> built = new ArrayList<>(sequences.size());
        for (int i = 0; i < sequences.size(); i++) {
            SequenceBuilder builder = sequences.get(i);
            if (builder.files.isEmpty()) {
                throw new IllegalArgumentException("Sequence " + (i + 1) + " has no files");
            }
            built.add(new SequenceArgs(builder.files, builder.channels, builder.categories));
        }
        return new MergeJob(output, threads, built);
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException(option + " needs a value");
        }
        return args[index];
    }

    private static SequenceBuilder requireSequence(SequenceBuilder current, String option) {
        if (current == null) {
            throw new IllegalArgumentException(option + " must follow --seq");
        }
        return current;
    }

    private static int parseThreads(String raw) {
        try {
            int threads = Integer.parseInt(raw.trim());
            if (threads < 0) {
                throw new IllegalArgumentException("Thread count must not be negative: " + raw);
            }
            return threads;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid thread count: " + raw, ex);
        }
    }

    private static ChannelCategory parseCategory(String key) {
        return ChannelCategory.fromKey(key)
            .orElseThrow(() -> new IllegalArgumentException("Unknown channel category " + key));
    }

    private static List<String> splitList(String csv) {
        List<String> values = new ArrayList<>();
        for (String part : csv.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                values.add(trimmed);
            }
        }
        return values;
    }

    private static List<String> strings(JSONArray array) {
        if (array == null) {
            return List.of();
        }
        List<String> values = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            String value = array.getString(i).trim();
            if (!value.isEmpty()) {
                values.add(value);
            }
        }
        return values;
    }

    private static final class SequenceBuilder {
        private final List<Path> files = new ArrayList<>();
        private final List<String> channels = new ArrayList<>();
        private final List<ChannelCategory> categories = new ArrayList<>();
    }
}
