package com.osman.exrtool.cli;

import com.osman.exrtool.core.channel.ChannelCategory;

import java.nio.file.Path;
import java.util.List;

/**
 * Merge job as described on the command line or in a job file, before channel names are resolved.
 *
 * @param output    output path template.
 * @param threads   worker count, {@code 0} for automatic.
 * @param sequences sequences in the order they were given.
 */
record MergeJob(String output, int threads, List<SequenceArgs> sequences) {

    MergeJob {
        sequences = List.copyOf(sequences);
    }

    /**
     * @param files      files of the sequence.
     * @param channels   explicitly named channels.
     * @param categories channel categories to add.
     */
    record SequenceArgs(List<Path> files, List<String> channels, List<ChannelCategory> categories) {

        SequenceArgs {
            files = List.copyOf(files);
            channels = List.copyOf(channels);
            categories = List.copyOf(categories);
        }

        boolean selectsEverything() {
            return channels.isEmpty() && categories.isEmpty();
        }
    }
}
