package com.osman.exrtool.core.run;

import com.osman.exrtool.core.frame.InputFileSpec;

import java.util.List;
import java.util.Objects;

/**
 * Everything needed to start a merge run.
 *
 * @param files          input files in submission order.
 * @param outputTemplate output path, optionally with a {@code #} run for the frame number.
 * @param threads        worker count, {@code 0} to pick one from the processor count.
 * @param listener       optional progress callback.
 */
public record MergeRequest(List<InputFileSpec> files,
                           String outputTemplate,
                           int threads,
                           ProgressListener listener) {

    public MergeRequest {
        Objects.requireNonNull(files, "files");
        files = List.copyOf(files);
        Objects.requireNonNull(outputTemplate, "outputTemplate");
        if (outputTemplate.isBlank()) {
            throw new IllegalArgumentException("Output template must not be blank");
        }
        if (threads < 0) {
            throw new IllegalArgumentException("Thread count must not be negative: " + threads);
        }
    }

    public MergeRequest(List<InputFileSpec> files, String outputTemplate) {
        this(files, outputTemplate, 0, null);
    }
}
