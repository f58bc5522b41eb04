package com.osman.exrtool.core.run;

import com.osman.exrtool.core.codec.ExrCodec;
import com.osman.exrtool.core.codec.TinyExrCodec;

import java.util.Objects;

/**
 * Entry point of the merge engine: turns a request into a running batch.
 */
public final class ExrMergeService {

    private final ExrCodec codec;

    public ExrMergeService() {
        this(new TinyExrCodec());
    }

    public ExrMergeService(ExrCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    /**
     * Groups the request's files by frame and starts the workers. Returns immediately; the caller
     * polls the handle and must close it.
     */
    public RunHandle submit(MergeRequest request) {
        MergeRun run = new MergeRun(request, codec);
        run.start();
        return run;
    }

    public ExrCodec codec() {
        return codec;
    }
}
