package com.osman.exrtool.core.run;

import com.osman.exrtool.core.codec.ExrCodec;
import com.osman.exrtool.core.frame.FrameGroup;
import com.osman.exrtool.core.frame.SequenceGrouper;
import com.osman.exrtool.core.merge.ChannelMerger;
import com.osman.exrtool.core.merge.OutputPathTemplate;
import com.osman.exrtool.logging.AppLogger;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * One batch: the frame groups built from a request plus the progress and error state its workers share.
 * Grouping happens in the constructor, before any worker exists.
 */
final class MergeRun implements RunHandle {

    private static final Logger LOGGER = AppLogger.get();

    private final List<FrameGroup> frames;
    private final int fileCount;
    private final OutputPathTemplate outputTemplate;
    private final ProgressTracker progress;
    private final ErrorCollector errors = new ErrorCollector();
    private final WorkerPool<FrameGroup> pool;
    private final ProgressListener listener;
    private final AtomicBoolean completionLogged = new AtomicBoolean();
    private final AtomicBoolean closed = new AtomicBoolean();

    MergeRun(MergeRequest request, ExrCodec codec) {
        this.frames = SequenceGrouper.group(request.files());
        this.fileCount = request.files().size();
        this.outputTemplate = new OutputPathTemplate(request.outputTemplate());
        this.progress = new ProgressTracker(fileCount, frames.size());
        this.listener = request.listener();

        ChannelMerger merger = new ChannelMerger(codec, outputTemplate, progress, errors);
        int threads = WorkerPool.resolveThreadCount(request.threads());
        this.pool = new WorkerPool<>(frames, threads, merger::merge, this::onWorkerProgress);
    }

    void start() {
        LOGGER.info("Merging " + fileCount + " file(s) into " + frames.size() + " frame(s) -> "
            + outputTemplate + " using " + pool.threadCount() + " thread(s)");
        if (frames.size() > 1 && !outputTemplate.hasFramePlaceholder()) {
            LOGGER.warning("Output template has no '#' run; every frame writes " + outputTemplate);
        }
        pool.start();
    }

    @Override
    public RunProgress poll() {
        boolean complete = pool.isComplete();
        return new RunProgress(complete, progress.done(), progress.max());
    }

    @Override
    public int errorCount() {
        return errors.count();
    }

    @Override
    public Optional<String> error(int index) {
        return errors.message(index);
    }

    @Override
    public List<MergeError> errors() {
        return errors.snapshot();
    }

    @Override
    public int frameGroupCount() {
        return frames.size();
    }

    @Override
    public int threadCount() {
        return pool.threadCount();
    }

    List<FrameGroup> frames() {
        return frames;
    }

    @Override
    public void close() {
        pool.join();
        if (closed.compareAndSet(false, true)) {
            LOGGER.fine("Run released");
        }
    }

    private void onWorkerProgress() {
        if (pool.isComplete() && completionLogged.compareAndSet(false, true)) {
            int failed = errors.count();
            if (failed == 0) {
                LOGGER.info("Merge finished: " + frames.size() + " frame(s) written");
            } else {
                LOGGER.warning("Merge finished with " + failed + " error(s) across " + frames.size() + " frame(s)");
            }
        }
        if (listener != null) {
            listener.onProgress(this);
        }
    }
}
