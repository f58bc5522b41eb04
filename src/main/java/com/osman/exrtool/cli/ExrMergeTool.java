package com.osman.exrtool.cli;

import com.osman.exrtool.cli.MergeJob.SequenceArgs;
import com.osman.exrtool.config.ConfigService;
import com.osman.exrtool.core.channel.ChannelCategorizer;
import com.osman.exrtool.core.channel.ChannelInspector;
import com.osman.exrtool.core.channel.SequenceSelection;
import com.osman.exrtool.core.codec.ExrCodecException;
import com.osman.exrtool.core.run.ExrMergeService;
import com.osman.exrtool.core.run.MergeError;
import com.osman.exrtool.core.run.MergeErrorLog;
import com.osman.exrtool.core.run.MergeRequest;
import com.osman.exrtool.core.run.RunHandle;
import com.osman.exrtool.core.run.RunProgress;
import com.osman.exrtool.logging.AppLogger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Command-line front-end: merges the channels of one or more EXR sequences into per-frame files.
 */
public final class ExrMergeTool {

    static final int EXIT_OK = 0;
    static final int EXIT_ERRORS = 1;
    static final int EXIT_USAGE = 2;

    private static final Logger LOGGER = AppLogger.get();
    private static final long POLL_INTERVAL_MS = 200;

    private static final String USAGE = """
        Usage:
          ExrMergeTool --output <template> [--threads N] (--seq <file>... [--channels a,b] [--categories key,key])...
          ExrMergeTool --batch <job.json>

        A '#' run in the template is replaced by the zero padded frame number (out.####.exr).
        Without --channels or --categories every channel of the sequence's first file is kept.
        Category keys: color, normal, depth, ao, crypto-object, crypto-material, density, variance, noice, others
        """;

    private ExrMergeTool() {
    }

    public static void main(String[] args) {
        System.exit(run(args, new ExrMergeService()));
    }

    static int run(String[] args, ExrMergeService service) {
        MergeJob job;
        List<SequenceSelection> selections;
        try {
            job = MergeJobParser.parseArgs(args, ConfigService.getInstance().getThreadCount());
            selections = resolveSelections(job, new ChannelInspector(service.codec()));
        } catch (IllegalArgumentException ex) {
            LOGGER.severe(ex.getMessage());
            LOGGER.info(USAGE);
            return EXIT_USAGE;
        } catch (IOException | ExrCodecException ex) {
            LOGGER.severe(ex.getMessage());
            return EXIT_USAGE;
        }

        MergeRequest request = new MergeRequest(
            SequenceSelection.flatten(selections), job.output(), job.threads(), null);
        try (RunHandle run = service.submit(request)) {
            RunProgress progress = awaitCompletion(run);
            return report(run, progress);
        }
    }

    static List<SequenceSelection> resolveSelections(MergeJob job, ChannelInspector inspector)
            throws ExrCodecException {
        List<SequenceSelection> selections = new ArrayList<>(job.sequences().size());
        for (SequenceArgs sequence : job.sequences()) {
            Set<String> channels = new LinkedHashSet<>(sequence.channels());
            if (sequence.selectsEverything() || !sequence.categories().isEmpty()) {
                Path first = sequence.files().get(0);
                List<String> available;
                try {
                    available = inspector.channelNames(first);
                } catch (ExrCodecException ex) {
                    throw new ExrCodecException("Cannot read channels of " + first + ": " + ex.getMessage(), ex);
                }
                channels.addAll(sequence.selectsEverything()
                    ? available
                    : ChannelCategorizer.select(available, sequence.categories()));
            }
            if (channels.isEmpty()) {
                LOGGER.warning("No channels selected for sequence starting at " + sequence.files().get(0));
            }
            selections.add(new SequenceSelection(sequence.files(), channels));
        }
        return selections;
    }

    private static RunProgress awaitCompletion(RunHandle run) {
        long lastDone = -1;
        while (true) {
            RunProgress progress = run.poll();
            if (progress.done() != lastDone) {
                lastDone = progress.done();
                LOGGER.info("Progress " + progress.done() + "/" + progress.max());
            }
            if (progress.complete()) {
                return progress;
            }
            try {
                Thread.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                LOGGER.warning("Interrupted while waiting; finishing the run before exiting");
                run.close();
                return run.poll();
            }
        }
    }

    private static int report(RunHandle run, RunProgress progress) {
        int errorCount = run.errorCount();
        if (errorCount == 0) {
            LOGGER.info("Done: all " + run.frameGroupCount() + " frame(s) written");
            return EXIT_OK;
        }
        for (int i = 0; i < errorCount; i++) {
            run.error(i).ifPresent(message -> LOGGER.severe(message.replace("\n", " | ")));
        }
        MergeErrorLog.logFailures(run.errors());
        long failedFrames = run.errors().stream().map(MergeError::frame).distinct().count();
        LOGGER.warning("Partial success: " + failedFrames + " of " + run.frameGroupCount()
            + " frame(s) failed with " + errorCount + " error(s); progress " + progress.done() + "/" + progress.max());
        return EXIT_ERRORS;
    }
}
