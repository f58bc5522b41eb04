package com.osman.exrtool.cli;

import com.osman.exrtool.cli.MergeJob.SequenceArgs;
import com.osman.exrtool.core.channel.ChannelCategory;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MergeJobParserTest {

    @TempDir
    Path tempDir;

    @Test
    void parsesSequencesWithSelections() throws Exception {
        MergeJob job = MergeJobParser.parseArgs(new String[] {
            "--output", "out.####.exr", "--threads", "3",
            "--seq", "beauty.0001.exr", "beauty.0002.exr", "--channels", "R, G,B",
            "--seq", "aov.0001.exr", "--categories", "depth,normal"
        }, 0);

        assertEquals("out.####.exr", job.output());
        assertEquals(3, job.threads());
        assertEquals(2, job.sequences().size());
        SequenceArgs beauty = job.sequences().get(0);
        assertEquals(List.of(Path.of("beauty.0001.exr"), Path.of("beauty.0002.exr")), beauty.files());
        assertEquals(List.of("R", "G", "B"), beauty.channels());
        SequenceArgs aov = job.sequences().get(1);
        assertEquals(List.of(ChannelCategory.DEPTH, ChannelCategory.NORMAL), aov.categories());
        assertTrue(aov.channels().isEmpty());
    }

    @Test
    void sequenceWithoutSelectionTakesEverything() throws Exception {
        MergeJob job = MergeJobParser.parseArgs(new String[] {"-o", "out.exr", "--seq", "a.exr"}, 5);

        assertEquals(5, job.threads());
        assertTrue(job.sequences().get(0).selectsEverything());
    }

    @Test
    void rejectsMalformedArguments() {
        assertUsage();
        assertUsage("--seq", "a.exr");
        assertUsage("--output", "o.exr");
        assertUsage("--output", "o.exr", "--seq");
        assertUsage("--output", "o.exr", "a.exr");
        assertUsage("--output", "o.exr", "--seq", "a.exr", "--threads", "-1");
        assertUsage("--output", "o.exr", "--seq", "a.exr", "--threads", "many");
        assertUsage("--output", "o.exr", "--seq", "a.exr", "--categories", "sky");
        assertUsage("--output", "o.exr", "--channels", "R", "--seq", "a.exr");
        assertUsage("--output", "o.exr", "--seq", "a.exr", "--verbose");
        assertUsage("--output", "--seq", "a.exr");
        assertUsage("--batch", "job.json", "--output", "o.exr");
    }

    @Test
    void readsJobFileRelativeToItsDirectory() throws Exception {
        Path jobFile = tempDir.resolve("job.json");
        Files.writeString(jobFile, """
            {
              "output": "comp/out.####.exr",
              "threads": 2,
              "sequences": [
                {"files": ["beauty/b.0001.exr", "/abs/b.0002.exr"], "channels": ["R", "G"]},
                {"files": ["depth.0001.exr"], "categories": ["depth"]}
              ]
            }
            """);

        MergeJob job = MergeJobParser.parseArgs(new String[] {"--batch", jobFile.toString()}, 0);

        assertEquals("comp/out.####.exr", job.output());
        assertEquals(2, job.threads());
        SequenceArgs first = job.sequences().get(0);
        assertEquals(tempDir.toAbsolutePath().resolve("beauty/b.0001.exr"), first.files().get(0));
        assertEquals(Path.of("/abs/b.0002.exr"), first.files().get(1));
        assertEquals(List.of("R", "G"), first.channels());
        assertEquals(List.of(ChannelCategory.DEPTH), job.sequences().get(1).categories());
    }

    @Test
    void jobFileFallsBackToDefaultThreads() throws Exception {
        Path jobFile = tempDir.resolve("job.json");
        Files.writeString(jobFile, "{\"output\": \"o.exr\", \"sequences\": [{\"files\": [\"a.exr\"]}]}");

        assertEquals(4, MergeJobParser.parseJobFile(jobFile, 4).threads());
    }

    @Test
    void brokenJobFileIsAnIoError() throws Exception {
        Path jobFile = tempDir.resolve("broken.json");
        Files.writeString(jobFile, "{\"output\": ");

        assertThrows(IOException.class, () -> MergeJobParser.parseJobFile(jobFile, 0));
        assertThrows(IOException.class, () -> MergeJobParser.parseJobFile(tempDir.resolve("missing.json"), 0));
    }

    @Test
    void jobFileWithoutSequencesIsRejected() throws Exception {
        Path jobFile = tempDir.resolve("empty.json");
        Files.writeString(jobFile, "{\"output\": \"o.exr\", \"sequences\": [{\"files\": []}]}");

        assertThrows(IllegalArgumentException.class, () -> MergeJobParser.parseJobFile(jobFile, 0));
    }

    private static void assertUsage(String... args) {
        assertThrows(IllegalArgumentException.class, () -> MergeJobParser.parseArgs(args, 0));
    }
}
