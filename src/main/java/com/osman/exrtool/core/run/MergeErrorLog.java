package com.osman.exrtool.core.run;

import com.osman.exrtool.config.ConfigService;
import com.osman.exrtool.logging.AppLogger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Appends merge failures to a CSV file so failed frames of earlier batches can be reviewed later.
 */
public final class MergeErrorLog {

    private static final Logger LOGGER = AppLogger.get();
    private static final String HEADER = "timestamp,kind,frame,file,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private MergeErrorLog() {
    }

    public static void logFailures(List<MergeError> errors) {
        logFailures(ConfigService.getInstance().getErrorLogFile(), errors);
    }

    public static void logFailures(Path logFile, List<MergeError> errors) {
        if (errors == null || errors.isEmpty()) {
            return;
        }
        String timestamp = TIMESTAMP_FORMAT.format(Instant.now());
        synchronized (MergeErrorLog.class) {
            try {
                Path parent = logFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                boolean fileExists = Files.exists(logFile);
                try (BufferedWriter writer = Files.newBufferedWriter(
                    logFile,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                )) {
                    if (!fileExists) {
                        writer.write(HEADER);
                        writer.newLine();
                    }
                    for (MergeError error : errors) {
                        writer.write(toCsv(timestamp, error));
                        writer.newLine();
                    }
                }
            } catch (IOException ioEx) {
                LOGGER.log(Level.WARNING, "Failed to write merge error log " + logFile, ioEx);
            }
        }
    }

    static String toCsv(String timestamp, MergeError error) {
        String[] columns = {
            timestamp,
            error.kind().name(),
            error.frame().isPresent() ? error.frame().toString() : "",
            error.file() == null ? "" : error.file().toString(),
            error.detail() == null ? "" : error.detail()
        };
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(columns[i]));
        }
        return sb.toString();
    }

    private static String escape(String value) {
        boolean needsQuotes = value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r");
        String escaped = value.replace("\"", "\"\"");
        if (needsQuotes) {
            return "\"" + escaped + "\"";
        }
        return escaped;
    }
}
