package com.cardpack.logging;

import com.cardpack.core.PackagingException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Appends packaging failures to a CSV inside the build output directory so failed runs can be reviewed
 * after the console is gone.
 */
public final class PackagingErrorLogger {

    static final Path DEFAULT_LOG_FILE = Paths.get("target", "packaging-errors.csv");
    private static final String HEADER = "timestamp,stage,unit,path,exception_type,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private final Path logFile;

    public PackagingErrorLogger() {
        this(DEFAULT_LOG_FILE);
    }

    public PackagingErrorLogger(Path logFile) {
        this.logFile = logFile;
    }

    public Path logFile() {
        return logFile;
    }

    public void logFailure(String stage, Exception exception) {
        String unit = "";
        String path = "";
        if (exception instanceof PackagingException) {
            PackagingException packaging = (PackagingException) exception;
            unit = packaging.getUnitName() != null ? packaging.getUnitName() : "";
            path = packaging.getPath() != null ? packaging.getPath().toString() : "";
        }
        String message = (exception == null) ? "" : exception.getMessage();
        String[] columns = new String[] {
            TIMESTAMP_FORMAT.format(Instant.now()),
            stage,
            unit,
            path,
            exception == null ? "" : exception.getClass().getName(),
            message != null ? message : ""
        };
        writeRow(columns);
    }

    private void writeRow(String[] columns) {
        synchronized (PackagingErrorLogger.class) {
            try {
                if (logFile.getParent() != null) {
                    Files.createDirectories(logFile.getParent());
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
                    writer.write(toCsv(columns));
                    writer.newLine();
                }
            } catch (IOException ioEx) {
                AppLogger.get().warning("Failed to write packaging error log: " + ioEx.getMessage());
            }
        }
    }

    static String toCsv(String[] columns) {
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
        if (value == null) {
            return "";
        }
        boolean needsQuotes = value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r");
        String escaped = value.replace("\"", "\"\"");
        if (needsQuotes) {
            return "\"" + escaped + "\"";
        }
        return escaped;
    }
}
