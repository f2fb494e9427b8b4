package dev.badgersnacks.formiddb.logging;

import dev.badgersnacks.formiddb.ingest.ErrorSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * File logger that keeps a per-session record of scans, runs and the problems they reported.
 */
public final class ActionLogger implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActionLogger.class);
    private static final DateTimeFormatter FILE_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());
    private static final DateTimeFormatter ENTRY_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());
    private static final AtomicInteger SESSION_COUNTER = new AtomicInteger();

    private final Path logFile;
    private final BufferedWriter writer;

    public ActionLogger() {
        this(defaultDirectory());
    }

    public ActionLogger(Path logsDirectory) {
        try {
            this.logFile = createLogFile(logsDirectory);
            this.writer = Files.newBufferedWriter(logFile, StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
            log("session:start", "FormID Database Manager logging to " + logFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to initialize action logger", e);
        }
    }

    public static Path defaultDirectory() {
        return Path.of(System.getProperty("user.home"), ".formid-database-manager", "logs");
    }

    public Path getLogFile() {
        return logFile;
    }

    public void log(String action, String message) {
        log(action, message, null);
    }

    public synchronized void log(String action, String message, Throwable error) {
        try {
            writer.write(ENTRY_FORMAT.format(Instant.now()));
            writer.write(" [");
            writer.write(action);
            writer.write("] ");
            writer.write(message == null ? "" : message);
            writer.newLine();
            if (error != null) {
                StringWriter sw = new StringWriter();
                error.printStackTrace(new PrintWriter(sw));
                writer.write(sw.toString());
            }
            writer.flush();
        } catch (IOException e) {
            LOGGER.warn("Failed to write action log entry", e);
        }
    }

    /**
     * Routes reported problems into this log, tagged {@code info} or {@code warn}.
     */
    public ErrorSink asErrorSink() {
        return (message, informational) -> log(informational ? "info" : "warn", message);
    }

    @Override
    public synchronized void close() {
        try {
            log("session:end", "Closing action logger.");
            writer.close();
        } catch (IOException e) {
            LOGGER.warn("Failed to close action logger", e);
        }
    }

    private static Path createLogFile(Path logsDirectory) throws IOException {
        Files.createDirectories(logsDirectory);
        // two sessions within the same second must not collide
        String fileName = "formid-database-manager-" + FILE_FORMAT.format(Instant.now())
                + "-" + ProcessHandle.current().pid() + "-" + SESSION_COUNTER.incrementAndGet() + ".log";
        return logsDirectory.resolve(fileName).toAbsolutePath();
    }
}
