package com.ordergw.gateway.recorder;

import com.ordergw.gateway.dispatch.ResponseRecorder;
import com.ordergw.protocol.ResponseRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Appends one line per response to a log file:
 *
 *   2024-01-02T09:15:03.120 | OrderID: 1001 | Response: ACCEPT | Latency(ms): 50.21
 *
 * Each line is flushed as it is written. Writes are serialized on this object.
 */
public final class FileResponseRecorder implements ResponseRecorder, Closeable {

    private static final Logger log = LoggerFactory.getLogger(FileResponseRecorder.class);

    private static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS");

    private final Path path;
    private final ZoneId zone;
    private final BufferedWriter writer;
    private long written;

    public FileResponseRecorder(Path path, ZoneId zone) throws IOException {
        this.path = path;
        this.zone = zone;
        if (path.getParent() != null) Files.createDirectories(path.getParent());
        this.writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        log.info("Recording responses to {}", path.toAbsolutePath());
    }

    @Override
    public synchronized void record(ResponseRecord record) {
        try {
            writer.write(format(record, zone));
            writer.newLine();
            writer.flush();
            written++;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append to " + path, e);
        }
    }

    public synchronized long written() {
        return written;
    }

    static String format(ResponseRecord record, ZoneId zone) {
        LocalDateTime ts = LocalDateTime.ofInstant(Instant.ofEpochMilli(record.timestampMillis()), zone);
        return TS.format(ts)
                + " | OrderID: " + record.orderId()
                + " | Response: " + record.verdict().name()
                + " | Latency(ms): " + String.format(Locale.ROOT, "%.2f", record.latencyMillis());
    }

    @Override
    public synchronized void close() throws IOException {
        writer.close();
        log.info("Response log {} closed after {} records", path, written);
    }
}
