package edu.harvard.hms.dbmi.avillach.inventory.storage;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Append-only JSON lines file. Each record is one line; a call to {@link #append} or {@link #appendAll} is flushed before it returns,
 * so everything acknowledged survives a restart.
 *
 * Thread-safe.
 */
public class JsonLinesJournal<T> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JsonLinesJournal.class);

    private final Path journalFile;
    private final Class<T> recordType;
    private final ObjectMapper mapper;
    private BufferedWriter writer;

    public JsonLinesJournal(Path journalFile, Class<T> recordType) {
        this.journalFile = journalFile;
        this.recordType = recordType;
        this.mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Reads every record written so far. Blank lines are skipped; a truncated line (a crash mid-write) is logged and dropped.
     */
    public synchronized List<T> replay() {
        List<T> records = new ArrayList<>();
        if (!Files.exists(journalFile)) {
            return records;
        }
        try (BufferedReader reader = Files.newBufferedReader(journalFile, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(mapper.readValue(line, recordType));
                } catch (IOException e) {
                    log.warn("Skipping unreadable line {} of {}: {}", lineNumber, journalFile, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to replay journal " + journalFile, e);
        }
        log.info("Replayed {} {} record(s) from {}", records.size(), recordType.getSimpleName(), journalFile);
        return records;
    }

    public synchronized void append(T record) {
        appendAll(List.of(record));
    }

    public synchronized void appendAll(Collection<? extends T> records) {
        if (records.isEmpty()) {
            return;
        }
        try {
            BufferedWriter out = writer();
            for (T record : records) {
                out.write(mapper.writeValueAsString(record));
                out.newLine();
            }
            out.flush();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to append to journal " + journalFile, e);
        }
    }

    public Path getJournalFile() {
        return journalFile;
    }

    private BufferedWriter writer() throws IOException {
        if (writer == null) {
            Path parent = journalFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            boolean tornTail = endsWithPartialLine();
            writer = Files.newBufferedWriter(
                journalFile, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE
            );
            if (tornTail) {
                // terminate the partial record so the next append starts on its own line
                log.warn("Journal {} ends with a partial line, terminating it before appending", journalFile);
                writer.newLine();
                writer.flush();
            }
            log.info("Opened journal: {}", journalFile);
        }
        return writer;
    }

    private boolean endsWithPartialLine() throws IOException {
        if (!Files.exists(journalFile)) {
            return false;
        }
        try (SeekableByteChannel channel = Files.newByteChannel(journalFile, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return false;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1);
            channel.read(last);
            return last.get(0) != '\n';
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (writer != null) {
            writer.close();
            writer = null;
            log.info("Closed journal: {}", journalFile);
        }
    }
}
