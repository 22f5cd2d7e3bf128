package com.williamcallahan.corpussync.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Append-only file of JSON documents, one per line.
 *
 * <p>Each append writes a complete line in a single channel write. A line torn by a crash can
 * only be the last one; it is cut off when the journal is opened so later appends start on a
 * clean line boundary.</p>
 */
final class JsonLinesJournal implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesJournal.class);
    private static final byte NEWLINE = '\n';

    private final Path file;
    private final ObjectMapper mapper;
    private final boolean fsync;
    private FileChannel channel;

    JsonLinesJournal(Path file, ObjectMapper mapper, boolean fsync) {
        this.file = file;
        this.mapper = mapper;
        this.fsync = fsync;
        try {
            Files.createDirectories(file.toAbsolutePath().getParent());
            repairTornTail();
        } catch (IOException e) {
            throw new StoreIOException("[STORE] Cannot open journal " + file, e);
        }
    }

    Path file() {
        return file;
    }

    /**
     * Reads every complete line of the journal in append order.
     *
     * @param type event type each line deserializes to
     * @return events, empty when the journal does not exist yet
     */
    synchronized <T> List<T> readAll(Class<T> type) {
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            List<T> events = new ArrayList<>(lines.size());
            for (String line : lines) {
                if (!line.isBlank()) {
                    events.add(mapper.readValue(line, type));
                }
            }
            return events;
        } catch (IOException e) {
            throw new StoreIOException("[STORE] Cannot replay journal " + file, e);
        }
    }

    /**
     * Appends one event as a single line, forcing it to disk when the journal was opened with fsync.
     *
     * @param event event to serialize
     */
    synchronized void append(Object event) {
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(event);
        } catch (IOException e) {
            throw new StoreIOException("[STORE] Cannot serialize event for " + file, e);
        }
        ByteBuffer buffer = ByteBuffer.allocate(json.length + 1);
        buffer.put(json).put(NEWLINE).flip();

        long sizeBefore = -1;
        try {
            FileChannel target = openChannel();
            sizeBefore = target.size();
            while (buffer.hasRemaining()) {
                target.write(buffer);
            }
            if (fsync) {
                target.force(false);
            }
        } catch (IOException e) {
            rollBack(sizeBefore, e);
            throw new StoreIOException("[STORE] Cannot append to journal " + file, e);
        }
    }

    @Override
    public synchronized void close() throws IOException {
        if (channel != null) {
            channel.close();
            channel = null;
        }
    }

    private FileChannel openChannel() throws IOException {
        if (channel == null || !channel.isOpen()) {
            channel = FileChannel.open(
                    file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        }
        return channel;
    }

    private void rollBack(long sizeBefore, IOException failure) {
        if (sizeBefore < 0 || channel == null) {
            return;
        }
        try {
            channel.truncate(sizeBefore);
        } catch (IOException truncateFailure) {
            failure.addSuppressed(truncateFailure);
        }
    }

    private void repairTornTail() throws IOException {
        if (!Files.exists(file)) {
            return;
        }
        byte[] content = Files.readAllBytes(file);
        if (content.length == 0 || content[content.length - 1] == NEWLINE) {
            return;
        }
        int keep = content.length;
        while (keep > 0 && content[keep - 1] != NEWLINE) {
            keep--;
        }
        log.warn("[STORE] Discarding {} bytes of torn tail in {}", content.length - keep, file);
        try (FileChannel repair = FileChannel.open(file, StandardOpenOption.WRITE)) {
            repair.truncate(keep);
            repair.force(true);
        }
    }
}
