package org.netpreserve.domainprober;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.domainprober.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Append-only log of candidates that turned out not to be live, one URL per line.
 * <p>
 * The whole log is loaded into memory once; after that it is only ever appended to. The last line
 * is the resume cursor. Appends are buffered until {@link #checkpoint()}.
 */
public class OutcomeLog implements Closeable {
    private static final Logger log = LoggerFactory.getLogger(OutcomeLog.class);
    private final Path path;
    private final Set<Url> recorded = new HashSet<>();
    private BufferedWriter writer;
    private boolean tornTail;
    private int unflushed;

    /**
     * @param members every candidate in the log
     * @param cursor  the last candidate in the log, or null if it's empty
     */
    public record State(Set<Url> members, @Nullable Url cursor) {
    }

    public OutcomeLog(Path path) {
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public synchronized State load() {
        var members = new HashSet<Url>();
        if (!Files.exists(path)) return new State(members, null);
        Url cursor = null;
        try {
            tornTail = !endsWithNewline(path);
            try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
                String pending = null;
                String line;
                while ((line = reader.readLine()) != null) {
                    if (pending != null) {
                        cursor = new Url(pending);
                        members.add(cursor);
                    }
                    line = line.trim();
                    pending = line.isEmpty() ? null : line;
                }
                if (pending != null) {
                    if (tornTail) {
                        log.warn("Ignoring incomplete last line of {}: {}", path, pending);
                    } else {
                        cursor = new Url(pending);
                        members.add(cursor);
                    }
                }
            }
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + path, e);
        }
        recorded.addAll(members);
        return new State(members, cursor);
    }

    private static boolean endsWithNewline(Path path) throws IOException {
        try (var file = new RandomAccessFile(path.toFile(), "r")) {
            if (file.length() == 0) return true;
            file.seek(file.length() - 1);
            return file.read() == '\n';
        }
    }

    /**
     * Appends the candidate unless it is already in the log.
     *
     * @return true if it was appended
     */
    public synchronized boolean recordNotLive(Url candidate) {
        if (!recorded.add(candidate)) return false;
        try {
            BufferedWriter writer = writer();
            writer.write(candidate.toString());
            writer.write('\n');
            unflushed++;
        } catch (IOException e) {
            recorded.remove(candidate);
            throw new PersistenceException("Failed to append to " + path, e);
        }
        return true;
    }

    private BufferedWriter writer() throws IOException {
        if (writer == null) {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            // not a FileChannel: an interrupt must never close the log underneath us
            writer = new BufferedWriter(new OutputStreamWriter(
                    new FileOutputStream(path.toFile(), true), StandardCharsets.UTF_8));
            if (tornTail) {
                writer.write('\n');
                tornTail = false;
            }
        }
        return writer;
    }

    /**
     * Forces buffered appends out to the file.
     */
    public synchronized void checkpoint() {
        if (writer == null || unflushed == 0) return;
        try {
            writer.flush();
            log.trace("Checkpointed {} outcomes to {}", unflushed, path);
            unflushed = 0;
        } catch (IOException e) {
            throw new PersistenceException("Failed to flush " + path, e);
        }
    }

    public synchronized int size() {
        return recorded.size();
    }

    @Override
    public synchronized void close() {
        if (writer == null) return;
        try {
            checkpoint();
        } finally {
            try {
                writer.close();
            } catch (IOException e) {
                log.error("Failed to close {}", path, e);
            }
            writer = null;
        }
    }
}
