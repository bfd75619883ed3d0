package org.netpreserve.domainprober;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.domainprober.util.Url;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.*;

class OutcomeLogTest {
    @TempDir
    Path tempDir;

    @Test
    void missingFileIsEmpty() {
        var state = new OutcomeLog(tempDir.resolve("empty_domains.txt")).load();
        assertEquals(Set.of(), state.members());
        assertNull(state.cursor());
    }

    @Test
    void appendsInOrderAndReloads() throws IOException {
        Path path = tempDir.resolve("sub/empty_domains.txt");
        try (var log = new OutcomeLog(path)) {
            log.load();
            assertTrue(log.recordNotLive(new Url("http://b.com")));
            assertTrue(log.recordNotLive(new Url("http://a.com")));
            assertFalse(log.recordNotLive(new Url("http://b.com")));
            assertEquals(2, log.size());
        }
        assertEquals(List.of("http://b.com", "http://a.com"), Files.readAllLines(path));

        var state = new OutcomeLog(path).load();
        assertEquals(Set.of(new Url("http://a.com"), new Url("http://b.com")), state.members());
        assertEquals(new Url("http://a.com"), state.cursor());
    }

    @Test
    void checkpointMakesAppendsVisible() throws IOException {
        Path path = tempDir.resolve("empty_domains.txt");
        try (var log = new OutcomeLog(path)) {
            log.load();
            log.recordNotLive(new Url("http://a.com"));
            log.checkpoint();
            assertEquals(List.of("http://a.com"), Files.readAllLines(path));
        }
    }

    @Test
    void alreadyLoggedCandidatesAreNotAppended() throws IOException {
        Path path = tempDir.resolve("empty_domains.txt");
        Files.writeString(path, "http://a.com\n");
        try (var log = new OutcomeLog(path)) {
            log.load();
            assertFalse(log.recordNotLive(new Url("http://a.com")));
        }
        assertEquals("http://a.com\n", Files.readString(path));
    }

    @Test
    void incompleteLastLineIsIgnored() throws IOException {
        Path path = tempDir.resolve("empty_domains.txt");
        Files.writeString(path, "http://a.com\n\nhttp://b.com\nhttp://c.c", UTF_8);
        try (var log = new OutcomeLog(path)) {
            var state = log.load();
            assertEquals(Set.of(new Url("http://a.com"), new Url("http://b.com")), state.members());
            assertEquals(new Url("http://b.com"), state.cursor());

            log.recordNotLive(new Url("http://d.com"));
        }
        assertEquals("http://a.com\n\nhttp://b.com\nhttp://c.c\nhttp://d.com\n", Files.readString(path));
        assertEquals(new Url("http://d.com"), new OutcomeLog(path).load().cursor());
    }

    @Test
    void concurrentAppendsAreNeitherTornNorLost() throws Exception {
        Path path = tempDir.resolve("empty_domains.txt");
        int threads = 8;
        int perThread = 500;
        var expected = new HashSet<Url>();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try (var log = new OutcomeLog(path)) {
            log.load();
            var startGate = new CountDownLatch(1);
            var futures = new ArrayList<Future<?>>();
            for (int t = 0; t < threads; t++) {
                var urls = new ArrayList<Url>();
                for (int i = 0; i < perThread; i++) {
                    urls.add(new Url("http://t" + t + "-" + i + ".com"));
                    // shared by every thread
                    urls.add(new Url("http://shared" + i + ".com"));
                }
                expected.addAll(urls);
                futures.add(executor.submit(() -> {
                    startGate.await();
                    for (Url url : urls) {
                        log.recordNotLive(url);
                        if (url.hashCode() % 50 == 0) log.checkpoint();
                    }
                    return null;
                }));
            }
            startGate.countDown();
            for (var future : futures) future.get();
        } finally {
            executor.shutdownNow();
        }

        List<String> lines = Files.readAllLines(path);
        assertEquals(expected.size(), lines.size());
        var seen = new HashSet<Url>();
        for (String line : lines) {
            assertFalse(line.isBlank());
            assertTrue(seen.add(new Url(line)), "duplicate line " + line);
        }
        assertEquals(expected, seen);
        assertEquals(expected, new OutcomeLog(path).load().members());
    }
}
