package org.netpreserve.domainprober;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.domainprober.CandidateSource.Phase;
import org.netpreserve.domainprober.CandidateSource.Position;
import org.netpreserve.domainprober.util.Url;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ResumeControllerTest {
    @TempDir
    Path tempDir;

    private CandidateSource source() throws IOException {
        Path words = Files.write(tempDir.resolve("words.txt"), List.of("foo", "bar", "baz"));
        return new CandidateSource(words, List.of("com"), "http", 2, 2);
    }

    private static List<String> all(CandidateSource source) {
        var urls = new ArrayList<String>();
        source.forEachRemaining(url -> urls.add(url.toString()));
        return urls;
    }

    @Test
    void startsFromTheBeginningWithoutCursor() throws IOException {
        try (var source = source()) {
            assertEquals(Position.START, new ResumeController(true).position(source, null));
            assertEquals("http://foo.com", source.next().toString());
        }
    }

    @Test
    void ignoresCursorWhenDisabled() throws IOException {
        try (var source = source()) {
            assertEquals(Position.START, new ResumeController(false).position(source, new Url("http://bar.com")));
            assertEquals("http://foo.com", source.next().toString());
        }
    }

    @Test
    void resumesAfterEveryPrefix() throws IOException {
        List<String> sequence;
        try (var source = source()) {
            sequence = all(source);
        }
        for (int k : new int[]{0, 1, sequence.size() - 2}) {
            try (var source = source()) {
                new ResumeController(true).position(source, new Url(sequence.get(k)));
                assertEquals(sequence.subList(k + 1, sequence.size()), all(source), "cursor " + sequence.get(k));
            }
        }
    }

    @Test
    void resumesWithCombinationsAfterDictionary() throws IOException {
        try (var source = source()) {
            var position = new ResumeController(true).position(source, new Url("http://baz.com"));
            assertEquals(new Position(Phase.COMBINATIONS, 2, 0, 0), position);
            assertEquals("http://aa.com", source.next().toString());
        }
    }

    @Test
    void unknownCursorStartsFromTheBeginning() throws IOException {
        try (var source = source()) {
            assertEquals(Position.START, new ResumeController(true).position(source, new Url("http://foo.org")));
            assertEquals("http://foo.com", source.next().toString());
        }
    }
}
