package org.netpreserve.domainprober;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.domainprober.config.CandidatesConfig;
import org.netpreserve.domainprober.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;

/**
 * Deterministic sequence of candidates: every word of the word list crossed with every suffix,
 * followed by every combination of {@link #ALPHABET} by increasing length, again crossed with
 * every suffix.
 * <p>
 * The sequence can be restarted at any {@link Position}. Positions in the combination phase are
 * computed arithmetically; the dictionary phase is re-read from the start of the file.
 */
public class CandidateSource implements Iterator<Url>, Closeable {
    private static final Logger log = LoggerFactory.getLogger(CandidateSource.class);
    public static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    /**
     * Longest combination whose index still fits in a long (36^12 < 2^63).
     */
    public static final int MAX_COMBO_LENGTH = 12;

    private final @Nullable Path wordList;
    private final List<String> suffixes;
    private final String scheme;
    private final int minLength;
    private final int maxLength;

    private Phase phase;
    private BufferedReader reader;
    private String word;
    private int length;
    private long nameIndex;
    private int suffixIndex;

    public enum Phase {
        DICTIONARY, COMBINATIONS, EXHAUSTED
    }

    /**
     * Position of a candidate in the sequence.
     *
     * @param length      combination length, 0 in the dictionary phase
     * @param nameIndex   index of the accepted word, or of the combination within its length
     * @param suffixIndex index into the suffix list
     */
    public record Position(Phase phase, int length, long nameIndex, int suffixIndex) {
        public static final Position START = new Position(Phase.DICTIONARY, 0, 0, 0);
    }

    public CandidateSource(@Nullable Path wordList, List<String> suffixes, String scheme, int comboLength,
                           @Nullable Integer maxComboLength) throws GenerationException {
        if (suffixes == null || suffixes.isEmpty()) throw new IllegalArgumentException("At least one suffix is required");
        if (comboLength < 1 || comboLength > MAX_COMBO_LENGTH) {
            throw new IllegalArgumentException("comboLength must be between 1 and " + MAX_COMBO_LENGTH);
        }
        int max = maxComboLength == null ? MAX_COMBO_LENGTH : maxComboLength;
        if (max < comboLength || max > MAX_COMBO_LENGTH) {
            throw new IllegalArgumentException("maxComboLength must be between comboLength (" + comboLength +
                                               ") and " + MAX_COMBO_LENGTH);
        }
        this.wordList = wordList;
        this.suffixes = normalizeSuffixes(suffixes);
        this.scheme = scheme == null ? "http" : scheme;
        this.minLength = comboLength;
        this.maxLength = max;
        seek(Position.START);
    }

    public static CandidateSource open(CandidatesConfig config) throws GenerationException {
        return new CandidateSource(config.wordList() == null ? null : Path.of(config.wordList()),
                config.suffixes(), config.scheme(), config.comboLength(), config.maxComboLength());
    }

    private static List<String> normalizeSuffixes(List<String> suffixes) {
        var normalized = new ArrayList<String>(suffixes.size());
        for (String suffix : suffixes) {
            String s = suffix.trim().toLowerCase(Locale.ROOT);
            while (s.startsWith(".")) s = s.substring(1);
            for (String label : s.split("\\.", -1)) {
                if (!Url.isValidLabel(label)) throw new IllegalArgumentException("Invalid suffix: " + suffix);
            }
            normalized.add(s);
        }
        return List.copyOf(normalized);
    }

    public List<String> suffixes() {
        return suffixes;
    }

    @Override
    public boolean hasNext() {
        return phase != Phase.EXHAUSTED;
    }

    @Override
    public Url next() {
        if (phase == Phase.EXHAUSTED) throw new NoSuchElementException();
        String name = phase == Phase.DICTIONARY ? word : nameAt(length, nameIndex);
        Url candidate = Url.forHost(scheme, name, suffixes.get(suffixIndex));
        try {
            advance();
        } catch (GenerationException e) {
            throw new UncheckedIOException(e);
        }
        return candidate;
    }

    /**
     * The position of the candidate that {@link #next()} will return.
     */
    public Position position() {
        return switch (phase) {
            case DICTIONARY -> new Position(Phase.DICTIONARY, 0, nameIndex, suffixIndex);
            case COMBINATIONS -> new Position(Phase.COMBINATIONS, length, nameIndex, suffixIndex);
            case EXHAUSTED -> new Position(Phase.EXHAUSTED, 0, 0, 0);
        };
    }

    private void advance() throws GenerationException {
        if (++suffixIndex < suffixes.size()) return;
        suffixIndex = 0;
        nameIndex++;
        if (phase == Phase.DICTIONARY) {
            word = readWord();
            if (word == null) startCombinations(minLength, 0);
        } else if (nameIndex >= combinationCount(length)) {
            startCombinations(length + 1, 0);
        }
    }

    private void startCombinations(int length, long nameIndex) {
        closeReader();
        if (length > maxLength) {
            phase = Phase.EXHAUSTED;
            return;
        }
        phase = Phase.COMBINATIONS;
        this.length = length;
        this.nameIndex = nameIndex;
    }

    private String readWord() throws GenerationException {
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                String name = line.trim().toLowerCase(Locale.ROOT);
                if (name.isEmpty()) continue;
                if (!Url.isValidLabel(name)) {
                    log.debug("Skipping word that is not a valid host name label: {}", name);
                    continue;
                }
                return name;
            }
            return null;
        } catch (IOException e) {
            throw new GenerationException("Error reading word list " + wordList, e);
        }
    }

    /**
     * Restarts the sequence at the given position.
     */
    public void seek(Position position) throws GenerationException {
        if (position.suffixIndex() < 0 || position.suffixIndex() >= suffixes.size()) {
            throw new IllegalArgumentException("Suffix index out of range: " + position);
        }
        closeReader();
        switch (position.phase()) {
            case DICTIONARY -> {
                phase = Phase.DICTIONARY;
                nameIndex = 0;
                suffixIndex = 0;
                word = null;
                if (wordList != null) {
                    try {
                        reader = Files.newBufferedReader(wordList, StandardCharsets.UTF_8);
                    } catch (IOException e) {
                        throw new GenerationException("Unable to open word list " + wordList, e);
                    }
                    word = readWord();
                    while (word != null && nameIndex < position.nameIndex()) {
                        word = readWord();
                        nameIndex++;
                    }
                }
                if (word == null) {
                    startCombinations(minLength, 0);
                } else {
                    suffixIndex = position.suffixIndex();
                }
            }
            case COMBINATIONS -> {
                if (position.length() < minLength || position.nameIndex() < 0 ||
                    (position.length() <= maxLength && position.nameIndex() >= combinationCount(position.length()))) {
                    throw new IllegalArgumentException("Combination position out of range: " + position);
                }
                startCombinations(position.length(), position.nameIndex());
                suffixIndex = phase == Phase.EXHAUSTED ? 0 : position.suffixIndex();
            }
            case EXHAUSTED -> phase = Phase.EXHAUSTED;
        }
    }

    /**
     * Restarts the sequence immediately after the first occurrence of {@code candidate}. If it doesn't
     * occur in the sequence the source is left at the start.
     *
     * @return true if the candidate was found
     */
    public boolean seekAfter(Url candidate) throws GenerationException {
        seek(Position.START);
        while (phase == Phase.DICTIONARY) {
            if (next().equals(candidate)) return true;
        }
        Position position = combinationPosition(candidate);
        if (position == null) {
            seek(Position.START);
            return false;
        }
        seek(position);
        next();
        return true;
    }

    /**
     * Works out where the candidate would appear in the combination phase, or null if it can't.
     */
    @Nullable Position combinationPosition(Url candidate) {
        String prefix = scheme + "://";
        String url = candidate.toString();
        if (!url.startsWith(prefix)) return null;
        String host = url.substring(prefix.length());
        for (int i = 0; i < suffixes.size(); i++) {
            String suffix = "." + suffixes.get(i);
            if (!host.endsWith(suffix)) continue;
            String name = host.substring(0, host.length() - suffix.length());
            if (name.length() < minLength || name.length() > maxLength) continue;
            long index = indexOf(name);
            if (index < 0) continue;
            return new Position(Phase.COMBINATIONS, name.length(), index, i);
        }
        return null;
    }

    static long combinationCount(int length) {
        long count = 1;
        for (int i = 0; i < length; i++) {
            count *= ALPHABET.length();
        }
        return count;
    }

    /**
     * The combination at the given index among all combinations of the given length.
     */
    static String nameAt(int length, long index) {
        char[] chars = new char[length];
        for (int i = length - 1; i >= 0; i--) {
            chars[i] = ALPHABET.charAt((int) (index % ALPHABET.length()));
            index /= ALPHABET.length();
        }
        return new String(chars);
    }

    /**
     * Inverse of {@link #nameAt(int, long)}, or -1 if the name contains a character outside the alphabet.
     */
    static long indexOf(String name) {
        long index = 0;
        for (int i = 0; i < name.length(); i++) {
            int digit = ALPHABET.indexOf(name.charAt(i));
            if (digit < 0) return -1;
            index = index * ALPHABET.length() + digit;
        }
        return index;
    }

    private void closeReader() {
        if (reader == null) return;
        try {
            reader.close();
        } catch (IOException e) {
            log.warn("Error closing word list {}", wordList, e);
        }
        reader = null;
    }

    @Override
    public void close() {
        closeReader();
        phase = Phase.EXHAUSTED;
    }
}
