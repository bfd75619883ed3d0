package org.netpreserve.domainprober.config;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Candidate generation.
 *
 * @param wordList       newline-delimited file of base names, probed before the combinations
 * @param suffixes       suffixes appended to every base name, in order (e.g. com, net)
 * @param scheme         URL scheme of the generated candidates
 * @param comboLength    length of the shortest generated combination
 * @param maxComboLength length of the longest generated combination, unbounded if null
 */
public record CandidatesConfig(
        @Nullable String wordList,
        List<String> suffixes,
        String scheme,
        int comboLength,
        @Nullable Integer maxComboLength) {

    public CandidatesConfig withWordList(String wordList) {
        return new CandidatesConfig(wordList, suffixes, scheme, comboLength, maxComboLength);
    }

    public CandidatesConfig withSuffixes(List<String> suffixes) {
        return new CandidatesConfig(wordList, suffixes, scheme, comboLength, maxComboLength);
    }

    public CandidatesConfig withComboLength(int comboLength) {
        return new CandidatesConfig(wordList, suffixes, scheme, comboLength, maxComboLength);
    }

    public CandidatesConfig withMaxComboLength(Integer maxComboLength) {
        return new CandidatesConfig(wordList, suffixes, scheme, comboLength, maxComboLength);
    }
}
