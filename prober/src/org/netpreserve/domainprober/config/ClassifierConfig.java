package org.netpreserve.domainprober.config;

import java.util.List;

/**
 * @param minContentLength bodies shorter than this many characters are treated as placeholders
 * @param parkedPhrases    phrases (case-insensitive) that mark a parking or for-sale page
 */
public record ClassifierConfig(
        int minContentLength,
        List<String> parkedPhrases) {
}
