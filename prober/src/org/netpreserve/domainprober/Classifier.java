package org.netpreserve.domainprober;

import org.netpreserve.domainprober.config.ClassifierConfig;
import org.netpreserve.domainprober.fetch.TransportException;
import org.netpreserve.domainprober.fetch.TransportTimeoutException;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Judges a single probe response. Stateless apart from its configuration, so it is safe to share
 * between workers.
 */
public class Classifier {
    private final int minContentLength;
    private final List<String> parkedPhrases;

    public Classifier(ClassifierConfig config) {
        this(config.minContentLength(), config.parkedPhrases());
    }

    public Classifier(int minContentLength, List<String> parkedPhrases) {
        this.minContentLength = minContentLength;
        this.parkedPhrases = parkedPhrases == null ? List.of() : parkedPhrases.stream()
                .filter(Objects::nonNull)
                .filter(phrase -> !phrase.isBlank())
                .map(phrase -> phrase.toLowerCase(Locale.ROOT))
                .toList();
    }

    public Classification classify(int status, String body) {
        if (status != 200) {
            return new Classification(Outcome.EMPTY, "HTTP " + status);
        }
        if (body == null || body.length() < minContentLength) {
            return new Classification(Outcome.PARKED, "body only " + (body == null ? 0 : body.length()) + " chars");
        }
        String lowerBody = body.toLowerCase(Locale.ROOT);
        for (String phrase : parkedPhrases) {
            if (lowerBody.contains(phrase)) {
                return new Classification(Outcome.PARKED, "contains \"" + phrase + "\"");
            }
        }
        return new Classification(Outcome.LIVE, "HTTP 200, " + body.length() + " chars");
    }

    public Classification classify(TransportException e) {
        return new Classification(Outcome.EMPTY, e instanceof TransportTimeoutException ? "timeout" : e.getMessage());
    }

    /**
     * @param reason human-readable explanation, only ever logged
     */
    public record Classification(Outcome outcome, String reason) {
    }
}
