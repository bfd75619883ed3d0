package org.netpreserve.domainprober.util;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jetbrains.annotations.NotNull;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Objects;

/**
 * URL type which caches parsing. Two URLs are equal only if their strings are identical.
 */
public class Url implements Comparable<Url> {
    /**
     * Longest label allowed in a host name.
     */
    public static final int MAX_LABEL_LENGTH = 63;
    private final String url;
    private URI uri;

    @JsonCreator
    public Url(String url) {
        this.url = Objects.requireNonNull(url, "url");
    }

    /**
     * Builds the URL for the host {@code name.suffix}, e.g. {@code http://example.com}.
     */
    public static Url forHost(String scheme, String name, String suffix) {
        return new Url(scheme + "://" + name + "." + suffix);
    }

    public synchronized URI toURI() throws URISyntaxException {
        if (uri == null) {
            uri = new URI(url);
        }
        return uri;
    }

    /**
     * The host portion of the URL, or null if it can't be parsed.
     */
    public String host() {
        try {
            return toURI().getHost();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    /**
     * The leftmost label of the host, e.g. {@code example} for {@code http://example.com}.
     */
    public String firstLabel() {
        String host = host();
        if (host == null) return null;
        int i = host.indexOf('.');
        return i == -1 ? host : host.substring(0, i);
    }

    /**
     * True if the label is 1 to 63 ASCII letters, digits or hyphens and neither starts nor ends with a hyphen.
     */
    public static boolean isValidLabel(String label) {
        if (label.isEmpty() || label.length() > MAX_LABEL_LENGTH) return false;
        if (label.charAt(0) == '-' || label.charAt(label.length() - 1) == '-') return false;
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            if (!(c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c >= '0' && c <= '9' || c == '-')) return false;
        }
        return true;
    }

    @JsonValue
    public String toString() {
        return url;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        Url url1 = (Url) o;
        return url.equals(url1.url);
    }

    @Override
    public int hashCode() {
        return url.hashCode();
    }

    @Override
    public int compareTo(@NotNull Url o) {
        return url.compareTo(o.url);
    }
}
