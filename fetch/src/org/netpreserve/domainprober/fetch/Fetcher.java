package org.netpreserve.domainprober.fetch;

import org.netpreserve.domainprober.util.Url;

import java.time.Duration;
import java.util.Map;

/**
 * Performs a single GET request and returns the response status and decoded body.
 * <p>
 * Implementations must give up once {@code timeout} has elapsed and report it as a
 * {@link TransportTimeoutException}. They must not retry.
 */
@FunctionalInterface
public interface Fetcher {
    FetchResponse fetch(Url url, Duration timeout, Map<String, String> headers)
            throws TransportException, InterruptedException;
}
