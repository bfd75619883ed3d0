package org.netpreserve.domainprober.fetch;

/**
 * The request never produced a usable response: connection failure, unresolvable or invalid host,
 * malformed response, or a timeout.
 */
public class TransportException extends Exception {
    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
