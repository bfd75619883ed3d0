package org.netpreserve.domainprober.fetch;

public class TransportTimeoutException extends TransportException {
    public TransportTimeoutException(String message) {
        super(message);
    }
}
