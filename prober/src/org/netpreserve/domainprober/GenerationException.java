package org.netpreserve.domainprober;

import java.io.IOException;

/**
 * The word list could not be read. Probing never starts, or stops, when this happens.
 */
public class GenerationException extends IOException {
    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
