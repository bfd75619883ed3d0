package org.netpreserve.domainprober;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * An outcome or discovery could not be written (or the existing record could not be read back).
 * Fatal: carrying on would risk losing results that only exist in memory.
 */
public class PersistenceException extends UncheckedIOException {
    public PersistenceException(String message, IOException cause) {
        super(message, cause);
    }
}
