package org.netpreserve.domainprober.config;

/**
 * Storage configuration.
 *
 * @param outcomeLog  append-only log of candidates found not to be live
 * @param discoveries JSON listing of live candidates
 */
public record StorageConfig(
        String outcomeLog,
        String discoveries
) {
}
