package org.netpreserve.domainprober.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.domainprober.util.DurationDeserializer;

import java.time.Duration;
import java.util.List;

/**
 * How probing behaves.
 *
 * @param workers            number of probes running at once
 * @param timeout            time allowed for a whole request, after which the candidate counts as empty
 * @param userAgents         User-Agent strings, one picked at random per request
 * @param checkpointInterval flush the outcome log after this many records
 * @param progressInterval   how often to log progress
 */
public record ProbeSettings(
        int workers,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration timeout,
        List<String> userAgents,
        int checkpointInterval,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration progressInterval) {

    public ProbeSettings withWorkers(int workers) {
        return new ProbeSettings(workers, timeout, userAgents, checkpointInterval, progressInterval);
    }
}
