package org.netpreserve.domainprober;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.domainprober.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Positions a fresh {@link CandidateSource} so a run carries on from where the previous one stopped.
 * <p>
 * The cursor is the last line of the outcome log. Because the log is written in submission order
 * every candidate up to and including the cursor already has an outcome, so generation restarts
 * immediately after it. Candidates after the cursor whose outcome is known are still dropped by
 * the prober's skip-filter.
 */
public class ResumeController {
    private static final Logger log = LoggerFactory.getLogger(ResumeController.class);
    private final boolean enabled;

    public ResumeController(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * @return the position generation will start from
     */
    public CandidateSource.Position position(CandidateSource source, @Nullable Url cursor) throws GenerationException {
        if (!enabled) {
            log.info("Resume disabled, starting from the first candidate");
            source.seek(CandidateSource.Position.START);
        } else if (cursor == null) {
            log.info("No previous outcomes, starting from the first candidate");
            source.seek(CandidateSource.Position.START);
        } else if (source.seekAfter(cursor)) {
            log.info("Resuming after {} at {}", cursor, source.position());
        } else {
            log.warn("Resume cursor {} is not part of the configured candidates, starting from the first candidate",
                    cursor);
        }
        return source.position();
    }
}
