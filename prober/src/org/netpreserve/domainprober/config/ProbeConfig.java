package org.netpreserve.domainprober.config;

/**
 * Root configuration for a probe job.
 *
 * @param candidates what to probe (word list, suffixes, combinations)
 * @param probe      how to probe (workers, timeout, user agents, checkpointing)
 * @param classifier how to judge a response
 * @param storage    where outcomes and discoveries are kept, relative to the job directory
 * @param resume     continue after the last recorded outcome instead of starting from the first candidate
 */
public record ProbeConfig(
        CandidatesConfig candidates,
        ProbeSettings probe,
        ClassifierConfig classifier,
        StorageConfig storage,
        boolean resume
) {
    public ProbeConfig withCandidates(CandidatesConfig candidates) {
        return new ProbeConfig(candidates, probe, classifier, storage, resume);
    }

    public ProbeConfig withProbe(ProbeSettings probe) {
        return new ProbeConfig(candidates, probe, classifier, storage, resume);
    }

    public ProbeConfig withResume(boolean resume) {
        return new ProbeConfig(candidates, probe, classifier, storage, resume);
    }
}
