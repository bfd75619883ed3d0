package org.netpreserve.domainprober;

import org.netpreserve.domainprober.config.ProbeConfig;
import org.netpreserve.domainprober.fetch.Fetcher;
import org.netpreserve.domainprober.fetch.HttpFetcher;
import org.netpreserve.domainprober.fetch.UserAgents;
import org.netpreserve.domainprober.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A single probing run over a job directory.
 */
public class Job implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Job.class);
    private final ProbeConfig config;
    private final Fetcher fetcher;
    private final OutcomeLog outcomeLog;
    private final DiscoveryStore discoveryStore;
    private final ProgressTracker progressTracker;
    private final Lock startStopLock = new ReentrantLock();
    private volatile State state = State.STOPPED;
    private volatile Prober prober;
    private boolean closed;

    public enum State {
        STOPPED, RUNNING, STOPPING
    }

    public Job(Path jobDir, ProbeConfig config) {
        this(jobDir, config, new HttpFetcher(config.probe().timeout()));
    }

    public Job(Path jobDir, ProbeConfig config, Fetcher fetcher) {
        this.config = config;
        this.fetcher = fetcher;
        this.outcomeLog = new OutcomeLog(jobDir.resolve(config.storage().outcomeLog()));
        this.discoveryStore = new DiscoveryStore(jobDir.resolve(config.storage().discoveries()));
        this.progressTracker = new ProgressTracker(config.probe().progressInterval());
    }

    /**
     * Probes every configured candidate that has no known outcome yet. Blocks until the candidates
     * run out or the job is closed.
     */
    public Progress run() throws BadStateException, GenerationException, InterruptedException {
        Prober prober;
        if (!startStopLock.tryLock()) throw new BadStateException("Job busy " + state);
        try {
            if (closed) throw new BadStateException("Job is closed");
            if (state != State.STOPPED) throw new BadStateException("Can only run a STOPPED job");
            var probe = config.probe();
            prober = new Prober(fetcher, new Classifier(config.classifier()), new UserAgents(probe.userAgents()),
                    outcomeLog, discoveryStore, probe.workers(), probe.timeout(), probe.checkpointInterval());
            this.prober = prober;
            state = State.RUNNING;
        } finally {
            startStopLock.unlock();
        }

        try (CandidateSource source = CandidateSource.open(config.candidates())) {
            OutcomeLog.State outcomes = outcomeLog.load();
            Set<Url> live = discoveryStore.load();
            log.info("Loaded {} outcomes from {} and {} discoveries from {}", outcomes.members().size(),
                    outcomeLog.path(), live.size(), discoveryStore.path());

            new ResumeController(config.resume()).position(source, outcomes.cursor());

            progressTracker.startSession(prober::progress);
            try {
                Progress progress = prober.run(source, new HashSet<>(outcomes.members()), live);
                log.info("Probing finished: {} probed, {} live, {} discoveries in total",
                        progress.completed(), progress.live(), discoveryStore.size());
                return progress;
            } finally {
                progressTracker.stopSession();
            }
        } finally {
            startStopLock.lock();
            try {
                if (state == State.RUNNING) state = State.STOPPED;
            } finally {
                startStopLock.unlock();
            }
        }
    }

    /**
     * Stops a running job, waiting for completed probes to be recorded, then releases its resources.
     * Safe to call more than once and from any thread.
     */
    @Override
    public void close() {
        startStopLock.lock();
        try {
            if (closed) return;
            closed = true;
            state = State.STOPPING;
            Prober prober = this.prober;
            if (prober != null) {
                try {
                    prober.close();
                } catch (Exception e) {
                    log.error("Failed to stop prober", e);
                }
            }
            try {
                outcomeLog.close();
            } catch (Exception e) {
                log.error("Failed to close outcome log", e);
            }
            try {
                progressTracker.close();
            } catch (Exception e) {
                log.error("Failed to close progress tracker", e);
            }
            state = State.STOPPED;
        } finally {
            startStopLock.unlock();
        }
    }

    public Progress progress() {
        Prober prober = this.prober;
        return prober == null ? Progress.EMPTY : prober.progress();
    }

    public ProbeConfig config() {
        return config;
    }

    public State state() {
        return state;
    }

    public static class BadStateException extends Exception {
        public BadStateException(String message) {
            super(message);
        }
    }
}
