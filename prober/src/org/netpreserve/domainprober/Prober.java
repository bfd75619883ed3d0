package org.netpreserve.domainprober;

import org.netpreserve.domainprober.Classifier.Classification;
import org.netpreserve.domainprober.fetch.Fetcher;
import org.netpreserve.domainprober.fetch.TransportException;
import org.netpreserve.domainprober.util.LogUtils;
import org.netpreserve.domainprober.util.NamedThreadFactory;
import org.netpreserve.domainprober.util.Url;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Probes candidates with a fixed pool of workers.
 * <p>
 * {@link #run} is the coordinator: it draws candidates, drops those whose outcome is already known,
 * hands the rest to the workers and records each result. Workers only fetch and classify; they
 * never touch the outcome sets or the stores.
 * <p>
 * Live results are stored as soon as they arrive. Other results are released to the outcome log
 * in the order the candidates were submitted, so that the last line of the log is always preceded
 * by outcomes for every earlier candidate. A crash can therefore cause some candidates to be
 * probed again but never causes one to be skipped on resume.
 */
public class Prober implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Prober.class);
    private static final long POLL_MILLIS = 100;
    private final Fetcher fetcher;
    private final Classifier classifier;
    private final Supplier<String> userAgents;
    private final OutcomeLog outcomeLog;
    private final DiscoveryStore discoveryStore;
    private final int workers;
    private final int maxInFlight;
    private final Duration timeout;
    private final int checkpointInterval;
    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile boolean closed;
    private volatile boolean running;
    private volatile Progress progress = Progress.EMPTY;

    // coordinator state
    private final Map<Future<ProbeResult>, Pending> pending = new HashMap<>();
    private final Set<Url> inFlight = new HashSet<>();
    private final TreeMap<Long, ProbeResult> completed = new TreeMap<>();
    private long nextSequence;
    private long nextToRelease;
    private int sinceCheckpoint;
    private long generated, skipped, submitted, found, parked, empty, errors;

    public Prober(Fetcher fetcher, Classifier classifier, Supplier<String> userAgents, OutcomeLog outcomeLog,
                  DiscoveryStore discoveryStore, int workers, Duration timeout, int checkpointInterval) {
        if (workers < 1) throw new IllegalArgumentException("workers must be at least 1");
        this.fetcher = fetcher;
        this.classifier = classifier;
        this.userAgents = userAgents;
        this.outcomeLog = outcomeLog;
        this.discoveryStore = discoveryStore;
        this.workers = workers;
        this.maxInFlight = workers * 2;
        this.timeout = timeout;
        this.checkpointInterval = Math.max(1, checkpointInterval);
    }

    private record Pending(long sequence, Url url) {
    }

    /**
     * @param reason why the outcome was chosen, for logging only
     */
    record ProbeResult(Url url, Outcome outcome, String reason, long fetchTimeMs) {
    }

    /**
     * Probes every candidate not already in {@code notLive} or {@code live}, adding each result to
     * the matching set. Returns when the candidates are exhausted and every probe has completed, or
     * soon after {@link #close()} is called.
     *
     * @param notLive candidates known not to be live, owned by the caller but updated by this method
     * @param live    candidates known to be live, likewise
     */
    public Progress run(Iterator<Url> candidates, Set<Url> notLive, Set<Url> live) throws InterruptedException {
        if (running) throw new IllegalStateException("Already running");
        running = true;
        ExecutorService executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory("probe-worker"));
        CompletionService<ProbeResult> completionService = new ExecutorCompletionService<>(executor);
        try {
            while (!closed && candidates.hasNext()) {
                Url candidate = candidates.next();
                generated++;
                if (notLive.contains(candidate) || live.contains(candidate) || inFlight.contains(candidate)) {
                    skipped++;
                    if (skipped % 1024 == 0) publishProgress();
                    continue;
                }
                var future = completionService.submit(() -> probe(candidate));
                pending.put(future, new Pending(nextSequence++, candidate));
                inFlight.add(candidate);
                submitted++;
                drainCompleted(completionService, notLive, live, maxInFlight);
                publishProgress();
            }
            drainCompleted(completionService, notLive, live, 1);
        } finally {
            // whatever is still in flight is abandoned and will be probed again next run
            executor.shutdownNow();
            try {
                outcomeLog.checkpoint();
            } finally {
                publishProgress();
                if (!pending.isEmpty()) {
                    log.info("Abandoned {} probes still in flight", pending.size());
                }
                finished.countDown();
            }
        }
        return progress;
    }

    /**
     * Handles completed probes, blocking while at least {@code threshold} probes are in flight.
     */
    private void drainCompleted(CompletionService<ProbeResult> completionService, Set<Url> notLive,
                                Set<Url> live, int threshold) throws InterruptedException {
        Future<ProbeResult> future;
        while ((future = completionService.poll()) != null) {
            complete(future, notLive, live);
        }
        while (!closed && pending.size() >= threshold) {
            future = completionService.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (future != null) complete(future, notLive, live);
        }
    }

    private void complete(Future<ProbeResult> future, Set<Url> notLive, Set<Url> live) {
        Pending job = pending.remove(future);
        inFlight.remove(job.url());
        ProbeResult result;
        try {
            result = future.get();
        } catch (ExecutionException e) {
            log.error("Unexpected error probing {}", job.url(), e.getCause());
            result = new ProbeResult(job.url(), Outcome.ERROR, String.valueOf(e.getCause()), 0);
        } catch (InterruptedException e) {
            // can't happen: the future is already done
            Thread.currentThread().interrupt();
            return;
        }

        log.atDebug().addKeyValue("url", result.url())
                .addKeyValue("outcome", result.outcome())
                .addKeyValue("fetchTimeMs", result.fetchTimeMs())
                .log("Probed {}: {} ({})", result.url(), result.outcome(), result.reason());

        switch (result.outcome()) {
            case LIVE -> {
                live.add(result.url());
                found++;
                int total = discoveryStore.mergeAndPersist(Set.of(result.url()));
                log.atInfo().addKeyValue("url", result.url())
                        .log("Found {} ({} discoveries)", result.url(), total);
            }
            case PARKED -> parked++;
            case EMPTY -> empty++;
            case ERROR -> errors++;
        }
        if (!result.outcome().isLive()) notLive.add(result.url());

        completed.put(job.sequence(), result);
        release();
        if (sinceCheckpoint >= checkpointInterval || result.outcome().isLive()) {
            outcomeLog.checkpoint();
            sinceCheckpoint = 0;
        }
        publishProgress();
    }

    /**
     * Writes not-live outcomes to the log for the longest run of completed candidates following the
     * last one released.
     */
    private void release() {
        ProbeResult result;
        while ((result = completed.remove(nextToRelease)) != null) {
            nextToRelease++;
            if (!result.outcome().isLive() && outcomeLog.recordNotLive(result.url())) {
                sinceCheckpoint++;
            }
        }
    }

    private ProbeResult probe(Url url) throws InterruptedException {
        long start = System.nanoTime();
        Classification classification;
        try {
            var response = fetcher.fetch(url, timeout, Map.of("User-Agent", userAgents.get()));
            classification = classifier.classify(response.status(), response.body());
            if (classification.outcome() == Outcome.PARKED && log.isTraceEnabled()) {
                log.trace("Placeholder body from {}: {}", url, LogUtils.ellipses(response.body()));
            }
        } catch (TransportException e) {
            classification = classifier.classify(e);
        }
        long fetchTimeMs = (System.nanoTime() - start) / 1_000_000;
        return new ProbeResult(url, classification.outcome(), classification.reason(), fetchTimeMs);
    }

    private void publishProgress() {
        progress = new Progress(generated, skipped, submitted, found, parked, empty, errors, pending.size());
    }

    /**
     * The latest counters. Safe to call from any thread.
     */
    public Progress progress() {
        return progress;
    }

    /**
     * Stops the run: no further candidates are submitted and probes still in flight are abandoned.
     * Waits for the coordinator to record what has completed. Safe to call from any thread.
     */
    @Override
    public void close() {
        closed = true;
        if (!running) return;
        try {
            if (!finished.await(30, TimeUnit.SECONDS)) {
                log.warn("Timed out waiting for probing to stop");
            }
        } catch (InterruptedException e) {
            log.warn("Interrupted while waiting for probing to stop", e);
            Thread.currentThread().interrupt();
        }
    }
}
