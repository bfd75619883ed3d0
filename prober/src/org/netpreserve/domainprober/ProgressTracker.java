package org.netpreserve.domainprober;

import org.netpreserve.domainprober.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodically logs the current probe progress. It only ever sees published snapshots.
 */
public class ProgressTracker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);
    private final ScheduledExecutorService scheduler =
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("progress"));
    private final Duration interval;
    private ScheduledFuture<?> snapshotTask;
    private Supplier<Progress> source;
    private volatile Instant sessionStartTime;

    public ProgressTracker(Duration interval) {
        this.interval = interval;
    }

    public synchronized void startSession(Supplier<Progress> source) {
        if (snapshotTask != null) return;
        this.source = source;
        sessionStartTime = Instant.now();
        long millis = Math.max(1, interval.toMillis());
        snapshotTask = scheduler.scheduleAtFixedRate(this::snapshot, millis, millis, TimeUnit.MILLISECONDS);
    }

    public synchronized void stopSession() {
        if (snapshotTask == null) return;
        snapshotTask.cancel(false);
        snapshotTask = null;
        snapshot();
        sessionStartTime = null;
    }

    private synchronized void snapshot() {
        Instant start = sessionStartTime;
        if (start == null) return;
        log.info(format(source.get(), Duration.between(start, Instant.now())));
    }

    static String format(Progress progress, Duration runtime) {
        double seconds = Math.max(1, runtime.toSeconds());
        return String.format(Locale.ROOT, "Progress after %ds: %d generated, %d skipped, %d probed (%.1f/s), %d live, " +
                             "%d parked, %d empty, %d errors, %d in flight",
                runtime.toSeconds(), progress.generated(), progress.skipped(), progress.completed(),
                progress.completed() / seconds, progress.live(), progress.parked(), progress.empty(),
                progress.errors(), progress.inFlight());
    }

    @Override
    public void close() {
        stopSession();
        scheduler.shutdownNow();
    }
}
