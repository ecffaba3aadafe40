package fr.lapetina.imagebatch.coordinator;

import fr.lapetina.imagebatch.domain.format.FormatCache;
import fr.lapetina.imagebatch.domain.model.BatchReport;
import fr.lapetina.imagebatch.domain.model.JobOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Accumulates the outcomes of one batch in completion order.
 *
 * Workers call {@link #record(JobOutcome)} concurrently; the submitting thread waits in
 * {@link #await()} until every job has reported, then builds the report.
 */
final class BatchTracker {

    private static final Logger log = LoggerFactory.getLogger(BatchTracker.class);

    private static final Comparator<JobOutcome> BY_INPUT = Comparator.comparing(JobOutcome::input);

    private final int totalJobs;
    private final int workers;
    private final FormatCache formatCache = new FormatCache();
    private final CountDownLatch remaining;
    private final Instant startedAt;
    private final long startNanos;

    // Guarded by this
    private final List<JobOutcome> completed = new ArrayList<>();
    private final List<JobOutcome> failures = new ArrayList<>();
    private Duration completedTime = Duration.ZERO;
    private long endNanos;
    private Instant completedAt;

    BatchTracker(int totalJobs, int workers) {
        this.totalJobs = totalJobs;
        this.workers = workers;
        this.remaining = new CountDownLatch(totalJobs);
        this.startedAt = Instant.now();
        this.startNanos = System.nanoTime();
    }

    /**
     * Folds one outcome into the batch. Outcomes beyond the submitted count are ignored.
     */
    void record(JobOutcome outcome) {
        synchronized (this) {
            if (completed.size() + failures.size() >= totalJobs) {
                log.warn("Ignoring outcome beyond batch size: totalJobs={}, outcome={}", totalJobs, outcome);
                return;
            }
            if (outcome.isSuccess()) {
                completed.add(outcome);
                completedTime = completedTime.plus(outcome.elapsed());
            } else {
                failures.add(outcome);
            }
            if (completed.size() + failures.size() == totalJobs) {
                endNanos = System.nanoTime();
                completedAt = Instant.now();
            }
        }
        remaining.countDown();
    }

    /**
     * Blocks until every job has reported.
     */
    void await() throws InterruptedException {
        remaining.await();
    }

    boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return remaining.await(timeout, unit);
    }

    long pending() {
        return remaining.getCount();
    }

    FormatCache formatCache() {
        return formatCache;
    }

    /**
     * Builds the final report. Only valid once {@link #await()} has returned.
     */
    synchronized BatchReport toReport() {
        if (remaining.getCount() != 0) {
            throw new IllegalStateException("Batch still running: pending=" + remaining.getCount());
        }

        List<JobOutcome> sortedCompleted = new ArrayList<>(completed);
        sortedCompleted.sort(BY_INPUT);
        List<JobOutcome> sortedFailures = new ArrayList<>(failures);
        sortedFailures.sort(BY_INPUT);

        Duration average = completed.isEmpty()
                ? Duration.ZERO
                : completedTime.dividedBy(completed.size());

        return new BatchReport(
                totalJobs,
                completed.size(),
                failures.size(),
                workers,
                startedAt,
                completedAt,
                Duration.ofNanos(endNanos - startNanos),
                average,
                sortedFailures,
                sortedCompleted
        );
    }
}
