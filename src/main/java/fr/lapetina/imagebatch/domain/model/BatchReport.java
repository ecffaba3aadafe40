package fr.lapetina.imagebatch.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Aggregate summary of one batch, finalized once every job has produced an outcome.
 * Immutable and thread-safe.
 *
 * @param totalJobs            number of submitted jobs
 * @param processedCount       completed jobs
 * @param errorCount           failed jobs
 * @param workers              worker count the batch ran with
 * @param startedAt            when dispatch began
 * @param completedAt          when the last outcome arrived
 * @param totalTime            wall-clock time of the whole batch
 * @param averageTimePerImage  mean elapsed time of completed jobs, zero when none completed
 * @param failures             failed outcomes sorted by input path
 * @param completed            completed outcomes sorted by input path
 */
public record BatchReport(
        int totalJobs,
        int processedCount,
        int errorCount,
        int workers,
        Instant startedAt,
        Instant completedAt,
        Duration totalTime,
        Duration averageTimePerImage,
        List<JobOutcome> failures,
        List<JobOutcome> completed
) {
    public BatchReport {
        failures = failures != null ? List.copyOf(failures) : List.of();
        completed = completed != null ? List.copyOf(completed) : List.of();
        if (processedCount + errorCount != totalJobs) {
            throw new IllegalStateException("Outcome count mismatch: processed=" + processedCount
                    + ", errors=" + errorCount + ", submitted=" + totalJobs);
        }
    }

    /**
     * Report for a batch with nothing to do.
     */
    public static BatchReport empty(int workers) {
        Instant now = Instant.now();
        return new BatchReport(0, 0, 0, workers, now, now, Duration.ZERO, Duration.ZERO, List.of(), List.of());
    }

    public boolean hasFailures() {
        return errorCount > 0;
    }

    /**
     * Sum of per-image processing times, which exceeds {@link #totalTime()} when workers overlap.
     */
    public Duration cumulativeProcessingTime() {
        return completed.stream()
                .map(JobOutcome::elapsed)
                .reduce(Duration.ZERO, Duration::plus);
    }
}
