package fr.lapetina.imagebatch.report.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.imagebatch.domain.model.BatchReport;
import fr.lapetina.imagebatch.domain.model.JobOutcome;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON document written for a finished batch.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BatchReportDocument {

    @JsonProperty("total_jobs")
    private int totalJobs;

    @JsonProperty("processed_count")
    private int processedCount;

    @JsonProperty("error_count")
    private int errorCount;

    private int workers;

    @JsonProperty("started_at")
    private Instant startedAt;

    @JsonProperty("completed_at")
    private Instant completedAt;

    @JsonProperty("total_time_ms")
    private long totalTimeMs;

    @JsonProperty("average_time_per_image_ms")
    private double averageTimePerImageMs;

    private List<Entry> failures = new ArrayList<>();

    private List<Entry> completed = new ArrayList<>();

    // Getters and setters
    public int getTotalJobs() { return totalJobs; }
    public void setTotalJobs(int totalJobs) { this.totalJobs = totalJobs; }

    public int getProcessedCount() { return processedCount; }
    public void setProcessedCount(int processedCount) { this.processedCount = processedCount; }

    public int getErrorCount() { return errorCount; }
    public void setErrorCount(int errorCount) { this.errorCount = errorCount; }

    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public long getTotalTimeMs() { return totalTimeMs; }
    public void setTotalTimeMs(long totalTimeMs) { this.totalTimeMs = totalTimeMs; }

    public double getAverageTimePerImageMs() { return averageTimePerImageMs; }
    public void setAverageTimePerImageMs(double averageTimePerImageMs) { this.averageTimePerImageMs = averageTimePerImageMs; }

    public List<Entry> getFailures() { return failures; }
    public void setFailures(List<Entry> failures) { this.failures = failures; }

    public List<Entry> getCompleted() { return completed; }
    public void setCompleted(List<Entry> completed) { this.completed = completed; }

    /**
     * Creates a document from a batch report.
     */
    public static BatchReportDocument from(BatchReport report) {
        BatchReportDocument doc = new BatchReportDocument();
        doc.setTotalJobs(report.totalJobs());
        doc.setProcessedCount(report.processedCount());
        doc.setErrorCount(report.errorCount());
        doc.setWorkers(report.workers());
        doc.setStartedAt(report.startedAt());
        doc.setCompletedAt(report.completedAt());
        doc.setTotalTimeMs(report.totalTime().toMillis());
        doc.setAverageTimePerImageMs(report.averageTimePerImage().toNanos() / 1_000_000.0);

        List<Entry> failures = new ArrayList<>();
        for (JobOutcome outcome : report.failures()) {
            failures.add(Entry.from(outcome));
        }
        doc.setFailures(failures);

        List<Entry> completed = new ArrayList<>();
        for (JobOutcome outcome : report.completed()) {
            completed.add(Entry.from(outcome));
        }
        doc.setCompleted(completed);
        return doc;
    }

    /**
     * One job outcome. Completed entries carry output, codec and timing; failed entries
     * carry the error kind and message.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {

        private String input;
        private String output;
        private String codec;

        @JsonProperty("elapsed_ms")
        private Long elapsedMs;

        @JsonProperty("error_kind")
        private String errorKind;

        private String error;

        public String getInput() { return input; }
        public void setInput(String input) { this.input = input; }

        public String getOutput() { return output; }
        public void setOutput(String output) { this.output = output; }

        public String getCodec() { return codec; }
        public void setCodec(String codec) { this.codec = codec; }

        public Long getElapsedMs() { return elapsedMs; }
        public void setElapsedMs(Long elapsedMs) { this.elapsedMs = elapsedMs; }

        public String getErrorKind() { return errorKind; }
        public void setErrorKind(String errorKind) { this.errorKind = errorKind; }

        public String getError() { return error; }
        public void setError(String error) { this.error = error; }

        public static Entry from(JobOutcome outcome) {
            Entry entry = new Entry();
            entry.setInput(outcome.input().toString());
            if (outcome.isSuccess()) {
                entry.setOutput(outcome.output().toString());
                entry.setCodec(outcome.codec() != null ? outcome.codec().name() : null);
                entry.setElapsedMs(outcome.elapsed().toMillis());
            } else {
                entry.setErrorKind(outcome.errorKind().name());
                entry.setError(outcome.errorMessage());
            }
            return entry;
        }
    }
}
