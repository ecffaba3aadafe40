package fr.lapetina.imagebatch.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.imagebatch.domain.model.BatchReport;
import fr.lapetina.imagebatch.report.dto.BatchReportDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Writes batch reports as JSON files named {@code batch_report_<yyyyMMdd_HHmmss>.json}.
 */
public final class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Path reportDirectory;
    private final ZoneId zone;
    private final ObjectMapper objectMapper;

    public ReportWriter(Path reportDirectory) {
        this(reportDirectory, ZoneId.systemDefault());
    }

    public ReportWriter(Path reportDirectory, ZoneId zone) {
        this.reportDirectory = reportDirectory;
        this.zone = zone;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Serializes the report to its JSON document.
     */
    public String toJson(BatchReport report) throws JsonProcessingException {
        return objectMapper.writeValueAsString(BatchReportDocument.from(report));
    }

    /**
     * Writes the report into the report directory, creating it if needed.
     *
     * @return the written file
     */
    public Path write(BatchReport report) throws IOException {
        Files.createDirectories(reportDirectory);
        Instant stamp = report.completedAt() != null ? report.completedAt() : Instant.now();
        Path file = reportDirectory.resolve(fileNameFor(stamp));

        Files.writeString(file, toJson(report));

        log.info("Report written: path={}, processed={}, errors={}",
                file, report.processedCount(), report.errorCount());
        return file;
    }

    String fileNameFor(Instant instant) {
        return "batch_report_" + FILE_TIMESTAMP.format(instant.atZone(zone)) + ".json";
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }

    public Path getReportDirectory() {
        return reportDirectory;
    }
}
