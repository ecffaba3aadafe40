package fr.lapetina.imagebatch.infrastructure.io;

import fr.lapetina.imagebatch.domain.model.JobPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Turns an input directory into the list of (input, output) pairs of a batch.
 *
 * Only regular files directly inside the input directory whose extension is supported are
 * kept. Outputs are named {@code <prefix><original filename>} inside the output directory.
 * The result is sorted by filename.
 */
public final class JobPlanner {

    private static final Logger log = LoggerFactory.getLogger(JobPlanner.class);

    public static final Set<String> DEFAULT_EXTENSIONS = Set.of(".jpg", ".jpeg", ".png", ".bmp", ".tiff");
    public static final String DEFAULT_PREFIX = "processed_";

    private final Set<String> extensions;
    private final String outputPrefix;

    public JobPlanner(Set<String> extensions, String outputPrefix) {
        this.extensions = normalize(extensions);
        this.outputPrefix = outputPrefix != null ? outputPrefix : "";
    }

    public static JobPlanner withDefaults() {
        return new JobPlanner(DEFAULT_EXTENSIONS, DEFAULT_PREFIX);
    }

    /**
     * Lists the input directory and creates the output directory.
     *
     * @throws IOException if the input directory is missing or unreadable, or the output
     *                     directory cannot be created
     */
    public List<JobPaths> plan(Path inputDir, Path outputDir) throws IOException {
        if (!Files.exists(inputDir)) {
            throw new NoSuchFileException(inputDir.toString(), null, "Input directory does not exist");
        }
        if (!Files.isDirectory(inputDir)) {
            throw new NotDirectoryException(inputDir.toString());
        }
        Files.createDirectories(outputDir);

        List<JobPaths> jobs;
        try (Stream<Path> entries = Files.list(inputDir)) {
            jobs = entries
                    .filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .map(p -> new JobPaths(p, outputDir.resolve(outputPrefix + p.getFileName())))
                    .collect(Collectors.toList());
        }

        log.info("Planned {} jobs: inputDir={}, outputDir={}", jobs.size(), inputDir, outputDir);
        return jobs;
    }

    public boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String extension : extensions) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    public Set<String> getExtensions() {
        return extensions;
    }

    public String getOutputPrefix() {
        return outputPrefix;
    }

    private static Set<String> normalize(Set<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            return DEFAULT_EXTENSIONS;
        }
        return extensions.stream()
                .map(e -> e.trim().toLowerCase(Locale.ROOT))
                .filter(e -> !e.isEmpty())
                .map(e -> e.startsWith(".") ? e : "." + e)
                .collect(Collectors.toUnmodifiableSet());
    }
}
