package fr.lapetina.imagebatch.infrastructure.io;

import fr.lapetina.imagebatch.domain.model.JobPaths;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobPlannerTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should keep supported files sorted by name with prefixed outputs")
    void shouldPlanSupportedFiles() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("in"));
        Path output = tempDir.resolve("out");
        for (String name : List.of("c.bmp", "a.jpg", "B.PNG", "notes.txt", "d.tiff", "e.jpeg", "f.gif")) {
            Files.writeString(input.resolve(name), "x");
        }
        Files.createDirectories(input.resolve("sub.png"));

        List<JobPaths> plan = JobPlanner.withDefaults().plan(input, output);

        assertThat(plan).extracting(p -> p.input().getFileName().toString())
                .containsExactly("B.PNG", "a.jpg", "c.bmp", "d.tiff", "e.jpeg");
        assertThat(plan.get(1).output()).isEqualTo(output.resolve("processed_a.jpg"));
        assertThat(output).isDirectory();
    }

    @Test
    @DisplayName("should normalize configured extensions")
    void shouldNormalizeExtensions() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("in"));
        Files.writeString(input.resolve("a.png"), "x");
        Files.writeString(input.resolve("b.jpg"), "x");

        JobPlanner planner = new JobPlanner(Set.of("PNG"), "");
        List<JobPaths> plan = planner.plan(input, tempDir.resolve("out"));

        assertThat(planner.getExtensions()).containsExactly(".png");
        assertThat(plan).hasSize(1);
        assertThat(plan.get(0).output().getFileName().toString()).isEqualTo("a.png");
    }

    @Test
    @DisplayName("should return an empty plan for an empty directory")
    void shouldReturnEmptyPlan() throws Exception {
        Path input = Files.createDirectories(tempDir.resolve("in"));

        assertThat(JobPlanner.withDefaults().plan(input, tempDir.resolve("out"))).isEmpty();
    }

    @Test
    @DisplayName("should fail when the input directory is missing")
    void shouldFailOnMissingInput() {
        assertThatThrownBy(() -> JobPlanner.withDefaults().plan(tempDir.resolve("nope"), tempDir.resolve("out")))
                .isInstanceOf(NoSuchFileException.class);
    }
}
