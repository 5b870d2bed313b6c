package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ProcessGenerationPipelineTest {

    @TempDir
    Path outputRoot;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<String> events = Collections.synchronizedList(new ArrayList<>());
    private final ProgressListener recorder =
            (progress, message, status) -> events.add(progress + "|" + message + "|" + status);

    private final GenerationJob job = GenerationJob.builder()
            .jobId("job-42")
            .status(JobStatus.CLAIMED)
            .inputRef(Map.of("media_url", "https://example.com/a.mp4"))
            .build();

    private ProcessGenerationPipeline shell(String script, Duration timeout) {
        return new ProcessGenerationPipeline(List.of("sh", "-c", script, "pipeline"), outputRoot, timeout, objectMapper);
    }

    @Test
    void mapProgress_StageMarkersSpreadOverGenerationRange() {
        ProcessGenerationPipeline.mapProgress("[1/7] Loading model", recorder);
        ProcessGenerationPipeline.mapProgress("INFO [7/7]", recorder);
        ProcessGenerationPipeline.mapProgress("=== PIPELINE COMPLETE ===", recorder);
        ProcessGenerationPipeline.mapProgress("downloading weights 40%", recorder);
        ProcessGenerationPipeline.mapProgress("[9/7] bogus", recorder);

        assertThat(events).containsExactly(
                "25|Loading model|GENERATING",
                "85|Stage 7/7|GENERATING",
                "85|Running quality checks...|GENERATING");
    }

    @Test
    void mapProgress_OversizedStageNumbersAreNotMarkers() {
        ProcessGenerationPipeline.mapProgress("[99999999999/3] model warmup", recorder);
        ProcessGenerationPipeline.mapProgress("[2/99999999999999]", recorder);
        ProcessGenerationPipeline.mapProgress("[2/4] mixing", recorder);

        assertThat(events).containsExactly("50|mixing|GENERATING");
    }

    @Test
    void generate_WithoutCommand_Fails() {
        ProcessGenerationPipeline pipeline =
                new ProcessGenerationPipeline(List.of(), outputRoot, Duration.ofSeconds(5), objectMapper);

        assertThatThrownBy(() -> pipeline.generate(job, recorder))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("No generation command");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void generate_RunsCommandAndReadsScores() throws Exception {
        // Given - $6 is the output directory after --job-id, --input and --out are appended
        String script = "test -f \"$4\" || exit 9; "
                + "echo '[1/2] Separating stems'; echo '[2/2] Rendering loop'; echo 'PIPELINE COMPLETE'; "
                + "printf '{\"output_ref\":\"loops/job-42.mp4\",\"quality_score\":8.5,\"loop_score\":0.9}' "
                + "> \"$6/scores.json\"";

        // When
        GenerationResult result = shell(script, Duration.ofSeconds(30)).generate(job, recorder);

        // Then
        Path outputDir = outputRoot.resolve("job-42");
        assertThat(result.getOutputRef()).isEqualTo("loops/job-42.mp4");
        assertThat(result.getOutputDir()).isEqualTo(outputDir.toString());
        assertThat(result.getQualityScore()).isEqualTo(8.5);
        assertThat(result.getLoopScore()).isEqualTo(0.9);
        assertThat(objectMapper.readTree(outputDir.resolve("input.json").toFile()).get("media_url").asText())
                .isEqualTo("https://example.com/a.mp4");
        assertThat(events).containsExactly(
                "15|Starting generation pipeline...|GENERATING",
                "50|Separating stems|GENERATING",
                "85|Rendering loop|GENERATING",
                "85|Running quality checks...|GENERATING",
                "90|Collecting output...|UPLOADING");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void generate_ListenerErrorOnOutputLineKeepsDraining() throws Exception {
        // Given - more output than a pipe buffer holds after the failing line
        ProgressListener failingOnStages = (progress, message, status) -> {
            if (message.startsWith("Separating")) {
                throw new IllegalStateException("listener broke");
            }
            events.add(progress + "|" + message + "|" + status);
        };
        String script = "echo '[1/2] Separating stems'; seq 1 30000; echo '[2/2] Rendering loop'";

        // When
        GenerationResult result = shell(script, Duration.ofSeconds(30)).generate(job, failingOnStages);

        // Then
        assertThat(result.getOutputRef()).isEqualTo(outputRoot.resolve("job-42").toString());
        assertThat(events).contains("85|Rendering loop|GENERATING");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void generate_WithoutScoresFile_UsesOutputDir() throws Exception {
        GenerationResult result = shell("echo done", Duration.ofSeconds(30)).generate(job, recorder);

        assertThat(result.getOutputRef()).isEqualTo(outputRoot.resolve("job-42").toString());
        assertThat(result.getQualityScore()).isNull();
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void generate_NonZeroExit_ReportsLastOutputLine() {
        String script = "echo 'Traceback (most recent call last)'; echo 'RuntimeError: CUDA out of memory' >&2; exit 3";

        assertThatThrownBy(() -> shell(script, Duration.ofSeconds(30)).generate(job, recorder))
                .isInstanceOf(GenerationException.class)
                .hasMessage("Pipeline failed (exit 3): RuntimeError: CUDA out of memory");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void generate_Timeout_KillsProcess() {
        assertThatThrownBy(() -> shell("sleep 10", Duration.ofMillis(300)).generate(job, recorder))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void generate_UnreadableScores_Fails() throws Exception {
        Files.createDirectories(outputRoot.resolve("job-42"));

        assertThatThrownBy(() -> shell("echo '{broken' > \"$6/scores.json\"", Duration.ofSeconds(30))
                .generate(job, recorder))
                .isInstanceOf(GenerationException.class)
                .hasMessageContaining("scores.json");
    }
}
