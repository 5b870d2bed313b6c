package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs the external generation command for a job.
 *
 * The command gets {@code --job-id <id> --input <input.json> --out <dir>} appended. Its stdout
 * stage markers such as {@code [3/7]} are mapped onto progress 15-85; on success the pipeline
 * reads {@code scores.json} from the output directory for the quality and loop scores.
 */
@Slf4j
public class ProcessGenerationPipeline implements GenerationPipeline {

    static final Pattern STAGE_MARKER = Pattern.compile("\\[(\\d{1,6})/(\\d{1,6})]\\s*(.*)");
    static final String COMPLETE_MARKER = "PIPELINE COMPLETE";
    static final String INPUT_FILE = "input.json";
    static final String SCORES_FILE = "scores.json";

    private static final int START_PROGRESS = 15;
    private static final int STAGES_PROGRESS_SPAN = 70;
    private static final int TAIL_LINES = 20;

    private final List<String> command;
    private final Path outputRoot;
    private final Duration timeout;
    private final ObjectMapper objectMapper;

    public ProcessGenerationPipeline(List<String> command, Path outputRoot, Duration timeout, ObjectMapper objectMapper) {
        this.command = command != null ? List.copyOf(command) : List.of();
        this.outputRoot = outputRoot;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
    }

    @Override
    public GenerationResult generate(GenerationJob job, ProgressListener listener)
            throws GenerationException, InterruptedException {
        if (command.isEmpty()) {
            throw new GenerationException("No generation command configured");
        }

        Path outputDir = outputRoot.resolve(job.getJobId());
        Path inputFile = outputDir.resolve(INPUT_FILE);
        try {
            Files.createDirectories(outputDir);
            objectMapper.writeValue(inputFile.toFile(), job.getInputRef());
        } catch (IOException e) {
            throw new GenerationException("Cannot prepare output directory: " + e.getMessage(), e);
        }

        List<String> fullCommand = new ArrayList<>(command);
        fullCommand.add("--job-id");
        fullCommand.add(job.getJobId());
        fullCommand.add("--input");
        fullCommand.add(inputFile.toString());
        fullCommand.add("--out");
        fullCommand.add(outputDir.toString());

        listener.onProgress(START_PROGRESS, "Starting generation pipeline...", JobStatus.GENERATING);
        runProcess(job.getJobId(), fullCommand, listener);

        listener.onProgress(90, "Collecting output...", JobStatus.UPLOADING);
        return readResult(outputDir);
    }

    private void runProcess(String jobId, List<String> fullCommand, ProgressListener listener)
            throws GenerationException, InterruptedException {
        Process process;
        try {
            process = new ProcessBuilder(fullCommand).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new GenerationException("Cannot start pipeline: " + e.getMessage(), e);
        }

        Deque<String> tail = new ArrayDeque<>();
        ExecutorService reader = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "pipeline-output-" + jobId);
            thread.setDaemon(true);
            return thread;
        });
        try {
            Future<?> output = reader.submit(() -> consumeOutput(jobId, process, listener, tail));

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new GenerationException("Pipeline timed out after " + timeout);
            }
            try {
                output.get(10, TimeUnit.SECONDS);
            } catch (Exception e) {
                log.debug("Pipeline output for job {} not fully drained: {}", jobId, e.getMessage());
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        } finally {
            reader.shutdownNow();
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String lastLine;
            synchronized (tail) {
                lastLine = tail.isEmpty() ? "" : ": " + tail.peekLast();
            }
            throw new GenerationException("Pipeline failed (exit " + exitCode + ")" + lastLine);
        }
    }

    private void consumeOutput(String jobId, Process process, ProgressListener listener, Deque<String> tail) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String trimmed = line.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                log.debug("[{}] {}", jobId, trimmed);
                synchronized (tail) {
                    tail.addLast(trimmed);
                    if (tail.size() > TAIL_LINES) {
                        tail.removeFirst();
                    }
                }
                try {
                    mapProgress(trimmed, listener);
                } catch (RuntimeException e) {
                    // keep draining, a stalled pipe would block the child until the timeout
                    log.warn("Skipping progress for job {} on line '{}': {}", jobId, trimmed, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Error reading pipeline output for job {}: {}", jobId, e.getMessage());
        }
    }

    /**
     * Maps one output line to a progress milestone, if it carries one
     */
    static void mapProgress(String line, ProgressListener listener) {
        Matcher matcher = STAGE_MARKER.matcher(line);
        if (matcher.find()) {
            int stage = Integer.parseInt(matcher.group(1));
            int stages = Integer.parseInt(matcher.group(2));
            if (stages > 0 && stage <= stages) {
                int progress = START_PROGRESS + (stage * STAGES_PROGRESS_SPAN) / stages;
                String message = matcher.group(3).isBlank() ? "Stage " + stage + "/" + stages : matcher.group(3).trim();
                listener.onProgress(progress, message, JobStatus.GENERATING);
            }
        } else if (line.contains(COMPLETE_MARKER)) {
            listener.onProgress(START_PROGRESS + STAGES_PROGRESS_SPAN, "Running quality checks...", JobStatus.GENERATING);
        }
    }

    private GenerationResult readResult(Path outputDir) throws GenerationException {
        GenerationResult.GenerationResultBuilder result = GenerationResult.builder()
                .outputDir(outputDir.toString())
                .outputRef(outputDir.toString());

        Path scoresFile = outputDir.resolve(SCORES_FILE);
        if (!Files.exists(scoresFile)) {
            log.debug("No {} in {}, completing without scores", SCORES_FILE, outputDir);
            return result.build();
        }
        try {
            JsonNode scores = objectMapper.readTree(scoresFile.toFile());
            if (scores.hasNonNull("output_ref")) {
                result.outputRef(scores.get("output_ref").asText());
            }
            if (scores.hasNonNull("quality_score")) {
                result.qualityScore(scores.get("quality_score").asDouble());
            }
            if (scores.hasNonNull("loop_score")) {
                result.loopScore(scores.get("loop_score").asDouble());
            }
            return result.build();
        } catch (IOException e) {
            throw new GenerationException("Unreadable " + SCORES_FILE + ": " + e.getMessage(), e);
        }
    }
}
