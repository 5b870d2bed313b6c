package ai.loopcanvas.dispatch.store;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class LocalJobStoreTest extends AbstractJobStoreTest {

    @TempDir
    Path dataDir;

    private LocalJobStore store;

    @BeforeEach
    void setUp() {
        store = new LocalJobStore(dataDir, clock);
    }

    @Override
    protected JobStore store() {
        return store;
    }

    @Test
    void state_SurvivesReopen() {
        // Given
        String jobId = enqueue(3, 2);
        store.claim("w1", "gpu");
        store.updateProgress(jobId, "w1", 42, "rendering", JobStatus.GENERATING);
        GenerationJob before = store.get(jobId).orElseThrow();

        // When
        LocalJobStore reopened = new LocalJobStore(dataDir, clock);

        // Then
        assertThat(reopened.get(jobId)).contains(before);
        assertThat(reopened.complete(jobId, "w1", JobOutput.of("out/1"))).isTrue();
    }

    @Test
    void document_IsKeyedByJobIdWithSnakeCaseFields() throws IOException {
        String jobId = enqueue(10, 3);

        JsonNode root = new ObjectMapper().readTree(store.getDocumentPath().toFile());

        assertThat(root.has(jobId)).isTrue();
        JsonNode record = root.get(jobId);
        assertThat(record.get("job_id").asText()).isEqualTo(jobId);
        assertThat(record.get("status").asText()).isEqualTo("queued");
        assertThat(record.get("max_attempts").asInt()).isEqualTo(3);
        assertThat(record.get("created_at").asText()).isEqualTo("2024-05-01T10:00:01Z");
        assertThat(Files.exists(dataDir.resolve(LocalJobStore.DOCUMENT_NAME + ".tmp"))).isFalse();
    }

    @Test
    void malformedRecord_IsSkippedAndPreserved() throws IOException {
        // Given
        String jobId = enqueue(10, 3);
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode root = (ObjectNode) mapper.readTree(store.getDocumentPath().toFile());
        root.putObject("broken").put("job_id", "broken").put("status", "exploded");
        Files.writeString(store.getDocumentPath(), mapper.writeValueAsString(root), StandardCharsets.UTF_8);

        // When
        GenerationJob claimed = store.claim("w1", "gpu").orElseThrow();

        // Then
        assertThat(claimed.getJobId()).isEqualTo(jobId);
        assertThat(store.get("broken")).isEmpty();
        assertThat(store.stats().getTotal()).isEqualTo(1);
        JsonNode saved = mapper.readTree(store.getDocumentPath().toFile());
        assertThat(saved.get("broken").get("status").asText()).isEqualTo("exploded");
        assertThat(saved.get(jobId).get("status").asText()).isEqualTo("claimed");
    }

    @Test
    void corruptDocument_IsBackedUpAndStoreStartsEmpty() throws IOException {
        // Given
        Files.writeString(store.getDocumentPath(), "{ not json", StandardCharsets.UTF_8);

        // When
        assertThat(store.stats().getTotal()).isZero();
        String jobId = enqueue(10, 3);

        // Then
        assertThat(store.get(jobId)).isPresent();
        try (Stream<Path> files = Files.list(dataDir)) {
            assertThat(files.map(path -> path.getFileName().toString()))
                    .anyMatch(name -> name.startsWith(LocalJobStore.DOCUMENT_NAME + ".corrupt-"));
        }
    }

    @Test
    void constructor_UnusableDirectoryFails() throws IOException {
        Path file = Files.writeString(dataDir.resolve("not-a-dir"), "x");

        assertThatThrownBy(() -> new LocalJobStore(file.resolve("queue"), clock))
                .isInstanceOf(JobStore.JobStoreException.class);
    }

    @Test
    void readsOnlyDoNotCreateDocument() {
        assertThat(store.get("nothing")).isEmpty();
        assertThat(store.stats().getTotal()).isZero();
        assertThat(Files.exists(store.getDocumentPath())).isFalse();
    }
}
