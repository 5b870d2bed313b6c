package ai.loopcanvas.dispatch;

import ai.loopcanvas.dispatch.store.JobStore;
import ai.loopcanvas.dispatch.store.LocalJobStore;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full application against the local store: one job through two workers over HTTP
 */
@SpringBootTest
@AutoConfigureMockMvc
class DispatchApplicationTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void queueProperties(DynamicPropertyRegistry registry) {
        registry.add("app.queue.local.data-dir", () -> dataDir.toString());
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JobStore jobStore;

    private JsonNode postJson(String path, String body) throws Exception {
        MvcResult result = mockMvc.perform(post(path)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andReturn();
        assertThat(result.getResponse().getStatus()).isBetween(200, 201);
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    void jobLifecycleOverHttp() throws Exception {
        assertThat(jobStore).isInstanceOf(LocalJobStore.class);

        // submit
        JsonNode submitted = postJson("/api/v2/jobs",
                "{\"input_ref\":{\"media_url\":\"https://example.com/a.mp4\"},\"priority\":1,\"max_attempts\":2}");
        String jobId = submitted.get("job_id").asText();

        // worker A claims, reports progress and fails
        JsonNode claimA = postJson("/api/v2/queue/claim", "{\"worker_id\":\"A\",\"worker_type\":\"gpu\"}");
        assertThat(claimA.get("job").get("job_id").asText()).isEqualTo(jobId);
        JsonNode progress = postJson("/api/v2/queue/progress",
                "{\"job_id\":\"" + jobId + "\",\"worker_id\":\"A\",\"progress\":10,"
                        + "\"message\":\"starting\",\"status\":\"generating\"}");
        assertThat(progress.get("ok").asBoolean()).isTrue();
        JsonNode failed = postJson("/api/v2/queue/fail",
                "{\"job_id\":\"" + jobId + "\",\"worker_id\":\"A\",\"error\":\"oom\"}");
        assertThat(failed.get("status").asText()).isEqualTo("queued");

        // worker B finishes it
        JsonNode claimB = postJson("/api/v2/queue/claim", "{\"worker_id\":\"B\",\"worker_type\":\"gpu\"}");
        assertThat(claimB.get("job").get("attempt").asInt()).isEqualTo(1);
        JsonNode completed = postJson("/api/v2/queue/complete",
                "{\"job_id\":\"" + jobId + "\",\"worker_id\":\"B\",\"output_ref\":\"out/123\",\"quality_score\":9.4}");
        assertThat(completed.get("ok").asBoolean()).isTrue();

        // then
        mockMvc.perform(get("/api/v2/jobs/" + jobId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("complete"))
                .andExpect(jsonPath("$.attempt").value(1))
                .andExpect(jsonPath("$.output_ref").value("out/123"))
                .andExpect(jsonPath("$.quality_score").value(9.4));

        mockMvc.perform(get("/api/v2/queue/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.backend").value("local"))
                .andExpect(jsonPath("$.complete").value(1))
                .andExpect(jsonPath("$.monitor_running").value(true));

        mockMvc.perform(get("/api/v2/workers/B"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.completed").value(1));

        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.components.jobStore.details.backend").value("local"));
    }
}
