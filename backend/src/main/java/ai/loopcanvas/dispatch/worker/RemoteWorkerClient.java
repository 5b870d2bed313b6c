package ai.loopcanvas.dispatch.worker;

import ai.loopcanvas.dispatch.model.JobStatus;
import ai.loopcanvas.dispatch.model.dto.AckResponse;
import ai.loopcanvas.dispatch.model.dto.ClaimRequest;
import ai.loopcanvas.dispatch.model.dto.ClaimResponse;
import ai.loopcanvas.dispatch.model.dto.CompleteRequest;
import ai.loopcanvas.dispatch.model.dto.FailRequest;
import ai.loopcanvas.dispatch.model.dto.FailResponse;
import ai.loopcanvas.dispatch.model.dto.GenerationJob;
import ai.loopcanvas.dispatch.model.dto.JobOutput;
import ai.loopcanvas.dispatch.model.dto.ProgressRequest;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.Optional;

/**
 * Worker client speaking the queue's JSON RPCs over HTTP.
 * A 4xx answer means the queue refused the call and is returned as a negative result;
 * transport errors and 5xx answers raise {@link WorkerClientException} so the caller can retry.
 */
@Slf4j
public class RemoteWorkerClient implements WorkerClient {

    static final String CLAIM_PATH = "/api/v2/queue/claim";
    static final String PROGRESS_PATH = "/api/v2/queue/progress";
    static final String COMPLETE_PATH = "/api/v2/queue/complete";
    static final String FAIL_PATH = "/api/v2/queue/fail";

    private final RestTemplate restTemplate;
    private final String serverUrl;

    public RemoteWorkerClient(RestTemplate restTemplate, String serverUrl) {
        this.restTemplate = restTemplate;
        this.serverUrl = serverUrl.endsWith("/") ? serverUrl.substring(0, serverUrl.length() - 1) : serverUrl;
    }

    @Override
    public Optional<GenerationJob> claim(String workerId, String workerType) {
        ClaimRequest request = ClaimRequest.builder()
                .workerId(workerId)
                .workerType(workerType)
                .build();
        ClaimResponse response = post(CLAIM_PATH, request, ClaimResponse.class);
        return response != null ? Optional.ofNullable(response.getJob()) : Optional.empty();
    }

    @Override
    public boolean reportProgress(String jobId, String workerId, int progress, String message, JobStatus status) {
        ProgressRequest request = ProgressRequest.builder()
                .jobId(jobId)
                .workerId(workerId)
                .progress(progress)
                .message(message)
                .status(status)
                .build();
        AckResponse response = post(PROGRESS_PATH, request, AckResponse.class);
        return response != null && response.isOk();
    }

    @Override
    public boolean complete(String jobId, String workerId, JobOutput output) {
        CompleteRequest request = CompleteRequest.builder()
                .jobId(jobId)
                .workerId(workerId)
                .outputRef(output.getOutputRef())
                .outputDir(output.getOutputDir())
                .qualityScore(output.getQualityScore())
                .loopScore(output.getLoopScore())
                .build();
        AckResponse response = post(COMPLETE_PATH, request, AckResponse.class);
        return response != null && response.isOk();
    }

    @Override
    public Optional<JobStatus> fail(String jobId, String workerId, String error) {
        FailRequest request = FailRequest.builder()
                .jobId(jobId)
                .workerId(workerId)
                .error(error)
                .build();
        FailResponse response = post(FAIL_PATH, request, FailResponse.class);
        if (response == null || !response.isOk()) {
            return Optional.empty();
        }
        return Optional.ofNullable(response.getStatus());
    }

    @Override
    public String describe() {
        return "remote:" + serverUrl;
    }

    private <T> T post(String path, Object body, Class<T> responseType) {
        String url = serverUrl + path;
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            HttpEntity<Object> entity = new HttpEntity<>(body, headers);

            log.debug("POST {}", url);
            ResponseEntity<T> response = restTemplate.postForEntity(url, entity, responseType);
            return response.getBody();

        } catch (HttpClientErrorException e) {
            log.warn("Queue refused {}: {} {}", path, e.getStatusCode(), e.getResponseBodyAsString());
            return null;
        } catch (RestClientException e) {
            throw new WorkerClientException("Call to " + url + " failed: " + e.getMessage(), e);
        }
    }
}
