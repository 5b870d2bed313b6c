package ai.loopcanvas.dispatch.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * HTTP client used by remote workers to reach the queue API.
 */
@Configuration
public class HttpClientConfig {

    /**
     * Creates the RestTemplate for worker RPCs with the configured connect and read timeouts.
     *
     * @param builder the RestTemplateBuilder provided by Spring Boot, already wired to the app's ObjectMapper
     * @param workerProperties worker settings holding the timeouts
     * @return a configured RestTemplate instance
     */
    @Bean
    public RestTemplate workerRestTemplate(RestTemplateBuilder builder, WorkerProperties workerProperties) {
        return builder
            .setConnectTimeout(workerProperties.getConnectTimeout())
            .setReadTimeout(workerProperties.getReadTimeout())
            .build();
    }
}
