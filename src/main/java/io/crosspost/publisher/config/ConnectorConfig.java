package io.crosspost.publisher.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.crosspost.publisher.connector.ConnectorFactory;
import io.crosspost.publisher.connector.ServiceRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class ConnectorConfig {

    @Bean
    public RestTemplate publisherRestTemplate(PublisherConfig config) {
        HttpConfig http = config.http();

        // HttpURLConnection reports a 401 on a streamed POST as an I/O error, java.net.http does not
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofMillis(http.connectTimeout()))
                .build();

        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(http.readTimeout());

        RestTemplate restTemplate = new RestTemplate(requestFactory);
        restTemplate.getInterceptors().add((request, body, execution) -> {
            request.getHeaders().set(HttpHeaders.USER_AGENT, http.userAgent());
            return execution.execute(request, body);
        });

        return restTemplate;
    }

    @Bean
    public Sleeper retrySleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean
    public ServiceRegistry serviceRegistry(PublisherConfig config, RestTemplate publisherRestTemplate,
                                           ObjectMapper objectMapper) {
        return new ConnectorFactory(publisherRestTemplate, objectMapper).createRegistry(config);
    }

    @Bean
    public RetryConfig retryConfig(PublisherConfig config) {
        return config.retry();
    }

    @Bean
    public ContentConfig contentConfig(PublisherConfig config) {
        return config.content();
    }

    @Bean
    public DeletionConfig deletionConfig(PublisherConfig config) {
        return config.deletion();
    }
}
