package com.dcruver.weekly.config;

import com.dcruver.weekly.domain.week.PolicyParameters;
import com.dcruver.weekly.domain.week.WeekClassifier;
import com.dcruver.weekly.domain.week.WeekPolicy;
import com.dcruver.weekly.domain.week.WeeklyAggregator;
import com.dcruver.weekly.store.ContentStoreClient;
import com.dcruver.weekly.store.ContentStoreProperties;
import com.dcruver.weekly.store.NotionContentStoreClient;
import com.dcruver.weekly.store.NotionPayloadMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the content store client and the week aggregator.
 */
@Configuration
@Slf4j
public class ReporterConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Bean
    public HttpClient contentStoreHttpClient(ContentStoreProperties properties) {
        return HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .build();
    }

    @Bean
    public ContentStoreClient contentStoreClient(HttpClient contentStoreHttpClient, ObjectMapper objectMapper,
                                                 NotionPayloadMapper mapper, ContentStoreProperties properties) {
        if (properties.getApiKey() == null || properties.getApiKey().isBlank()) {
            log.warn("No content store API key configured (weekly.store.api-key); requests will be rejected");
        }
        return new NotionContentStoreClient(contentStoreHttpClient, objectMapper, mapper, properties);
    }

    @Bean
    public WeeklyAggregator weeklyAggregator(WeekClassifier classifier, WeekPolicyProperties properties) {
        WeekPolicy policy = WeekPolicy.fromKey(properties.getPolicy());
        PolicyParameters params = properties.getAnchorDate() != null
            ? PolicyParameters.anchoredAt(properties.getAnchorDate())
            : PolicyParameters.none();
        return new WeeklyAggregator(classifier, policy, params);
    }
}
