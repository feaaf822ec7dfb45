package dev.changeguard.infrastructure.servicenow;

import dev.changeguard.config.ServiceNowProperties;
import dev.changeguard.config.ValidationProperties;
import dev.changeguard.exception.PostingException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ServiceNow Table API client with a circuit breaker.
 * Uses WebClient with bounded {@code block()} calls; callers run on collector pool threads.
 */
@Component
public class ServiceNowTableClient implements TicketClient {

    private static final Logger log = LoggerFactory.getLogger(ServiceNowTableClient.class);
    private static final String CHANGE_TABLE = "change_request";
    private static final ParameterizedTypeReference<Map<String, Object>> SINGLE =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, List<Map<String, Object>>>> MANY =
            new ParameterizedTypeReference<>() {};

    private final WebClient webClient;
    private final Duration fetchTimeout;
    private final Duration postTimeout;

    public ServiceNowTableClient(WebClient.Builder builder, ServiceNowProperties properties,
                                 ValidationProperties validation) {
        this.fetchTimeout = validation.fetchTimeout();
        this.postTimeout = validation.postTimeout();
        Duration responseTimeout = postTimeout.compareTo(fetchTimeout) > 0 ? postTimeout : fetchTimeout;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(responseTimeout)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000);
        WebClient.Builder configured = builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE);
        if (hasText(properties.instanceUrl())) configured.baseUrl(properties.instanceUrl());
        if (hasText(properties.username()) && properties.password() != null)
            configured.defaultHeaders(h -> h.setBasicAuth(properties.username(), properties.password()));
        this.webClient = configured.build();
    }

    @Override
    @CircuitBreaker(name = "servicenow")
    public Optional<TicketRecord> getRecord(String table, String id, List<String> fields) {
        Map<String, Object> body = webClient.get()
                .uri(b -> b.path("/api/now/table/{table}/{id}")
                        .queryParam("sysparm_fields", "{fields}")
                        .queryParam("sysparm_exclude_reference_link", "true")
                        .build(Map.of("table", table, "id", id, "fields", String.join(",", fields))))
                .retrieve()
                .bodyToMono(SINGLE)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .block(fetchTimeout);
        if (body == null || !(body.get("result") instanceof Map<?, ?> result)) {
            log.debug("No {} record {}", table, id);
            return Optional.empty();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> row = (Map<String, Object>) result;
        return Optional.of(TicketRecord.of(row));
    }

    @Override
    @CircuitBreaker(name = "servicenow")
    public List<TicketRecord> queryRecords(String table, String query, List<String> fields, int limit) {
        Map<String, List<Map<String, Object>>> body = webClient.get()
                .uri(b -> b.path("/api/now/table/{table}")
                        .queryParam("sysparm_query", "{query}")
                        .queryParam("sysparm_fields", "{fields}")
                        .queryParam("sysparm_limit", limit)
                        .queryParam("sysparm_exclude_reference_link", "true")
                        .build(Map.of("table", table, "query", query, "fields", String.join(",", fields))))
                .retrieve()
                .bodyToMono(MANY)
                .block(fetchTimeout);
        if (body == null || body.get("result") == null) return List.of();
        return body.get("result").stream().map(TicketRecord::of).toList();
    }

    @Override
    @CircuitBreaker(name = "servicenow")
    public void postNote(String changeId, String text) {
        try {
            webClient.patch()
                    .uri("/api/now/table/{table}/{id}", CHANGE_TABLE, changeId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("work_notes", text))
                    .retrieve()
                    .toBodilessEntity()
                    .block(postTimeout);
            log.info("Work note posted on change {}", changeId);
        } catch (RuntimeException e) {
            throw new PostingException("Could not post work note on change " + changeId, e);
        }
    }

    private static boolean hasText(String s) {
        return s != null && !s.isBlank();
    }
}
