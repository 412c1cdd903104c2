package com.example.linkservice.client.edge;

import com.example.linkservice.dto.BulkPutResult;
import com.example.linkservice.dto.EdgeCacheEntry;
import com.example.linkservice.dto.EdgeLinkPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the Cloudflare Workers KV REST API, the edge store consulted by the redirect path.
 *
 * CRITICAL DESIGN:
 * - Must be called OUTSIDE @Transactional
 * - When any credential is missing (local dev) every operation returns without I/O
 * - Bulk writes report per-batch counts and never throw; the next full sync is the retry
 * - Single-key calls go through the "edgeStore" circuit breaker, whose fallback only logs
 * - Every call is bounded by a timeout
 */
@Component
@Slf4j
public class EdgeStoreClient {

    private static final String NAMESPACE_PATH = "/accounts/{accountId}/storage/kv/namespaces/{namespaceId}";

    private final WebClient edgeStoreWebClient;
    private final ObjectMapper objectMapper;
    private final String accountId;
    private final String namespaceId;
    private final String apiToken;
    private final int maxBatchSize;
    private final Duration requestTimeout;

    public EdgeStoreClient(@Qualifier("edgeStoreWebClient") WebClient edgeStoreWebClient,
                           ObjectMapper objectMapper,
                           @Value("${edge-store.account-id:}") String accountId,
                           @Value("${edge-store.namespace-id:}") String namespaceId,
                           @Value("${edge-store.api-token:}") String apiToken,
                           @Value("${edge-store.max-batch-size:10000}") int maxBatchSize,
                           @Value("${edge-store.request-timeout:3s}") Duration requestTimeout) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("edge-store.max-batch-size must be positive, got " + maxBatchSize);
        }
        this.edgeStoreWebClient = edgeStoreWebClient;
        this.objectMapper = objectMapper;
        this.accountId = accountId;
        this.namespaceId = namespaceId;
        this.apiToken = apiToken;
        this.maxBatchSize = maxBatchSize;
        this.requestTimeout = requestTimeout;
    }

    /**
     * True only when account id, namespace id and API token are all set.
     */
    public boolean isConfigured() {
        return StringUtils.hasText(accountId)
                && StringUtils.hasText(namespaceId)
                && StringUtils.hasText(apiToken);
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    /**
     * Write all entries, overwriting existing keys, in batches of at most max-batch-size.
     * A rejected or timed-out batch counts all of its entries as failed.
     */
    public BulkPutResult bulkPut(List<EdgeCacheEntry> entries) {
        if (!isConfigured() || entries.isEmpty()) {
            return BulkPutResult.empty();
        }

        BulkPutResult result = BulkPutResult.empty();
        for (int start = 0, batchIndex = 0; start < entries.size(); start += maxBatchSize, batchIndex++) {
            List<EdgeCacheEntry> batch = entries.subList(start, Math.min(start + maxBatchSize, entries.size()));
            result = result.plus(putBatch(batch, batchIndex));
        }
        return result;
    }

    private BulkPutResult putBatch(List<EdgeCacheEntry> batch, int batchIndex) {
        try {
            List<Map<String, String>> body = batch.stream()
                    .map(entry -> Map.of("key", entry.key(), "value", serialize(entry.value())))
                    .toList();

            edgeStoreWebClient.put()
                    .uri(NAMESPACE_PATH + "/bulk", accountId, namespaceId)
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .toBodilessEntity()
                    .timeout(requestTimeout.multipliedBy(3))
                    .block();

            log.debug("Edge bulk put batch {} accepted: {} entries", batchIndex, batch.size());
            return new BulkPutResult(batch.size(), 0);

        } catch (WebClientResponseException e) {
            log.error("❌ Edge bulk put failed (batch {}): status={} body={}",
                    batchIndex, e.getStatusCode().value(), e.getResponseBodyAsString());
            return new BulkPutResult(0, batch.size());
        } catch (Exception e) {
            log.error("❌ Edge bulk put error (batch {}): {}", batchIndex, e.getMessage(), e);
            return new BulkPutResult(0, batch.size());
        }
    }

    /**
     * Write or overwrite one key.
     *
     * @return true if the store accepted the write, false when unconfigured
     */
    @CircuitBreaker(name = "edgeStore", fallbackMethod = "writeFallback")
    public boolean put(String slug, EdgeLinkPayload payload) {
        if (!isConfigured()) {
            return false;
        }

        edgeStoreWebClient.put()
                .uri(NAMESPACE_PATH + "/values/{key}", accountId, namespaceId, slug)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(serialize(payload))
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                        .defaultIfEmpty("")
                        .flatMap(text -> Mono.error(new EdgeStoreException(
                                "Edge put failed for slug \"" + slug + "\": " + response.statusCode().value() + " " + text))))
                .toBodilessEntity()
                .timeout(requestTimeout)
                .block();
        return true;
    }

    /**
     * Remove one key. Deleting a missing key is not an error.
     *
     * @return true if the store accepted the delete, false when unconfigured
     */
    @CircuitBreaker(name = "edgeStore", fallbackMethod = "deleteFallback")
    public boolean delete(String slug) {
        if (!isConfigured()) {
            return false;
        }

        edgeStoreWebClient.delete()
                .uri(NAMESPACE_PATH + "/values/{key}", accountId, namespaceId, slug)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .onStatus(status -> status.isError() && status.value() != HttpStatus.NOT_FOUND.value(),
                        response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .flatMap(text -> Mono.error(new EdgeStoreException(
                                        "Edge delete failed for slug \"" + slug + "\": " + response.statusCode().value() + " " + text))))
                .toBodilessEntity()
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .timeout(requestTimeout)
                .block();
        return true;
    }

    /**
     * Read one key back. Used by the operator sync to spot-check consistency.
     */
    @CircuitBreaker(name = "edgeStore", fallbackMethod = "getFallback")
    public Optional<EdgeLinkPayload> get(String slug) {
        if (!isConfigured()) {
            return Optional.empty();
        }

        String body = edgeStoreWebClient.get()
                .uri(NAMESPACE_PATH + "/values/{key}", accountId, namespaceId, slug)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .bodyToMono(String.class)
                .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                .timeout(requestTimeout)
                .block();

        if (body == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(body, EdgeLinkPayload.class));
        } catch (JsonProcessingException e) {
            throw new EdgeStoreException("Unreadable edge entry for slug \"" + slug + "\"", e);
        }
    }

    private boolean writeFallback(String slug, EdgeLinkPayload payload, Throwable throwable) {
        log.warn("⚠️ Edge put skipped for slug={}: {}", slug, throwable.getMessage());
        return false;
    }

    private boolean deleteFallback(String slug, Throwable throwable) {
        log.warn("⚠️ Edge delete skipped for slug={}: {}", slug, throwable.getMessage());
        return false;
    }

    private Optional<EdgeLinkPayload> getFallback(String slug, Throwable throwable) {
        log.warn("⚠️ Edge get failed for slug={}: {}", slug, throwable.getMessage());
        return Optional.empty();
    }

    private String serialize(EdgeLinkPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new EdgeStoreException("Cannot serialize edge payload for id=" + payload.id(), e);
        }
    }

    private String bearer() {
        return "Bearer " + apiToken;
    }

    public static class EdgeStoreException extends RuntimeException {
        public EdgeStoreException(String message) {
            super(message);
        }

        public EdgeStoreException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
