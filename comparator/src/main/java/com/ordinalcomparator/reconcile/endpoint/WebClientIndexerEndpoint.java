package com.ordinalcomparator.reconcile.endpoint;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.ordinalcomparator.domain.ChainId;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.Receipts;
import com.ordinalcomparator.reconcile.config.EndpointHttpProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Indexer endpoint over HTTP using WebClient. Each call resolves the block hash for the height
 * ({@code /blockhash/{height}}, cached) and then reads the protocol events for that hash.
 * One attempt per call; errors are mapped onto {@link FetchErrorKind}.
 */
@Slf4j
public class WebClientIndexerEndpoint implements IndexerEndpoint {

    private final String baseUrl;
    private final WebClient webClient;
    private final IndexerResponseParser parser;
    private final Duration requestTimeout;
    private final Duration blockHashTimeout;
    private final Duration nodeInfoTimeout;
    private final Cache<Long, String> blockHashes;

    public WebClientIndexerEndpoint(String baseUrl, WebClient webClient, IndexerResponseParser parser,
                                    EndpointHttpProperties http) {
        this.baseUrl = baseUrl;
        this.webClient = webClient;
        this.parser = parser;
        this.requestTimeout = Duration.ofMillis(http.getRequestTimeoutMs());
        this.blockHashTimeout = Duration.ofMillis(http.getBlockHashTimeoutMs());
        this.nodeInfoTimeout = Duration.ofMillis(http.getNodeInfoTimeoutMs());
        this.blockHashes = Caffeine.newBuilder()
                .maximumSize(Math.max(1L, http.getBlockHashCacheSize()))
                .build();
    }

    @Override
    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public Receipts fetch(ChainId chain, ProtocolId protocol, long height) {
        String hash = blockHash(height);
        String body = get(baseUrl + "/api/v1/" + protocol.getApiSegment() + "/block/{hash}/events",
                requestTimeout, "events of block " + height, hash);
        return parser.parseReceipts(protocol, body);
    }

    @Override
    public long tip(ChainId chain) {
        NodeInfo info = parser.parseNodeInfo(get(baseUrl + "/api/v1/node/info", nodeInfoTimeout, "node info"));
        if (!chain.getNetworkName().equals(info.network())) {
            throw new SchemaException("endpoint " + baseUrl + " serves network '" + info.network()
                    + "', expected '" + chain.getNetworkName() + "'");
        }
        log.debug("Tip of {} is {}", baseUrl, info.ordBlockHeight());
        return info.ordBlockHeight();
    }

    String blockHash(long height) {
        String cached = blockHashes.getIfPresent(height);
        if (cached != null) {
            return cached;
        }
        String hash = parser.parseBlockHash(
                get(baseUrl + "/blockhash/{height}", blockHashTimeout, "block hash at " + height, height), height);
        blockHashes.put(height, hash);
        return hash;
    }

    private String get(String uriTemplate, Duration timeout, String what, Object... uriVariables) {
        Mono<String> call = webClient.get()
                .uri(uriTemplate, uriVariables)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout)
                .onErrorMap(e -> !(e instanceof EndpointException), e -> mapError(e, what));
        try {
            return call.block();
        } catch (EndpointException e) {
            throw e;
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new FetchAbortedException("Interrupted while waiting for " + what + " from " + baseUrl, cause);
            }
            throw e;
        }
    }

    private EndpointException mapError(Throwable e, String what) {
        String prefix = what + " from " + baseUrl + ": ";
        if (e instanceof TimeoutException) {
            return new TransientFetchException(FetchErrorKind.TIMEOUT, prefix + "timed out", e);
        }
        if (e instanceof WebClientResponseException wcre) {
            HttpStatusCode status = wcre.getStatusCode();
            if (isTransientStatus(status)) {
                return new TransientFetchException(FetchErrorKind.UNAVAILABLE, prefix + "HTTP " + status.value(), e);
            }
            return new SchemaException(prefix + "HTTP " + status.value(), e);
        }
        // connection refused, reset, DNS failure
        return new TransientFetchException(FetchErrorKind.UNAVAILABLE, prefix + messageOf(e), e);
    }

    static boolean isTransientStatus(HttpStatusCode status) {
        int code = status.value();
        return status.is5xxServerError() || code == 408 || code == 429;
    }

    private static String messageOf(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
