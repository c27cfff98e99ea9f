package com.ordinalcomparator.reconcile.endpoint;

import com.ordinalcomparator.reconcile.config.EndpointHttpProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Creates HTTP endpoints sharing one WebClient (and its connection pool).
 */
@Component
@RequiredArgsConstructor
public class WebClientIndexerEndpointFactory implements IndexerEndpointFactory {

    private final WebClient.Builder webClientBuilder;
    private final IndexerResponseParser parser;
    private final EndpointHttpProperties httpProperties;

    @Override
    public IndexerEndpoint create(String baseUrl) {
        return new WebClientIndexerEndpoint(baseUrl, webClientBuilder.build(), parser, httpProperties);
    }
}
