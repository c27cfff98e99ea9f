package com.ordinalcomparator.reconcile.endpoint;

@FunctionalInterface
public interface IndexerEndpointFactory {

    IndexerEndpoint create(String baseUrl);
}
