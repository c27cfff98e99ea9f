package com.ordinalcomparator.reconcile.engine;

import com.ordinalcomparator.domain.Brc20Receipts;
import com.ordinalcomparator.domain.ChainId;
import com.ordinalcomparator.domain.OrdinalEvent;
import com.ordinalcomparator.domain.OrdinalReceipts;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.Receipts;
import com.ordinalcomparator.reconcile.endpoint.FetchErrorKind;
import com.ordinalcomparator.reconcile.endpoint.IndexerEndpoint;
import com.ordinalcomparator.reconcile.endpoint.SchemaException;
import com.ordinalcomparator.reconcile.endpoint.TransientFetchException;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongConsumer;

/**
 * In-memory indexer: every block holds one inscription event unless overridden.
 */
class FakeIndexer implements IndexerEndpoint {

    private final String baseUrl;
    private final Map<Long, OrdinalReceipts> overrides = new ConcurrentHashMap<>();
    private final Map<Long, Integer> transientFailures = new ConcurrentHashMap<>();
    private final Set<Long> schemaFailures = ConcurrentHashMap.newKeySet();
    private final Map<Long, AtomicInteger> fetchCounts = new ConcurrentHashMap<>();
    private volatile long tip = Long.MAX_VALUE;
    private volatile RuntimeException tipFailure;
    private volatile LongConsumer onFetch = h -> { };
    private volatile Runnable onTip = () -> { };
    private final AtomicInteger tipCalls = new AtomicInteger();

    FakeIndexer(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    static OrdinalReceipts standardBlock(long height) {
        return new OrdinalReceipts(List.of(
                new OrdinalEvent("tx" + height, "tx" + height + "i0", "inscribe", "bc1qowner", "hash" + height, height)));
    }

    FakeIndexer withBlock(long height, OrdinalReceipts receipts) {
        overrides.put(height, receipts);
        return this;
    }

    FakeIndexer failingTransiently(long height, int times) {
        transientFailures.put(height, times);
        return this;
    }

    FakeIndexer failingWithSchemaError(long height) {
        schemaFailures.add(height);
        return this;
    }

    FakeIndexer withTip(long tip) {
        this.tip = tip;
        return this;
    }

    FakeIndexer withTipFailure(RuntimeException failure) {
        this.tipFailure = failure;
        return this;
    }

    FakeIndexer onFetch(LongConsumer hook) {
        this.onFetch = hook;
        return this;
    }

    FakeIndexer onTip(Runnable hook) {
        this.onTip = hook;
        return this;
    }

    int tipCalls() {
        return tipCalls.get();
    }

    int fetchCount(long height) {
        AtomicInteger c = fetchCounts.get(height);
        return c == null ? 0 : c.get();
    }

    int totalFetches() {
        return fetchCounts.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    @Override
    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public Receipts fetch(ChainId chain, ProtocolId protocol, long height) {
        int attempt = fetchCounts.computeIfAbsent(height, h -> new AtomicInteger()).incrementAndGet();
        onFetch.accept(height);
        if (schemaFailures.contains(height)) {
            throw new SchemaException("unknown event type at " + height);
        }
        Integer failures = transientFailures.get(height);
        if (failures != null && attempt <= failures) {
            throw new TransientFetchException(FetchErrorKind.UNAVAILABLE, "HTTP 503 at " + height);
        }
        if (protocol == ProtocolId.BRC20) {
            return Brc20Receipts.empty();
        }
        return overrides.getOrDefault(height, standardBlock(height));
    }

    @Override
    public long tip(ChainId chain) {
        tipCalls.incrementAndGet();
        onTip.run();
        if (tipFailure != null) {
            throw tipFailure;
        }
        return tip;
    }
}
