package com.ordinalcomparator.domain;

import java.util.List;

public record OrdinalReceipts(List<OrdinalEvent> events) implements Receipts {

    public OrdinalReceipts {
        events = events == null ? List.of() : List.copyOf(events);
    }

    public static OrdinalReceipts empty() {
        return new OrdinalReceipts(List.of());
    }

    @Override
    public ProtocolId protocol() {
        return ProtocolId.ORDINAL;
    }

    @Override
    public int size() {
        return events.size();
    }
}
