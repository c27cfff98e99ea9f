package com.ordinalcomparator.domain;

import java.util.List;

public record Brc20Receipts(List<Brc20Entry> entries) implements Receipts {

    public Brc20Receipts {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static Brc20Receipts empty() {
        return new Brc20Receipts(List.of());
    }

    @Override
    public ProtocolId protocol() {
        return ProtocolId.BRC20;
    }

    @Override
    public int size() {
        return entries.size();
    }
}
