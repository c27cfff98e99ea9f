package com.ordinalcomparator.reconcile.compare;

import com.ordinalcomparator.domain.ProtocolId;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Closed dispatch from {@link ProtocolId} to its comparator. Fails at startup when a protocol has
 * no comparator or two comparators claim the same protocol.
 */
@Component
public class ComparatorRegistry {

    private final Map<ProtocolId, ReceiptComparator> byProtocol = new EnumMap<>(ProtocolId.class);

    public ComparatorRegistry(List<ReceiptComparator> comparators) {
        for (ReceiptComparator comparator : comparators) {
            ReceiptComparator previous = byProtocol.put(comparator.protocol(), comparator);
            if (previous != null) {
                throw new IllegalStateException("Two comparators registered for " + comparator.protocol());
            }
        }
        for (ProtocolId protocol : ProtocolId.values()) {
            if (!byProtocol.containsKey(protocol)) {
                throw new IllegalStateException("No comparator registered for " + protocol);
            }
        }
    }

    public ReceiptComparator forProtocol(ProtocolId protocol) {
        return byProtocol.get(protocol);
    }
}
