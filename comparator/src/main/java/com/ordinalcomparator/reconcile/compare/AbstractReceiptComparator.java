package com.ordinalcomparator.reconcile.compare;

import com.ordinalcomparator.domain.DivergenceEntry;
import com.ordinalcomparator.domain.DivergenceKind;
import com.ordinalcomparator.domain.ProtocolId;
import com.ordinalcomparator.domain.Receipts;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Keyed matching shared by the protocol comparators. Items are keyed by a protocol match key; the
 * n-th item with a key on one side matches the n-th item with the same key on the other side
 * (occurrences after the first get a {@code #n} suffix).
 *
 * @param <R> receipts type of the protocol
 * @param <T> item type
 */
abstract class AbstractReceiptComparator<R extends Receipts, T> implements ReceiptComparator {

    private final ProtocolId protocol;
    private final Class<R> receiptsType;

    protected AbstractReceiptComparator(ProtocolId protocol, Class<R> receiptsType) {
        this.protocol = protocol;
        this.receiptsType = receiptsType;
    }

    @Override
    public ProtocolId protocol() {
        return protocol;
    }

    @Override
    public List<DivergenceEntry> compare(long height, Receipts primary, Receipts secondary) {
        R p = cast(primary, "primary");
        R s = cast(secondary, "secondary");
        Map<String, T> primaryByKey = index(items(p));
        Map<String, T> secondaryByKey = index(items(s));

        List<DivergenceEntry> out = new ArrayList<>();
        TreeSet<String> keys = new TreeSet<>(primaryByKey.keySet());
        keys.addAll(secondaryByKey.keySet());
        for (String key : keys) {
            T left = primaryByKey.get(key);
            T right = secondaryByKey.get(key);
            if (right == null) {
                out.add(new DivergenceEntry(height, DivergenceKind.MISSING_IN_SECONDARY, key, describe(left)));
            } else if (left == null) {
                out.add(new DivergenceEntry(height, DivergenceKind.MISSING_IN_PRIMARY, key, describe(right)));
            } else {
                List<String> diffs = new ArrayList<>();
                diffFields(left, right, diffs);
                if (!diffs.isEmpty()) {
                    out.add(new DivergenceEntry(height, DivergenceKind.FIELD_MISMATCH, key, String.join("; ", diffs)));
                }
            }
        }
        addBlockLevel(height, p, s, out);
        out.sort(DivergenceEntry.REPORT_ORDER);
        return List.copyOf(out);
    }

    protected abstract List<T> items(R receipts);

    protected abstract String matchKey(T item);

    /** Appends one "field: primary=X secondary=Y" string per differing field. */
    protected abstract void diffFields(T primary, T secondary, List<String> diffs);

    protected abstract String describe(T item);

    /** Hook for block-level divergences. */
    protected void addBlockLevel(long height, R primary, R secondary, List<DivergenceEntry> out) {
    }

    protected static void diff(String field, Object primary, Object secondary, List<String> diffs) {
        if (!Objects.equals(primary, secondary)) {
            diffs.add(field + ": primary=" + primary + " secondary=" + secondary);
        }
    }

    private Map<String, T> index(List<T> items) {
        Map<String, T> byKey = new TreeMap<>();
        Map<String, Integer> occurrences = new HashMap<>();
        for (T item : items) {
            String base = matchKey(item);
            int n = occurrences.merge(base, 1, Integer::sum);
            byKey.put(n == 1 ? base : base + "#" + n, item);
        }
        return byKey;
    }

    private R cast(Receipts receipts, String side) {
        if (!receiptsType.isInstance(receipts)) {
            throw new IllegalArgumentException(protocol + " comparator got " + side + " receipts of type "
                    + (receipts == null ? "null" : receipts.getClass().getSimpleName()));
        }
        return receiptsType.cast(receipts);
    }
}
