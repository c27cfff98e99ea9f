package com.ordinalcomparator.reconcile.compare;

import com.ordinalcomparator.domain.Brc20Entry;
import com.ordinalcomparator.domain.Brc20Receipts;
import com.ordinalcomparator.domain.DivergenceEntry;
import com.ordinalcomparator.domain.DivergenceKind;
import com.ordinalcomparator.domain.ProtocolId;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;

/**
 * Matches ledger entries by (ticker, txid) and compares amount and operation. Amounts compare
 * numerically, so "1.0" equals "1.00".
 */
@Component
public class Brc20ReceiptComparator extends AbstractReceiptComparator<Brc20Receipts, Brc20Entry> {

    public Brc20ReceiptComparator() {
        super(ProtocolId.BRC20, Brc20Receipts.class);
    }

    @Override
    protected List<Brc20Entry> items(Brc20Receipts receipts) {
        return receipts.entries();
    }

    @Override
    protected String matchKey(Brc20Entry entry) {
        String ticker = entry.ticker() == null ? "" : entry.ticker().toLowerCase(Locale.ROOT);
        return ticker + "|" + entry.txid();
    }

    @Override
    protected void diffFields(Brc20Entry primary, Brc20Entry secondary, List<String> diffs) {
        if (!sameAmount(primary.amount(), secondary.amount())) {
            diffs.add("amount: primary=" + plain(primary.amount()) + " secondary=" + plain(secondary.amount()));
        }
        diff("operation", primary.operation(), secondary.operation(), diffs);
    }

    @Override
    protected String describe(Brc20Entry entry) {
        return entry.operation() + " amount=" + plain(entry.amount()) + " from=" + entry.from() + " to=" + entry.to();
    }

    @Override
    protected void addBlockLevel(long height, Brc20Receipts primary, Brc20Receipts secondary, List<DivergenceEntry> out) {
        if (primary.size() != secondary.size()) {
            out.add(new DivergenceEntry(height, DivergenceKind.COUNT_MISMATCH, "",
                    "entries: primary=" + primary.size() + " secondary=" + secondary.size()));
        }
    }

    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.compareTo(b) == 0;
    }

    private static String plain(BigDecimal amount) {
        return amount == null ? "null" : amount.toPlainString();
    }
}
