package com.ordinalcomparator.reconcile.compare;

import com.ordinalcomparator.domain.Brc20Entry;
import com.ordinalcomparator.domain.Brc20Operation;
import com.ordinalcomparator.domain.Brc20Receipts;
import com.ordinalcomparator.domain.DivergenceEntry;
import com.ordinalcomparator.domain.DivergenceKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class Brc20ReceiptComparatorTest {

    private final Brc20ReceiptComparator comparator = new Brc20ReceiptComparator();

    private static Brc20Entry entry(String ticker, String txid, Brc20Operation op, String amount) {
        return new Brc20Entry(txid, ticker, op, amount == null ? null : new BigDecimal(amount), "from", "to", txid + "i0");
    }

    @Test
    @DisplayName("amounts compare numerically regardless of scale")
    void scaleInsensitiveAmounts() {
        Brc20Receipts primary = new Brc20Receipts(List.of(entry("ordi", "t1", Brc20Operation.MINT, "1000")));
        Brc20Receipts secondary = new Brc20Receipts(List.of(entry("ordi", "t1", Brc20Operation.MINT, "1000.000")));

        assertThat(comparator.compare(1, primary, secondary)).isEmpty();
    }

    @Test
    @DisplayName("ticker is matched case-insensitively")
    void tickerCaseInsensitive() {
        Brc20Receipts primary = new Brc20Receipts(List.of(entry("ORDI", "t1", Brc20Operation.TRANSFER, "5")));
        Brc20Receipts secondary = new Brc20Receipts(List.of(entry("ordi", "t1", Brc20Operation.TRANSFER, "5")));

        assertThat(comparator.compare(1, primary, secondary)).isEmpty();
    }

    @Test
    void amountAndOperationMismatch() {
        Brc20Receipts primary = new Brc20Receipts(List.of(entry("sats", "t1", Brc20Operation.MINT, "10")));
        Brc20Receipts secondary = new Brc20Receipts(List.of(entry("sats", "t1", Brc20Operation.BURN, "11")));

        List<DivergenceEntry> out = comparator.compare(2, primary, secondary);

        assertThat(out).hasSize(1);
        assertThat(out.get(0).kind()).isEqualTo(DivergenceKind.FIELD_MISMATCH);
        assertThat(out.get(0).key()).isEqualTo("sats|t1");
        assertThat(out.get(0).detail())
                .contains("amount: primary=10 secondary=11")
                .contains("operation: primary=MINT secondary=BURN");
    }

    @Test
    @DisplayName("differing entry counts add a block-level COUNT_MISMATCH next to the per-key entries")
    void countMismatch() {
        Brc20Receipts primary = new Brc20Receipts(List.of(
                entry("ordi", "t1", Brc20Operation.MINT, "1"),
                entry("ordi", "t2", Brc20Operation.MINT, "1")));
        Brc20Receipts secondary = new Brc20Receipts(List.of(entry("ordi", "t1", Brc20Operation.MINT, "1")));

        List<DivergenceEntry> out = comparator.compare(3, primary, secondary);

        assertThat(out).extracting(DivergenceEntry::kind)
                .containsExactly(DivergenceKind.COUNT_MISMATCH, DivergenceKind.MISSING_IN_SECONDARY);
        assertThat(out.get(0).key()).isEmpty();
        assertThat(out.get(0).detail()).isEqualTo("entries: primary=2 secondary=1");
        assertThat(out.get(1).key()).isEqualTo("ordi|t2");
    }

    @Test
    void deployWithoutAmountMatchesDeployWithoutAmount() {
        Brc20Receipts r = new Brc20Receipts(List.of(entry("pepe", "t9", Brc20Operation.DEPLOY, null)));

        assertThat(comparator.compare(4, r, r)).isEmpty();
    }
}
