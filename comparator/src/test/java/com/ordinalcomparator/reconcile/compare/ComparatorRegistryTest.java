package com.ordinalcomparator.reconcile.compare;

import com.ordinalcomparator.domain.ProtocolId;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComparatorRegistryTest {

    @Test
    void dispatchesByProtocol() {
        ComparatorRegistry registry = new ComparatorRegistry(
                List.of(new OrdinalReceiptComparator(), new Brc20ReceiptComparator()));

        assertThat(registry.forProtocol(ProtocolId.ORDINAL)).isInstanceOf(OrdinalReceiptComparator.class);
        assertThat(registry.forProtocol(ProtocolId.BRC20)).isInstanceOf(Brc20ReceiptComparator.class);
    }

    @Test
    void failsWhenProtocolHasNoComparator() {
        assertThatThrownBy(() -> new ComparatorRegistry(List.of(new OrdinalReceiptComparator())))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("BRC20");
    }

    @Test
    void failsOnDuplicateComparator() {
        assertThatThrownBy(() -> new ComparatorRegistry(List.of(
                new OrdinalReceiptComparator(), new OrdinalReceiptComparator(), new Brc20ReceiptComparator())))
                .isInstanceOf(IllegalStateException.class);
    }
}
