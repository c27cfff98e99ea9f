package com.ordinalcomparator.reconcile.compare;

import com.ordinalcomparator.domain.OrdinalEvent;
import com.ordinalcomparator.domain.OrdinalReceipts;
import com.ordinalcomparator.domain.ProtocolId;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Matches inscription events by inscription id and compares owner, content hash and sequence number.
 */
@Component
public class OrdinalReceiptComparator extends AbstractReceiptComparator<OrdinalReceipts, OrdinalEvent> {

    public OrdinalReceiptComparator() {
        super(ProtocolId.ORDINAL, OrdinalReceipts.class);
    }

    @Override
    protected List<OrdinalEvent> items(OrdinalReceipts receipts) {
        return receipts.events();
    }

    @Override
    protected String matchKey(OrdinalEvent event) {
        return event.inscriptionId();
    }

    @Override
    protected void diffFields(OrdinalEvent primary, OrdinalEvent secondary, List<String> diffs) {
        diff("owner", primary.owner(), secondary.owner(), diffs);
        diff("contentHash", primary.contentHash(), secondary.contentHash(), diffs);
        diff("sequenceNumber", primary.sequenceNumber(), secondary.sequenceNumber(), diffs);
    }

    @Override
    protected String describe(OrdinalEvent event) {
        return "type=" + event.type() + " txid=" + event.txid() + " owner=" + event.owner();
    }
}
