package com.commerce.saga.ledger;

import com.commerce.ledger.entity.LedgerEntry;
import com.commerce.ledger.service.LedgerEntryInput;
import com.commerce.ledger.service.LedgerPostings;
import com.commerce.ledger.service.LedgerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Ledger postings made by saga steps, keyed by the step's idempotency key so a
 * re-executed step finds its earlier posting instead of posting again.
 * Callers supply the transaction.
 */
@Component
public class StepPostings {

    private static final Logger log = LoggerFactory.getLogger(StepPostings.class);

    static final String REVERSAL_SUFFIX = ":reversal";

    private final LedgerService ledgerService;

    public StepPostings(LedgerService ledgerService) {
        this.ledgerService = ledgerService;
    }

    public Posting post(String postingKey, List<LedgerEntryInput> inputs) {
        List<LedgerEntry> existing = ledgerService.findPosting(postingKey);
        if (!existing.isEmpty()) {
            log.info("Posting {} already recorded", postingKey);
            return new Posting(postingKey, existing, false);
        }
        return new Posting(postingKey, ledgerService.createEntries(postingKey, inputs), true);
    }

    /** Posts the REVERSAL of {@code postingKey}, once. Does nothing if the posting was never made. */
    public void reverse(String postingKey, String reason, String actor) {
        List<LedgerEntry> original = ledgerService.findPosting(postingKey);
        if (original.isEmpty()) {
            log.info("Nothing to reverse for posting {}", postingKey);
            return;
        }
        post(postingKey + REVERSAL_SUFFIX, LedgerPostings.reversalOf(original, reason, actor));
    }

    public record Posting(String postingKey, List<LedgerEntry> entries, boolean created) {

        public PostingReceipt receipt() {
            return new PostingReceipt(postingKey, entries.size());
        }
    }

    /** Step output stored in the saga's step results. */
    public record PostingReceipt(String postingKey, int entryCount) {
    }
}
