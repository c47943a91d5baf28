package com.commerce.ledger.service;

import com.commerce.ledger.entity.AccountType;
import com.commerce.ledger.entity.EntryType;
import com.commerce.ledger.entity.LedgerEntry;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Standard balanced postings. Each method returns the inputs for one
 * {@link LedgerService#createEntries} batch.
 */
public final class LedgerPostings {

    private LedgerPostings() {}

    public static List<LedgerEntryInput> paymentCaptured(String subjectId, BigDecimal amount, String currency,
                                                         String customerId, String paymentReference, String createdBy) {
        return List.of(
                new LedgerEntryInput(subjectId, EntryType.PAYMENT_CAPTURED, AccountType.CUSTOMER, customerId,
                        amount.negate(), currency, "Payment captured from customer", paymentReference, createdBy),
                new LedgerEntryInput(subjectId, EntryType.PAYMENT_CAPTURED, AccountType.ESCROW, null,
                        amount, currency, "Payment held in escrow", paymentReference, createdBy));
    }

    public static List<LedgerEntryInput> refundInitiated(String refundId, BigDecimal amount, String currency,
                                                         String customerId, String createdBy) {
        return List.of(
                new LedgerEntryInput(refundId, EntryType.REFUND_INITIATED, AccountType.CUSTOMER, customerId,
                        amount.negate(), currency, "Refund liability created for customer", null, createdBy),
                new LedgerEntryInput(refundId, EntryType.REFUND_INITIATED, AccountType.PLATFORM, null,
                        amount, currency, "Refund processing liability", null, createdBy));
    }

    /** Customer credit and platform debit, plus a platform/gateway fee pair when the gateway charged a fee. */
    public static List<LedgerEntryInput> refundProcessed(String refundId, BigDecimal processedAmount,
                                                         BigDecimal gatewayFee, String currency, String customerId,
                                                         String gatewayRefundId, String processedBy) {
        List<LedgerEntryInput> entries = new ArrayList<>();
        entries.add(new LedgerEntryInput(refundId, EntryType.REFUND_PROCESSED, AccountType.CUSTOMER, customerId,
                processedAmount, currency, "Refund processed via gateway", gatewayRefundId, processedBy));
        entries.add(new LedgerEntryInput(refundId, EntryType.REFUND_PROCESSED, AccountType.PLATFORM, null,
                processedAmount.negate(), currency, "Refund amount debited from platform", gatewayRefundId, processedBy));

        if (gatewayFee != null && gatewayFee.signum() > 0) {
            entries.add(new LedgerEntryInput(refundId, EntryType.GATEWAY_FEE, AccountType.PLATFORM, null,
                    gatewayFee.negate(), currency, "Gateway refund processing fees", gatewayRefundId, processedBy));
            entries.add(new LedgerEntryInput(refundId, EntryType.GATEWAY_FEE, AccountType.GATEWAY, null,
                    gatewayFee, currency, "Gateway refund fees collected", gatewayRefundId, processedBy));
        }
        return entries;
    }

    public static List<LedgerEntryInput> merchantImpact(String refundId, BigDecimal merchantShare, BigDecimal platformFee,
                                                        String currency, String merchantId, String createdBy) {
        List<LedgerEntryInput> entries = new ArrayList<>();
        entries.add(new LedgerEntryInput(refundId, EntryType.REFUND_PROCESSED, AccountType.MERCHANT, merchantId,
                merchantShare.negate(), currency, "Merchant share of refund", null, createdBy));
        if (platformFee != null && platformFee.signum() > 0) {
            entries.add(new LedgerEntryInput(refundId, EntryType.FEE_DEDUCTED, AccountType.PLATFORM, null,
                    platformFee, currency, "Platform fee adjustment for refund", null, createdBy));
        }
        return entries;
    }

    public static List<LedgerEntryInput> adjustment(String subjectId, BigDecimal amount, String reason, String currency,
                                                    AccountType accountType, String accountId, String createdBy) {
        return List.of(new LedgerEntryInput(subjectId, EntryType.ADJUSTMENT, accountType, accountId,
                amount, currency, "Adjustment: " + reason, null, createdBy));
    }

    /** Negates every entry of a posting, referencing the entry it cancels. */
    public static List<LedgerEntryInput> reversalOf(List<LedgerEntry> posting, String reason, String createdBy) {
        return posting.stream()
                .map(entry -> new LedgerEntryInput(entry.getSubjectId(), EntryType.REVERSAL, entry.getAccountType(),
                        entry.getAccountId(), entry.getAmount().negate(), entry.getCurrency(),
                        "Reversal: " + reason, entry.getId().toString(), createdBy))
                .toList();
    }
}
