package uk.gegc.boxbilling.features.usage.application;

import uk.gegc.boxbilling.features.usage.domain.model.OverageBillingRecord;

/**
 * Outcome of an overage billing calculation. {@code record} is null when nothing was charged.
 *
 * @param created {@code true} only for the call that inserted the record
 */
public record OverageBillingResult(OverageBillingRecord record, boolean created, String reason) {

    public static OverageBillingResult none(String reason) {
        return new OverageBillingResult(null, false, reason);
    }

    public static OverageBillingResult created(OverageBillingRecord record) {
        return new OverageBillingResult(record, true, null);
    }

    public static OverageBillingResult existing(OverageBillingRecord record) {
        return new OverageBillingResult(record, false, "Already calculated for this period");
    }

    public boolean hasRecord() {
        return record != null;
    }

    public long overageAmount() {
        return record == null ? 0L : record.getTotalOverageAmount();
    }
}
