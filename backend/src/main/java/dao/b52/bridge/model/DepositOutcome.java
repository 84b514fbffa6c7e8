package dao.b52.bridge.model;

/**
 * Result of one credit-or-skip step for a deposit record that exists on the settlement chain.
 */
public record DepositOutcome(
        Type type,
        long index,
        String recordId,
        String recipient,
        String amount,
        long externalHeight,
        String reason
) {

    public enum Type {
        /** Balance credited. */
        SYNCED,
        /** Record is malformed; marked processed without crediting. */
        SKIPPED,
        /** Record id was already in the processed set; nothing credited. */
        ALREADY_PROCESSED
    }
}
