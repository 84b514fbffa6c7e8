package dao.b52.bridge.model;

import java.util.Map;

/**
 * Event emitted by a bridge state transition, e.g. deposit_synced or withdrawal_signed.
 */
public record BridgeEvent(
        String type,
        long blockHeight,
        long blockTime,
        Map<String, String> attributes
) {
    public static final String DEPOSIT_SYNCED = "deposit_synced";
    public static final String DEPOSIT_SKIPPED = "deposit_skipped";
    public static final String BRIDGE_DEPOSIT_PROCESSED = "bridge_deposit_processed";
    public static final String WITHDRAWAL_INITIATED = "withdrawal_initiated";
    public static final String WITHDRAWAL_SIGNED = "withdrawal_signed";
    public static final String WITHDRAWAL_COMPLETED = "withdrawal_completed";
}
