package dao.b52.bridge.repository;

import dao.b52.bridge.host.Checkpointable;
import dao.b52.bridge.model.SyncCursor;
import dao.b52.bridge.model.WithdrawalRequest;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public interface BridgeStore extends Checkpointable {

    // processed record set (append-only)

    boolean isProcessed(String recordId);

    void markProcessed(String recordId);

    Set<String> processedRecordIds();

    // deposit sync

    SyncCursor getSyncCursor();

    void saveSyncCursor(SyncCursor cursor);

    long getLastDepositCheckTime();

    void setLastDepositCheckTime(long blockTime);

    Optional<Long> findProcessedIndexHeight(long index);

    void recordProcessedIndex(long index, long externalHeight);

    Map<Long, Long> processedDepositIndices();

    // withdrawals

    void saveWithdrawal(WithdrawalRequest request);

    Optional<WithdrawalRequest> findWithdrawal(String nonce);

    List<WithdrawalRequest> findWithdrawals();

    long getWithdrawalNonce();

    /**
     * Advance the withdrawal nonce sequence and return the new value (first call returns 1).
     */
    long nextWithdrawalNonce();

    void setWithdrawalNonce(long value);
}
