package dao.b52.bridge.repository;

import dao.b52.bridge.model.SyncCursor;
import dao.b52.bridge.model.WithdrawalRequest;
import org.springframework.stereotype.Repository;

import java.util.*;

/**
 * Sorted in-memory maps so that iteration order (and therefore exports and scans) is the same on every node.
 * Access is serialized by the host chain executor.
 */
@Repository
public class InMemoryBridgeStore implements BridgeStore {

    // key: processed record id
    private final NavigableSet<String> processedRecordIds = new TreeSet<>();

    // key: deposit index -> settlement chain height used
    private final NavigableMap<Long, Long> processedDepositIndices = new TreeMap<>();

    // key: nonce (fixed width hex, so lexical order == numeric order)
    private final NavigableMap<String, WithdrawalRequest> withdrawalsByNonce = new TreeMap<>();

    private SyncCursor syncCursor = SyncCursor.INITIAL;
    private long lastDepositCheckTime;
    private long withdrawalNonce;

    @Override
    public synchronized boolean isProcessed(String recordId) {
        return processedRecordIds.contains(recordId);
    }

    @Override
    public synchronized void markProcessed(String recordId) {
        processedRecordIds.add(recordId);
    }

    @Override
    public synchronized Set<String> processedRecordIds() {
        return Collections.unmodifiableSet(new TreeSet<>(processedRecordIds));
    }

    @Override
    public synchronized SyncCursor getSyncCursor() {
        return syncCursor;
    }

    @Override
    public synchronized void saveSyncCursor(SyncCursor cursor) {
        this.syncCursor = Objects.requireNonNull(cursor, "cursor");
    }

    @Override
    public synchronized long getLastDepositCheckTime() {
        return lastDepositCheckTime;
    }

    @Override
    public synchronized void setLastDepositCheckTime(long blockTime) {
        this.lastDepositCheckTime = blockTime;
    }

    @Override
    public synchronized Optional<Long> findProcessedIndexHeight(long index) {
        return Optional.ofNullable(processedDepositIndices.get(index));
    }

    @Override
    public synchronized void recordProcessedIndex(long index, long externalHeight) {
        processedDepositIndices.put(index, externalHeight);
    }

    @Override
    public synchronized Map<Long, Long> processedDepositIndices() {
        return Collections.unmodifiableMap(new TreeMap<>(processedDepositIndices));
    }

    @Override
    public synchronized void saveWithdrawal(WithdrawalRequest request) {
        withdrawalsByNonce.put(request.getNonce(), request);
    }

    @Override
    public synchronized Optional<WithdrawalRequest> findWithdrawal(String nonce) {
        if (nonce == null) return Optional.empty();
        return Optional.ofNullable(withdrawalsByNonce.get(nonce.toLowerCase(Locale.ROOT)));
    }

    @Override
    public synchronized List<WithdrawalRequest> findWithdrawals() {
        return new ArrayList<>(withdrawalsByNonce.values());
    }

    @Override
    public synchronized long getWithdrawalNonce() {
        return withdrawalNonce;
    }

    @Override
    public synchronized long nextWithdrawalNonce() {
        withdrawalNonce = Math.addExact(withdrawalNonce, 1L);
        return withdrawalNonce;
    }

    @Override
    public synchronized void setWithdrawalNonce(long value) {
        if (value < withdrawalNonce) {
            throw new IllegalArgumentException("Withdrawal nonce cannot move back: " + withdrawalNonce + " -> " + value);
        }
        this.withdrawalNonce = value;
    }

    @Override
    public synchronized Checkpoint checkpoint() {
        Set<String> ids = new TreeSet<>(processedRecordIds);
        Map<Long, Long> indices = new TreeMap<>(processedDepositIndices);
        Map<String, WithdrawalRequest> withdrawals = new TreeMap<>();
        withdrawalsByNonce.forEach((k, v) -> withdrawals.put(k, v.copy()));
        SyncCursor cursor = syncCursor;
        long checkTime = lastDepositCheckTime;
        long nonce = withdrawalNonce;

        return () -> {
            synchronized (this) {
                processedRecordIds.clear();
                processedRecordIds.addAll(ids);
                processedDepositIndices.clear();
                processedDepositIndices.putAll(indices);
                withdrawalsByNonce.clear();
                withdrawals.forEach((k, v) -> withdrawalsByNonce.put(k, v.copy()));
                syncCursor = cursor;
                lastDepositCheckTime = checkTime;
                withdrawalNonce = nonce;
            }
        };
    }
}
