package dao.b52.bridge.support;

import dao.b52.bridge.exception.BridgeReadException;
import dao.b52.bridge.model.DepositRecord;
import dao.b52.bridge.service.BridgeContractReader;

import java.math.BigInteger;
import java.util.Optional;
import java.util.TreeMap;

/**
 * In-memory bridge contract. A deposit becomes visible to reads at or above the height it was written at.
 */
public class FakeBridgeContractReader implements BridgeContractReader {

    private final TreeMap<Long, DepositRecord> deposits = new TreeMap<>();
    private long currentBlock = Long.MAX_VALUE / 2;
    private boolean unavailable;
    private int findCalls;

    public FakeBridgeContractReader deposit(long index, String account, long amount, long atHeight) {
        return deposit(index, account, BigInteger.valueOf(amount), atHeight);
    }

    public FakeBridgeContractReader deposit(long index, String account, BigInteger amount, long atHeight) {
        deposits.put(index, new DepositRecord(index, account, amount, atHeight));
        return this;
    }

    public void setCurrentBlock(long currentBlock) {
        this.currentBlock = currentBlock;
    }

    public void setUnavailable(boolean unavailable) {
        this.unavailable = unavailable;
    }

    public int getFindCalls() {
        return findCalls;
    }

    @Override
    public Optional<DepositRecord> findDeposit(long index, Long height) {
        findCalls++;
        failIfUnavailable();
        DepositRecord record = deposits.get(index);
        if (record == null) return Optional.empty();
        if (height != null && record.atHeight() > height) return Optional.empty();
        long readAt = height == null ? currentBlock : height;
        return Optional.of(new DepositRecord(index, record.account(), record.amount(), readAt));
    }

    @Override
    public long currentBlockNumber() {
        failIfUnavailable();
        return currentBlock;
    }

    @Override
    public long highestDepositIndex(long height) {
        failIfUnavailable();
        return deposits.values().stream()
                .filter(d -> d.atHeight() <= height)
                .mapToLong(DepositRecord::index)
                .max()
                .orElse(0L);
    }

    private void failIfUnavailable() {
        if (unavailable) {
            throw new BridgeReadException("connection refused");
        }
    }
}
