package dao.b52.bridge.service;

import dao.b52.bridge.model.DepositRecord;

import java.util.Optional;

/**
 * Read-only view of the bridge contract on the settlement chain.
 * Implementations throw {@link dao.b52.bridge.exception.BridgeReadException} on any transport failure.
 */
public interface BridgeContractReader {

    /**
     * @param height settlement chain block to read at, latest when null
     * @return empty when the contract holds no record for the index at that height
     */
    Optional<DepositRecord> findDeposit(long index, Long height);

    long currentBlockNumber();

    /**
     * Highest deposit index the contract has assigned as of the given height.
     */
    long highestDepositIndex(long height);
}
