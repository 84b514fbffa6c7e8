package dao.b52.bridge.model;

import java.math.BigInteger;

/**
 * Deposit as stored by the bridge contract: deposits(uint256) -> (string account, uint256 amount).
 *
 * atHeight is the settlement chain block the record was read at, not the block it was written in.
 */
public record DepositRecord(
        long index,
        String account,
        BigInteger amount,
        long atHeight
) {}
