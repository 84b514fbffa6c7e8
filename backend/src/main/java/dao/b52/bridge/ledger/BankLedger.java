package dao.b52.bridge.ledger;

import dao.b52.bridge.host.Checkpointable;

import java.math.BigInteger;
import java.util.Map;

/**
 * Host chain balances of the bridged denomination. Addresses are normalized bech32 host addresses.
 */
public interface BankLedger extends Checkpointable {

    BigInteger spendable(String address);

    /**
     * Create supply and credit it to the address, creating the account when it does not exist yet.
     */
    void mint(String address, BigInteger amount);

    /**
     * Debit the address and destroy the supply.
     *
     * @throws dao.b52.bridge.exception.InsufficientFundsException if the spendable balance is lower than amount
     */
    void burn(String address, BigInteger amount);

    boolean hasAccount(String address);

    BigInteger totalSupply();

    Map<String, BigInteger> balances();
}
