package dao.b52.bridge.ledger;

import dao.b52.bridge.config.HostChainProperties;
import dao.b52.bridge.exception.InsufficientFundsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

@Slf4j
@Component
public class InMemoryBankLedger implements BankLedger {

    private final String denom;

    // key: host address
    private final NavigableMap<String, BigInteger> balances = new TreeMap<>();

    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryBankLedger(HostChainProperties hostProps) {
        this.denom = hostProps.getDenom();
    }

    @Override
    public synchronized BigInteger spendable(String address) {
        return balances.getOrDefault(address, BigInteger.ZERO);
    }

    @Override
    public synchronized void mint(String address, BigInteger amount) {
        requirePositive(amount);
        if (!balances.containsKey(address)) {
            log.info("Creating ledger account: address={}", address);
        }
        balances.merge(address, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
        log.debug("Minted {}{} to {}", amount, denom, address);
    }

    @Override
    public synchronized void burn(String address, BigInteger amount) {
        requirePositive(amount);
        BigInteger balance = spendable(address);
        if (balance.compareTo(amount) < 0) {
            throw new InsufficientFundsException("insufficient balance: have " + balance + denom + ", need " + amount + denom);
        }
        balances.put(address, balance.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
        log.debug("Burned {}{} from {}", amount, denom, address);
    }

    @Override
    public synchronized boolean hasAccount(String address) {
        return balances.containsKey(address);
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized Map<String, BigInteger> balances() {
        return Collections.unmodifiableMap(new TreeMap<>(balances));
    }

    @Override
    public synchronized Checkpoint checkpoint() {
        Map<String, BigInteger> saved = new TreeMap<>(balances);
        BigInteger savedSupply = totalSupply;
        return () -> {
            synchronized (this) {
                balances.clear();
                balances.putAll(saved);
                totalSupply = savedSupply;
            }
        };
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Amount must be positive, got " + amount);
        }
    }
}
