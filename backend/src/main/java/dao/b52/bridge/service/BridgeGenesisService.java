package dao.b52.bridge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.b52.bridge.config.BridgeProperties;
import dao.b52.bridge.exception.InvalidStateImportException;
import dao.b52.bridge.ledger.BankLedger;
import dao.b52.bridge.model.BridgeGenesis;
import dao.b52.bridge.model.SyncCursor;
import dao.b52.bridge.model.WithdrawalRequest;
import dao.b52.bridge.model.WithdrawalStatus;
import dao.b52.bridge.repository.BridgeStore;
import dao.b52.bridge.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Export and import of the complete bridge state (processed ids, cursor, withdrawals, nonce sequence,
 * scanner clock, per-index heights and balances).
 * <p>
 * Import is genesis-only: it is rejected once the bridge holds any state.
 */
@Slf4j
@Service
public class BridgeGenesisService {

    private final BridgeStore store;
    private final BankLedger ledger;
    private final HostAddressCodec addressCodec;
    private final BridgeProperties bridgeProps;
    private final ObjectMapper objectMapper;

    public BridgeGenesisService(BridgeStore store,
                                BankLedger ledger,
                                HostAddressCodec addressCodec,
                                BridgeProperties bridgeProps,
                                ObjectMapper objectMapper) {
        this.store = store;
        this.ledger = ledger;
        this.addressCodec = addressCodec;
        this.bridgeProps = bridgeProps;
        this.objectMapper = objectMapper;
    }

    public BridgeGenesis exportGenesis() {
        BridgeGenesis genesis = new BridgeGenesis();
        genesis.setContractAddress(bridgeProps.getContractAddress());
        genesis.setProcessedRecordIds(new ArrayList<>(store.processedRecordIds()));
        genesis.setSyncCursor(store.getSyncCursor());
        genesis.setWithdrawalRequests(store.findWithdrawals().stream().map(WithdrawalRequest::copy).toList());
        genesis.setWithdrawalNonce(store.getWithdrawalNonce());
        genesis.setLastDepositCheckTime(store.getLastDepositCheckTime());
        genesis.setProcessedDepositIndices(new TreeMap<>(store.processedDepositIndices()));
        genesis.setBalances(new TreeMap<>(ledger.balances()));
        return genesis;
    }

    public void importGenesis(BridgeGenesis genesis) {
        if (!isEmptyState()) {
            throw new InvalidStateImportException("bridge state already initialized");
        }
        validate(genesis);

        genesis.getProcessedRecordIds().forEach(id -> store.markProcessed(id.toLowerCase(Locale.ROOT)));
        store.saveSyncCursor(genesis.getSyncCursor());
        store.setLastDepositCheckTime(genesis.getLastDepositCheckTime());
        genesis.getProcessedDepositIndices().forEach(store::recordProcessedIndex);
        for (WithdrawalRequest request : genesis.getWithdrawalRequests()) {
            store.saveWithdrawal(canonical(request));
        }
        store.setWithdrawalNonce(genesis.getWithdrawalNonce());
        genesis.getBalances().forEach((address, amount) -> {
            if (amount.signum() > 0) {
                ledger.mint(address.toLowerCase(Locale.ROOT), amount);
            }
        });

        log.info("Bridge state imported: processedIds={}, cursor={}, withdrawals={}, nonce={}, accounts={}",
                genesis.getProcessedRecordIds().size(), genesis.getSyncCursor(),
                genesis.getWithdrawalRequests().size(), genesis.getWithdrawalNonce(), genesis.getBalances().size());
    }

    public BridgeGenesis readGenesisFile(Path path) {
        try {
            return objectMapper.readValue(Files.readAllBytes(path), BridgeGenesis.class);
        } catch (IOException e) {
            throw new InvalidStateImportException("cannot read bridge state from " + path + ": " + e.getMessage());
        }
    }

    public void validate(BridgeGenesis genesis) {
        if (genesis == null) {
            throw new InvalidStateImportException("bridge state is missing");
        }

        String configured = bridgeProps.getContractAddress();
        String exported = genesis.getContractAddress();
        if (configured != null && !configured.isBlank() && exported != null && !exported.isBlank()
                && !configured.trim().equals(exported.trim())) {
            // record ids hash the address as written, so a re-cased address is a different id space
            throw new InvalidStateImportException("state belongs to contract " + exported + ", configured " + configured);
        }

        Set<String> ids = new HashSet<>();
        for (String id : nullSafe(genesis.getProcessedRecordIds())) {
            if (id == null || id.length() != 66 || !id.startsWith("0x") || !CryptoUtil.isHex(id.substring(2))) {
                throw new InvalidStateImportException("malformed processed record id: " + id);
            }
            if (!ids.add(id.toLowerCase(Locale.ROOT))) {
                throw new InvalidStateImportException("duplicate processed record id: " + id);
            }
        }

        SyncCursor cursor = genesis.getSyncCursor();
        if (cursor == null || cursor.lastProcessedIndex() < 0 || cursor.lastExternalHeight() < 0 || cursor.version() < 0) {
            throw new InvalidStateImportException("invalid sync cursor: " + cursor);
        }
        if (genesis.getLastDepositCheckTime() < 0 || genesis.getWithdrawalNonce() < 0) {
            throw new InvalidStateImportException("negative scanner time or withdrawal nonce");
        }

        for (Map.Entry<Long, Long> e : nullSafe(genesis.getProcessedDepositIndices()).entrySet()) {
            if (e.getKey() == null || e.getKey() < 0 || e.getValue() == null || e.getValue() < 0) {
                throw new InvalidStateImportException("invalid processed deposit index entry: " + e);
            }
        }

        Set<String> nonces = new HashSet<>();
        for (WithdrawalRequest request : nullSafe(genesis.getWithdrawalRequests())) {
            validateWithdrawal(request, genesis.getWithdrawalNonce());
            if (!nonces.add(request.getNonce().toLowerCase(Locale.ROOT))) {
                throw new InvalidStateImportException("duplicate withdrawal nonce: " + request.getNonce());
            }
        }

        for (Map.Entry<String, BigInteger> e : nullSafe(genesis.getBalances()).entrySet()) {
            if (!addressCodec.isValid(e.getKey())) {
                throw new InvalidStateImportException("invalid balance address: " + e.getKey());
            }
            if (e.getValue() == null || e.getValue().signum() < 0) {
                throw new InvalidStateImportException("invalid balance for " + e.getKey());
            }
        }

        genesis.setProcessedRecordIds(nullSafe(genesis.getProcessedRecordIds()));
        genesis.setProcessedDepositIndices(nullSafe(genesis.getProcessedDepositIndices()));
        genesis.setWithdrawalRequests(nullSafe(genesis.getWithdrawalRequests()));
        genesis.setBalances(nullSafe(genesis.getBalances()));
    }

    private void validateWithdrawal(WithdrawalRequest request, long nonceSequence) {
        if (request == null || !CryptoUtil.isNonce(request.getNonce() == null ? null : request.getNonce().toLowerCase(Locale.ROOT))) {
            throw new InvalidStateImportException("malformed withdrawal nonce: " + (request == null ? null : request.getNonce()));
        }
        BigInteger nonceValue = new BigInteger(request.getNonce().substring(2), 16);
        if (nonceValue.compareTo(BigInteger.valueOf(nonceSequence)) > 0) {
            throw new InvalidStateImportException("withdrawal nonce " + request.getNonce() + " beyond nonce sequence " + nonceSequence);
        }
        if (!addressCodec.isValid(request.getOwner())) {
            throw new InvalidStateImportException("invalid withdrawal owner: " + request.getOwner());
        }
        if (!WithdrawalService.isSettlementAddress(request.getDestination())) {
            throw new InvalidStateImportException("invalid withdrawal destination: " + request.getDestination());
        }
        if (request.getAmount() == null || request.getAmount().signum() <= 0 || !CryptoUtil.isUint256(request.getAmount())) {
            throw new InvalidStateImportException("invalid withdrawal amount for " + request.getNonce());
        }
        if (request.getStatus() != WithdrawalStatus.PENDING && request.getSignature() == null) {
            throw new InvalidStateImportException("withdrawal " + request.getNonce() + " is " + request.getStatus() + " without signature");
        }
        if (request.getSignature() != null && !isSignature(request.getSignature())) {
            throw new InvalidStateImportException("malformed signature for withdrawal " + request.getNonce());
        }
    }

    // 0x followed by the 65 byte r || s || v signature.
    private static boolean isSignature(String value) {
        return value.length() == 132 && value.startsWith("0x") && CryptoUtil.isHex(value.substring(2));
    }

    /**
     * Stored keys and addresses are lower case; lookups by nonce rely on it.
     */
    private static WithdrawalRequest canonical(WithdrawalRequest request) {
        return new WithdrawalRequest(
                request.getNonce().toLowerCase(Locale.ROOT),
                request.getOwner().toLowerCase(Locale.ROOT),
                request.getDestination().toLowerCase(Locale.ROOT),
                request.getAmount(),
                request.getCreatedAt(),
                request.getStatus(),
                request.getSignature() == null ? null : request.getSignature().toLowerCase(Locale.ROOT),
                request.getCompletedAt(),
                request.getCompletionTxRef());
    }

    private boolean isEmptyState() {
        return store.processedRecordIds().isEmpty()
                && store.findWithdrawals().isEmpty()
                && store.getWithdrawalNonce() == 0L
                && store.getSyncCursor().equals(SyncCursor.INITIAL)
                && store.processedDepositIndices().isEmpty()
                && ledger.totalSupply().signum() == 0;
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list == null ? new ArrayList<>() : list;
    }

    private static <K, V> Map<K, V> nullSafe(Map<K, V> map) {
        return map == null ? new TreeMap<>() : map;
    }
}
