package dao.b52.bridge.model;

import lombok.Data;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Portable snapshot of all bridge state, used to carry the bridge across chain restarts.
 */
@Data
public class BridgeGenesis {

    private String contractAddress;
    private List<String> processedRecordIds = new ArrayList<>();
    private SyncCursor syncCursor = SyncCursor.INITIAL;
    private List<WithdrawalRequest> withdrawalRequests = new ArrayList<>();
    private long withdrawalNonce;
    private long lastDepositCheckTime;
    private Map<Long, Long> processedDepositIndices = new TreeMap<>();
    /** Ledger balances keyed by host address. Optional on import. */
    private Map<String, BigInteger> balances = new TreeMap<>();
}
