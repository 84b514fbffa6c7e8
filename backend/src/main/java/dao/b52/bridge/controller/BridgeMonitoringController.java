package dao.b52.bridge.controller;

import dao.b52.bridge.config.BridgeProperties;
import dao.b52.bridge.config.ScannerProperties;
import dao.b52.bridge.host.BridgeEventLog;
import dao.b52.bridge.host.HostChain;
import dao.b52.bridge.ledger.BankLedger;
import dao.b52.bridge.model.BridgeEvent;
import dao.b52.bridge.model.BridgeGenesis;
import dao.b52.bridge.model.SyncCursor;
import dao.b52.bridge.model.WithdrawalRequest;
import dao.b52.bridge.model.WithdrawalStatus;
import dao.b52.bridge.repository.BridgeStore;
import dao.b52.bridge.service.BridgeEndBlocker;
import dao.b52.bridge.service.BridgeGenesisService;
import dao.b52.bridge.service.FinalizedHeightCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Monitoring endpoint for deposit sync progress, recent bridge events and state export/import.
 */
@Slf4j
@RestController
@RequestMapping("/api/monitor")
public class BridgeMonitoringController {

    private final HostChain hostChain;
    private final BridgeStore store;
    private final BankLedger ledger;
    private final BridgeEventLog eventLog;
    private final BridgeGenesisService genesisService;
    private final FinalizedHeightCalculator heightCalculator;
    private final BridgeEndBlocker endBlocker;
    private final BridgeProperties bridgeProps;
    private final ScannerProperties scannerProps;

    public BridgeMonitoringController(HostChain hostChain,
                                      BridgeStore store,
                                      BankLedger ledger,
                                      BridgeEventLog eventLog,
                                      BridgeGenesisService genesisService,
                                      FinalizedHeightCalculator heightCalculator,
                                      BridgeEndBlocker endBlocker,
                                      BridgeProperties bridgeProps,
                                      ScannerProperties scannerProps) {
        this.hostChain = hostChain;
        this.store = store;
        this.ledger = ledger;
        this.eventLog = eventLog;
        this.genesisService = genesisService;
        this.heightCalculator = heightCalculator;
        this.endBlocker = endBlocker;
        this.bridgeProps = bridgeProps;
        this.scannerProps = scannerProps;
    }

    /**
     * GET /api/monitor/sync
     * Cursor, scanner clock and processed counts.
     */
    @GetMapping("/sync")
    public ResponseEntity<Map<String, Object>> getSyncStatus() {
        Map<String, Object> response = new LinkedHashMap<>();

        long blockTime = hostChain.currentBlockTime();
        SyncCursor cursor = store.getSyncCursor();
        List<WithdrawalRequest> withdrawals = store.findWithdrawals();

        response.put("status", "SUCCESS");
        response.put("host", Map.of(
                "height", hostChain.currentHeight(),
                "blockTime", blockTime
        ));
        response.put("cursor", Map.of(
                "lastProcessedIndex", cursor.lastProcessedIndex(),
                "lastExternalHeight", cursor.lastExternalHeight(),
                "version", cursor.version()
        ));
        response.put("finalizedHeight", heightCalculator.finalizedHeight(blockTime));
        response.put("scanner", Map.of(
                "enabled", scannerProps.isEnabled(),
                "lastCheckTime", store.getLastDepositCheckTime(),
                "checkIntervalSeconds", scannerProps.getCheckIntervalSeconds()
        ));
        response.put("deposits", Map.of(
                "enabled", bridgeProps.isEnabled(),
                "processedRecords", store.processedRecordIds().size(),
                "processedIndices", store.processedDepositIndices().size()
        ));
        response.put("withdrawals", Map.of(
                "total", withdrawals.size(),
                "pending", countByStatus(withdrawals, WithdrawalStatus.PENDING),
                "signed", countByStatus(withdrawals, WithdrawalStatus.SIGNED),
                "completed", countByStatus(withdrawals, WithdrawalStatus.COMPLETED),
                "nonce", store.getWithdrawalNonce(),
                "autoSign", endBlocker.isAutoSignEnabled()
        ));
        response.put("totalSupply", ledger.totalSupply().toString());
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/events?limit=
     * Most recent committed bridge events, oldest first.
     */
    @GetMapping("/events")
    public ResponseEntity<Map<String, Object>> getEvents(@RequestParam(defaultValue = "100") int limit) {
        Map<String, Object> response = new LinkedHashMap<>();
        List<BridgeEvent> events = eventLog.recent(limit);
        response.put("status", "SUCCESS");
        response.put("total", events.size());
        response.put("events", events);
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/monitor/state/export
     */
    @GetMapping("/state/export")
    public ResponseEntity<BridgeGenesis> exportState() {
        return ResponseEntity.ok(genesisService.exportGenesis());
    }

    /**
     * POST /api/monitor/state/import
     * Only accepted while the bridge holds no state.
     */
    @PostMapping("/state/import")
    public ResponseEntity<Map<String, Object>> importState(@RequestBody BridgeGenesis genesis) {
        try {
            hostChain.executeTx("import_genesis", ctx -> {
                genesisService.importGenesis(genesis);
                return null;
            });

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "SUCCESS");
            response.put("processedRecords", store.processedRecordIds().size());
            response.put("withdrawals", store.findWithdrawals().size());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return ErrorResponses.of("importState", e);
        }
    }

    private static long countByStatus(List<WithdrawalRequest> withdrawals, WithdrawalStatus status) {
        return withdrawals.stream().filter(w -> w.getStatus() == status).count();
    }
}
