package dao.b52.bridge.controller;

import dao.b52.bridge.exception.InvalidIndexException;
import dao.b52.bridge.host.HostChain;
import dao.b52.bridge.model.CompleteWithdrawalRequest;
import dao.b52.bridge.model.DepositOutcome;
import dao.b52.bridge.model.InitiateWithdrawalRequest;
import dao.b52.bridge.model.ProcessDepositRequest;
import dao.b52.bridge.model.SignWithdrawalRequest;
import dao.b52.bridge.model.WithdrawalRequest;
import dao.b52.bridge.model.WithdrawalStatus;
import dao.b52.bridge.service.DepositCreditService;
import dao.b52.bridge.service.DepositIngestionService;
import dao.b52.bridge.service.WithdrawalService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Bridge entry points. Every mutating call runs as one host chain transaction: on failure nothing it
 * touched is kept.
 */
@Slf4j
@RestController
@RequestMapping("/api/bridge")
public class BridgeController {

    private final HostChain hostChain;
    private final WithdrawalService withdrawalService;
    private final DepositIngestionService ingestionService;
    private final DepositCreditService creditService;

    public BridgeController(HostChain hostChain,
                            WithdrawalService withdrawalService,
                            DepositIngestionService ingestionService,
                            DepositCreditService creditService) {
        this.hostChain = hostChain;
        this.withdrawalService = withdrawalService;
        this.ingestionService = ingestionService;
        this.creditService = creditService;
    }

    /**
     * POST /api/bridge/withdrawals
     * Burn the amount from owner and queue a withdrawal to the settlement chain destination.
     */
    @PostMapping("/withdrawals")
    public ResponseEntity<Map<String, Object>> initiateWithdrawal(@Valid @RequestBody InitiateWithdrawalRequest req) {
        try {
            WithdrawalRequest created = hostChain.executeTx("initiate_withdrawal",
                    ctx -> withdrawalService.initiateWithdrawal(ctx, req.getOwner(), req.getDestination(), req.getAmount()));

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "SUCCESS");
            response.put("nonce", created.getNonce());
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return ErrorResponses.of("initiateWithdrawal", e);
        }
    }

    /**
     * POST /api/bridge/withdrawals/{nonce}/sign
     */
    @PostMapping("/withdrawals/{nonce}/sign")
    public ResponseEntity<Map<String, Object>> signWithdrawal(@PathVariable String nonce,
                                                              @Valid @RequestBody SignWithdrawalRequest req) {
        try {
            String signature = hostChain.executeTx("sign_withdrawal",
                    ctx -> withdrawalService.signWithdrawal(ctx, nonce, req.getSignerKey()));

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "SUCCESS");
            response.put("nonce", nonce.toLowerCase(Locale.ROOT));
            response.put("signature", signature);
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return ErrorResponses.of("signWithdrawal", e);
        }
    }

    /**
     * POST /api/bridge/withdrawals/{nonce}/complete
     */
    @PostMapping("/withdrawals/{nonce}/complete")
    public ResponseEntity<Map<String, Object>> completeWithdrawal(@PathVariable String nonce,
                                                                  @Valid @RequestBody CompleteWithdrawalRequest req) {
        try {
            WithdrawalRequest completed = hostChain.executeTx("complete_withdrawal",
                    ctx -> withdrawalService.markCompleted(ctx, nonce, req.getExternalTxRef()));

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "SUCCESS");
            response.put("withdrawal", withdrawalInfo(completed));
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return ErrorResponses.of("completeWithdrawal", e);
        }
    }

    /**
     * POST /api/bridge/deposits/process
     * Process one deposit index right away instead of waiting for the block-driven sync.
     */
    @PostMapping("/deposits/process")
    public ResponseEntity<Map<String, Object>> processDeposit(@Valid @RequestBody ProcessDepositRequest req) {
        try {
            DepositOutcome outcome = hostChain.executeTx("process_deposit",
                    ctx -> ingestionService.processDeposit(ctx, req.getIndex(), req.getExternalHeight()));

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("status", "SUCCESS");
            response.put("index", outcome.index());
            response.put("recordId", outcome.recordId());
            response.put("recipient", outcome.recipient());
            response.put("amount", outcome.amount());
            response.put("externalHeight", outcome.externalHeight());
            response.put("outcome", outcome.type().name().toLowerCase(Locale.ROOT));
            if (outcome.reason() != null) {
                response.put("reason", outcome.reason());
            }
            return ResponseEntity.ok(response);
        } catch (Exception e) {
            return ErrorResponses.of("processDeposit", e);
        }
    }

    /**
     * GET /api/bridge/processed/{id}
     * Whether a deposit record id (or a plain deposit index) is in the processed set.
     */
    @GetMapping("/processed/{id}")
    public ResponseEntity<Map<String, Object>> isProcessed(@PathVariable String id) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            String recordId = id.matches("\\d+") ? creditService.recordId(parseIndex(id)) : id.toLowerCase(Locale.ROOT);
            response.put("status", "SUCCESS");
            response.put("id", recordId);
            response.put("processed", creditService.isProcessedRecord(recordId));
        } catch (Exception e) {
            return ErrorResponses.of("isProcessed", e);
        }
        return ResponseEntity.ok(response);
    }

    // Deposit indices are uint64 on the settlement chain.
    private static long parseIndex(String id) {
        try {
            return Long.parseUnsignedLong(id);
        } catch (NumberFormatException e) {
            throw new InvalidIndexException("deposit index " + id + " is out of the uint64 range");
        }
    }

    /**
     * GET /api/bridge/withdrawals?owner=
     */
    @GetMapping("/withdrawals")
    public ResponseEntity<Map<String, Object>> listWithdrawals(@RequestParam(required = false) String owner) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            List<WithdrawalRequest> withdrawals = withdrawalService.listWithdrawals(owner);
            List<Map<String, Object>> items = new ArrayList<>();
            for (WithdrawalRequest w : withdrawals) {
                items.add(withdrawalInfo(w));
            }
            response.put("status", "SUCCESS");
            response.put("total", items.size());
            response.put("withdrawals", items);
        } catch (Exception e) {
            return ErrorResponses.of("listWithdrawals", e);
        }
        return ResponseEntity.ok(response);
    }

    /**
     * GET /api/bridge/withdrawals/{nonce}
     */
    @GetMapping("/withdrawals/{nonce}")
    public ResponseEntity<Map<String, Object>> getWithdrawal(@PathVariable String nonce) {
        Map<String, Object> response = new LinkedHashMap<>();
        try {
            Optional<WithdrawalRequest> withdrawal = withdrawalService.getWithdrawal(nonce);
            if (withdrawal.isEmpty()) {
                response.put("status", "ERROR");
                response.put("error", "withdrawal " + nonce + " not found");
                response.put("code", "withdrawal_not_found");
                return ResponseEntity.status(404).body(response);
            }
            Map<String, Object> info = withdrawalInfo(withdrawal.get());
            if (withdrawal.get().getStatus() != WithdrawalStatus.PENDING) {
                info.put("signer", withdrawalService.recoverSigner(nonce));
            }
            response.put("status", "SUCCESS");
            response.put("withdrawal", info);
        } catch (Exception e) {
            return ErrorResponses.of("getWithdrawal", e);
        }
        return ResponseEntity.ok(response);
    }

    private Map<String, Object> withdrawalInfo(WithdrawalRequest w) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("nonce", w.getNonce());
        info.put("owner", w.getOwner());
        info.put("destination", w.getDestination());
        info.put("amount", w.getAmount().toString());
        info.put("status", w.getStatus());
        info.put("createdAt", w.getCreatedAt());
        if (w.getSignature() != null) {
            info.put("signature", w.getSignature());
        }
        if (w.getStatus() == WithdrawalStatus.COMPLETED) {
            info.put("completedAt", w.getCompletedAt());
            info.put("completionTxRef", w.getCompletionTxRef());
        }
        return info;
    }
}
