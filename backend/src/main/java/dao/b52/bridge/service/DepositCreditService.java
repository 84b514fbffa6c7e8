package dao.b52.bridge.service;

import dao.b52.bridge.config.BridgeProperties;
import dao.b52.bridge.config.HostChainProperties;
import dao.b52.bridge.exception.BridgeException;
import dao.b52.bridge.host.BlockContext;
import dao.b52.bridge.ledger.BankLedger;
import dao.b52.bridge.model.BridgeEvent;
import dao.b52.bridge.model.DepositOutcome;
import dao.b52.bridge.model.DepositRecord;
import dao.b52.bridge.repository.BridgeStore;
import dao.b52.bridge.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Credit-or-skip step shared by the ingestion engine, the gap scanner and manual processing.
 * <p>
 * A record that exists on the settlement chain always ends up in the processed set: either credited or,
 * when its data is unusable, skipped with a reason. Skipping is a pure function of the record, so every
 * validator reaches the same decision.
 * The caller owns the sync cursor.
 */
@Slf4j
@Service
public class DepositCreditService {

    private final BridgeStore store;
    private final BankLedger ledger;
    private final HostAddressCodec addressCodec;
    private final BridgeProperties bridgeProps;
    private final String denom;

    public DepositCreditService(BridgeStore store,
                                BankLedger ledger,
                                HostAddressCodec addressCodec,
                                BridgeProperties bridgeProps,
                                HostChainProperties hostProps) {
        this.store = store;
        this.ledger = ledger;
        this.addressCodec = addressCodec;
        this.bridgeProps = bridgeProps;
        this.denom = hostProps.getDenom();
    }

    public String recordId(long index) {
        return CryptoUtil.processedRecordId(bridgeProps.getContractAddress(), index);
    }

    public boolean isProcessed(long index) {
        return store.isProcessed(recordId(index));
    }

    public boolean isProcessedRecord(String recordId) {
        return store.isProcessed(recordId);
    }

    public DepositOutcome creditOrSkip(BlockContext ctx, DepositRecord record, long externalHeight) {
        long index = record.index();
        String id = recordId(index);
        String amountText = record.amount() == null ? "0" : record.amount().toString();

        if (store.isProcessed(id)) {
            return new DepositOutcome(DepositOutcome.Type.ALREADY_PROCESSED, index, id, null, amountText, externalHeight,
                    "already processed");
        }

        Optional<String> recipient = addressCodec.normalizeDepositAccount(record.account());
        String skipReason = null;
        if (recipient.isEmpty()) {
            skipReason = "invalid recipient address: " + record.account();
        } else if (record.amount() == null || record.amount().signum() <= 0) {
            skipReason = "zero amount";
        } else {
            try {
                ledger.mint(recipient.get(), record.amount());
            } catch (IllegalArgumentException | BridgeException e) {
                skipReason = "ledger rejected credit: " + e.getMessage();
            }
        }

        store.markProcessed(id);
        store.recordProcessedIndex(index, externalHeight);

        if (skipReason != null) {
            log.warn("Skipping deposit: index={}, account={}, amount={}, reason={}",
                    index, record.account(), amountText, skipReason);
            ctx.emit(BridgeEvent.DEPOSIT_SKIPPED,
                    "index", index,
                    "record_id", id,
                    "account", record.account(),
                    "amount", amountText,
                    "external_height", externalHeight,
                    "reason", skipReason);
            return new DepositOutcome(DepositOutcome.Type.SKIPPED, index, id, recipient.orElse(null), amountText,
                    externalHeight, skipReason);
        }

        log.info("Deposit credited: index={}, recipient={}, amount={}{}, externalHeight={}",
                index, recipient.get(), amountText, denom, externalHeight);
        ctx.emit(BridgeEvent.DEPOSIT_SYNCED,
                "index", index,
                "record_id", id,
                "recipient", recipient.get(),
                "amount", amountText,
                "denom", denom,
                "external_height", externalHeight);
        return new DepositOutcome(DepositOutcome.Type.SYNCED, index, id, recipient.get(), amountText, externalHeight, null);
    }
}
