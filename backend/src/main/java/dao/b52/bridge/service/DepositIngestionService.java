package dao.b52.bridge.service;

import dao.b52.bridge.config.BridgeProperties;
import dao.b52.bridge.exception.BridgeReadException;
import dao.b52.bridge.exception.DepositAlreadyProcessedException;
import dao.b52.bridge.exception.DepositNotFoundException;
import dao.b52.bridge.host.BlockContext;
import dao.b52.bridge.model.BridgeEvent;
import dao.b52.bridge.model.DepositOutcome;
import dao.b52.bridge.model.DepositRecord;
import dao.b52.bridge.model.SyncCursor;
import dao.b52.bridge.repository.BridgeStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Optional;

/**
 * Sequential deposit ingestion: walks the contract's deposit indices in order, one cursor step per record.
 * <p>
 * Rules per block:
 * - read at the finalized height derived from block time, never at the node's latest block
 * - record missing at that height: stop, nothing written
 * - record already processed: move the cursor index only
 * - otherwise credit or skip, then move the cursor to {index, height}
 * - settlement chain unreachable: stop, nothing written, retry next block
 */
@Slf4j
@Service
public class DepositIngestionService {

    private final BridgeStore store;
    private final BridgeContractReader reader;
    private final DepositCreditService creditService;
    private final FinalizedHeightCalculator heightCalculator;
    private final BridgeProperties props;

    public DepositIngestionService(BridgeStore store,
                                   BridgeContractReader reader,
                                   DepositCreditService creditService,
                                   FinalizedHeightCalculator heightCalculator,
                                   BridgeProperties props) {
        this.store = store;
        this.reader = reader;
        this.creditService = creditService;
        this.heightCalculator = heightCalculator;
        this.props = props;
    }

    /**
     * Runs once per host block.
     *
     * @return number of indices the cursor moved over
     */
    public int syncDeposits(BlockContext ctx) {
        long height = heightCalculator.finalizedHeight(ctx.getBlockTime());
        int maxPerBlock = Math.max(1, props.getMaxDepositsPerBlock());
        int handled = 0;

        while (handled < maxPerBlock) {
            SyncCursor cursor = store.getSyncCursor();
            long index = cursor.nextIndex();

            Optional<DepositRecord> record;
            try {
                record = reader.findDeposit(index, height);
            } catch (BridgeReadException e) {
                log.warn("Deposit read failed, retrying next block: index={}, height={}, error={}",
                        index, height, e.getMessage());
                break;
            }

            if (record.isEmpty()) {
                log.debug("No deposit at index={} as of height={}", index, height);
                break;
            }

            if (creditService.isProcessed(index)) {
                log.debug("Deposit index={} already processed, advancing cursor", index);
                store.saveSyncCursor(cursor.advanceIndex(index));
                handled++;
                continue;
            }

            creditService.creditOrSkip(ctx, record.get(), height);
            store.saveSyncCursor(cursor.advance(index, height));
            handled++;
        }

        if (handled > 0) {
            SyncCursor cursor = store.getSyncCursor();
            log.info("Deposit sync: blockHeight={}, handled={}, lastProcessedIndex={}, lastExternalHeight={}",
                    ctx.getHeight(), handled, cursor.lastProcessedIndex(), cursor.lastExternalHeight());
        }
        return handled;
    }

    /**
     * Operator-triggered processing of one deposit index. Leaves the sync cursor alone; the engine skips the
     * index later because its record id is already processed.
     *
     * @param externalHeight height to read at; null or 0 means the settlement chain's current block
     */
    public DepositOutcome processDeposit(BlockContext ctx, long index, Long externalHeight) {
        if (creditService.isProcessed(index)) {
            throw new DepositAlreadyProcessedException("deposit " + index + " already processed");
        }

        long height = (externalHeight == null || externalHeight == 0L)
                ? reader.currentBlockNumber()
                : externalHeight;

        DepositRecord record = reader.findDeposit(index, height)
                .orElseThrow(() -> new DepositNotFoundException(
                        "deposit " + index + " not found at settlement height " + height));

        DepositOutcome outcome = creditService.creditOrSkip(ctx, record, height);
        ctx.emit(BridgeEvent.BRIDGE_DEPOSIT_PROCESSED,
                "index", index,
                "outcome", outcome.type().name().toLowerCase(Locale.ROOT),
                "recipient", outcome.recipient() == null ? "" : outcome.recipient(),
                "amount", outcome.amount(),
                "external_height", height);
        return outcome;
    }
}
