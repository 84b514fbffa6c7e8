package dao.b52.bridge.service;

import dao.b52.bridge.config.ScannerProperties;
import dao.b52.bridge.exception.BridgeReadException;
import dao.b52.bridge.host.BlockContext;
import dao.b52.bridge.model.DepositOutcome;
import dao.b52.bridge.model.DepositRecord;
import dao.b52.bridge.repository.BridgeStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Rate-limited gap filler. Every check interval (host block time) it looks at all indices up to the
 * contract's highest one and handles those the sequential engine has not reached or has missed.
 */
@Slf4j
@Service
public class BatchDepositScanner {

    private final BridgeStore store;
    private final BridgeContractReader reader;
    private final DepositCreditService creditService;
    private final FinalizedHeightCalculator heightCalculator;
    private final ScannerProperties props;

    public BatchDepositScanner(BridgeStore store,
                               BridgeContractReader reader,
                               DepositCreditService creditService,
                               FinalizedHeightCalculator heightCalculator,
                               ScannerProperties props) {
        this.store = store;
        this.reader = reader;
        this.creditService = creditService;
        this.heightCalculator = heightCalculator;
        this.props = props;
    }

    public boolean isDue(long blockTime) {
        return blockTime - store.getLastDepositCheckTime() >= props.getCheckIntervalSeconds();
    }

    /**
     * @return number of deposits credited or skipped in this run; at most max-batch missing indices are looked up
     */
    public int scan(BlockContext ctx) {
        if (!props.isEnabled() || !isDue(ctx.getBlockTime())) {
            return 0;
        }
        store.setLastDepositCheckTime(ctx.getBlockTime());

        long height = heightCalculator.finalizedHeight(ctx.getBlockTime());
        long highest;
        try {
            long current = reader.currentBlockNumber();
            if (current < height) {
                log.warn("Settlement node behind finalized height, skipping scan: nodeHeight={}, finalizedHeight={}",
                        current, height);
                return 0;
            }
            highest = reader.highestDepositIndex(height);
        } catch (BridgeReadException e) {
            log.warn("Deposit scan aborted: {}", e.getMessage());
            return 0;
        }

        // max-batch bounds the missing indices looked up per run, found or not
        int maxBatch = Math.max(1, props.getMaxBatch());
        int attempted = 0;
        int handled = 0;
        for (long index = 0; index <= highest && attempted < maxBatch; index++) {
            if (creditService.isProcessed(index)) {
                continue;
            }
            attempted++;
            Optional<DepositRecord> record;
            try {
                record = reader.findDeposit(index, height);
            } catch (BridgeReadException e) {
                log.warn("Deposit scan stopped at index={}: {}", index, e.getMessage());
                break;
            }
            if (record.isEmpty()) {
                continue;
            }
            DepositOutcome outcome = creditService.creditOrSkip(ctx, record.get(), height);
            log.info("Scanner handled missing deposit: index={}, outcome={}", index, outcome.type());
            handled++;
        }

        log.info("Deposit scan done: blockTime={}, finalizedHeight={}, highestIndex={}, attempted={}, handled={}",
                ctx.getBlockTime(), height, highest, attempted, handled);
        return handled;
    }
}
