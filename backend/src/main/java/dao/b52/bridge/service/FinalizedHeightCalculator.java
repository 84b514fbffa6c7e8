package dao.b52.bridge.service;

import dao.b52.bridge.config.BridgeProperties;
import org.springframework.stereotype.Component;

/**
 * Derives the settlement chain height to read deposits at from host block time alone, so every validator
 * reads at the same height no matter how far its own node has synced.
 */
@Component
public class FinalizedHeightCalculator {

    private final BridgeProperties props;

    public FinalizedHeightCalculator(BridgeProperties props) {
        this.props = props;
    }

    /**
     * max(1, floor((blockTime - l2GenesisTime) / l2BlockInterval) - finalityMargin)
     */
    public long finalizedHeight(long blockTime) {
        long interval = Math.max(1L, props.getL2BlockIntervalSeconds());
        long elapsed = Math.max(0L, blockTime - props.getL2GenesisTime());
        long estimated = elapsed / interval;
        return Math.max(1L, estimated - props.getFinalityMargin());
    }
}
