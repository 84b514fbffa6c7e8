package dao.b52.bridge.service;

import dao.b52.bridge.config.BridgeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FinalizedHeightCalculatorTest {

    private BridgeProperties props;
    private FinalizedHeightCalculator calculator;

    @BeforeEach
    void setUp() {
        props = new BridgeProperties();
        props.setL2GenesisTime(1_000_000L);
        props.setL2BlockIntervalSeconds(2);
        props.setFinalityMargin(64);
        calculator = new FinalizedHeightCalculator(props);
    }

    @Test
    @DisplayName("Height is elapsed blocks minus the finality margin")
    void subtractsFinalityMargin() {
        // 1000 seconds -> 500 blocks -> 436 after margin
        assertEquals(436L, calculator.finalizedHeight(1_001_000L));
    }

    @Test
    @DisplayName("Partial settlement blocks are floored")
    void floorsPartialBlocks() {
        assertEquals(436L, calculator.finalizedHeight(1_001_001L));
        assertEquals(437L, calculator.finalizedHeight(1_001_002L));
    }

    @Test
    @DisplayName("Never below 1, also before settlement genesis")
    void clampsToOne() {
        assertEquals(1L, calculator.finalizedHeight(1_000_000L));
        assertEquals(1L, calculator.finalizedHeight(1_000_100L));
        assertEquals(1L, calculator.finalizedHeight(0L));
    }

    @Test
    @DisplayName("Same block time always yields the same height")
    void deterministic() {
        long t = 1_234_567L;
        assertEquals(calculator.finalizedHeight(t), new FinalizedHeightCalculator(props).finalizedHeight(t));
    }

    @Test
    void followsConfiguredInterval() {
        props.setL2BlockIntervalSeconds(12);
        props.setFinalityMargin(0);
        assertEquals(10L, calculator.finalizedHeight(1_000_120L));
    }
}
