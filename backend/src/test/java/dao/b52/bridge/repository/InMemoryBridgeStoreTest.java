package dao.b52.bridge.repository;

import dao.b52.bridge.host.Checkpointable;
import dao.b52.bridge.model.SyncCursor;
import dao.b52.bridge.model.WithdrawalRequest;
import dao.b52.bridge.model.WithdrawalStatus;
import dao.b52.bridge.util.CryptoUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryBridgeStoreTest {

    private InMemoryBridgeStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryBridgeStore();
    }

    @Test
    void nonceSequenceStartsAtOne() {
        assertEquals(0L, store.getWithdrawalNonce());
        assertEquals(1L, store.nextWithdrawalNonce());
        assertEquals(2L, store.nextWithdrawalNonce());
        assertThrows(IllegalArgumentException.class, () -> store.setWithdrawalNonce(1L));
    }

    @Test
    void withdrawalLookupIgnoresNonceCase() {
        String nonce = CryptoUtil.formatNonce(0xab);
        store.saveWithdrawal(new WithdrawalRequest(nonce, "owner", "0x" + "1".repeat(40), BigInteger.ONE, 1L));

        assertTrue(store.findWithdrawal(nonce.toUpperCase().replace("0X", "0x")).isPresent());
        assertTrue(store.findWithdrawal(CryptoUtil.formatNonce(1)).isEmpty());
    }

    @Test
    void checkpointRestoresEverything() {
        String nonce = CryptoUtil.formatNonce(store.nextWithdrawalNonce());
        WithdrawalRequest request = new WithdrawalRequest(nonce, "owner", "0x" + "1".repeat(40), BigInteger.ONE, 1L);
        store.saveWithdrawal(request);
        store.markProcessed("0xaa");
        Checkpointable.Checkpoint checkpoint = store.checkpoint();

        request.markSigned("0x01");
        store.saveWithdrawal(request);
        store.markProcessed("0xbb");
        store.recordProcessedIndex(3, 30);
        store.saveSyncCursor(SyncCursor.INITIAL.advance(3, 30));
        store.setLastDepositCheckTime(99);
        store.nextWithdrawalNonce();

        checkpoint.revert();

        assertEquals(WithdrawalStatus.PENDING, store.findWithdrawal(nonce).orElseThrow().getStatus());
        assertEquals(1, store.processedRecordIds().size());
        assertTrue(store.processedDepositIndices().isEmpty());
        assertEquals(SyncCursor.INITIAL, store.getSyncCursor());
        assertEquals(0L, store.getLastDepositCheckTime());
        assertEquals(1L, store.getWithdrawalNonce());
    }
}
