package dao.b52.bridge.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dao.b52.bridge.exception.InvalidStateImportException;
import dao.b52.bridge.host.BlockContext;
import dao.b52.bridge.model.BridgeGenesis;
import dao.b52.bridge.model.SyncCursor;
import dao.b52.bridge.model.WithdrawalRequest;
import dao.b52.bridge.model.WithdrawalStatus;
import dao.b52.bridge.support.BridgeTestFixture;
import dao.b52.bridge.util.CryptoUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class BridgeGenesisServiceTest {

    private static final String KEY = "4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318";
    private static final String DESTINATION = "0x1111111111111111111111111111111111111111";

    private BridgeTestFixture source;
    private String alice;

    @BeforeEach
    void setUp() {
        source = new BridgeTestFixture();
        alice = source.hostAddress(1);

        source.reader.deposit(1, alice, 1_000L, 10);
        source.reader.deposit(2, "bogus", 5L, 10);
        source.ingestionService.syncDeposits(source.blockAtHeight(10, 100));
        source.scanner.scan(source.blockAtHeight(11, 100));

        BlockContext block = BlockContext.of(12, 1_700_000_500L);
        String nonce = source.withdrawalService.initiateWithdrawal(block, alice, DESTINATION, BigInteger.valueOf(300L)).getNonce();
        source.withdrawalService.signWithdrawal(block, nonce, KEY);
        source.withdrawalService.initiateWithdrawal(block, alice, DESTINATION, BigInteger.valueOf(200L));
    }

    @Test
    @DisplayName("Export then import into a fresh node reproduces the state")
    void exportImportRoundTrip() {
        BridgeGenesis exported = source.genesisService.exportGenesis();

        BridgeTestFixture target = new BridgeTestFixture();
        target.genesisService.importGenesis(exported);

        assertEquals(exported, target.genesisService.exportGenesis());
        assertEquals(BigInteger.valueOf(500L), target.ledger.spendable(alice));
        assertEquals(source.store.getSyncCursor(), target.store.getSyncCursor());
    }

    @Test
    @DisplayName("Export survives JSON serialization")
    void jsonRoundTrip(@TempDir Path dir) throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        Path file = dir.resolve("bridge-genesis.json");
        Files.write(file, mapper.writeValueAsBytes(source.genesisService.exportGenesis()));

        BridgeTestFixture target = new BridgeTestFixture();
        BridgeGenesis read = target.genesisService.readGenesisFile(file);
        target.genesisService.importGenesis(read);

        assertEquals(source.genesisService.exportGenesis(), target.genesisService.exportGenesis());
    }

    @Test
    @DisplayName("Imported nonce sequence and processed set keep working")
    void importedStateContinues() {
        BridgeTestFixture target = new BridgeTestFixture();
        target.genesisService.importGenesis(source.genesisService.exportGenesis());
        target.reader.deposit(1, alice, 1_000L, 10);
        target.reader.deposit(3, alice, 7L, 10);

        String nonce = target.withdrawalService
                .initiateWithdrawal(BlockContext.of(1, 1), alice, DESTINATION, BigInteger.ONE).getNonce();
        target.scanner.scan(target.blockAtHeight(2, 500));

        assertEquals(CryptoUtil.formatNonce(3), nonce);
        // 500 imported - 1 withdrawn + 7 from index 3; index 1 not credited again
        assertEquals(BigInteger.valueOf(506L), target.ledger.spendable(alice));
    }

    @Test
    void importRejectedOnceStateExists() {
        BridgeGenesis exported = source.genesisService.exportGenesis();
        assertThrows(InvalidStateImportException.class, () -> source.genesisService.importGenesis(exported));
    }

    @Test
    void rejectsMalformedDocuments() {
        BridgeTestFixture target = new BridgeTestFixture();

        BridgeGenesis badId = source.genesisService.exportGenesis();
        badId.setProcessedRecordIds(List.of("0x1234"));
        assertThrows(InvalidStateImportException.class, () -> target.genesisService.importGenesis(badId));

        BridgeGenesis otherContract = source.genesisService.exportGenesis();
        otherContract.setContractAddress("0x0000000000000000000000000000000000000001");
        assertThrows(InvalidStateImportException.class, () -> target.genesisService.importGenesis(otherContract));

        BridgeGenesis recased = source.genesisService.exportGenesis();
        recased.setContractAddress(BridgeTestFixture.CONTRACT.toLowerCase(Locale.ROOT));
        assertThrows(InvalidStateImportException.class, () -> target.genesisService.importGenesis(recased));

        BridgeGenesis nonceBehind = source.genesisService.exportGenesis();
        nonceBehind.setWithdrawalNonce(1L);
        assertThrows(InvalidStateImportException.class, () -> target.genesisService.importGenesis(nonceBehind));

        BridgeGenesis badCursor = source.genesisService.exportGenesis();
        badCursor.setSyncCursor(new SyncCursor(-1, 0, 0));
        assertThrows(InvalidStateImportException.class, () -> target.genesisService.importGenesis(badCursor));

        assertTrue(target.store.processedRecordIds().isEmpty());
        assertEquals(BigInteger.ZERO, target.ledger.totalSupply());
    }

    @Test
    @DisplayName("Withdrawals imported in mixed case are stored canonically and found by nonce")
    void importedWithdrawalFoundByNonce() {
        String nonce = "0x" + "0".repeat(63) + "A";
        BridgeGenesis genesis = new BridgeGenesis();
        genesis.setWithdrawalNonce(10L);
        genesis.setWithdrawalRequests(List.of(
                new WithdrawalRequest(nonce, alice, "0xABCDEF" + "0".repeat(34), BigInteger.TEN, 5L)));

        BridgeTestFixture target = new BridgeTestFixture();
        target.genesisService.importGenesis(genesis);

        WithdrawalRequest byUpper = target.withdrawalService.getWithdrawal(nonce).orElseThrow();
        WithdrawalRequest byLower = target.withdrawalService.getWithdrawal(nonce.toLowerCase(Locale.ROOT)).orElseThrow();
        assertEquals(byUpper, byLower);
        assertEquals("0x" + "0".repeat(63) + "a", byLower.getNonce());
        assertEquals("0xabcdef" + "0".repeat(34), byLower.getDestination());

        String signature = target.withdrawalService.signWithdrawal(BlockContext.of(1, 1), nonce, KEY);
        assertEquals(132, signature.length());
    }

    @Test
    void rejectsMalformedSignature() {
        BridgeGenesis truncated = source.genesisService.exportGenesis();
        WithdrawalRequest signed = truncated.getWithdrawalRequests().stream()
                .filter(w -> w.getStatus() == WithdrawalStatus.SIGNED)
                .findFirst().orElseThrow();
        List<WithdrawalRequest> requests = new ArrayList<>(truncated.getWithdrawalRequests());
        requests.set(requests.indexOf(signed), new WithdrawalRequest(signed.getNonce(), signed.getOwner(),
                signed.getDestination(), signed.getAmount(), signed.getCreatedAt(), WithdrawalStatus.SIGNED,
                signed.getSignature().substring(0, 130), 0L, null));
        truncated.setWithdrawalRequests(requests);

        BridgeTestFixture target = new BridgeTestFixture();
        assertThrows(InvalidStateImportException.class, () -> target.genesisService.importGenesis(truncated));

        requests.set(requests.indexOf(signed), new WithdrawalRequest(signed.getNonce(), signed.getOwner(),
                signed.getDestination(), signed.getAmount(), signed.getCreatedAt(), WithdrawalStatus.SIGNED,
                "not-a-signature", 0L, null));
        assertThrows(InvalidStateImportException.class, () -> target.genesisService.importGenesis(truncated));
        assertTrue(target.store.findWithdrawals().isEmpty());
    }

    @Test
    void missingFileIsRejected(@TempDir Path dir) {
        assertThrows(InvalidStateImportException.class,
                () -> source.genesisService.readGenesisFile(dir.resolve("missing.json")));
    }
}
