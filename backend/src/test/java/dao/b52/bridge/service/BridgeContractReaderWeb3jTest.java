package dao.b52.bridge.service;

import dao.b52.bridge.config.BridgeProperties;
import dao.b52.bridge.exception.BridgeReadException;
import dao.b52.bridge.model.DepositRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Decoding of deposits(uint256) return data as produced by the bridge contract.
 */
class BridgeContractReaderWeb3jTest {

    private static String encodeDeposit(String account, BigInteger amount) {
        return "0x" + FunctionEncoder.encodeConstructor(
                Arrays.<Type>asList(new Utf8String(account), new Uint256(amount)));
    }

    @Test
    @DisplayName("Decodes (string account, uint256 amount)")
    void decodesDeposit() {
        String raw = encodeDeposit("b521qypqxpq9qcrsszg2pvxq6rs0zqg3yyc5lzv7xu", BigInteger.valueOf(12_345_678L));

        Optional<DepositRecord> record = BridgeContractReaderWeb3j.decodeDeposit(7, 1_000L, raw);

        assertTrue(record.isPresent());
        assertEquals(7L, record.get().index());
        assertEquals("b521qypqxpq9qcrsszg2pvxq6rs0zqg3yyc5lzv7xu", record.get().account());
        assertEquals(BigInteger.valueOf(12_345_678L), record.get().amount());
        assertEquals(1_000L, record.get().atHeight());
    }

    @Test
    void decodesFullUint256Amount() {
        BigInteger max = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);

        Optional<DepositRecord> record = BridgeContractReaderWeb3j.decodeDeposit(1, 1L, encodeDeposit("b52ab", max));

        assertEquals(max, record.orElseThrow().amount());
    }

    @Test
    @DisplayName("Empty return data or empty account means not found")
    void notFound() {
        assertTrue(BridgeContractReaderWeb3j.decodeDeposit(1, 1L, null).isEmpty());
        assertTrue(BridgeContractReaderWeb3j.decodeDeposit(1, 1L, "0x").isEmpty());
        assertTrue(BridgeContractReaderWeb3j.decodeDeposit(1, 1L, encodeDeposit("", BigInteger.ZERO)).isEmpty());
    }

    @Test
    @DisplayName("Unconfigured contract address fails as a transient read error")
    void missingContractAddress() {
        Web3j web3j = Web3j.build(new HttpService("http://127.0.0.1:1"));
        try {
            BridgeContractReaderWeb3j reader = new BridgeContractReaderWeb3j(web3j, new BridgeProperties());
            assertThrows(BridgeReadException.class, () -> reader.findDeposit(1, 10L));
            assertThrows(BridgeReadException.class, () -> reader.highestDepositIndex(10L));
        } finally {
            web3j.shutdown();
        }
    }

    @Test
    @DisplayName("Unreachable node fails as a transient read error")
    void unreachableNode() {
        Web3j web3j = Web3j.build(new HttpService("http://127.0.0.1:1"));
        try {
            BridgeProperties props = new BridgeProperties();
            props.setContractAddress("0xcc391c8f1aFd6DB5D8b0e064BA81b1383b14FE5B");
            props.setRpcTimeoutMs(2_000);
            BridgeContractReaderWeb3j reader = new BridgeContractReaderWeb3j(web3j, props);

            assertThrows(BridgeReadException.class, reader::currentBlockNumber);
            assertThrows(BridgeReadException.class, () -> reader.findDeposit(1, null));
        } finally {
            web3j.shutdown();
        }
    }
}
