package dao.b52.bridge.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CryptoUtilTest {

    @Test
    @DisplayName("Record id is sha256 of the configured contract, dash, index")
    void processedRecordIdLayout() {
        String expected = CryptoUtil.toHex0x(Hash.sha256(
                "0xcc391c8f1aFd6DB5D8b0e064BA81b1383b14FE5B-7".getBytes(StandardCharsets.UTF_8)));

        String id = CryptoUtil.processedRecordId(" 0xcc391c8f1aFd6DB5D8b0e064BA81b1383b14FE5B ", 7);

        assertEquals(expected, id);
        assertEquals(66, id.length());
        assertNotEquals(id, CryptoUtil.processedRecordId("0xcc391c8f1afd6db5d8b0e064ba81b1383b14fe5b", 7));
    }

    @Test
    void recordIdsDifferPerIndexAndContract() {
        String contract = "0xcc391c8f1afd6db5d8b0e064ba81b1383b14fe5b";
        assertNotEquals(CryptoUtil.processedRecordId(contract, 1), CryptoUtil.processedRecordId(contract, 2));
        assertNotEquals(CryptoUtil.processedRecordId(contract, 1),
                CryptoUtil.processedRecordId("0x0000000000000000000000000000000000000001", 1));
    }

    @Test
    @DisplayName("Nonce is bytes32 hex")
    void formatNonce() {
        assertEquals("0x" + "0".repeat(63) + "1", CryptoUtil.formatNonce(1));
        assertEquals("0x" + "0".repeat(62) + "ff", CryptoUtil.formatNonce(255));
        assertTrue(CryptoUtil.isNonce(CryptoUtil.formatNonce(42)));
        assertFalse(CryptoUtil.isNonce("0x01"));
        assertFalse(CryptoUtil.isNonce("0x" + "g".repeat(64)));
    }

    @Test
    void uint256Bounds() {
        BigInteger max = BigInteger.TWO.pow(256).subtract(BigInteger.ONE);
        assertTrue(CryptoUtil.isUint256(max));
        assertFalse(CryptoUtil.isUint256(max.add(BigInteger.ONE)));
        assertFalse(CryptoUtil.isUint256(BigInteger.valueOf(-1)));
    }
}
