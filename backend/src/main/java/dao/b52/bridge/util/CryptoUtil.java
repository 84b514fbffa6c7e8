package dao.b52.bridge.util;

import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

/**
 * Hashing and hex helpers shared by the deposit and withdrawal paths.
 *
 * IMPORTANT:
 * - Record ids feed the processed-record set, which is consensus state. Changing the id layout
 *   makes every validator re-credit already bridged deposits.
 */
public final class CryptoUtil {
    private CryptoUtil() {}

    /**
     * Deterministic id of a deposit record: 0x + hex(sha256("{contract}-{index}")).
     * The contract address is hashed exactly as configured: checksum and lower-case forms give different ids.
     */
    public static String processedRecordId(String contractAddress, long index) {
        String contract = contractAddress == null ? "" : contractAddress.trim();
        String input = contract + "-" + Long.toUnsignedString(index);
        return toHex0x(Hash.sha256(input.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Withdrawal nonce as the settlement contract expects it: 0x + 64 hex (bytes32).
     */
    public static String formatNonce(long sequence) {
        return "0x" + String.format("%064x", BigInteger.valueOf(sequence));
    }

    public static boolean isNonce(String value) {
        return value != null && value.length() == 66 && value.startsWith("0x") && isHex(value.substring(2));
    }

    public static boolean isUint256(BigInteger value) {
        return value != null && value.signum() >= 0 && value.bitLength() <= 256;
    }

    public static String toHex0x(byte[] bytes) {
        StringBuilder sb = new StringBuilder("0x");
        for (byte b : bytes) sb.append(String.format("%02x", b));
        return sb.toString();
    }

    public static String strip0x(String value) {
        if (value == null) return "";
        return (value.startsWith("0x") || value.startsWith("0X"))
                ? value.substring(2)
                : value;
    }

    public static boolean isHex(String value) {
        if (value == null || value.isEmpty()) return false;
        for (int i = 0; i < value.length(); i++) {
            if (Character.digit(value.charAt(i), 16) < 0) return false;
        }
        return true;
    }
}
