package dao.b52.bridge.service;

import dao.b52.bridge.config.HostChainProperties;
import dao.b52.bridge.util.Bech32;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class HostAddressCodecTest {

    private HostAddressCodec codec;
    private byte[] payload;

    @BeforeEach
    void setUp() {
        codec = new HostAddressCodec(new HostChainProperties());
        payload = new byte[20];
        for (int i = 0; i < payload.length; i++) payload[i] = (byte) (i + 1);
    }

    @Test
    @DisplayName("Bech32 address with the host prefix is accepted as is")
    void acceptsBech32() {
        String address = codec.encode(payload);

        assertTrue(address.startsWith("b521"));
        assertTrue(codec.isValid(address));
        assertEquals(Optional.of(address), codec.normalizeDepositAccount(address));
    }

    @Test
    @DisplayName("Upper case bech32 is normalized to lower case")
    void normalizesCase() {
        String address = codec.encode(payload);
        assertEquals(Optional.of(address), codec.normalizeDepositAccount(address.toUpperCase(Locale.ROOT)));
    }

    @Test
    @DisplayName("prefix + hex payload is re-encoded as bech32")
    void reencodesHexForm() {
        String hexForm = "b52" + "0102030405060708090a0b0c0d0e0f1011121314";

        Optional<String> normalized = codec.normalizeDepositAccount(hexForm);

        assertTrue(normalized.isPresent());
        assertEquals(codec.encode(payload), normalized.get());
        assertArrayEquals(payload, Bech32.decode(normalized.get()).data());
    }

    @Test
    @DisplayName("prefix + hex payload is accepted in upper case")
    void reencodesUpperCaseHexForm() {
        String expected = codec.encode(payload);

        assertEquals(Optional.of(expected),
                codec.normalizeDepositAccount("b52" + "0102030405060708090A0B0C0D0E0F1011121314"));
        assertEquals(Optional.of(expected),
                codec.normalizeDepositAccount(" B520102030405060708090A0B0C0D0E0F1011121314 "));
    }

    @Test
    @DisplayName("Unusable account strings are rejected")
    void rejectsMalformed() {
        assertTrue(codec.normalizeDepositAccount(null).isEmpty());
        assertTrue(codec.normalizeDepositAccount("").isEmpty());
        assertTrue(codec.normalizeDepositAccount("b52").isEmpty());
        assertTrue(codec.normalizeDepositAccount("b52abc").isEmpty(), "odd length hex");
        assertTrue(codec.normalizeDepositAccount("B52ABC").isEmpty(), "odd length upper case hex");
        assertTrue(codec.normalizeDepositAccount("0x2c7536e3605d9c16a7a3d7b1898e529396a65c23").isEmpty());
        assertTrue(codec.normalizeDepositAccount(Bech32.encode("cosmos", payload)).isEmpty(), "foreign prefix");
    }

    @Test
    @DisplayName("Payload longer than 255 bytes is rejected")
    void rejectsOversizedPayload() {
        String hexForm = "b52" + "ab".repeat(256);
        assertTrue(codec.normalizeDepositAccount(hexForm).isEmpty());
        assertTrue(codec.normalizeDepositAccount("b52" + "ab".repeat(255)).isPresent());
    }

    @Test
    void corruptedChecksumIsInvalid() {
        String address = codec.encode(payload);
        char last = address.charAt(address.length() - 1);
        String corrupted = address.substring(0, address.length() - 1) + (last == 'q' ? 'p' : 'q');
        assertFalse(codec.isValid(corrupted));
    }
}
