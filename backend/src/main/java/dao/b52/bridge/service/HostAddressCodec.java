package dao.b52.bridge.service;

import dao.b52.bridge.config.HostChainProperties;
import dao.b52.bridge.util.Bech32;
import org.bouncycastle.util.encoders.Hex;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Host chain account addresses: bech32 with the configured prefix.
 * Deposits may also name the recipient as prefix + hex payload, which is re-encoded to bech32.
 */
@Component
public class HostAddressCodec {

    static final int MAX_PAYLOAD_BYTES = 255;

    private final String prefix;
    private final Pattern hexForm;

    public HostAddressCodec(HostChainProperties hostProps) {
        this.prefix = hostProps.getAddressPrefix().toLowerCase(Locale.ROOT);
        this.hexForm = Pattern.compile("^" + Pattern.quote(prefix) + "([0-9a-f]+)$");
    }

    public boolean isValid(String address) {
        if (address == null || address.isBlank()) return false;
        try {
            Bech32.Decoded decoded = Bech32.decode(address);
            return prefix.equals(decoded.hrp()) && isValidPayload(decoded.data());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /**
     * Deposit recipient to a canonical bech32 address, or empty if the account string is unusable.
     */
    public Optional<String> normalizeDepositAccount(String account) {
        if (account == null) return Optional.empty();
        String trimmed = account.trim();
        if (isValid(trimmed)) {
            return Optional.of(trimmed.toLowerCase(Locale.ROOT));
        }

        Matcher m = hexForm.matcher(trimmed.toLowerCase(Locale.ROOT));
        if (!m.matches()) return Optional.empty();
        String hex = m.group(1);
        if (hex.length() % 2 != 0) return Optional.empty();

        byte[] payload = Hex.decode(hex);
        if (!isValidPayload(payload)) return Optional.empty();
        return Optional.of(Bech32.encode(prefix, payload));
    }

    public String encode(byte[] payload) {
        if (!isValidPayload(payload)) {
            throw new IllegalArgumentException("Address payload must be 1.." + MAX_PAYLOAD_BYTES + " bytes");
        }
        return Bech32.encode(prefix, payload);
    }

    private static boolean isValidPayload(byte[] payload) {
        return payload != null && payload.length > 0 && payload.length <= MAX_PAYLOAD_BYTES;
    }
}
