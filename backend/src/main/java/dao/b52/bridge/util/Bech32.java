package dao.b52.bridge.util;

import java.io.ByteArrayOutputStream;
import java.util.Locale;

/**
 * BIP-173 bech32 codec used for host chain account addresses.
 *
 * Encoding works on 8-bit payloads; conversion to the 5-bit alphabet happens inside.
 */
public final class Bech32 {
    private Bech32() {}

    private static final String CHARSET = "qpzry9x8gf2tvdw0s3jn54khce6mua7l";
    private static final int[] GENERATOR = {0x3b6a57b2, 0x26508e6d, 0x1ea119fa, 0x3d4233dd, 0x2a1462b3};
    private static final int MAX_LENGTH = 1023;

    public record Decoded(String hrp, byte[] data) {}

    public static String encode(String hrp, byte[] payload) {
        if (hrp == null || hrp.isEmpty()) {
            throw new IllegalArgumentException("Human readable part must not be empty");
        }
        String lowerHrp = hrp.toLowerCase(Locale.ROOT);
        byte[] values = convertBits(payload, 8, 5, true);
        byte[] checksum = createChecksum(lowerHrp, values);

        StringBuilder sb = new StringBuilder(lowerHrp.length() + 1 + values.length + checksum.length);
        sb.append(lowerHrp).append('1');
        for (byte v : values) sb.append(CHARSET.charAt(v));
        for (byte v : checksum) sb.append(CHARSET.charAt(v));
        return sb.toString();
    }

    public static Decoded decode(String value) {
        if (value == null || value.length() < 8 || value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("Invalid bech32 length");
        }
        boolean lower = false;
        boolean upper = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 33 || c > 126) throw new IllegalArgumentException("Invalid bech32 character at " + i);
            if (c >= 'a' && c <= 'z') lower = true;
            if (c >= 'A' && c <= 'Z') upper = true;
        }
        if (lower && upper) {
            throw new IllegalArgumentException("Mixed case bech32 string");
        }
        String s = value.toLowerCase(Locale.ROOT);
        int sep = s.lastIndexOf('1');
        if (sep < 1 || sep + 7 > s.length()) {
            throw new IllegalArgumentException("Missing or misplaced bech32 separator");
        }
        String hrp = s.substring(0, sep);
        byte[] values = new byte[s.length() - sep - 1];
        for (int i = 0; i < values.length; i++) {
            int d = CHARSET.indexOf(s.charAt(sep + 1 + i));
            if (d < 0) throw new IllegalArgumentException("Invalid bech32 data character: " + s.charAt(sep + 1 + i));
            values[i] = (byte) d;
        }
        if (polymod(hrpExpand(hrp), values) != 1) {
            throw new IllegalArgumentException("Invalid bech32 checksum");
        }
        byte[] data = new byte[values.length - 6];
        System.arraycopy(values, 0, data, 0, data.length);
        return new Decoded(hrp, convertBits(data, 5, 8, false));
    }

    private static byte[] createChecksum(String hrp, byte[] values) {
        byte[] enc = new byte[values.length + 6];
        System.arraycopy(values, 0, enc, 0, values.length);
        int mod = polymod(hrpExpand(hrp), enc) ^ 1;
        byte[] out = new byte[6];
        for (int i = 0; i < 6; i++) {
            out[i] = (byte) ((mod >>> (5 * (5 - i))) & 31);
        }
        return out;
    }

    private static byte[] hrpExpand(String hrp) {
        int n = hrp.length();
        byte[] out = new byte[n * 2 + 1];
        for (int i = 0; i < n; i++) {
            out[i] = (byte) (hrp.charAt(i) >>> 5);
            out[i + n + 1] = (byte) (hrp.charAt(i) & 31);
        }
        return out;
    }

    private static int polymod(byte[] hrp, byte[] values) {
        int chk = 1;
        chk = polymodStep(chk, hrp);
        return polymodStep(chk, values);
    }

    private static int polymodStep(int chk, byte[] values) {
        for (byte v : values) {
            int top = chk >>> 25;
            chk = ((chk & 0x1ffffff) << 5) ^ (v & 0xff);
            for (int i = 0; i < 5; i++) {
                if (((top >>> i) & 1) == 1) chk ^= GENERATOR[i];
            }
        }
        return chk;
    }

    private static byte[] convertBits(byte[] in, int fromBits, int toBits, boolean pad) {
        int acc = 0;
        int bits = 0;
        int maxv = (1 << toBits) - 1;
        int maxAcc = (1 << (fromBits + toBits - 1)) - 1;
        ByteArrayOutputStream out = new ByteArrayOutputStream(in.length * fromBits / toBits + 1);
        for (byte b : in) {
            int value = b & 0xff;
            if ((value >>> fromBits) != 0) {
                throw new IllegalArgumentException("Input value out of range for " + fromBits + "-bit group");
            }
            acc = ((acc << fromBits) | value) & maxAcc;
            bits += fromBits;
            while (bits >= toBits) {
                bits -= toBits;
                out.write((acc >>> bits) & maxv);
            }
        }
        if (pad) {
            if (bits > 0) out.write((acc << (toBits - bits)) & maxv);
        } else if (bits >= fromBits || ((acc << (toBits - bits)) & maxv) != 0) {
            throw new IllegalArgumentException("Invalid bech32 padding");
        }
        return out.toByteArray();
    }
}
