package dao.b52.bridge.service;

import dao.b52.bridge.exception.InvalidSignerKeyException;
import dao.b52.bridge.model.WithdrawalRequest;
import dao.b52.bridge.util.CryptoUtil;
import org.springframework.stereotype.Component;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Keys;
import org.web3j.crypto.Sign;
import org.web3j.crypto.WalletUtils;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Locale;

/**
 * Withdrawal authorizations the settlement contract can verify with ecrecover.
 * <p>
 * Solidity side:
 * hash = keccak256(abi.encodePacked(address destination, uint256 amount, bytes32 nonce));
 * signedHash = toEthSignedMessageHash(hash);
 * require(recover(signedHash, signature) == validator);
 */
@Component
public class WithdrawalSigner {

    public String sign(WithdrawalRequest request, String signerKeyHex) {
        ECKeyPair keyPair = parseKey(signerKeyHex);
        byte[] messageHash = withdrawalMessageHash(request.getDestination(), request.getAmount(), request.getNonce());
        Sign.SignatureData sig = Sign.signPrefixedMessage(messageHash, keyPair);

        byte[] out = new byte[65];
        System.arraycopy(sig.getR(), 0, out, 0, 32);
        System.arraycopy(sig.getS(), 0, out, 32, 32);
        byte v = sig.getV()[0];
        out[64] = v < 27 ? (byte) (v + 27) : v;
        return Numeric.toHexString(out);
    }

    /**
     * Settlement chain address (0x + 40 hex, lower case) that produced the stored signature.
     */
    public String recoverSigner(WithdrawalRequest request) {
        if (request.getSignature() == null) {
            throw new IllegalStateException("Withdrawal " + request.getNonce() + " is not signed");
        }
        byte[] sig = Numeric.hexStringToByteArray(request.getSignature());
        if (sig.length != 65) {
            throw new IllegalStateException("Signature must be 65 bytes, got " + sig.length);
        }
        byte v = sig[64];
        Sign.SignatureData data = new Sign.SignatureData(
                v < 27 ? (byte) (v + 27) : v,
                Arrays.copyOfRange(sig, 0, 32),
                Arrays.copyOfRange(sig, 32, 64)
        );
        byte[] messageHash = withdrawalMessageHash(request.getDestination(), request.getAmount(), request.getNonce());
        try {
            BigInteger publicKey = Sign.signedPrefixedMessageToKey(messageHash, data);
            return "0x" + Keys.getAddress(publicKey);
        } catch (SignatureException e) {
            throw new IllegalStateException("Signature recovery failed for withdrawal " + request.getNonce(), e);
        }
    }

    public String addressOf(String signerKeyHex) {
        return "0x" + Keys.getAddress(parseKey(signerKeyHex));
    }

    /**
     * keccak256(destination20 || amount32 || nonce32)
     */
    public static byte[] withdrawalMessageHash(String destination, BigInteger amount, String nonce) {
        byte[] dest20 = Numeric.hexStringToByteArray(destination);
        if (dest20.length != 20) {
            throw new IllegalArgumentException("Destination must be 20 bytes, got " + dest20.length);
        }
        byte[] amount32 = Numeric.toBytesPadded(amount, 32);
        byte[] nonce32 = Numeric.hexStringToByteArray(nonce);
        if (nonce32.length != 32) {
            throw new IllegalArgumentException("Nonce must be 32 bytes, got " + nonce32.length);
        }

        byte[] packed = new byte[20 + 32 + 32];
        System.arraycopy(dest20, 0, packed, 0, 20);
        System.arraycopy(amount32, 0, packed, 20, 32);
        System.arraycopy(nonce32, 0, packed, 52, 32);
        return Hash.sha3(packed);
    }

    static ECKeyPair parseKey(String signerKeyHex) {
        String clean = CryptoUtil.strip0x(signerKeyHex == null ? "" : signerKeyHex.trim()).toLowerCase(Locale.ROOT);
        if (clean.length() != 64 || !CryptoUtil.isHex(clean) || !WalletUtils.isValidPrivateKey(clean)) {
            throw new InvalidSignerKeyException("signer key must be 32 bytes of hex");
        }
        BigInteger key = new BigInteger(clean, 16);
        if (key.signum() == 0) {
            throw new InvalidSignerKeyException("signer key must not be zero");
        }
        return ECKeyPair.create(key);
    }
}
