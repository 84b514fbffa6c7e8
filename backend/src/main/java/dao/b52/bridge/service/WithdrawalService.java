package dao.b52.bridge.service;

import dao.b52.bridge.config.HostChainProperties;
import dao.b52.bridge.exception.InsufficientFundsException;
import dao.b52.bridge.exception.InvalidAddressException;
import dao.b52.bridge.exception.InvalidAmountException;
import dao.b52.bridge.exception.InvalidDestinationException;
import dao.b52.bridge.exception.InvalidNonceException;
import dao.b52.bridge.exception.InvalidWithdrawalStateException;
import dao.b52.bridge.exception.WithdrawalNotFoundException;
import dao.b52.bridge.host.BlockContext;
import dao.b52.bridge.ledger.BankLedger;
import dao.b52.bridge.model.BridgeEvent;
import dao.b52.bridge.model.WithdrawalRequest;
import dao.b52.bridge.model.WithdrawalStatus;
import dao.b52.bridge.repository.BridgeStore;
import dao.b52.bridge.util.CryptoUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Burn-and-authorize withdrawals. Burning happens in the same transaction that records the request, so a
 * stored request always has its amount removed from circulation on the host chain.
 */
@Slf4j
@Service
public class WithdrawalService {

    private final BridgeStore store;
    private final BankLedger ledger;
    private final HostAddressCodec addressCodec;
    private final WithdrawalSigner signer;
    private final String denom;

    public WithdrawalService(BridgeStore store,
                             BankLedger ledger,
                             HostAddressCodec addressCodec,
                             WithdrawalSigner signer,
                             HostChainProperties hostProps) {
        this.store = store;
        this.ledger = ledger;
        this.addressCodec = addressCodec;
        this.signer = signer;
        this.denom = hostProps.getDenom();
    }

    public WithdrawalRequest initiateWithdrawal(BlockContext ctx, String owner, String destination, BigInteger amount) {
        if (!addressCodec.isValid(owner)) {
            throw new InvalidAddressException("invalid owner address: " + owner);
        }
        String normalizedOwner = owner.trim().toLowerCase(Locale.ROOT);

        if (!isSettlementAddress(destination)) {
            throw new InvalidDestinationException("destination must be 0x followed by 40 hex characters");
        }
        String normalizedDestination = destination.toLowerCase(Locale.ROOT);

        if (amount == null || amount.signum() <= 0) {
            throw new InvalidAmountException("amount must be positive");
        }
        if (!CryptoUtil.isUint256(amount)) {
            throw new InvalidAmountException("amount exceeds uint256");
        }

        // checked before allocating a nonce so a rejected request does not consume one
        BigInteger spendable = ledger.spendable(normalizedOwner);
        if (spendable.compareTo(amount) < 0) {
            throw new InsufficientFundsException("insufficient balance: have " + spendable + denom + ", need " + amount + denom);
        }

        String nonce = CryptoUtil.formatNonce(store.nextWithdrawalNonce());
        ledger.burn(normalizedOwner, amount);

        WithdrawalRequest request = new WithdrawalRequest(nonce, normalizedOwner, normalizedDestination, amount,
                ctx.getBlockTime());
        store.saveWithdrawal(request);

        log.info("Withdrawal initiated: nonce={}, owner={}, destination={}, amount={}{}",
                nonce, normalizedOwner, normalizedDestination, amount, denom);
        ctx.emit(BridgeEvent.WITHDRAWAL_INITIATED,
                "nonce", nonce,
                "owner", normalizedOwner,
                "destination", normalizedDestination,
                "amount", amount,
                "denom", denom);
        return request.copy();
    }

    /**
     * Sign a withdrawal. Signing an already signed request returns the stored signature unchanged.
     *
     * @return hex signature (0x + 130 hex)
     */
    public String signWithdrawal(BlockContext ctx, String nonce, String signerKeyHex) {
        requireNonceFormat(nonce);
        WithdrawalSigner.parseKey(signerKeyHex);
        WithdrawalRequest request = require(nonce);

        if (request.getStatus() == WithdrawalStatus.COMPLETED) {
            throw new InvalidWithdrawalStateException("withdrawal " + request.getNonce() + " is already completed");
        }
        if (request.getStatus() == WithdrawalStatus.SIGNED) {
            log.debug("Withdrawal {} already signed, returning stored signature", request.getNonce());
            return request.getSignature();
        }

        String signature = signer.sign(request, signerKeyHex);
        request.markSigned(signature);
        store.saveWithdrawal(request);

        log.info("Withdrawal signed: nonce={}, signer={}", request.getNonce(), signer.addressOf(signerKeyHex));
        ctx.emit(BridgeEvent.WITHDRAWAL_SIGNED,
                "nonce", request.getNonce(),
                "destination", request.getDestination(),
                "amount", request.getAmount(),
                "signature", signature);
        return signature;
    }

    /**
     * Record that the authorization was redeemed on the settlement chain. Completing twice is a no-op.
     */
    public WithdrawalRequest markCompleted(BlockContext ctx, String nonce, String externalTxRef) {
        requireNonceFormat(nonce);
        WithdrawalRequest request = require(nonce);

        if (request.getStatus() == WithdrawalStatus.COMPLETED) {
            return request.copy();
        }
        if (request.getStatus() != WithdrawalStatus.SIGNED) {
            throw new InvalidWithdrawalStateException("withdrawal " + request.getNonce() + " must be signed before completion");
        }

        request.markCompleted(ctx.getBlockTime(), externalTxRef);
        store.saveWithdrawal(request);

        log.info("Withdrawal completed: nonce={}, externalTxRef={}", request.getNonce(), externalTxRef);
        ctx.emit(BridgeEvent.WITHDRAWAL_COMPLETED,
                "nonce", request.getNonce(),
                "external_tx_ref", externalTxRef == null ? "" : externalTxRef);
        return request.copy();
    }

    /**
     * Sign every pending withdrawal with the validator key. Runs from the end blocker.
     *
     * @return number of requests signed
     */
    public int signPending(BlockContext ctx, String validatorKeyHex) {
        int signed = 0;
        for (WithdrawalRequest request : store.findWithdrawals()) {
            if (request.getStatus() == WithdrawalStatus.PENDING) {
                signWithdrawal(ctx, request.getNonce(), validatorKeyHex);
                signed++;
            }
        }
        return signed;
    }

    public Optional<WithdrawalRequest> getWithdrawal(String nonce) {
        requireNonceFormat(nonce);
        return store.findWithdrawal(nonce).map(WithdrawalRequest::copy);
    }

    /**
     * @param owner host address filter, all requests when null or blank
     */
    public List<WithdrawalRequest> listWithdrawals(String owner) {
        String filter = owner == null || owner.isBlank() ? null : owner.trim().toLowerCase(Locale.ROOT);
        return store.findWithdrawals().stream()
                .filter(w -> filter == null || filter.equals(w.getOwner()))
                .map(WithdrawalRequest::copy)
                .toList();
    }

    public String recoverSigner(String nonce) {
        WithdrawalRequest request = require(nonce);
        return signer.recoverSigner(request);
    }

    static boolean isSettlementAddress(String value) {
        return value != null
                && value.length() == 42
                && value.startsWith("0x")
                && CryptoUtil.isHex(value.substring(2));
    }

    private WithdrawalRequest require(String nonce) {
        return store.findWithdrawal(nonce)
                .orElseThrow(() -> new WithdrawalNotFoundException("withdrawal " + nonce + " not found"));
    }

    private static void requireNonceFormat(String nonce) {
        if (!CryptoUtil.isNonce(nonce == null ? null : nonce.toLowerCase(Locale.ROOT))) {
            throw new InvalidNonceException("nonce must be 0x followed by 64 hex characters");
        }
    }
}
