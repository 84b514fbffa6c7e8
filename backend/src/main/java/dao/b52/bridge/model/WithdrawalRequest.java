package dao.b52.bridge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * Burn-and-authorize withdrawal. Owner, destination and amount are fixed at creation; the status only
 * moves forward: pending -> signed -> completed.
 */
@Getter
@ToString
@EqualsAndHashCode
public class WithdrawalRequest {

    private final String nonce;
    private final String owner;
    /** Settlement chain address (0x + 40 hex). */
    private final String destination;
    private final BigInteger amount;
    private final long createdAt;

    private WithdrawalStatus status;
    /** Hex-encoded 65 byte signature (r || s || v), set when signed. */
    private String signature;
    private long completedAt;
    private String completionTxRef;

    public WithdrawalRequest(String nonce, String owner, String destination, BigInteger amount, long createdAt) {
        this(nonce, owner, destination, amount, createdAt, WithdrawalStatus.PENDING, null, 0L, null);
    }

    @JsonCreator
    public WithdrawalRequest(@JsonProperty("nonce") String nonce,
                             @JsonProperty("owner") String owner,
                             @JsonProperty("destination") String destination,
                             @JsonProperty("amount") BigInteger amount,
                             @JsonProperty("createdAt") long createdAt,
                             @JsonProperty("status") WithdrawalStatus status,
                             @JsonProperty("signature") String signature,
                             @JsonProperty("completedAt") long completedAt,
                             @JsonProperty("completionTxRef") String completionTxRef) {
        this.nonce = nonce;
        this.owner = owner;
        this.destination = destination;
        this.amount = amount;
        this.createdAt = createdAt;
        this.status = status == null ? WithdrawalStatus.PENDING : status;
        this.signature = signature;
        this.completedAt = completedAt;
        this.completionTxRef = completionTxRef;
    }

    public void markSigned(String signatureHex) {
        requireTransition(WithdrawalStatus.SIGNED);
        this.signature = signatureHex;
        this.status = WithdrawalStatus.SIGNED;
    }

    public void markCompleted(long completedAt, String completionTxRef) {
        requireTransition(WithdrawalStatus.COMPLETED);
        this.completedAt = completedAt;
        this.completionTxRef = completionTxRef;
        this.status = WithdrawalStatus.COMPLETED;
    }

    public WithdrawalRequest copy() {
        return new WithdrawalRequest(nonce, owner, destination, amount, createdAt,
                status, signature, completedAt, completionTxRef);
    }

    private void requireTransition(WithdrawalStatus next) {
        if (!status.canMoveTo(next)) {
            throw new IllegalStateException("Withdrawal " + nonce + " cannot move from " + status + " to " + next);
        }
    }
}
