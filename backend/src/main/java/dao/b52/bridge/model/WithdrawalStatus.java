package dao.b52.bridge.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WithdrawalStatus {
    PENDING("pending"),
    SIGNED("signed"),
    COMPLETED("completed");

    private final String wireName;

    WithdrawalStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean canMoveTo(WithdrawalStatus next) {
        return next.ordinal() == ordinal() + 1;
    }
}
