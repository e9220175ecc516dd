package com.flagship.payments_engine.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of applying one record: accepted, or rejected with a reason.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApplyResult {

    private static final ApplyResult ACCEPTED = new ApplyResult(null, null);

    private final ApplyError error;
    private final String message;

    public static ApplyResult accepted() {
        return ACCEPTED;
    }

    public static ApplyResult rejected(ApplyError error, String message) {
        return new ApplyResult(error, message);
    }

    public boolean isAccepted() {
        return error == null;
    }

    public boolean isRejected() {
        return error != null;
    }

    @Override
    public String toString() {
        return isAccepted() ? "ApplyResult[accepted]" : "ApplyResult[" + error + ": " + message + "]";
    }
}
