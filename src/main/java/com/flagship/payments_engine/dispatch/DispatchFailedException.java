package com.flagship.payments_engine.dispatch;

/**
 * A record could not be applied and the run must abort.
 * The cause is the fatal error raised while applying it.
 */
public class DispatchFailedException extends RuntimeException {

    public DispatchFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
