package com.flagship.payments_engine.ledger;

/**
 * Level at which rejected records are logged. OFF ignores them silently;
 * they are still counted.
 */
public enum RejectionLogLevel {
    WARN,
    DEBUG,
    OFF
}
