package com.flagship.payments_engine.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-precision arithmetic helpers for ledger amounts.
 *
 * All balances carry exactly four fractional digits. The representable range
 * is that of a signed 64-bit count of ten-thousandths; anything outside it is
 * an overflow and aborts the run.
 */
public final class Amounts {

    public static final int SCALE = 4;

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private static final BigDecimal MAX = BigDecimal.valueOf(Long.MAX_VALUE, SCALE);
    private static final BigDecimal MIN = BigDecimal.valueOf(Long.MIN_VALUE, SCALE);
    private static final int MAX_INTEGER_DIGITS = MAX.precision() - MAX.scale();

    private Amounts() {
        // Utility class
    }

    /**
     * Normalises an amount to the ledger scale, rounding half-even.
     *
     * @throws LedgerOverflowException if the value is outside the representable range
     */
    public static BigDecimal normalize(BigDecimal value) {
        // Range is judged from the exponent; setScale cost grows with it.
        if (value.signum() == 0) {
            return ZERO;
        }
        long integerDigits = (long) value.precision() - value.scale();
        if (integerDigits > MAX_INTEGER_DIGITS) {
            throw overflow(value);
        }
        if (integerDigits < -SCALE) {
            // Below 0.00001, which rounds to zero at the ledger scale.
            return ZERO;
        }
        return checked(value.setScale(SCALE, RoundingMode.HALF_EVEN));
    }

    /**
     * Returns the value unchanged if it fits the representable range.
     *
     * @throws LedgerOverflowException if it does not
     */
    public static BigDecimal checked(BigDecimal value) {
        if (value.compareTo(MAX) > 0 || value.compareTo(MIN) < 0) {
            throw overflow(value);
        }
        return value;
    }

    public static BigDecimal add(BigDecimal left, BigDecimal right) {
        return checked(left.add(right));
    }

    public static BigDecimal subtract(BigDecimal left, BigDecimal right) {
        return checked(left.subtract(right));
    }

    private static LedgerOverflowException overflow(BigDecimal value) {
        return new LedgerOverflowException(
            String.format("Amount %s exceeds the representable range [%s, %s]",
                value, MIN.toPlainString(), MAX.toPlainString()));
    }

    /**
     * Renders an amount with exactly four fractional digits, e.g. {@code 1.5000}.
     */
    public static String format(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_EVEN).toPlainString();
    }
}
