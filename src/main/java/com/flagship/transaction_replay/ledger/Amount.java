package com.flagship.transaction_replay.ledger;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point money value.
 *
 * The value is held as a signed count of 1/10000 units, so balances never
 * carry floating point drift. Decimal text is only touched when parsing
 * input and rendering output.
 *
 * Key invariant: all arithmetic is long arithmetic on the scaled value.
 */
@Value
public class Amount {

    public static final int SCALE = 4;
    public static final Amount ZERO = new Amount(0L);

    long scaledValue;

    private Amount(long scaledValue) {
        this.scaledValue = scaledValue;
    }

    public static Amount ofScaled(long scaledValue) {
        return scaledValue == 0L ? ZERO : new Amount(scaledValue);
    }

    /**
     * Parses a decimal numeral leniently.
     *
     * Blank or unparseable text yields {@link #ZERO} instead of failing.
     */
    public static Amount fromDecimalString(String text) {
        try {
            return parse(text);
        } catch (NumberFormatException | ArithmeticException e) {
            return ZERO;
        }
    }

    /**
     * Parses a decimal numeral strictly.
     *
     * Values with more than four fractional digits are rounded half away from zero.
     *
     * @param text decimal text, may be null or blank (yields zero)
     * @return the scaled amount
     * @throws NumberFormatException if the text is not a decimal numeral
     * @throws ArithmeticException if the scaled value does not fit in a long
     */
    public static Amount parse(String text) {
        if (text == null || text.isBlank()) {
            return ZERO;
        }
        BigDecimal scaled = new BigDecimal(text.trim())
                .movePointRight(SCALE)
                .setScale(0, RoundingMode.HALF_UP);
        return ofScaled(scaled.longValueExact());
    }

    public Amount add(Amount other) {
        return ofScaled(Math.addExact(scaledValue, other.scaledValue));
    }

    public Amount subtract(Amount other) {
        return ofScaled(Math.subtractExact(scaledValue, other.scaledValue));
    }

    public boolean isGreaterThanOrEqualTo(Amount other) {
        return scaledValue >= other.scaledValue;
    }

    public BigDecimal toBigDecimal() {
        return BigDecimal.valueOf(scaledValue, SCALE);
    }

    /**
     * Renders the value with exactly four fractional digits, e.g. {@code 3.0000}.
     */
    public String toDecimalString() {
        return toBigDecimal().toPlainString();
    }

    @Override
    public String toString() {
        return toDecimalString();
    }
}
