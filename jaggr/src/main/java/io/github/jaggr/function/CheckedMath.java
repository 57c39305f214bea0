package io.github.jaggr.function;

import io.github.jaggr.exception.OverflowException;

import java.math.BigDecimal;

import static java.lang.String.format;

/**
 * Overflow checks behind every accumulator: BIGINT results use exact 64-bit arithmetic,
 * BIGDECIMAL results are capped at a maximum number of digits and DOUBLE results must stay finite.
 */
public final class CheckedMath {
    private CheckedMath() {
    }

    public static long add(long a, long b, AggrFunction function) {
        long r = a + b;
        // overflow iff both operands have the same sign and the result has the other one
        if (((a ^ r) & (b ^ r)) < 0) {
            throw new OverflowException(format("BIGINT value is out of range in %s: %d + %d", function, a, b));
        }
        return r;
    }

    public static BigDecimal checkPrecision(BigDecimal value, AggrFunction function) {
        int maxPrecision = function.getConfig().getDecimalMaxPrecision();
        // precision counts digits of the unscaled value, integer digits are what can overflow
        int integerDigits = value.precision() - value.scale();
        if (integerDigits > maxPrecision) {
            throw new OverflowException(format("DECIMAL value is out of range in %s: %d integer digits, at most %d",
                    function, integerDigits, maxPrecision));
        }
        return value;
    }

    public static double checkFinite(double value, AggrFunction function) {
        if (Double.isInfinite(value) || Double.isNaN(value)) {
            throw new OverflowException(format("DOUBLE value is out of range in %s: %s", function, value));
        }
        return value;
    }
}
