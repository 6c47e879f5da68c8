// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.primitives;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Bonding-curve price of a resource, in resource credits.
 *
 * <p>For positive usage the price is
 * <pre>
 *   num   = (((regen * coeffA) &gt;&gt; shift) + 1) * usage
 *   denom = coeffB + max(pool, 0)
 *   cost  = floor(num / denom) + 1
 * </pre>
 * The trailing {@code + 1} makes any positive usage cost at least one credit.
 * Negative usage prices as the negated cost of the absolute usage, and zero
 * usage is free.
 *
 * <p>All arithmetic is on {@link BigInteger}; results are identical on every JVM.
 *
 * @since 0.1.0
 */
public final class PricingCurve {

    private PricingCurve() {
        // Utility class
    }

    /**
     * Computes the credit cost of {@code usage} units against {@code pool}.
     *
     * @param params the curve coefficients
     * @param pool   the current resource pool (negative pools price as empty)
     * @param usage  the resource usage, already scaled by the resource unit
     * @param regen  the credit regeneration rate
     * @return the cost; negative iff {@code usage} is negative
     * @throws ArithmeticException if {@code coeffB + max(pool, 0)} is not positive
     */
    public static BigInteger cost(
            final CurveParams params,
            final BigInteger pool,
            final BigInteger usage,
            final BigInteger regen) {
        Objects.requireNonNull(params, "params cannot be null");
        Objects.requireNonNull(pool, "pool cannot be null");
        Objects.requireNonNull(usage, "usage cannot be null");
        Objects.requireNonNull(regen, "regen cannot be null");

        final int sign = usage.signum();
        if (sign == 0) {
            return BigInteger.ZERO;
        }
        if (sign < 0) {
            return cost(params, pool, usage.negate(), regen).negate();
        }

        final BigInteger denom = params.coeffB().add(pool.max(BigInteger.ZERO));
        if (denom.signum() <= 0) {
            throw new ArithmeticException(
                    "pricing curve denominator must be positive, got: " + denom
                            + " (coeffB=" + params.coeffB() + ", pool=" + pool + ")");
        }

        final BigInteger num = regen.multiply(params.coeffA())
                .shiftRight(params.shift())
                .add(BigInteger.ONE)
                .multiply(usage);

        // floorDiv semantics: num may be negative when regen is negative
        final BigInteger[] qr = num.divideAndRemainder(denom);
        BigInteger quotient = qr[0];
        if (qr[1].signum() < 0) {
            quotient = quotient.subtract(BigInteger.ONE);
        }
        return quotient.add(BigInteger.ONE);
    }

    /**
     * Convenience overload for callers holding {@code long} usage counts.
     */
    public static BigInteger cost(
            final CurveParams params,
            final BigInteger pool,
            final long usage,
            final BigInteger regen) {
        return cost(params, pool, BigInteger.valueOf(usage), regen);
    }
}
