// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.primitives;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Fixed-point decay rate of a resource pool.
 *
 * <p>The fraction of the pool removed per time unit is
 * {@code decayPerTimeUnit / 2^denomShift}.
 *
 * @param decayPerTimeUnit numerator of the per-time-unit decay fraction
 * @param denomShift       base-2 logarithm of the denominator
 * @since 0.1.0
 */
public record DecayParams(BigInteger decayPerTimeUnit, int denomShift) {

    public DecayParams {
        Objects.requireNonNull(decayPerTimeUnit, "decayPerTimeUnit cannot be null");
        if (decayPerTimeUnit.signum() < 0) {
            throw new IllegalArgumentException("decayPerTimeUnit must be non-negative, got: " + decayPerTimeUnit);
        }
        if (denomShift < 0) {
            throw new IllegalArgumentException("denomShift must be non-negative, got: " + denomShift);
        }
    }

    public static DecayParams of(final long decayPerTimeUnit, final int denomShift) {
        return new DecayParams(BigInteger.valueOf(decayPerTimeUnit), denomShift);
    }
}
