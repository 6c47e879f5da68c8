// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.primitives;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Discrete approximation of exponential pool decay.
 *
 * <p>Over {@code dt} time units a non-negative pool loses
 * {@code min((decayPerTimeUnit * dt * pool) >> denomShift, pool)}. A negative
 * pool decays symmetrically toward zero.
 *
 * @since 0.1.0
 */
public final class PoolDecay {

    private PoolDecay() {
        // Utility class
    }

    /**
     * Computes the amount removed from {@code pool} over {@code dt} time units.
     *
     * @param params the decay rate
     * @param pool   the pool balance to decay
     * @param dt     elapsed time units, normally one block
     * @return the decay amount; never larger in magnitude than {@code pool}
     * @throws IllegalArgumentException if {@code dt} is negative
     */
    public static BigInteger decay(final DecayParams params, final BigInteger pool, final long dt) {
        Objects.requireNonNull(params, "params cannot be null");
        Objects.requireNonNull(pool, "pool cannot be null");
        if (dt < 0) {
            throw new IllegalArgumentException("dt must be non-negative, got: " + dt);
        }

        if (pool.signum() < 0) {
            return decay(params, pool.negate(), dt).negate();
        }

        final BigInteger amount = params.decayPerTimeUnit()
                .multiply(BigInteger.valueOf(dt))
                .multiply(pool)
                .shiftRight(params.denomShift());
        return amount.min(pool);
    }
}
