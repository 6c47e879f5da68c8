// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.config;

import java.math.BigInteger;
import java.util.Objects;

import sh.rcmeter.primitives.DecayParams;

/**
 * Per-resource pool dynamics.
 *
 * <p>{@code poolEq}, {@code maxPoolSize} and {@code minDecay} describe the
 * equilibrium the decay rate was derived from; the per-block step itself only
 * reads {@code resourceUnit}, {@code budgetPerTimeUnit} and {@code decayParams}.
 *
 * @param resourceUnit      multiplier from counted usage to pool units; positive
 * @param budgetPerTimeUnit credits added to the pool per time unit
 * @param poolEq            equilibrium pool size
 * @param maxPoolSize       maximum pool size
 * @param decayParams       fixed-point decay rate
 * @param minDecay          minimum decay
 */
public record ResourceDynamicsParams(
        BigInteger resourceUnit,
        BigInteger budgetPerTimeUnit,
        BigInteger poolEq,
        BigInteger maxPoolSize,
        DecayParams decayParams,
        BigInteger minDecay) {

    public ResourceDynamicsParams {
        Objects.requireNonNull(resourceUnit, "resourceUnit cannot be null");
        Objects.requireNonNull(budgetPerTimeUnit, "budgetPerTimeUnit cannot be null");
        Objects.requireNonNull(poolEq, "poolEq cannot be null");
        Objects.requireNonNull(maxPoolSize, "maxPoolSize cannot be null");
        Objects.requireNonNull(decayParams, "decayParams cannot be null");
        Objects.requireNonNull(minDecay, "minDecay cannot be null");
        if (resourceUnit.signum() <= 0) {
            throw new IllegalArgumentException("resourceUnit must be positive, got: " + resourceUnit);
        }
        if (budgetPerTimeUnit.signum() < 0) {
            throw new IllegalArgumentException("budgetPerTimeUnit must be non-negative, got: " + budgetPerTimeUnit);
        }
    }
}
