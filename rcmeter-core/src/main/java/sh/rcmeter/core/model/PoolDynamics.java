// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.model;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import sh.rcmeter.core.config.ResourcePool;
import sh.rcmeter.core.config.ResourceType;

/**
 * Per-resource breakdown of one pool update.
 *
 * <p>
 * For every resource {@code newPool = pool - decay + budget - usage}. The
 * {@code newPool} values are exact and may be negative when a block uses more
 * than the pool holds; {@link #nextPool()} clamps them at zero to form the next
 * snapshot.
 *
 * @param dt         elapsed time units
 * @param pool       balances before the update
 * @param budget     regeneration added, {@code budget_per_time_unit * dt}
 * @param usage      scaled usage drained
 * @param decay      amount decayed from {@code pool - usage}
 * @param newPool    exact balances after the update
 * @param adjustment reserved for future pool adjustments; always empty
 */
public record PoolDynamics(
        long dt,
        Map<ResourceType, BigInteger> pool,
        Map<ResourceType, BigInteger> budget,
        Map<ResourceType, BigInteger> usage,
        Map<ResourceType, BigInteger> decay,
        Map<ResourceType, BigInteger> newPool,
        Map<ResourceType, BigInteger> adjustment) {

    public PoolDynamics {
        if (dt < 0) {
            throw new IllegalArgumentException("dt cannot be negative: " + dt);
        }
        pool = copy(pool, "pool");
        budget = copy(budget, "budget");
        usage = copy(usage, "usage");
        decay = copy(decay, "decay");
        newPool = copy(newPool, "newPool");
        adjustment = copy(adjustment, "adjustment");
    }

    /**
     * @return the snapshot to price the next block against
     */
    public ResourcePool nextPool() {
        final Map<ResourceType, BigInteger> next = new EnumMap<>(ResourceType.class);
        for (Map.Entry<ResourceType, BigInteger> entry : newPool.entrySet()) {
            next.put(entry.getKey(), entry.getValue().max(BigInteger.ZERO));
        }
        return new ResourcePool(next);
    }

    private static Map<ResourceType, BigInteger> copy(final Map<ResourceType, BigInteger> source, final String name) {
        Objects.requireNonNull(source, name + " cannot be null");
        final Map<ResourceType, BigInteger> copy = new EnumMap<>(ResourceType.class);
        copy.putAll(source);
        return Collections.unmodifiableMap(copy);
    }
}
