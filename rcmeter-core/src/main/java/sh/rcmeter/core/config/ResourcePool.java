// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.config;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import sh.rcmeter.core.error.RcConfigException;

/**
 * Immutable snapshot of the per-resource pool balances.
 *
 * <p>Balances are never negative. A snapshot is never modified; the next
 * block's snapshot is produced by
 * {@link sh.rcmeter.core.model.PoolDynamics#nextPool()}.
 */
public final class ResourcePool {

    private final Map<ResourceType, BigInteger> balances;

    /**
     * @param balances one non-negative balance per resource
     * @throws RcConfigException if a resource is missing or a balance is negative
     */
    public ResourcePool(final Map<ResourceType, BigInteger> balances) {
        Objects.requireNonNull(balances, "balances cannot be null");
        final Set<ResourceType> missing = EnumSet.allOf(ResourceType.class);
        missing.removeAll(balances.keySet());
        if (!missing.isEmpty()) {
            throw new RcConfigException("Resource pool is missing: " + missing);
        }
        for (Map.Entry<ResourceType, BigInteger> entry : balances.entrySet()) {
            if (entry.getValue() == null || entry.getValue().signum() < 0) {
                throw new RcConfigException("Pool of " + entry.getKey().wireName()
                        + " must be non-negative, got: " + entry.getValue());
            }
        }
        this.balances = new EnumMap<>(balances);
    }

    public BigInteger get(final ResourceType type) {
        return balances.get(type);
    }

    /**
     * @return a read-only view of all balances
     */
    public Map<ResourceType, BigInteger> balances() {
        return Collections.unmodifiableMap(balances);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ResourcePool other)) {
            return false;
        }
        return balances.equals(other.balances);
    }

    @Override
    public int hashCode() {
        return balances.hashCode();
    }

    @Override
    public String toString() {
        return "ResourcePool" + balances;
    }
}
