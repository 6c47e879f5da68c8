// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.model;

import java.math.BigInteger;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

import sh.rcmeter.core.config.ResourceType;
import sh.rcmeter.core.usage.UsageVector;

/**
 * Result of pricing one transaction.
 *
 * @param usage       raw accumulated usage
 * @param scaledUsage usage multiplied by {@code resource_unit}, zero for unpriced resources
 * @param cost        RC cost per resource
 */
public record TransactionCost(
        UsageVector usage,
        Map<ResourceType, BigInteger> scaledUsage,
        Map<ResourceType, BigInteger> cost) {

    public TransactionCost {
        Objects.requireNonNull(usage, "usage cannot be null");
        scaledUsage = copy(Objects.requireNonNull(scaledUsage, "scaledUsage cannot be null"));
        cost = copy(Objects.requireNonNull(cost, "cost cannot be null"));
    }

    private static Map<ResourceType, BigInteger> copy(final Map<ResourceType, BigInteger> source) {
        final Map<ResourceType, BigInteger> copy = new EnumMap<>(ResourceType.class);
        copy.putAll(source);
        return Collections.unmodifiableMap(copy);
    }

    public BigInteger cost(final ResourceType type) {
        return cost.getOrDefault(type, BigInteger.ZERO);
    }

    /**
     * @return the sum of all per-resource costs
     */
    public BigInteger total() {
        BigInteger total = BigInteger.ZERO;
        for (BigInteger value : cost.values()) {
            total = total.add(value);
        }
        return total;
    }
}
