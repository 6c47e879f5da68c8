// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.usage;

import java.util.EnumMap;
import java.util.Map;

import sh.rcmeter.core.config.ResourceType;

/**
 * Raw resource usage of one transaction or block, before scaling by
 * {@code resource_unit}.
 *
 * @param historyBytes  serialized bytes stored in block history
 * @param newAccounts   account-creation tokens consumed
 * @param marketBytes   serialized bytes of transactions touching the market
 * @param stateBytes    state-bytes size units added to consensus state
 * @param executionTime execution time units
 */
public record UsageVector(
        long historyBytes,
        long newAccounts,
        long marketBytes,
        long stateBytes,
        long executionTime) {

    public static final UsageVector ZERO = new UsageVector(0L, 0L, 0L, 0L, 0L);

    public long get(final ResourceType type) {
        return switch (type) {
            case HISTORY_BYTES -> historyBytes;
            case NEW_ACCOUNTS -> newAccounts;
            case MARKET_BYTES -> marketBytes;
            case STATE_BYTES -> stateBytes;
            case EXECUTION_TIME -> executionTime;
        };
    }

    /**
     * Component-wise sum.
     *
     * @throws ArithmeticException if any component overflows
     */
    public UsageVector plus(final UsageVector other) {
        return new UsageVector(
                Math.addExact(historyBytes, other.historyBytes),
                Math.addExact(newAccounts, other.newAccounts),
                Math.addExact(marketBytes, other.marketBytes),
                Math.addExact(stateBytes, other.stateBytes),
                Math.addExact(executionTime, other.executionTime));
    }

    /**
     * @return the counters keyed by resource, in canonical order
     */
    public Map<ResourceType, Long> asMap() {
        final Map<ResourceType, Long> map = new EnumMap<>(ResourceType.class);
        for (ResourceType type : ResourceType.values()) {
            map.put(type, get(type));
        }
        return map;
    }
}
