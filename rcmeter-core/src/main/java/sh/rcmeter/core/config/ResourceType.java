// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.config;

import java.util.Optional;

/**
 * The five priced resources, in canonical order.
 */
public enum ResourceType {
    HISTORY_BYTES("resource_history_bytes"),
    NEW_ACCOUNTS("resource_new_accounts"),
    MARKET_BYTES("resource_market_bytes"),
    STATE_BYTES("resource_state_bytes"),
    EXECUTION_TIME("resource_execution_time");

    private final String wireName;

    ResourceType(final String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<ResourceType> fromWireName(final String wireName) {
        for (ResourceType type : values()) {
            if (type.wireName.equals(wireName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
