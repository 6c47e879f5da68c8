// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core;

import java.math.BigInteger;
import java.util.Map;
import java.util.StringJoiner;

import sh.rcmeter.core.config.ResourceType;

/**
 * Formats single-line trace messages for cost queries and pool updates.
 *
 * <p>All lines start with a bracketed tag:
 * <ul>
 * <li>{@code [RC-COST] ops=1 size=133 total=280272911 history=42083274 ...}
 * <li>{@code [RC-POOL] history pool=... decay=... budget=... usage=... newPool=...}
 * <li>{@code [RC-BLOCK] block=42 txs=3 rejected=0}
 * </ul>
 *
 * <p>Pure functions, thread-safe.
 *
 * @see DebugLogger
 */
public final class LogFormatter {

    private static final String PREFIX = "resource_";

    private LogFormatter() {
    }

    /**
     * Format: [RC-COST] ops=1 size=133 total=280272911 history_bytes=42083274 ...
     */
    public static String formatCost(
            final int operations, final long size, final BigInteger total, final Map<ResourceType, BigInteger> costs) {
        final StringJoiner line = new StringJoiner(" ");
        line.add("[RC-COST]")
                .add("ops=" + operations)
                .add("size=" + size)
                .add("total=" + total);
        for (Map.Entry<ResourceType, BigInteger> entry : costs.entrySet()) {
            line.add(shortName(entry.getKey()) + "=" + entry.getValue());
        }
        return line.toString();
    }

    /**
     * Format: [RC-POOL] state_bytes pool=1 decay=0 budget=2 usage=1 newPool=2
     */
    public static String formatPool(
            final ResourceType resource,
            final BigInteger pool,
            final BigInteger decay,
            final BigInteger budget,
            final BigInteger usage,
            final BigInteger newPool) {
        return String.format(
                "[RC-POOL] %s pool=%s decay=%s budget=%s usage=%s newPool=%s",
                shortName(resource), pool, decay, budget, usage, newPool);
    }

    /**
     * Format: [RC-BLOCK] block=42 txs=3 rejected=1
     */
    public static String formatBlock(final long blockNum, final int transactions, final int rejected) {
        return String.format("[RC-BLOCK] block=%d txs=%d rejected=%d", blockNum, transactions, rejected);
    }

    private static String shortName(final ResourceType resource) {
        final String wire = resource.wireName();
        return wire.startsWith(PREFIX) ? wire.substring(PREFIX.length()) : wire;
    }
}
