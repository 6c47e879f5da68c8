// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.config;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import sh.rcmeter.core.error.MissingExecutionTimeException;
import sh.rcmeter.core.error.RcConfigException;
import sh.rcmeter.core.op.OperationType;

/**
 * Immutable fixed execution time per charged operation.
 *
 * <p>The table may be partial: node documents predating an operation carry
 * no entry for it. Pricing a transaction that contains such an operation
 * fails with {@link MissingExecutionTimeException}; the table itself and
 * every other transaction stay usable. Ignored operations never have an entry.
 */
public final class ExecutionTimeTable {

    private static final String SUFFIX = "_exec_time";

    private final Map<OperationType, Long> execTimes;

    /**
     * @param execTimes non-negative entries for charged operations
     * @throws RcConfigException if an ignored operation is present or an entry is negative
     */
    public ExecutionTimeTable(final Map<OperationType, Long> execTimes) {
        Objects.requireNonNull(execTimes, "execTimes cannot be null");
        for (Map.Entry<OperationType, Long> entry : execTimes.entrySet()) {
            if (!entry.getKey().isCharged()) {
                throw new RcConfigException("Execution-time table lists ignored operation " + entry.getKey().wireName());
            }
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new RcConfigException("Execution time of " + entry.getKey().wireName()
                        + " must be non-negative, got: " + entry.getValue());
            }
        }
        this.execTimes = execTimes.isEmpty()
                ? new EnumMap<>(OperationType.class)
                : new EnumMap<>(execTimes);
    }

    /**
     * @param type a charged operation
     * @return its execution time units
     * @throws IllegalArgumentException      if {@code type} is ignored
     * @throws MissingExecutionTimeException if {@code type} has no configured time
     */
    public long get(final OperationType type) {
        if (!type.isCharged()) {
            throw new IllegalArgumentException(type.wireName() + " is not a charged operation");
        }
        final Long value = execTimes.get(type);
        if (value == null) {
            throw new MissingExecutionTimeException(type.wireName());
        }
        return value;
    }

    public boolean contains(final OperationType type) {
        return execTimes.containsKey(type);
    }

    /**
     * @return charged operations without a configured time, in declaration order
     */
    public Set<OperationType> missing() {
        final Set<OperationType> missing = EnumSet.copyOf(OperationType.charged());
        missing.removeAll(execTimes.keySet());
        return Collections.unmodifiableSet(missing);
    }

    /**
     * @return the configuration key of {@code type}, e.g. {@code vote_operation_exec_time}
     */
    public static String key(final OperationType type) {
        return type.wireName() + SUFFIX;
    }
}
