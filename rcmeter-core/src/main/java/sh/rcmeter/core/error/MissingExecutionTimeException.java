// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.error;

/**
 * Thrown when a transaction contains a charged operation that the configured
 * execution-time table has no entry for.
 *
 * <p>Only the transaction being priced fails; others keep being priced
 * against the same table.
 *
 * @since 0.1.0
 */
public final class MissingExecutionTimeException extends RcException {

    private final String operation;

    public MissingExecutionTimeException(final String operation) {
        super("No execution time configured for " + operation);
        this.operation = operation;
    }

    /**
     * @return wire name of the operation, e.g. {@code smt_create_operation}
     */
    public String operation() {
        return operation;
    }
}
