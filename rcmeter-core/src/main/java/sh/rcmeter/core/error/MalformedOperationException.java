// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.error;

/**
 * Thrown when an operation is missing a required field or a field has the
 * wrong shape. Values are never coerced.
 *
 * @since 0.1.0
 */
public final class MalformedOperationException extends RcException {

    private final String operation;
    private final String field;

    public MalformedOperationException(final String operation, final String field, final String reason) {
        super("Malformed " + operation + ": field '" + field + "' " + reason);
        this.operation = operation;
        this.field = field;
    }

    public MalformedOperationException(final String operation, final String field, final String reason,
            final Throwable cause) {
        super("Malformed " + operation + ": field '" + field + "' " + reason, cause);
        this.operation = operation;
        this.field = field;
    }

    public String operation() {
        return operation;
    }

    /**
     * @return dotted path of the offending field, e.g. {@code owner.key_auths[0]}
     */
    public String field() {
        return field;
    }
}
