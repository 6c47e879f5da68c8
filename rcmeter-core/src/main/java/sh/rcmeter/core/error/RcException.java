// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.error;

/**
 * Base runtime exception for all resource credit failures.
 *
 * <p>
 * Every failure is scoped to the single transaction or pricing call being
 * evaluated. None of them leaves pool state modified: pools only change
 * through {@link sh.rcmeter.core.model.ResourceCreditModel#applyPoolDynamics}.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * RcException
 * ├── {@link UnknownOperationException} - operation tag outside the known set
 * ├── {@link MalformedOperationException} - missing or ill-typed operation field
 * ├── {@link DegenerateCurveException} - pricing curve with a non-positive denominator
 * ├── {@link UsageOverflowException} - usage counter overflow
 * ├── {@link MissingExecutionTimeException} - charged operation without a configured execution time
 * └── {@link RcConfigException} - invalid or incomplete parameter documents
 * </pre>
 *
 * @since 0.1.0
 */
public sealed class RcException extends RuntimeException
        permits UnknownOperationException,
        MalformedOperationException,
        DegenerateCurveException,
        UsageOverflowException,
        MissingExecutionTimeException,
        RcConfigException {

    public RcException(final String message) {
        super(message);
    }

    public RcException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
