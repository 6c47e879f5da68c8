// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.error;

/**
 * Thrown when a {@code long} usage counter would overflow while a transaction's
 * usage is accumulated.
 *
 * @since 0.1.0
 */
public final class UsageOverflowException extends RcException {

    public UsageOverflowException(final String message, final ArithmeticException cause) {
        super(message, cause);
    }
}
