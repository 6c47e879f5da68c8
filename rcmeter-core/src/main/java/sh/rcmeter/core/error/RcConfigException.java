// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.error;

/**
 * Thrown when resource parameters, size tables or pool documents are invalid
 * or incomplete.
 *
 * @since 0.1.0
 */
public final class RcConfigException extends RcException {

    public RcConfigException(final String message) {
        super(message);
    }

    public RcConfigException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
