// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.error;

/**
 * Thrown when a transaction contains an operation tag that is neither a
 * charged operation nor one of the explicitly ignored ones.
 *
 * @since 0.1.0
 */
public final class UnknownOperationException extends RcException {

    private final String tag;

    public UnknownOperationException(final String tag) {
        super("Unknown operation type: " + tag);
        this.tag = tag;
    }

    /**
     * @return the unrecognized wire tag
     */
    public String tag() {
        return tag;
    }
}
