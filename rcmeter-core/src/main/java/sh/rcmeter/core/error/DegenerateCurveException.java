// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.error;

import sh.rcmeter.core.config.ResourceType;

/**
 * Thrown when a resource's pricing curve denominator {@code coeff_b + max(pool, 0)}
 * is not positive.
 *
 * @since 0.1.0
 */
public final class DegenerateCurveException extends RcException {

    private final ResourceType resource;

    public DegenerateCurveException(final ResourceType resource, final ArithmeticException cause) {
        super("Degenerate pricing curve for " + resource.wireName() + ": " + cause.getMessage(), cause);
        this.resource = resource;
    }

    public ResourceType resource() {
        return resource;
    }
}
