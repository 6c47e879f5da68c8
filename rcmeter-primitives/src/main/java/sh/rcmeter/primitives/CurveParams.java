// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.primitives;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Coefficients of a resource pricing curve.
 *
 * <p>{@code coeffA} routinely exceeds {@code Long.MAX_VALUE} (values around
 * 1.3e19 are normal), so both coefficients are held as {@link BigInteger}.
 *
 * @param coeffA multiplier applied to the regeneration rate
 * @param coeffB constant added to the pool in the denominator
 * @param shift  right shift applied to {@code regen * coeffA}; must be non-negative
 * @since 0.1.0
 */
public record CurveParams(BigInteger coeffA, BigInteger coeffB, int shift) {

    public CurveParams {
        Objects.requireNonNull(coeffA, "coeffA cannot be null");
        Objects.requireNonNull(coeffB, "coeffB cannot be null");
        if (shift < 0) {
            throw new IllegalArgumentException("shift must be non-negative, got: " + shift);
        }
    }

    public static CurveParams of(final String coeffA, final String coeffB, final int shift) {
        return new CurveParams(new BigInteger(coeffA), new BigInteger(coeffB), shift);
    }
}
