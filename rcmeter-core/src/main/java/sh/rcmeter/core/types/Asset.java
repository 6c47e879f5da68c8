// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.types;

import java.math.BigInteger;
import java.util.Objects;

/**
 * An amount of a ledger asset, as carried by operations.
 *
 * <p>The amount is an integer count of the smallest unit; {@code precision}
 * only matters for display.
 *
 * @param amount    integer amount in the smallest unit
 * @param precision number of decimal places of the asset
 * @param nai       numerical asset identifier, e.g. {@code @@000000013}
 */
public record Asset(BigInteger amount, int precision, String nai) {

    public Asset {
        Objects.requireNonNull(amount, "amount cannot be null");
        Objects.requireNonNull(nai, "nai cannot be null");
        if (precision < 0) {
            throw new IllegalArgumentException("precision must be non-negative, got: " + precision);
        }
    }

    public boolean isZero() {
        return amount.signum() == 0;
    }
}
