// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Global RC regeneration rate.
 *
 * <p>Mana regenerates fully over {@link #RC_REGEN_TIME_SECONDS}, so the per-block
 * rate is the total vesting supply divided by the number of blocks in that
 * window.
 */
public final class RcRegen {

    /** Five days. */
    public static final long RC_REGEN_TIME_SECONDS = 60L * 60L * 24L * 5L;

    public static final long BLOCK_INTERVAL_SECONDS = 3L;

    private static final BigInteger BLOCKS_PER_REGEN =
            BigInteger.valueOf(RC_REGEN_TIME_SECONDS / BLOCK_INTERVAL_SECONDS);

    private RcRegen() {
    }

    /**
     * @param totalVestingShares total vesting shares in their smallest unit
     * @return the regen rate per block, rounded down
     * @throws IllegalArgumentException if {@code totalVestingShares} is negative
     */
    public static BigInteger fromTotalVestingShares(final BigInteger totalVestingShares) {
        Objects.requireNonNull(totalVestingShares, "totalVestingShares cannot be null");
        if (totalVestingShares.signum() < 0) {
            throw new IllegalArgumentException("totalVestingShares cannot be negative: " + totalVestingShares);
        }
        return totalVestingShares.divide(BLOCKS_PER_REGEN);
    }
}
