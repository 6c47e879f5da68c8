// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.types;

import java.util.Objects;

/**
 * A comment payout beneficiary.
 *
 * @param account beneficiary account name
 * @param weight  share of the payout in basis points
 */
public record Beneficiary(String account, int weight) {

    public Beneficiary {
        Objects.requireNonNull(account, "account cannot be null");
    }
}
