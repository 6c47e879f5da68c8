// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.util.Objects;

import sh.rcmeter.core.types.Asset;

/**
 * Claims an account creation ticket. A claim with a zero fee is paid for in
 * resource credits and counts against the new-accounts resource.
 *
 * @param creator claiming account
 * @param fee     declared fee
 */
public record ClaimAccountOperation(String creator, Asset fee) implements Operation {

    public ClaimAccountOperation {
        Objects.requireNonNull(creator, "creator cannot be null");
        Objects.requireNonNull(fee, "fee cannot be null");
    }

    public boolean isFree() {
        return fee.isZero();
    }

    @Override
    public OperationType type() {
        return OperationType.CLAIM_ACCOUNT;
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitClaimAccount(this);
    }
}
