// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.util.Objects;

import sh.rcmeter.core.types.Authority;

/**
 * Redeems an account creation ticket obtained through {@link ClaimAccountOperation}.
 */
public record CreateClaimedAccountOperation(
        String creator,
        String newAccountName,
        Authority owner,
        Authority active,
        Authority posting,
        String memoKey) implements Operation {

    public CreateClaimedAccountOperation {
        Objects.requireNonNull(creator, "creator cannot be null");
        Objects.requireNonNull(newAccountName, "newAccountName cannot be null");
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(active, "active cannot be null");
        Objects.requireNonNull(posting, "posting cannot be null");
        Objects.requireNonNull(memoKey, "memoKey cannot be null");
    }

    @Override
    public OperationType type() {
        return OperationType.CREATE_CLAIMED_ACCOUNT;
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitCreateClaimedAccount(this);
    }
}
