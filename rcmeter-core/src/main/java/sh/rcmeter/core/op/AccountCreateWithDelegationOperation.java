// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.util.Objects;

import sh.rcmeter.core.types.Asset;
import sh.rcmeter.core.types.Authority;

/**
 * Creates an account and delegates vesting shares to it in the same step.
 *
 * @param fee            account creation fee
 * @param delegation     vesting shares delegated to the new account
 * @param creator        paying account
 * @param newAccountName name of the new account
 * @param owner          owner authority
 * @param active         active authority
 * @param posting        posting authority
 * @param memoKey        public memo key
 */
public record AccountCreateWithDelegationOperation(
        Asset fee,
        Asset delegation,
        String creator,
        String newAccountName,
        Authority owner,
        Authority active,
        Authority posting,
        String memoKey) implements Operation {

    public AccountCreateWithDelegationOperation {
        Objects.requireNonNull(fee, "fee cannot be null");
        Objects.requireNonNull(delegation, "delegation cannot be null");
        Objects.requireNonNull(creator, "creator cannot be null");
        Objects.requireNonNull(newAccountName, "newAccountName cannot be null");
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(active, "active cannot be null");
        Objects.requireNonNull(posting, "posting cannot be null");
        Objects.requireNonNull(memoKey, "memoKey cannot be null");
    }

    @Override
    public OperationType type() {
        return OperationType.ACCOUNT_CREATE_WITH_DELEGATION;
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitAccountCreateWithDelegation(this);
    }
}
