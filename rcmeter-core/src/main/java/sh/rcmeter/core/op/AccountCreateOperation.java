// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.util.Objects;

import sh.rcmeter.core.types.Asset;
import sh.rcmeter.core.types.Authority;

/**
 * Creates an account paid for by {@code creator}.
 *
 * @param fee            account creation fee
 * @param creator        paying account
 * @param newAccountName name of the new account
 * @param owner          owner authority
 * @param active         active authority
 * @param posting        posting authority
 * @param memoKey        public memo key
 */
public record AccountCreateOperation(
        Asset fee,
        String creator,
        String newAccountName,
        Authority owner,
        Authority active,
        Authority posting,
        String memoKey) implements Operation {

    public AccountCreateOperation {
        Objects.requireNonNull(fee, "fee cannot be null");
        Objects.requireNonNull(creator, "creator cannot be null");
        Objects.requireNonNull(newAccountName, "newAccountName cannot be null");
        Objects.requireNonNull(owner, "owner cannot be null");
        Objects.requireNonNull(active, "active cannot be null");
        Objects.requireNonNull(posting, "posting cannot be null");
        Objects.requireNonNull(memoKey, "memoKey cannot be null");
    }

    @Override
    public OperationType type() {
        return OperationType.ACCOUNT_CREATE;
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitAccountCreate(this);
    }
}
