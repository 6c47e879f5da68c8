// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.usage;

import java.util.Objects;

import sh.rcmeter.core.config.ExecutionTimeTable;
import sh.rcmeter.core.config.StateBytesSizes;
import sh.rcmeter.core.config.StateObjectSize;
import sh.rcmeter.core.error.MissingExecutionTimeException;
import sh.rcmeter.core.error.UsageOverflowException;
import sh.rcmeter.core.op.AccountCreateOperation;
import sh.rcmeter.core.op.AccountCreateWithDelegationOperation;
import sh.rcmeter.core.op.AllowedVoteAssets;
import sh.rcmeter.core.op.ClaimAccountOperation;
import sh.rcmeter.core.op.CommentOperation;
import sh.rcmeter.core.op.CommentOptionsExtension;
import sh.rcmeter.core.op.CommentOptionsOperation;
import sh.rcmeter.core.op.CommentPayoutBeneficiaries;
import sh.rcmeter.core.op.CreateClaimedAccountOperation;
import sh.rcmeter.core.op.GenericOperation;
import sh.rcmeter.core.op.LimitOrderCreateOperation;
import sh.rcmeter.core.op.Operation;
import sh.rcmeter.core.op.OperationType;
import sh.rcmeter.core.op.OperationVisitor;
import sh.rcmeter.core.op.WitnessUpdateOperation;
import sh.rcmeter.core.types.Authority;

/**
 * Accumulates the per-operation part of a transaction's usage.
 *
 * <p>
 * One accountant is created per transaction and fed every operation in
 * order. Each charged operation adds its configured execution time and, where
 * it stores objects in consensus state, their size in state-bytes units.
 * Ignored operations add nothing.
 *
 * <p>
 * Not thread-safe; instances are cheap and meant to be discarded after one
 * transaction.
 */
public final class OperationUsageAccountant implements OperationVisitor {

    private final StateBytesSizes sizes;
    private final ExecutionTimeTable execTimes;

    private long stateBytes;
    private long executionTime;
    private long marketOpCount;
    private long newAccountOpCount;

    public OperationUsageAccountant(final StateBytesSizes sizes, final ExecutionTimeTable execTimes) {
        this.sizes = Objects.requireNonNull(sizes, "sizes cannot be null");
        this.execTimes = Objects.requireNonNull(execTimes, "execTimes cannot be null");
    }

    /**
     * Accounts for one operation.
     *
     * @throws UsageOverflowException        if a counter would overflow
     * @throws MissingExecutionTimeException if a charged operation has no configured execution time
     */
    public void account(final Operation op) {
        Objects.requireNonNull(op, "op cannot be null");
        op.accept(this);
    }

    public long stateBytes() {
        return stateBytes;
    }

    public long executionTime() {
        return executionTime;
    }

    public long marketOpCount() {
        return marketOpCount;
    }

    public long newAccountOpCount() {
        return newAccountOpCount;
    }

    @Override
    public void visitAccountCreate(final AccountCreateOperation op) {
        addStateBytes(newAccountBytes(op.owner(), op.active(), op.posting()));
        addExecutionTime(op.type());
    }

    @Override
    public void visitAccountCreateWithDelegation(final AccountCreateWithDelegationOperation op) {
        addStateBytes(newAccountBytes(op.owner(), op.active(), op.posting()));
        addStateBytes(sizes.get(StateObjectSize.VESTING_DELEGATION_OBJECT_BASE));
        addExecutionTime(op.type());
    }

    @Override
    public void visitCreateClaimedAccount(final CreateClaimedAccountOperation op) {
        addStateBytes(newAccountBytes(op.owner(), op.active(), op.posting()));
        addExecutionTime(op.type());
    }

    @Override
    public void visitClaimAccount(final ClaimAccountOperation op) {
        addExecutionTime(op.type());
        // only a free claim consumes an account-creation token
        if (op.isFree()) {
            newAccountOpCount = exactAdd(newAccountOpCount, 1L, "new account op count");
        }
    }

    @Override
    public void visitComment(final CommentOperation op) {
        addStateBytes(sizes.get(StateObjectSize.COMMENT_OBJECT_BASE));
        addStateBytes(exactMultiply(sizes.get(StateObjectSize.COMMENT_OBJECT_PERMLINK_CHAR),
                op.permlinkByteLength()));
        addStateBytes(exactMultiply(sizes.get(StateObjectSize.COMMENT_OBJECT_PARENT_PERMLINK_CHAR),
                op.parentPermlinkByteLength()));
        addExecutionTime(op.type());
    }

    @Override
    public void visitCommentOptions(final CommentOptionsOperation op) {
        for (CommentOptionsExtension extension : op.extensions()) {
            extension.accept(this);
        }
        addExecutionTime(op.type());
    }

    @Override
    public void visitCommentPayoutBeneficiaries(final CommentPayoutBeneficiaries extension) {
        addStateBytes(exactMultiply(sizes.get(StateObjectSize.COMMENT_OBJECT_BENEFICIARIES_MEMBER),
                extension.beneficiaries().size()));
    }

    @Override
    public void visitAllowedVoteAssets(final AllowedVoteAssets extension) {
        // stored inline with the comment, no extra state
    }

    @Override
    public void visitLimitOrderCreate(final LimitOrderCreateOperation op) {
        if (!op.fillOrKill()) {
            addStateBytes(sizes.get(StateObjectSize.LIMIT_ORDER_OBJECT_BASE));
        }
        addExecutionTime(op.type());
        countMarketOp();
    }

    @Override
    public void visitWitnessUpdate(final WitnessUpdateOperation op) {
        addStateBytes(sizes.get(StateObjectSize.WITNESS_OBJECT_BASE));
        addStateBytes(exactMultiply(sizes.get(StateObjectSize.WITNESS_OBJECT_URL_CHAR), op.urlByteLength()));
        addExecutionTime(op.type());
    }

    @Override
    public void visitGeneric(final GenericOperation op) {
        final OperationType type = op.type();
        if (!type.isCharged()) {
            return;
        }
        addStateBytes(sizes.fixedStateBytes(type));
        addExecutionTime(type);
        if (type.isMarket()) {
            countMarketOp();
        }
    }

    private long newAccountBytes(final Authority owner, final Authority active, final Authority posting) {
        long bytes = exactAdd(
                sizes.get(StateObjectSize.ACCOUNT_OBJECT_BASE),
                sizes.get(StateObjectSize.ACCOUNT_AUTHORITY_OBJECT_BASE),
                "account bytes");
        bytes = exactAdd(bytes, authorityBytes(owner), "account bytes");
        bytes = exactAdd(bytes, authorityBytes(active), "account bytes");
        return exactAdd(bytes, authorityBytes(posting), "account bytes");
    }

    private long authorityBytes(final Authority authority) {
        final long accounts = exactMultiply(
                sizes.get(StateObjectSize.AUTHORITY_ACCOUNT_MEMBER), authority.accountAuths().size());
        final long keys = exactMultiply(
                sizes.get(StateObjectSize.AUTHORITY_KEY_MEMBER), authority.keyAuths().size());
        return exactAdd(exactAdd(sizes.get(StateObjectSize.AUTHORITY_BASE), accounts, "authority bytes"),
                keys, "authority bytes");
    }

    private void addStateBytes(final long bytes) {
        stateBytes = exactAdd(stateBytes, bytes, "state bytes");
    }

    private void addExecutionTime(final OperationType type) {
        executionTime = exactAdd(executionTime, execTimes.get(type), "execution time");
    }

    private void countMarketOp() {
        marketOpCount = exactAdd(marketOpCount, 1L, "market op count");
    }

    private static long exactAdd(final long a, final long b, final String counter) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new UsageOverflowException(counter + " overflows a 64-bit counter", e);
        }
    }

    private static long exactMultiply(final long size, final int count) {
        try {
            return Math.multiplyExact(size, (long) count);
        } catch (ArithmeticException e) {
            throw new UsageOverflowException("state bytes overflow a 64-bit counter", e);
        }
    }
}
