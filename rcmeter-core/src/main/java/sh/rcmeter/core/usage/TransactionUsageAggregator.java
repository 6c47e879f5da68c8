// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.usage;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.rcmeter.core.config.ResourceParameters;
import sh.rcmeter.core.config.StateBytesSizes;
import sh.rcmeter.core.config.StateObjectSize;
import sh.rcmeter.core.error.MissingExecutionTimeException;
import sh.rcmeter.core.error.UsageOverflowException;
import sh.rcmeter.core.op.Operation;
import sh.rcmeter.core.tx.Transaction;

/**
 * Computes the raw {@link UsageVector} of a transaction.
 *
 * <p>
 * The serialized size is charged as history bytes, as market bytes when any
 * operation touches the market, and as per-byte transaction state on top of
 * the fixed transaction object. Everything else comes from an
 * {@link OperationUsageAccountant} run over the operations in order.
 *
 * <p>
 * The aggregator never serializes. Callers pass the size they measured, or
 * configure a {@link TransactionSizer}.
 *
 * <p>Thread-safe; holds only immutable configuration.
 */
public final class TransactionUsageAggregator {

    private final ResourceParameters params;
    private final @Nullable TransactionSizer sizer;

    public TransactionUsageAggregator(final ResourceParameters params) {
        this(params, null);
    }

    public TransactionUsageAggregator(final ResourceParameters params, final @Nullable TransactionSizer sizer) {
        this.params = Objects.requireNonNull(params, "params cannot be null");
        this.sizer = sizer;
    }

    /**
     * Computes usage with a caller-supplied serialized size.
     *
     * @param tx   the transaction
     * @param size its serialized length in bytes
     * @return the raw usage
     * @throws IllegalArgumentException if {@code size} is negative
     * @throws UsageOverflowException   if a counter would overflow
     * @throws MissingExecutionTimeException if an operation has no configured execution time
     */
    public UsageVector compute(final Transaction tx, final long size) {
        Objects.requireNonNull(tx, "tx cannot be null");
        if (size < 0) {
            throw new IllegalArgumentException("Transaction size cannot be negative: " + size);
        }

        final StateBytesSizes sizes = params.stateBytesSizes();
        final OperationUsageAccountant accountant = new OperationUsageAccountant(sizes, params.executionTimes());
        for (Operation op : tx.operations()) {
            accountant.account(op);
        }

        try {
            final long stateBytes = Math.addExact(
                    Math.addExact(
                            sizes.get(StateObjectSize.TRANSACTION_OBJECT_BASE),
                            Math.multiplyExact(sizes.get(StateObjectSize.TRANSACTION_OBJECT_BYTE), size)),
                    accountant.stateBytes());
            return new UsageVector(
                    size,
                    accountant.newAccountOpCount(),
                    accountant.marketOpCount() > 0 ? size : 0L,
                    stateBytes,
                    accountant.executionTime());
        } catch (ArithmeticException e) {
            throw new UsageOverflowException("Transaction state bytes overflow a 64-bit counter", e);
        }
    }

    /**
     * Computes usage, measuring the transaction with the configured sizer.
     *
     * @throws IllegalStateException if no {@link TransactionSizer} is configured
     */
    public UsageVector compute(final Transaction tx) {
        Objects.requireNonNull(tx, "tx cannot be null");
        if (sizer == null) {
            throw new IllegalStateException("No TransactionSizer configured; pass the serialized size explicitly");
        }
        return compute(tx, sizer.serializedSize(tx));
    }
}
