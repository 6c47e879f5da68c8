// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.model;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.rcmeter.core.DebugLogger;
import sh.rcmeter.core.LogFormatter;
import sh.rcmeter.core.error.RcException;
import sh.rcmeter.core.error.UsageOverflowException;
import sh.rcmeter.core.tx.Transaction;
import sh.rcmeter.core.tx.TransactionJson;
import sh.rcmeter.core.usage.UsageVector;

/**
 * Drives a {@link ResourceCreditModel} block by block.
 *
 * <p>
 * Transactions of block {@code N} are priced against the pools as they stood
 * before {@code N}; their usage is summed, and {@link #closeBlock(long)} applies
 * the sum to the pools exactly once. Blocks must be closed in consecutive
 * order. A transaction that fails to price is rejected and leaves both the
 * pools and the block's usage untouched.
 *
 * <p>
 * Thread-safe. {@link #quote} reads the current snapshot without locking;
 * {@link #submit} and {@link #closeBlock} serialize on an internal lock.
 */
public final class PoolLedger {

    private static final Logger LOG = LoggerFactory.getLogger(PoolLedger.class);

    private final Object lock = new Object();

    private volatile ResourceCreditModel model;
    private long nextBlockNum;
    private UsageVector pending = UsageVector.ZERO;
    private int accepted;
    private int rejected;

    /**
     * @param model        the snapshot before {@code firstBlockNum}
     * @param firstBlockNum number of the first block to be closed
     */
    public PoolLedger(final ResourceCreditModel model, final long firstBlockNum) {
        this.model = Objects.requireNonNull(model, "model cannot be null");
        if (firstBlockNum < 0) {
            throw new IllegalArgumentException("firstBlockNum cannot be negative: " + firstBlockNum);
        }
        this.nextBlockNum = firstBlockNum;
    }

    /**
     * @return the current pool snapshot
     */
    public ResourceCreditModel model() {
        return model;
    }

    public long nextBlockNum() {
        synchronized (lock) {
            return nextBlockNum;
        }
    }

    /**
     * @return usage accepted into the open block so far
     */
    public UsageVector pendingUsage() {
        synchronized (lock) {
            return pending;
        }
    }

    /**
     * Prices a transaction against the current snapshot without adding it to the block.
     */
    public TransactionCost quote(final Transaction tx, final long size) {
        return model.getTransactionCost(tx, size);
    }

    /**
     * Prices a transaction and adds its usage to the open block.
     *
     * @throws RcException              if the transaction cannot be priced; the block is unchanged
     * @throws IllegalArgumentException if {@code size} is negative; the block is unchanged
     */
    public TransactionCost submit(final Transaction tx, final long size) {
        Objects.requireNonNull(tx, "tx cannot be null");
        synchronized (lock) {
            final TransactionCost cost;
            final UsageVector next;
            try {
                cost = model.getTransactionCost(tx, size);
                next = add(pending, cost.usage());
            } catch (RcException | IllegalArgumentException e) {
                rejected++;
                LOG.warn("Rejected transaction in block {}: {}", nextBlockNum, e.getMessage());
                throw e;
            }
            pending = next;
            accepted++;
            return cost;
        }
    }

    /**
     * Decodes a transaction from JSON, then {@linkplain #submit(Transaction, long) submits} it.
     */
    public TransactionCost submit(final String transactionJson, final long size) {
        final Transaction tx;
        try {
            tx = TransactionJson.parse(transactionJson);
        } catch (RcException e) {
            synchronized (lock) {
                rejected++;
                LOG.warn("Rejected transaction in block {}: {}", nextBlockNum, e.getMessage());
            }
            throw e;
        }
        return submit(tx, size);
    }

    /**
     * Applies the open block's usage to the pools and opens the next block.
     *
     * @param blockNum the block being closed; must equal {@link #nextBlockNum()}
     * @return the pool update that was applied
     * @throws IllegalStateException if {@code blockNum} is out of order or already closed
     */
    public PoolDynamics closeBlock(final long blockNum) {
        synchronized (lock) {
            if (blockNum != nextBlockNum) {
                throw new IllegalStateException(
                        "Expected to close block " + nextBlockNum + " but got " + blockNum);
            }
            final ResourceCreditModel current = model;
            final PoolDynamics dynamics = current.applyPoolDynamics(pending);
            model = current.withPool(dynamics.nextPool());
            DebugLogger.logBlock(LogFormatter.formatBlock(blockNum, accepted, rejected));
            pending = UsageVector.ZERO;
            accepted = 0;
            rejected = 0;
            nextBlockNum = blockNum + 1;
            return dynamics;
        }
    }

    private static UsageVector add(final UsageVector total, final UsageVector usage) {
        try {
            return total.plus(usage);
        } catch (ArithmeticException e) {
            throw new UsageOverflowException("Block usage overflows a 64-bit counter", e);
        }
    }
}
