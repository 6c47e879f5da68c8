// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.usage;

import sh.rcmeter.core.tx.Transaction;

/**
 * Measures the canonical binary serialization of a transaction.
 *
 * <p>The ledger's binary format lives outside this library; callers that only
 * hold a decoded transaction plug in a serializer here.
 */
@FunctionalInterface
public interface TransactionSizer {

    /**
     * @return the serialized length of {@code tx} in bytes, never negative
     */
    long serializedSize(Transaction tx);
}
