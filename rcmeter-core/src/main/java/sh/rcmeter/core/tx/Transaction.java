// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.tx;

import java.util.List;
import java.util.Objects;

import sh.rcmeter.core.op.Operation;

/**
 * A signed ledger transaction.
 *
 * <p>Only {@code operations} matter for usage accounting; the header fields are
 * carried so that an external serializer can measure the transaction.
 *
 * @param refBlockNum    low 16 bits of the reference block number
 * @param refBlockPrefix reference block id prefix
 * @param expiration     expiration time as sent on the wire
 * @param operations     operations in execution order
 * @param signatures     hex-encoded signatures
 */
public record Transaction(
        int refBlockNum,
        long refBlockPrefix,
        String expiration,
        List<Operation> operations,
        List<String> signatures) {

    public Transaction {
        Objects.requireNonNull(expiration, "expiration cannot be null");
        operations = List.copyOf(Objects.requireNonNull(operations, "operations cannot be null"));
        signatures = List.copyOf(Objects.requireNonNull(signatures, "signatures cannot be null"));
    }

    /**
     * Creates an unsigned transaction with an empty header, for usage estimation.
     */
    public static Transaction of(final List<Operation> operations) {
        return new Transaction(0, 0L, "1970-01-01T00:00:00", operations, List.of());
    }

    public static Transaction of(final Operation... operations) {
        return of(List.of(operations));
    }
}
