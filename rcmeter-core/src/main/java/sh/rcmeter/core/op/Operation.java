// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

/**
 * A decoded ledger operation.
 *
 * <p>
 * The permitted subtypes form a closed union: operations whose fields affect
 * resource usage have dedicated records, every other known tag is a
 * {@link GenericOperation}. {@link OperationVisitor} therefore covers every
 * operation at compile time.
 */
public sealed interface Operation permits
        AccountCreateOperation,
        AccountCreateWithDelegationOperation,
        CreateClaimedAccountOperation,
        ClaimAccountOperation,
        CommentOperation,
        CommentOptionsOperation,
        LimitOrderCreateOperation,
        WitnessUpdateOperation,
        GenericOperation {

    OperationType type();

    void accept(OperationVisitor visitor);
}
