// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

/**
 * Visitor over the closed {@link Operation} union, including the extensions
 * nested in {@link CommentOptionsOperation}.
 */
public interface OperationVisitor {

    void visitAccountCreate(AccountCreateOperation op);

    void visitAccountCreateWithDelegation(AccountCreateWithDelegationOperation op);

    void visitCreateClaimedAccount(CreateClaimedAccountOperation op);

    void visitClaimAccount(ClaimAccountOperation op);

    void visitComment(CommentOperation op);

    void visitCommentOptions(CommentOptionsOperation op);

    void visitCommentPayoutBeneficiaries(CommentPayoutBeneficiaries extension);

    void visitAllowedVoteAssets(AllowedVoteAssets extension);

    void visitLimitOrderCreate(LimitOrderCreateOperation op);

    void visitWitnessUpdate(WitnessUpdateOperation op);

    /**
     * Called for every operation without a dedicated record, charged or ignored.
     */
    void visitGeneric(GenericOperation op);
}
