// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.util.List;
import java.util.Objects;

import sh.rcmeter.core.types.Beneficiary;

/**
 * Routes part of a comment's payout to other accounts.
 */
public record CommentPayoutBeneficiaries(List<Beneficiary> beneficiaries) implements CommentOptionsExtension {

    public static final String TAG = "comment_payout_beneficiaries";

    public CommentPayoutBeneficiaries {
        beneficiaries = List.copyOf(Objects.requireNonNull(beneficiaries, "beneficiaries cannot be null"));
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitCommentPayoutBeneficiaries(this);
    }
}
