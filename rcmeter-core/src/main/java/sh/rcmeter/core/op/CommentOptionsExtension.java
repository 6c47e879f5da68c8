// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

/**
 * An extension attached to a {@link CommentOptionsOperation}.
 */
public sealed interface CommentOptionsExtension permits CommentPayoutBeneficiaries, AllowedVoteAssets {

    /**
     * @return the extension's wire tag
     */
    String tag();

    void accept(OperationVisitor visitor);
}
