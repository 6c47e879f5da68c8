// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.util.List;
import java.util.Objects;

import sh.rcmeter.core.types.Asset;

/**
 * Sets payout options on a comment. Beneficiaries arrive as an extension.
 */
public record CommentOptionsOperation(
        String author,
        String permlink,
        Asset maxAcceptedPayout,
        int percentSteemDollars,
        boolean allowVotes,
        boolean allowCurationRewards,
        List<CommentOptionsExtension> extensions) implements Operation {

    public CommentOptionsOperation {
        Objects.requireNonNull(author, "author cannot be null");
        Objects.requireNonNull(permlink, "permlink cannot be null");
        Objects.requireNonNull(maxAcceptedPayout, "maxAcceptedPayout cannot be null");
        extensions = List.copyOf(Objects.requireNonNull(extensions, "extensions cannot be null"));
    }

    @Override
    public OperationType type() {
        return OperationType.COMMENT_OPTIONS;
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitCommentOptions(this);
    }
}
