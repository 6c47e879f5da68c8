// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.util.List;
import java.util.Objects;

/**
 * Lists the token assets a comment may be voted on with.
 *
 * @param assetNais numerical asset identifiers of the votable assets
 */
public record AllowedVoteAssets(List<String> assetNais) implements CommentOptionsExtension {

    public static final String TAG = "allowed_vote_assets";

    public AllowedVoteAssets {
        assetNais = List.copyOf(Objects.requireNonNull(assetNais, "assetNais cannot be null"));
    }

    @Override
    public String tag() {
        return TAG;
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitAllowedVoteAssets(this);
    }
}
