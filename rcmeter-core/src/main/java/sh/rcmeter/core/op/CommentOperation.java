// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.rcmeter.core.op;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Creates or edits a post or reply.
 *
 * <p>{@code parentAuthor} is empty for top-level posts, in which case
 * {@code parentPermlink} is the post's category.
 */
public record CommentOperation(
        String parentAuthor,
        String parentPermlink,
        String author,
        String permlink,
        String title,
        String body,
        String jsonMetadata) implements Operation {

    public CommentOperation {
        Objects.requireNonNull(parentAuthor, "parentAuthor cannot be null");
        Objects.requireNonNull(parentPermlink, "parentPermlink cannot be null");
        Objects.requireNonNull(author, "author cannot be null");
        Objects.requireNonNull(permlink, "permlink cannot be null");
        Objects.requireNonNull(title, "title cannot be null");
        Objects.requireNonNull(body, "body cannot be null");
        Objects.requireNonNull(jsonMetadata, "jsonMetadata cannot be null");
    }

    /**
     * @return the UTF-8 encoded length of the permlink
     */
    public int permlinkByteLength() {
        return permlink.getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * @return the UTF-8 encoded length of the parent permlink
     */
    public int parentPermlinkByteLength() {
        return parentPermlink.getBytes(StandardCharsets.UTF_8).length;
    }

    @Override
    public OperationType type() {
        return OperationType.COMMENT;
    }

    @Override
    public void accept(final OperationVisitor visitor) {
        visitor.visitComment(this);
    }
}
