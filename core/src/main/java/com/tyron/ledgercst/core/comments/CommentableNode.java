package com.tyron.ledgercst.core.comments;

import com.tyron.ledgercst.core.fields.FieldDescriptor;
import com.tyron.ledgercst.core.fields.Floating;
import com.tyron.ledgercst.core.fields.NodeProperties;
import com.tyron.ledgercst.core.model.MaybeLeft;
import com.tyron.ledgercst.core.model.MaybeRight;
import com.tyron.ledgercst.core.model.Placeholder;
import com.tyron.ledgercst.core.model.TokenTransformer;
import com.tyron.ledgercst.core.model.TreeNode;
import com.tyron.ledgercst.core.spacing.Newline;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Tree node that may own a leading comment (the block comment on the lines right above it)
 * and a trailing comment (the block comment on the lines right below it).
 * <p>
 * Both are optional fields separated from the node by exactly one newline. A free comment
 * in the stream can be adopted with {@link #claimLeadingComment} or
 * {@link #claimTrailingComment} and given back with the matching unclaim method; neither
 * changes the printed text.
 */
public abstract class CommentableNode extends TreeNode {

    public static final FieldDescriptor LEADING_COMMENT = FieldDescriptor.optional("leading_comment", Floating.RIGHT, Newline::fromDefault);
    public static final FieldDescriptor TRAILING_COMMENT = FieldDescriptor.optional("trailing_comment", Floating.LEFT, Newline::fromDefault);

    protected MaybeRight<BlockComment> leadingComment;
    protected MaybeLeft<BlockComment> trailingComment;

    protected CommentableNode(
            @NotNull TokenStore tokenStore,
            @NotNull MaybeRight<BlockComment> leadingComment,
            @NotNull MaybeLeft<BlockComment> trailingComment) {
        super(tokenStore);
        this.leadingComment = Objects.requireNonNull(leadingComment, "leadingComment");
        this.trailingComment = Objects.requireNonNull(trailingComment, "trailingComment");
    }

    @Override
    public @NotNull Token getFirstToken() {
        return leadingComment.getFirstToken();
    }

    @Override
    public @NotNull Token getLastToken() {
        return trailingComment.getLastToken();
    }

    /**
     * Indentation given to comments created from a string value.
     */
    protected @NotNull String commentIndent() {
        return "";
    }

    public @Nullable BlockComment getRawLeadingComment() {
        return leadingComment.getInner();
    }

    public void setRawLeadingComment(@Nullable BlockComment comment) {
        BlockComment old = leadingComment.getInner();
        NodeProperties.setOptional(leadingComment, comment, LEADING_COMMENT);
        updateClaims(old, comment);
    }

    public @Nullable String getLeadingComment() {
        BlockComment comment = leadingComment.getInner();
        return comment != null ? comment.getValue() : null;
    }

    public void setLeadingComment(@Nullable String value) {
        BlockComment current = leadingComment.getInner();
        if (value != null && current != null) {
            current.setValue(value);
        } else {
            setRawLeadingComment(value != null ? BlockComment.fromValue(value, commentIndent()) : null);
        }
    }

    public @Nullable BlockComment getRawTrailingComment() {
        return trailingComment.getInner();
    }

    public void setRawTrailingComment(@Nullable BlockComment comment) {
        BlockComment old = trailingComment.getInner();
        NodeProperties.setOptional(trailingComment, comment, TRAILING_COMMENT);
        updateClaims(old, comment);
    }

    public @Nullable String getTrailingComment() {
        BlockComment comment = trailingComment.getInner();
        return comment != null ? comment.getValue() : null;
    }

    public void setTrailingComment(@Nullable String value) {
        BlockComment current = trailingComment.getInner();
        if (value != null && current != null) {
            current.setValue(value);
        } else {
            setRawTrailingComment(value != null ? BlockComment.fromValue(value, commentIndent()) : null);
        }
    }

    public @Nullable BlockComment claimLeadingComment() {
        return claimLeadingComment(null, false);
    }

    public @Nullable BlockComment claimLeadingComment(@Nullable BlockComment comment) {
        return claimLeadingComment(comment, false);
    }

    /**
     * Adopts the block comment right above this node, separated from it by exactly one
     * newline, as its leading comment. Placeholders between the comment and the node are
     * moved in front of the comment.
     *
     * @param comment        the comment expected there, or null to take whatever is there
     * @param suppressErrors return null instead of throwing when nothing can be claimed
     * @return the leading comment, or null if suppressed
     * @throws CommentClaimException if the node already has another leading comment, the
     *                               comment is owned elsewhere, or it is not right above
     */
    public @Nullable BlockComment claimLeadingComment(@Nullable BlockComment comment, boolean suppressErrors) {
        BlockComment existing = leadingComment.getInner();
        if (existing != null) {
            if (comment == null || comment == existing) {
                return existing;
            }
            return fail("Leading comment already exists.", suppressErrors);
        }
        if (comment != null && comment.isClaimed()) {
            return fail("Comment already claimed.", suppressErrors);
        }
        Token anchor = getFirstToken();
        List<Token> skipped = new ArrayList<>();
        Token token = tokenStore.getPrev(anchor);
        while (token instanceof Placeholder) {
            skipped.add(token);
            token = tokenStore.getPrev(token);
        }
        Token newline = token;
        Token candidate = newline instanceof Newline ? tokenStore.getPrev(newline) : null;
        if (!(candidate instanceof BlockComment found) || (comment != null && comment != found)) {
            return fail("Comment not found in the same context.", suppressErrors);
        }
        if (found.isClaimed()) {
            return fail("Comment already claimed.", suppressErrors);
        }
        if (!skipped.isEmpty()) {
            Token regionEnd = skipped.get(0);
            Collections.reverse(skipped);
            List<Token> reordered = new ArrayList<>(skipped);
            reordered.add(found);
            reordered.add(newline);
            tokenStore.splice(reordered, found, regionEnd);
        }
        leadingComment.adoptInner(found);
        found.setClaimed(true);
        return found;
    }

    public @Nullable BlockComment unclaimLeadingComment() {
        BlockComment comment = leadingComment.releaseInner();
        if (comment != null) {
            comment.setClaimed(false);
        }
        return comment;
    }

    public @Nullable BlockComment claimTrailingComment() {
        return claimTrailingComment(null, false);
    }

    public @Nullable BlockComment claimTrailingComment(@Nullable BlockComment comment) {
        return claimTrailingComment(comment, false);
    }

    /**
     * Adopts the block comment right below this node, separated from it by exactly one
     * newline, as its trailing comment. Placeholders between the node and the comment are
     * moved behind the comment.
     *
     * @see #claimLeadingComment(BlockComment, boolean)
     */
    public @Nullable BlockComment claimTrailingComment(@Nullable BlockComment comment, boolean suppressErrors) {
        BlockComment existing = trailingComment.getInner();
        if (existing != null) {
            if (comment == null || comment == existing) {
                return existing;
            }
            return fail("Trailing comment already exists.", suppressErrors);
        }
        if (comment != null && comment.isClaimed()) {
            return fail("Comment already claimed.", suppressErrors);
        }
        Token anchor = getLastToken();
        List<Token> skipped = new ArrayList<>();
        Token token = tokenStore.getNext(anchor);
        while (token instanceof Placeholder) {
            skipped.add(token);
            token = tokenStore.getNext(token);
        }
        Token newline = token;
        Token candidate = newline instanceof Newline ? tokenStore.getNext(newline) : null;
        if (!(candidate instanceof BlockComment found) || (comment != null && comment != found)) {
            return fail("Comment not found in the same context.", suppressErrors);
        }
        if (found.isClaimed()) {
            return fail("Comment already claimed.", suppressErrors);
        }
        if (!skipped.isEmpty()) {
            Token regionStart = skipped.get(0);
            List<Token> reordered = new ArrayList<>();
            reordered.add(newline);
            reordered.add(found);
            reordered.addAll(skipped);
            tokenStore.splice(reordered, regionStart, found);
        }
        trailingComment.adoptInner(found);
        found.setClaimed(true);
        return found;
    }

    public @Nullable BlockComment unclaimTrailingComment() {
        BlockComment comment = trailingComment.releaseInner();
        if (comment != null) {
            comment.setClaimed(false);
        }
        return comment;
    }

    /**
     * Claims comments of the children first, then this node's trailing and leading comments.
     */
    @Override
    public void autoClaimComments() {
        autoClaimChildren();
        claimTrailingComment(null, true);
        claimLeadingComment(null, true);
    }

    protected void autoClaimChildren() {
        super.autoClaimComments();
    }

    @Override
    protected final void reattachChildren(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        leadingComment = reattachChild(leadingComment, store, transformer);
        reattachBody(store, transformer);
        trailingComment = reattachChild(trailingComment, store, transformer);
    }

    /**
     * Re-homes the fields between the leading and trailing comments.
     */
    protected abstract void reattachBody(@NotNull TokenStore store, @NotNull TokenTransformer transformer);

    private static void updateClaims(@Nullable BlockComment old, @Nullable BlockComment current) {
        if (old != null && old != current) {
            old.setClaimed(false);
        }
        if (current != null) {
            current.setClaimed(true);
        }
    }

    private static @Nullable BlockComment fail(String message, boolean suppressErrors) {
        if (suppressErrors) {
            return null;
        }
        throw new CommentClaimException(message);
    }
}
