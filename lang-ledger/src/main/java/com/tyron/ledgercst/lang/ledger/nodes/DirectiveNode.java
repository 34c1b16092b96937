package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.core.comments.BlockComment;
import com.tyron.ledgercst.core.comments.CommentableNode;
import com.tyron.ledgercst.core.comments.RepeatedWithComments;
import com.tyron.ledgercst.core.config.CstSettings;
import com.tyron.ledgercst.core.fields.FieldDescriptor;
import com.tyron.ledgercst.core.fields.Floating;
import com.tyron.ledgercst.core.fields.MaybeHooks;
import com.tyron.ledgercst.core.fields.NodeProperties;
import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.Indentable;
import com.tyron.ledgercst.core.model.MaybeLeft;
import com.tyron.ledgercst.core.model.MaybeRight;
import com.tyron.ledgercst.core.model.Repeated;
import com.tyron.ledgercst.core.model.TokenTransformer;
import com.tyron.ledgercst.core.spacing.Newline;
import com.tyron.ledgercst.core.spacing.SpacingAccessors;
import com.tyron.ledgercst.core.spacing.Whitespace;
import com.tyron.ledgercst.core.store.TokenStore;
import com.tyron.ledgercst.lang.ledger.tokens.Date;
import com.tyron.ledgercst.lang.ledger.tokens.InlineComment;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Fields shared by every directive: the date, an inline comment at the end of the first
 * line and the indented metadata lines below it.
 */
abstract class DirectiveNode extends CommentableNode implements SpacingAccessors {

    public static final FieldDescriptor DATE = FieldDescriptor.required("date");
    public static final FieldDescriptor LABEL = FieldDescriptor.required("label");
    public static final FieldDescriptor INLINE_COMMENT = FieldDescriptor.optional("inline_comment", Floating.LEFT, Whitespace::fromDefault);
    public static final FieldDescriptor META = FieldDescriptor.repeated("meta", Newline::fromDefault)
            .withDefaultIndent(() -> CstSettings.getInstance().getIndent());

    protected Date date;
    protected MaybeLeft<InlineComment> inlineComment;
    protected Repeated<CstNode> meta;
    private final RepeatedWithComments<MetaItem> metaWithComments;

    protected DirectiveNode(
            @NotNull TokenStore tokenStore,
            @NotNull MaybeRight<BlockComment> leadingComment,
            @NotNull Date date,
            @NotNull MaybeLeft<InlineComment> inlineComment,
            @NotNull Repeated<CstNode> meta,
            @NotNull MaybeLeft<BlockComment> trailingComment) {
        super(tokenStore, leadingComment, trailingComment);
        this.date = Objects.requireNonNull(date, "date");
        this.inlineComment = Objects.requireNonNull(inlineComment, "inlineComment");
        this.meta = Objects.requireNonNull(meta, "meta");
        this.metaWithComments = new RepeatedWithComments<>(meta, META, this, MetaItem.class);
    }

    public @NotNull Date getRawDate() {
        return date;
    }

    public void setRawDate(@NotNull Date date) {
        this.date = NodeProperties.setRequired(this.date, date);
    }

    public @NotNull LocalDate getDate() {
        return date.getValue();
    }

    public void setDate(@NotNull LocalDate date) {
        this.date.setValue(date);
    }

    public @Nullable InlineComment getRawInlineComment() {
        return inlineComment.getInner();
    }

    public void setRawInlineComment(@Nullable InlineComment comment) {
        NodeProperties.setOptional(inlineComment, comment, INLINE_COMMENT);
    }

    public @Nullable String getInlineComment() {
        return NodeProperties.getOptionalValue(inlineComment);
    }

    public void setInlineComment(@Nullable String comment) {
        NodeProperties.setOptionalValue(inlineComment, comment, MaybeHooks.standard(INLINE_COMMENT), InlineComment::fromValue);
    }

    /**
     * Metadata lines together with the block comments claimed between them.
     */
    public @NotNull RepeatedWithComments<MetaItem> getRawMeta() {
        return metaWithComments;
    }

    public @NotNull Meta getMeta() {
        return new Meta(metaWithComments);
    }

    @Override
    protected void autoClaimChildren() {
        metaWithComments.autoClaimComments();
    }

    @Override
    protected final void reattachBody(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        date = reattachChild(date, store, transformer);
        reattachHeader(store, transformer);
        inlineComment = reattachChild(inlineComment, store, transformer);
        meta = reattachChild(meta, store, transformer);
    }

    /**
     * Re-homes the fields between the date and the inline comment.
     */
    protected abstract void reattachHeader(@NotNull TokenStore store, @NotNull TokenTransformer transformer);

    /**
     * Standalone metadata list for a directive built from scratch.
     */
    static @NotNull Repeated<CstNode> metaFromChildren(@NotNull List<? extends CstNode> items) {
        String indent = !items.isEmpty() && items.get(0) instanceof Indentable indentable
                ? indentable.getIndent() : META.getDefaultIndent();
        return Repeated.fromChildren(items, META::newSeparators, null, indent);
    }
}
