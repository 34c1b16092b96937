package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.core.comments.BlockComment;
import com.tyron.ledgercst.core.comments.CommentableNode;
import com.tyron.ledgercst.core.config.CstSettings;
import com.tyron.ledgercst.core.fields.FieldDescriptor;
import com.tyron.ledgercst.core.fields.Floating;
import com.tyron.ledgercst.core.fields.MaybeHooks;
import com.tyron.ledgercst.core.fields.NodeLayout;
import com.tyron.ledgercst.core.fields.NodeProperties;
import com.tyron.ledgercst.core.model.Indentable;
import com.tyron.ledgercst.core.model.MaybeLeft;
import com.tyron.ledgercst.core.model.MaybeRight;
import com.tyron.ledgercst.core.model.TokenTransformer;
import com.tyron.ledgercst.core.parser.ParsedChildren;
import com.tyron.ledgercst.core.spacing.SpacingAccessors;
import com.tyron.ledgercst.core.spacing.Whitespace;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import com.tyron.ledgercst.lang.ledger.parser.LedgerGrammarParser;
import com.tyron.ledgercst.lang.ledger.tokens.Date;
import com.tyron.ledgercst.lang.ledger.tokens.Decimal;
import com.tyron.ledgercst.lang.ledger.tokens.EscapedString;
import com.tyron.ledgercst.lang.ledger.tokens.Indent;
import com.tyron.ledgercst.lang.ledger.tokens.InlineComment;
import com.tyron.ledgercst.lang.ledger.tokens.MetaKey;
import com.tyron.ledgercst.lang.ledger.tokens.MetaValue;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One indented {@code key: value} line under a directive. The value is optional.
 */
public final class MetaItem extends CommentableNode implements Indentable, SpacingAccessors {

    public static final FieldDescriptor INDENT = FieldDescriptor.required("indent");
    public static final FieldDescriptor KEY = FieldDescriptor.required("key");
    public static final FieldDescriptor VALUE = FieldDescriptor.optional("value", Floating.LEFT, Whitespace::fromDefault);
    public static final FieldDescriptor INLINE_COMMENT = FieldDescriptor.optional("inline_comment", Floating.LEFT, Whitespace::fromDefault);

    public static final NodeLayout LAYOUT = NodeLayout.of(LedgerGrammarParser.META_ITEM,
            LEADING_COMMENT, INDENT, KEY, VALUE, INLINE_COMMENT, TRAILING_COMMENT);

    private Indent indent;
    private MetaKey key;
    private MaybeLeft<MetaValue> value;
    private MaybeLeft<InlineComment> inlineComment;

    public MetaItem(
            @NotNull TokenStore tokenStore,
            @NotNull MaybeRight<BlockComment> leadingComment,
            @NotNull Indent indent,
            @NotNull MetaKey key,
            @NotNull MaybeLeft<MetaValue> value,
            @NotNull MaybeLeft<InlineComment> inlineComment,
            @NotNull MaybeLeft<BlockComment> trailingComment) {
        super(tokenStore, leadingComment, trailingComment);
        this.indent = Objects.requireNonNull(indent, "indent");
        this.key = Objects.requireNonNull(key, "key");
        this.value = Objects.requireNonNull(value, "value");
        this.inlineComment = Objects.requireNonNull(inlineComment, "inlineComment");
    }

    public static @NotNull MetaItem fromParsed(@NotNull TokenStore store, @NotNull ParsedChildren children) {
        return new MetaItem(store,
                children.right(LEADING_COMMENT.name(), BlockComment.class),
                children.required(INDENT.name(), Indent.class),
                children.required(KEY.name(), MetaKey.class),
                children.left(VALUE.name(), MetaValue.class),
                children.left(INLINE_COMMENT.name(), InlineComment.class),
                children.left(TRAILING_COMMENT.name(), BlockComment.class));
    }

    public static @NotNull MetaItem fromChildren(
            @Nullable BlockComment leadingComment,
            @NotNull Indent indent,
            @NotNull MetaKey key,
            @Nullable MetaValue value,
            @Nullable InlineComment inlineComment,
            @Nullable BlockComment trailingComment) {
        MaybeRight<BlockComment> leading = MaybeRight.fromChildren(claimed(leadingComment), LEADING_COMMENT.newSeparators());
        MaybeLeft<MetaValue> maybeValue = MaybeLeft.fromChildren(value, VALUE.newSeparators());
        MaybeLeft<InlineComment> inline = MaybeLeft.fromChildren(inlineComment, INLINE_COMMENT.newSeparators());
        MaybeLeft<BlockComment> trailing = MaybeLeft.fromChildren(claimed(trailingComment), TRAILING_COMMENT.newSeparators());

        List<Token> tokens = new ArrayList<>();
        tokens.addAll(leading.detach());
        tokens.addAll(indent.detach());
        tokens.addAll(key.detach());
        tokens.addAll(maybeValue.detach());
        tokens.addAll(inline.detach());
        tokens.addAll(trailing.detach());
        TokenStore store = TokenStore.fromTokens(tokens);
        TokenTransformer identity = TokenTransformer.identity();
        return new MetaItem(store,
                reattachChild(leading, store, identity),
                reattachChild(indent, store, identity),
                reattachChild(key, store, identity),
                reattachChild(maybeValue, store, identity),
                reattachChild(inline, store, identity),
                reattachChild(trailing, store, identity));
    }

    public static @NotNull MetaItem fromValue(@NotNull String key, @Nullable Object value) {
        return fromValue(key, value, CstSettings.getInstance().getIndent());
    }

    public static @NotNull MetaItem fromValue(@NotNull String key, @Nullable Object value, @NotNull String indent) {
        return fromChildren(null, new Indent(indent), MetaKey.fromValue(key),
                value != null ? toToken(value) : null, null, null);
    }

    /**
     * Token for a plain value: {@link String} becomes a quoted string, {@link BigDecimal}
     * a number and {@link LocalDate} a date. Tokens are returned unchanged.
     *
     * @throws IllegalArgumentException for any other type
     */
    public static @NotNull MetaValue toToken(@NotNull Object value) {
        if (value instanceof MetaValue token) {
            return token;
        }
        if (value instanceof String s) {
            return EscapedString.fromValue(s);
        }
        if (value instanceof BigDecimal d) {
            return Decimal.fromValue(d);
        }
        if (value instanceof LocalDate d) {
            return Date.fromValue(d);
        }
        throw new IllegalArgumentException("unsupported metadata value type: " + value.getClass().getName());
    }

    @Override
    public @NotNull String getIndent() {
        return indent.getRawText();
    }

    public void setIndent(@NotNull String indent) {
        this.indent.setRawText(indent);
    }

    public @NotNull Indent getRawIndent() {
        return indent;
    }

    @Override
    protected @NotNull String commentIndent() {
        return indent.getRawText();
    }

    public @NotNull MetaKey getRawKey() {
        return key;
    }

    public void setRawKey(@NotNull MetaKey key) {
        this.key = NodeProperties.setRequired(this.key, key);
    }

    public @NotNull String getKey() {
        return key.getValue();
    }

    public void setKey(@NotNull String key) {
        this.key.setValue(key);
    }

    public @Nullable MetaValue getRawValue() {
        return value.getInner();
    }

    public void setRawValue(@Nullable MetaValue value) {
        NodeProperties.setOptional(this.value, value, VALUE);
    }

    public @Nullable Object getValue() {
        MetaValue current = value.getInner();
        return current != null ? current.getValue() : null;
    }

    /**
     * Updates the present token in place when it already holds a value of the same kind,
     * otherwise swaps in a new token built by {@link #toToken}.
     */
    public void setValue(@Nullable Object value) {
        MetaValue current = this.value.getInner();
        if (current instanceof EscapedString token && value instanceof String s) {
            token.setValue(s);
        } else if (current instanceof Decimal token && value instanceof BigDecimal d) {
            token.setValue(d);
        } else if (current instanceof Date token && value instanceof LocalDate d) {
            token.setValue(d);
        } else {
            setRawValue(value != null ? toToken(value) : null);
        }
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

    @Override
    protected void reattachBody(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        indent = reattachChild(indent, store, transformer);
        key = reattachChild(key, store, transformer);
        value = reattachChild(value, store, transformer);
        inlineComment = reattachChild(inlineComment, store, transformer);
    }

    @Override
    protected @NotNull MetaItem cloneNode(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return new MetaItem(store,
                cloneChild(leadingComment, store, transformer),
                cloneChild(indent, store, transformer),
                cloneChild(key, store, transformer),
                cloneChild(value, store, transformer),
                cloneChild(inlineComment, store, transformer),
                cloneChild(trailingComment, store, transformer));
    }

    @Override
    protected @NotNull List<?> getChildren() {
        return Arrays.asList(leadingComment, indent, key, value, inlineComment, trailingComment);
    }

    static @Nullable BlockComment claimed(@Nullable BlockComment comment) {
        if (comment != null) {
            comment.setClaimed(true);
        }
        return comment;
    }
}
