package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.core.comments.BlockComment;
import com.tyron.ledgercst.core.fields.FieldDescriptor;
import com.tyron.ledgercst.core.fields.NodeLayout;
import com.tyron.ledgercst.core.fields.NodeProperties;
import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.MaybeLeft;
import com.tyron.ledgercst.core.model.MaybeRight;
import com.tyron.ledgercst.core.model.Repeated;
import com.tyron.ledgercst.core.model.TokenTransformer;
import com.tyron.ledgercst.core.parser.ParsedChildren;
import com.tyron.ledgercst.core.spacing.Whitespace;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import com.tyron.ledgercst.lang.ledger.parser.LedgerGrammarParser;
import com.tyron.ledgercst.lang.ledger.tokens.Account;
import com.tyron.ledgercst.lang.ledger.tokens.CloseLabel;
import com.tyron.ledgercst.lang.ledger.tokens.Date;
import com.tyron.ledgercst.lang.ledger.tokens.InlineComment;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@code YYYY-MM-DD close Account}, closing an account.
 */
public final class Close extends DirectiveNode implements Directive {

    public static final FieldDescriptor ACCOUNT = FieldDescriptor.required("account");

    public static final NodeLayout LAYOUT = NodeLayout.of(LedgerGrammarParser.CLOSE,
            LEADING_COMMENT, DATE, LABEL, ACCOUNT, INLINE_COMMENT, META, TRAILING_COMMENT);

    private CloseLabel label;
    private Account account;

    public Close(
            @NotNull TokenStore tokenStore,
            @NotNull MaybeRight<BlockComment> leadingComment,
            @NotNull Date date,
            @NotNull CloseLabel label,
            @NotNull Account account,
            @NotNull MaybeLeft<InlineComment> inlineComment,
            @NotNull Repeated<CstNode> meta,
            @NotNull MaybeLeft<BlockComment> trailingComment) {
        super(tokenStore, leadingComment, date, inlineComment, meta, trailingComment);
        this.label = Objects.requireNonNull(label, "label");
        this.account = Objects.requireNonNull(account, "account");
    }

    public static @NotNull Close fromParsed(@NotNull TokenStore store, @NotNull ParsedChildren children) {
        return new Close(store,
                children.right(LEADING_COMMENT.name(), BlockComment.class),
                children.required(DATE.name(), Date.class),
                children.required(LABEL.name(), CloseLabel.class),
                children.required(ACCOUNT.name(), Account.class),
                children.left(INLINE_COMMENT.name(), InlineComment.class),
                children.repeated(META.name(), CstNode.class),
                children.left(TRAILING_COMMENT.name(), BlockComment.class));
    }

    public static @NotNull Close fromChildren(
            @Nullable BlockComment leadingComment,
            @NotNull Date date,
            @NotNull Account account,
            @Nullable InlineComment inlineComment,
            @NotNull List<? extends CstNode> meta,
            @Nullable BlockComment trailingComment) {
        MaybeRight<BlockComment> leading = MaybeRight.fromChildren(MetaItem.claimed(leadingComment), LEADING_COMMENT.newSeparators());
        CloseLabel label = CloseLabel.fromDefault();
        MaybeLeft<InlineComment> inline = MaybeLeft.fromChildren(inlineComment, INLINE_COMMENT.newSeparators());
        Repeated<CstNode> metaList = metaFromChildren(meta);
        MaybeLeft<BlockComment> trailing = MaybeLeft.fromChildren(MetaItem.claimed(trailingComment), TRAILING_COMMENT.newSeparators());

        List<Token> tokens = new ArrayList<>();
        tokens.addAll(leading.detach());
        tokens.addAll(date.detach());
        tokens.add(Whitespace.fromDefault());
        tokens.addAll(label.detach());
        tokens.add(Whitespace.fromDefault());
        tokens.addAll(account.detach());
        tokens.addAll(inline.detach());
        tokens.addAll(metaList.detach());
        tokens.addAll(trailing.detach());
        TokenStore store = TokenStore.fromTokens(tokens);
        TokenTransformer identity = TokenTransformer.identity();
        return new Close(store,
                reattachChild(leading, store, identity),
                reattachChild(date, store, identity),
                reattachChild(label, store, identity),
                reattachChild(account, store, identity),
                reattachChild(inline, store, identity),
                reattachChild(metaList, store, identity),
                reattachChild(trailing, store, identity));
    }

    public static @NotNull Close fromValue(@NotNull LocalDate date, @NotNull String account) {
        return fromChildren(null, Date.fromValue(date), Account.fromValue(account), null, List.of(), null);
    }

    public @NotNull CloseLabel getRawLabel() {
        return label;
    }

    public @NotNull Account getRawAccount() {
        return account;
    }

    public void setRawAccount(@NotNull Account account) {
        this.account = NodeProperties.setRequired(this.account, account);
    }

    public @NotNull String getAccount() {
        return account.getValue();
    }

    public void setAccount(@NotNull String account) {
        this.account.setValue(account);
    }

    @Override
    protected void reattachHeader(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        label = reattachChild(label, store, transformer);
        account = reattachChild(account, store, transformer);
    }

    @Override
    protected @NotNull Close cloneNode(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return new Close(store,
                cloneChild(leadingComment, store, transformer),
                cloneChild(date, store, transformer),
                cloneChild(label, store, transformer),
                cloneChild(account, store, transformer),
                cloneChild(inlineComment, store, transformer),
                cloneChild(meta, store, transformer),
                cloneChild(trailingComment, store, transformer));
    }

    @Override
    protected @NotNull List<?> getChildren() {
        return Arrays.asList(leadingComment, date, label, account, inlineComment, meta, trailingComment);
    }
}
