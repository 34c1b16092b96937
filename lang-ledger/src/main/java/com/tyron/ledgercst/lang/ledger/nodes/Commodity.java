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
import com.tyron.ledgercst.lang.ledger.tokens.CommodityLabel;
import com.tyron.ledgercst.lang.ledger.tokens.Currency;
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
 * {@code YYYY-MM-DD commodity CUR}, declaring a currency.
 */
public final class Commodity extends DirectiveNode implements Directive {

    public static final FieldDescriptor CURRENCY = FieldDescriptor.required("currency");

    public static final NodeLayout LAYOUT = NodeLayout.of(LedgerGrammarParser.COMMODITY,
            LEADING_COMMENT, DATE, LABEL, CURRENCY, INLINE_COMMENT, META, TRAILING_COMMENT);

    private CommodityLabel label;
    private Currency currency;

    public Commodity(
            @NotNull TokenStore tokenStore,
            @NotNull MaybeRight<BlockComment> leadingComment,
            @NotNull Date date,
            @NotNull CommodityLabel label,
            @NotNull Currency currency,
            @NotNull MaybeLeft<InlineComment> inlineComment,
            @NotNull Repeated<CstNode> meta,
            @NotNull MaybeLeft<BlockComment> trailingComment) {
        super(tokenStore, leadingComment, date, inlineComment, meta, trailingComment);
        this.label = Objects.requireNonNull(label, "label");
        this.currency = Objects.requireNonNull(currency, "currency");
    }

    public static @NotNull Commodity fromParsed(@NotNull TokenStore store, @NotNull ParsedChildren children) {
        return new Commodity(store,
                children.right(LEADING_COMMENT.name(), BlockComment.class),
                children.required(DATE.name(), Date.class),
                children.required(LABEL.name(), CommodityLabel.class),
                children.required(CURRENCY.name(), Currency.class),
                children.left(INLINE_COMMENT.name(), InlineComment.class),
                children.repeated(META.name(), CstNode.class),
                children.left(TRAILING_COMMENT.name(), BlockComment.class));
    }

    public static @NotNull Commodity fromChildren(
            @Nullable BlockComment leadingComment,
            @NotNull Date date,
            @NotNull Currency currency,
            @Nullable InlineComment inlineComment,
            @NotNull List<? extends CstNode> meta,
            @Nullable BlockComment trailingComment) {
        MaybeRight<BlockComment> leading = MaybeRight.fromChildren(MetaItem.claimed(leadingComment), LEADING_COMMENT.newSeparators());
        CommodityLabel label = CommodityLabel.fromDefault();
        MaybeLeft<InlineComment> inline = MaybeLeft.fromChildren(inlineComment, INLINE_COMMENT.newSeparators());
        Repeated<CstNode> metaList = metaFromChildren(meta);
        MaybeLeft<BlockComment> trailing = MaybeLeft.fromChildren(MetaItem.claimed(trailingComment), TRAILING_COMMENT.newSeparators());

        List<Token> tokens = new ArrayList<>();
        tokens.addAll(leading.detach());
        tokens.addAll(date.detach());
        tokens.add(Whitespace.fromDefault());
        tokens.addAll(label.detach());
        tokens.add(Whitespace.fromDefault());
        tokens.addAll(currency.detach());
        tokens.addAll(inline.detach());
        tokens.addAll(metaList.detach());
        tokens.addAll(trailing.detach());
        TokenStore store = TokenStore.fromTokens(tokens);
        TokenTransformer identity = TokenTransformer.identity();
        return new Commodity(store,
                reattachChild(leading, store, identity),
                reattachChild(date, store, identity),
                reattachChild(label, store, identity),
                reattachChild(currency, store, identity),
                reattachChild(inline, store, identity),
                reattachChild(metaList, store, identity),
                reattachChild(trailing, store, identity));
    }

    public static @NotNull Commodity fromValue(@NotNull LocalDate date, @NotNull String currency) {
        return fromChildren(null, Date.fromValue(date), Currency.fromValue(currency), null, List.of(), null);
    }

    public @NotNull CommodityLabel getRawLabel() {
        return label;
    }

    public @NotNull Currency getRawCurrency() {
        return currency;
    }

    public void setRawCurrency(@NotNull Currency currency) {
        this.currency = NodeProperties.setRequired(this.currency, currency);
    }

    public @NotNull String getCurrency() {
        return currency.getValue();
    }

    public void setCurrency(@NotNull String currency) {
        this.currency.setValue(currency);
    }

    @Override
    protected void reattachHeader(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        label = reattachChild(label, store, transformer);
        currency = reattachChild(currency, store, transformer);
    }

    @Override
    protected @NotNull Commodity cloneNode(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return new Commodity(store,
                cloneChild(leadingComment, store, transformer),
                cloneChild(date, store, transformer),
                cloneChild(label, store, transformer),
                cloneChild(currency, store, transformer),
                cloneChild(inlineComment, store, transformer),
                cloneChild(meta, store, transformer),
                cloneChild(trailingComment, store, transformer));
    }

    @Override
    protected @NotNull List<?> getChildren() {
        return Arrays.asList(leadingComment, date, label, currency, inlineComment, meta, trailingComment);
    }
}
