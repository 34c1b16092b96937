package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.core.comments.BlockComment;
import com.tyron.ledgercst.core.fields.FieldDescriptor;
import com.tyron.ledgercst.core.fields.Floating;
import com.tyron.ledgercst.core.fields.MaybeHooks;
import com.tyron.ledgercst.core.fields.NodeLayout;
import com.tyron.ledgercst.core.fields.NodeProperties;
import com.tyron.ledgercst.core.fields.RepeatedList;
import com.tyron.ledgercst.core.fields.RepeatedValues;
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
import com.tyron.ledgercst.lang.ledger.tokens.Comma;
import com.tyron.ledgercst.lang.ledger.tokens.Currency;
import com.tyron.ledgercst.lang.ledger.tokens.Date;
import com.tyron.ledgercst.lang.ledger.tokens.EscapedString;
import com.tyron.ledgercst.lang.ledger.tokens.InlineComment;
import com.tyron.ledgercst.lang.ledger.tokens.OpenLabel;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * {@code YYYY-MM-DD open Account [CUR, ...] ["booking"]}, opening an account with an
 * optional list of allowed currencies and a booking method.
 */
public final class Open extends DirectiveNode implements Directive {

    public static final FieldDescriptor ACCOUNT = FieldDescriptor.required("account");
    public static final FieldDescriptor CURRENCIES = FieldDescriptor.repeated("currencies", Comma::fromDefault, Whitespace::fromDefault)
            .withSeparatorsBefore(Whitespace::fromDefault);
    public static final FieldDescriptor BOOKING = FieldDescriptor.optional("booking", Floating.LEFT, Whitespace::fromDefault);

    public static final NodeLayout LAYOUT = NodeLayout.of(LedgerGrammarParser.OPEN,
            LEADING_COMMENT, DATE, LABEL, ACCOUNT, CURRENCIES, BOOKING, INLINE_COMMENT, META, TRAILING_COMMENT);

    private OpenLabel label;
    private Account account;
    private Repeated<Currency> currencies;
    private MaybeLeft<EscapedString> booking;

    public Open(
            @NotNull TokenStore tokenStore,
            @NotNull MaybeRight<BlockComment> leadingComment,
            @NotNull Date date,
            @NotNull OpenLabel label,
            @NotNull Account account,
            @NotNull Repeated<Currency> currencies,
            @NotNull MaybeLeft<EscapedString> booking,
            @NotNull MaybeLeft<InlineComment> inlineComment,
            @NotNull Repeated<CstNode> meta,
            @NotNull MaybeLeft<BlockComment> trailingComment) {
        super(tokenStore, leadingComment, date, inlineComment, meta, trailingComment);
        this.label = Objects.requireNonNull(label, "label");
        this.account = Objects.requireNonNull(account, "account");
        this.currencies = Objects.requireNonNull(currencies, "currencies");
        this.booking = Objects.requireNonNull(booking, "booking");
    }

    public static @NotNull Open fromParsed(@NotNull TokenStore store, @NotNull ParsedChildren children) {
        return new Open(store,
                children.right(LEADING_COMMENT.name(), BlockComment.class),
                children.required(DATE.name(), Date.class),
                children.required(LABEL.name(), OpenLabel.class),
                children.required(ACCOUNT.name(), Account.class),
                children.repeated(CURRENCIES.name(), Currency.class),
                children.left(BOOKING.name(), EscapedString.class),
                children.left(INLINE_COMMENT.name(), InlineComment.class),
                children.repeated(META.name(), CstNode.class),
                children.left(TRAILING_COMMENT.name(), BlockComment.class));
    }

    public static @NotNull Open fromChildren(
            @Nullable BlockComment leadingComment,
            @NotNull Date date,
            @NotNull Account account,
            @NotNull List<Currency> currencies,
            @Nullable EscapedString booking,
            @Nullable InlineComment inlineComment,
            @NotNull List<? extends CstNode> meta,
            @Nullable BlockComment trailingComment) {
        MaybeRight<BlockComment> leading = MaybeRight.fromChildren(MetaItem.claimed(leadingComment), LEADING_COMMENT.newSeparators());
        OpenLabel label = OpenLabel.fromDefault();
        Repeated<Currency> currencyList = Repeated.fromChildren(currencies, CURRENCIES::newSeparators, CURRENCIES::newSeparatorsBefore, null);
        MaybeLeft<EscapedString> maybeBooking = MaybeLeft.fromChildren(booking, BOOKING.newSeparators());
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
        tokens.addAll(currencyList.detach());
        tokens.addAll(maybeBooking.detach());
        tokens.addAll(inline.detach());
        tokens.addAll(metaList.detach());
        tokens.addAll(trailing.detach());
        TokenStore store = TokenStore.fromTokens(tokens);
        TokenTransformer identity = TokenTransformer.identity();
        return new Open(store,
                reattachChild(leading, store, identity),
                reattachChild(date, store, identity),
                reattachChild(label, store, identity),
                reattachChild(account, store, identity),
                reattachChild(currencyList, store, identity),
                reattachChild(maybeBooking, store, identity),
                reattachChild(inline, store, identity),
                reattachChild(metaList, store, identity),
                reattachChild(trailing, store, identity));
    }

    public static @NotNull Open fromValue(@NotNull LocalDate date, @NotNull String account) {
        return fromValue(date, account, List.of(), null);
    }

    public static @NotNull Open fromValue(
            @NotNull LocalDate date,
            @NotNull String account,
            @NotNull List<String> currencies,
            @Nullable String booking) {
        List<Currency> currencyTokens = new ArrayList<>(currencies.size());
        for (String currency : currencies) {
            currencyTokens.add(Currency.fromValue(currency));
        }
        return fromChildren(null, Date.fromValue(date), Account.fromValue(account), currencyTokens,
                booking != null ? EscapedString.fromValue(booking) : null, null, List.of(), null);
    }

    public @NotNull OpenLabel getRawLabel() {
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

    public @NotNull RepeatedList<Currency> getRawCurrencies() {
        return new RepeatedList<>(currencies, CURRENCIES);
    }

    public @NotNull RepeatedValues<String, Currency> getCurrencies() {
        return new RepeatedValues<>(getRawCurrencies(), Currency::fromValue);
    }

    public @Nullable EscapedString getRawBooking() {
        return booking.getInner();
    }

    public void setRawBooking(@Nullable EscapedString booking) {
        NodeProperties.setOptional(this.booking, booking, BOOKING);
    }

    public @Nullable String getBooking() {
        return NodeProperties.getOptionalValue(booking);
    }

    public void setBooking(@Nullable String booking) {
        NodeProperties.setOptionalValue(this.booking, booking, MaybeHooks.standard(BOOKING), EscapedString::fromValue);
    }

    @Override
    protected void reattachHeader(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        label = reattachChild(label, store, transformer);
        account = reattachChild(account, store, transformer);
        currencies = reattachChild(currencies, store, transformer);
        booking = reattachChild(booking, store, transformer);
    }

    @Override
    protected @NotNull Open cloneNode(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return new Open(store,
                cloneChild(leadingComment, store, transformer),
                cloneChild(date, store, transformer),
                cloneChild(label, store, transformer),
                cloneChild(account, store, transformer),
                cloneChild(currencies, store, transformer),
                cloneChild(booking, store, transformer),
                cloneChild(inlineComment, store, transformer),
                cloneChild(meta, store, transformer),
                cloneChild(trailingComment, store, transformer));
    }

    @Override
    protected @NotNull List<?> getChildren() {
        return Arrays.asList(leadingComment, date, label, account, currencies, booking, inlineComment, meta, trailingComment);
    }
}
