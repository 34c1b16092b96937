package com.tyron.ledgercst.core.model;

import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Optional child laid out as {@code value, separators, placeholder}.
 */
public final class MaybeRight<X extends CstNode> extends Maybe<X> {

    public MaybeRight(@NotNull TokenStore tokenStore, @Nullable X inner, @NotNull Placeholder placeholder) {
        super(tokenStore, inner, placeholder);
    }

    public static <X extends CstNode> @NotNull MaybeRight<X> fromChildren(@Nullable X inner, @NotNull List<? extends Token> separators) {
        Placeholder placeholder = new Placeholder();
        List<Token> tokens = new ArrayList<>();
        if (inner != null) {
            tokens.addAll(inner.detach());
            tokens.addAll(separators);
        }
        tokens.add(placeholder);
        TokenStore store = TokenStore.fromTokens(tokens);
        X attached = reattachNullable(inner, store, TokenTransformer.identity());
        return new MaybeRight<>(store, attached, placeholder);
    }

    @Override
    public @NotNull Token getFirstToken() {
        return inner != null ? inner.getFirstToken() : placeholder;
    }

    @Override
    public @NotNull Token getLastToken() {
        return placeholder;
    }

    @Override
    public void createInner(@NotNull X value, @NotNull List<? extends Token> separators) {
        requireAbsent();
        List<Token> tokens = new ArrayList<>(value.detach());
        tokens.addAll(separators);
        tokenStore.insertBefore(placeholder, tokens);
        inner = reattachChild(value, tokenStore, TokenTransformer.identity());
    }

    @Override
    public void removeInner() {
        X current = requirePresent();
        Token last = Objects.requireNonNull(tokenStore.getPrev(placeholder), "token before placeholder");
        tokenStore.remove(current.getFirstToken(), last);
        inner = null;
    }

    @Override
    protected @NotNull MaybeRight<X> cloneNode(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return new MaybeRight<>(store, cloneNullable(inner, store, transformer), transformer.transform(placeholder));
    }
}
