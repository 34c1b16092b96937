package com.tyron.ledgercst.core.model;

import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Optional child laid out as {@code placeholder, separators, value}.
 */
public final class MaybeLeft<X extends CstNode> extends Maybe<X> {

    public MaybeLeft(@NotNull TokenStore tokenStore, @Nullable X inner, @NotNull Placeholder placeholder) {
        super(tokenStore, inner, placeholder);
    }

    public static <X extends CstNode> @NotNull MaybeLeft<X> fromChildren(@Nullable X inner, @NotNull List<? extends Token> separators) {
        Placeholder placeholder = new Placeholder();
        List<Token> tokens = new ArrayList<>();
        tokens.add(placeholder);
        if (inner != null) {
            tokens.addAll(separators);
            tokens.addAll(inner.detach());
        }
        TokenStore store = TokenStore.fromTokens(tokens);
        X attached = reattachNullable(inner, store, TokenTransformer.identity());
        return new MaybeLeft<>(store, attached, placeholder);
    }

    @Override
    public @NotNull Token getFirstToken() {
        return placeholder;
    }

    @Override
    public @NotNull Token getLastToken() {
        return inner != null ? inner.getLastToken() : placeholder;
    }

    @Override
    public void createInner(@NotNull X value, @NotNull List<? extends Token> separators) {
        requireAbsent();
        List<Token> tokens = new ArrayList<>(separators);
        tokens.addAll(value.detach());
        tokenStore.insertAfter(placeholder, tokens);
        inner = reattachChild(value, tokenStore, TokenTransformer.identity());
    }

    @Override
    public void removeInner() {
        X current = requirePresent();
        Token first = Objects.requireNonNull(tokenStore.getNext(placeholder), "token after placeholder");
        tokenStore.remove(first, current.getLastToken());
        inner = null;
    }

    @Override
    protected @NotNull MaybeLeft<X> cloneNode(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return new MaybeLeft<>(store, cloneNullable(inner, store, transformer), transformer.transform(placeholder));
    }
}
