package com.tyron.ledgercst.core.model;

import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Leaf node wrapping exactly one token. Two token nodes are equal when they have the same
 * concrete type and raw text.
 */
public abstract class TokenNode extends Token implements CstNode {

    protected TokenNode(@NotNull String rawText) {
        super(rawText);
    }

    @Override
    public @NotNull Token getFirstToken() {
        return this;
    }

    @Override
    public @NotNull Token getLastToken() {
        return this;
    }

    @Override
    public @NotNull List<Token> getTokens() {
        return List.of(this);
    }

    @Override
    public @NotNull List<Token> detach() {
        TokenStore store = getTokenStore();
        if (store == null) {
            return List.of(this);
        }
        if (store.size() != 1) {
            throw new IllegalStateException("Cannot reuse node. Consider making a copy.");
        }
        return store.releaseAll();
    }

    @Override
    public @NotNull CstNode reattach(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return transformer.transform(this);
    }

    @Override
    public @NotNull CstNode cloneInto(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return transformer.transform(this);
    }

    @Override
    public abstract @NotNull TokenNode copy();

    @Override
    public @NotNull TokenNode deepCopy() {
        return copy();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        return getRawText().equals(((TokenNode) o).getRawText());
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + getRawText().hashCode();
    }
}
