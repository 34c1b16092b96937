package com.tyron.ledgercst.core.model;

import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Composite node owning typed fields. Its span, delimited by {@link #getFirstToken()} and
 * {@link #getLastToken()}, is contiguous inside {@link #getTokenStore()}.
 * <p>
 * Subclasses list their structural children through {@link #getChildren()} and rebuild
 * them in {@link #cloneNode} and {@link #reattachChildren}.
 */
public abstract class TreeNode implements CstNode {

    protected TokenStore tokenStore;

    protected TreeNode(@NotNull TokenStore tokenStore) {
        this.tokenStore = Objects.requireNonNull(tokenStore, "tokenStore");
    }

    @Override
    public @NotNull TokenStore getTokenStore() {
        return tokenStore;
    }

    @Override
    public @NotNull List<Token> getTokens() {
        return tokenStore.range(getFirstToken(), getLastToken());
    }

    @Override
    public @NotNull List<Token> detach() {
        if (tokenStore.getFirst() != getFirstToken() || tokenStore.getLast() != getLastToken()) {
            throw new IllegalStateException("Cannot reuse node. Consider making a copy.");
        }
        return tokenStore.releaseAll();
    }

    @Override
    public final @NotNull TreeNode reattach(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        this.tokenStore = store;
        reattachChildren(store, transformer);
        return this;
    }

    @Override
    public final @NotNull TreeNode reattach(@NotNull TokenStore store) {
        return reattach(store, TokenTransformer.identity());
    }

    @Override
    public final @NotNull TreeNode cloneInto(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return cloneNode(store, transformer);
    }

    @Override
    public @NotNull TreeNode deepCopy() {
        List<Token> span = getTokens();
        List<Token> copies = new ArrayList<>(span.size());
        for (Token token : span) {
            copies.add(token.copy());
        }
        TokenStore target = TokenStore.fromTokens(copies);
        return cloneNode(target, new IndexRemapTransformer(tokenStore, span.get(0).getIndex(), target, 0));
    }

    protected abstract @NotNull TreeNode cloneNode(@NotNull TokenStore store, @NotNull TokenTransformer transformer);

    protected abstract void reattachChildren(@NotNull TokenStore store, @NotNull TokenTransformer transformer);

    /**
     * Structural children in field order. Absent optional values appear as null.
     */
    protected abstract @NotNull List<?> getChildren();

    @Override
    public void autoClaimComments() {
        List<?> children = getChildren();
        for (int i = children.size() - 1; i >= 0; i--) {
            if (children.get(i) instanceof CstNode child) {
                child.autoClaimComments();
            }
        }
    }

    @SuppressWarnings("unchecked")
    protected static <N extends CstNode> N cloneChild(@NotNull N child, @NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return (N) child.cloneInto(store, transformer);
    }

    protected static <N extends CstNode> @Nullable N cloneNullable(@Nullable N child, @NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return child == null ? null : cloneChild(child, store, transformer);
    }

    @SuppressWarnings("unchecked")
    protected static <N extends CstNode> N reattachChild(@NotNull N child, @NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return (N) child.reattach(store, transformer);
    }

    protected static <N extends CstNode> @Nullable N reattachNullable(@Nullable N child, @NotNull TokenStore store, @NotNull TokenTransformer transformer) {
        return child == null ? null : reattachChild(child, store, transformer);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        TreeNode other = (TreeNode) o;
        return getTokens().equals(other.getTokens()) && getChildren().equals(other.getChildren());
    }

    @Override
    public int hashCode() {
        return 31 * getClass().hashCode() + getTokens().hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Token token : getTokens()) {
            sb.append(token.getRawText());
        }
        return getClass().getSimpleName() + "(" + sb + ")";
    }
}
