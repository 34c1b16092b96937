package com.tyron.ledgercst.core.model;

import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A node of the concrete syntax tree: either a single {@link TokenNode} or a
 * {@link TreeNode} spanning a contiguous range of tokens in one {@link TokenStore}.
 */
public interface CstNode {

    /**
     * The store holding this node's tokens, or null for a detached token.
     */
    @Nullable TokenStore getTokenStore();

    @NotNull Token getFirstToken();

    @NotNull Token getLastToken();

    /**
     * Tokens of this node's span, in store order.
     */
    @NotNull List<Token> getTokens();

    /**
     * Removes this node's tokens from their store so they can be inserted elsewhere.
     * Only legal when the node spans its entire store.
     *
     * @return the released tokens, in order
     * @throws IllegalStateException if the store holds tokens outside this node
     */
    @NotNull List<Token> detach();

    /**
     * Re-homes this node after its tokens were inserted into {@code store}.
     *
     * @return the node to keep referencing; tokens return their transformed counterpart
     */
    @NotNull CstNode reattach(@NotNull TokenStore store, @NotNull TokenTransformer transformer);

    default @NotNull CstNode reattach(@NotNull TokenStore store) {
        return reattach(store, TokenTransformer.identity());
    }

    /**
     * Rebuilds this node's structure over tokens of {@code store}, mapping each token
     * through {@code transformer}.
     */
    @NotNull CstNode cloneInto(@NotNull TokenStore store, @NotNull TokenTransformer transformer);

    /**
     * Copy of this node living in its own fresh store. No token is shared with the original.
     */
    @NotNull CstNode deepCopy();

    /**
     * Claims every claimable comment in this subtree, without failing.
     */
    default void autoClaimComments() {
    }
}
