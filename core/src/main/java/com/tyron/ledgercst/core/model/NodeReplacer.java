package com.tyron.ledgercst.core.model;

import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Swaps one node for another in place.
 */
public final class NodeReplacer {

    private NodeReplacer() {
    }

    /**
     * Splices {@code replacement}'s tokens over {@code current}'s span and re-homes
     * {@code replacement} into the store {@code current} lived in.
     *
     * @return the node now occupying the span
     * @throws IllegalArgumentException if {@code current} is a free token
     */
    public static <N extends CstNode> @NotNull N replace(@NotNull N current, @NotNull N replacement) {
        TokenStore store = current.getTokenStore();
        if (store == null) {
            throw new IllegalArgumentException("Cannot replace a free token.");
        }
        if (current == replacement) {
            return current;
        }
        Token first = current.getFirstToken();
        Token last = current.getLastToken();
        List<Token> tokens = replacement.detach();
        store.splice(tokens, first, last);
        @SuppressWarnings("unchecked")
        N attached = (N) replacement.reattach(store, TokenTransformer.identity());
        return attached;
    }
}
