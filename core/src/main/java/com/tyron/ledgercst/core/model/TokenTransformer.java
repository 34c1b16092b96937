package com.tyron.ledgercst.core.model;

import com.tyron.ledgercst.core.store.Token;
import org.jetbrains.annotations.NotNull;

/**
 * Maps a token of one subtree to the token that takes its place in another.
 */
@FunctionalInterface
public interface TokenTransformer {

    @NotNull Token transformToken(@NotNull Token token);

    @SuppressWarnings("unchecked")
    default <T extends Token> @NotNull T transform(@NotNull T token) {
        Token result = transformToken(token);
        if (result.getClass() != token.getClass()) {
            throw new IllegalStateException("token transformer mapped " + token + " to " + result);
        }
        return (T) result;
    }

    static @NotNull TokenTransformer identity() {
        return token -> token;
    }
}
