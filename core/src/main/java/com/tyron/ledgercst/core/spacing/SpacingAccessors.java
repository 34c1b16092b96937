package com.tyron.ledgercst.core.spacing;

import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read and replace the whitespace and newlines around a node.
 * <p>
 * Empty tokens right next to the node are skipped first. The spacing run then extends over
 * {@link Whitespace} and {@link Newline} tokens only, so other tokens such as comments are
 * never swallowed by a spacing update.
 */
public interface SpacingAccessors extends CstNode {

    default @NotNull List<Token> getRawSpacingBefore() {
        TokenStore store = getTokenStore();
        if (store == null) {
            return List.of();
        }
        List<Token> tokens = Spacing.find(store.getPrev(getFirstToken()), store::getPrev);
        Collections.reverse(tokens);
        return tokens;
    }

    default void setRawSpacingBefore(@NotNull List<? extends Token> tokens) {
        TokenStore store = Spacing.requireStore(this);
        List<Token> current = getRawSpacingBefore();
        if (current.isEmpty()) {
            store.insertBefore(getFirstToken(), tokens);
        } else {
            store.splice(tokens, current.get(0), current.get(current.size() - 1));
        }
    }

    default @NotNull String getSpacingBefore() {
        return Spacing.toText(getRawSpacingBefore());
    }

    default void setSpacingBefore(@NotNull String spacing) {
        setRawSpacingBefore(Spacing.toTokens(spacing));
    }

    default @NotNull List<Token> getRawSpacingAfter() {
        TokenStore store = getTokenStore();
        if (store == null) {
            return List.of();
        }
        return Spacing.find(store.getNext(getLastToken()), store::getNext);
    }

    default void setRawSpacingAfter(@NotNull List<? extends Token> tokens) {
        TokenStore store = Spacing.requireStore(this);
        List<Token> current = getRawSpacingAfter();
        if (current.isEmpty()) {
            store.insertAfter(getLastToken(), tokens);
        } else {
            store.splice(tokens, current.get(0), current.get(current.size() - 1));
        }
    }

    default @NotNull String getSpacingAfter() {
        return Spacing.toText(getRawSpacingAfter());
    }

    default void setSpacingAfter(@NotNull String spacing) {
        setRawSpacingAfter(Spacing.toTokens(spacing));
    }

    final class Spacing {

        private static final Pattern GROUP = Pattern.compile("([ \\t]+)|(\\r*\\n)");

        private Spacing() {
        }

        static @NotNull List<Token> find(@Nullable Token start, @NotNull UnaryOperator<Token> succ) {
            Token token = start;
            while (token != null && token.getRawText().isEmpty()) {
                token = succ.apply(token);
            }
            List<Token> tokens = new ArrayList<>();
            while (token instanceof Whitespace || token instanceof Newline) {
                if (!token.getRawText().isEmpty()) {
                    tokens.add(token);
                }
                token = succ.apply(token);
            }
            return tokens;
        }

        static @NotNull TokenStore requireStore(@NotNull CstNode node) {
            TokenStore store = node.getTokenStore();
            if (store == null) {
                throw new IllegalStateException("Cannot set spacing without a token store.");
            }
            return store;
        }

        public static @NotNull String toText(@NotNull List<? extends Token> tokens) {
            StringBuilder sb = new StringBuilder();
            for (Token token : tokens) {
                sb.append(token.getRawText());
            }
            return sb.toString();
        }

        /**
         * Splits {@code text} into whitespace and newline tokens. Characters that are neither
         * are dropped.
         */
        public static @NotNull List<Token> toTokens(@NotNull String text) {
            List<Token> tokens = new ArrayList<>();
            Matcher m = GROUP.matcher(text);
            while (m.find()) {
                if (m.group(1) != null) {
                    tokens.add(new Whitespace(m.group(1)));
                } else {
                    tokens.add(new Newline(m.group(2)));
                }
            }
            return tokens;
        }
    }
}
