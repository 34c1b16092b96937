package com.tyron.ledgercst.api.parse;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * Node of the raw parse tree produced by a {@link TokenizerParser}.
 * <p>
 * Optional and repeated grammar positions are made explicit so the tree builder can
 * anchor them even when nothing was matched.
 */
public sealed interface ParseNode permits ParseNode.Terminal, ParseNode.Rule, ParseNode.Optional, ParseNode.Repetition {

    /**
     * A lexed terminal. {@code index} is the position of the terminal in the full
     * token list returned alongside the tree.
     */
    record Terminal(@NotNull String type, @NotNull String rawText, int index, int line, int column) implements ParseNode {
        public Terminal {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(rawText, "rawText");
        }
    }

    record Rule(@NotNull String rule, @NotNull List<ParseNode> children) implements ParseNode {
        public Rule {
            Objects.requireNonNull(rule, "rule");
            children = List.copyOf(children);
        }
    }

    /**
     * An optional position; {@code inner} is null when nothing matched.
     */
    record Optional(@Nullable ParseNode inner) implements ParseNode {

        public static Optional empty() {
            return new Optional(null);
        }

        public boolean isPresent() {
            return inner != null;
        }
    }

    record Repetition(@NotNull List<ParseNode> items) implements ParseNode {
        public Repetition {
            items = List.copyOf(items);
        }
    }
}
