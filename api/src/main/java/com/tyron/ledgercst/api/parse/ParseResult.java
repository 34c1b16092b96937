package com.tyron.ledgercst.api.parse;

import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Output of {@link TokenizerParser#tokenizeAndParse}: every lexed terminal in source
 * order (including ignored ones such as whitespace and comments) and the parse tree,
 * which references a subset of them.
 */
public record ParseResult(@NotNull List<ParseNode.Terminal> tokens, @NotNull ParseNode.Rule tree) {

    public ParseResult {
        tokens = List.copyOf(tokens);
        Objects.requireNonNull(tree, "tree");
    }
}
