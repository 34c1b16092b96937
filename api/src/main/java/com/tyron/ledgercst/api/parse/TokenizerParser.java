package com.tyron.ledgercst.api.parse;

import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Tokenizer and parser for one concrete syntax.
 */
public interface TokenizerParser {

    /**
     * Lexes {@code source} without parsing it.
     *
     * @throws ParseException if the text cannot be tokenized
     */
    @NotNull List<ParseNode.Terminal> tokenize(@NotNull String source);

    /**
     * Lexes and parses {@code source} starting from {@code startRule}.
     *
     * @throws ParseException on syntax errors
     * @throws IllegalArgumentException if {@code startRule} is unknown
     */
    @NotNull ParseResult tokenizeAndParse(@NotNull String source, @NotNull String startRule);
}
