package com.tyron.ledgercst.core.parser;

import com.tyron.ledgercst.api.parse.ParseException;
import com.tyron.ledgercst.api.parse.ParseNode;
import com.tyron.ledgercst.api.parse.ParseResult;
import com.tyron.ledgercst.api.parse.TokenizerParser;
import com.tyron.ledgercst.core.language.LanguageSupport;
import com.tyron.ledgercst.core.model.TokenNode;
import com.tyron.ledgercst.core.model.TreeNode;
import org.jetbrains.annotations.NotNull;

import java.util.List;
import java.util.Objects;

/**
 * Parses text into tree nodes or single tokens of one language.
 */
public final class CstParser {

    private final TokenizerParser tokenizerParser;
    private final NodeRegistry registry;

    public CstParser(@NotNull TokenizerParser tokenizerParser, @NotNull NodeRegistry registry) {
        this.tokenizerParser = Objects.requireNonNull(tokenizerParser, "tokenizerParser");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public static @NotNull CstParser forLanguage(@NotNull LanguageSupport language) {
        return new CstParser(language.createTokenizerParser(), language.getNodeRegistry());
    }

    public @NotNull NodeRegistry getRegistry() {
        return registry;
    }

    /**
     * Parses {@code text} as a whole node of {@code type}.
     *
     * @throws ParseException on syntax errors
     */
    public <N extends TreeNode> @NotNull N parse(@NotNull String text, @NotNull Class<N> type) {
        String rule = registry.nodeType(type).rule();
        ParseResult result = tokenizerParser.tokenizeAndParse(text, rule);
        return TreeBuilder.build(result, registry, type);
    }

    /**
     * Parses {@code text} as exactly one token of {@code type}.
     *
     * @throws ParseException if the text is not a single token of that type
     */
    public <T extends TokenNode> @NotNull T parseToken(@NotNull String text, @NotNull Class<T> type) {
        String expected = registry.tokenType(type);
        List<ParseNode.Terminal> tokens = tokenizerParser.tokenize(text);
        if (tokens.isEmpty()) {
            throw new ParseException("expected " + expected + " but reached end of input", 0, 0);
        }
        ParseNode.Terminal first = tokens.get(0);
        if (!first.type().equals(expected)) {
            throw new ParseException("expected " + expected + " but got " + first.type(), first.line(), first.column());
        }
        if (tokens.size() > 1) {
            ParseNode.Terminal extra = tokens.get(1);
            throw new ParseException("expected end of input but got " + extra.type(), extra.line(), extra.column());
        }
        return type.cast(registry.createToken(first.type(), first.rawText()));
    }
}
