package com.tyron.ledgercst.core.language;

import com.tyron.ledgercst.api.parse.TokenizerParser;
import com.tyron.ledgercst.core.parser.NodeRegistry;
import org.jetbrains.annotations.NotNull;

/**
 * Binds a concrete syntax to the engine.
 */
public interface LanguageSupport {

    @NotNull String getName();

    /**
     * @return true if this language handles the given file (e.g. endsWith(".bean"))
     */
    boolean canHandle(@NotNull String fileName);

    /**
     * Creates a tokenizer and parser for one parse session.
     */
    @NotNull TokenizerParser createTokenizerParser();

    /**
     * Token and tree models of this language.
     */
    @NotNull NodeRegistry getNodeRegistry();
}
