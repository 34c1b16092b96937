package com.tyron.ledgercst.lang.ledger.lexer;

import java.util.Set;

/**
 * Terminal type names produced by {@link LedgerLexer}.
 */
public final class LedgerTokenTypes {

    public static final String DATE = "DATE";
    public static final String OPEN = "OPEN";
    public static final String CLOSE = "CLOSE";
    public static final String COMMODITY = "COMMODITY";
    public static final String ACCOUNT = "ACCOUNT";
    public static final String CURRENCY = "CURRENCY";
    public static final String ESCAPED_STRING = "ESCAPED_STRING";
    public static final String NUMBER = "NUMBER";
    public static final String COMMA = "COMMA";
    public static final String INDENT = "INDENT";
    public static final String META_KEY = "META_KEY";
    public static final String INLINE_COMMENT = "INLINE_COMMENT";

    public static final String WHITESPACE = "WHITESPACE";
    public static final String NEWLINE = "NEWLINE";
    public static final String BLOCK_COMMENT = "BLOCK_COMMENT";

    /**
     * Terminals the grammar never references.
     */
    public static final Set<String> IGNORED = Set.of(WHITESPACE, NEWLINE, BLOCK_COMMENT);

    private LedgerTokenTypes() {
    }
}
