package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.core.config.CstSettings;
import com.tyron.ledgercst.core.model.TokenNode;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;

/**
 * Leading blanks of an indented content line.
 */
public final class Indent extends TokenNode {

    public static final String TYPE = LedgerTokenTypes.INDENT;

    public Indent(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull Indent fromDefault() {
        return new Indent(CstSettings.getInstance().getIndent());
    }

    @Override
    public @NotNull Indent copy() {
        return new Indent(getRawText());
    }
}
