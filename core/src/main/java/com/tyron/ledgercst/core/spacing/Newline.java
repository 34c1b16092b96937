package com.tyron.ledgercst.core.spacing;

import com.tyron.ledgercst.core.config.CstSettings;
import com.tyron.ledgercst.core.model.TokenNode;
import org.jetbrains.annotations.NotNull;

/**
 * Line break, optionally preceded by carriage returns.
 */
public final class Newline extends TokenNode {

    public static final String TYPE = "NEWLINE";

    public Newline(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull Newline fromDefault() {
        return new Newline(CstSettings.getInstance().getNewline());
    }

    @Override
    public @NotNull Newline copy() {
        return new Newline(getRawText());
    }
}
