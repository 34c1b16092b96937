package com.tyron.ledgercst.core.spacing;

import com.tyron.ledgercst.core.model.TokenNode;
import org.jetbrains.annotations.NotNull;

/**
 * Run of spaces and tabs.
 */
public final class Whitespace extends TokenNode {

    public static final String TYPE = "WHITESPACE";

    public Whitespace(@NotNull String rawText) {
        super(rawText);
    }

    public static @NotNull Whitespace fromDefault() {
        return new Whitespace(" ");
    }

    @Override
    public @NotNull Whitespace copy() {
        return new Whitespace(getRawText());
    }
}
