package com.tyron.ledgercst.core;

import com.tyron.ledgercst.core.model.TokenNode;
import com.tyron.ledgercst.core.spacing.SpacingAccessors;
import org.jetbrains.annotations.NotNull;

/**
 * Plain token used by the engine tests.
 */
public final class Word extends TokenNode implements SpacingAccessors {

    public static final String TYPE = "WORD";

    public Word(@NotNull String rawText) {
        super(rawText);
    }

    @Override
    public @NotNull Word copy() {
        return new Word(getRawText());
    }
}
