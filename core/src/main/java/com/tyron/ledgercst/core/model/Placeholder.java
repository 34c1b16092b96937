package com.tyron.ledgercst.core.model;

import org.jetbrains.annotations.NotNull;

/**
 * Zero-width anchor token. Marks where an optional or repeated child lives even while it
 * is absent or empty.
 */
public final class Placeholder extends TokenNode {

    public Placeholder() {
        super("");
    }

    @Override
    public void setRawText(@NotNull String rawText) {
        throw new IllegalStateException("Placeholder text cannot be changed");
    }

    @Override
    public @NotNull Placeholder copy() {
        return new Placeholder();
    }
}
