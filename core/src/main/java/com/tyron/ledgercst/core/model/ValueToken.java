package com.tyron.ledgercst.core.model;

import org.jetbrains.annotations.NotNull;

/**
 * Token exposing a typed value parsed from its raw text.
 *
 * @param <V> value type
 */
public abstract class ValueToken<V> extends TokenNode {

    private V value;

    protected ValueToken(@NotNull String rawText) {
        super(rawText);
        this.value = parseValue(rawText);
    }

    protected ValueToken(@NotNull String rawText, @NotNull V value) {
        super(rawText);
        this.value = value;
    }

    public @NotNull V getValue() {
        return value;
    }

    public void setValue(@NotNull V value) {
        String raw = formatValue(value);
        super.setRawText(raw);
        this.value = value;
    }

    @Override
    public void setRawText(@NotNull String rawText) {
        V parsed = parseValue(rawText);
        super.setRawText(rawText);
        this.value = parsed;
    }

    /**
     * @throws IllegalArgumentException if {@code rawText} is not a valid representation
     */
    protected abstract @NotNull V parseValue(@NotNull String rawText);

    protected abstract @NotNull String formatValue(@NotNull V value);
}
