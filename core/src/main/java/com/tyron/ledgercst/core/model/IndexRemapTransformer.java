package com.tyron.ledgercst.core.model;

import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Maps tokens of a range in {@code source} to the tokens at the same relative index in
 * {@code target}. Used when a span was copied token by token into a new store.
 */
public final class IndexRemapTransformer implements TokenTransformer {

    private final TokenStore source;
    private final int sourceStart;
    private final TokenStore target;
    private final int targetStart;

    public IndexRemapTransformer(@NotNull TokenStore source, int sourceStart, @NotNull TokenStore target, int targetStart) {
        this.source = Objects.requireNonNull(source, "source");
        this.sourceStart = sourceStart;
        this.target = Objects.requireNonNull(target, "target");
        this.targetStart = targetStart;
    }

    @Override
    public @NotNull Token transformToken(@NotNull Token token) {
        int index = source.indexOf(token);
        return target.get(index - sourceStart + targetStart);
    }
}
