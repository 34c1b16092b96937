package com.tyron.ledgercst.core.store;

import com.tyron.ledgercst.api.text.Position;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Smallest unit of text managed by a {@link TokenStore}.
 * <p>
 * A token is owned by at most one store at a time. While owned, it carries a handle
 * (store, index, cached position) maintained by the store; the handle is cleared when
 * the token leaves the store.
 */
public abstract class Token {

    private String rawText;

    @Nullable TokenStore store;
    int index = -1;
    @Nullable Position position;

    protected Token(@NotNull String rawText) {
        this.rawText = Objects.requireNonNull(rawText, "rawText");
    }

    public final @NotNull String getRawText() {
        return rawText;
    }

    /**
     * Replaces the raw text in place and lets the owning store reposition the tokens
     * that follow.
     */
    public void setRawText(@NotNull String rawText) {
        Objects.requireNonNull(rawText, "rawText");
        if (this.rawText.equals(rawText)) {
            return;
        }
        this.rawText = rawText;
        TokenStore s = store;
        if (s != null) {
            s.update(this);
        }
    }

    public @Nullable TokenStore getTokenStore() {
        return store;
    }

    /**
     * Index inside the owning store.
     *
     * @throws IllegalStateException if the token is detached
     */
    public int getIndex() {
        if (store == null) {
            throw new IllegalStateException("token is detached: " + this);
        }
        return index;
    }

    /**
     * Absolute position of the first character of this token.
     *
     * @throws IllegalStateException if the token is detached
     */
    public @NotNull Position getPosition() {
        Position p = position;
        if (store == null || p == null) {
            throw new IllegalStateException("token is detached: " + this);
        }
        return p;
    }

    /**
     * Fresh detached token of the same type and raw text.
     */
    public abstract @NotNull Token copy();

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + rawText.replace("\n", "\\n") + ")";
    }
}
