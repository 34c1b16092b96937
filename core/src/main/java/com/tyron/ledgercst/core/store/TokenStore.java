package com.tyron.ledgercst.core.store;

import com.tyron.ledgercst.api.text.Position;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Ordered token buffer with cached absolute positions.
 * <p>
 * Concatenating the raw text of all tokens yields the managed text. Every mutation goes
 * through {@link #splice}, which reindexes and repositions the tokens from the splice
 * point to the tail in a single pass. Lookups by token are O(1) through the handle the
 * store keeps on each token it owns.
 */
public final class TokenStore implements Iterable<Token> {

    private final List<Token> tokens = new ArrayList<>();

    private TokenStore() {
    }

    public static @NotNull TokenStore create() {
        return new TokenStore();
    }

    /**
     * Builds a store owning {@code tokens}.
     *
     * @throws IllegalArgumentException if a token is already owned by a store or listed twice
     */
    public static @NotNull TokenStore fromTokens(@NotNull List<? extends Token> tokens) {
        TokenStore store = new TokenStore();
        store.spliceAt(0, 0, tokens);
        return store;
    }

    /**
     * Replaces the inclusive range {@code [start, end]} with {@code replacement}.
     * <p>
     * A null {@code start} means the head of the store. A null {@code end} means an empty
     * range right before {@code start}, i.e. a pure insertion. Tokens of the replaced range
     * may appear in {@code replacement}, which reorders them in place.
     *
     * @throws IllegalArgumentException on ownership violations or an inverted range
     */
    public void splice(@NotNull List<? extends Token> replacement, @Nullable Token start, @Nullable Token end) {
        int from = start == null ? 0 : indexOf(start);
        int to = end == null ? from : indexOf(end) + 1;
        if (to < from) {
            throw new IllegalArgumentException("inverted splice range: " + start + " .. " + end);
        }
        spliceAt(from, to, replacement);
    }

    public void insertBefore(@NotNull Token ref, @NotNull List<? extends Token> newTokens) {
        int at = indexOf(ref);
        spliceAt(at, at, newTokens);
    }

    /**
     * Inserts after {@code ref}, or at the head of the store when {@code ref} is null.
     */
    public void insertAfter(@Nullable Token ref, @NotNull List<? extends Token> newTokens) {
        int at = ref == null ? 0 : indexOf(ref) + 1;
        spliceAt(at, at, newTokens);
    }

    /**
     * Removes the inclusive range {@code [start, end]}. Removed tokens become detached.
     */
    public void remove(@NotNull Token start, @NotNull Token end) {
        splice(List.of(), start, end);
    }

    public void replace(@NotNull Token old, @NotNull Token replacement) {
        splice(List.of(replacement), old, old);
    }

    /**
     * Releases every token, leaving the store empty, and returns them in order.
     */
    public @NotNull List<Token> releaseAll() {
        List<Token> all = new ArrayList<>(tokens);
        spliceAt(0, tokens.size(), List.of());
        return all;
    }

    /**
     * Re-derives positions after {@code token}'s raw text changed in place.
     */
    public void update(@NotNull Token token) {
        int i = indexOf(token);
        repositionFrom(i + 1);
    }

    public int indexOf(@NotNull Token token) {
        if (token.store != this) {
            throw new IllegalArgumentException("token is not owned by this store: " + token);
        }
        return token.index;
    }

    public boolean contains(@NotNull Token token) {
        return token.store == this;
    }

    public @NotNull Token get(int index) {
        if (index < 0 || index >= tokens.size()) {
            throw new IndexOutOfBoundsException("token index " + index + " is out of bounds for size=" + tokens.size());
        }
        return tokens.get(index);
    }

    public @NotNull Position getPosition(@NotNull Token token) {
        indexOf(token);
        return token.getPosition();
    }

    public @Nullable Token getPrev(@NotNull Token token) {
        int i = indexOf(token);
        return i > 0 ? tokens.get(i - 1) : null;
    }

    public @Nullable Token getNext(@NotNull Token token) {
        int i = indexOf(token);
        return i + 1 < tokens.size() ? tokens.get(i + 1) : null;
    }

    public @Nullable Token getFirst() {
        return tokens.isEmpty() ? null : tokens.get(0);
    }

    public @Nullable Token getLast() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    /**
     * Tokens of the inclusive range {@code [start, end]}.
     */
    public @NotNull List<Token> range(@NotNull Token start, @NotNull Token end) {
        int from = indexOf(start);
        int to = indexOf(end) + 1;
        if (to < from) {
            throw new IllegalArgumentException("inverted range: " + start + " .. " + end);
        }
        return new ArrayList<>(tokens.subList(from, to));
    }

    /**
     * Returns the non-empty token starting exactly at {@code offset}.
     *
     * @throws IllegalArgumentException if no non-empty token starts there
     */
    public @NotNull Token getByPosition(int offset) {
        int lo = 0;
        int hi = tokens.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (tokens.get(mid).position.offset() < offset) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        for (int i = lo; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.position.offset() != offset) {
                break;
            }
            if (!t.getRawText().isEmpty()) {
                return t;
            }
        }
        throw new IllegalArgumentException("no token starts at offset=" + offset);
    }

    /**
     * Non-empty tokens starting on zero-based {@code line}.
     */
    public @NotNull List<Token> findByLine(int line) {
        int lo = 0;
        int hi = tokens.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (tokens.get(mid).position.line() < line) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        List<Token> result = new ArrayList<>();
        for (int i = lo; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.position.line() != line) {
                break;
            }
            if (!t.getRawText().isEmpty()) {
                result.add(t);
            }
        }
        return result;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int getTextLength() {
        if (tokens.isEmpty()) {
            return 0;
        }
        Token last = tokens.get(tokens.size() - 1);
        return last.position.offset() + last.getRawText().length();
    }

    public @NotNull String getText() {
        StringBuilder sb = new StringBuilder(getTextLength());
        for (Token t : tokens) {
            sb.append(t.getRawText());
        }
        return sb.toString();
    }

    @Override
    public @NotNull Iterator<Token> iterator() {
        return Collections.unmodifiableList(tokens).iterator();
    }

    private void spliceAt(int from, int to, List<? extends Token> replacement) {
        Set<Token> incoming = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Token t : replacement) {
            if (t == null) {
                throw new IllegalArgumentException("null token in splice");
            }
            if (!incoming.add(t)) {
                throw new IllegalArgumentException("token listed twice in splice: " + t);
            }
            if (t.store != null && (t.store != this || t.index < from || t.index >= to)) {
                throw new IllegalArgumentException("token is already owned by a store: " + t);
            }
        }

        List<Token> removed = tokens.subList(from, to);
        for (Token t : removed) {
            if (!incoming.contains(t)) {
                t.store = null;
                t.index = -1;
                t.position = null;
            }
        }
        removed.clear();
        tokens.addAll(from, replacement);
        for (Token t : replacement) {
            t.store = this;
        }
        repositionFrom(from);
    }

    private void repositionFrom(int from) {
        Position p;
        if (from == 0) {
            p = Position.ZERO;
        } else {
            Token prev = tokens.get(from - 1);
            p = prev.position.plus(Position.ofText(prev.getRawText()));
        }
        for (int i = from; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            t.index = i;
            t.position = p;
            p = p.plus(Position.ofText(t.getRawText()));
        }
    }
}
