package com.tyron.ledgercst.core.fields;

import com.tyron.ledgercst.core.model.ValueToken;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Value view over a repeated field of value tokens, e.g. a list of currencies read and
 * written as strings.
 *
 * @param <V> value type
 * @param <X> token type
 */
public final class RepeatedValues<V, X extends ValueToken<V>> implements Iterable<V> {

    private final RepeatedList<X> list;
    private final Function<V, X> factory;

    public RepeatedValues(@NotNull RepeatedList<X> list, @NotNull Function<V, X> factory) {
        this.list = Objects.requireNonNull(list, "list");
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    public int size() {
        return list.size();
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    public @NotNull V get(int index) {
        return list.get(index).getValue();
    }

    /**
     * Rewrites the existing token in place.
     */
    public void set(int index, @NotNull V value) {
        list.get(index).setValue(value);
    }

    public void insert(int index, @NotNull V value) {
        list.insert(index, factory.apply(value));
    }

    public void append(@NotNull V value) {
        list.append(factory.apply(value));
    }

    public void delete(int index) {
        list.delete(index);
    }

    public @NotNull V pop(int index) {
        return list.pop(index).getValue();
    }

    public int indexOf(@NotNull V value) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).getValue().equals(value)) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(@NotNull V value) {
        return indexOf(value) >= 0;
    }

    /**
     * Removes the first occurrence of {@code value}.
     *
     * @throws IllegalArgumentException if the value is not present
     */
    public void remove(@NotNull V value) {
        int i = indexOf(value);
        if (i < 0) {
            throw new IllegalArgumentException("value not in list: " + value);
        }
        list.delete(i);
    }

    public void clear() {
        list.clear();
    }

    public @NotNull List<V> toList() {
        List<V> values = new ArrayList<>(list.size());
        for (X token : list) {
            values.add(token.getValue());
        }
        return values;
    }

    @Override
    public @NotNull Iterator<V> iterator() {
        return toList().iterator();
    }
}
