package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.core.comments.RepeatedWithComments;
import com.tyron.ledgercst.core.config.CstSettings;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Keyed view over the metadata lines of a directive. Keys are looked up in line order;
 * if a key occurs more than once the first line wins.
 */
public final class Meta implements Iterable<MetaItem> {

    private final RepeatedWithComments<MetaItem> items;

    Meta(@NotNull RepeatedWithComments<MetaItem> items) {
        this.items = Objects.requireNonNull(items, "items");
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public @NotNull List<String> keys() {
        List<String> keys = new ArrayList<>();
        for (MetaItem item : items.items()) {
            keys.add(item.getKey());
        }
        return keys;
    }

    public boolean containsKey(@NotNull String key) {
        return getItem(key) != null;
    }

    public @Nullable MetaItem getItem(@NotNull String key) {
        for (MetaItem item : items.items()) {
            if (item.getKey().equals(key)) {
                return item;
            }
        }
        return null;
    }

    /**
     * @return the value of {@code key}, or null if the key is missing or has no value
     */
    public @Nullable Object get(@NotNull String key) {
        MetaItem item = getItem(key);
        return item != null ? item.getValue() : null;
    }

    /**
     * Sets the value of an existing line, or appends a new line using the indentation of
     * the existing ones.
     */
    public void put(@NotNull String key, @Nullable Object value) {
        MetaItem item = getItem(key);
        if (item != null) {
            item.setValue(value);
        } else {
            items.append(MetaItem.fromValue(key, value, indent()));
        }
    }

    /**
     * Removes the line of {@code key} and returns it in its own store.
     */
    public @Nullable MetaItem remove(@NotNull String key) {
        List<MetaItem> current = items.items();
        for (int i = 0; i < current.size(); i++) {
            if (current.get(i).getKey().equals(key)) {
                return items.pop(i);
            }
        }
        return null;
    }

    public @NotNull Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        for (MetaItem item : items.items()) {
            map.putIfAbsent(item.getKey(), item.getValue());
        }
        return map;
    }

    @Override
    public @NotNull Iterator<MetaItem> iterator() {
        return items.items().iterator();
    }

    private String indent() {
        String inferred = items.getRepeated().getInferredIndent();
        return inferred != null ? inferred : CstSettings.getInstance().getIndent();
    }
}
