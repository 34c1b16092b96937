package com.tyron.ledgercst.core.fields;

import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.NodeReplacer;
import com.tyron.ledgercst.core.model.Repeated;
import com.tyron.ledgercst.core.model.TokenTransformer;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Mutable sequence view over a {@link Repeated} field. Every edit is a bounded splice
 * against the neighboring items, or the placeholder when editing at the front.
 * <p>
 * Indices may be negative and count from the end. Insertion points are clamped; element
 * indices out of range throw {@link IndexOutOfBoundsException}.
 *
 * @param <X> item type
 */
public class RepeatedList<X extends CstNode> implements Iterable<X> {

    private final Repeated<X> repeated;
    private final FieldDescriptor field;

    public RepeatedList(@NotNull Repeated<X> repeated, @NotNull FieldDescriptor field) {
        this.repeated = Objects.requireNonNull(repeated, "repeated");
        this.field = Objects.requireNonNull(field, "field");
    }

    public @NotNull Repeated<X> getRepeated() {
        return repeated;
    }

    public @NotNull FieldDescriptor getField() {
        return field;
    }

    public int size() {
        return repeated.getItems().size();
    }

    public boolean isEmpty() {
        return repeated.getItems().isEmpty();
    }

    public @NotNull X get(int index) {
        List<X> items = repeated.getItems();
        return items.get(Indexes.element(index, items.size()));
    }

    public @NotNull List<X> get(@NotNull Slice slice) {
        List<X> items = repeated.getItems();
        List<X> result = new ArrayList<>();
        for (int i : slice.indices(items.size())) {
            result.add(items.get(i));
        }
        return result;
    }

    /**
     * Position of {@code item} by identity, or -1.
     */
    public int indexOf(@NotNull X item) {
        return Indexes.identityIndexOf(repeated.getItems(), item);
    }

    public void set(int index, @NotNull X value) {
        List<X> items = new ArrayList<>(repeated.getItems());
        int i = Indexes.element(index, items.size());
        X current = items.get(i);
        if (current == value) {
            return;
        }
        X attached = NodeReplacer.replace(current, value);
        items.set(i, attached);
        repeated.replaceItems(items);
        onRemoved(current);
        onInserted(attached);
    }

    /**
     * Assigns {@code values} to {@code slice}. With a unit step the selected range is
     * replaced and the list may grow or shrink. With any other step the sizes must match.
     *
     * @throws IllegalArgumentException on a size mismatch under a non-unit step, before any
     *                                  change is made
     */
    public void set(@NotNull Slice slice, @NotNull List<? extends X> values) {
        Slice.Bounds bounds = slice.resolve(size());
        if (bounds.step() == 1) {
            int start = bounds.start();
            int stop = Math.max(start, bounds.stop());
            List<Integer> range = new ArrayList<>();
            for (int i = start; i < stop; i++) {
                range.add(i);
            }
            List<X> snapshot = new ArrayList<>(values);
            dropMany(range);
            for (int k = 0; k < snapshot.size(); k++) {
                insert(start + k, snapshot.get(k));
            }
            return;
        }
        List<Integer> indices = slice.indices(size());
        if (indices.size() != values.size()) {
            throw new IllegalArgumentException("attempt to assign sequence of size " + values.size()
                    + " to extended slice of size " + indices.size());
        }
        for (int k = 0; k < indices.size(); k++) {
            set(indices.get(k), values.get(k));
        }
    }

    public void delete(int index) {
        dropMany(List.of(Indexes.element(index, size())));
    }

    public void delete(@NotNull Slice slice) {
        dropMany(slice.indices(size()));
    }

    /**
     * Inserts {@code value} so that it ends up at {@code index}.
     */
    public void insert(int index, @NotNull X value) {
        List<X> items = new ArrayList<>(repeated.getItems());
        int at = Indexes.insertion(index, items.size());
        TokenStore store = repeated.getTokenStore();
        List<Token> valueTokens = value.detach();
        if (items.isEmpty()) {
            List<Token> tokens = new ArrayList<>(field.newSeparatorsBefore());
            tokens.addAll(valueTokens);
            store.insertAfter(repeated.getPlaceholder(), tokens);
        } else if (at == 0) {
            List<Token> tokens = new ArrayList<>(valueTokens);
            tokens.addAll(field.newSeparators());
            store.insertBefore(items.get(0).getFirstToken(), tokens);
        } else {
            List<Token> tokens = new ArrayList<>(field.newSeparators());
            tokens.addAll(valueTokens);
            store.insertAfter(items.get(at - 1).getLastToken(), tokens);
        }
        @SuppressWarnings("unchecked")
        X attached = (X) value.reattach(store, TokenTransformer.identity());
        items.add(at, attached);
        repeated.replaceItems(items);
        onInserted(attached);
    }

    public void append(@NotNull X value) {
        insert(size(), value);
    }

    public void extend(@NotNull Iterable<? extends X> values) {
        List<X> snapshot = new ArrayList<>();
        values.forEach(snapshot::add);
        for (X value : snapshot) {
            append(value);
        }
    }

    public @NotNull X pop() {
        return pop(-1);
    }

    /**
     * Removes the item at {@code index} and moves it into its own store, so it can be
     * inserted elsewhere.
     */
    public @NotNull X pop(int index) {
        int i = Indexes.element(index, size());
        X item = repeated.getItems().get(i);
        List<Token> tokens = item.getTokens();
        dropMany(List.of(i));
        TokenStore standalone = TokenStore.fromTokens(tokens);
        @SuppressWarnings("unchecked")
        X moved = (X) item.reattach(standalone, TokenTransformer.identity());
        return moved;
    }

    /**
     * Removes {@code item}, found by identity.
     *
     * @throws IllegalArgumentException if the item is not in this list
     */
    public void remove(@NotNull X item) {
        int i = indexOf(item);
        if (i < 0) {
            throw new IllegalArgumentException("item not in list: " + item);
        }
        delete(i);
    }

    public void clear() {
        List<Integer> all = new ArrayList<>();
        for (int i = 0; i < size(); i++) {
            all.add(i);
        }
        dropMany(all);
    }

    /**
     * Removes the items at {@code indices} together with their separators. Ranges are cut
     * in descending order so earlier items keep their neighbors while the later ones go.
     */
    public void dropMany(@NotNull Collection<Integer> indices) {
        if (indices.isEmpty()) {
            return;
        }
        List<X> items = repeated.getItems();
        TreeSet<Integer> drop = new TreeSet<>();
        for (int index : indices) {
            drop.add(Indexes.element(index, items.size()));
        }
        TokenStore store = repeated.getTokenStore();
        for (int i : drop.descendingSet()) {
            X item = items.get(i);
            if (i > 0) {
                Token first = Objects.requireNonNull(store.getNext(items.get(i - 1).getLastToken()));
                store.remove(first, item.getLastToken());
                continue;
            }
            X follower = null;
            for (int j = 1; j < items.size(); j++) {
                if (!drop.contains(j)) {
                    follower = items.get(j);
                    break;
                }
            }
            if (follower != null) {
                Token last = Objects.requireNonNull(store.getPrev(follower.getFirstToken()));
                store.remove(item.getFirstToken(), last);
            } else {
                Token first = Objects.requireNonNull(store.getNext(repeated.getPlaceholder()));
                store.remove(first, item.getLastToken());
            }
        }
        List<X> kept = new ArrayList<>(items.size() - drop.size());
        List<X> removed = new ArrayList<>(drop.size());
        for (int i = 0; i < items.size(); i++) {
            (drop.contains(i) ? removed : kept).add(items.get(i));
        }
        repeated.replaceItems(kept);
        for (X item : removed) {
            onRemoved(item);
        }
    }

    /**
     * Read-only snapshot of the items.
     */
    public @NotNull List<X> toList() {
        return new ArrayList<>(repeated.getItems());
    }

    @Override
    public @NotNull Iterator<X> iterator() {
        return toList().iterator();
    }

    protected void onInserted(@NotNull X item) {
    }

    protected void onRemoved(@NotNull X item) {
    }
}
