package com.tyron.ledgercst.core.comments;

import com.tyron.ledgercst.core.fields.FieldDescriptor;
import com.tyron.ledgercst.core.fields.RepeatedList;
import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.Repeated;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Repeated field whose items may be interleaved with claimed block comments.
 * <p>
 * {@link #raw()} edits the full list, comments included; the remaining list operations see
 * only items of type {@code M} and translate their indices. Comments inserted through
 * {@link #raw()} become claimed, comments removed from it become free again.
 *
 * @param <M> item type
 */
public final class RepeatedWithComments<M extends CstNode> {

    private final Repeated<CstNode> repeated;
    private final CstNode owner;
    private final Class<M> itemType;
    private final RepeatedList<CstNode> raw;

    /**
     * @param owner node whose span bounds the search for comments around the list
     */
    public RepeatedWithComments(
            @NotNull Repeated<CstNode> repeated,
            @NotNull FieldDescriptor field,
            @NotNull CstNode owner,
            @NotNull Class<M> itemType) {
        this.repeated = Objects.requireNonNull(repeated, "repeated");
        this.owner = Objects.requireNonNull(owner, "owner");
        this.itemType = Objects.requireNonNull(itemType, "itemType");
        this.raw = new RepeatedList<>(repeated, field) {
            @Override
            protected void onInserted(@NotNull CstNode item) {
                if (item instanceof BlockComment comment) {
                    comment.setClaimed(true);
                }
            }

            @Override
            protected void onRemoved(@NotNull CstNode item) {
                if (item instanceof BlockComment comment) {
                    comment.setClaimed(false);
                }
            }
        };
    }

    public @NotNull Repeated<CstNode> getRepeated() {
        return repeated;
    }

    /**
     * The full list, items and comments alike.
     */
    public @NotNull RepeatedList<CstNode> raw() {
        return raw;
    }

    public @NotNull List<Interleaved<M>> entries() {
        List<Interleaved<M>> entries = new ArrayList<>();
        for (CstNode node : repeated.getItems()) {
            if (node instanceof BlockComment comment) {
                entries.add(new Interleaved.Comment<>(comment));
            } else {
                entries.add(new Interleaved.Item<>(itemType.cast(node)));
            }
        }
        return entries;
    }

    /**
     * Items without the interleaved comments.
     */
    public @NotNull List<M> items() {
        List<M> items = new ArrayList<>();
        for (CstNode node : repeated.getItems()) {
            if (itemType.isInstance(node)) {
                items.add(itemType.cast(node));
            }
        }
        return items;
    }

    public int size() {
        return items().size();
    }

    public boolean isEmpty() {
        return items().isEmpty();
    }

    public @NotNull M get(int index) {
        return itemType.cast(raw.get(rawIndex(index)));
    }

    public void set(int index, @NotNull M value) {
        raw.set(rawIndex(index), value);
    }

    /**
     * Inserts before the item currently at {@code index}, or after everything when
     * {@code index} equals the item count.
     */
    public void insert(int index, @NotNull M value) {
        int size = size();
        int resolved = index < 0 ? index + size : index;
        resolved = Math.max(0, Math.min(resolved, size));
        raw.insert(resolved == size ? raw.size() : rawIndex(resolved), value);
    }

    public void append(@NotNull M value) {
        raw.append(value);
    }

    public void delete(int index) {
        raw.delete(rawIndex(index));
    }

    public @NotNull M pop(int index) {
        return itemType.cast(raw.pop(rawIndex(index)));
    }

    public void remove(@NotNull M item) {
        raw.remove(item);
    }

    public @NotNull List<BlockComment> claimInterleavingComments() {
        return new InterleavingClaimer(repeated, owner, null).claim();
    }

    /**
     * Claims exactly {@code comments}.
     *
     * @throws CommentClaimException if any of them cannot be found; nothing is claimed then
     */
    public @NotNull List<BlockComment> claimInterleavingComments(@NotNull Collection<BlockComment> comments) {
        return new InterleavingClaimer(repeated, owner, comments).claim();
    }

    public @NotNull List<BlockComment> unclaimInterleavingComments() {
        return unclaim(null);
    }

    /**
     * Gives back exactly {@code comments}.
     *
     * @throws CommentClaimException if any of them is not in the list; nothing is unclaimed then
     */
    public @NotNull List<BlockComment> unclaimInterleavingComments(@NotNull Collection<BlockComment> comments) {
        return unclaim(comments);
    }

    /**
     * Claims the comments of every item, then the comments interleaved with the items.
     */
    public void autoClaimComments() {
        List<CstNode> items = repeated.getItems();
        for (int i = items.size() - 1; i >= 0; i--) {
            items.get(i).autoClaimComments();
        }
        claimInterleavingComments();
    }

    private List<BlockComment> unclaim(@Nullable Collection<BlockComment> comments) {
        Set<BlockComment> selected = null;
        if (comments != null) {
            selected = Collections.newSetFromMap(new IdentityHashMap<>());
            selected.addAll(comments);
            Set<BlockComment> missing = Collections.newSetFromMap(new IdentityHashMap<>());
            missing.addAll(selected);
            for (CstNode node : repeated.getItems()) {
                if (node instanceof BlockComment comment) {
                    missing.remove(comment);
                }
            }
            if (!missing.isEmpty()) {
                throw new CommentClaimException(missing.size() + " comment(s) not found.");
            }
        }
        List<CstNode> kept = new ArrayList<>();
        List<BlockComment> released = new ArrayList<>();
        for (CstNode node : repeated.getItems()) {
            if (node instanceof BlockComment comment && (selected == null || selected.contains(comment))) {
                comment.setClaimed(false);
                released.add(comment);
            } else {
                kept.add(node);
            }
        }
        repeated.replaceItems(kept);
        return released;
    }

    private int rawIndex(int index) {
        List<CstNode> nodes = repeated.getItems();
        int size = size();
        int resolved = index < 0 ? index + size : index;
        if (resolved < 0 || resolved >= size) {
            throw new IndexOutOfBoundsException("index " + index + " is out of range for size=" + size);
        }
        int seen = 0;
        for (int i = 0; i < nodes.size(); i++) {
            if (itemType.isInstance(nodes.get(i))) {
                if (seen == resolved) {
                    return i;
                }
                seen++;
            }
        }
        throw new IllegalStateException("item index " + index + " not found");
    }
}
