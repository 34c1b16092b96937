package com.tyron.ledgercst.core.comments;

import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.Placeholder;
import com.tyron.ledgercst.core.model.Repeated;
import com.tyron.ledgercst.core.spacing.Newline;
import com.tyron.ledgercst.core.spacing.Whitespace;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Finds free block comments around and between the items of a repeated field and splices
 * them into the item list.
 */
final class InterleavingClaimer {

    private static final Logger LOG = Logger.getLogger(InterleavingClaimer.class.getName());

    private final Repeated<CstNode> repeated;
    private final CstNode owner;
    private final @Nullable Set<BlockComment> wanted;

    InterleavingClaimer(@NotNull Repeated<CstNode> repeated, @NotNull CstNode owner, @Nullable Collection<BlockComment> comments) {
        this.repeated = repeated;
        this.owner = owner;
        if (comments == null) {
            this.wanted = null;
        } else {
            this.wanted = Collections.newSetFromMap(new IdentityHashMap<>());
            this.wanted.addAll(comments);
        }
    }

    @NotNull List<BlockComment> claim() {
        TokenStore store = repeated.getTokenStore();

        List<BlockComment> before = findOuter(repeated.getFirstToken(), store::getPrev, owner.getFirstToken());
        Collections.reverse(before);
        List<CstNode> inner = findInner(store);
        List<BlockComment> after = findOuter(repeated.getLastToken(), store::getNext, owner.getLastToken());

        if (wanted != null && !wanted.isEmpty()) {
            throw new CommentClaimException(wanted.size() + " comment(s) not found.");
        }

        if (!before.isEmpty()) {
            shiftPlaceholders(store, before.get(0), repeated.getPlaceholder(), true);
        }
        if (!after.isEmpty()) {
            Token first = store.getNext(repeated.getLastToken());
            if (first != null) {
                shiftPlaceholders(store, first, after.get(after.size() - 1), false);
            }
        }

        List<CstNode> items = new ArrayList<>(before.size() + inner.size() + after.size());
        items.addAll(before);
        items.addAll(inner);
        items.addAll(after);
        List<BlockComment> claimed = new ArrayList<>();
        for (CstNode item : items) {
            if (item instanceof BlockComment comment && !comment.isClaimed()) {
                comment.setClaimed(true);
                claimed.add(comment);
            }
        }
        repeated.replaceItems(items);
        if (!claimed.isEmpty()) {
            LOG.fine("claimInterleaving owner=" + owner.getClass().getSimpleName() + " claimed=" + claimed.size() + " items=" + items.size());
        }
        return claimed;
    }

    private boolean isWanted(BlockComment comment) {
        return wanted == null || wanted.contains(comment);
    }

    private List<CstNode> findInner(TokenStore store) {
        List<CstNode> result = new ArrayList<>();
        Token start = repeated.getFirstToken();
        for (CstNode item : repeated.getItems()) {
            Token end = item.getFirstToken();
            Token token = start;
            while (token != null && token != end) {
                if (token instanceof BlockComment comment && !comment.isClaimed() && isWanted(comment)) {
                    if (wanted != null) {
                        wanted.remove(comment);
                    }
                    result.add(comment);
                }
                token = store.getNext(token);
            }
            result.add(item);
            if (wanted != null && item instanceof BlockComment comment) {
                wanted.remove(comment);
            }
            start = store.getNext(item.getLastToken());
        }
        return result;
    }

    private List<BlockComment> findOuter(Token start, UnaryOperator<Token> succ, Token limit) {
        List<BlockComment> result = new ArrayList<>();
        Token prev = start;
        Token token = succ.apply(start);
        while (prev != limit && token != null) {
            if (token instanceof BlockComment comment) {
                if (comment.isClaimed()) {
                    break;
                }
                if (isWanted(comment)) {
                    if (wanted != null) {
                        wanted.remove(comment);
                    }
                    result.add(comment);
                }
            } else if (!isSpacing(token)) {
                break;
            }
            prev = token;
            token = succ.apply(token);
        }
        return result;
    }

    private static boolean isSpacing(Token token) {
        return token instanceof Newline || token instanceof Whitespace || token.getRawText().isEmpty();
    }

    /**
     * Moves the placeholders of {@code [first, last]} to the front ({@code toFront}) or back of
     * the range, keeping the other tokens in order.
     */
    private static void shiftPlaceholders(TokenStore store, Token first, Token last, boolean toFront) {
        List<Token> placeholders = new ArrayList<>();
        List<Token> others = new ArrayList<>();
        for (Token token : store.range(first, last)) {
            if (token instanceof Placeholder) {
                placeholders.add(token);
            } else {
                others.add(token);
            }
        }
        if (placeholders.isEmpty()) {
            return;
        }
        List<Token> reordered = new ArrayList<>();
        if (toFront) {
            reordered.addAll(placeholders);
            reordered.addAll(others);
        } else {
            reordered.addAll(others);
            reordered.addAll(placeholders);
        }
        store.splice(reordered, first, last);
    }
}
