package com.tyron.ledgercst.core.parser;

import com.tyron.ledgercst.core.fields.NodeLayout;
import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.Maybe;
import com.tyron.ledgercst.core.model.MaybeLeft;
import com.tyron.ledgercst.core.model.MaybeRight;
import com.tyron.ledgercst.core.model.Repeated;
import org.jetbrains.annotations.NotNull;

import java.util.List;

/**
 * Children built for one grammar rule, addressed by field name.
 */
public final class ParsedChildren {

    private final NodeLayout layout;
    private final List<Object> children;

    ParsedChildren(@NotNull NodeLayout layout, @NotNull List<Object> children) {
        this.layout = layout;
        this.children = List.copyOf(children);
    }

    public <T extends CstNode> @NotNull T required(@NotNull String name, @NotNull Class<T> type) {
        Object child = children.get(layout.indexOf(name));
        if (!type.isInstance(child)) {
            throw mismatch(name, type, child);
        }
        return type.cast(child);
    }

    @SuppressWarnings("unchecked")
    public <T extends CstNode> @NotNull MaybeLeft<T> left(@NotNull String name, @NotNull Class<T> type) {
        Object child = children.get(layout.indexOf(name));
        if (!(child instanceof MaybeLeft<?> maybe) || !innerMatches(maybe, type)) {
            throw mismatch(name, type, child);
        }
        return (MaybeLeft<T>) maybe;
    }

    @SuppressWarnings("unchecked")
    public <T extends CstNode> @NotNull MaybeRight<T> right(@NotNull String name, @NotNull Class<T> type) {
        Object child = children.get(layout.indexOf(name));
        if (!(child instanceof MaybeRight<?> maybe) || !innerMatches(maybe, type)) {
            throw mismatch(name, type, child);
        }
        return (MaybeRight<T>) maybe;
    }

    @SuppressWarnings("unchecked")
    public <T extends CstNode> @NotNull Repeated<T> repeated(@NotNull String name, @NotNull Class<T> type) {
        Object child = children.get(layout.indexOf(name));
        if (!(child instanceof Repeated<?> repeated)) {
            throw mismatch(name, type, child);
        }
        for (CstNode item : repeated.getItems()) {
            if (!type.isInstance(item)) {
                throw mismatch(name, type, item);
            }
        }
        return (Repeated<T>) repeated;
    }

    private static boolean innerMatches(Maybe<?> maybe, Class<?> type) {
        return maybe.getInner() == null || type.isInstance(maybe.getInner());
    }

    private GrammarInconsistencyException mismatch(String name, Class<?> expected, Object actual) {
        return new GrammarInconsistencyException("rule " + layout.rule() + " field " + name
                + " expected " + expected.getSimpleName() + " but got " + actual);
    }
}
