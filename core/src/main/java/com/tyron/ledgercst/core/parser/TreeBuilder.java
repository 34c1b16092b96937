package com.tyron.ledgercst.core.parser;

import com.tyron.ledgercst.api.parse.ParseNode;
import com.tyron.ledgercst.api.parse.ParseResult;
import com.tyron.ledgercst.core.fields.Cardinality;
import com.tyron.ledgercst.core.fields.FieldDescriptor;
import com.tyron.ledgercst.core.fields.Floating;
import com.tyron.ledgercst.core.fields.NodeLayout;
import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.Indentable;
import com.tyron.ledgercst.core.model.MaybeLeft;
import com.tyron.ledgercst.core.model.MaybeRight;
import com.tyron.ledgercst.core.model.Placeholder;
import com.tyron.ledgercst.core.model.Repeated;
import com.tyron.ledgercst.core.model.TokenNode;
import com.tyron.ledgercst.core.model.TreeNode;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Builds a tree of nodes over one {@link TokenStore} from a {@link ParseResult}.
 * <p>
 * Every lexed terminal ends up in the store in source order, including the ones the parse
 * tree leaves out (whitespace, comments, punctuation). Each optional or repeated position
 * gets a placeholder: left-floating ones are emitted right away, right-floating ones are
 * held back and emitted just before the next real token, after any ignored tokens.
 */
public final class TreeBuilder {

    private static final Logger LOG = Logger.getLogger(TreeBuilder.class.getName());

    private final NodeRegistry registry;
    private final List<ParseNode.Terminal> terminals;
    private final List<Token> built = new ArrayList<>();
    private final TokenStore store = TokenStore.create();
    private int cursor;
    private @Nullable Placeholder pendingRight;
    private int placeholders;

    private TreeBuilder(@NotNull NodeRegistry registry, @NotNull List<ParseNode.Terminal> terminals) {
        this.registry = registry;
        this.terminals = terminals;
    }

    /**
     * @throws GrammarInconsistencyException if the tree does not match the registered layouts
     */
    public static <N extends TreeNode> @NotNull N build(@NotNull ParseResult result, @NotNull NodeRegistry registry, @NotNull Class<N> type) {
        Objects.requireNonNull(result, "result");
        TreeBuilder builder = new TreeBuilder(Objects.requireNonNull(registry, "registry"), result.tokens());
        TreeNode root = builder.addRule(result.tree());
        builder.flushGap(builder.terminals.size());
        builder.store.insertAfter(null, builder.built);
        if (!type.isInstance(root)) {
            throw new GrammarInconsistencyException("expected " + type.getSimpleName() + " but built " + root.getClass().getSimpleName());
        }
        LOG.fine("treeBuilder rule=" + result.tree().rule() + " tokens=" + builder.store.size() + " placeholders=" + builder.placeholders);
        return type.cast(root);
    }

    private TreeNode addRule(ParseNode.Rule rule) {
        NodeType<?> nodeType = registry.nodeType(rule.rule());
        NodeLayout layout = nodeType.layout();
        List<ParseNode> children = rule.children();
        if (children.size() != layout.fields().size()) {
            throw new GrammarInconsistencyException("rule " + rule.rule() + " has " + children.size()
                    + " children but its layout declares " + layout.fields().size() + " fields");
        }
        List<Object> built = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            FieldDescriptor field = layout.fields().get(i);
            ParseNode child = children.get(i);
            built.add(addField(rule.rule(), field, child));
        }
        return nodeType.factory().create(store, new ParsedChildren(layout, built));
    }

    private Object addField(String rule, FieldDescriptor field, ParseNode child) {
        Cardinality cardinality = field.cardinality();
        if (cardinality == Cardinality.OPTIONAL && child instanceof ParseNode.Optional optional) {
            return addOptional(optional, Objects.requireNonNull(field.floating()));
        }
        if (cardinality == Cardinality.REPEATED && child instanceof ParseNode.Repetition repetition) {
            return addRepeated(repetition, field);
        }
        if (cardinality == Cardinality.REQUIRED && (child instanceof ParseNode.Terminal || child instanceof ParseNode.Rule)) {
            return addRequired(child);
        }
        throw new GrammarInconsistencyException("rule " + rule + " field " + field.name() + " is "
                + cardinality + " but the parse tree has " + child.getClass().getSimpleName());
    }

    private CstNode addRequired(ParseNode node) {
        if (node instanceof ParseNode.Terminal terminal) {
            return addTerminal(terminal);
        }
        if (node instanceof ParseNode.Rule rule) {
            return addRule(rule);
        }
        throw new GrammarInconsistencyException("expected a terminal or rule but got " + node.getClass().getSimpleName());
    }

    private CstNode addOptional(ParseNode.Optional optional, Floating floating) {
        ParseNode innerNode = optional.inner();
        if (floating == Floating.LEFT) {
            Placeholder placeholder = addLeftPlaceholder();
            CstNode inner = innerNode != null ? addRequired(innerNode) : null;
            return new MaybeLeft<>(store, inner, placeholder);
        }
        CstNode inner = innerNode != null ? addRequired(innerNode) : null;
        Placeholder placeholder = addRightPlaceholder();
        return new MaybeRight<>(store, inner, placeholder);
    }

    private CstNode addRepeated(ParseNode.Repetition repetition, FieldDescriptor field) {
        Placeholder placeholder = addLeftPlaceholder();
        List<CstNode> items = new ArrayList<>(repetition.items().size());
        for (ParseNode item : repetition.items()) {
            items.add(addRequired(item));
        }
        String indent = null;
        if (field.defaultIndent() != null) {
            if (!items.isEmpty() && items.get(0) instanceof Indentable indentable && indentable.getIndent() != null) {
                indent = indentable.getIndent();
            } else {
                indent = field.getDefaultIndent();
            }
        }
        return new Repeated<>(store, items, placeholder, indent);
    }

    private TokenNode addTerminal(ParseNode.Terminal terminal) {
        int index = terminal.index();
        if (index < cursor || index >= terminals.size() || !terminals.get(index).equals(terminal)) {
            throw new GrammarInconsistencyException("terminal out of order: " + terminal);
        }
        flushGap(index);
        TokenNode token = registry.createToken(terminal.type(), terminal.rawText());
        built.add(token);
        cursor++;
        return token;
    }

    private void flushGap(int upTo) {
        for (int i = cursor; i < upTo; i++) {
            ParseNode.Terminal ignored = terminals.get(i);
            built.add(registry.createToken(ignored.type(), ignored.rawText()));
        }
        cursor = Math.max(cursor, upTo);
        if (pendingRight != null) {
            built.add(pendingRight);
            pendingRight = null;
        }
    }

    private Placeholder addLeftPlaceholder() {
        if (pendingRight != null) {
            throw new GrammarInconsistencyException("Floating direction cannot be satisfied.");
        }
        Placeholder placeholder = new Placeholder();
        built.add(placeholder);
        placeholders++;
        return placeholder;
    }

    private Placeholder addRightPlaceholder() {
        if (pendingRight != null) {
            throw new GrammarInconsistencyException("Floating direction cannot be satisfied.");
        }
        Placeholder placeholder = new Placeholder();
        pendingRight = placeholder;
        placeholders++;
        return placeholder;
    }
}
