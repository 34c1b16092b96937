package com.tyron.ledgercst.core.parser;

import com.tyron.ledgercst.api.parse.ParseNode;
import com.tyron.ledgercst.api.parse.ParseResult;
import com.tyron.ledgercst.core.Word;
import com.tyron.ledgercst.core.fields.FieldDescriptor;
import com.tyron.ledgercst.core.fields.Floating;
import com.tyron.ledgercst.core.fields.NodeLayout;
import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.MaybeLeft;
import com.tyron.ledgercst.core.model.MaybeRight;
import com.tyron.ledgercst.core.model.Placeholder;
import com.tyron.ledgercst.core.model.Repeated;
import com.tyron.ledgercst.core.model.TokenTransformer;
import com.tyron.ledgercst.core.model.TreeNode;
import com.tyron.ledgercst.core.print.CstPrinter;
import com.tyron.ledgercst.core.spacing.Whitespace;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.jetbrains.annotations.NotNull;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TreeBuilderTest {

    private static final FieldDescriptor FIRST = FieldDescriptor.required("first");
    private static final FieldDescriptor SECOND = FieldDescriptor.optional("second", Floating.LEFT, Whitespace::fromDefault);
    private static final FieldDescriptor REST = FieldDescriptor.repeated("rest", Whitespace::fromDefault);
    private static final FieldDescriptor LEAD = FieldDescriptor.optional("lead", Floating.RIGHT, Whitespace::fromDefault);

    private static final NodeLayout PAIR = NodeLayout.of("pair", FIRST, SECOND, REST);
    private static final NodeLayout TAIL = NodeLayout.of("tail", LEAD, FIRST);
    private static final NodeLayout CONFLICT = NodeLayout.of("conflict", LEAD, SECOND, FIRST);

    private static final NodeRegistry REGISTRY = NodeRegistry.builder()
            .token(Word.TYPE, Word.class, Word::new)
            .token(Whitespace.TYPE, Whitespace.class, Whitespace::new)
            .tree(new NodeType<>(Seq.class, PAIR, (store, c) -> new Seq(store, List.of(
                    c.required("first", Word.class), c.left("second", Word.class), c.repeated("rest", Word.class)))))
            .tree(new NodeType<>(Seq.class, TAIL, (store, c) -> new Seq(store, List.of(
                    c.right("lead", Word.class), c.required("first", Word.class)))))
            .tree(new NodeType<>(Seq.class, CONFLICT, (store, c) -> new Seq(store, List.of(
                    c.right("lead", Word.class), c.left("second", Word.class), c.required("first", Word.class)))))
            .build();

    /**
     * Node made of arbitrary children, in order.
     */
    static final class Seq extends TreeNode {

        private List<CstNode> children;

        Seq(TokenStore store, List<CstNode> children) {
            super(store);
            this.children = new ArrayList<>(children);
        }

        @Override
        public @NotNull Token getFirstToken() {
            return children.get(0).getFirstToken();
        }

        @Override
        public @NotNull Token getLastToken() {
            return children.get(children.size() - 1).getLastToken();
        }

        @Override
        protected @NotNull TreeNode cloneNode(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
            List<CstNode> cloned = new ArrayList<>();
            for (CstNode child : children) {
                cloned.add(cloneChild(child, store, transformer));
            }
            return new Seq(store, cloned);
        }

        @Override
        protected void reattachChildren(@NotNull TokenStore store, @NotNull TokenTransformer transformer) {
            List<CstNode> reattached = new ArrayList<>();
            for (CstNode child : children) {
                reattached.add(reattachChild(child, store, transformer));
            }
            children = reattached;
        }

        @Override
        protected @NotNull List<?> getChildren() {
            return children;
        }
    }

    private static ParseNode.Terminal word(String text, int index, int column) {
        return new ParseNode.Terminal(Word.TYPE, text, index, 0, column);
    }

    private static ParseNode.Terminal space(int index, int column) {
        return new ParseNode.Terminal(Whitespace.TYPE, " ", index, 0, column);
    }

    @Test
    public void leftPlaceholdersAreEmittedImmediately() {
        ParseNode.Terminal a = word("a", 0, 0);
        ParseNode.Terminal b = word("b", 2, 2);
        ParseResult result = new ParseResult(List.of(a, space(1, 1), b),
                new ParseNode.Rule("pair", List.of(a, new ParseNode.Optional(b), new ParseNode.Repetition(List.of()))));

        Seq seq = TreeBuilder.build(result, REGISTRY, Seq.class);
        TokenStore store = seq.getTokenStore();

        assertEquals("a b", CstPrinter.print(seq));
        assertEquals(5, store.size());
        assertInstanceOf(Placeholder.class, store.get(1));
        assertInstanceOf(Whitespace.class, store.get(2));
        assertInstanceOf(Placeholder.class, store.get(4));

        MaybeLeft<?> second = (MaybeLeft<?>) seq.getChildren().get(1);
        assertSame(store.get(1), second.getPlaceholder());
        assertSame(store.get(3), second.getInner());
        Repeated<?> rest = (Repeated<?>) seq.getChildren().get(2);
        assertTrue(rest.getItems().isEmpty());
        assertNull(rest.getInferredIndent());
    }

    @Test
    public void rightPlaceholderWaitsForTheNextToken() {
        ParseNode.Terminal a = word("a", 1, 1);
        ParseResult result = new ParseResult(List.of(space(0, 0), a),
                new ParseNode.Rule("tail", List.of(ParseNode.Optional.empty(), a)));

        Seq seq = TreeBuilder.build(result, REGISTRY, Seq.class);
        TokenStore store = seq.getTokenStore();

        assertEquals(3, store.size());
        assertInstanceOf(Whitespace.class, store.get(0));
        MaybeRight<?> lead = (MaybeRight<?>) seq.getChildren().get(0);
        assertSame(store.get(1), lead.getPlaceholder());
        assertEquals(" a", store.getText());
    }

    @Test
    public void leftAfterPendingRightCannotBeSatisfied() {
        ParseNode.Terminal a = word("a", 0, 0);
        ParseResult result = new ParseResult(List.of(a),
                new ParseNode.Rule("conflict", List.of(ParseNode.Optional.empty(), ParseNode.Optional.empty(), a)));

        GrammarInconsistencyException e = assertThrows(GrammarInconsistencyException.class,
                () -> TreeBuilder.build(result, REGISTRY, Seq.class));
        assertEquals("Floating direction cannot be satisfied.", e.getMessage());
    }

    @Test
    public void childCountMustMatchLayout() {
        ParseNode.Terminal a = word("a", 0, 0);
        ParseResult result = new ParseResult(List.of(a), new ParseNode.Rule("pair", List.of(a)));

        assertThrows(GrammarInconsistencyException.class, () -> TreeBuilder.build(result, REGISTRY, Seq.class));
    }

    @Test
    public void cardinalityMustMatchLayout() {
        ParseNode.Terminal a = word("a", 0, 0);
        ParseResult result = new ParseResult(List.of(a),
                new ParseNode.Rule("pair", List.of(a, new ParseNode.Repetition(List.of()), new ParseNode.Repetition(List.of()))));

        assertThrows(GrammarInconsistencyException.class, () -> TreeBuilder.build(result, REGISTRY, Seq.class));
    }

    @Test
    public void unknownRuleIsReported() {
        ParseNode.Terminal a = word("a", 0, 0);
        ParseResult result = new ParseResult(List.of(a), new ParseNode.Rule("nope", List.of(a)));

        assertThrows(GrammarInconsistencyException.class, () -> TreeBuilder.build(result, REGISTRY, Seq.class));
    }

    @Test
    public void builtTreeSurvivesDeepCopy() {
        ParseNode.Terminal a = word("a", 0, 0);
        ParseNode.Terminal b = word("b", 2, 2);
        ParseResult result = new ParseResult(List.of(a, space(1, 1), b),
                new ParseNode.Rule("pair", List.of(a, ParseNode.Optional.empty(), new ParseNode.Repetition(List.of(b)))));

        Seq seq = TreeBuilder.build(result, REGISTRY, Seq.class);
        Seq copy = (Seq) seq.deepCopy();

        assertEquals(seq, copy);
        assertEquals("a b", CstPrinter.print(copy));
        for (Token token : copy.getTokens()) {
            assertSame(copy.getTokenStore(), token.getTokenStore());
        }
    }
}
