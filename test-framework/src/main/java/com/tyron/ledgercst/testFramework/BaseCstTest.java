package com.tyron.ledgercst.testFramework;

import com.tyron.ledgercst.core.config.CstSettings;
import com.tyron.ledgercst.core.language.LanguageSupport;
import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.core.model.TreeNode;
import com.tyron.ledgercst.core.parser.CstParser;
import com.tyron.ledgercst.core.print.CstPrinter;
import com.tyron.ledgercst.core.store.Token;
import com.tyron.ledgercst.core.store.TokenStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Base class for language tests.
 * <p>
 * - Configures test logging and resets {@link CstSettings} around every test.
 * - Creates a {@link CstParser} for the language under test.
 * - Provides print and structural assertions shared by all node tests.
 */
public abstract class BaseCstTest {

    protected CstParser parser;

    @BeforeEach
    public final void baseSetUp() {
        TestLogging.configureOnce();
        CstSettings.reset();
        parser = CstParser.forLanguage(getLanguage());
        beforeEach();
    }

    @AfterEach
    public final void baseTearDown() {
        try {
            afterEach();
        } finally {
            CstSettings.reset();
        }
    }

    protected abstract LanguageSupport getLanguage();

    protected void beforeEach() {
    }

    protected void afterEach() {
    }

    protected <N extends TreeNode> N parse(String text, Class<N> type) {
        N node = parser.parse(text, type);
        assertStoreConsistent(node.getTokenStore());
        return node;
    }

    /**
     * Parses {@code text} and checks that printing gives it back unchanged.
     */
    protected <N extends TreeNode> N parseRoundTrip(String text, Class<N> type) {
        N node = parse(text, type);
        assertEquals(text, print(node));
        return node;
    }

    protected static String print(CstNode node) {
        return CstPrinter.print(node);
    }

    protected static void assertPrints(String expected, CstNode node) {
        assertEquals(expected, print(node));
        TokenStore store = node.getTokenStore();
        if (store != null) {
            assertStoreConsistent(store);
        }
    }

    /**
     * Deep copies {@code node} and checks that the copy is equal, prints the same and shares
     * no token with the original.
     */
    @SuppressWarnings("unchecked")
    protected static <N extends CstNode> N checkDeepCopy(N node) {
        N copy = (N) node.deepCopy();
        assertNotSame(node, copy);
        assertEquals(node, copy);
        assertEquals(print(node), print(copy));
        assertDisjoint(node, copy);
        TokenStore store = copy.getTokenStore();
        if (store != null) {
            assertStoreConsistent(store);
        }
        return copy;
    }

    /**
     * Moves a node that owns its whole store into a fresh store and checks that it follows.
     */
    protected static void checkReattach(TreeNode node) {
        String before = print(node);
        List<Token> tokens = node.detach();
        TokenStore store = TokenStore.fromTokens(tokens);
        assertSame(node, node.reattach(store));
        assertSame(store, node.getTokenStore());
        assertEquals(before, print(node));
        assertStoreConsistent(store);
    }

    protected static void assertDisjoint(CstNode a, CstNode b) {
        Set<Token> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        seen.addAll(a.getTokens());
        for (Token token : b.getTokens()) {
            assertFalse(seen.contains(token), () -> "token shared between nodes: " + token);
        }
    }

    /**
     * Every token knows its store, index and position, and positions add up to the text.
     */
    protected static void assertStoreConsistent(TokenStore store) {
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < store.size(); i++) {
            Token token = store.get(i);
            assertSame(store, token.getTokenStore());
            assertEquals(i, token.getIndex());
            assertEquals(text.length(), token.getPosition().offset());
            text.append(token.getRawText());
        }
        assertEquals(text.toString(), store.getText());
    }

    protected static void assertIterableSame(List<?> expected, List<?> actual) {
        assertEquals(expected.size(), actual.size(), "size");
        for (int i = 0; i < expected.size(); i++) {
            assertSame(expected.get(i), actual.get(i), "element " + i);
        }
    }
}
