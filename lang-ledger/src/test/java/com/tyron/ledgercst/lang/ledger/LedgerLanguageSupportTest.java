package com.tyron.ledgercst.lang.ledger;

import com.tyron.ledgercst.lang.ledger.nodes.Close;
import com.tyron.ledgercst.lang.ledger.nodes.File;
import com.tyron.ledgercst.lang.ledger.nodes.MetaItem;
import com.tyron.ledgercst.lang.ledger.parser.LedgerGrammarParser;
import com.tyron.ledgercst.lang.ledger.tokens.Currency;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class LedgerLanguageSupportTest {

    private final LedgerLanguageSupport language = LedgerLanguageSupport.getInstance();

    @ParameterizedTest
    @ValueSource(strings = {"main.bean", "books/2020.beancount", "personal.ledger"})
    public void handlesLedgerFiles(String fileName) {
        assertTrue(language.canHandle(fileName));
    }

    @ParameterizedTest
    @ValueSource(strings = {"notes.txt", "bean", "Main.java"})
    public void ignoresOtherFiles(String fileName) {
        assertFalse(language.canHandle(fileName));
    }

    @Test
    public void registryMapsRulesAndTokens() {
        assertSame(language, LedgerLanguageSupport.getInstance());
        assertEquals("ledger", language.getName());
        assertEquals(LedgerGrammarParser.FILE, language.getNodeRegistry().nodeType(File.class).rule());
        assertEquals(LedgerGrammarParser.CLOSE, language.getNodeRegistry().nodeType(Close.class).rule());
        assertEquals(LedgerGrammarParser.META_ITEM, language.getNodeRegistry().nodeType(MetaItem.class).rule());
        assertEquals(Currency.TYPE, language.getNodeRegistry().tokenType(Currency.class));
        assertInstanceOf(LedgerGrammarParser.class, language.createTokenizerParser());
    }
}
