package com.tyron.ledgercst.lang.ledger.parser;

import com.tyron.ledgercst.api.parse.ParseException;
import com.tyron.ledgercst.api.parse.ParseNode;
import com.tyron.ledgercst.api.parse.ParseResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LedgerGrammarParserTest {

    private final LedgerGrammarParser parser = new LedgerGrammarParser();

    @Test
    public void openRuleChildren() {
        ParseResult result = parser.tokenizeAndParse("2020-01-01 open Assets:Cash USD, GBP", LedgerGrammarParser.OPEN);
        List<ParseNode> children = result.tree().children();

        assertEquals(9, children.size());
        assertFalse(((ParseNode.Optional) children.get(0)).isPresent());
        ParseNode.Repetition currencies = (ParseNode.Repetition) children.get(4);
        assertEquals(2, currencies.items().size());
        assertEquals("GBP", ((ParseNode.Terminal) currencies.items().get(1)).rawText());
        assertFalse(((ParseNode.Optional) children.get(5)).isPresent());
    }

    @Test
    public void treeTerminalsAreTheLexedOnes() {
        ParseResult result = parser.tokenizeAndParse("2020-01-01 close Assets:Cash", LedgerGrammarParser.CLOSE);
        ParseNode.Terminal account = (ParseNode.Terminal) result.tree().children().get(3);
        assertSame(result.tokens().get(account.index()), account);
    }

    @Test
    public void fileWithSeveralDirectives() {
        ParseResult result = parser.tokenizeAndParse(
                "; header\n2020-01-01 commodity USD\n  name: \"Dollar\"\n\n2020-01-02 open Assets:Cash\n",
                LedgerGrammarParser.FILE);
        ParseNode.Repetition directives = (ParseNode.Repetition) result.tree().children().get(0);
        assertEquals(2, directives.items().size());
        ParseNode.Rule commodity = (ParseNode.Rule) directives.items().get(0);
        assertEquals(LedgerGrammarParser.COMMODITY, commodity.rule());
        assertEquals(1, ((ParseNode.Repetition) commodity.children().get(5)).items().size());
    }

    @Test
    public void emptyFile() {
        ParseResult result = parser.tokenizeAndParse("\n; nothing here\n", LedgerGrammarParser.FILE);
        assertTrue(((ParseNode.Repetition) result.tree().children().get(0)).items().isEmpty());
    }

    @Test
    public void directiveMustFitOnOneLine() {
        assertThrows(ParseException.class,
                () -> parser.tokenizeAndParse("2020-01-01 open\nAssets:Cash", LedgerGrammarParser.OPEN));
        ParseException e = assertThrows(ParseException.class,
                () -> parser.tokenizeAndParse("2020-01-01 close Assets:A 2020-01-02 close Assets:B", LedgerGrammarParser.FILE));
        assertEquals(0, e.getLine());
        assertEquals(26, e.getColumn());
    }

    @Test
    public void metadataWithoutDirectiveIsRejected() {
        assertThrows(ParseException.class, () -> parser.tokenizeAndParse("  a: 1\n", LedgerGrammarParser.FILE));
    }

    @Test
    public void trailingInputIsRejected() {
        assertThrows(ParseException.class,
                () -> parser.tokenizeAndParse("2020-01-01 close Assets:A\n2020-01-02 close Assets:B", LedgerGrammarParser.CLOSE));
    }

    @Test
    public void endOfInputErrorPointsAtTheEnd() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.tokenizeAndParse("2020-01-01 close", LedgerGrammarParser.CLOSE));
        assertEquals(0, e.getLine());
        assertEquals(16, e.getColumn());
    }

    @Test
    public void unknownStartRule() {
        assertThrows(IllegalArgumentException.class, () -> parser.tokenizeAndParse("", "balance"));
    }
}
