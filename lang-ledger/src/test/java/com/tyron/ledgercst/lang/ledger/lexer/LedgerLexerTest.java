package com.tyron.ledgercst.lang.ledger.lexer;

import com.tyron.ledgercst.api.parse.ParseException;
import com.tyron.ledgercst.api.parse.ParseNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LedgerLexerTest {

    private static List<String> types(String text) {
        return LedgerLexer.tokenize(text).stream().map(ParseNode.Terminal::type).toList();
    }

    private static String join(List<ParseNode.Terminal> tokens) {
        StringBuilder sb = new StringBuilder();
        for (ParseNode.Terminal token : tokens) {
            sb.append(token.rawText());
        }
        return sb.toString();
    }

    @Test
    public void openLine() {
        assertEquals(List.of("DATE", "WHITESPACE", "OPEN", "WHITESPACE", "ACCOUNT", "WHITESPACE",
                        "CURRENCY", "COMMA", "WHITESPACE", "CURRENCY", "WHITESPACE", "ESCAPED_STRING",
                        "WHITESPACE", "INLINE_COMMENT"),
                types("2020-01-01 open Assets:Cash USD, GBP \"FIFO\" ; note"));
    }

    @Test
    public void metadataLines() {
        assertEquals(List.of("DATE", "WHITESPACE", "CLOSE", "WHITESPACE", "ACCOUNT", "NEWLINE",
                        "INDENT", "META_KEY", "WHITESPACE", "NUMBER", "NEWLINE",
                        "INDENT", "META_KEY", "WHITESPACE", "DATE"),
                types("2020-01-01 close Assets:Cash\n  a: 1,000.50\n  b: 2021/02/03"));
    }

    @Test
    public void commentLinesWithTheSameIndentMerge() {
        List<ParseNode.Terminal> tokens = LedgerLexer.tokenize("; one\n; two\n  ; three\n\n; four");
        assertEquals(List.of("BLOCK_COMMENT", "NEWLINE", "BLOCK_COMMENT", "NEWLINE", "NEWLINE", "BLOCK_COMMENT"),
                tokens.stream().map(ParseNode.Terminal::type).toList());
        assertEquals("; one\n; two", tokens.get(0).rawText());
        assertEquals("  ; three", tokens.get(2).rawText());
        assertEquals(2, tokens.get(2).line());
        assertEquals(4, tokens.get(5).line());
    }

    @Test
    public void blankLinesWithSpacesAreWhitespace() {
        assertEquals(List.of("NEWLINE", "WHITESPACE", "NEWLINE"), types("\n  \n"));
        assertEquals(List.of("WHITESPACE"), types("   "));
    }

    @Test
    public void tokensConcatenateToTheInput() {
        String text = "; header\n\n2020-01-01 open Assets:Cash\r\n  note: \"a \\\"b\\\"\"\n";
        assertEquals(text, join(LedgerLexer.tokenize(text)));
    }

    @Test
    public void indicesAndColumns() {
        List<ParseNode.Terminal> tokens = LedgerLexer.tokenize("2020-01-01 close Assets:Cash");
        for (int i = 0; i < tokens.size(); i++) {
            assertEquals(i, tokens.get(i).index());
        }
        assertEquals(17, tokens.get(4).column());
    }

    @Test
    public void unexpectedCharacterReportsPosition() {
        ParseException e = assertThrows(ParseException.class, () -> LedgerLexer.tokenize("2020-01-01 close\n  @"));
        assertEquals(1, e.getLine());
        assertEquals(2, e.getColumn());
    }

    @Test
    public void unterminatedString() {
        assertThrows(ParseException.class, () -> LedgerLexer.tokenize("\"open"));
    }
}
