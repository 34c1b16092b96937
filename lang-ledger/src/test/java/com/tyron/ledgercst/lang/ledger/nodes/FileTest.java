package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.api.parse.ParseException;
import com.tyron.ledgercst.core.comments.BlockComment;
import com.tyron.ledgercst.core.model.CstNode;
import com.tyron.ledgercst.lang.ledger.LedgerTestCase;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FileTest extends LedgerTestCase {

    private static final String LEDGER = "; Ledger\n"
            + "\n"
            + "2020-01-01 commodity USD\n"
            + "  name: \"US Dollar\"\n"
            + "\n"
            + "; cash\n"
            + "2020-01-02 open Assets:Cash USD\n"
            + "\n"
            + "2021-01-01 close Assets:Cash ; done\n";

    @Test
    public void roundTrip() {
        File file = parseRoundTrip(LEDGER, File.class);
        List<Directive> directives = file.getDirectives().items();

        assertEquals(3, directives.size());
        assertInstanceOf(Commodity.class, directives.get(0));
        assertInstanceOf(Open.class, directives.get(1));
        assertInstanceOf(Close.class, directives.get(2));
        assertEquals(LocalDate.of(2020, 1, 2), directives.get(1).getDate());
        assertEquals("done", directives.get(2).getInlineComment());
    }

    @Test
    public void roundTripKeepsOddSpacing() {
        String text = "\n\n2020-01-01  open\tAssets:Cash   USD ,GBP\r\n\t a:   1 ;x\n\n\n  \n2020-01-02 close Assets:Cash";
        parseRoundTrip(text, File.class);
    }

    @Test
    public void emptyFile() {
        File file = parseRoundTrip("", File.class);
        assertTrue(file.getDirectives().isEmpty());

        File commentsOnly = parseRoundTrip("; nothing\n\n; at all\n", File.class);
        commentsOnly.autoClaimComments();
        assertTrue(commentsOnly.getDirectives().isEmpty());
        assertEquals(2, commentsOnly.getRawDirectives().size());
        assertPrints("; nothing\n\n; at all\n", commentsOnly);
    }

    @Test
    public void autoClaimComments() {
        File file = parse(LEDGER, File.class);
        file.autoClaimComments();

        List<Directive> directives = file.getDirectives().items();
        assertEquals("cash", directives.get(1).getLeadingComment());
        assertNull(directives.get(0).getLeadingComment());
        assertNull(directives.get(0).getTrailingComment());

        CstNode first = file.getRawDirectives().get(0);
        assertInstanceOf(BlockComment.class, first);
        assertEquals("Ledger", ((BlockComment) first).getValue());
        assertEquals(4, file.getRawDirectives().size());
        assertEquals(3, file.getDirectives().size());
        assertPrints(LEDGER, file);
    }

    @Test
    public void appendDirective() {
        File file = parse(LEDGER, File.class);
        file.getDirectives().append(Close.fromValue(LocalDate.of(2022, 1, 1), "Assets:Bank"));
        assertPrints(LEDGER.substring(0, LEDGER.length() - 1) + "\n\n2022-01-01 close Assets:Bank\n", file);
        assertEquals(4, file.getDirectives().size());
    }

    @Test
    public void insertDirectiveInFront() {
        File file = parse(LEDGER, File.class);
        file.getDirectives().insert(0, Commodity.fromValue(LocalDate.of(2019, 1, 1), "EUR"));
        assertPrints("; Ledger\n\n2019-01-01 commodity EUR\n\n" + LEDGER.substring("; Ledger\n\n".length()), file);
    }

    @Test
    public void deleteDirective() {
        File file = parse(LEDGER, File.class);
        file.getDirectives().delete(1);
        assertPrints("; Ledger\n"
                + "\n"
                + "2020-01-01 commodity USD\n"
                + "  name: \"US Dollar\"\n"
                + "\n"
                + "2021-01-01 close Assets:Cash ; done\n", file);
    }

    @Test
    public void deleteDirectiveKeepsClaimedLeadingComment() {
        File file = parse(LEDGER, File.class);
        file.autoClaimComments();
        Directive open = file.getDirectives().pop(1);

        assertEquals("; cash\n2020-01-02 open Assets:Cash USD", print(open));
        assertEquals("cash", open.getLeadingComment());
        assertFalse(file.getTokenStore().getText().contains("cash USD"));
    }

    @Test
    public void buildFromChildren() {
        File file = File.fromChildren(List.of(
                Open.fromValue(LocalDate.of(2020, 1, 1), "Assets:Cash", List.of("USD"), null),
                Close.fromValue(LocalDate.of(2020, 12, 31), "Assets:Cash")));
        assertPrints("2020-01-01 open Assets:Cash USD\n\n2020-12-31 close Assets:Cash", file);

        File empty = File.fromChildren(List.of());
        assertPrints("", empty);
        empty.getDirectives().append(Commodity.fromValue(LocalDate.of(2020, 1, 1), "USD"));
        assertPrints("2020-01-01 commodity USD", empty);
    }

    @Test
    public void deepCopy() {
        File file = parse(LEDGER, File.class);
        file.autoClaimComments();
        File copy = checkDeepCopy(file);
        assertTrue(((BlockComment) copy.getRawDirectives().get(0)).isClaimed());
        assertTrue(copy.getDirectives().get(1).getRawLeadingComment().isClaimed());

        copy.getDirectives().get(0).setDate(LocalDate.of(1999, 1, 1));
        copy.getDirectives().get(1).setLeadingComment("cash account");
        assertPrints(LEDGER, file);
        assertTrue(print(copy).startsWith("; Ledger\n\n1999-01-01 commodity USD"));
        assertTrue(print(copy).contains("; cash account\n2020-01-02 open"));
    }

    @Test
    public void moveDirectiveBetweenFiles() {
        File source = parse(LEDGER, File.class);
        File target = parse("2023-01-01 commodity EUR\n", File.class);

        Directive moved = source.getDirectives().pop(0);
        target.getDirectives().append(moved);
        assertPrints("2023-01-01 commodity EUR\n\n2020-01-01 commodity USD\n  name: \"US Dollar\"\n", target);
        assertSame(target.getTokenStore(), moved.getTokenStore());
    }

    @Test
    public void syntaxErrors() {
        assertThrows(ParseException.class, () -> parse("2020-01-01 open\n", File.class));
        assertThrows(ParseException.class, () -> parse("2020-01-01 balance Assets:Cash\n", File.class));
        assertThrows(ParseException.class, () -> parse("open Assets:Cash\n", File.class));
    }
}
