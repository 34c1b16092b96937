package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.core.comments.BlockComment;
import com.tyron.ledgercst.core.comments.CommentClaimException;
import com.tyron.ledgercst.lang.ledger.LedgerTestCase;
import com.tyron.ledgercst.lang.ledger.tokens.Account;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

public class CloseTest extends LedgerTestCase {

    @Test
    public void readsFields() {
        Close close = parseRoundTrip("2020/06/30 close Assets:Cash ; empty now", Close.class);
        assertEquals(LocalDate.of(2020, 6, 30), close.getDate());
        assertEquals("Assets:Cash", close.getAccount());
        assertEquals("empty now", close.getInlineComment());
    }

    @Test
    public void rawAccountReplacement() {
        Close close = parse("2020-06-30 close Assets:Cash", Close.class);
        Account old = close.getRawAccount();
        close.setRawAccount(new Account("Assets:Bank"));
        assertPrints("2020-06-30 close Assets:Bank", close);
        assertNull(old.getTokenStore());
    }

    @Test
    public void claimTrailingComment() {
        String text = "2020-01-01 close Assets:Foo\n; note";
        Close close = parse(text, Close.class);
        assertEquals("2020-01-01 close Assets:Foo", print(close));

        BlockComment comment = close.claimTrailingComment();
        assertNotNull(comment);
        assertTrue(comment.isClaimed());
        assertEquals("note", close.getTrailingComment());
        assertEquals(text, print(close));
        assertEquals(text, close.getTokenStore().getText());

        assertSame(comment, close.unclaimTrailingComment());
        assertFalse(comment.isClaimed());
        assertNull(close.getTrailingComment());
        assertEquals("2020-01-01 close Assets:Foo", print(close));
        assertEquals(text, close.getTokenStore().getText());
    }

    @Test
    public void claimTrailingCommentAfterInlineComment() {
        Close close = parse("2000-01-01 close Assets:Foo ; trailing\n; note", Close.class);
        BlockComment comment = close.claimTrailingComment();

        assertTrue(comment.isClaimed());
        assertEquals("trailing", close.getInlineComment());
        assertPrints("2000-01-01 close Assets:Foo ; trailing\n; note", close);
        assertSame(comment, close.claimTrailingComment());
        assertPrints("2000-01-01 close Assets:Foo ; trailing\n; note", close);
    }

    @Test
    public void claimLeadingComment() {
        String text = "; closing\n; for good\n2020-01-01 close Assets:Foo";
        Close close = parse(text, Close.class);
        assertNotNull(close.claimLeadingComment());
        assertEquals("closing\nfor good", close.getLeadingComment());
        assertPrints(text, close);
    }

    @Test
    public void commentAfterBlankLineIsNotClaimed() {
        Close close = parse("2020-01-01 close Assets:Foo\n\n; elsewhere", Close.class);
        CommentClaimException e = assertThrows(CommentClaimException.class, close::claimTrailingComment);
        assertEquals("Comment not found in the same context.", e.getMessage());
        assertNull(close.claimTrailingComment(null, true));
        close.autoClaimComments();
        assertNull(close.getTrailingComment());
    }

    @Test
    public void setCommentsFromValues() {
        Close close = parse("2020-01-01 close Assets:Foo", Close.class);
        close.setLeadingComment("above");
        close.setTrailingComment("below\ntwice");
        assertPrints("; above\n2020-01-01 close Assets:Foo\n; below\n; twice", close);
        close.setTrailingComment("once");
        assertPrints("; above\n2020-01-01 close Assets:Foo\n; once", close);
        close.setLeadingComment(null);
        close.setTrailingComment(null);
        assertPrints("2020-01-01 close Assets:Foo", close);
    }

    @Test
    public void trailingCommentGoesBelowMeta() {
        Close close = parse("2020-01-01 close Assets:Foo\n  reason: \"moved\"", Close.class);
        close.setTrailingComment("done");
        assertPrints("2020-01-01 close Assets:Foo\n  reason: \"moved\"\n; done", close);
        close.setInlineComment("x");
        assertPrints("2020-01-01 close Assets:Foo ; x\n  reason: \"moved\"\n; done", close);
    }

    @Test
    public void fromValue() {
        Close close = Close.fromValue(LocalDate.of(2022, 3, 4), "Assets:Cash");
        assertPrints("2022-03-04 close Assets:Cash", close);
        checkDeepCopy(close);
    }
}
