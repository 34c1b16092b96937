package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.lang.ledger.LedgerTestCase;
import com.tyron.ledgercst.lang.ledger.tokens.Currency;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OpenTest extends LedgerTestCase {

    @Test
    public void readsAllFields() {
        Open open = parseRoundTrip("2020-01-01 open Assets:Cash USD, GBP \"FIFO\" ; main account", Open.class);

        assertEquals(LocalDate.of(2020, 1, 1), open.getDate());
        assertEquals("open", open.getRawLabel().getRawText());
        assertEquals("Assets:Cash", open.getAccount());
        assertEquals(List.of("USD", "GBP"), open.getCurrencies().toList());
        assertEquals("FIFO", open.getBooking());
        assertEquals("main account", open.getInlineComment());
        assertTrue(open.getMeta().isEmpty());
        assertNull(open.getLeadingComment());
        assertNull(open.getTrailingComment());
    }

    @Test
    public void minimalOpen() {
        Open open = parseRoundTrip("2020-01-01 open Assets:Cash", Open.class);
        assertTrue(open.getCurrencies().isEmpty());
        assertNull(open.getBooking());
        assertNull(open.getInlineComment());
    }

    @Test
    public void insertCurrencyAfterExisting() {
        Open open = parse("2020-01-01 open Assets:Foo USD", Open.class);
        open.getCurrencies().insert(1, "GBP");
        assertPrints("2020-01-01 open Assets:Foo USD, GBP", open);
    }

    @Test
    public void insertCurrencyInFront() {
        Open open = parse("2020-01-01 open Assets:Foo USD", Open.class);
        open.getCurrencies().insert(0, "EUR");
        assertPrints("2020-01-01 open Assets:Foo EUR, USD", open);
        assertEquals(List.of("EUR", "USD"), open.getCurrencies().toList());
    }

    @Test
    public void appendCurrencyToEmptyList() {
        Open open = parse("2020-01-01 open Assets:Foo ; note", Open.class);
        open.getCurrencies().append("USD");
        assertPrints("2020-01-01 open Assets:Foo USD ; note", open);
        open.getCurrencies().append("GBP");
        assertPrints("2020-01-01 open Assets:Foo USD, GBP ; note", open);
    }

    @Test
    public void insertIntoEmptyListUsesLeadingSeparator() {
        Open open = parse("2020-01-01 open Assets:Foo", Open.class);
        open.getCurrencies().insert(0, "USD");
        open.getCurrencies().insert(1, "GBP");
        assertPrints("2020-01-01 open Assets:Foo USD, GBP", open);
        assertEquals(2, open.getRawCurrencies().size());
    }

    @Test
    public void deleteCurrencies() {
        Open open = parse("2020-01-01 open Assets:Foo USD, GBP, EUR", Open.class);
        open.getCurrencies().delete(1);
        assertPrints("2020-01-01 open Assets:Foo USD, EUR", open);
        open.getCurrencies().delete(0);
        assertPrints("2020-01-01 open Assets:Foo EUR", open);
        open.getCurrencies().clear();
        assertPrints("2020-01-01 open Assets:Foo", open);
    }

    @Test
    public void replaceCurrencyKeepsSeparators() {
        Open open = parse("2020-01-01 open Assets:Foo USD,GBP", Open.class);
        open.getCurrencies().set(1, "CHF");
        assertPrints("2020-01-01 open Assets:Foo USD,CHF", open);
        open.getRawCurrencies().set(0, new Currency("JPY"));
        assertPrints("2020-01-01 open Assets:Foo JPY,CHF", open);
    }

    @Test
    public void setBookingAndComment() {
        Open open = parse("2020-01-01 open Assets:Foo USD", Open.class);
        open.setBooking("FIFO");
        assertPrints("2020-01-01 open Assets:Foo USD \"FIFO\"", open);
        open.setInlineComment("opened");
        assertPrints("2020-01-01 open Assets:Foo USD \"FIFO\" ; opened", open);
        open.setBooking("LIFO");
        assertPrints("2020-01-01 open Assets:Foo USD \"LIFO\" ; opened", open);
        open.setBooking(null);
        assertPrints("2020-01-01 open Assets:Foo USD ; opened", open);
        open.setInlineComment(null);
        assertPrints("2020-01-01 open Assets:Foo USD", open);
    }

    @Test
    public void setRequiredFields() {
        Open open = parse("2020-01-01 open Assets:Foo", Open.class);
        open.setDate(LocalDate.of(2021, 12, 31));
        open.setAccount("Liabilities:Card");
        assertPrints("2021-12-31 open Liabilities:Card", open);
        assertThrows(IllegalArgumentException.class, () -> open.setAccount("not an account"));
        assertPrints("2021-12-31 open Liabilities:Card", open);
    }

    @Test
    public void fromValue() {
        Open open = Open.fromValue(LocalDate.of(2020, 1, 1), "Assets:Cash", List.of("USD", "EUR"), "STRICT");
        assertPrints("2020-01-01 open Assets:Cash USD, EUR \"STRICT\"", open);
        assertEquals(List.of("USD", "EUR"), open.getCurrencies().toList());
        assertEquals("STRICT", open.getBooking());

        Open bare = Open.fromValue(LocalDate.of(2020, 1, 1), "Assets:Cash");
        assertPrints("2020-01-01 open Assets:Cash", bare);
        bare.getCurrencies().append("USD");
        assertPrints("2020-01-01 open Assets:Cash USD", bare);
    }

    @Test
    public void fromValueAddsMeta() {
        Open open = Open.fromValue(LocalDate.of(2020, 1, 1), "Assets:Cash");
        open.getMeta().put("note", "x");
        assertPrints("2020-01-01 open Assets:Cash\n    note: \"x\"", open);
    }

    @Test
    public void deepCopyIsIndependent() {
        Open open = parse("2020-01-01 open Assets:Foo USD, GBP \"FIFO\" ; c\n  a: 1", Open.class);
        Open copy = checkDeepCopy(open);
        copy.getCurrencies().delete(0);
        copy.getMeta().put("a", "changed");
        assertPrints("2020-01-01 open Assets:Foo USD, GBP \"FIFO\" ; c\n  a: 1", open);
        assertPrints("2020-01-01 open Assets:Foo GBP \"FIFO\" ; c\n  a: \"changed\"", copy);
        assertNotEquals(open, copy);
    }

    @Test
    public void reattachToNewStore() {
        Open open = parse("2020-01-01 open Assets:Foo USD\n  a: 1", Open.class);
        checkReattach(open);
        open.getCurrencies().append("GBP");
        assertPrints("2020-01-01 open Assets:Foo USD, GBP\n  a: 1", open);
    }
}
