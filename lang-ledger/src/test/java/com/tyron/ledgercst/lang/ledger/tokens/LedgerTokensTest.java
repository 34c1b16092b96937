package com.tyron.ledgercst.lang.ledger.tokens;

import com.tyron.ledgercst.api.parse.ParseException;
import com.tyron.ledgercst.lang.ledger.LedgerTestCase;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

public class LedgerTokensTest extends LedgerTestCase {

    @Test
    public void escapedStringUnescapes() {
        EscapedString token = parser.parseToken("\"say \\\"hi\\\"\\n\\\\\"", EscapedString.class);
        assertEquals("say \"hi\"\n\\", token.getValue());
    }

    @Test
    public void escapedStringEscapesOnWrite() {
        EscapedString token = EscapedString.fromValue("a \"b\"\tc\\");
        assertEquals("\"a \\\"b\\\"\\tc\\\\\"", token.getRawText());
        token.setValue("plain");
        assertEquals("\"plain\"", token.getRawText());
    }

    @Test
    public void decimalWithThousandsSeparators() {
        Decimal token = parser.parseToken("1,000.50", Decimal.class);
        assertEquals(0, new BigDecimal("1000.50").compareTo(token.getValue()));
        token.setValue(new BigDecimal("-2.5"));
        assertEquals("-2.5", token.getRawText());
    }

    @Test
    public void dateAcceptsSlashes() {
        Date token = parser.parseToken("2021/02/03", Date.class);
        assertEquals(LocalDate.of(2021, 2, 3), token.getValue());
        token.setValue(LocalDate.of(2021, 2, 4));
        assertEquals("2021-02-04", token.getRawText());
        assertThrows(IllegalArgumentException.class, () -> new Date("2021-13-01"));
    }

    @Test
    public void inlineCommentValue() {
        InlineComment token = new InlineComment(";   spaced out");
        assertEquals("spaced out", token.getValue());
        token.setValue("short");
        assertEquals("; short", token.getRawText());
        assertThrows(IllegalArgumentException.class, () -> token.setValue("two\nlines"));
        assertEquals("; short", token.getRawText());
    }

    @Test
    public void metaKeyValue() {
        MetaKey key = parser.parseToken("filename:", MetaKey.class);
        assertEquals("filename", key.getValue());
        key.setValue("lineno");
        assertEquals("lineno:", key.getRawText());
        assertThrows(IllegalArgumentException.class, () -> MetaKey.fromValue("Upper"));
    }

    @Test
    public void accountAndCurrencyValidate() {
        assertEquals("Assets:US:Cash", Account.fromValue("Assets:US:Cash").getValue());
        assertThrows(IllegalArgumentException.class, () -> Account.fromValue("assets:cash"));
        assertThrows(IllegalArgumentException.class, () -> Currency.fromValue("usd"));
        Currency currency = Currency.fromValue("USD");
        assertThrows(IllegalArgumentException.class, () -> currency.setValue("U S"));
        assertEquals("USD", currency.getRawText());
    }

    @Test
    public void labelsDefaultToKeywords() {
        assertEquals("open", OpenLabel.fromDefault().getRawText());
        assertEquals("close", CloseLabel.fromDefault().getRawText());
        assertEquals("commodity", CommodityLabel.fromDefault().getRawText());
        assertEquals(",", Comma.fromDefault().getRawText());
        assertEquals("    ", Indent.fromDefault().getRawText());
    }

    @Test
    public void parseTokenRejectsOtherInput() {
        assertThrows(ParseException.class, () -> parser.parseToken("USD GBP", Currency.class));
        assertThrows(ParseException.class, () -> parser.parseToken("Assets:Cash", Currency.class));
        assertThrows(ParseException.class, () -> parser.parseToken("", Currency.class));
    }
}
