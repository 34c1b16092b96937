package com.tyron.ledgercst.lang.ledger.nodes;

import com.tyron.ledgercst.core.config.CstSettings;
import com.tyron.ledgercst.lang.ledger.LedgerTestCase;
import com.tyron.ledgercst.lang.ledger.tokens.Currency;
import com.tyron.ledgercst.lang.ledger.tokens.Decimal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class MetaTest extends LedgerTestCase {

    private static final String COMMODITY = "2020-01-01 commodity USD\n"
            + "  name: \"US Dollar\"\n"
            + "  precision: 2\n"
            + "  since: 1792-04-02\n"
            + "  parent: Assets:Cash\n"
            + "  flag:";

    @Override
    protected void afterEach() {
        System.clearProperty(CstSettings.CONFIG_PROPERTY);
    }

    @Test
    public void readsTypedValues() {
        Commodity commodity = parseRoundTrip(COMMODITY, Commodity.class);
        Meta meta = commodity.getMeta();

        assertEquals(5, meta.size());
        assertEquals(List.of("name", "precision", "since", "parent", "flag"), meta.keys());
        assertEquals("US Dollar", meta.get("name"));
        assertEquals(0, BigDecimal.valueOf(2).compareTo((BigDecimal) meta.get("precision")));
        assertEquals(LocalDate.of(1792, 4, 2), meta.get("since"));
        assertEquals("Assets:Cash", meta.get("parent"));
        assertTrue(meta.containsKey("flag"));
        assertNull(meta.get("flag"));
        assertNull(meta.get("missing"));
        assertFalse(meta.containsKey("missing"));
    }

    @Test
    public void firstDuplicateKeyWins() {
        Close close = parse("2020-01-01 close Assets:Cash\n  a: 1\n  a: 2", Close.class);
        Map<String, Object> map = close.getMeta().toMap();
        assertEquals(1, map.size());
        assertEquals(0, BigDecimal.ONE.compareTo((BigDecimal) map.get("a")));
        assertEquals(2, close.getMeta().size());
    }

    @Test
    public void putUpdatesExistingLine() {
        Commodity commodity = parse(COMMODITY, Commodity.class);
        commodity.getMeta().put("precision", new BigDecimal("4"));
        commodity.getMeta().put("name", "Dollar");
        commodity.getMeta().put("flag", "on");
        assertPrints("2020-01-01 commodity USD\n"
                + "  name: \"Dollar\"\n"
                + "  precision: 4\n"
                + "  since: 1792-04-02\n"
                + "  parent: Assets:Cash\n"
                + "  flag: \"on\"", commodity);
    }

    @Test
    public void putChangesValueKind() {
        Commodity commodity = parse("2020-01-01 commodity USD\n  precision: 2", Commodity.class);
        commodity.getMeta().put("precision", LocalDate.of(2020, 2, 2));
        assertPrints("2020-01-01 commodity USD\n  precision: 2020-02-02", commodity);
        commodity.getMeta().put("precision", null);
        assertPrints("2020-01-01 commodity USD\n  precision:", commodity);
        commodity.getMeta().put("precision", new Currency("EUR"));
        assertPrints("2020-01-01 commodity USD\n  precision: EUR", commodity);
        assertThrows(IllegalArgumentException.class, () -> commodity.getMeta().put("precision", 12));
    }

    @Test
    public void putAppendsWithInferredIndent() {
        Commodity commodity = parse("2020-01-01 commodity USD\n  name: \"US Dollar\"", Commodity.class);
        commodity.getMeta().put("precision", new BigDecimal("2"));
        assertPrints("2020-01-01 commodity USD\n  name: \"US Dollar\"\n  precision: 2", commodity);
        assertEquals("  ", commodity.getMeta().getItem("precision").getIndent());
    }

    @Test
    public void putIntoEmptyMetaUsesDefaultIndent() {
        Commodity commodity = parse("2020-01-01 commodity USD ; dollars", Commodity.class);
        commodity.getMeta().put("name", "US Dollar");
        assertPrints("2020-01-01 commodity USD ; dollars\n    name: \"US Dollar\"", commodity);
    }

    @Test
    public void configuredIndentApplies(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("settings.yaml");
        Files.writeString(config, "indent: \"\\t\"\n");
        System.setProperty(CstSettings.CONFIG_PROPERTY, config.toString());
        CstSettings.reset();

        Commodity commodity = parse("2020-01-01 commodity USD", Commodity.class);
        commodity.getMeta().put("name", "US Dollar");
        assertPrints("2020-01-01 commodity USD\n\tname: \"US Dollar\"", commodity);
    }

    @Test
    public void removeReturnsStandaloneItem() {
        Commodity commodity = parse(COMMODITY, Commodity.class);
        MetaItem removed = commodity.getMeta().remove("since");
        assertNotNull(removed);
        assertEquals("since", removed.getKey());
        assertPrints("  since: 1792-04-02", removed);
        assertNotSame(commodity.getTokenStore(), removed.getTokenStore());
        assertEquals(List.of("name", "precision", "parent", "flag"), commodity.getMeta().keys());
        assertPrints("2020-01-01 commodity USD\n"
                + "  name: \"US Dollar\"\n"
                + "  precision: 2\n"
                + "  parent: Assets:Cash\n"
                + "  flag:", commodity);
        assertNull(commodity.getMeta().remove("since"));
    }

    @Test
    public void removeFirstAndLast() {
        Close close = parse("2020-01-01 close Assets:Cash\n  a: 1\n  b: 2\n  c: 3", Close.class);
        close.getMeta().remove("a");
        assertPrints("2020-01-01 close Assets:Cash\n  b: 2\n  c: 3", close);
        close.getMeta().remove("c");
        assertPrints("2020-01-01 close Assets:Cash\n  b: 2", close);
        close.getMeta().remove("b");
        assertPrints("2020-01-01 close Assets:Cash", close);
        assertTrue(close.getMeta().isEmpty());
    }

    @Test
    public void popThenAppendMovesLine() {
        Close close = parse("2020-01-01 close Assets:Cash\n  a: \"A\"\n  b: \"B\"\n  c: \"C\"", Close.class);
        MetaItem b = close.getRawMeta().pop(1);
        assertPrints("  b: \"B\"", b);
        close.getRawMeta().append(b);
        assertPrints("2020-01-01 close Assets:Cash\n  a: \"A\"\n  c: \"C\"\n  b: \"B\"", close);
        assertEquals(List.of("A", "C", "B"),
                close.getRawMeta().items().stream().map(MetaItem::getValue).toList());
        assertSame(close.getTokenStore(), b.getTokenStore());
    }

    @Test
    public void itemCannotBeInsertedTwice() {
        Close close = parse("2020-01-01 close Assets:Cash\n  a: 1", Close.class);
        MetaItem a = close.getRawMeta().get(0);
        assertThrows(IllegalStateException.class, () -> close.getRawMeta().append(a));
        assertPrints("2020-01-01 close Assets:Cash\n  a: 1", close);
    }

    @Test
    public void metaItemAccessors() {
        MetaItem item = parseRoundTrip("  total: 1,234.5 ; approx", MetaItem.class);
        assertEquals("  ", item.getIndent());
        assertEquals("total", item.getKey());
        assertInstanceOf(Decimal.class, item.getRawValue());
        assertEquals("approx", item.getInlineComment());

        item.setKey("sum");
        item.setIndent("\t");
        item.setInlineComment(null);
        assertPrints("\tsum: 1,234.5", item);
        item.setValue(null);
        assertPrints("\tsum:", item);
        item.setValue("x");
        item.setInlineComment("again");
        assertPrints("\tsum: \"x\" ; again", item);
    }

    @Test
    public void metaItemLeadingCommentKeepsIndent() {
        MetaItem item = MetaItem.fromValue("note", "n", "  ");
        item.setLeadingComment("about note");
        assertPrints("  ; about note\n  note: \"n\"", item);
        checkDeepCopy(item);
    }
}
