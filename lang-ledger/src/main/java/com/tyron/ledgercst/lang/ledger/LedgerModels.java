package com.tyron.ledgercst.lang.ledger;

import com.tyron.ledgercst.core.comments.BlockComment;
import com.tyron.ledgercst.core.parser.NodeRegistry;
import com.tyron.ledgercst.core.parser.NodeType;
import com.tyron.ledgercst.core.spacing.Newline;
import com.tyron.ledgercst.core.spacing.Whitespace;
import com.tyron.ledgercst.lang.ledger.nodes.Close;
import com.tyron.ledgercst.lang.ledger.nodes.Commodity;
import com.tyron.ledgercst.lang.ledger.nodes.File;
import com.tyron.ledgercst.lang.ledger.nodes.MetaItem;
import com.tyron.ledgercst.lang.ledger.nodes.Open;
import com.tyron.ledgercst.lang.ledger.tokens.Account;
import com.tyron.ledgercst.lang.ledger.tokens.CloseLabel;
import com.tyron.ledgercst.lang.ledger.tokens.Comma;
import com.tyron.ledgercst.lang.ledger.tokens.CommodityLabel;
import com.tyron.ledgercst.lang.ledger.tokens.Currency;
import com.tyron.ledgercst.lang.ledger.tokens.Date;
import com.tyron.ledgercst.lang.ledger.tokens.Decimal;
import com.tyron.ledgercst.lang.ledger.tokens.EscapedString;
import com.tyron.ledgercst.lang.ledger.tokens.Indent;
import com.tyron.ledgercst.lang.ledger.tokens.InlineComment;
import com.tyron.ledgercst.lang.ledger.tokens.MetaKey;
import com.tyron.ledgercst.lang.ledger.tokens.OpenLabel;
import org.jetbrains.annotations.NotNull;

/**
 * Token and tree models of the ledger language.
 */
public final class LedgerModels {

    private static final NodeRegistry REGISTRY = NodeRegistry.builder()
            .token(Date.TYPE, Date.class, Date::new)
            .token(OpenLabel.TYPE, OpenLabel.class, OpenLabel::new)
            .token(CloseLabel.TYPE, CloseLabel.class, CloseLabel::new)
            .token(CommodityLabel.TYPE, CommodityLabel.class, CommodityLabel::new)
            .token(Account.TYPE, Account.class, Account::new)
            .token(Currency.TYPE, Currency.class, Currency::new)
            .token(EscapedString.TYPE, EscapedString.class, EscapedString::new)
            .token(Decimal.TYPE, Decimal.class, Decimal::new)
            .token(Comma.TYPE, Comma.class, Comma::new)
            .token(Indent.TYPE, Indent.class, Indent::new)
            .token(MetaKey.TYPE, MetaKey.class, MetaKey::new)
            .token(InlineComment.TYPE, InlineComment.class, InlineComment::new)
            .token(Whitespace.TYPE, Whitespace.class, Whitespace::new)
            .token(Newline.TYPE, Newline.class, Newline::new)
            .token(BlockComment.TYPE, BlockComment.class, BlockComment::new)
            .tree(new NodeType<>(File.class, File.LAYOUT, File::fromParsed))
            .tree(new NodeType<>(Open.class, Open.LAYOUT, Open::fromParsed))
            .tree(new NodeType<>(Close.class, Close.LAYOUT, Close::fromParsed))
            .tree(new NodeType<>(Commodity.class, Commodity.LAYOUT, Commodity::fromParsed))
            .tree(new NodeType<>(MetaItem.class, MetaItem.LAYOUT, MetaItem::fromParsed))
            .build();

    private LedgerModels() {
    }

    public static @NotNull NodeRegistry registry() {
        return REGISTRY;
    }
}
