package com.tyron.ledgercst.lang.ledger.parser;

import com.tyron.ledgercst.api.parse.ParseException;
import com.tyron.ledgercst.api.parse.ParseNode;
import com.tyron.ledgercst.api.parse.ParseResult;
import com.tyron.ledgercst.api.parse.TokenizerParser;
import com.tyron.ledgercst.api.text.Position;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerLexer;
import com.tyron.ledgercst.lang.ledger.lexer.LedgerTokenTypes;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Recursive descent parser for the ledger grammar.
 * <p>
 * Every directive occupies one line followed by its indented metadata lines. Comments
 * and spacing are left out of the tree; leading and trailing comment positions are
 * always emitted empty and filled later by comment claiming.
 */
public final class LedgerGrammarParser implements TokenizerParser {

    private static final Logger LOG = Logger.getLogger(LedgerGrammarParser.class.getName());

    public static final String FILE = "file";
    public static final String OPEN = "open";
    public static final String CLOSE = "close";
    public static final String COMMODITY = "commodity";
    public static final String META_ITEM = "meta_item";

    private static final Set<String> META_VALUES = Set.of(
            LedgerTokenTypes.ESCAPED_STRING,
            LedgerTokenTypes.NUMBER,
            LedgerTokenTypes.DATE,
            LedgerTokenTypes.ACCOUNT,
            LedgerTokenTypes.CURRENCY);

    @Override
    public @NotNull List<ParseNode.Terminal> tokenize(@NotNull String source) {
        return LedgerLexer.tokenize(source);
    }

    @Override
    public @NotNull ParseResult tokenizeAndParse(@NotNull String source, @NotNull String startRule) {
        List<ParseNode.Terminal> tokens = tokenize(source);
        Session session = new Session(tokens, Position.ofText(source));
        ParseNode.Rule tree;
        switch (startRule) {
            case FILE -> tree = session.file();
            case OPEN -> tree = session.open();
            case CLOSE -> tree = session.close();
            case COMMODITY -> tree = session.commodity();
            case META_ITEM -> tree = session.metaItem();
            default -> throw new IllegalArgumentException("unknown start rule: " + startRule);
        }
        session.expectEnd();
        LOG.fine("ledgerParse rule=" + startRule + " terminals=" + tokens.size() + " chars=" + source.length());
        return new ParseResult(tokens, tree);
    }

    private static final class Session {

        private final List<ParseNode.Terminal> tokens;
        private final Position end;
        private int pos;

        Session(List<ParseNode.Terminal> tokens, Position end) {
            this.tokens = tokens;
            this.end = end;
        }

        ParseNode.Rule file() {
            List<ParseNode> directives = new ArrayList<>();
            while (peek(0) != null) {
                directives.add(directive());
            }
            return new ParseNode.Rule(FILE, List.of(new ParseNode.Repetition(directives)));
        }

        ParseNode.Rule directive() {
            ParseNode.Terminal date = peek(0);
            ParseNode.Terminal keyword = peek(1);
            if (date == null || !date.type().equals(LedgerTokenTypes.DATE)) {
                throw unexpected(date, "a directive");
            }
            if (keyword == null || keyword.line() != date.line()) {
                throw unexpected(keyword, "a directive keyword");
            }
            return switch (keyword.type()) {
                case LedgerTokenTypes.OPEN -> open();
                case LedgerTokenTypes.CLOSE -> close();
                case LedgerTokenTypes.COMMODITY -> commodity();
                default -> throw unexpected(keyword, "a directive keyword");
            };
        }

        ParseNode.Rule open() {
            ParseNode.Terminal date = expect(LedgerTokenTypes.DATE);
            int line = date.line();
            ParseNode.Terminal label = expectOnLine(LedgerTokenTypes.OPEN, line);
            ParseNode.Terminal account = expectOnLine(LedgerTokenTypes.ACCOUNT, line);
            List<ParseNode> currencies = new ArrayList<>();
            if (onLine(LedgerTokenTypes.CURRENCY, line)) {
                currencies.add(next());
                while (onLine(LedgerTokenTypes.COMMA, line)) {
                    next();
                    currencies.add(expectOnLine(LedgerTokenTypes.CURRENCY, line));
                }
            }
            ParseNode.Optional booking = optional(LedgerTokenTypes.ESCAPED_STRING, line);
            ParseNode.Optional inline = optional(LedgerTokenTypes.INLINE_COMMENT, line);
            expectLineEnd(line);
            ParseNode.Repetition meta = metaItems();
            return new ParseNode.Rule(OPEN, List.of(ParseNode.Optional.empty(), date, label, account,
                    new ParseNode.Repetition(currencies), booking, inline, meta, ParseNode.Optional.empty()));
        }

        ParseNode.Rule close() {
            ParseNode.Terminal date = expect(LedgerTokenTypes.DATE);
            int line = date.line();
            ParseNode.Terminal label = expectOnLine(LedgerTokenTypes.CLOSE, line);
            ParseNode.Terminal account = expectOnLine(LedgerTokenTypes.ACCOUNT, line);
            ParseNode.Optional inline = optional(LedgerTokenTypes.INLINE_COMMENT, line);
            expectLineEnd(line);
            ParseNode.Repetition meta = metaItems();
            return new ParseNode.Rule(CLOSE, List.of(ParseNode.Optional.empty(), date, label, account,
                    inline, meta, ParseNode.Optional.empty()));
        }

        ParseNode.Rule commodity() {
            ParseNode.Terminal date = expect(LedgerTokenTypes.DATE);
            int line = date.line();
            ParseNode.Terminal label = expectOnLine(LedgerTokenTypes.COMMODITY, line);
            ParseNode.Terminal currency = expectOnLine(LedgerTokenTypes.CURRENCY, line);
            ParseNode.Optional inline = optional(LedgerTokenTypes.INLINE_COMMENT, line);
            expectLineEnd(line);
            ParseNode.Repetition meta = metaItems();
            return new ParseNode.Rule(COMMODITY, List.of(ParseNode.Optional.empty(), date, label, currency,
                    inline, meta, ParseNode.Optional.empty()));
        }

        ParseNode.Rule metaItem() {
            ParseNode.Terminal indent = expect(LedgerTokenTypes.INDENT);
            int line = indent.line();
            ParseNode.Terminal key = expectOnLine(LedgerTokenTypes.META_KEY, line);
            ParseNode.Terminal value = peek(0);
            ParseNode.Optional optionalValue = ParseNode.Optional.empty();
            if (value != null && value.line() == line && META_VALUES.contains(value.type())) {
                optionalValue = new ParseNode.Optional(next());
            }
            ParseNode.Optional inline = optional(LedgerTokenTypes.INLINE_COMMENT, line);
            expectLineEnd(line);
            return new ParseNode.Rule(META_ITEM, List.of(ParseNode.Optional.empty(), indent, key,
                    optionalValue, inline, ParseNode.Optional.empty()));
        }

        private ParseNode.Repetition metaItems() {
            List<ParseNode> items = new ArrayList<>();
            ParseNode.Terminal next = peek(0);
            while (next != null && next.type().equals(LedgerTokenTypes.INDENT)) {
                items.add(metaItem());
                next = peek(0);
            }
            return new ParseNode.Repetition(items);
        }

        private ParseNode.Optional optional(String type, int line) {
            return onLine(type, line) ? new ParseNode.Optional(next()) : ParseNode.Optional.empty();
        }

        void expectEnd() {
            ParseNode.Terminal next = peek(0);
            if (next != null) {
                throw unexpected(next, "end of input");
            }
        }

        private void expectLineEnd(int line) {
            ParseNode.Terminal next = peek(0);
            if (next != null && next.line() == line) {
                throw unexpected(next, "end of line");
            }
        }

        private boolean onLine(String type, int line) {
            ParseNode.Terminal next = peek(0);
            return next != null && next.line() == line && next.type().equals(type);
        }

        private ParseNode.Terminal expect(String type) {
            ParseNode.Terminal next = peek(0);
            if (next == null || !next.type().equals(type)) {
                throw unexpected(next, type);
            }
            return next();
        }

        private ParseNode.Terminal expectOnLine(String type, int line) {
            ParseNode.Terminal next = peek(0);
            if (next == null || next.line() != line || !next.type().equals(type)) {
                throw unexpected(next, type);
            }
            return next();
        }

        /**
         * The {@code ahead}-th significant terminal from the cursor, or null past the end.
         */
        private @Nullable ParseNode.Terminal peek(int ahead) {
            int seen = 0;
            for (int i = pos; i < tokens.size(); i++) {
                ParseNode.Terminal token = tokens.get(i);
                if (LedgerTokenTypes.IGNORED.contains(token.type())) {
                    continue;
                }
                if (seen == ahead) {
                    return token;
                }
                seen++;
            }
            return null;
        }

        private ParseNode.Terminal next() {
            ParseNode.Terminal token = peek(0);
            if (token == null) {
                throw unexpected(null, "more input");
            }
            pos = token.index() + 1;
            return token;
        }

        private ParseException unexpected(@Nullable ParseNode.Terminal token, String expected) {
            if (token == null) {
                return new ParseException("expected " + expected + " but reached end of input", end.line(), end.column());
            }
            return new ParseException("expected " + expected + " but got " + token.type() + " '" + token.rawText() + "'",
                    token.line(), token.column());
        }
    }
}
