package com.tyron.ledgercst.lang.ledger;

import com.tyron.ledgercst.api.parse.TokenizerParser;
import com.tyron.ledgercst.core.language.LanguageSupport;
import com.tyron.ledgercst.core.parser.NodeRegistry;
import com.tyron.ledgercst.lang.ledger.parser.LedgerGrammarParser;
import org.jetbrains.annotations.NotNull;

public class LedgerLanguageSupport implements LanguageSupport {

    private static LedgerLanguageSupport instance;

    public static synchronized LedgerLanguageSupport getInstance() {
        if (instance == null) {
            instance = new LedgerLanguageSupport();
        }
        return instance;
    }

    @Override
    public @NotNull String getName() {
        return "ledger";
    }

    @Override
    public boolean canHandle(@NotNull String fileName) {
        return fileName.endsWith(".bean") || fileName.endsWith(".beancount") || fileName.endsWith(".ledger");
    }

    @Override
    public @NotNull TokenizerParser createTokenizerParser() {
        return new LedgerGrammarParser();
    }

    @Override
    public @NotNull NodeRegistry getNodeRegistry() {
        return LedgerModels.registry();
    }
}
