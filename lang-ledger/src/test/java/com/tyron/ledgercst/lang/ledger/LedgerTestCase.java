package com.tyron.ledgercst.lang.ledger;

import com.tyron.ledgercst.core.language.LanguageSupport;
import com.tyron.ledgercst.testFramework.BaseCstTest;

/**
 * Base class for tests against the ledger language.
 */
public abstract class LedgerTestCase extends BaseCstTest {

    @Override
    protected LanguageSupport getLanguage() {
        return LedgerLanguageSupport.getInstance();
    }
}
