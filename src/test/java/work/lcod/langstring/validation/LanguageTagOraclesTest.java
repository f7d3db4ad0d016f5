package work.lcod.langstring.validation;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.lcod.langstring.support.LangStringTestSupport;

class LanguageTagOraclesTest {
    @AfterEach
    void resetOracle() {
        LangStringTestSupport.resetGlobalState();
    }

    @Test
    void discoversBundledOracle() {
        assertInstanceOf(Bcp47LanguageTagOracle.class, LanguageTagOracles.current().orElseThrow());
    }

    @Test
    void overrideAndResetRestoreDiscovery() {
        LanguageTagOracle custom = tag -> true;

        LanguageTagOracles.use(custom);
        assertSame(custom, LanguageTagOracles.current().orElseThrow());

        LanguageTagOracles.useNone();
        assertFalse(LanguageTagOracles.current().isPresent());

        LanguageTagOracles.reset();
        assertTrue(LanguageTagOracles.current().isPresent());
    }
}
