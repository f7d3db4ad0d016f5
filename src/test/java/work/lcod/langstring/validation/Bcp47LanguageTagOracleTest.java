package work.lcod.langstring.validation;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class Bcp47LanguageTagOracleTest {
    private final LanguageTagOracle oracle = new Bcp47LanguageTagOracle();

    @Test
    void acceptsWellFormedTags() {
        assertTrue(oracle.isValid("en"));
        assertTrue(oracle.isValid("pt-BR"));
        assertTrue(oracle.isValid("zh-Hant-TW"));
    }

    @Test
    void rejectsMalformedTags() {
        assertFalse(oracle.isValid(""));
        assertFalse(oracle.isValid(null));
        assertFalse(oracle.isValid("not a tag"));
        assertFalse(oracle.isValid("en_US"));
    }
}
