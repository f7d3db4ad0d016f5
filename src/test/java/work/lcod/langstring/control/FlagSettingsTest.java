package work.lcod.langstring.control;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class FlagSettingsTest {
    @Test
    void withReturnsNewValueAndKeepsOriginal() {
        FlagSettings defaults = FlagSettings.defaults();

        FlagSettings changed = defaults.with(GlobalFlag.STRIP_TEXT, true);

        assertFalse(defaults.get(LangStringFlag.STRIP_TEXT));
        assertTrue(changed.get(LangStringFlag.STRIP_TEXT));
        assertNotEquals(defaults, changed);
    }

    @Test
    void withResetOfGlobalResetsMirrors() {
        FlagSettings settings = FlagSettings.builder()
            .set(GlobalFlag.STRIP_LANG, true)
            .build()
            .withReset(GlobalFlag.STRIP_LANG);

        assertEquals(FlagSettings.defaults(), settings);
    }

    @Test
    void isEnabledResolvesMirrorOfNamespace() {
        FlagSettings settings = FlagSettings.defaults().with(SetLangStringFlag.METHODS_MATCH_TYPES, true);

        assertTrue(settings.isEnabled(FlagNamespace.SET_LANG_STRING, GlobalFlag.METHODS_MATCH_TYPES));
        assertFalse(settings.isEnabled(FlagNamespace.LANG_STRING, GlobalFlag.METHODS_MATCH_TYPES));
        assertFalse(settings.isEnabled(FlagNamespace.MULTI_LANG_STRING, GlobalFlag.METHODS_MATCH_TYPES));
    }

    @Test
    void namespaceResetOnlyTouchesThatNamespace() {
        FlagSettings settings = FlagSettings.defaults()
            .with(GlobalFlag.LOWERCASE_LANG, true)
            .withNamespaceReset(FlagNamespace.LANG_STRING);

        assertFalse(settings.get(LangStringFlag.LOWERCASE_LANG));
        assertTrue(settings.get(MultiLangStringFlag.LOWERCASE_LANG));
    }

    @Test
    void mapIsUnmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> FlagSettings.defaults().asMap().put(GlobalFlag.VALID_LANG, true));
    }

    @Test
    void toStringListsEnabledFlags() {
        String rendered = FlagSettings.defaults().toString();

        assertTrue(rendered.contains("GlobalFlag.DEFINED_TEXT"));
        assertFalse(rendered.contains("STRIP_TEXT"));
    }
}
