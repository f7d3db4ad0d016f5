package work.lcod.langstring.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.langstring.support.LangStringTestSupport.assertFailure;

import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.lcod.langstring.ErrorKind;
import work.lcod.langstring.control.Controller;
import work.lcod.langstring.control.FlagNamespace;
import work.lcod.langstring.control.FlagSettings;
import work.lcod.langstring.control.GlobalFlag;
import work.lcod.langstring.control.LangStringFlag;
import work.lcod.langstring.support.LangStringTestSupport;

class FlagValidatorTest {
    private static final LanguageTagOracle ONLY_EN = tag -> tag.equals("en");

    @AfterEach
    void resetFlags() {
        LangStringTestSupport.resetGlobalState();
    }

    private static FlagValidator validator(FlagSettings settings, LanguageTagOracle oracle) {
        return new FlagValidator(FlagNamespace.LANG_STRING, settings, Optional.ofNullable(oracle));
    }

    @Test
    void absentValuesBecomeEmpty() {
        var validator = validator(FlagSettings.defaults().with(GlobalFlag.DEFINED_TEXT, false), null);

        assertEquals("", validator.validateText(null));
        assertEquals("", validator.validateLanguage(null));
    }

    @Test
    void nonStringIsTypeFailure() {
        var validator = validator(FlagSettings.defaults(), null);

        assertFailure(ErrorKind.TYPE, () -> validator.validateText(42));
        assertFailure(ErrorKind.TYPE, () -> validator.validateLanguage(true));
    }

    @Test
    void whitespaceOnlyTextIsEmptyOnlyWhenStripped() {
        var plain = validator(FlagSettings.defaults(), null);
        var stripping = validator(FlagSettings.defaults().with(LangStringFlag.STRIP_TEXT, true), null);

        assertEquals("   ", plain.validateText("   "));
        assertFailure(ErrorKind.VALUE, () -> stripping.validateText("   "));
        assertEquals("Hello", stripping.validateText("  Hello "));
    }

    @Test
    void emptyTextRejectedWhileDefinedTextIsOn() {
        var failure = assertFailure(ErrorKind.VALUE, () -> validator(FlagSettings.defaults(), null).validateText(""));

        assertEquals(true, failure.getMessage().contains("LangStringFlag.DEFINED_TEXT"));
    }

    @Test
    void languageIsStrippedThenCheckedThenFolded() {
        var settings = FlagSettings.builder()
            .set(LangStringFlag.STRIP_LANG, true)
            .set(LangStringFlag.DEFINED_LANG, true)
            .set(LangStringFlag.LOWERCASE_LANG, true)
            .build();
        var validator = validator(settings, null);

        assertEquals("pt-br", validator.validateLanguage(" pt-BR "));
        assertFailure(ErrorKind.VALUE, () -> validator.validateLanguage("  "));
    }

    @Test
    void invalidTagRejectedByOracle() {
        var validator = validator(FlagSettings.defaults().with(GlobalFlag.VALID_LANG, true), ONLY_EN);

        assertEquals("en", validator.validateLanguage("en"));
        assertFailure(ErrorKind.VALUE, () -> validator.validateLanguage("xx"));
    }

    @Test
    void oracleSeesFoldedTag() {
        var settings = FlagSettings.builder()
            .set(GlobalFlag.VALID_LANG, true)
            .set(GlobalFlag.LOWERCASE_LANG, true)
            .build();

        assertEquals("en", validator(settings, ONLY_EN).validateLanguage("EN"));
    }

    @Test
    void missingOracleIsSkippedUnlessEnforced() {
        var lenient = validator(FlagSettings.defaults().with(GlobalFlag.VALID_LANG, true), null);
        var strict = validator(
            FlagSettings.defaults().with(GlobalFlag.VALID_LANG, true).with(GlobalFlag.ENFORCE_EXTRA_DEPEND, true),
            null
        );

        assertEquals("not a tag", lenient.validateLanguage("not a tag"));
        assertFailure(ErrorKind.VALUE, () -> strict.validateLanguage("en"));
    }

    @Test
    void ofFollowsControllerAndInstalledOracle() {
        Controller.set(GlobalFlag.VALID_LANG, true);
        LanguageTagOracles.use(ONLY_EN);

        var validator = FlagValidator.of(FlagNamespace.MULTI_LANG_STRING, null);

        assertFailure(ErrorKind.VALUE, () -> validator.validateLanguage("fr"));
    }
}
