package work.lcod.langstring.control;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.langstring.support.LangStringTestSupport.assertFailure;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.lcod.langstring.ErrorKind;

class FlagSettingsLoaderTest {
    @TempDir
    Path tempDir;

    @Test
    void tomlGlobalAppliesBeforeScopedOverrides() {
        FlagSettings settings = FlagSettingsLoader.fromToml("""
            [lang_string]
            STRIP_TEXT = false

            [global]
            STRIP_TEXT = true
            """);

        assertFalse(settings.get(LangStringFlag.STRIP_TEXT));
        assertTrue(settings.get(SetLangStringFlag.STRIP_TEXT));
        assertTrue(settings.get(MultiLangStringFlag.STRIP_TEXT));
    }

    @Test
    void jsonDocumentIsSupported() {
        FlagSettings settings = FlagSettingsLoader.fromJson("""
            {"multi_lang_string": {"PRINT_WITH_QUOTES": false}}
            """);

        assertFalse(settings.get(MultiLangStringFlag.PRINT_WITH_QUOTES));
        assertTrue(settings.get(LangStringFlag.PRINT_WITH_QUOTES));
    }

    @Test
    void yamlDocumentIsSupported() {
        FlagSettings settings = FlagSettingsLoader.fromYaml("""
            global:
              LOWERCASE_LANG: true
            set_lang_string:
              lowercase_lang: false
            """);

        assertTrue(settings.get(LangStringFlag.LOWERCASE_LANG));
        assertFalse(settings.get(SetLangStringFlag.LOWERCASE_LANG));
    }

    @Test
    void unknownTableOrFlagIsKindFailure() {
        assertFailure(ErrorKind.KIND, () -> FlagSettingsLoader.fromToml("[everything]\nSTRIP_TEXT = true\n"));
        assertFailure(ErrorKind.KIND, () -> FlagSettingsLoader.fromToml("[multi_lang_string]\nMETHODS_MATCH_TYPES = true\n"));
    }

    @Test
    void nonBooleanValueIsTypeFailure() {
        assertFailure(ErrorKind.TYPE, () -> FlagSettingsLoader.fromToml("[global]\nSTRIP_TEXT = \"yes\"\n"));
        assertFailure(ErrorKind.TYPE, () -> FlagSettingsLoader.fromJson("{\"global\": {\"STRIP_TEXT\": 1}}"));
    }

    @Test
    void malformedDocumentIsReported() {
        assertThrows(IllegalStateException.class, () -> FlagSettingsLoader.fromToml("[global\n"));
        assertThrows(IllegalStateException.class, () -> FlagSettingsLoader.fromJson("{"));
    }

    @Test
    void loadPicksFormatFromExtension() throws Exception {
        Path toml = tempDir.resolve("flags.toml");
        Files.writeString(toml, "[set_lang_string]\nLOWERCASE_LANG = true\n");
        Path json = tempDir.resolve("flags.json");
        Files.writeString(json, "{\"global\": {\"VALID_LANG\": true}}");
        Path yaml = tempDir.resolve("flags.yml");
        Files.writeString(yaml, "lang_string:\n  PRINT_WITH_LANG: false\n");

        assertTrue(FlagSettingsLoader.load(toml).get(SetLangStringFlag.LOWERCASE_LANG));
        assertTrue(FlagSettingsLoader.load(json).get(LangStringFlag.VALID_LANG));
        assertFalse(FlagSettingsLoader.load(yaml).get(LangStringFlag.PRINT_WITH_LANG));
    }

    @Test
    void missingFileIsReported() {
        assertThrows(IllegalStateException.class, () -> FlagSettingsLoader.load(tempDir.resolve("absent.toml")));
    }
}
