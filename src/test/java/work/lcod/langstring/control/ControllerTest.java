package work.lcod.langstring.control;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static work.lcod.langstring.support.LangStringTestSupport.assertFailure;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import work.lcod.langstring.ErrorKind;
import work.lcod.langstring.support.LangStringTestSupport;

class ControllerTest {
    @AfterEach
    void resetFlags() {
        LangStringTestSupport.resetGlobalState();
    }

    @Test
    void defaultsMatchDeclaredValues() {
        assertTrue(Controller.get(GlobalFlag.DEFINED_TEXT));
        assertTrue(Controller.get(LangStringFlag.PRINT_WITH_QUOTES));
        assertTrue(Controller.get(MultiLangStringFlag.PRINT_WITH_LANG));
        assertFalse(Controller.get(SetLangStringFlag.STRIP_TEXT));
        assertFalse(Controller.get(GlobalFlag.VALID_LANG));
    }

    @Test
    void globalSetCascadesToEveryNamespace() {
        Controller.set(GlobalFlag.STRIP_TEXT, true);

        assertTrue(Controller.get(GlobalFlag.STRIP_TEXT));
        assertTrue(Controller.get(LangStringFlag.STRIP_TEXT));
        assertTrue(Controller.get(SetLangStringFlag.STRIP_TEXT));
        assertTrue(Controller.get(MultiLangStringFlag.STRIP_TEXT));
    }

    @Test
    void globalMatchTypesSkipsNamespaceWithoutMirror() {
        Controller.set(GlobalFlag.METHODS_MATCH_TYPES, true);

        assertTrue(Controller.get(LangStringFlag.METHODS_MATCH_TYPES));
        assertTrue(Controller.get(SetLangStringFlag.METHODS_MATCH_TYPES));
        assertEquals(39, Controller.getAll().size());
    }

    @Test
    void scopedSetLeavesOtherNamespacesAlone() {
        Controller.set(LangStringFlag.LOWERCASE_LANG, true);

        assertTrue(Controller.get(LangStringFlag.LOWERCASE_LANG));
        assertFalse(Controller.get(GlobalFlag.LOWERCASE_LANG));
        assertFalse(Controller.get(SetLangStringFlag.LOWERCASE_LANG));
        assertFalse(Controller.get(MultiLangStringFlag.LOWERCASE_LANG));
    }

    @Test
    void resettingScopedFlagKeepsUnrelatedFlags() {
        Controller.set(GlobalFlag.STRIP_LANG, true);
        Controller.set(GlobalFlag.DEFINED_LANG, true);

        Controller.reset(SetLangStringFlag.STRIP_LANG);

        assertFalse(Controller.get(SetLangStringFlag.STRIP_LANG));
        assertTrue(Controller.get(LangStringFlag.STRIP_LANG));
        assertTrue(Controller.get(GlobalFlag.STRIP_LANG));
        assertTrue(Controller.get(SetLangStringFlag.DEFINED_LANG));
    }

    @Test
    void resetAllScopedOnlyTouchesThatNamespace() {
        Controller.set(GlobalFlag.STRIP_TEXT, true);

        Controller.resetAll(FlagNamespace.MULTI_LANG_STRING);

        assertFalse(Controller.get(MultiLangStringFlag.STRIP_TEXT));
        assertTrue(Controller.get(LangStringFlag.STRIP_TEXT));
    }

    @Test
    void resetAllGlobalRestoresEverything() {
        Controller.set(GlobalFlag.STRIP_TEXT, true);
        Controller.set(LangStringFlag.DEFINED_TEXT, false);

        Controller.resetAll();

        assertEquals(FlagSettings.defaults().asMap(), Controller.getAll());
    }

    @Test
    void getAllIsOrderedByQualifiedName() {
        List<String> names = new ArrayList<>();
        Controller.getAll().keySet().forEach(flag -> names.add(flag.qualifiedName()));

        List<String> sorted = new ArrayList<>(names);
        sorted.sort(null);
        assertEquals(sorted, names);
        assertEquals("GlobalFlag.DEFINED_LANG", names.get(0));
    }

    @Test
    void getAllForNamespaceIsScoped() {
        Map<Flag, Boolean> scoped = Controller.getAll(FlagNamespace.MULTI_LANG_STRING);

        assertEquals(9, scoped.size());
        assertTrue(scoped.keySet().stream().allMatch(flag -> flag instanceof MultiLangStringFlag));
    }

    @Test
    void unknownFlagIsKindFailure() {
        Flag foreign = new Flag() {
            @Override
            public String name() {
                return "STRIP_TEXT";
            }

            @Override
            public FlagNamespace namespace() {
                return FlagNamespace.GLOBAL;
            }

            @Override
            public boolean defaultValue() {
                return false;
            }
        };

        assertFailure(ErrorKind.KIND, () -> Controller.set(foreign, true));
        assertFailure(ErrorKind.KIND, () -> Controller.get(foreign));
        assertFailure(ErrorKind.KIND, () -> Controller.reset(null));
        assertFailure(ErrorKind.KIND, () -> Controller.resetAll(null));
    }

    @Test
    void printWritesOneLinePerFlag() {
        var buffer = new ByteArrayOutputStream();
        var out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        Controller.set(GlobalFlag.STRIP_TEXT, true);

        Controller.print(GlobalFlag.STRIP_TEXT, out);
        Controller.print(FlagNamespace.LANG_STRING, out);

        String[] lines = buffer.toString(StandardCharsets.UTF_8).split("\\R");
        assertEquals("GlobalFlag.STRIP_TEXT = true", lines[0]);
        assertEquals(11, lines.length);
        assertEquals("LangStringFlag.DEFINED_LANG = false", lines[1]);
        assertEquals("LangStringFlag.STRIP_TEXT = true", lines[9]);
    }

    @Test
    void applyReplacesWholeState() {
        FlagSettings settings = FlagSettings.builder().set(GlobalFlag.DEFINED_TEXT, false).build();

        Controller.apply(settings);

        assertEquals(settings, Controller.snapshot());
        assertFalse(Controller.get(LangStringFlag.DEFINED_TEXT));
    }
}
