package work.lcod.langstring.model;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class RenderOptionsTest {
    @Test
    void nullSwitchesFallBackToPolicy() {
        var options = RenderOptions.defaults();

        assertEquals("@", options.separator());
        assertEquals("\"Hi\"@en", options.render("Hi", "en", true, true));
        assertEquals("Hi", options.render("Hi", "en", false, false));
    }

    @Test
    void explicitSwitchesWin() {
        var options = RenderOptions.defaults().withQuotes(false).withSeparator("::");

        assertEquals("Hi::en", options.render("Hi", "en", true, true));
        assertEquals("\"Hi\"", options.withQuotes(true).withLang(false).render("Hi", "en", false, true));
    }

    @Test
    void emptyLanguageOmitsSuffix() {
        assertEquals("\"Hi\"", RenderOptions.defaults().render("Hi", "", true, true));
        assertEquals("@", new RenderOptions(null, null, null).separator());
    }
}
