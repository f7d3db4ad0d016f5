package work.lcod.langstring.convert;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static work.lcod.langstring.support.LangStringTestSupport.assertFailure;

import org.junit.jupiter.api.Test;
import work.lcod.langstring.ErrorKind;

class ConversionMethodTest {
    @Test
    void parsesNamesIgnoringCase() {
        assertEquals(ConversionMethod.MANUAL, ConversionMethod.from("manual"));
        assertEquals(ConversionMethod.PARSE, ConversionMethod.from(" PARSE "));
    }

    @Test
    void unknownNamesAreKindFailures() {
        var failure = assertFailure(ErrorKind.KIND, () -> ConversionMethod.from("guess"));

        assertEquals("Unknown method: guess. Valid methods are 'manual' and 'parse'.", failure.getMessage());
        assertFailure(ErrorKind.KIND, () -> ConversionMethod.from(null));
        assertFailure(ErrorKind.KIND, () -> ConversionMethod.from(" "));
    }
}
