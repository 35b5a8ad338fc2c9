package parsers;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ValueCoercerTest {

    @Test
    void toInteger_parsesWholeNumbers() {
        assertEquals(Optional.of(1), ValueCoercer.toInteger("1"));
        assertEquals(Optional.empty(), ValueCoercer.toInteger("1.00"));
        assertEquals(Optional.empty(), ValueCoercer.toInteger("as"));
        assertEquals(Optional.empty(), ValueCoercer.toInteger(""));
    }

    @Test
    void toDouble_parsesDecimals() {
        assertEquals(Optional.of(1.0), ValueCoercer.toDouble("1.00"));
        assertEquals(Optional.of(1.0), ValueCoercer.toDouble("1"));
        assertEquals(Optional.empty(), ValueCoercer.toDouble("1.2s"));
        assertEquals(Optional.empty(), ValueCoercer.toDouble("1f"));
    }

    @Test
    void toBoolean_usesVocabulary() {
        assertEquals(Optional.of(true), ValueCoercer.toBoolean("true"));
        assertEquals(Optional.of(false), ValueCoercer.toBoolean("0"));
        assertEquals(Optional.of(false), ValueCoercer.toBoolean("no"));
        assertEquals(Optional.of(true), ValueCoercer.toBoolean("YES"));
        assertEquals(Optional.empty(), ValueCoercer.toBoolean("what"));
        assertEquals(Optional.empty(), ValueCoercer.toBoolean("no,yes"));
    }

    @Test
    void toList_splitsOnCommas() {
        assertEquals(Optional.of(List.of("array", "of", "values")), ValueCoercer.toList("array,of,values"));
        assertEquals(Optional.of(List.of("array", "of", "values")), ValueCoercer.toList("array, of, values"));
        assertEquals(Optional.of(List.of(1.0, 2, 3.3)), ValueCoercer.toList("1.0, 2, 3.3"));
        assertEquals(Optional.empty(), ValueCoercer.toList("word"));
    }

    @Test
    void toList_numbersWinOverBooleansInsideLists() {
        assertEquals(Optional.of(List.of(1, true, false)), ValueCoercer.toList("1,true, no"));
    }

    @Test
    void toList_keepsEmptySegments() {
        assertEquals(Optional.of(List.of("a", "")), ValueCoercer.toList("a,"));
        assertEquals(Optional.of(List.of("", "", "")), ValueCoercer.toList(",,"));
    }

    @Test
    void coerce_integers() {
        assertEquals(26214400, ValueCoercer.coerce("26214400"));
        assertEquals(0, ValueCoercer.coerce("0"));
        assertEquals(7, ValueCoercer.coerce("007"));
        assertEquals(2147483648L, ValueCoercer.coerce("2147483648"));
        assertEquals(new BigInteger("99999999999999999999"), ValueCoercer.coerce("99999999999999999999"));
    }

    @Test
    void coerce_floats() {
        assertEquals(1.5, ValueCoercer.coerce("1.5"));
        assertEquals(0.5, ValueCoercer.coerce(".5"));
        assertEquals(5.0, ValueCoercer.coerce("5."));
    }

    @Test
    void coerce_oneAndZeroStayIntegers() {
        assertEquals(Integer.valueOf(1), ValueCoercer.coerce("1"));
        assertEquals(Integer.valueOf(0), ValueCoercer.coerce("0"));
    }

    @Test
    void coerce_booleansIgnoreCase() {
        assertEquals(Boolean.TRUE, ValueCoercer.coerce("Yes"));
        assertEquals(Boolean.TRUE, ValueCoercer.coerce("TRUE"));
        assertEquals(Boolean.FALSE, ValueCoercer.coerce("no"));
        assertEquals(Boolean.FALSE, ValueCoercer.coerce("False"));
    }

    @Test
    void coerce_quotedStringsAreNeverTyped() {
        assertEquals("hello there, ftp uploading", ValueCoercer.coerce("\"hello there, ftp uploading\""));
        assertEquals("42", ValueCoercer.coerce("'42'"));
        assertEquals("yes", ValueCoercer.coerce("\"yes\""));
        assertEquals(" padded ", ValueCoercer.coerce("\" padded \""));
        assertEquals("", ValueCoercer.coerce("\"\""));
    }

    @Test
    void coerce_mismatchedQuotesFallBackToString() {
        assertEquals("\"abc'", ValueCoercer.coerce("\"abc'"));
        assertEquals("\"", ValueCoercer.coerce("\""));
    }

    @Test
    void coerce_dotsThatAreNotNumbers() {
        assertEquals(".", ValueCoercer.coerce("."));
        assertEquals("1.2.3", ValueCoercer.coerce("1.2.3"));
        assertEquals("-5", ValueCoercer.coerce("-5"));
    }

    @Test
    void coerce_listElementsAreCoercedOneByOne() {
        var raw = "10, 2.5, no, 'x,y', plain";
        var segments = raw.split(",");
        var actual = (List<?>) ValueCoercer.coerce(raw);

        assertEquals(segments.length, actual.size());
        for (int i = 0; i < segments.length; i++) {
            assertEquals(ValueCoercer.coerce(segments[i].trim()), actual.get(i));
        }
        assertEquals(List.of(10, 2.5, false, "'x", "y'", "plain"), actual);
    }

    @Test
    void coerce_listIsUnmodifiable() {
        var list = (List<?>) ValueCoercer.coerce("a,b");
        assertThrows(UnsupportedOperationException.class, list::clear);
    }

    @Test
    void coerce_fallbackIsTrimmedAndStable() {
        var once = ValueCoercer.coerce("  /srv/var/tmp/  ");
        assertEquals("/srv/var/tmp/", once);
        assertEquals(once, ValueCoercer.coerce((String) once));
    }

    @Test
    void isNumber_allowsOneDecimalPoint() {
        assertTrue(ValueCoercer.isNumber("12"));
        assertTrue(ValueCoercer.isNumber("1.2"));
        assertFalse(ValueCoercer.isNumber("1.2.3"));
        assertFalse(ValueCoercer.isNumber("."));
        assertFalse(ValueCoercer.isNumber(""));
        assertFalse(ValueCoercer.isNumber("1e5"));
    }

    @Test
    void coerce_rejectsNull() {
        assertThrows(NullPointerException.class, () -> ValueCoercer.coerce(null));
    }
}
