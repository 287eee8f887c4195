package confetti.lang;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ValueConvertersTest {

    enum Mode { READ_ONLY, READ_WRITE }

    ValueConverters converters;

    @BeforeEach
    void setUp() {
        converters = ValueConverters.builtIn();
    }

    private <T> T convert(Class<T> type, String text) {
        return converters.find(type).orElseThrow().fromConfValue(text);
    }

    @Test
    void numbers() {
        assertEquals(8080, convert(int.class, "8080"));
        assertEquals(-3, convert(Integer.class, "-3"));
        assertEquals(1L << 40, convert(long.class, "1099511627776"));
        assertEquals((short) 7, convert(short.class, "7"));
        assertEquals((byte) -1, convert(byte.class, "-1"));
        assertEquals(2.5, convert(double.class, "2.5"));
        assertEquals(0.25f, convert(float.class, "0.25"));
        assertEquals(new BigInteger("123456789012345678901234567890"), convert(BigInteger.class, "123456789012345678901234567890"));
        assertEquals(new BigDecimal("1.10"), convert(BigDecimal.class, "1.10"));
    }

    @Test
    void malformedNumbers() {
        var ex = assertThrows(ConversionException.class, () -> convert(int.class, "eighty"));
        assertEquals("Cannot convert 'eighty' to integer", ex.getMessage());
        assertThrows(ConversionException.class, () -> convert(byte.class, "300"));
        assertThrows(ConversionException.class, () -> convert(BigDecimal.class, "1..0"));
    }

    @Test
    void booleans() {
        for (var text : new String[] {"true", "YES", "on", "1"}) {
            assertTrue(convert(boolean.class, text), text);
        }
        for (var text : new String[] {"false", "No", "off", "0"}) {
            assertFalse(convert(Boolean.class, text), text);
        }
        assertThrows(ConversionException.class, () -> convert(boolean.class, "maybe"));
    }

    @Test
    void characters() {
        assertEquals('x', convert(char.class, "x"));
        assertThrows(ConversionException.class, () -> convert(Character.class, "xy"));
    }

    @Test
    void quoting() {
        assertTrue(converters.find(String.class).orElseThrow().requiresQuotes());
        assertFalse(converters.find(int.class).orElseThrow().requiresQuotes());
        assertFalse(converters.find(boolean.class).orElseThrow().requiresQuotes());
    }

    @Test
    void enums() {
        assertEquals(Mode.READ_ONLY, convert(Mode.class, "READ_ONLY"));
        assertEquals(Mode.READ_WRITE, convert(Mode.class, "read_write"));
        assertEquals("READ_WRITE", converters.find(Mode.class).orElseThrow().toConfValue(Mode.READ_WRITE));
        assertThrows(ConversionException.class, () -> convert(Mode.class, "append"));
    }

    @Test
    void enumsFollowNamingPolicy() {
        converters = ValueConverters.builtIn(NamingPolicy.KEBAB_CASE);
        assertEquals(Mode.READ_ONLY, convert(Mode.class, "read-only"));
        assertEquals("read-write", converters.find(Mode.class).orElseThrow().toConfValue(Mode.READ_WRITE));
    }

    @Test
    void unsupportedTypes() {
        assertFalse(converters.supports(Duration.class));
        assertTrue(converters.find(Duration.class).isEmpty());
    }

    @Test
    void withAddsConverterToCopy() {
        var extended = converters.with(Duration.class, ValueConverter.of(Duration::parse, Duration::toString, false));
        assertTrue(extended.supports(Duration.class));
        assertFalse(converters.supports(Duration.class));
        assertEquals(Duration.ofSeconds(30), extended.find(Duration.class).orElseThrow().fromConfValue("PT30S"));
    }
}
