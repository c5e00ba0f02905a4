package dev.fumaz.locator.factory;

import dev.fumaz.locator.exception.ParameterException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ParametersTest {

    @Test
    void absentParametersDifferFromEmptyOnes() {
        Parameters absent = Parameters.absent();
        Parameters empty = Parameters.of();

        assertTrue(absent.isAbsent());
        assertFalse(empty.isAbsent());
        assertTrue(empty.isEmpty());
        assertEquals(0, empty.size());
    }

    @Test
    void positionalLookupReturnsTypedValue() {
        Parameters parameters = Parameters.of("id", 7);

        assertEquals("id", parameters.get(0, String.class));
        assertEquals(7, parameters.get(1, Integer.class));
        assertEquals(7, parameters.get(1, int.class), "primitive lookups should match boxed values");
    }

    @Test
    void positionalLookupFailsOutOfRange() {
        Parameters parameters = Parameters.of("id");

        ParameterException exception = assertThrows(ParameterException.class, () -> parameters.get(1, String.class));
        assertTrue(exception.getMessage().contains("out of bounds"), "message should mention the range");
        assertThrows(ParameterException.class, () -> parameters.get(-1, String.class));
    }

    @Test
    void positionalLookupFailsOnWrongType() {
        Parameters parameters = Parameters.of("id", null);

        ParameterException exception = assertThrows(ParameterException.class, () -> parameters.get(0, Integer.class));
        assertTrue(exception.getMessage().contains("java.lang.String"), "message should name the actual type");
        assertThrows(ParameterException.class, () -> parameters.get(1, String.class), "null never matches a type");
    }

    @Test
    void typedLookupReturnsFirstMatch() {
        StringBuilder builder = new StringBuilder("first");
        Parameters parameters = Parameters.of(1, builder, "second");

        assertSame(builder, parameters.get(CharSequence.class));
        assertEquals("second", parameters.first(String.class));
        assertEquals(1, parameters.get(Integer.class));
    }

    @Test
    void typedLookupFailsWithoutMatch() {
        Parameters parameters = Parameters.of("id");

        assertThrows(ParameterException.class, () -> parameters.get(Long.class));
    }

    @Test
    void everyLookupFailsWhenParametersAreAbsent() {
        Parameters absent = Parameters.absent();

        assertThrows(ParameterException.class, () -> absent.get(0, String.class));
        assertThrows(ParameterException.class, () -> absent.get(String.class));
    }

    @Test
    void suppliedArrayIsCopied() {
        Object[] values = {"a", "b"};
        Parameters parameters = Parameters.of(values);
        values[0] = "changed";

        assertEquals(Arrays.asList("a", "b"), parameters.asList());
    }
}
