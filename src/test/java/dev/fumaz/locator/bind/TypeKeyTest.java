package dev.fumaz.locator.bind;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TypeKeyTest {

    @Test
    void classKeysCompareByName() {
        assertEquals(TypeKey.of(String.class), TypeKey.of(String.class));
        assertEquals("java.lang.String", TypeKey.of(String.class).getName());
        assertNotEquals(TypeKey.of(String.class), TypeKey.of(CharSequence.class));
    }

    @Test
    void primitiveClassesShareIdentityWithTheirWrappers() {
        assertEquals(TypeKey.of(Integer.class), TypeKey.of(int.class),
                "int and Integer should be the same binding type");
        assertSame(Integer.class, TypeKey.of(int.class).getRawType());
    }

    @Test
    void genericTokenCarriesFullTypeName() {
        TypeKey<List<String>> names = new TypeKey<List<String>>() {
        };

        assertEquals("java.util.List<java.lang.String>", names.getName());
        assertSame(List.class, names.getRawType());
        assertNotEquals(TypeKey.of(List.class), names, "raw and parameterized lists are distinct identities");
        assertEquals(new TypeKey<List<String>>() {
        }, names, "tokens created separately should still be equal");
    }

    @Test
    void arrayClassesAndTokensShareIdentity() {
        assertEquals(TypeKey.of(String[].class), new TypeKey<String[]>() {
        });
        assertEquals("java.lang.String[]", TypeKey.of(String[].class).getName());

        assertEquals(TypeKey.of(int[].class), new TypeKey<int[]>() {
        });
        assertEquals("int[]", TypeKey.of(int[].class).getName());
        assertSame(int[].class, TypeKey.of(int[].class).getRawType());
        assertNotEquals(TypeKey.of(int[].class), TypeKey.of(Integer[].class));
    }

    @Test
    void nestedGenericTokensAreDistinguished() {
        TypeKey<Map<String, Integer>> first = new TypeKey<Map<String, Integer>>() {
        };
        TypeKey<Map<String, Long>> second = new TypeKey<Map<String, Long>>() {
        };

        assertNotEquals(first, second);
    }

    @Test
    @SuppressWarnings("rawtypes")
    void tokenWithoutTypeArgumentIsRejected() {
        assertThrows(IllegalStateException.class, () -> new TypeKey() {
        });
    }

    @Test
    void castChecksRawType() {
        TypeKey<Number> numbers = TypeKey.of(Number.class);

        assertTrue(numbers.isInstance(42));
        assertEquals(42, numbers.cast(42));
        assertThrows(ClassCastException.class, () -> numbers.cast("forty-two"));
    }
}
