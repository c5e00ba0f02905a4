package dev.fumaz.locator.util;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.Map;

public final class Types {

    private static final Map<Class<?>, Class<?>> WRAPPERS = new HashMap<>();

    static {
        WRAPPERS.put(boolean.class, Boolean.class);
        WRAPPERS.put(byte.class, Byte.class);
        WRAPPERS.put(char.class, Character.class);
        WRAPPERS.put(short.class, Short.class);
        WRAPPERS.put(int.class, Integer.class);
        WRAPPERS.put(long.class, Long.class);
        WRAPPERS.put(float.class, Float.class);
        WRAPPERS.put(double.class, Double.class);
        WRAPPERS.put(void.class, Void.class);
    }

    private Types() {
    }

    @SuppressWarnings("unchecked")
    public static <T> @NotNull Class<T> box(@NotNull Class<T> type) {
        if (!type.isPrimitive()) {
            return type;
        }

        return (Class<T>) WRAPPERS.get(type);
    }

    public static @NotNull String describe(@Nullable Object value) {
        return value == null ? "null" : value.getClass().getTypeName();
    }

}
