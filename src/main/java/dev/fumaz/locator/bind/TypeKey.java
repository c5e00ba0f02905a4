package dev.fumaz.locator.bind;

import dev.fumaz.locator.util.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.lang.reflect.Array;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.Objects;

/**
 * A {@link TypeKey} is the explicit identity of a bound type.
 * <p>
 * Plain classes are keyed with {@link #of(Class)}. Generic types are keyed by subclassing:
 * <pre>{@code
 * TypeKey<List<String>> names = new TypeKey<List<String>>() {};
 * }</pre>
 * Two keys are equal when their names are equal. Names use the source form of the type,
 * so {@code TypeKey.of(String[].class)} and {@code new TypeKey<String[]>() {}} are the same key.
 *
 * @param <T> the type being identified
 */
public class TypeKey<T> {

    private final @NotNull Class<? super T> rawType;
    private final @NotNull String name;

    private TypeKey(@NotNull Class<? super T> rawType, @NotNull String name) {
        this.rawType = rawType;
        this.name = name;
    }

    @SuppressWarnings("unchecked")
    protected TypeKey() {
        Type superclass = getClass().getGenericSuperclass();

        if (!(superclass instanceof ParameterizedType)) {
            throw new IllegalStateException("TypeKey must be created with a type argument, e.g. new TypeKey<List<String>>() {}");
        }

        Type argument = ((ParameterizedType) superclass).getActualTypeArguments()[0];
        this.rawType = (Class<? super T>) rawTypeOf(argument);
        this.name = argument.getTypeName();
    }

    public static <T> @NotNull TypeKey<T> of(@NotNull Class<T> type) {
        Objects.requireNonNull(type, "type");

        Class<T> boxed = Types.box(type);
        return new TypeKey<>(boxed, boxed.getTypeName());
    }

    public @NotNull Class<? super T> getRawType() {
        return rawType;
    }

    public @NotNull String getName() {
        return name;
    }

    public boolean isInstance(@Nullable Object value) {
        return rawType.isInstance(value);
    }

    /**
     * Casts a produced value to this type. Only the raw type is checked.
     *
     * @throws ClassCastException if the value is not an instance of the raw type
     */
    @SuppressWarnings("unchecked")
    public T cast(@Nullable Object value) {
        return (T) rawType.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof TypeKey)) {
            return false;
        }

        TypeKey<?> that = (TypeKey<?>) o;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }

    private static Class<?> rawTypeOf(Type type) {
        if (type instanceof Class) {
            return Types.box((Class<?>) type);
        }

        if (type instanceof ParameterizedType) {
            return (Class<?>) ((ParameterizedType) type).getRawType();
        }

        if (type instanceof GenericArrayType) {
            Class<?> component = rawTypeOf(((GenericArrayType) type).getGenericComponentType());
            return Array.newInstance(component, 0).getClass();
        }

        throw new IllegalArgumentException("Cannot key unresolved type " + type.getTypeName());
    }

}
