package dev.fumaz.locator.factory;

import dev.fumaz.locator.exception.ParameterException;
import dev.fumaz.locator.util.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The ordered construction parameters handed to a {@link Producer}.
 * <p>
 * Parameters are <em>absent</em> when the caller resolved without passing any, which is
 * different from an explicitly empty list.
 */
public final class Parameters {

    private static final Parameters ABSENT = new Parameters(null);

    private final @Nullable Object[] values;

    private Parameters(@Nullable Object[] values) {
        this.values = values;
    }

    public static @NotNull Parameters absent() {
        return ABSENT;
    }

    public static @NotNull Parameters of(@Nullable Object... values) {
        if (values == null) {
            return ABSENT;
        }

        return new Parameters(values.clone());
    }

    public boolean isAbsent() {
        return values == null;
    }

    public boolean isEmpty() {
        return values == null || values.length == 0;
    }

    public int size() {
        return values == null ? 0 : values.length;
    }

    /**
     * Returns the parameter at {@code index}.
     *
     * @throws ParameterException if no parameters were supplied, the index is out of range,
     *                            or the value is not an instance of {@code type}
     */
    public <T> T get(int index, @NotNull Class<T> type) {
        Object[] supplied = require();

        if (index < 0 || index >= supplied.length) {
            throw new ParameterException("Index " + index + " is out of bounds for " + supplied.length + " parameters");
        }

        Object value = supplied[index];
        Class<T> boxed = Types.box(type);

        if (!boxed.isInstance(value)) {
            throw new ParameterException("Parameter at index " + index + " is of type " + Types.describe(value)
                    + ", expected " + type.getName());
        }

        return boxed.cast(value);
    }

    /**
     * Returns the first parameter that is an instance of {@code type}.
     *
     * @throws ParameterException if no parameters were supplied or none matches
     */
    public <T> T get(@NotNull Class<T> type) {
        Object[] supplied = require();
        Class<T> boxed = Types.box(type);

        for (Object value : supplied) {
            if (boxed.isInstance(value)) {
                return boxed.cast(value);
            }
        }

        throw new ParameterException("No parameter of type " + type.getName() + " found among " + supplied.length + " parameters");
    }

    public <T> T first(@NotNull Class<T> type) {
        return get(type);
    }

    public @NotNull List<Object> asList() {
        if (values == null) {
            return Collections.emptyList();
        }

        return Collections.unmodifiableList(Arrays.asList(values));
    }

    @Override
    public String toString() {
        return values == null ? "Parameters(absent)" : "Parameters" + Arrays.toString(values);
    }

    private Object[] require() {
        if (values == null) {
            throw new ParameterException("No parameters were supplied");
        }

        return values;
    }

}
