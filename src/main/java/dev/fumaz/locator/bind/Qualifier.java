package dev.fumaz.locator.bind;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * Distinguishes multiple bindings of the same type.
 * <p>
 * A missing qualifier selects the default binding, which is never matched by any
 * {@link Qualifier} value.
 */
public final class Qualifier {

    private final @NotNull String value;

    private Qualifier(@NotNull String value) {
        this.value = value;
    }

    public static @NotNull Qualifier of(@NotNull String value) {
        Objects.requireNonNull(value, "value");

        if (value.isEmpty()) {
            throw new IllegalArgumentException("Qualifier value cannot be empty");
        }

        return new Qualifier(value);
    }

    public @NotNull String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof Qualifier)) {
            return false;
        }

        Qualifier that = (Qualifier) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Qualifier(" + value + ")";
    }

}
