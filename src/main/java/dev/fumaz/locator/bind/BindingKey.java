package dev.fumaz.locator.bind;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Identifies a binding by type and optional {@link Qualifier}.
 * <p>
 * The canonical form is {@code <type name>:<qualifier value>}, with an empty suffix for
 * the default binding.
 */
public final class BindingKey {

    private final @NotNull TypeKey<?> type;
    private final @Nullable Qualifier qualifier;
    private final @NotNull String canonical;

    private BindingKey(@NotNull TypeKey<?> type, @Nullable Qualifier qualifier) {
        this.type = type;
        this.qualifier = qualifier;
        this.canonical = type.getName() + ":" + (qualifier == null ? "" : qualifier.getValue());
    }

    public static @NotNull BindingKey of(@NotNull TypeKey<?> type, @Nullable Qualifier qualifier) {
        return new BindingKey(Objects.requireNonNull(type, "type"), qualifier);
    }

    public static @NotNull BindingKey of(@NotNull Class<?> type, @Nullable Qualifier qualifier) {
        return of(TypeKey.of(type), qualifier);
    }

    public @NotNull TypeKey<?> getType() {
        return type;
    }

    public @Nullable Qualifier getQualifier() {
        return qualifier;
    }

    public boolean isDefault() {
        return qualifier == null;
    }

    public @NotNull String canonical() {
        return canonical;
    }

    public @NotNull String describe() {
        return "type " + type.getName() + ", qualifier " + (qualifier == null ? "default" : qualifier.getValue());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (!(o instanceof BindingKey)) {
            return false;
        }

        BindingKey that = (BindingKey) o;
        return canonical.equals(that.canonical);
    }

    @Override
    public int hashCode() {
        return canonical.hashCode();
    }

    @Override
    public String toString() {
        return canonical;
    }

}
