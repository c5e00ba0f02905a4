package dev.fumaz.locator.factory;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * An {@link InstanceFactory} always returns the same pre-built value and ignores parameters.
 *
 * @param <T> the type of the value
 */
public class InstanceFactory<T> implements Factory<T> {

    private final @NotNull T instance;

    public InstanceFactory(@NotNull T instance) {
        this.instance = Objects.requireNonNull(instance, "instance");
    }

    @Override
    public @NotNull T create(@NotNull Parameters parameters) {
        return instance;
    }

}
