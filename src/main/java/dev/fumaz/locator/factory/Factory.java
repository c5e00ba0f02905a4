package dev.fumaz.locator.factory;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link Factory} is the registered capability to produce values of one binding.
 *
 * @param <T> the type of the produced value
 */
@FunctionalInterface
public interface Factory<T> {

    static <T> @NotNull Factory<T> prototype(@NotNull Producer<? extends T> producer) {
        return new PrototypeFactory<>(producer);
    }

    static <T> @NotNull Factory<T> instance(@NotNull T instance) {
        return new InstanceFactory<>(instance);
    }

    @Nullable T create(@NotNull Parameters parameters);

    default @Nullable T create() {
        return create(Parameters.absent());
    }

}
