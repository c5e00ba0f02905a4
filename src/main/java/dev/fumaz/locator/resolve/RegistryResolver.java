package dev.fumaz.locator.resolve;

import dev.fumaz.locator.bind.BindingKey;
import dev.fumaz.locator.bind.BindingRegistry;
import dev.fumaz.locator.bind.Qualifier;
import dev.fumaz.locator.bind.TypeKey;
import dev.fumaz.locator.exception.BindingNotFoundException;
import dev.fumaz.locator.factory.Factory;
import dev.fumaz.locator.factory.Parameters;
import dev.fumaz.locator.provider.LazyProvider;
import dev.fumaz.locator.provider.Provider;
import dev.fumaz.locator.util.Types;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A {@link Resolver} backed directly by a {@link BindingRegistry}.
 * <p>
 * Lookups see the registry as it is at the time of the call, so while a module is being
 * declared only the bindings registered so far are visible.
 */
public final class RegistryResolver implements Resolver {

    private final @NotNull BindingRegistry registry;

    public RegistryResolver(@NotNull BindingRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public <T> @NotNull T resolve(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Parameters parameters) {
        Objects.requireNonNull(parameters, "parameters");

        BindingKey key = BindingKey.of(type, qualifier);
        Factory<?> factory = lookup(key);
        Object value = factory.create(parameters);

        if (value == null) {
            throw new BindingNotFoundException(key, "binding produced null");
        }

        if (!type.isInstance(value)) {
            throw new BindingNotFoundException(key, "binding produced " + Types.describe(value));
        }

        return type.cast(value);
    }

    @Override
    public <T> @NotNull Provider<T> createProvider(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Parameters parameters) {
        lookup(BindingKey.of(type, qualifier));

        return new LazyProvider<>(this, type, qualifier, parameters);
    }

    @Override
    public boolean isBound(@NotNull TypeKey<?> type, @Nullable Qualifier qualifier) {
        return registry.contains(BindingKey.of(type, qualifier));
    }

    public @NotNull BindingRegistry getRegistry() {
        return registry;
    }

    private @NotNull Factory<?> lookup(@NotNull BindingKey key) {
        Factory<?> factory = registry.get(key);

        if (factory == null) {
            throw new BindingNotFoundException(key);
        }

        return factory;
    }

}
