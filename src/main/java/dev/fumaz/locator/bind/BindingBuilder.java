package dev.fumaz.locator.bind;

import dev.fumaz.locator.factory.Factory;
import dev.fumaz.locator.factory.InstanceFactory;
import dev.fumaz.locator.factory.Producer;
import dev.fumaz.locator.factory.PrototypeFactory;
import dev.fumaz.locator.factory.SingletonFactory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A {@link BindingBuilder} registers one binding in a {@link BindingRegistry}.
 * <pre>{@code
 * bind(Repository.class).named("backup").toSingleton(parameters -> new FileRepository());
 * }</pre>
 *
 * @param <T> the bound type
 */
public class BindingBuilder<T> {

    private final @NotNull TypeKey<T> type;
    private final @NotNull BindingRegistry registry;

    private @Nullable Qualifier qualifier;

    public BindingBuilder(@NotNull TypeKey<T> type, @NotNull BindingRegistry registry) {
        this.type = Objects.requireNonNull(type, "type");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public BindingBuilder<T> named(@NotNull String name) {
        qualifier = Qualifier.of(name);
        return this;
    }

    public BindingBuilder<T> qualifiedBy(@Nullable Qualifier qualifier) {
        this.qualifier = qualifier;
        return this;
    }

    public BindingKey toFactory(@NotNull Producer<? extends T> producer) {
        return register(new PrototypeFactory<>(producer));
    }

    public BindingKey toSupplier(@NotNull Supplier<? extends T> supplier) {
        Objects.requireNonNull(supplier, "supplier");

        return toFactory(parameters -> supplier.get());
    }

    public BindingKey toSingleton(@NotNull Producer<? extends T> producer) {
        return register(new SingletonFactory<>(key(), producer));
    }

    public BindingKey toInstance(@NotNull T instance) {
        return register(new InstanceFactory<>(instance));
    }

    public @NotNull BindingKey key() {
        return BindingKey.of(type, qualifier);
    }

    private BindingKey register(@NotNull Factory<? extends T> factory) {
        BindingKey key = key();
        registry.put(key, factory);

        return key;
    }

}
