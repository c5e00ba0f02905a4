package dev.fumaz.locator.module;

import dev.fumaz.locator.bind.BindingBuilder;
import dev.fumaz.locator.bind.BindingKey;
import dev.fumaz.locator.bind.BindingRegistry;
import dev.fumaz.locator.bind.Qualifier;
import dev.fumaz.locator.bind.TypeKey;
import dev.fumaz.locator.factory.Parameters;
import dev.fumaz.locator.factory.Producer;
import dev.fumaz.locator.provider.Provider;
import dev.fumaz.locator.resolve.RegistryResolver;
import dev.fumaz.locator.resolve.Resolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link ModuleBuilder} collects the bindings of one {@link ModuleDeclaration}.
 * <p>
 * The builder starts with every binding merged from earlier declarations. Lookups made
 * through it only see bindings registered before the lookup, so a binding can depend on
 * earlier ones but not on ones declared after it:
 * <pre>{@code
 * Module module = Module.create(builder -> {
 *     builder.singleton(Repository.class, parameters -> new Repository());
 *     builder.factory(UseCase.class, parameters ->
 *             new UseCase(builder.instance(Repository.class), parameters.get(String.class)));
 * });
 * }</pre>
 * Producers may keep using the builder to resolve after the declaration has finished,
 * but no further bindings can be registered.
 */
public final class ModuleBuilder implements Resolver {

    private final @NotNull BindingRegistry registry;
    private final @NotNull RegistryResolver resolver;
    private boolean completed;

    ModuleBuilder(@NotNull BindingRegistry inherited) {
        this.registry = new BindingRegistry();
        this.registry.putAll(inherited);
        this.resolver = new RegistryResolver(registry);
    }

    public <T> @NotNull BindingBuilder<T> bind(@NotNull Class<T> type) {
        return bind(TypeKey.of(type));
    }

    public <T> @NotNull BindingBuilder<T> bind(@NotNull TypeKey<T> type) {
        ensureOpen();

        return new BindingBuilder<>(type, registry);
    }

    public <T> @NotNull BindingKey factory(@NotNull Class<T> type, @NotNull Producer<? extends T> producer) {
        return bind(type).toFactory(producer);
    }

    public <T> @NotNull BindingKey factory(@NotNull Class<T> type, @Nullable Qualifier qualifier, @NotNull Producer<? extends T> producer) {
        return bind(type).qualifiedBy(qualifier).toFactory(producer);
    }

    public <T> @NotNull BindingKey factory(@NotNull TypeKey<T> type, @NotNull Producer<? extends T> producer) {
        return bind(type).toFactory(producer);
    }

    public <T> @NotNull BindingKey factory(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Producer<? extends T> producer) {
        return bind(type).qualifiedBy(qualifier).toFactory(producer);
    }

    public <T> @NotNull BindingKey singleton(@NotNull Class<T> type, @NotNull Producer<? extends T> producer) {
        return bind(type).toSingleton(producer);
    }

    public <T> @NotNull BindingKey singleton(@NotNull Class<T> type, @Nullable Qualifier qualifier, @NotNull Producer<? extends T> producer) {
        return bind(type).qualifiedBy(qualifier).toSingleton(producer);
    }

    public <T> @NotNull BindingKey singleton(@NotNull TypeKey<T> type, @NotNull Producer<? extends T> producer) {
        return bind(type).toSingleton(producer);
    }

    public <T> @NotNull BindingKey singleton(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Producer<? extends T> producer) {
        return bind(type).qualifiedBy(qualifier).toSingleton(producer);
    }

    @Override
    public <T> @NotNull T resolve(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Parameters parameters) {
        return resolver.resolve(type, qualifier, parameters);
    }

    @Override
    public <T> @NotNull Provider<T> createProvider(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Parameters parameters) {
        return resolver.createProvider(type, qualifier, parameters);
    }

    @Override
    public boolean isBound(@NotNull TypeKey<?> type, @Nullable Qualifier qualifier) {
        return resolver.isBound(type, qualifier);
    }

    public boolean isCompleted() {
        return completed;
    }

    @NotNull BindingRegistry complete() {
        completed = true;
        registry.seal();

        return registry;
    }

    private void ensureOpen() {
        if (completed) {
            throw new IllegalStateException("Bindings can only be registered while the module declaration runs");
        }
    }

    @Override
    public String toString() {
        return "ModuleBuilder(" + registry.size() + " bindings" + (completed ? ", completed" : "") + ")";
    }

}
