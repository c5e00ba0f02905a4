package dev.fumaz.locator.module;

import dev.fumaz.locator.bind.BindingKey;
import dev.fumaz.locator.bind.BindingRegistry;
import dev.fumaz.locator.bind.Qualifier;
import dev.fumaz.locator.bind.TypeKey;
import dev.fumaz.locator.factory.Parameters;
import dev.fumaz.locator.provider.Provider;
import dev.fumaz.locator.resolve.RegistryResolver;
import dev.fumaz.locator.resolve.Resolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A {@link Module} is an immutable set of bindings, optionally composed from parent modules.
 * <p>
 * The bindings are built on first use by replaying, in order, the declarations of every
 * parent followed by the module's own declaration. Later declarations override earlier
 * ones with the same type and qualifier. Every module replays the declarations itself, so
 * modules never share singletons or see each other's bindings unless one is a parent of
 * the other.
 * <pre>{@code
 * Module core = Module.create(builder -> {
 *     builder.factory(Repository.class, parameters -> new Repository());
 *     builder.singleton(Counter.class, parameters -> new Counter());
 * });
 *
 * Module app = Module.create(Set.of(core), builder -> {
 *     builder.factory(UseCase.class, parameters ->
 *             new UseCase(builder.instance(Repository.class), parameters.get(String.class)));
 * });
 *
 * UseCase useCase = app.instance(UseCase.class, "exampleId");
 * }</pre>
 */
public final class Module implements Resolver {

    private static final Logger LOGGER = Logger.getLogger(Module.class.getName());

    private final @NotNull List<ModuleDeclaration> declarations;
    private final Object lock = new Object();
    private volatile @NotNull ModuleState state = ModuleState.UNBUILT;
    private volatile @Nullable RegistryResolver resolver;

    private Module(@NotNull List<ModuleDeclaration> declarations) {
        this.declarations = Collections.unmodifiableList(declarations);
    }

    public static @NotNull Module create(@NotNull ModuleDeclaration declaration) {
        return create(Collections.emptyList(), declaration);
    }

    /**
     * Creates a module that includes the bindings of {@code parents}, in iteration order,
     * followed by the bindings of {@code declaration}.
     */
    public static @NotNull Module create(@NotNull Collection<Module> parents, @NotNull ModuleDeclaration declaration) {
        Objects.requireNonNull(parents, "parents");
        Objects.requireNonNull(declaration, "declaration");

        List<ModuleDeclaration> declarations = new ArrayList<>();

        for (Module parent : parents) {
            declarations.addAll(Objects.requireNonNull(parent, "parent").declarations);
        }

        declarations.add(declaration);

        return new Module(declarations);
    }

    @Override
    public <T> @NotNull T resolve(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Parameters parameters) {
        return resolver().resolve(type, qualifier, parameters);
    }

    @Override
    public <T> @NotNull Provider<T> createProvider(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Parameters parameters) {
        return resolver().createProvider(type, qualifier, parameters);
    }

    @Override
    public boolean isBound(@NotNull TypeKey<?> type, @Nullable Qualifier qualifier) {
        return resolver().isBound(type, qualifier);
    }

    public @NotNull List<BindingKey> getBindingKeys() {
        return resolver().getRegistry().keys();
    }

    public @NotNull List<ModuleDeclaration> getDeclarations() {
        return declarations;
    }

    public @NotNull ModuleState getState() {
        return state;
    }

    private @NotNull RegistryResolver resolver() {
        RegistryResolver local = resolver;

        if (local != null) {
            return local;
        }

        synchronized (lock) {
            local = resolver;

            if (local != null) {
                return local;
            }

            // the lock is reentrant, so a declaration resolving its own module ends up here
            if (state == ModuleState.BUILDING) {
                throw new IllegalStateException("Module cannot be resolved while its declarations are running");
            }

            state = ModuleState.BUILDING;

            try {
                local = new RegistryResolver(build());
            } catch (RuntimeException | Error e) {
                state = ModuleState.UNBUILT;
                LOGGER.log(Level.WARNING, "Failed to build module", e);
                throw e;
            }

            resolver = local;
            state = ModuleState.BUILT;

            return local;
        }
    }

    private @NotNull BindingRegistry build() {
        BindingRegistry merged = new BindingRegistry();

        for (ModuleDeclaration declaration : declarations) {
            ModuleBuilder builder = new ModuleBuilder(merged);
            declaration.declare(builder);
            merged = builder.complete();
        }

        merged.seal();

        int size = merged.size();
        LOGGER.fine(() -> "Built module from " + declarations.size() + " declarations with " + size + " bindings");

        return merged;
    }

    @Override
    public String toString() {
        return "Module(" + declarations.size() + " declarations, " + state.name().toLowerCase(Locale.ROOT) + ")";
    }

}
