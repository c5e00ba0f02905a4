package dev.fumaz.locator.provider;

import dev.fumaz.locator.bind.BindingKey;
import dev.fumaz.locator.bind.Qualifier;
import dev.fumaz.locator.bind.TypeKey;
import dev.fumaz.locator.factory.Parameters;
import dev.fumaz.locator.resolve.Resolver;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * A {@link LazyProvider} captures a request and replays it against a {@link Resolver} on every {@link #get()}.
 *
 * @param <T> the type of the provided value
 */
public class LazyProvider<T> implements Provider<T> {

    private final @NotNull Resolver resolver;
    private final @NotNull TypeKey<T> type;
    private final @Nullable Qualifier qualifier;
    private final @NotNull Parameters parameters;

    public LazyProvider(@NotNull Resolver resolver,
                        @NotNull TypeKey<T> type,
                        @Nullable Qualifier qualifier,
                        @NotNull Parameters parameters) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.type = Objects.requireNonNull(type, "type");
        this.qualifier = qualifier;
        this.parameters = Objects.requireNonNull(parameters, "parameters");
    }

    @Override
    public @NotNull T get() {
        return resolver.resolve(type, qualifier, parameters);
    }

    public @NotNull BindingKey getKey() {
        return BindingKey.of(type, qualifier);
    }

    @Override
    public String toString() {
        return "LazyProvider(" + getKey() + ")";
    }

}
