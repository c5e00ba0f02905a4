package dev.fumaz.locator.resolve;

import dev.fumaz.locator.bind.Qualifier;
import dev.fumaz.locator.bind.TypeKey;
import dev.fumaz.locator.exception.BindingNotFoundException;
import dev.fumaz.locator.factory.Parameters;
import dev.fumaz.locator.provider.Provider;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A {@link Resolver} looks up bindings by type and qualifier and produces their values.
 * <p>
 * Calls without parameters pass {@link Parameters#absent()} to the producer; calls with
 * parameters pass them in order, even when the list is empty.
 */
public interface Resolver {

    /**
     * Resolves the binding for {@code type} and {@code qualifier}.
     *
     * @throws BindingNotFoundException if nothing is bound, or the bound value does not match {@code type}
     */
    <T> @NotNull T resolve(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Parameters parameters);

    /**
     * Creates a provider that resolves the binding each time it is asked for a value.
     * The binding must already exist.
     *
     * @throws BindingNotFoundException if nothing is bound
     */
    <T> @NotNull Provider<T> createProvider(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Parameters parameters);

    boolean isBound(@NotNull TypeKey<?> type, @Nullable Qualifier qualifier);

    default <T> @NotNull T instance(@NotNull Class<T> type) {
        return resolve(TypeKey.of(type), null, Parameters.absent());
    }

    default <T> @NotNull T instance(@NotNull Class<T> type, @Nullable Qualifier qualifier) {
        return resolve(TypeKey.of(type), qualifier, Parameters.absent());
    }

    default <T> @NotNull T instance(@NotNull Class<T> type, @NotNull Object... parameters) {
        return resolve(TypeKey.of(type), null, Parameters.of(parameters));
    }

    default <T> @NotNull T instance(@NotNull Class<T> type, @Nullable Qualifier qualifier, @NotNull Object... parameters) {
        return resolve(TypeKey.of(type), qualifier, Parameters.of(parameters));
    }

    default <T> @NotNull T instance(@NotNull TypeKey<T> type) {
        return resolve(type, null, Parameters.absent());
    }

    default <T> @NotNull T instance(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier) {
        return resolve(type, qualifier, Parameters.absent());
    }

    default <T> @NotNull T instance(@NotNull TypeKey<T> type, @NotNull Object... parameters) {
        return resolve(type, null, Parameters.of(parameters));
    }

    default <T> @NotNull T instance(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Object... parameters) {
        return resolve(type, qualifier, Parameters.of(parameters));
    }

    default <T> @NotNull Provider<T> providerOf(@NotNull Class<T> type) {
        return createProvider(TypeKey.of(type), null, Parameters.absent());
    }

    default <T> @NotNull Provider<T> providerOf(@NotNull Class<T> type, @Nullable Qualifier qualifier) {
        return createProvider(TypeKey.of(type), qualifier, Parameters.absent());
    }

    default <T> @NotNull Provider<T> providerOf(@NotNull Class<T> type, @NotNull Object... parameters) {
        return createProvider(TypeKey.of(type), null, Parameters.of(parameters));
    }

    default <T> @NotNull Provider<T> providerOf(@NotNull Class<T> type, @Nullable Qualifier qualifier, @NotNull Object... parameters) {
        return createProvider(TypeKey.of(type), qualifier, Parameters.of(parameters));
    }

    default <T> @NotNull Provider<T> providerOf(@NotNull TypeKey<T> type) {
        return createProvider(type, null, Parameters.absent());
    }

    default <T> @NotNull Provider<T> providerOf(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier) {
        return createProvider(type, qualifier, Parameters.absent());
    }

    default <T> @NotNull Provider<T> providerOf(@NotNull TypeKey<T> type, @NotNull Object... parameters) {
        return createProvider(type, null, Parameters.of(parameters));
    }

    default <T> @NotNull Provider<T> providerOf(@NotNull TypeKey<T> type, @Nullable Qualifier qualifier, @NotNull Object... parameters) {
        return createProvider(type, qualifier, Parameters.of(parameters));
    }

    default boolean isBound(@NotNull Class<?> type) {
        return isBound(TypeKey.of(type), null);
    }

    default boolean isBound(@NotNull Class<?> type, @Nullable Qualifier qualifier) {
        return isBound(TypeKey.of(type), qualifier);
    }

}
