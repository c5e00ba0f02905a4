package dev.fumaz.locator.provider;

import org.jetbrains.annotations.NotNull;

/**
 * A {@link Provider} defers resolution of a binding until {@link #get()} is called.
 * <p>
 * Each call resolves again: factory bindings produce a fresh value, singleton bindings
 * return their cached one. Providers can be used to break construction cycles.
 *
 * @param <T> the type of the provided value
 */
@FunctionalInterface
public interface Provider<T> {

    @NotNull T get();

}
