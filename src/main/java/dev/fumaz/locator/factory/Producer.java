package dev.fumaz.locator.factory;

import org.jetbrains.annotations.NotNull;

/**
 * Builds a value from the parameters supplied at resolution time.
 *
 * @param <T> the type of the produced value
 */
@FunctionalInterface
public interface Producer<T> {

    T produce(@NotNull Parameters parameters);

}
