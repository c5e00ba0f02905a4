package dev.fumaz.locator.exception;

import dev.fumaz.locator.bind.BindingKey;
import org.jetbrains.annotations.NotNull;

/**
 * Thrown when a singleton is requested again while its own producer is still running.
 * Use a {@link dev.fumaz.locator.provider.Provider} to defer one side of the cycle.
 */
public class CircularDependencyException extends LocatorException {

    private final @NotNull BindingKey key;

    public CircularDependencyException(@NotNull BindingKey key) {
        super("Dependency cycle detected while constructing singleton for " + key.describe());
        this.key = key;
    }

    public @NotNull BindingKey getKey() {
        return key;
    }
}
