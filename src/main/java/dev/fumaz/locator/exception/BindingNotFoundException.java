package dev.fumaz.locator.exception;

import dev.fumaz.locator.bind.BindingKey;
import org.jetbrains.annotations.NotNull;

/**
 * Signals that no binding could satisfy a request for a type and qualifier.
 * <p>
 * Also raised when a binding produced a value that does not match the requested type.
 */
public class BindingNotFoundException extends LocatorException {

    private final @NotNull BindingKey key;

    public BindingNotFoundException(@NotNull BindingKey key) {
        super("No binding found for " + key.describe());
        this.key = key;
    }

    public BindingNotFoundException(@NotNull BindingKey key, @NotNull String detail) {
        super("No binding found for " + key.describe() + ": " + detail);
        this.key = key;
    }

    public @NotNull BindingKey getKey() {
        return key;
    }
}
