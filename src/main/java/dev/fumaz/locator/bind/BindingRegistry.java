package dev.fumaz.locator.bind;

import dev.fumaz.locator.factory.Factory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/**
 * Maps {@link BindingKey binding keys} to the {@link Factory} that serves them.
 * <p>
 * Rebinding a key replaces the previous factory. Once {@link #seal() sealed}, the key set
 * can no longer change and the registry may be read from any thread.
 */
public final class BindingRegistry {

    private static final Logger LOGGER = Logger.getLogger(BindingRegistry.class.getName());

    private final Map<BindingKey, Factory<?>> factories = new ConcurrentHashMap<>();
    private final List<BindingKey> insertionOrder = new CopyOnWriteArrayList<>();
    private volatile boolean sealed;

    public @Nullable Factory<?> put(@NotNull BindingKey key, @NotNull Factory<?> factory) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(factory, "factory");
        ensureMutable();

        Factory<?> previous = factories.put(key, factory);

        if (previous == null) {
            insertionOrder.add(key);
        } else if (previous != factory) {
            LOGGER.fine(() -> "Overriding binding for " + key.describe());
        }

        return previous;
    }

    public void putAll(@NotNull BindingRegistry other) {
        Objects.requireNonNull(other, "other");

        for (BindingKey key : other.insertionOrder) {
            put(key, other.factories.get(key));
        }
    }

    public @Nullable Factory<?> get(@NotNull BindingKey key) {
        return factories.get(key);
    }

    public boolean contains(@NotNull BindingKey key) {
        return factories.containsKey(key);
    }

    public @NotNull List<BindingKey> keys() {
        return Collections.unmodifiableList(new ArrayList<>(insertionOrder));
    }

    public int size() {
        return factories.size();
    }

    public boolean isEmpty() {
        return factories.isEmpty();
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void ensureMutable() {
        if (sealed) {
            throw new IllegalStateException("Binding registry is sealed");
        }
    }

}
