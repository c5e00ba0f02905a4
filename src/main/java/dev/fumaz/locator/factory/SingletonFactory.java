package dev.fumaz.locator.factory;

import dev.fumaz.locator.bind.BindingKey;
import dev.fumaz.locator.exception.BindingNotFoundException;
import dev.fumaz.locator.exception.CircularDependencyException;
import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * A {@link SingletonFactory} runs its producer at most once and hands out the cached value afterwards.
 * <p>
 * Parameters only reach the producer on the call that constructs the value; later calls ignore them.
 * If the producer throws, nothing is cached and the next call constructs again.
 *
 * @param <T> the type of the produced value
 */
public class SingletonFactory<T> implements Factory<T> {

    private static final Logger LOGGER = Logger.getLogger(SingletonFactory.class.getName());
    private static final VarHandle INSTANCE_HANDLE;

    static {
        try {
            INSTANCE_HANDLE = MethodHandles.lookup().findVarHandle(SingletonFactory.class, "instance", Object.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final @NotNull BindingKey key;
    private final @NotNull Producer<? extends T> producer;
    private final Object lock = new Object();
    private T instance;
    private boolean constructing;

    public SingletonFactory(@NotNull BindingKey key, @NotNull Producer<? extends T> producer) {
        this.key = Objects.requireNonNull(key, "key");
        this.producer = Objects.requireNonNull(producer, "producer");
    }

    @Override
    public @NotNull T create(@NotNull Parameters parameters) {
        T local = getInitializedInstance();

        if (local != null) {
            return local;
        }

        synchronized (lock) {
            local = getInitializedInstance();

            if (local != null) {
                return local;
            }

            // the lock is reentrant, so only the constructing thread can get here
            if (constructing) {
                throw new CircularDependencyException(key);
            }

            constructing = true;

            try {
                local = producer.produce(parameters);
            } finally {
                constructing = false;
            }

            validate(local);
            publish(local);
            LOGGER.finer(() -> "Constructed singleton for " + key.describe());

            return local;
        }
    }

    public boolean isInitialized() {
        return getInitializedInstance() != null;
    }

    public @NotNull BindingKey getKey() {
        return key;
    }

    @SuppressWarnings("unchecked")
    private T getInitializedInstance() {
        return (T) INSTANCE_HANDLE.getAcquire(this);
    }

    private void publish(T value) {
        INSTANCE_HANDLE.setRelease(this, value);
    }

    private void validate(T candidate) {
        if (candidate != null) {
            return;
        }

        throw new BindingNotFoundException(key, "singleton producer returned null");
    }

}
