package dev.fumaz.locator.factory;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;

/**
 * A {@link PrototypeFactory} invokes its producer on every call.
 *
 * @param <T> the type of the produced value
 */
public class PrototypeFactory<T> implements Factory<T> {

    private final @NotNull Producer<? extends T> producer;

    public PrototypeFactory(@NotNull Producer<? extends T> producer) {
        this.producer = Objects.requireNonNull(producer, "producer");
    }

    @Override
    public T create(@NotNull Parameters parameters) {
        return producer.produce(parameters);
    }

}
