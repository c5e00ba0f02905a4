package dev.fumaz.locator.factory;

import dev.fumaz.locator.bind.BindingKey;
import dev.fumaz.locator.exception.BindingNotFoundException;
import dev.fumaz.locator.exception.CircularDependencyException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SingletonFactoryTest {

    private static final BindingKey KEY = BindingKey.of(Object.class, null);

    @Test
    void producerRunsOnceAndValueIsCached() {
        AtomicInteger invocations = new AtomicInteger();
        SingletonFactory<Object> factory = new SingletonFactory<>(KEY, parameters -> {
            invocations.incrementAndGet();
            return new Object();
        });

        assertFalse(factory.isInitialized());

        Object first = factory.create();
        Object second = factory.create(Parameters.of("ignored"));

        assertSame(first, second);
        assertEquals(1, invocations.get());
        assertTrue(factory.isInitialized());
    }

    @Test
    void onlyFirstCallParametersReachProducer() {
        SingletonFactory<String> factory = new SingletonFactory<>(KEY, parameters -> parameters.get(0, String.class));

        assertEquals("first", factory.create(Parameters.of("first")));
        assertEquals("first", factory.create(Parameters.of("second")));
    }

    @Test
    void failedConstructionIsNotCached() {
        AtomicInteger attempts = new AtomicInteger();
        SingletonFactory<Object> factory = new SingletonFactory<>(KEY, parameters -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("first attempt fails");
            }

            return new Object();
        });

        assertThrows(IllegalStateException.class, factory::create);
        assertFalse(factory.isInitialized());

        Object value = factory.create();
        assertSame(value, factory.create());
        assertEquals(2, attempts.get());
    }

    @Test
    void nullProductIsRejected() {
        SingletonFactory<Object> factory = new SingletonFactory<>(KEY, parameters -> null);

        assertThrows(BindingNotFoundException.class, factory::create);
    }

    @Test
    void reentrantConstructionIsReportedAsCycle() {
        AtomicReference<SingletonFactory<Object>> self = new AtomicReference<>();
        SingletonFactory<Object> factory = new SingletonFactory<>(KEY, parameters -> self.get().create(parameters));
        self.set(factory);

        CircularDependencyException exception = assertThrows(CircularDependencyException.class, factory::create);
        assertEquals(KEY, exception.getKey());
    }

    @Test
    void concurrentFirstAccessConstructsExactlyOnce() throws Exception {
        int threads = 16;
        AtomicInteger invocations = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        SingletonFactory<Object> factory = new SingletonFactory<>(KEY, parameters -> {
            invocations.incrementAndGet();
            sleep(20);
            return new Object();
        });

        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            List<Future<Object>> futures = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                Callable<Object> task = () -> {
                    start.await();
                    return factory.create();
                };
                futures.add(executor.submit(task));
            }

            start.countDown();

            Object expected = futures.get(0).get(5, TimeUnit.SECONDS);

            for (Future<Object> future : futures) {
                assertSame(expected, future.get(5, TimeUnit.SECONDS), "every thread should see the same instance");
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, invocations.get(), "producer should run exactly once");
    }

    @Test
    void prototypeFactoryProducesFreshValues() {
        Factory<Object> factory = Factory.prototype(parameters -> new Object());

        assertNotSame(factory.create(), factory.create());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
