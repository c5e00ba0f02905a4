package dev.fumaz.locator.benchmark;

import dev.fumaz.locator.module.Module;
import dev.fumaz.locator.provider.Provider;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Level;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.RunnerException;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Fork(1)
public class ModuleBenchmark {

    public static void main(String[] args) throws RunnerException {
        Options options = new OptionsBuilder()
                .include(ModuleBenchmark.class.getSimpleName())
                .build();

        new Runner(options).run();
    }

    @State(Scope.Benchmark)
    public static class LocatorState {

        Module core;
        Module app;
        Provider<CompositeService> compositeProvider;

        @Setup(Level.Trial)
        public void setUp() {
            core = Module.create(builder -> {
                builder.factory(HeavyComputation.class, parameters -> new HeavyComputation());
                builder.singleton(SingletonService.class,
                        parameters -> new SingletonService(builder.instance(HeavyComputation.class)));
                builder.factory(ExpensiveDependency.class,
                        parameters -> new ExpensiveDependency(builder.instance(HeavyComputation.class)));
            });

            app = Module.create(Collections.singleton(core), builder -> {
                builder.factory(TransientService.class,
                        parameters -> new TransientService(builder.instance(ExpensiveDependency.class)));
                builder.factory(CompositeService.class, parameters -> new CompositeService(
                        builder.instance(SingletonService.class),
                        builder.instance(TransientService.class),
                        builder.instance(ExpensiveDependency.class)));
            });

            compositeProvider = app.providerOf(CompositeService.class);
        }
    }

    @Benchmark
    public Object resolveSingleton(LocatorState state) {
        return state.app.instance(SingletonService.class);
    }

    @Benchmark
    public Object resolveCompositeGraph(LocatorState state) {
        return state.app.instance(CompositeService.class);
    }

    @Benchmark
    public Object resolveThroughProvider(LocatorState state) {
        return state.compositeProvider.get();
    }

    @Benchmark
    public Object buildModule(LocatorState state) {
        Module fresh = Module.create(Collections.singleton(state.app), builder -> {
        });

        return fresh.instance(CompositeService.class);
    }

    @Benchmark
    public void unresolvedBindingLookup(LocatorState state, Blackhole blackhole) {
        try {
            blackhole.consume(state.app.instance(UnboundType.class));
        } catch (RuntimeException exception) {
            blackhole.consume(exception);
        }
    }

    public static class SingletonService {
        private final HeavyComputation heavyComputation;

        public SingletonService(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int compute() {
            return heavyComputation.compute();
        }
    }

    public static class TransientService {
        private final ExpensiveDependency dependency;

        public TransientService(ExpensiveDependency dependency) {
            this.dependency = dependency;
        }

        public int compute() {
            return dependency.value();
        }
    }

    public static class CompositeService {
        private final SingletonService singletonService;
        private final TransientService transientService;
        private final ExpensiveDependency expensiveDependency;

        public CompositeService(SingletonService singletonService,
                                TransientService transientService,
                                ExpensiveDependency expensiveDependency) {
            this.singletonService = singletonService;
            this.transientService = transientService;
            this.expensiveDependency = expensiveDependency;
        }

        public int aggregate() {
            return singletonService.compute() + transientService.compute() + expensiveDependency.value();
        }
    }

    public static class ExpensiveDependency {
        private final HeavyComputation heavyComputation;

        public ExpensiveDependency(HeavyComputation heavyComputation) {
            this.heavyComputation = heavyComputation;
        }

        public int value() {
            return heavyComputation.compute();
        }
    }

    public static class HeavyComputation {
        public int compute() {
            int result = 0;
            for (int i = 0; i < 16; i++) {
                result = (result * 31) ^ i;
            }
            return result;
        }
    }

    public static class UnboundType {
    }
}
