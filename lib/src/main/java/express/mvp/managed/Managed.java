package express.mvp.managed;

import express.mvp.managed.lifecycle.FailureHandler;
import express.mvp.managed.lifecycle.ShutdownOptions;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collector;
import java.util.stream.Collectors;

/**
 * A lazy, composable recipe for setting up a resource and later tearing it down.
 *
 * <p>A {@code Managed} holds no resource itself. Each {@link #build()} runs the setup and returns a
 * fresh {@link Resource}; building twice produces two independent resources. Instances are composed
 * with {@link #flatMap} and {@link #map}, which do no work until the result is built.
 *
 * <p>Once composition is complete, the resources are set up and consumed with {@link #use} or
 * {@link #useUntilShutdown()}. Both tear down everything that was set up once it is no longer
 * needed, in the opposite order from setup.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Managed<ApiServer> server =
 *     Managed.eval(() -> log.info("Starting setup"), () -> log.info("Finished teardown"))
 *         .flatMap(ignored -> Managed.setup(() -> new Settings(8080, 7070)))
 *         .flatMap(settings -> Managed.of(() -> new HealthCheckServer(settings), HealthCheckServer::stop)
 *             .flatMap(health -> Managed.from(() -> new ApiServer(settings))
 *                 .flatMap(api -> Managed.eval(health::markReady, health::markUnready)
 *                     .map(ignored -> api))));
 *
 * server.useUntilShutdown();
 * }</pre>
 *
 * <h2>Failure Handling</h2>
 *
 * <ul>
 *   <li><b>Setup:</b> if a link fails to set up, every link already set up in the chain is torn
 *       down before the original failure propagates. Failures of those teardowns are attached as
 *       suppressed exceptions.
 *   <li><b>Teardown:</b> every link is torn down even if a later link failed to. Two failures are
 *       combined into a {@link TeardownDoubleException}, nested for more.
 *   <li><b>Use:</b> teardown runs even if the consumer fails; a teardown failure is then attached
 *       to the consumer's failure as suppressed.
 * </ul>
 *
 * <p>Checked exceptions thrown by setup and teardown callbacks are wrapped in {@link
 * ManagedException}.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>A {@code Managed} is immutable and may be shared. A built {@link Resource} is not
 * synchronized; callers using one from several threads must serialize access to it.
 *
 * @param <T> the type of the managed value
 * @see Resource
 * @see Teardown
 */
@FunctionalInterface
public interface Managed<T> {

    /**
     * Builds a resource from this recipe, including every {@code Managed} previously composed with
     * it.
     *
     * <p>If this method is used instead of {@link #use}, {@link Resource#teardown()} must be called
     * explicitly when the resource is no longer needed.
     *
     * @return a freshly set up resource
     */
    Resource<T> build();

    /**
     * Builds the resource, passes its value to {@code f}, and tears it down before returning.
     *
     * <p>Teardown runs whether {@code f} returns or throws. If both fail, the failure of {@code f}
     * propagates with the teardown failure attached as suppressed.
     *
     * @param f the function consuming the value
     * @param <R> the result type
     * @return the result of {@code f}
     */
    default <R> R use(Function<? super T, ? extends R> f) {
        Objects.requireNonNull(f, "f");
        Resource<T> resource = build();
        R result;
        try {
            result = f.apply(resource.get());
        } catch (Throwable usageFailure) {
            try {
                resource.teardown();
            } catch (Throwable teardownFailure) {
                if (teardownFailure != usageFailure) {
                    usageFailure.addSuppressed(teardownFailure);
                }
            }
            throw usageFailure;
        }
        resource.teardown();
        return result;
    }

    /**
     * Same as {@link #use}, for side effects only.
     *
     * @param f the consumer of the value
     */
    default void foreach(Consumer<? super T> f) {
        Objects.requireNonNull(f, "f");
        use(
                t -> {
                    f.accept(t);
                    return null;
                });
    }

    /** Builds the resource and tears it down immediately, typically for a {@code Managed<Void>}. */
    default void run() {
        use(t -> null);
    }

    /**
     * Builds the resource and tears it down when the JVM shuts down.
     *
     * <p>Failures during setup or the deferred teardown are rethrown.
     *
     * @return true if a teardown hook was registered
     * @see #useUntilShutdown(ShutdownOptions)
     */
    default boolean useUntilShutdown() {
        return useUntilShutdown(ShutdownOptions.defaults());
    }

    /**
     * Builds the resource and tears it down when the JVM shuts down, handing failures to the given
     * handlers.
     *
     * @param onSetupFailure receives a failure thrown while building
     * @param onTeardownFailure receives a failure thrown by the deferred teardown
     * @return true if a teardown hook was registered
     * @see #useUntilShutdown(ShutdownOptions)
     */
    default boolean useUntilShutdown(
            FailureHandler onSetupFailure, FailureHandler onTeardownFailure) {
        return useUntilShutdown(
                ShutdownOptions.builder()
                        .onSetupFailure(onSetupFailure)
                        .onTeardownFailure(onTeardownFailure)
                        .build());
    }

    /**
     * Builds the resource and registers its teardown with the configured shutdown hook registrar
     * instead of running it now.
     *
     * <p>This is meant for programs that run until the process is asked to stop. No consumer is
     * invoked. If the build fails, the failure goes to {@link ShutdownOptions#onSetupFailure()}; as
     * no resource exists in that case, no hook is registered even when the handler returns
     * normally.
     *
     * <p>If the registrar rejects the hook, the resource is torn down right away and the rejection
     * propagates, with any teardown failure attached as suppressed.
     *
     * @param options failure handlers and hook registrar
     * @return true if a teardown hook was registered, false if setup failed and the failure was
     *     handled
     */
    default boolean useUntilShutdown(ShutdownOptions options) {
        Objects.requireNonNull(options, "options");
        Resource<T> resource;
        try {
            resource = build();
        } catch (Throwable setupFailure) {
            options.onSetupFailure().handle(setupFailure);
            return false;
        }

        FailureHandler onTeardownFailure = options.onTeardownFailure();
        try {
            options.hookRegistrar()
                    .register(
                            () -> {
                                try {
                                    resource.teardown();
                                } catch (Throwable teardownFailure) {
                                    onTeardownFailure.handle(teardownFailure);
                                }
                            });
        } catch (Throwable registrationFailure) {
            try {
                resource.teardown();
            } catch (Throwable teardownFailure) {
                if (teardownFailure != registrationFailure) {
                    registrationFailure.addSuppressed(teardownFailure);
                }
            }
            throw registrationFailure;
        }
        return true;
    }

    /**
     * Composes a new {@code Managed} that depends on the value managed by this one.
     *
     * <p>Nothing runs until the result is built. The resulting resource tears down the dependent
     * resource first and this one second.
     *
     * @param f derives the dependent recipe from this value
     * @param <U> the dependent value type
     * @return the composed recipe
     */
    default <U> Managed<U> flatMap(Function<? super T, ? extends Managed<U>> f) {
        Objects.requireNonNull(f, "f");
        return () -> ComposedResource.compose(this, f);
    }

    /**
     * Composes a new {@code Managed} by applying a function to the value managed by this one.
     *
     * @param f the mapping function
     * @param <U> the mapped value type
     * @return the mapped recipe
     */
    default <U> Managed<U> map(Function<? super T, ? extends U> f) {
        Objects.requireNonNull(f, "f");
        return flatMap(t -> constant(f.apply(t)));
    }

    /**
     * Creates a {@code Managed} that returns an existing resource on every build.
     *
     * @param resource the resource to wrap
     * @param <T> the value type
     * @return a recipe whose build returns {@code resource}
     */
    static <T> Managed<T> wrap(Resource<T> resource) {
        Objects.requireNonNull(resource, "resource");
        return () -> resource;
    }

    /**
     * Creates a {@code Managed} that requires neither setup nor teardown.
     *
     * @param value the value
     * @param <T> the value type
     * @return a recipe for a constant resource
     */
    static <T> Managed<T> constant(T value) {
        return wrap(Resource.constant(value));
    }

    /**
     * Creates a {@code Managed} that requires both setup and teardown.
     *
     * @param setup produces the value, run on every build
     * @param teardown releases the value
     * @param <T> the value type
     * @return the recipe
     */
    static <T> Managed<T> of(SetupAction<T> setup, Teardown<? super T> teardown) {
        Objects.requireNonNull(setup, "setup");
        Objects.requireNonNull(teardown, "teardown");
        return () -> Resource.of(runSetup(setup), teardown);
    }

    /**
     * Creates a {@code Managed} for a closeable value, torn down with {@link AutoCloseable#close()}.
     *
     * @param setup produces the value, run on every build
     * @param <T> the closeable type
     * @return the recipe
     */
    static <T extends AutoCloseable> Managed<T> from(SetupAction<T> setup) {
        return of(setup, Teardown.autoCloseable());
    }

    /**
     * Creates a {@code Managed} whose teardown is the given capability of the value type.
     *
     * @param setup produces the value, run on every build
     * @param capability the teardown capability for {@code T}
     * @param <T> the value type
     * @return the recipe
     */
    static <T> Managed<T> from(SetupAction<T> setup, Teardown<? super T> capability) {
        return of(setup, capability);
    }

    /**
     * Creates a {@code Managed} whose teardown is resolved from a registry.
     *
     * <p>The teardown is resolved now, not at build time.
     *
     * @param type the value type used for lookup
     * @param setup produces the value, run on every build
     * @param registry resolves the teardown for {@code type}
     * @param <T> the value type
     * @return the recipe
     * @throws IllegalArgumentException if the registry has no teardown for {@code type}
     */
    static <T> Managed<T> from(Class<T> type, SetupAction<T> setup, TeardownRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        return of(setup, registry.lookup(type));
    }

    /**
     * Creates a {@code Managed} that requires setup only.
     *
     * @param setup produces the value, run on every build
     * @param <T> the value type
     * @return the recipe
     */
    static <T> Managed<T> setup(SetupAction<T> setup) {
        return of(setup, Teardown.none());
    }

    /**
     * Creates a {@code Managed} for a side effect on setup only.
     *
     * @param effect run on every build
     * @return the recipe
     */
    static Managed<Void> evalSetup(Effect effect) {
        return eval(effect, () -> {});
    }

    /**
     * Creates a {@code Managed} for a side effect on teardown only.
     *
     * @param effect run on every teardown
     * @return the recipe
     */
    static Managed<Void> evalTeardown(Effect effect) {
        return eval(() -> {}, effect);
    }

    /**
     * Creates a {@code Managed} for side effects on both setup and teardown.
     *
     * @param setupEffect run on every build
     * @param teardownEffect run on every teardown
     * @return the recipe
     */
    static Managed<Void> eval(Effect setupEffect, Effect teardownEffect) {
        Objects.requireNonNull(setupEffect, "setupEffect");
        Objects.requireNonNull(teardownEffect, "teardownEffect");
        return Managed.<Void>of(
                () -> {
                    setupEffect.run();
                    return null;
                },
                ignored -> teardownEffect.run());
    }

    /**
     * Combines many recipes into one producing the list of their values.
     *
     * <p>Setup follows iteration order and teardown the reverse of it.
     *
     * @param managed the recipes to combine
     * @param <A> the element type
     * @return a recipe for the values, in iteration order
     */
    static <A> Managed<List<A>> sequence(Iterable<? extends Managed<? extends A>> managed) {
        return sequence(managed, Collectors.<A>toList());
    }

    /**
     * Combines many recipes into one whose values are gathered by a collector.
     *
     * <p>Use this to choose the shape of the result, for example {@code Collectors.toSet()} for a set
     * of recipes. Setup follows iteration order and teardown the reverse of it. The recipes are
     * read from {@code managed} now; the collector runs on every build.
     *
     * @param managed the recipes to combine
     * @param collector gathers the values
     * @param <A> the element type
     * @param <R> the result type
     * @return a recipe for the collected values
     */
    static <A, R> Managed<R> sequence(
            Iterable<? extends Managed<? extends A>> managed, Collector<? super A, ?, R> collector) {
        Objects.requireNonNull(managed, "managed");
        Objects.requireNonNull(collector, "collector");
        return fold(managed, collector);
    }

    private static <A, C, R> Managed<R> fold(
            Iterable<? extends Managed<? extends A>> managed, Collector<? super A, C, R> collector) {
        Managed<C> result = setup(() -> collector.supplier().get());
        for (Managed<? extends A> element : managed) {
            result =
                    result.flatMap(
                            container ->
                                    element.map(
                                            a -> {
                                                collector.accumulator().accept(container, a);
                                                return container;
                                            }));
        }
        return result.map(container -> collector.finisher().apply(container));
    }

    private static <T> T runSetup(SetupAction<T> setup) {
        try {
            return setup.setup();
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Exception e) {
            throw new ManagedException("Resource setup failed", e);
        }
    }
}
