package express.mvp.managed;

import java.util.Objects;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The resource built by {@link Managed#flatMap}: owns an upstream and a downstream resource and
 * releases them in reverse setup order.
 *
 * <h2>Setup</h2>
 *
 * <pre>
 * upstream.build() ──▶ f(upstream.get()).build() ──▶ composed
 *                       │
 *                       └─ fails ──▶ upstream.teardown() ──▶ rethrow original failure
 *                                     (teardown failure added as suppressed)
 * </pre>
 *
 * <h2>Teardown</h2>
 *
 * <p>Downstream first, then upstream, and the upstream teardown is attempted even when the
 * downstream one failed:
 *
 * <ul>
 *   <li>downstream ok: the upstream outcome propagates unchanged
 *   <li>downstream fails, upstream ok: the downstream failure is rethrown
 *   <li>both fail: {@link TeardownDoubleException} with the downstream failure as outer
 * </ul>
 *
 * @param <T> the upstream value type
 * @param <U> the downstream value type
 */
final class ComposedResource<T, U> implements Resource<U> {

    private static final Logger LOGGER = Logger.getLogger(ComposedResource.class.getName());

    /** Resource set up first and torn down last. */
    private final Resource<T> upstream;

    /** Resource set up from the upstream value, torn down first. */
    private final Resource<U> downstream;

    private ComposedResource(Resource<T> upstream, Resource<U> downstream) {
        this.upstream = upstream;
        this.downstream = downstream;
    }

    /**
     * Builds the upstream resource, then the downstream one derived from its value.
     *
     * @param upstreamManaged the upstream recipe
     * @param next derives the downstream recipe from the upstream value
     * @return the composed resource owning both
     */
    static <T, U> ComposedResource<T, U> compose(
            Managed<T> upstreamManaged, Function<? super T, ? extends Managed<U>> next) {
        Resource<T> upstream = upstreamManaged.build();
        Resource<U> downstream;
        try {
            Managed<U> downstreamManaged =
                    Objects.requireNonNull(next.apply(upstream.get()), "flatMap function returned null");
            downstream = downstreamManaged.build();
        } catch (Throwable setupFailure) {
            LOGGER.log(Level.FINE, "Setup failed, tearing down upstream resource", setupFailure);
            try {
                upstream.teardown();
            } catch (Throwable teardownFailure) {
                if (teardownFailure != setupFailure) {
                    setupFailure.addSuppressed(teardownFailure);
                }
            }
            throw setupFailure;
        }
        return new ComposedResource<>(upstream, downstream);
    }

    @Override
    public U get() {
        return downstream.get();
    }

    @Override
    public void teardown() {
        try {
            downstream.teardown();
        } catch (Throwable outer) {
            try {
                upstream.teardown();
            } catch (Throwable inner) {
                LOGGER.log(Level.FINE, "Both links of a composed resource failed to tear down", inner);
                throw new TeardownDoubleException(outer, inner);
            }
            throw outer;
        }
        upstream.teardown();
    }

    @Override
    public String toString() {
        return "ComposedResource[upstream=" + upstream + ", downstream=" + downstream + "]";
    }
}
