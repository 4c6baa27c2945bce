package express.mvp.managed;

import java.util.Objects;

/**
 * A live value together with the one-shot action that releases it.
 *
 * <p>Resources are not generally created directly; see {@link Managed} instead. A resource is
 * produced by {@link Managed#build()} and must be {@linkplain #teardown() torn down} exactly once by
 * whoever built it.
 *
 * <h2>Contract</h2>
 *
 * <ul>
 *   <li>{@link #get()} may be called any number of times and has no side effects
 *   <li>{@link #teardown()} must be called exactly once; calling it again is a caller error and its
 *       effect is unspecified
 * </ul>
 *
 * @param <T> the type of the held value
 * @see Managed
 */
public interface Resource<T> {

    /**
     * Returns the held value.
     *
     * @return the value produced at setup
     */
    T get();

    /**
     * Releases the resource.
     *
     * @throws RuntimeException if releasing fails; checked failures arrive wrapped in {@link
     *     ManagedException}
     */
    void teardown();

    /**
     * Returns a resource that needs no teardown.
     *
     * @param value the value to hold, may be null
     * @param <T> the value type
     * @return a resource whose teardown does nothing
     */
    static <T> Resource<T> constant(T value) {
        return new Resource<>() {
            @Override
            public T get() {
                return value;
            }

            @Override
            public void teardown() {
                // nothing to release
            }

            @Override
            public String toString() {
                return "Resource.constant(" + value + ")";
            }
        };
    }

    /**
     * Pairs an already produced value with the action that releases it.
     *
     * @param value the value to hold
     * @param teardown the release action applied to {@code value}
     * @param <T> the value type
     * @return a resource releasing {@code value} with {@code teardown}
     */
    static <T> Resource<T> of(T value, Teardown<? super T> teardown) {
        Objects.requireNonNull(teardown, "teardown");
        return new Resource<>() {
            @Override
            public T get() {
                return value;
            }

            @Override
            public void teardown() {
                try {
                    teardown.teardown(value);
                } catch (RuntimeException | Error e) {
                    throw e;
                } catch (Exception e) {
                    throw new ManagedException("Resource teardown failed", e);
                }
            }

            @Override
            public String toString() {
                return "Resource(" + value + ")";
            }
        };
    }
}
