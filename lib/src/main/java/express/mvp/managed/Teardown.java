package express.mvp.managed;

/**
 * Describes how to release a value of type {@code T}.
 *
 * <p>A {@code Teardown} is either passed explicitly to {@link Managed#of(SetupAction, Teardown)},
 * or resolved as a capability of the resource type: {@link #autoCloseable()} covers every {@link
 * AutoCloseable}, and a {@link TeardownRegistry} maps other types to their teardown.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * Teardown<ExecutorService> shutdown = ExecutorService::shutdownNow;
 *
 * Managed<ExecutorService> executor =
 *     Managed.from(() -> Executors.newFixedThreadPool(4), shutdown);
 * }</pre>
 *
 * @param <T> the type of value released
 * @see TeardownRegistry
 */
@FunctionalInterface
public interface Teardown<T> {

    /**
     * Releases the given value.
     *
     * @param value the value to release
     * @throws Exception if releasing fails
     */
    void teardown(T value) throws Exception;

    /**
     * Returns the teardown that calls {@link AutoCloseable#close()}.
     *
     * @param <T> the closeable type
     * @return the default teardown for closeable types
     */
    static <T extends AutoCloseable> Teardown<T> autoCloseable() {
        return AutoCloseable::close;
    }

    /**
     * Returns a teardown that does nothing.
     *
     * @param <T> the value type
     * @return a no-op teardown
     */
    static <T> Teardown<T> none() {
        return value -> {};
    }
}
