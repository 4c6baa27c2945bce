package express.mvp.managed;

/**
 * Produces the value of a resource when a {@link Managed} is built.
 *
 * <p>The action runs once per {@link Managed#build()}, never while chaining. A checked exception
 * thrown here reaches the caller wrapped in {@link ManagedException}.
 *
 * @param <T> the type of the produced value
 */
@FunctionalInterface
public interface SetupAction<T> {

    /**
     * Sets up the resource.
     *
     * @return the resource value
     * @throws Exception if setup fails
     */
    T setup() throws Exception;
}
