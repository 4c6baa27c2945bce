package express.mvp.managed.lifecycle;

/**
 * Registers callbacks to run once when the process is asked to terminate.
 *
 * <p>{@link express.mvp.managed.Managed#useUntilShutdown useUntilShutdown} hands the teardown of
 * the built resource to a registrar instead of running it. {@link ShutdownHookRegistry#jvm()} is
 * the registrar backed by a JVM shutdown hook; tests and embedding runtimes supply their own.
 *
 * @see ShutdownHookRegistry
 */
@FunctionalInterface
public interface ShutdownHookRegistrar {

    /**
     * Registers a callback to run once at process termination.
     *
     * @param hook the callback
     */
    void register(Runnable hook);
}
