package express.mvp.managed.lifecycle;

import express.mvp.managed.ManagedException;

/**
 * Receives a failure raised during {@link express.mvp.managed.Managed#useUntilShutdown
 * useUntilShutdown} setup or its deferred teardown.
 *
 * <p>A handler either rethrows the failure or deals with it (for example by logging) and returns
 * normally. The default, {@link #rethrow()}, propagates it unchanged.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * FailureHandler logAndExit = failure -> {
 *     LOGGER.log(Level.SEVERE, "Startup failed", failure);
 *     System.exit(1);
 * };
 * server.useUntilShutdown(logAndExit, FailureHandler.rethrow());
 * }</pre>
 */
@FunctionalInterface
public interface FailureHandler {

    /**
     * Handles a failure.
     *
     * @param failure the failure raised by setup or teardown
     */
    void handle(Throwable failure);

    /**
     * Returns the handler that rethrows every failure.
     *
     * <p>Unchecked exceptions and errors are rethrown as the same instance; anything else is wrapped
     * in {@link ManagedException}.
     *
     * @return the rethrowing handler
     */
    static FailureHandler rethrow() {
        return FailureHandler::propagate;
    }

    /**
     * Returns a handler that ignores every failure.
     *
     * @return the ignoring handler
     */
    static FailureHandler ignore() {
        return failure -> {};
    }

    private static void propagate(Throwable failure) {
        if (failure instanceof RuntimeException) {
            throw (RuntimeException) failure;
        }
        if (failure instanceof Error) {
            throw (Error) failure;
        }
        throw new ManagedException(failure);
    }
}
