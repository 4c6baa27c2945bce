/**
 * Process lifecycle support for {@link express.mvp.managed.Managed#useUntilShutdown
 * useUntilShutdown}.
 *
 * <h2>Key Components</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.managed.lifecycle.ShutdownHookRegistrar} - Registers callbacks to run at
 *       process termination
 *   <li>{@link express.mvp.managed.lifecycle.ShutdownHookRegistry} - Runs callbacks once, in
 *       registration order, from a single JVM shutdown hook
 *   <li>{@link express.mvp.managed.lifecycle.ShutdownOptions} - Failure handlers and registrar
 *   <li>{@link express.mvp.managed.lifecycle.FailureHandler} - Receives setup and deferred teardown
 *       failures
 * </ul>
 */
package express.mvp.managed.lifecycle;
