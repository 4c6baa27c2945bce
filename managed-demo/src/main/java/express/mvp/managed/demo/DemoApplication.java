package express.mvp.managed.demo;

import express.mvp.managed.Managed;
import express.mvp.managed.lifecycle.FailureHandler;
import express.mvp.managed.lifecycle.ShutdownOptions;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts a health check server and an API server as one {@link Managed} stack and keeps them
 * running until the JVM is asked to stop.
 *
 * <h2>Startup and Shutdown Order</h2>
 *
 * <pre>
 * setup:    log ─▶ settings ─▶ HealthCheckServer ─▶ ApiServer ─▶ markReady ─▶ log
 * teardown:        markUnready ─▶ ApiServer.close ─▶ HealthCheckServer.stop ─▶ log
 * </pre>
 *
 * <h2>Shutdown Logging</h2>
 *
 * <p>The teardown runs inside a JVM shutdown hook. {@link java.util.logging.LogManager} resets its
 * handlers from a shutdown hook of its own, and the JVM starts shutdown hooks in no particular
 * order, so the teardown log lines ("Finished teardown", "Stopped ApiServer") may be missing from
 * the output when the process exits. The teardown itself still runs. Tests that build the stack
 * directly see every line.
 *
 * <p>Usage: {@code java -jar managed-demo.jar [healthCheckPort [apiPort]]}
 */
public final class DemoApplication {

    private static final Logger LOGGER = Logger.getLogger(DemoApplication.class.getName());

    private DemoApplication() {
        // Entry point only
    }

    /**
     * Describes the server stack. Nothing starts until the result is built.
     *
     * @param settings host and ports for both servers
     * @return the stack, yielding the API server
     */
    public static Managed<ApiServer> server(DemoSettings settings) {
        return Managed.eval(
                        () -> LOGGER.info("Starting setup..."),
                        () -> LOGGER.info("Finished teardown"))
                .flatMap(ignored -> Managed.setup(() -> settings))
                .flatMap(DemoApplication::servers);
    }

    private static Managed<ApiServer> servers(DemoSettings settings) {
        return Managed.of(() -> HealthCheckServer.start(settings), HealthCheckServer::stop)
                .flatMap(
                        healthCheck ->
                                Managed.from(() -> ApiServer.start(settings))
                                        .flatMap(api -> ready(healthCheck).map(ignored -> api)));
    }

    // marks the health check ready once the API is up, and unready before the API goes down
    private static Managed<Void> ready(HealthCheckServer healthCheck) {
        return Managed.eval(healthCheck::markReady, healthCheck::markUnready)
                .flatMap(
                        ignored -> Managed.evalSetup(() -> LOGGER.info("Startup is finished!")));
    }

    /**
     * Parses settings from {@code [healthCheckPort [apiPort]]}.
     *
     * @param args command line arguments
     * @return the settings
     * @throws IllegalArgumentException if a port is not a valid number
     */
    static DemoSettings parseSettings(String[] args) {
        DemoSettings.Builder builder = DemoSettings.builder();
        try {
            if (args.length > 0) {
                builder.healthCheckPort(Integer.parseInt(args[0]));
            }
            if (args.length > 1) {
                builder.apiPort(Integer.parseInt(args[1]));
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Ports must be numbers: " + String.join(" ", args), e);
        }
        return builder.build();
    }

    public static void main(String[] args) {
        DemoSettings settings = parseSettings(args);
        LOGGER.info(() -> "Using " + settings);

        server(settings)
                .useUntilShutdown(
                        ShutdownOptions.builder()
                                .onSetupFailure(
                                        failure -> {
                                            LOGGER.log(Level.SEVERE, "Startup failed", failure);
                                            FailureHandler.rethrow().handle(failure);
                                        })
                                .onTeardownFailure(
                                        failure ->
                                                LOGGER.log(
                                                        Level.WARNING, "Teardown failed", failure))
                                .build());
    }
}
