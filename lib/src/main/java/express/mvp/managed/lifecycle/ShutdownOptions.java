package express.mvp.managed.lifecycle;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;

/**
 * Configuration for {@link express.mvp.managed.Managed#useUntilShutdown(ShutdownOptions)}.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Shutdown Options</caption>
 *   <tr><th>Parameter</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>onSetupFailure</td><td>rethrow</td><td>Receives a failure thrown while building</td></tr>
 *   <tr><td>onTeardownFailure</td><td>rethrow</td><td>Receives a failure of the deferred teardown</td></tr>
 *   <tr><td>hookRegistrar</td><td>{@link ShutdownHookRegistry#jvm()}</td><td>Where the teardown is registered</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ShutdownOptions options = ShutdownOptions.builder()
 *     .onSetupFailure(failure -> LOGGER.log(Level.SEVERE, "Startup failed", failure))
 *     .onTeardownFailure(failure -> LOGGER.log(Level.WARNING, "Teardown failed", failure))
 *     .build();
 *
 * server.useUntilShutdown(options);
 * }</pre>
 */
public final class ShutdownOptions {

    private static final ShutdownOptions DEFAULTS = builder().build();

    /** Handler for failures while building. */
    private final FailureHandler onSetupFailure;

    /** Handler for failures of the deferred teardown. */
    private final FailureHandler onTeardownFailure;

    /** Receives the deferred teardown. */
    private final ShutdownHookRegistrar hookRegistrar;

    private ShutdownOptions(Builder builder) {
        this.onSetupFailure = builder.onSetupFailure;
        this.onTeardownFailure = builder.onTeardownFailure;
        this.hookRegistrar = builder.hookRegistrar;
    }

    /**
     * Returns options that rethrow every failure and register with the JVM shutdown hook.
     *
     * @return the default options
     */
    public static ShutdownOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Creates a new builder with default values.
     *
     * @return a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the handler for failures while building.
     *
     * @return the setup failure handler (never null)
     */
    public FailureHandler onSetupFailure() {
        return onSetupFailure;
    }

    /**
     * Returns the handler for failures of the deferred teardown.
     *
     * @return the teardown failure handler (never null)
     */
    public FailureHandler onTeardownFailure() {
        return onTeardownFailure;
    }

    /**
     * Returns the registrar receiving the deferred teardown.
     *
     * @return the hook registrar (never null)
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "The registrar is shared process state, not a copy of the options.")
    public ShutdownHookRegistrar hookRegistrar() {
        return hookRegistrar;
    }

    @Override
    public String toString() {
        return "ShutdownOptions{"
                + "onSetupFailure="
                + onSetupFailure
                + ", onTeardownFailure="
                + onTeardownFailure
                + ", hookRegistrar="
                + hookRegistrar
                + '}';
    }

    /** Builder for {@link ShutdownOptions}. */
    public static final class Builder {
        private FailureHandler onSetupFailure = FailureHandler.rethrow();
        private FailureHandler onTeardownFailure = FailureHandler.rethrow();
        private ShutdownHookRegistrar hookRegistrar = ShutdownHookRegistry.jvm();

        private Builder() {}

        /**
         * Sets the handler for failures while building.
         *
         * @param handler the handler
         * @return this builder
         */
        public Builder onSetupFailure(FailureHandler handler) {
            this.onSetupFailure = Objects.requireNonNull(handler, "onSetupFailure");
            return this;
        }

        /**
         * Sets the handler for failures of the deferred teardown.
         *
         * @param handler the handler
         * @return this builder
         */
        public Builder onTeardownFailure(FailureHandler handler) {
            this.onTeardownFailure = Objects.requireNonNull(handler, "onTeardownFailure");
            return this;
        }

        /**
         * Sets the registrar receiving the deferred teardown.
         *
         * @param registrar the registrar
         * @return this builder
         */
        @SuppressFBWarnings(
                value = "EI_EXPOSE_REP2",
                justification = "The registrar is shared process state, not a copy of the options.")
        public Builder hookRegistrar(ShutdownHookRegistrar registrar) {
            this.hookRegistrar = Objects.requireNonNull(registrar, "hookRegistrar");
            return this;
        }

        /**
         * Builds the options.
         *
         * @return the configured options
         */
        public ShutdownOptions build() {
            return new ShutdownOptions(this);
        }
    }
}
