package express.mvp.managed;

/**
 * A side effect run during setup or teardown that produces no resource.
 *
 * <p>Used by {@link Managed#evalSetup(Effect)}, {@link Managed#evalTeardown(Effect)} and {@link
 * Managed#eval(Effect, Effect)} to interleave logging or signalling with real resources in a chain.
 */
@FunctionalInterface
public interface Effect {

    /**
     * Runs the side effect.
     *
     * @throws Exception if the effect fails
     */
    void run() throws Exception;
}
