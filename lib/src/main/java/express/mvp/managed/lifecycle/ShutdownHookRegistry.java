package express.mvp.managed.lifecycle;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-wide list of teardown callbacks run once at termination, in registration order.
 *
 * <p>The JVM runs its own shutdown hooks concurrently and in no particular order. This registry
 * installs a single JVM hook instead and runs its callbacks one after another on that hook's thread,
 * so independently registered {@link express.mvp.managed.Managed} stacks are torn down in the order
 * they were started. The order inside one stack is fixed by the stack itself.
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>
 * register(hook) ──▶ [installs JVM hook on first registration, for {@link #jvm()}]
 *       ⋮
 * JVM shutdown ──▶ runHooks() ──▶ hook 1, hook 2, ... hook n
 * </pre>
 *
 * <p>A callback that throws, an {@link Error} included, does not stop the remaining callbacks;
 * its failure is logged at {@code WARNING}. After the hooks have run, further registrations are
 * rejected.
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Registration may happen from any thread. Callbacks run outside the registry's lock.
 *
 * @see ShutdownHookRegistrar
 */
public final class ShutdownHookRegistry implements ShutdownHookRegistrar {

    private static final Logger LOGGER = Logger.getLogger(ShutdownHookRegistry.class.getName());

    /** Registry backed by a JVM shutdown hook. */
    private static final ShutdownHookRegistry JVM = new ShutdownHookRegistry(true);

    /** Name of the thread installed as JVM shutdown hook. */
    static final String HOOK_THREAD_NAME = "managed-shutdown";

    private final Object lock = new Object();

    /** Callbacks in registration order. Guarded by {@link #lock}. */
    private final List<Runnable> hooks = new ArrayList<>();

    /** Whether to install a JVM shutdown hook on first registration. */
    private final boolean installJvmHook;

    /** Guarded by {@link #lock}. */
    private boolean jvmHookInstalled;

    /** Guarded by {@link #lock}. */
    private boolean hooksRun;

    /**
     * Creates a registry whose hooks run only when {@link #runHooks()} is called.
     *
     * <p>Use this for embedding runtimes that manage their own termination, and in tests.
     */
    public ShutdownHookRegistry() {
        this(false);
    }

    private ShutdownHookRegistry(boolean installJvmHook) {
        this.installJvmHook = installJvmHook;
    }

    /**
     * Returns the registry whose hooks run when the JVM shuts down.
     *
     * @return the process-wide registry
     */
    public static ShutdownHookRegistry jvm() {
        return JVM;
    }

    /**
     * Registers a callback to run at termination, after all earlier registrations.
     *
     * @param hook the callback
     * @throws IllegalStateException if the hooks have already run
     */
    @Override
    public void register(Runnable hook) {
        Objects.requireNonNull(hook, "hook");
        synchronized (lock) {
            if (hooksRun) {
                throw new IllegalStateException("Shutdown hooks have already run");
            }
            if (installJvmHook && !jvmHookInstalled) {
                Runtime.getRuntime().addShutdownHook(new Thread(this::runHooks, HOOK_THREAD_NAME));
                jvmHookInstalled = true;
            }
            hooks.add(hook);
            LOGGER.fine(() -> "Registered shutdown hook #" + hooks.size());
        }
    }

    /**
     * Returns the number of registered callbacks.
     *
     * @return the callback count
     */
    public int size() {
        synchronized (lock) {
            return hooks.size();
        }
    }

    /**
     * Checks if the callbacks have run.
     *
     * @return true once {@link #runHooks()} has started
     */
    public boolean hasRun() {
        synchronized (lock) {
            return hooksRun;
        }
    }

    /**
     * Runs every registered callback once, in registration order.
     *
     * <p>Only the first call has an effect. For {@link #jvm()} this is called by the JVM shutdown
     * hook.
     */
    public void runHooks() {
        List<Runnable> toRun;
        synchronized (lock) {
            if (hooksRun) {
                return;
            }
            hooksRun = true;
            toRun = new ArrayList<>(hooks);
        }

        LOGGER.fine(() -> "Running " + toRun.size() + " shutdown hook(s)");
        for (Runnable hook : toRun) {
            try {
                hook.run();
            } catch (RuntimeException | Error e) {
                LOGGER.log(Level.WARNING, "Shutdown hook failed", e);
            }
        }
    }
}
