package express.mvp.managed;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup table resolving the {@link Teardown} capability of a resource type.
 *
 * <p>Use this when the resource type is only known as a {@link Class} at the call site, or when a
 * third-party type has a release method that is not {@code close()}. Types implementing {@link
 * AutoCloseable} resolve to a teardown calling {@code close()} without registration.
 *
 * <h2>Resolution Order</h2>
 *
 * <ol>
 *   <li>A teardown registered for the exact class
 *   <li>A teardown registered for the nearest superclass
 *   <li>A teardown registered for an implemented interface (breadth first)
 *   <li>{@code close()} if the type is {@link AutoCloseable}
 * </ol>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * TeardownRegistry registry = new TeardownRegistry()
 *     .register(ExecutorService.class, ExecutorService::shutdownNow);
 *
 * Managed<ExecutorService> executor =
 *     Managed.from(ExecutorService.class, () -> Executors.newSingleThreadExecutor(), registry);
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 *
 * <p>Registration and lookup may happen concurrently.
 */
public final class TeardownRegistry {

    /** Fallback for {@link AutoCloseable} types without a registration. */
    private static final Teardown<Object> CLOSE = value -> AutoCloseable.class.cast(value).close();

    /** Registered teardowns keyed by resource type, each accepting any instance of its key. */
    private final Map<Class<?>, Teardown<Object>> teardowns = new ConcurrentHashMap<>();

    /** Creates an empty registry. */
    public TeardownRegistry() {
        // AutoCloseable types resolve without registration
    }

    /**
     * Registers the teardown for a resource type, replacing any previous registration.
     *
     * @param type the resource type
     * @param teardown the teardown applied to values of {@code type} and its subtypes
     * @param <T> the resource type
     * @return this registry
     */
    public <T> TeardownRegistry register(Class<T> type, Teardown<? super T> teardown) {
        teardowns.put(
                Objects.requireNonNull(type, "type"),
                forType(type, Objects.requireNonNull(teardown, "teardown")));
        return this;
    }

    /**
     * Removes the teardown registered for exactly this type.
     *
     * @param type the resource type
     * @return true if a registration was removed
     */
    public boolean remove(Class<?> type) {
        return teardowns.remove(type) != null;
    }

    /**
     * Checks whether a teardown can be resolved for the type.
     *
     * @param type the resource type
     * @return true if {@link #lookup(Class)} would succeed
     */
    public boolean supports(Class<?> type) {
        return find(type) != null || AutoCloseable.class.isAssignableFrom(type);
    }

    /**
     * Resolves the teardown for a resource type.
     *
     * @param type the resource type
     * @param <T> the resource type
     * @return the teardown for {@code type}
     * @throws IllegalArgumentException if no teardown is registered and the type is not {@link
     *     AutoCloseable}
     */
    public <T> Teardown<? super T> lookup(Class<T> type) {
        Objects.requireNonNull(type, "type");
        Teardown<Object> found = find(type);
        if (found != null) {
            return found;
        }
        if (AutoCloseable.class.isAssignableFrom(type)) {
            return CLOSE;
        }
        throw new IllegalArgumentException("No teardown registered for " + type.getName());
    }

    private static <T> Teardown<Object> forType(Class<T> type, Teardown<? super T> teardown) {
        return value -> teardown.teardown(type.cast(value));
    }

    private Teardown<Object> find(Class<?> type) {
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            Teardown<Object> teardown = teardowns.get(c);
            if (teardown != null) {
                return teardown;
            }
        }

        Deque<Class<?>> queue = new ArrayDeque<>();
        Set<Class<?>> seen = new HashSet<>();
        for (Class<?> c = type; c != null; c = c.getSuperclass()) {
            for (Class<?> i : c.getInterfaces()) {
                queue.add(i);
            }
        }
        while (!queue.isEmpty()) {
            Class<?> i = queue.poll();
            if (!seen.add(i)) {
                continue;
            }
            Teardown<Object> teardown = teardowns.get(i);
            if (teardown != null) {
                return teardown;
            }
            for (Class<?> parent : i.getInterfaces()) {
                queue.add(parent);
            }
        }
        return null;
    }
}
