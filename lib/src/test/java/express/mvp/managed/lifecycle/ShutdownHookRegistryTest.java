package express.mvp.managed.lifecycle;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link ShutdownHookRegistry}. */
@DisplayName("ShutdownHookRegistry")
class ShutdownHookRegistryTest {

    private ShutdownHookRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ShutdownHookRegistry();
    }

    @Nested
    @DisplayName("Registration")
    class RegistrationTests {

        @Test
        @DisplayName("Starts empty and not run")
        void startsEmpty() {
            assertEquals(0, registry.size());
            assertFalse(registry.hasRun());
        }

        @Test
        @DisplayName("Registered hooks do not run until runHooks")
        void hooks_doNotRunImmediately() {
            AtomicInteger runs = new AtomicInteger();
            registry.register(runs::incrementAndGet);

            assertEquals(1, registry.size());
            assertEquals(0, runs.get());
        }

        @Test
        @DisplayName("Null hooks are rejected")
        void nullHook_rejected() {
            assertThrows(NullPointerException.class, () -> registry.register(null));
        }

        @Test
        @DisplayName("Registration after the hooks ran is rejected")
        void registrationAfterRun_rejected() {
            registry.runHooks();

            assertThrows(IllegalStateException.class, () -> registry.register(() -> {}));
        }

        @Test
        @DisplayName("The JVM registry is a singleton")
        void jvmRegistry_isSingleton() {
            assertSame(ShutdownHookRegistry.jvm(), ShutdownHookRegistry.jvm());
        }
    }

    @Nested
    @DisplayName("Running hooks")
    class RunningTests {

        @Test
        @DisplayName("Hooks run in registration order")
        void hooks_runInRegistrationOrder() {
            List<Integer> order = new ArrayList<>();
            registry.register(() -> order.add(1));
            registry.register(() -> order.add(2));
            registry.register(() -> order.add(3));

            registry.runHooks();

            assertEquals(List.of(1, 2, 3), order);
            assertTrue(registry.hasRun());
        }

        @Test
        @DisplayName("Hooks run only once")
        void hooks_runOnce() {
            AtomicInteger runs = new AtomicInteger();
            registry.register(runs::incrementAndGet);

            registry.runHooks();
            registry.runHooks();

            assertEquals(1, runs.get());
        }

        @Test
        @DisplayName("A failing hook does not stop later hooks")
        void failingHook_doesNotStopOthers() {
            List<String> order = new ArrayList<>();
            registry.register(() -> order.add("first"));
            registry.register(
                    () -> {
                        throw new IllegalStateException("hook failed");
                    });
            registry.register(() -> order.add("third"));

            assertDoesNotThrow(registry::runHooks);

            assertEquals(List.of("first", "third"), order);
        }

        @Test
        @DisplayName("A hook throwing an Error does not stop later hooks")
        void errorHook_doesNotStopOthers() {
            List<String> order = new ArrayList<>();
            registry.register(
                    () -> {
                        throw new AssertionError("hook failed");
                    });
            registry.register(() -> order.add("second"));

            assertDoesNotThrow(registry::runHooks);

            assertEquals(List.of("second"), order);
        }
    }
}
