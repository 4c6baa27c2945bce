/**
 * Composable resource lifecycle management.
 *
 * <p>A {@link express.mvp.managed.Managed} describes how to set up a resource and how to tear it
 * down. Managed values are chained with {@code flatMap}; building the chain sets resources up in
 * order and tearing it down releases them in reverse order, even when setup, use or teardown fail.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.managed.Managed} - Lazy, composable setup/teardown recipe
 *   <li>{@link express.mvp.managed.Resource} - A built value and its release action
 *   <li>{@link express.mvp.managed.Teardown} - Release capability of a resource type
 *   <li>{@link express.mvp.managed.TeardownRegistry} - Resolves teardowns by type
 *   <li>{@link express.mvp.managed.TeardownDoubleException} - Aggregates teardown failures
 * </ul>
 *
 * @see express.mvp.managed.lifecycle.ShutdownHookRegistry
 */
package express.mvp.managed;
