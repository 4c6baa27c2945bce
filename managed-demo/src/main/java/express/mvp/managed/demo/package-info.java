/**
 * Demo application composing two HTTP servers with {@link express.mvp.managed.Managed}.
 *
 * <p>{@link express.mvp.managed.demo.DemoApplication} is the entry point.
 */
package express.mvp.managed.demo;
