package express.mvp.managed;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Exception wrapping two failures that occurred while tearing down one composite resource.
 *
 * <p>When a resource built by {@link Managed#flatMap} is torn down, the downstream link is
 * released first and the upstream link second. Both are always attempted. If both fail, neither
 * failure is dropped: the downstream failure becomes the {@linkplain #getOuter() outer} cause and
 * the upstream failure the {@linkplain #getInner() inner} cause.
 *
 * <h2>Nesting</h2>
 *
 * <p>Either cause may itself be a {@code TeardownDoubleException}, so a chain of any length can
 * report every teardown failure. For a chain {@code a -> b -> c} where all three teardowns fail:
 *
 * <pre>
 * TeardownDoubleException
 *   outer: TeardownDoubleException(outer = c, inner = b)
 *   inner: a
 * </pre>
 *
 * <p>{@link #getFailures()} flattens the tree in teardown order: {@code [c, b, a]}.
 *
 * <p>The stack trace of this exception is the outer failure's stack trace and {@link #getCause()}
 * returns the outer failure.
 */
public class TeardownDoubleException extends ManagedException {

    private static final long serialVersionUID = 1L;

    /** Failure of the link torn down first (the downstream one). */
    private final Throwable outer;

    /** Failure of the link torn down second (the upstream one). */
    private final Throwable inner;

    /**
     * Creates an exception wrapping two teardown failures.
     *
     * @param outer the failure of the link torn down first
     * @param inner the failure of the link torn down second
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "Causes are kept for diagnostics and cannot be safely copied.")
    public TeardownDoubleException(Throwable outer, Throwable inner) {
        super(
                "Double exception while tearing down composite resource: "
                        + Objects.requireNonNull(outer, "outer").getMessage()
                        + ", "
                        + Objects.requireNonNull(inner, "inner").getMessage(),
                outer);
        this.outer = outer;
        this.inner = inner;
        setStackTrace(outer.getStackTrace());
    }

    /**
     * Returns the failure of the link that was torn down first.
     *
     * @return the outer failure
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Causes are exposed for diagnostics and cannot be safely copied.")
    public Throwable getOuter() {
        return outer;
    }

    /**
     * Returns the failure of the link that was torn down second.
     *
     * @return the inner failure
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "Causes are exposed for diagnostics and cannot be safely copied.")
    public Throwable getInner() {
        return inner;
    }

    /**
     * Returns every teardown failure wrapped by this exception, nested ones included, in the order
     * the teardowns were attempted.
     *
     * @return an unmodifiable list of the leaf failures
     */
    public List<Throwable> getFailures() {
        List<Throwable> failures = new ArrayList<>();
        collect(this, failures);
        return Collections.unmodifiableList(failures);
    }

    private static void collect(Throwable t, List<Throwable> into) {
        if (t instanceof TeardownDoubleException) {
            TeardownDoubleException d = (TeardownDoubleException) t;
            collect(d.outer, into);
            collect(d.inner, into);
        } else {
            into.add(t);
        }
    }
}
