package express.mvp.managed;

/**
 * Unchecked exception thrown when resource setup or teardown fails with a checked exception.
 *
 * <p>Setup and teardown callbacks ({@link SetupAction}, {@link Teardown}, {@link Effect}) may throw
 * checked exceptions, while {@link Resource} and {@link Managed} methods do not declare any. Checked
 * failures are therefore wrapped in this exception, with the original failure as its cause.
 * Unchecked exceptions and errors are never wrapped; they propagate as the same instance.
 *
 * <h2>Error Recovery</h2>
 *
 * <p>By the time this exception reaches the caller of {@link Managed#build()} or {@link
 * Managed#use}, every resource that had been set up in the failing chain has already been torn
 * down. Failures of those compensating teardowns are attached as {@linkplain
 * Throwable#getSuppressed() suppressed} exceptions.
 *
 * @see TeardownDoubleException
 */
public class ManagedException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * Constructs a new exception with the specified message.
     *
     * @param message the detail message describing the failure
     */
    public ManagedException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified message and cause.
     *
     * @param message the detail message describing the failure
     * @param cause the underlying cause of the failure
     */
    public ManagedException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs a new exception with the specified cause.
     *
     * @param cause the underlying cause of the failure
     */
    public ManagedException(Throwable cause) {
        super(cause);
    }
}
