package Generator;

/**
 * Raised when a requested value cannot be produced within the recursion
 * bound or with the known generators.
 */
public class ConstructionFailedException extends Exception {

    private static final long serialVersionUID = 6542216396385254102L;

    public enum Reason {
        MAX_RECURSION,
        UNSATISFIABLE_PARAMETER,
        NO_RECEIVER,
        UNKNOWN_VARIANT,
        CONSTRUCTOR_FAILED
    }

    private final Reason reason;

    public ConstructionFailedException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ConstructionFailedException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * @return the reason of the innermost construction failure in the cause chain
     */
    public Reason getRootReason() {
        ConstructionFailedException current = this;
        while (current.getCause() instanceof ConstructionFailedException) {
            current = (ConstructionFailedException) current.getCause();
        }
        return current.reason;
    }
}
