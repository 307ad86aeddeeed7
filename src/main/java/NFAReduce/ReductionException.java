package NFAReduce;

/**
 * Base class of the errors a reduction run reports to its caller.
 */
public class ReductionException extends RuntimeException {
    public ReductionException(String message) {
        super(message);
    }

    public ReductionException(String message, Throwable cause) {
        super(message, cause);
    }
}
