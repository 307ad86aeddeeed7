package NFAReduce.Evaluation;

import NFAReduce.ReductionException;

/**
 * Evaluation of a test sample failed; the aggregate result is unusable.
 */
public class EvaluationException extends ReductionException {
    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
