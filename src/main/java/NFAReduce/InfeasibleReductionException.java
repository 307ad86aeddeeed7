package NFAReduce;

/**
 * Pruning ran out of candidate states before the target state count was reached.
 * The partially reduced automaton must not be used.
 */
public class InfeasibleReductionException extends ReductionException {
    private final int reachedCount;
    private final int targetCount;

    public InfeasibleReductionException(int reachedCount, int targetCount) {
        super("no more states left but required reduction cannot be reached: "
            + reachedCount + " states remain, target is " + targetCount);
        this.reachedCount = reachedCount;
        this.targetCount = targetCount;
    }

    public int getReachedCount() {
        return reachedCount;
    }

    public int getTargetCount() {
        return targetCount;
    }
}
