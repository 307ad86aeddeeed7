package NFAReduce;

/**
 * Reduction to run; exactly one per invocation.
 */
public enum ReductionMode {
    /** Pruning by folding low-frequency states into final states. */
    PRUNE("p"),
    /** Pruning by collapsing low-frequency states into absorbing final states, with an error bound. */
    FREQ_PRUNE("fp"),
    /** Merging of similar low-frequency states. */
    MERGE("m");

    private final String code;

    ReductionMode(String code) {
        this.code = code;
    }

    /**
     * Short name used in result file names.
     */
    public String getCode() {
        return code;
    }
}
