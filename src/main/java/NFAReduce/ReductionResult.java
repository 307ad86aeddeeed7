package NFAReduce;

/**
 * Statistics of one reduction. Fields that do not apply to the mode are -1.
 */
public record ReductionResult(ReductionMode mode, int originalStates, int reducedStates, long errorMass, int mergedStates) {

    @Override
    public String toString() {
        return "Reduction: " + reducedStates + "/" + originalStates + " " + (100 * reducedStates / originalStates) + "%";
    }
}
