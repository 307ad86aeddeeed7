package NFAReduce;

public class MissingFrequencyException extends ReductionException {
    private final int state;

    public MissingFrequencyException(int state) {
        super("no packet frequency for state " + state);
        this.state = state;
    }

    public int getState() {
        return state;
    }
}
