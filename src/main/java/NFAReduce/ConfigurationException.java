package NFAReduce;

/**
 * Invalid reduction parameters. Raised before the automaton is touched.
 */
public class ConfigurationException extends ReductionException {
    public ConfigurationException(String message) {
        super(message);
    }
}
