package NFAReduce.Model;

/**
 * An automaton read from a file, with the file's state names.
 */
public record LabeledNFA(ReducibleNFA<Integer> nfa, StateLabels labels) {
}
