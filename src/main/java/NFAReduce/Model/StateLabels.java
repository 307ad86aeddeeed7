package NFAReduce.Model;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

/**
 * Names of states as written in an automaton file, and the state ids they were given.
 * States without a name are referred to by their id.
 */
public final class StateLabels {
    private final Object2IntMap<String> ids = new Object2IntOpenHashMap<>();
    private final Int2ObjectMap<String> labels = new Int2ObjectOpenHashMap<>();

    public StateLabels() {
        ids.defaultReturnValue(ReducibleNFA.NO_STATE);
    }

    /**
     * Labels equal to the state ids of the automaton.
     */
    public static StateLabels of(ReducibleNFA<?> nfa) {
        final StateLabels result = new StateLabels();
        for (int s : nfa.getStates()) {
            result.put(Integer.toString(s), s);
        }
        return result;
    }

    public void put(String label, int state) {
        if (ids.containsKey(label)) {
            throw new IllegalArgumentException("duplicate state label '" + label + "'");
        }
        ids.put(label, state);
        labels.put(state, label);
    }

    /**
     * @return - the state named label, or {@link ReducibleNFA#NO_STATE}
     */
    public int state(String label) {
        return ids.getInt(label);
    }

    public String label(int state) {
        final String label = labels.get(state);
        return label != null ? label : Integer.toString(state);
    }

    public int size() {
        return ids.size();
    }
}
