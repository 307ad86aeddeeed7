package NFAReduce;

import NFAReduce.Model.ReducibleNFA;
import NFAReduce.Model.StateFrequencies;
import it.unimi.dsi.fastutil.ints.Int2LongMap;
import it.unimi.dsi.fastutil.ints.Int2LongOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

public class FrequencyCounter {
    /**
     * Label states with packet frequencies.
     * Every state touched while reading a sample (initial state included) counts once for that sample.
     * @param nfa - automaton, not modified
     * @param samples - training samples
     * @return - frequency of every state of the automaton, 0 for states never touched
     */
    public static <I> StateFrequencies count(ReducibleNFA<I> nfa, Iterable<? extends Iterable<I>> samples) {
        final Int2LongMap counts = new Int2LongOpenHashMap();
        for (Iterable<I> sample : samples) {
            final IntSet visited = new IntOpenHashSet();
            IntSortedSet current = new IntRBTreeSet();
            current.add(nfa.getInitialState());
            visited.addAll(current);
            for (I symbol : sample) {
                final IntSortedSet next = new IntRBTreeSet();
                for (int q : current) {
                    next.addAll(nfa.getTransitions(q, symbol));
                }
                if (next.isEmpty()) {
                    break;
                }
                visited.addAll(next);
                current = next;
            }
            for (int q : visited) {
                counts.put(q, counts.get(q) + 1);
            }
        }

        final StateFrequencies freq = new StateFrequencies();
        for (int s : nfa.getStates()) {
            freq.put(s, counts.get(s));
        }
        return freq;
    }
}
