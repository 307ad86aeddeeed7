package NFAReduce.Reduction;

import NFAReduce.Model.ReducibleNFA;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

public class Reachability {
    /**
     * Breadth first search from the initial state, ignoring symbols.
     * Reads the current transition function only, so it can be called right after transitions were overwritten.
     * @param nfa - automaton, not modified
     * @return - states reachable from the initial state, the initial state included
     */
    public static IntSortedSet reachable(ReducibleNFA<?> nfa) {
        final int init = nfa.getInitialState();
        if (!nfa.isState(init)) {
            throw new IllegalStateException("initial state " + init + " is not a state of the automaton");
        }
        final IntSortedSet reachable = new IntRBTreeSet();
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        reachable.add(init);
        queue.enqueue(init);
        while (!queue.isEmpty()) {
            final int q = queue.dequeueInt();
            for (int t : nfa.successors(q)) {
                if (reachable.add(t)) {
                    queue.enqueue(t);
                }
            }
        }
        return reachable;
    }

    /**
     * Delete every state the initial state cannot reach.
     * @return - the deleted states
     */
    public static IntSortedSet removeUnreachable(ReducibleNFA<?> nfa) {
        final IntSortedSet reachable = reachable(nfa);
        final IntSortedSet dead = new IntRBTreeSet(nfa.getStates());
        dead.removeAll(reachable);
        nfa.removeStates(dead);
        return dead;
    }
}
