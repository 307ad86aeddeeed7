package NFAReduce.Reduction;

import NFAReduce.ConfigurationException;
import NFAReduce.InfeasibleReductionException;
import NFAReduce.Model.ReducibleNFA;
import NFAReduce.Model.StateFrequencies;
import NFAReduce.ReductionOrchestrator;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.Int2LongMap;
import it.unimi.dsi.fastutil.ints.Int2LongOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntArrays;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Frequency guided pruning. Two policies:
 * <ul>
 *   <li>collapse ({@link #prune}): low-frequency states become absorbing final states; states this cuts off are
 *   deleted and their frequency is reported as an upper bound on the introduced error.</li>
 *   <li>fold ({@link #fold}): low-frequency states are merged into a final state they lead to.</li>
 * </ul>
 */
public class PruningReducer {

    /**
     * Collapse policy. Mutates the automaton in place.
     * @param nfa - automaton to reduce
     * @param ratio - fraction of the original state count to keep, in (0,1)
     * @param freq - packet frequency of every non-initial state
     * @return - error mass: sum of frequencies of all deleted states
     * @throws ConfigurationException if the ratio leaves at most one state
     * @throws InfeasibleReductionException if all candidates are used up before reaching the target
     */
    public static <I> long prune(ReducibleNFA<I> nfa, double ratio, StateFrequencies freq) {
        checkRatio(ratio);
        final int origCount = nfa.size();
        final int target = targetCount(ratio, origCount);
        if (target <= 1) {
            throw new ConfigurationException("reduction ratio " + ratio + " leaves " + target
                + " of " + origCount + " states; at least 2 are required");
        }

        // ranking reads every frequency, so missing entries fail before anything is modified
        final Int2LongMap f = frequenciesOf(nfa, freq);
        final int[] ranked = rankForCollapse(nfa, f);

        long error = 0;
        for (int dead : Reachability.removeUnreachable(nfa)) {
            error += f.get(dead);
        }

        int i = 0;
        while (nfa.size() > target) {
            if (i == ranked.length) {
                throw new InfeasibleReductionException(nfa.size(), target);
            }
            final long band = f.get(ranked[i]);
            int collapsed = 0;
            while (i < ranked.length && f.get(ranked[i]) == band) {
                final int q = ranked[i++];
                if (nfa.isState(q)) {
                    nfa.setFinal(q, true);
                    nfa.selfLoop(q);
                    collapsed++;
                }
            }
            final IntSortedSet dead = Reachability.removeUnreachable(nfa);
            for (int s : dead) {
                error += f.get(s);
            }
            if (ReductionOrchestrator.DEBUG) {
                System.out.println("DEBUG: frequency " + band + ": collapsed " + collapsed + ", removed "
                    + dead.size() + ", " + nfa.size() + " states left, error mass " + error);
            }
        }
        return error;
    }

    /**
     * Fold policy. Keeps the most frequent non-final states and merges each of the others into a final state
     * reachable from it (the shallowest one). A state that reaches no final state is deleted.
     * Mutates the automaton in place.
     * @param nfa - automaton to reduce
     * @param ratio - fraction of the original state count to keep, in (0,1)
     * @param freq - packet frequency of every non-final, non-initial state
     * @return - number of eliminated states
     * @throws ConfigurationException if the ratio leaves at most one non-final state to keep
     */
    public static <I> int fold(ReducibleNFA<I> nfa, double ratio, StateFrequencies freq) {
        checkRatio(ratio);
        final int origCount = nfa.size();
        final int keep = targetCount(ratio, origCount) - nfa.getFinalStates().size() - 1;
        if (keep <= 1) {
            throw new ConfigurationException("reduction ratio " + ratio + " leaves " + keep
                + " non-final states to keep (" + origCount + " states, " + nfa.getFinalStates().size()
                + " final); at least 2 are required");
        }

        final Int2IntSortedMap depth = nfa.stateDepth();
        final int[] ranked = rankForFold(nfa, freq, depth);

        // invert final -> predecessors into predecessor -> shallowest final
        final Int2IntMap targetFinal = new Int2IntOpenHashMap();
        for (Int2ObjectMap.Entry<IntSortedSet> e : nfa.finPred().int2ObjectEntrySet()) {
            final int fin = e.getIntKey();
            for (int p : e.getValue()) {
                if (!targetFinal.containsKey(p) || depthOf(depth, fin) < depthOf(depth, targetFinal.get(p))) {
                    targetFinal.put(p, fin);
                }
            }
        }

        final Int2IntMap mapping = new Int2IntRBTreeMap();
        final IntList orphans = new IntArrayList();
        for (int k = keep; k < ranked.length; k++) {
            final int s = ranked[k];
            if (targetFinal.containsKey(s)) {
                mapping.put(s, targetFinal.get(s));
            } else {
                orphans.add(s);
            }
        }

        nfa.mergeStates(mapping);
        nfa.removeStates(orphans);
        final IntSortedSet dead = Reachability.removeUnreachable(nfa);
        if (ReductionOrchestrator.DEBUG) {
            System.out.println("DEBUG: folded " + mapping.size() + ", removed " + orphans.size()
                + " without final successor, " + dead.size() + " unreachable");
        }
        return origCount - nfa.size();
    }

    static int targetCount(double ratio, int stateCount) {
        // half-to-even rounding
        return (int) Math.rint(ratio * stateCount);
    }

    /**
     * Non-initial states, ascending by frequency; ties go deeper states first, unreachable ones before all.
     */
    static int[] rankForCollapse(ReducibleNFA<?> nfa, Int2LongMap f) {
        final Int2IntSortedMap depth = nfa.stateDepth();
        final int[] ranked = nonInitial(nfa, false);
        IntArrays.quickSort(ranked, (x, y) -> {
            int c = Long.compare(f.get(x), f.get(y));
            if (c == 0) {
                c = Integer.compare(depthOf(depth, y), depthOf(depth, x));
            }
            return c != 0 ? c : Integer.compare(x, y);
        });
        return ranked;
    }

    /**
     * Non-final, non-initial states, descending by frequency; ties go shallower states first.
     */
    static int[] rankForFold(ReducibleNFA<?> nfa, StateFrequencies freq, Int2IntSortedMap depth) {
        final int[] ranked = nonInitial(nfa, true);
        final Int2LongMap f = new Int2LongOpenHashMap();
        for (int s : ranked) {
            f.put(s, freq.get(s));
        }
        IntArrays.quickSort(ranked, (x, y) -> {
            int c = Long.compare(f.get(y), f.get(x));
            if (c == 0) {
                c = Integer.compare(depthOf(depth, x), depthOf(depth, y));
            }
            return c != 0 ? c : Integer.compare(x, y);
        });
        return ranked;
    }

    private static Int2LongMap frequenciesOf(ReducibleNFA<?> nfa, StateFrequencies freq) {
        final Int2LongMap f = new Int2LongOpenHashMap();
        for (int s : nfa.getStates()) {
            if (s != nfa.getInitialState()) {
                f.put(s, freq.get(s));
            }
        }
        return f;
    }

    private static int[] nonInitial(ReducibleNFA<?> nfa, boolean skipFinals) {
        final IntList states = new IntArrayList();
        for (int s : nfa.getStates()) {
            if (s != nfa.getInitialState() && !(skipFinals && nfa.isFinal(s))) {
                states.add(s);
            }
        }
        return states.toIntArray();
    }

    private static int depthOf(Int2IntSortedMap depth, int state) {
        return depth.containsKey(state) ? depth.get(state) : Integer.MAX_VALUE;
    }

    private static void checkRatio(double ratio) {
        if (!(ratio > 0 && ratio < 1)) {
            throw new ConfigurationException("invalid reduction ratio " + ratio + ", should be in range (0,1)");
        }
    }
}
