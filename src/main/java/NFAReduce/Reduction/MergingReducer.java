package NFAReduce.Reduction;

import NFAReduce.ConfigurationException;
import NFAReduce.Model.MergeMapping;
import NFAReduce.Model.ReducibleNFA;
import NFAReduce.Model.StateFrequencies;
import NFAReduce.ReductionOrchestrator;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;

/**
 * Merges low-traffic states into a neighbour with nearly the same packet frequency.
 * There is no error bound for this reduction.
 */
public class MergingReducer {
    public static final double DEFAULT_THRESHOLD = 0.995;
    public static final double DEFAULT_MAX_FREQUENCY_RATIO = 0.1;

    /**
     * Merging reduction, in place.
     * <p>
     * A state p takes part if it is neither initial nor final, its frequency is non-zero, and
     * freq(p) / (maxFrequencyRatio * maximal frequency) does not exceed maxFrequencyRatio.
     * Each such p is paired with every non-final successor q != p whose similarity min/max of both
     * frequencies is above the threshold. Pairs are closed transitively and each cluster collapses to one state.
     * @param nfa - automaton to reduce
     * @param freq - packet frequencies, non-empty
     * @param threshold - similarity threshold, in [0,1]
     * @param maxFrequencyRatio - max frequency of a state allowed to be merged, in [0,1]
     * @return - the number of merged (removed) states
     */
    public static <I> int merge(ReducibleNFA<I> nfa, StateFrequencies freq, double threshold, double maxFrequencyRatio) {
        if (freq == null || freq.isEmpty()) {
            throw new ConfigurationException("packet frequency not provided");
        }
        if (!(threshold >= 0 && threshold <= 1)) {
            throw new ConfigurationException("invalid threshold value: " + threshold);
        }
        if (!(maxFrequencyRatio >= 0 && maxFrequencyRatio <= 1)) {
            throw new ConfigurationException("invalid max frequency ratio value: " + maxFrequencyRatio);
        }

        final MergeMapping mapping = candidates(nfa, freq, threshold, maxFrequencyRatio);
        for (Int2ObjectMap.Entry<IntList> cluster : mapping.clusters().int2ObjectEntrySet()) {
            if (cluster.getValue().size() < 2) {
                throw new IllegalStateException("merge cluster of state " + cluster.getIntKey() + " has a single member");
            }
        }

        final Int2IntSortedMap flat = mapping.toMap();
        if (!flat.isEmpty()) {
            nfa.mergeStates(flat);
        }

        // also runs when nothing merged: states unreachable in the input go too
        final IntSortedSet dead = Reachability.removeUnreachable(nfa);
        if (ReductionOrchestrator.DEBUG) {
            System.out.println("DEBUG: merged " + flat.size() + " states in " + mapping.clusters().size()
                + " clusters, removed " + dead.size() + " unreachable");
        }
        return flat.size();
    }

    /**
     * Breadth first search collecting mergeable (p, q) pairs into a union-find.
     */
    static MergeMapping candidates(ReducibleNFA<?> nfa, StateFrequencies freq, double threshold, double maxFrequencyRatio) {
        final double maxAbs = maxFrequencyRatio * freq.max();
        final int init = nfa.getInitialState();
        final Int2ObjectSortedMap<IntSortedSet> succ = nfa.succ();

        final MergeMapping mapping = new MergeMapping();
        final IntSet visited = new IntOpenHashSet();
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        visited.add(init);
        queue.enqueue(init);
        while (!queue.isEmpty()) {
            final int p = queue.dequeueInt();
            if (p != init && isLowTraffic(nfa, p, freq, maxAbs, maxFrequencyRatio)) {
                final long freqP = freq.get(p);
                for (int q : succ.get(p)) {
                    if (q == p || q == init || nfa.isFinal(q)) {
                        continue;
                    }
                    final long freqQ = freq.get(q);
                    final double d = (double) Math.min(freqP, freqQ) / Math.max(freqP, freqQ);
                    if (d > threshold) {
                        mapping.union(p, q);
                    }
                }
            }
            for (int q : succ.get(p)) {
                if (visited.add(q)) {
                    queue.enqueue(q);
                }
            }
        }
        return mapping;
    }

    private static boolean isLowTraffic(ReducibleNFA<?> nfa, int p, StateFrequencies freq, double maxAbs, double maxFrequencyRatio) {
        if (nfa.isFinal(p) || maxAbs == 0) {
            return false;
        }
        final long freqP = freq.get(p);
        return freqP != 0 && freqP / maxAbs <= maxFrequencyRatio;
    }
}
