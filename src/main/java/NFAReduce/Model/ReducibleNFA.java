package NFAReduce.Model;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import net.automatalib.alphabet.Alphabet;

/**
 * Mutable NFA with a single initial state, built for in-place reduction.
 * States are int identifiers; every state owns one (possibly empty) destination set per symbol.
 * All collections are ordered, so iteration (and everything derived from it) is deterministic.
 * <p>
 * Not thread-safe: a reducer owns the automaton exclusively for the duration of a call.
 * @param <I> - Input symbol type, e.g., Integer
 */
public class ReducibleNFA<I> {
    public static final int NO_STATE = -1;

    private final Alphabet<I> alphabet;
    private final Int2ObjectSortedMap<IntSortedSet[]> transitions = new Int2ObjectRBTreeMap<>();
    private final IntSortedSet finals = new IntRBTreeSet();
    private int initial = NO_STATE;
    private int nextId = 0;

    public ReducibleNFA(Alphabet<I> alphabet) {
        this.alphabet = alphabet;
    }

    public Alphabet<I> getInputAlphabet() {
        return alphabet;
    }

    public int addState(boolean accepting) {
        final int state = nextId++;
        transitions.put(state, emptyRow());
        if (accepting) {
            finals.add(state);
        }
        return state;
    }

    public int addInitialState(boolean accepting) {
        final int state = addState(accepting);
        setInitial(state);
        return state;
    }

    public void setInitial(int state) {
        checkState(state);
        initial = state;
    }

    public int getInitialState() {
        return initial;
    }

    public boolean isState(int state) {
        return transitions.containsKey(state);
    }

    public boolean isFinal(int state) {
        return finals.contains(state);
    }

    public void setFinal(int state, boolean accepting) {
        checkState(state);
        if (accepting) {
            finals.add(state);
        } else {
            finals.remove(state);
        }
    }

    public IntSortedSet getStates() {
        return IntSortedSets.unmodifiable(transitions.keySet());
    }

    public IntSortedSet getFinalStates() {
        return IntSortedSets.unmodifiable(finals);
    }

    public int size() {
        return transitions.size();
    }

    public void addTransition(int state, I symbol, int target) {
        checkState(target);
        row(state)[alphabet.getSymbolIndex(symbol)].add(target);
    }

    public IntSortedSet getTransitions(int state, I symbol) {
        return IntSortedSets.unmodifiable(row(state)[alphabet.getSymbolIndex(symbol)]);
    }

    /**
     * Replace every outgoing transition of the state with a self-loop over the whole alphabet.
     */
    public void selfLoop(int state) {
        final IntSortedSet[] row = row(state);
        for (int a = 0; a < row.length; a++) {
            final IntSortedSet loop = new IntRBTreeSet();
            loop.add(state);
            row[a] = loop;
        }
    }

    /**
     * Union of destination sets over all symbols.
     */
    public IntSortedSet successors(int state) {
        final IntSortedSet result = new IntRBTreeSet();
        for (IntSortedSet dest : row(state)) {
            result.addAll(dest);
        }
        return result;
    }

    public Int2ObjectSortedMap<IntSortedSet> succ() {
        final Int2ObjectSortedMap<IntSortedSet> result = new Int2ObjectRBTreeMap<>();
        for (int s : transitions.keySet()) {
            result.put(s, successors(s));
        }
        return result;
    }

    /**
     * Shortest transition count from the initial state. Unreachable states have no entry.
     */
    public Int2IntSortedMap stateDepth() {
        final Int2IntSortedMap depth = new Int2IntRBTreeMap();
        if (initial == NO_STATE) {
            return depth;
        }
        final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        depth.put(initial, 0);
        queue.enqueue(initial);
        while (!queue.isEmpty()) {
            final int q = queue.dequeueInt();
            final int d = depth.get(q);
            for (int t : successors(q)) {
                if (!depth.containsKey(t)) {
                    depth.put(t, d + 1);
                    queue.enqueue(t);
                }
            }
        }
        return depth;
    }

    /**
     * For each final state, every other state from which it can be reached.
     */
    public Int2ObjectSortedMap<IntSortedSet> finPred() {
        final Int2ObjectMap<IntSortedSet> pred = new Int2ObjectRBTreeMap<>();
        for (int s : transitions.keySet()) {
            pred.put(s, new IntRBTreeSet());
        }
        for (int s : transitions.keySet()) {
            for (int t : successors(s)) {
                pred.get(t).add(s);
            }
        }

        final Int2ObjectSortedMap<IntSortedSet> result = new Int2ObjectRBTreeMap<>();
        for (int f : finals) {
            final IntSortedSet seen = new IntRBTreeSet();
            final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
            queue.enqueue(f);
            while (!queue.isEmpty()) {
                for (int p : pred.get(queue.dequeueInt())) {
                    if (seen.add(p)) {
                        queue.enqueue(p);
                    }
                }
            }
            seen.remove(f);
            result.put(f, seen);
        }
        return result;
    }

    /**
     * Merge states in place. Each key is folded into its value: incoming transitions are redirected,
     * outgoing transitions are added to the representative, and the representative becomes final if any
     * member was. Chained mappings are normalized first, e.g. {b->a, c->b} is applied as {b->a, c->a}.
     * @param mapping - member to representative
     * @return the normalized mapping that was applied
     */
    public Int2IntSortedMap mergeStates(Int2IntMap mapping) {
        final MergeMapping normalized = new MergeMapping();
        for (Int2IntMap.Entry e : new Int2IntRBTreeMap(mapping).int2IntEntrySet()) {
            checkState(e.getIntKey());
            checkState(e.getIntValue());
            normalized.map(e.getIntKey(), e.getIntValue());
        }
        final Int2IntSortedMap flat = normalized.toMap();
        if (flat.containsKey(initial)) {
            throw new IllegalArgumentException("initial state " + initial + " cannot be merged into " + flat.get(initial));
        }
        if (flat.isEmpty()) {
            return flat;
        }

        for (int s : transitions.keySet()) {
            final IntSortedSet[] row = transitions.get(s);
            for (int a = 0; a < row.length; a++) {
                final IntSortedSet redirected = new IntRBTreeSet();
                for (int t : row[a]) {
                    redirected.add(flat.getOrDefault(t, t));
                }
                row[a] = redirected;
            }
        }
        for (Int2IntMap.Entry e : flat.int2IntEntrySet()) {
            final int member = e.getIntKey();
            final int rep = e.getIntValue();
            final IntSortedSet[] from = transitions.get(member);
            final IntSortedSet[] to = transitions.get(rep);
            for (int a = 0; a < from.length; a++) {
                to[a].addAll(from[a]);
            }
            if (finals.contains(member)) {
                finals.add(rep);
            }
        }
        for (int member : flat.keySet()) {
            finals.remove(member);
            transitions.remove(member);
        }
        return flat;
    }

    /**
     * Delete states together with every transition into them.
     */
    public void removeStates(IntCollection states) {
        if (states.isEmpty()) {
            return;
        }
        if (states.contains(initial)) {
            throw new IllegalArgumentException("initial state " + initial + " cannot be removed");
        }
        for (int s : states) {
            finals.remove(s);
            transitions.remove(s);
        }
        for (IntSortedSet[] row : transitions.values()) {
            for (IntSortedSet dest : row) {
                dest.removeAll(states);
            }
        }
    }

    public ReducibleNFA<I> copy() {
        final ReducibleNFA<I> result = new ReducibleNFA<>(alphabet);
        for (Int2ObjectMap.Entry<IntSortedSet[]> e : transitions.int2ObjectEntrySet()) {
            final IntSortedSet[] row = e.getValue();
            final IntSortedSet[] rowCopy = new IntSortedSet[row.length];
            for (int a = 0; a < row.length; a++) {
                rowCopy[a] = new IntRBTreeSet(row[a]);
            }
            result.transitions.put(e.getIntKey(), rowCopy);
        }
        result.finals.addAll(finals);
        result.initial = initial;
        result.nextId = nextId;
        return result;
    }

    /**
     * Run the word from the initial state; it matches as soon as the run touches a final state.
     */
    public boolean matches(Iterable<I> word) {
        IntSortedSet current = new IntRBTreeSet();
        current.add(initial);
        if (isFinal(initial)) {
            return true;
        }
        for (I symbol : word) {
            final int a = alphabet.getSymbolIndex(symbol);
            final IntSortedSet next = new IntRBTreeSet();
            for (int q : current) {
                next.addAll(transitions.get(q)[a]);
            }
            if (next.isEmpty()) {
                return false;
            }
            for (int q : next) {
                if (finals.contains(q)) {
                    return true;
                }
            }
            current = next;
        }
        return false;
    }

    private IntSortedSet[] emptyRow() {
        final IntSortedSet[] row = new IntSortedSet[alphabet.size()];
        for (int a = 0; a < row.length; a++) {
            row[a] = new IntRBTreeSet();
        }
        return row;
    }

    private IntSortedSet[] row(int state) {
        final IntSortedSet[] row = transitions.get(state);
        if (row == null) {
            throw new IllegalArgumentException("invalid NFA state: " + state);
        }
        return row;
    }

    private void checkState(int state) {
        if (!transitions.containsKey(state)) {
            throw new IllegalArgumentException("invalid NFA state: " + state);
        }
    }
}
