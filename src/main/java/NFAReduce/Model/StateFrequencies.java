package NFAReduce.Model;

import NFAReduce.MissingFrequencyException;
import it.unimi.dsi.fastutil.ints.Int2LongMap;
import it.unimi.dsi.fastutil.ints.Int2LongRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2LongSortedMap;
import it.unimi.dsi.fastutil.ints.Int2LongSortedMaps;
import it.unimi.dsi.fastutil.ints.IntCollection;

/**
 * Packet frequency of each state, i.e., how many training samples traversed it.
 * Looking up a state without an entry is an error; there is no implicit zero.
 */
public class StateFrequencies {
    private final Int2LongSortedMap freq = new Int2LongRBTreeMap();

    public void put(int state, long frequency) {
        if (frequency < 0) {
            throw new IllegalArgumentException("negative frequency " + frequency + " for state " + state);
        }
        freq.put(state, frequency);
    }

    public long get(int state) {
        if (!freq.containsKey(state)) {
            throw new MissingFrequencyException(state);
        }
        return freq.get(state);
    }

    public boolean contains(int state) {
        return freq.containsKey(state);
    }

    public boolean isEmpty() {
        return freq.isEmpty();
    }

    public int size() {
        return freq.size();
    }

    /**
     * @return the highest frequency of any state, 0 if empty
     */
    public long max() {
        long max = 0;
        for (long f : freq.values()) {
            max = Math.max(max, f);
        }
        return max;
    }

    /**
     * Sum of frequencies of the given states; every state must have an entry.
     */
    public long total(IntCollection states) {
        long sum = 0;
        for (int s : states) {
            sum += get(s);
        }
        return sum;
    }

    /**
     * Entries of the given states only (missing ones stay missing).
     */
    public StateFrequencies restrictTo(IntCollection states) {
        StateFrequencies result = new StateFrequencies();
        for (int s : states) {
            if (freq.containsKey(s)) {
                result.freq.put(s, freq.get(s));
            }
        }
        return result;
    }

    public Int2LongSortedMap asMap() {
        return Int2LongSortedMaps.unmodifiable(freq);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Int2LongMap.Entry e : freq.int2LongEntrySet()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(e.getIntKey()).append('=').append(e.getLongValue());
        }
        return sb.append('}').toString();
    }
}
