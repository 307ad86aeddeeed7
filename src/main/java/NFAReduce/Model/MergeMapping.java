package NFAReduce.Model;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2IntRBTreeMap;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * Disjoint-set (union-find) over state IDs, with path compression.
 * A lookup always answers with the final representative, so a flattened mapping is idempotent.
 */
public class MergeMapping {
    private final Int2IntMap parent = new Int2IntOpenHashMap();
    // position of first appearance, used to pick a deterministic representative
    private final Int2IntMap order = new Int2IntOpenHashMap();
    private final IntList elements = new IntArrayList();

    /**
     * Join the sets of a and b. The representative is whichever member entered the structure first.
     * @return true if two different sets were joined
     */
    public boolean union(int a, int b) {
        add(a);
        add(b);
        int ra = find(a);
        int rb = find(b);
        if (ra == rb) {
            return false;
        }
        if (order.get(ra) <= order.get(rb)) {
            parent.put(rb, ra);
        } else {
            parent.put(ra, rb);
        }
        return true;
    }

    /**
     * Attach the set of member below the set of representative.
     * @return true if two different sets were joined
     */
    public boolean map(int member, int representative) {
        add(member);
        add(representative);
        int rm = find(member);
        int rr = find(representative);
        if (rm == rr) {
            return false;
        }
        parent.put(rm, rr);
        return true;
    }

    /**
     * @return the representative of the state, or the state itself if it was never merged.
     */
    public int representative(int state) {
        if (!parent.containsKey(state)) {
            return state;
        }
        return find(state);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /**
     * Flat member -> representative mapping; representatives themselves are not keys.
     */
    public Int2IntSortedMap toMap() {
        Int2IntSortedMap result = new Int2IntRBTreeMap();
        for (int e : elements) {
            int rep = find(e);
            if (rep != e) {
                result.put(e, rep);
            }
        }
        return result;
    }

    /**
     * Representative -> all members of its set (representative included), in order of first appearance.
     */
    public Int2ObjectMap<IntList> clusters() {
        Int2ObjectMap<IntList> result = new Int2ObjectLinkedOpenHashMap<>();
        for (int e : elements) {
            int rep = find(e);
            IntList members = result.get(rep);
            if (members == null) {
                members = new IntArrayList();
                result.put(rep, members);
            }
            members.add(e);
        }
        return result;
    }

    private void add(int state) {
        if (!parent.containsKey(state)) {
            parent.put(state, state);
            order.put(state, elements.size());
            elements.add(state);
        }
    }

    private int find(int state) {
        int root = state;
        while (parent.get(root) != root) {
            root = parent.get(root);
        }
        // path compression
        int x = state;
        while (x != root) {
            int next = parent.get(x);
            parent.put(x, root);
            x = next;
        }
        return root;
    }
}
