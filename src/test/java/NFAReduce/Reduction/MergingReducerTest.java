package NFAReduce.Reduction;

import NFAReduce.ConfigurationException;
import NFAReduce.MissingFrequencyException;
import NFAReduce.Model.MergeMapping;
import NFAReduce.Model.ReducibleNFA;
import NFAReduce.Model.StateFrequencies;
import it.unimi.dsi.fastutil.ints.Int2IntSortedMap;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import net.automatalib.alphabet.impl.Alphabets;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static NFAReduce.Reduction.PruningReducerTest.freq;

public class MergingReducerTest {
  /**
   * Chain 0 -> 1 -> ... -> n-1 over symbol 0, last state final.
   */
  private static ReducibleNFA<Integer> chain(int n) {
    ReducibleNFA<Integer> nfa = new ReducibleNFA<>(Alphabets.integers(0, 1));
    for (int i = 0; i < n; i++) { nfa.addState(i == n - 1); }
    nfa.setInitial(0);
    for (int s = 0; s < n - 1; s++) { nfa.addTransition(s, 0, s + 1); }
    return nfa;
  }

  @Test
  void testSimilarNeighboursAreMerged() {
    ReducibleNFA<Integer> nfa = chain(4);
    // 10/11 ~ 0.909
    int merged = MergingReducer.merge(nfa, freq(100, 10, 11, 5), 0.9, 1.0);
    Assertions.assertEquals(1, merged);
    Assertions.assertEquals(IntList.of(0, 1, 3), new IntArrayList(nfa.getStates()));
    Assertions.assertEquals(IntList.of(1, 3), new IntArrayList(nfa.getTransitions(1, 0)));
    Assertions.assertEquals(IntList.of(3), new IntArrayList(nfa.getFinalStates()));
  }

  @Test
  void testBelowThresholdIsKept() {
    ReducibleNFA<Integer> nfa = chain(4);
    int merged = MergingReducer.merge(nfa, freq(100, 10, 11, 5), 0.95, 1.0);
    Assertions.assertEquals(0, merged);
    Assertions.assertEquals(4, nfa.size());
  }

  @Test
  void testTransitiveCluster() {
    ReducibleNFA<Integer> nfa = chain(5);
    int other = nfa.addState(false);
    nfa.addTransition(1, 1, other);
    StateFrequencies freq = freq(100, 10, 10, 10, 3, 50);

    MergeMapping mapping = MergingReducer.candidates(nfa, freq, 0.9, 1.0);
    Int2IntSortedMap flat = mapping.toMap();
    Assertions.assertEquals(2, flat.size());
    Assertions.assertEquals(1, flat.get(2));
    Assertions.assertEquals(1, flat.get(3)); // 3 joins through 2, but maps directly to 1
    Assertions.assertFalse(flat.containsKey(other));

    int merged = MergingReducer.merge(nfa, freq, 0.9, 1.0);
    Assertions.assertEquals(2, merged);
    Assertions.assertEquals(IntList.of(0, 1, 4, other), new IntArrayList(nfa.getStates()));
    Assertions.assertEquals(IntList.of(1, 4), new IntArrayList(nfa.getTransitions(1, 0)));
  }

  @Test
  void testFinalStatesAreNotMerged() {
    ReducibleNFA<Integer> nfa = chain(3);
    int merged = MergingReducer.merge(nfa, freq(100, 10, 10), 0.5, 1.0);
    Assertions.assertEquals(0, merged);
    Assertions.assertEquals(3, nfa.size());
  }

  @Test
  void testOnlyLowTrafficStatesTakePart() {
    // eligible when freq <= maxFrequencyRatio^2 * max, i.e. <= 1 here
    ReducibleNFA<Integer> nfa = chain(4);
    Assertions.assertEquals(0, MergingReducer.merge(nfa, freq(100, 10, 10, 5), 0.9, 0.1));
    Assertions.assertEquals(4, nfa.size());

    Assertions.assertEquals(1, MergingReducer.merge(nfa, freq(100, 1, 1, 5), 0.9, 0.1));
    Assertions.assertEquals(3, nfa.size());
  }

  @Test
  void testZeroFrequencyAndZeroRatio() {
    ReducibleNFA<Integer> nfa = chain(4);
    Assertions.assertEquals(0, MergingReducer.merge(nfa, freq(100, 0, 0, 5), 0, 1.0));
    Assertions.assertEquals(0, MergingReducer.merge(nfa, freq(100, 10, 10, 5), 0.9, 0));
    Assertions.assertEquals(4, nfa.size());
  }

  @Test
  void testInitialStateIsNeverMergedAway() {
    ReducibleNFA<Integer> nfa = chain(3);
    nfa.addTransition(1, 1, 0);
    Assertions.assertEquals(0, MergingReducer.merge(nfa, freq(10, 10, 1), 0.5, 1.0));
    Assertions.assertEquals(0, nfa.getInitialState());
    Assertions.assertEquals(3, nfa.size());
  }

  @Test
  void testUnreachableStatesRemovedWithoutCandidates() {
    ReducibleNFA<Integer> nfa = chain(3);
    int isolated = nfa.addState(false);
    Assertions.assertEquals(0, MergingReducer.merge(nfa, freq(10, 10, 1, 0), 0.995, 0.1));
    Assertions.assertEquals(IntList.of(0, 1, 2), new IntArrayList(nfa.getStates()));
    Assertions.assertFalse(nfa.isState(isolated));
  }

  @Test
  void testValidation() {
    ReducibleNFA<Integer> nfa = chain(4);
    StateFrequencies freq = freq(100, 10, 11, 5);
    Assertions.assertThrows(ConfigurationException.class, () -> MergingReducer.merge(nfa, freq, 1.5, 0.1));
    Assertions.assertThrows(ConfigurationException.class, () -> MergingReducer.merge(nfa, freq, -0.1, 0.1));
    Assertions.assertThrows(ConfigurationException.class, () -> MergingReducer.merge(nfa, freq, 0.9, 1.1));
    Assertions.assertThrows(ConfigurationException.class, () -> MergingReducer.merge(nfa, new StateFrequencies(), 0.9, 0.1));
    Assertions.assertThrows(ConfigurationException.class, () -> MergingReducer.merge(nfa, null, 0.9, 0.1));
    Assertions.assertEquals(4, nfa.size());
  }

  @Test
  void testMissingFrequency() {
    ReducibleNFA<Integer> nfa = chain(4);
    Assertions.assertThrows(MissingFrequencyException.class, () -> MergingReducer.merge(nfa, freq(100, 10), 0.9, 1.0));
    Assertions.assertEquals(4, nfa.size());
  }
}
