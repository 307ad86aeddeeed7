package NFAReduce;

import NFAReduce.Evaluation.AccuracyReport;
import NFAReduce.Model.ReducibleNFA;
import NFAReduce.Model.StateFrequencies;
import net.automatalib.alphabet.impl.Alphabets;
import net.automatalib.word.Word;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class ReductionOrchestratorTest {
  @TempDir
  Path tmp;

  /**
   * 0 -0-> 1, 0 -1-> 2, 1,2 -0-> 3, 3 -0-> 4 (final), 3 -1-> 5 (final)
   */
  private static ReducibleNFA<Integer> diamond() {
    ReducibleNFA<Integer> nfa = new ReducibleNFA<>(Alphabets.integers(0, 1));
    nfa.addInitialState(false);
    nfa.addState(false);
    nfa.addState(false);
    nfa.addState(false);
    nfa.addState(true);
    nfa.addState(true);
    nfa.addTransition(0, 0, 1);
    nfa.addTransition(0, 1, 2);
    nfa.addTransition(1, 0, 3);
    nfa.addTransition(2, 0, 3);
    nfa.addTransition(3, 0, 4);
    nfa.addTransition(3, 1, 5);
    return nfa;
  }

  private static StateFrequencies freq(long... values) {
    StateFrequencies freq = new StateFrequencies();
    for (int s = 0; s < values.length; s++) {
      freq.put(s, values[s]);
    }
    return freq;
  }

  private static ReductionConfig.Builder config(ReductionMode mode, double ratio) {
    return ReductionConfig.builder().mode(mode).ratio(ratio).train(Path.of("train.txt"), false)
        .input(Path.of("in.fa"));
  }

  @Test
  void testValidation() {
    Assertions.assertThrows(ConfigurationException.class,
        () -> new ReductionOrchestrator(ReductionConfig.builder().mode(ReductionMode.MERGE).input(Path.of("in.fa")).build()));
    Assertions.assertThrows(ConfigurationException.class,
        () -> new ReductionOrchestrator(config(ReductionMode.FREQ_PRUNE, 1.0).build()));
    Assertions.assertThrows(ConfigurationException.class,
        () -> new ReductionOrchestrator(config(ReductionMode.MERGE, 0.5).threshold(1.5).build()));
    Assertions.assertThrows(ConfigurationException.class,
        () -> new ReductionOrchestrator(config(ReductionMode.MERGE, 0.5).maxFrequencyRatio(-0.1).build()));
    Assertions.assertThrows(ConfigurationException.class,
        () -> new ReductionOrchestrator(config(ReductionMode.PRUNE, 0.5).workers(0).build()));
    Assertions.assertDoesNotThrow(() -> new ReductionOrchestrator(config(ReductionMode.PRUNE, 0.5).build()));
  }

  @Test
  void testReduceFreqPrune() {
    ReductionOrchestrator orchestrator = new ReductionOrchestrator(config(ReductionMode.FREQ_PRUNE, 0.5).build());
    ReducibleNFA<Integer> nfa = diamond();
    ReductionResult result = orchestrator.reduce(nfa, freq(100, 1, 1, 50, 10, 5));
    Assertions.assertEquals(new ReductionResult(ReductionMode.FREQ_PRUNE, 6, 3, 65, -1), result);
    Assertions.assertEquals(3, nfa.size());
    Assertions.assertEquals("Reduction: 3/6 50%", result.toString());
  }

  @Test
  void testReduceFold() {
    ReductionOrchestrator orchestrator = new ReductionOrchestrator(config(ReductionMode.PRUNE, 0.9).build());
    ReducibleNFA<Integer> nfa = diamond();
    // keeps 2 of the 3 non-final states; state 3 is folded into final state 4
    ReductionResult result = orchestrator.reduce(nfa, freq(100, 80, 90, 50, 10, 5));
    Assertions.assertEquals(new ReductionResult(ReductionMode.PRUNE, 6, 5, -1, -1), result);
    Assertions.assertFalse(nfa.isState(3));
    Assertions.assertTrue(nfa.matches(Word.fromSymbols(0, 0)));
  }

  @Test
  void testReduceMerge() {
    ReductionOrchestrator orchestrator = new ReductionOrchestrator(config(ReductionMode.MERGE, 0.5).build());
    // 0 -0-> 1 -0-> 2 -0-> 3 (final)
    ReducibleNFA<Integer> nfa = new ReducibleNFA<>(Alphabets.integers(0, 1));
    nfa.addInitialState(false);
    nfa.addState(false);
    nfa.addState(false);
    nfa.addState(true);
    nfa.addTransition(0, 0, 1);
    nfa.addTransition(1, 0, 2);
    nfa.addTransition(2, 0, 3);

    ReductionResult result = orchestrator.reduce(nfa, freq(1000, 5, 5, 5));
    Assertions.assertEquals(new ReductionResult(ReductionMode.MERGE, 4, 3, -1, 1), result);
    Assertions.assertTrue(nfa.matches(Word.fromSymbols(0, 0)));
    Assertions.assertTrue(nfa.matches(Word.fromSymbols(0, 0, 0, 0)));
  }

  @Test
  void testRun() throws Exception {
    Path input = tmp.resolve("in.fa");
    BAFormat.writeBAFile(input.toString(), diamond());
    Path train = tmp.resolve("train.txt");
    Files.writeString(train, "0 0 0\n1 0 1\n0 0 1\n", StandardCharsets.UTF_8);
    Path test = tmp.resolve("test.txt");
    Files.writeString(test, "0 0 0\n0 0 1\n1 0 1\n1 0 0\n0 1\n1 1 1\n\n", StandardCharsets.UTF_8);
    Path output = tmp.resolve("out.fa");

    ReductionOrchestrator orchestrator = new ReductionOrchestrator(ReductionConfig.builder()
        .mode(ReductionMode.FREQ_PRUNE)
        .ratio(0.5)
        .input(input)
        .output(output)
        .train(train, false)
        .addTestFile(test)
        .workers(1)
        .resultsDirectory(tmp.resolve("results"))
        .build());
    Assertions.assertEquals(tmp.resolve("results").resolve("train.txt_in.fa_fp_0.5.txt"), orchestrator.reportPath());
    Assertions.assertFalse(orchestrator.reportExists());

    ReductionOrchestrator.Outcome outcome = orchestrator.run();

    // frequencies 3,2,1,3,1,2: both bands below 3 collapse, cutting off 3, 4 and 5
    Assertions.assertEquals(new ReductionResult(ReductionMode.FREQ_PRUNE, 6, 3, 6, -1), outcome.result());
    Assertions.assertEquals(new AccuracyReport(0.2857, 0.6667, 0.8571), outcome.report());
    Assertions.assertTrue(orchestrator.reportExists());
    Assertions.assertEquals(List.of(AccuracyReport.HEADER, "0.2857,0.6667,0.8571"),
        Files.readAllLines(orchestrator.reportPath(), StandardCharsets.UTF_8));

    ReducibleNFA<Integer> reduced = BAFormat.getBAFile(output.toString()).nfa();
    Assertions.assertEquals(3, reduced.size());
    Assertions.assertTrue(reduced.matches(Word.fromSymbols(1, 1)));
    Assertions.assertFalse(reduced.matches(Word.epsilon()));
  }

  @Test
  void testExportFrequenciesThenReduce() throws Exception {
    Path input = tmp.resolve("in.fa");
    BAFormat.writeBAFile(input.toString(), diamond());
    Path train = tmp.resolve("train.txt");
    Files.writeString(train, "0 0 0\n1 0 1\n0 0 1\n", StandardCharsets.UTF_8);
    Path freq = tmp.resolve("freq.txt");

    ReductionOrchestrator export = new ReductionOrchestrator(ReductionConfig.builder()
        .input(input)
        .train(train, false)
        .frequencyOutput(freq)
        .build());
    StateFrequencies counted = export.exportFrequencies();
    Assertions.assertEquals(6, counted.size());
    Assertions.assertEquals(12, counted.total(counted.asMap().keySet()));
    Assertions.assertEquals(6, Files.readAllLines(freq, StandardCharsets.UTF_8).size());

    ReductionOrchestrator orchestrator = new ReductionOrchestrator(ReductionConfig.builder()
        .mode(ReductionMode.FREQ_PRUNE)
        .ratio(0.5)
        .input(input)
        .output(tmp.resolve("out.fa"))
        .train(freq, true)
        .resultsDirectory(tmp.resolve("results"))
        .build());
    ReductionOrchestrator.Outcome outcome = orchestrator.run();
    Assertions.assertNull(outcome.report());
    Assertions.assertEquals(new ReductionResult(ReductionMode.FREQ_PRUNE, 6, 3, 6, -1), outcome.result());
    Assertions.assertTrue(Files.exists(tmp.resolve("out.fa")));
    Assertions.assertFalse(Files.exists(tmp.resolve("results")));
  }

  @Test
  void testPrecomputedFrequenciesUseStateNames() throws Exception {
    Path input = tmp.resolve("sparse.ba");
    Files.writeString(input, "[10]\n0,[10]->[20]\n1,[10]->[30]\n0,[20]->[40]\n0,[30]->[40]\n"
        + "0,[40]->[50]\n1,[40]->[60]\n[50]\n[60]\n", StandardCharsets.UTF_8);
    Path freq = tmp.resolve("freq.txt");
    Files.writeString(freq, "# state count\n20 1\n30 1\n40 50\n50 10\n60 5\n", StandardCharsets.UTF_8);

    ReductionOrchestrator orchestrator = new ReductionOrchestrator(ReductionConfig.builder()
        .mode(ReductionMode.FREQ_PRUNE)
        .ratio(0.5)
        .input(input)
        .output(tmp.resolve("out.fa"))
        .train(freq, true)
        .build());
    Assertions.assertEquals(new ReductionResult(ReductionMode.FREQ_PRUNE, 6, 3, 65, -1), orchestrator.run().result());
  }

  @Test
  void testFrequencyExportValidation() {
    Assertions.assertThrows(ConfigurationException.class, () -> new ReductionOrchestrator(
        config(ReductionMode.PRUNE, 0.5).train(Path.of("f.txt"), true).frequencyOutput(Path.of("out.txt")).build()));
    Assertions.assertThrows(IllegalStateException.class,
        () -> new ReductionOrchestrator(config(ReductionMode.PRUNE, 0.5).build()).exportFrequencies());
  }

  @Test
  void testReportNamePerMode() {
    for (ReductionMode mode : ReductionMode.values()) {
      Path report = new ReductionOrchestrator(config(mode, 0.25).build()).reportPath();
      Assertions.assertEquals("train.txt_in.fa_" + mode.getCode() + "_0.25.txt", report.getFileName().toString());
    }
    Assertions.assertEquals("m", ReductionMode.MERGE.getCode());
    Assertions.assertEquals("p", ReductionMode.PRUNE.getCode());
    Assertions.assertEquals("fp", ReductionMode.FREQ_PRUNE.getCode());
  }
}
