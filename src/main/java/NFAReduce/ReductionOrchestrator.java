package NFAReduce;

import NFAReduce.Evaluation.AccuracyEvaluator;
import NFAReduce.Evaluation.AccuracyReport;
import NFAReduce.Evaluation.EvaluationRecord;
import NFAReduce.Model.LabeledNFA;
import NFAReduce.Model.ReducibleNFA;
import NFAReduce.Model.StateFrequencies;
import NFAReduce.Reduction.MergingReducer;
import NFAReduce.Reduction.PruningReducer;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs one reduction: load the automaton and its packet frequencies, reduce, save, and optionally evaluate.
 */
public class ReductionOrchestrator {
    public static boolean DEBUG = false;

    private final ReductionConfig config;

    /**
     * @throws ConfigurationException if the configuration is invalid
     */
    public ReductionOrchestrator(ReductionConfig config) {
        config.validate();
        this.config = config;
    }

    /**
     * Dispatch to exactly one reducer. The automaton is modified in place.
     * @param nfa - automaton to reduce, owned by this call until it returns
     * @param freq - packet frequencies of the automaton's states
     * @return - statistics of the reduction
     */
    public <I> ReductionResult reduce(ReducibleNFA<I> nfa, StateFrequencies freq) {
        final int origCount = nfa.size();
        return switch (config.getMode()) {
            case PRUNE -> {
                PruningReducer.fold(nfa, config.getRatio(), freq);
                yield new ReductionResult(ReductionMode.PRUNE, origCount, nfa.size(), -1, -1);
            }
            case FREQ_PRUNE -> {
                final long errorMass = PruningReducer.prune(nfa, config.getRatio(), freq);
                yield new ReductionResult(ReductionMode.FREQ_PRUNE, origCount, nfa.size(), errorMass, -1);
            }
            case MERGE -> {
                final int merged = MergingReducer.merge(nfa, freq, config.getThreshold(), config.getMaxFrequencyRatio());
                yield new ReductionResult(ReductionMode.MERGE, origCount, nfa.size(), -1, merged);
            }
        };
    }

    /**
     * Full run from the configured files.
     * @return - reduction statistics, and the accuracy report if test files were given
     */
    public Outcome run() {
        final LabeledNFA input = BAFormat.getBAFile(config.getInput().toString());
        final ReducibleNFA<Integer> nfa = input.nfa();
        final ReducibleNFA<Integer> original = nfa.copy();
        final StateFrequencies freq = frequencies(input);

        System.err.println("reduction ratio: " + config.getRatio());
        final ReductionResult result = reduce(nfa, freq);
        System.err.println(result);
        if (result.errorMass() != -1) {
            System.err.println("Packet error mass: " + result.errorMass());
        }
        if (result.mergedStates() != -1) {
            System.err.println("states merged: " + result.mergedStates());
        }

        BAFormat.writeBAFile(config.getOutput().toString(), nfa);
        System.err.println("saved as " + config.getOutput());

        if (config.getTestFiles().isEmpty()) {
            return new Outcome(result, null);
        }
        System.err.println("evaluation reduction error");
        final List<EvaluationRecord> records =
            AccuracyEvaluator.evaluate(original, nfa, config.getTestFiles(), config.getWorkers());
        final AccuracyReport report = AccuracyReport.aggregate(records, result.errorMass());
        System.out.println("real error: " + report.realError());
        if (report.estimatedError() != AccuracyReport.NOT_APPLICABLE) {
            System.out.println("estimated error of freq pruning: " + report.estimatedError());
        }
        if (report.precision() != AccuracyReport.NOT_APPLICABLE) {
            System.out.println("precision: " + report.precision());
        }
        final Path reportFile = reportPath();
        report.write(reportFile);
        System.out.println(reportFile + " saved.");
        return new Outcome(result, report);
    }

    /**
     * Compute packet frequencies of the input automaton's states from the training samples and
     * write them to the configured frequency output, named as in the input file. Nothing is reduced.
     * @return - the computed frequencies
     */
    public StateFrequencies exportFrequencies() {
        if (config.getFrequencyOutput() == null) {
            throw new IllegalStateException("no frequency output configured");
        }
        final LabeledNFA input = BAFormat.getBAFile(config.getInput().toString());
        final StateFrequencies freq = FrequencyCounter.count(input.nfa(),
            TraceFormat.read(config.getTrain(), input.nfa().getInputAlphabet()));
        FrequencyFormat.write(config.getFrequencyOutput(), freq, input.labels());
        System.err.println("saved as " + config.getFrequencyOutput());
        return freq;
    }

    /**
     * Report location: {@code <results>/<train>_<input>_<mode>_<ratio>.txt}.
     */
    public Path reportPath() {
        final String name = config.getTrain().getFileName() + "_" + config.getInput().getFileName() + "_"
            + config.getMode().getCode() + "_" + config.getRatio() + ".txt";
        return config.getResultsDirectory().resolve(name);
    }

    /**
     * Whether a run would overwrite an existing report.
     */
    public boolean reportExists() {
        return !config.getTestFiles().isEmpty() && Files.exists(reportPath());
    }

    private StateFrequencies frequencies(LabeledNFA input) {
        final ReducibleNFA<Integer> nfa = input.nfa();
        if (config.isPrecomputedFrequencies()) {
            return FrequencyFormat.read(config.getTrain(), nfa, input.labels());
        }
        return FrequencyCounter.count(nfa, TraceFormat.read(config.getTrain(), nfa.getInputAlphabet()));
    }

    /**
     * Result of {@link #run()}; report is null when no test files were given.
     */
    public record Outcome(ReductionResult result, AccuracyReport report) {
    }
}
