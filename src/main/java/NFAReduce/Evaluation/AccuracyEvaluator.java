package NFAReduce.Evaluation;

import NFAReduce.Model.ReducibleNFA;
import NFAReduce.TraceFormat;
import net.automatalib.word.Word;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Compares a reduced automaton with its original on test samples.
 * Sample files are evaluated in parallel on a bounded pool; each task gets its own copies of both automata.
 */
public class AccuracyEvaluator {

    /**
     * @param original - automaton before reduction
     * @param reduced - automaton after reduction
     * @param testFiles - sample files, see {@link TraceFormat}
     * @param workers - number of samples evaluated in parallel
     * @return - one record per sample file, in the order of testFiles
     * @throws EvaluationException if any sample fails
     */
    public static <I> List<EvaluationRecord> evaluate(ReducibleNFA<I> original, ReducibleNFA<I> reduced,
                                                      List<Path> testFiles, int workers) {
        if (workers < 1) {
            throw new IllegalArgumentException("invalid number of workers: " + workers);
        }
        final ExecutorService pool = Executors.newFixedThreadPool(Math.min(workers, Math.max(1, testFiles.size())));
        try {
            final List<Future<EvaluationRecord>> futures = new ArrayList<>(testFiles.size());
            for (Path file : testFiles) {
                final ReducibleNFA<I> originalCopy = original.copy();
                final ReducibleNFA<I> reducedCopy = reduced.copy();
                futures.add(pool.submit(() -> evaluateSample(originalCopy, reducedCopy, file)));
            }
            final List<EvaluationRecord> records = new ArrayList<>(futures.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    records.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    throw new EvaluationException("evaluation of '" + testFiles.get(i) + "' failed: "
                        + e.getCause().getMessage(), e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new EvaluationException("evaluation interrupted", e);
                }
            }
            return records;
        } finally {
            pool.shutdownNow();
        }
    }

    static <I> EvaluationRecord evaluateSample(ReducibleNFA<I> original, ReducibleNFA<I> reduced, Path file) {
        final List<Word<I>> words = TraceFormat.read(file, original.getInputAlphabet());
        long originalMatches = 0, reducedMatches = 0, fn = 0, fp = 0, tp = 0;
        for (Word<I> w : words) {
            final boolean o = original.matches(w);
            final boolean r = reduced.matches(w);
            if (o) {
                originalMatches++;
            }
            if (r) {
                reducedMatches++;
            }
            if (o && r) {
                tp++;
            } else if (r) {
                fp++;
            } else if (o) {
                fn++;
            }
        }
        return new EvaluationRecord(file.getFileName().toString(), originalMatches, words.size(), reducedMatches,
            fn, fp, tp);
    }
}
