package NFAReduce.Evaluation;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Aggregated reduction error. A value of -1 means "not applicable".
 */
public record AccuracyReport(double realError, double precision, double estimatedError) {
    public static final String HEADER = "#real_error,precision,estimated_error";
    public static final double NOT_APPLICABLE = -1;

    /**
     * Sum all records.
     * @param records - one record per test sample
     * @param errorMass - error mass reported by pruning, or -1
     */
    public static AccuracyReport aggregate(List<EvaluationRecord> records, long errorMass) {
        long total = 0, fp = 0, tp = 0;
        for (EvaluationRecord r : records) {
            total += r.total();
            fp += r.falsePositives();
            tp += r.truePositives();
        }
        if (total == 0) {
            throw new IllegalArgumentException("no test traffic to evaluate");
        }
        final double realError = round((double) fp / total);
        final double precision = tp + fp > 0 ? round((double) tp / (tp + fp)) : NOT_APPLICABLE;
        final double estimatedError = errorMass != -1 ? round((double) errorMass / total) : NOT_APPLICABLE;
        return new AccuracyReport(realError, precision, estimatedError);
    }

    public String toLine() {
        return format(realError) + "," + format(precision) + "," + format(estimatedError);
    }

    public void write(Path path) {
        try {
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, HEADER + "\n" + toLine() + "\n", StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot write results '" + path + "'", e);
        }
    }

    // 4 decimal places
    private static double round(double x) {
        return Math.round(x * 10000) / 10000.0;
    }

    private static String format(double x) {
        return x == NOT_APPLICABLE ? "-1" : Double.toString(x);
    }
}
