package NFAReduce.Evaluation;

/**
 * Accuracy of a reduced automaton on one test sample file, relative to the original automaton.
 * Serialized as 7 comma separated fields in declaration order.
 */
public record EvaluationRecord(String sample, long originalMatches, long total, long reducedMatches,
                               long falseNegatives, long falsePositives, long truePositives) {

    public String toCsv() {
        return String.join(",", sample, Long.toString(originalMatches), Long.toString(total),
            Long.toString(reducedMatches), Long.toString(falseNegatives), Long.toString(falsePositives),
            Long.toString(truePositives));
    }

    public static EvaluationRecord parse(String line) {
        final String[] f = line.trim().split(",");
        if (f.length != 7) {
            throw new IllegalArgumentException("expected 7 fields in evaluation record, found " + f.length + ": " + line);
        }
        try {
            return new EvaluationRecord(f[0], Long.parseLong(f[1]), Long.parseLong(f[2]), Long.parseLong(f[3]),
                Long.parseLong(f[4]), Long.parseLong(f[5]), Long.parseLong(f[6]));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid evaluation record: " + line, ex);
        }
    }
}
