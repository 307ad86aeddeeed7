package NFAReduce;

import NFAReduce.Reduction.MergingReducer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of a reduction run. Build with {@link #builder()}; checked by {@link #validate()}.
 */
public final class ReductionConfig {
    public static final double DEFAULT_RATIO = 0.2;
    public static final String DEFAULT_OUTPUT = "output.fa";
    public static final String DEFAULT_RESULTS_DIR = "results";

    private final ReductionMode mode;
    private final double ratio;
    private final double threshold;
    private final double maxFrequencyRatio;
    private final int workers;
    private final Path input;
    private final Path output;
    private final Path train;
    private final boolean precomputedFrequencies;
    private final List<Path> testFiles;
    private final Path resultsDirectory;
    private final Path frequencyOutput;

    private ReductionConfig(Builder b) {
        this.mode = b.mode;
        this.ratio = b.ratio;
        this.threshold = b.threshold;
        this.maxFrequencyRatio = b.maxFrequencyRatio;
        this.workers = b.workers;
        this.input = b.input;
        this.output = b.output;
        this.train = b.train;
        this.precomputedFrequencies = b.precomputedFrequencies;
        this.testFiles = List.copyOf(b.testFiles);
        this.resultsDirectory = b.resultsDirectory;
        this.frequencyOutput = b.frequencyOutput;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @throws ConfigurationException on the first invalid parameter
     */
    public void validate() {
        if (mode == null) {
            throw new ConfigurationException("no reduction mode selected");
        }
        if (train == null) {
            throw new ConfigurationException(mode == ReductionMode.MERGE
                ? "--train option is required when merging"
                : "--train option is required: pruning needs packet frequencies");
        }
        if (!(ratio > 0 && ratio < 1)) {
            throw new ConfigurationException("invalid reduction ratio " + ratio + ", should be in range (0,1)");
        }
        if (!(threshold >= 0 && threshold <= 1)) {
            throw new ConfigurationException("invalid threshold value: " + threshold);
        }
        if (!(maxFrequencyRatio >= 0 && maxFrequencyRatio <= 1)) {
            throw new ConfigurationException("invalid max frequency ratio value: " + maxFrequencyRatio);
        }
        if (workers < 1) {
            throw new ConfigurationException("invalid number of workers: " + workers);
        }
        if (frequencyOutput != null && precomputedFrequencies) {
            throw new ConfigurationException("computing packet frequencies needs training samples (--train), not --freq");
        }
    }

    public ReductionMode getMode() {
        return mode;
    }

    public double getRatio() {
        return ratio;
    }

    public double getThreshold() {
        return threshold;
    }

    public double getMaxFrequencyRatio() {
        return maxFrequencyRatio;
    }

    public int getWorkers() {
        return workers;
    }

    public Path getInput() {
        return input;
    }

    public Path getOutput() {
        return output;
    }

    public Path getTrain() {
        return train;
    }

    public boolean isPrecomputedFrequencies() {
        return precomputedFrequencies;
    }

    public List<Path> getTestFiles() {
        return testFiles;
    }

    public Path getResultsDirectory() {
        return resultsDirectory;
    }

    /**
     * Where to write computed packet frequencies instead of reducing; null to reduce.
     */
    public Path getFrequencyOutput() {
        return frequencyOutput;
    }

    public static final class Builder {
        private ReductionMode mode = ReductionMode.PRUNE;
        private double ratio = DEFAULT_RATIO;
        private double threshold = MergingReducer.DEFAULT_THRESHOLD;
        private double maxFrequencyRatio = MergingReducer.DEFAULT_MAX_FREQUENCY_RATIO;
        private int workers = Math.max(1, Runtime.getRuntime().availableProcessors() - 1);
        private Path input;
        private Path output = Paths.get(DEFAULT_OUTPUT);
        private Path train;
        private boolean precomputedFrequencies;
        private final List<Path> testFiles = new ArrayList<>();
        private Path resultsDirectory = Paths.get(DEFAULT_RESULTS_DIR);
        private Path frequencyOutput;

        private Builder() {
        }

        public Builder mode(ReductionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder ratio(double ratio) {
            this.ratio = ratio;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder maxFrequencyRatio(double maxFrequencyRatio) {
            this.maxFrequencyRatio = maxFrequencyRatio;
            return this;
        }

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder input(Path input) {
            this.input = input;
            return this;
        }

        public Builder output(Path output) {
            this.output = output;
            return this;
        }

        /**
         * Training samples (trace file), or a precomputed frequency file if precomputed is set.
         */
        public Builder train(Path train, boolean precomputed) {
            this.train = train;
            this.precomputedFrequencies = precomputed;
            return this;
        }

        public Builder addTestFile(Path test) {
            this.testFiles.add(test);
            return this;
        }

        public Builder resultsDirectory(Path resultsDirectory) {
            this.resultsDirectory = resultsDirectory;
            return this;
        }

        public Builder frequencyOutput(Path frequencyOutput) {
            this.frequencyOutput = frequencyOutput;
            return this;
        }

        public ReductionConfig build() {
            return new ReductionConfig(this);
        }
    }
}
