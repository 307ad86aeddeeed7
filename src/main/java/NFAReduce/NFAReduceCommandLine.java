package NFAReduce;

import java.nio.file.Paths;

public class NFAReduceCommandLine {
  public static void main(String[] args) {
    final ReductionConfig config;
    try {
      config = parseArgs(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      printUsageAndExit();
      return;
    }

    try {
      ReductionOrchestrator orchestrator = new ReductionOrchestrator(config);
      if (config.getFrequencyOutput() != null) {
        orchestrator.exportFrequencies();
        return;
      }
      if (orchestrator.reportExists()) {
        System.out.println(orchestrator.reportPath() + " already exists.");
        return;
      }
      long before = System.currentTimeMillis();
      orchestrator.run();
      long after = System.currentTimeMillis();
      System.err.println("duration: " + ((after - before) / 1000f) + "s");
    } catch (RuntimeException e) {
      System.err.println("ERROR " + e.getMessage());
      if (ReductionOrchestrator.DEBUG) {
        e.printStackTrace();
      }
      System.exit(1);
    }
  }

  /**
   * Parse command-line arguments. Does not validate values; see {@link ReductionConfig#validate()}.
   * @param args - command-line arguments
   * @return - configuration
   * @throws IllegalArgumentException on malformed arguments
   */
  static ReductionConfig parseArgs(String[] args) {
    ReductionConfig.Builder builder = ReductionConfig.builder();
    boolean merge = false;
    boolean freqPruning = false;
    String input = null;

    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      switch (arg) {
        case "--debug" -> ReductionOrchestrator.DEBUG = true;
        case "-m", "--merge" -> merge = true;
        case "-fp", "--freq_pruning" -> freqPruning = true;
        case "-r", "--ratio" -> builder.ratio(parseDouble(arg, value(args, ++i, arg)));
        case "-th", "--thresh" -> builder.threshold(parseDouble(arg, value(args, ++i, arg)));
        case "-mf", "--maxfr" -> builder.maxFrequencyRatio(parseDouble(arg, value(args, ++i, arg)));
        case "-n", "--nw" -> builder.workers(parseInt(arg, value(args, ++i, arg)));
        case "-o", "--output" -> builder.output(Paths.get(value(args, ++i, arg)));
        case "-f", "--freq_out" -> builder.frequencyOutput(Paths.get(value(args, ++i, arg)));
        case "--train" -> builder.train(Paths.get(value(args, ++i, arg)), false);
        case "--freq" -> builder.train(Paths.get(value(args, ++i, arg)), true);
        case "--test" -> {
          // consume values up to the next flag
          int count = 0;
          while (i + 1 < args.length && !args[i + 1].startsWith("-")) {
            builder.addTestFile(Paths.get(args[++i]));
            count++;
          }
          if (count == 0) {
            throw new IllegalArgumentException("Missing value for --test");
          }
        }
        default -> {
          if (arg.startsWith("-")) {
            throw new IllegalArgumentException("Unknown option: " + arg);
          }
          if (input != null) {
            throw new IllegalArgumentException("Unexpected argument: " + arg);
          }
          input = arg;
        }
      }
    }

    if (input == null) {
      throw new IllegalArgumentException("Missing NFA to reduce");
    }
    if (merge && freqPruning) {
      throw new IllegalArgumentException("--merge and --freq_pruning are mutually exclusive");
    }
    builder.input(Paths.get(input));
    builder.mode(merge ? ReductionMode.MERGE : freqPruning ? ReductionMode.FREQ_PRUNE : ReductionMode.PRUNE);
    return builder.build();
  }

  private static String value(String[] args, int i, String flag) {
    // Require a value that isn't another flag
    if (i >= args.length || args[i].startsWith("-")) {
      throw new IllegalArgumentException("Missing value for " + flag);
    }
    return args[i];
  }

  private static double parseDouble(String flag, String value) {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid value for " + flag + ": \"" + value + "\"");
    }
  }

  private static int parseInt(String flag, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid value for " + flag + ": \"" + value + "\"");
    }
  }

  private static void printUsageAndExit() {
    System.out.println(
        "NFAReduce [options] <BA input file>");
    System.out.println("[-r|--ratio N] : reduction ratio, in (0,1), default " + ReductionConfig.DEFAULT_RATIO);
    System.out.println("[-m|--merge] : merging reduction");
    System.out.println("[-fp|--freq_pruning] : frequency based pruning reduction, reports an error bound");
    System.out.println("[-th|--thresh N] : threshold for merging, default 0.995");
    System.out.println("[-mf|--maxfr N] : max frequency of a state allowed to be merged, default 0.1");
    System.out.println("[-n|--nw N] : number of workers evaluating test files in parallel");
    System.out.println("[-o|--output FILE] : reduced NFA (BA format), default " + ReductionConfig.DEFAULT_OUTPUT);
    System.out.println("[-f|--freq_out FILE] : don't reduce, write packet frequencies of NFA states computed from --train");
    System.out.println("--train FILE : training samples, one word of symbol indices per line");
    System.out.println("--freq FILE : precomputed packet frequencies (\"state count\" per line), instead of --train");
    System.out.println("[--test FILE...] : test samples; writes the error report to "
        + ReductionConfig.DEFAULT_RESULTS_DIR + "/");
    System.out.println("[--debug] : Additional debug/progress output");
    System.out.println();
    System.out.println("Without -m or -fp, pruning folds low-frequency states into final states.");
    System.exit(0);
  }
}
