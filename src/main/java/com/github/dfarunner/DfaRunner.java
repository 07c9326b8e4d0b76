package com.github.dfarunner;

import java.io.PrintStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads a DFA from a YAML document and determines if it accepts the input string. DFAs are always
 * validated before being run.
 *
 * <pre>
 * usage: DfaRunner dfa_yaml input_string [--trace]
 * </pre>
 *
 * An input string that is itself "--trace" goes after a "--" separator.
 *
 * Exit status is {@link #EXIT_VERDICT} whenever a verdict was printed, whether the string was
 * accepted or rejected.
 */
public final class DfaRunner {
  private static final Logger logger = LogManager.getLogger(DfaRunner.class.getSimpleName());

  static final int EXIT_VERDICT = 0;
  static final int EXIT_INVALID_DFA = 1;
  static final int EXIT_USAGE = 2;

  public static void main(final String[] args) {
    System.exit(run(args, System.out, System.err));
  }

  static int run(final String[] args, final PrintStream out, final PrintStream err) {
    final RunnerConfiguration config;
    try {
      config = RunnerConfiguration.fromArgs(args);
    } catch (IllegalArgumentException problem) {
      err.println(problem.getMessage());
      err.println(
          "usage: DfaRunner dfa_yaml input_string [" + RunnerConfiguration.TRACE_FLAG + "]");
      return EXIT_USAGE;
    }
    return run(config, out, err);
  }

  static int run(final RunnerConfiguration config, final PrintStream out, final PrintStream err) {
    logger.info("Running with " + config);
    try {
      final DfaDocument document = DfaLoader.load(config.getDfaDocument());
      final Dfa<String, String> dfa = DfaLoader.toDfa(document);

      // an undescribed document goes by its file name
      final String description = document.getDescription() == null
          ? String.valueOf(config.getDfaDocument().getFileName()) : document.getDescription();
      out.println("Loaded DFA: " + description);
      out.println("Input string: " + config.getInputString());

      DfaValidator.validate(dfa);

      final SimulationResult<String, String> result =
          DfaSimulator.run(dfa, DfaSimulator.symbolsOf(config.getInputString()));
      if (config.getTrace()) {
        out.println("Route: " + String.join(" -> ", result.getRoute()));
        if (result.getUnrecognizedSymbol().isPresent()) {
          out.println("Unrecognized symbol: '" + result.getUnrecognizedSymbol().get() + "'");
        }
      }
      if (result.isAccepted()) {
        out.println("DFA accepts string '" + config.getInputString() + "'");
      } else {
        out.println("DFA rejects string '" + config.getInputString() + "'");
      }
      return EXIT_VERDICT;
    } catch (DfaLoadException problem) {
      logger.error("Failed to load " + config.getDfaDocument(), problem);
      err.println("Failed to load DFA: " + problem.getMessage());
      return EXIT_INVALID_DFA;
    } catch (InvalidDfaException problem) {
      err.println("Invalid DFA: " + problem.getMessage());
      return EXIT_INVALID_DFA;
    }
  }

  private DfaRunner() {}

}
