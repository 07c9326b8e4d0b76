package com.github.dfarunner;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * This class encapsulates all the configuration parameters for a {@link DfaRunner} invocation. Use
 * the {@code RunnerConfigurationBuilder} to build it, or {@link #fromArgs(String[])} to map command
 * line arguments onto it.
 *
 * Notes:<br>
 * 1. the input string may be empty, the dfa then decides on its start state alone<br>
 * 2. with trace enabled the runner also reports every state the dfa went through<br>
 */
public final class RunnerConfiguration {
  static final String TRACE_FLAG = "--trace";
  static final String END_OF_OPTIONS = "--";

  private final Path dfaDocument;
  private final String inputString;
  private final boolean trace;

  public Path getDfaDocument() {
    return dfaDocument;
  }

  public String getInputString() {
    return inputString;
  }

  public boolean getTrace() {
    return trace;
  }

  /**
   * Maps {@code <dfa_yaml> <input_string> [--trace]}. The flag may appear anywhere before a
   * {@code --} argument; everything after that is positional, so {@code dfa.yaml -- --trace} runs
   * the literal input string "--trace".
   */
  public static RunnerConfiguration fromArgs(final String[] args) throws IllegalArgumentException {
    final RunnerConfigurationBuilder builder = RunnerConfigurationBuilder.newBuilder();
    int positional = 0;
    boolean options = true;
    for (final String arg : args) {
      if (options && END_OF_OPTIONS.equals(arg)) {
        options = false;
        continue;
      }
      if (options && TRACE_FLAG.equals(arg)) {
        builder.trace(true);
        continue;
      }
      switch (positional++) {
        case 0:
          builder.dfaDocument(Paths.get(arg));
          break;
        case 1:
          builder.inputString(arg);
          break;
        default:
          throw new IllegalArgumentException("Unexpected argument: " + arg);
      }
    }
    return builder.build();
  }

  public final static class RunnerConfigurationBuilder {
    private Path dfaDocument;
    private String inputString;
    private boolean trace;

    public static RunnerConfigurationBuilder newBuilder() {
      return new RunnerConfigurationBuilder();
    }

    public RunnerConfigurationBuilder dfaDocument(final Path dfaDocument) {
      this.dfaDocument = dfaDocument;
      return this;
    }

    public RunnerConfigurationBuilder inputString(final String inputString) {
      this.inputString = inputString;
      return this;
    }

    public RunnerConfigurationBuilder trace(final boolean trace) {
      this.trace = trace;
      return this;
    }

    public RunnerConfiguration build() throws IllegalArgumentException {
      final RunnerConfiguration config = new RunnerConfiguration(dfaDocument, inputString, trace);
      config.validate();
      return config;
    }

    private RunnerConfigurationBuilder() {}
  }

  private void validate() throws IllegalArgumentException {
    StringBuilder messages = new StringBuilder();
    if (dfaDocument == null) {
      messages.append("DFA document cannot be null. ");
    }
    if (inputString == null) {
      messages.append("Input string cannot be null. ");
    }
    if (messages.length() > 0) {
      throw new IllegalArgumentException(messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "RunnerConfiguration [dfaDocument=" + dfaDocument + ", inputString=" + inputString
        + ", trace=" + trace + "]";
  }

  private RunnerConfiguration(final Path dfaDocument, final String inputString,
      final boolean trace) {
    this.dfaDocument = dfaDocument;
    this.inputString = inputString;
    this.trace = trace;
  }

}
