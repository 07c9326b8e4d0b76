package com.github.dfarunner;

/**
 * Unified exception for everything that can go wrong while turning a DFA document into a
 * {@link Dfa}. Structural problems of the automaton itself are not reported here; those are the
 * business of {@link DfaValidator} and {@link InvalidDfaException}.
 */
public final class DfaLoadException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public DfaLoadException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public DfaLoadException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public DfaLoadException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    UNREADABLE_DOCUMENT("DFA document could not be read or is not well-formed YAML"),
    // 2.
    MISSING_FIELD("DFA document lacks a required field"),
    // 3.
    MALFORMED_FIELD("DFA document field holds a value of the wrong shape");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
