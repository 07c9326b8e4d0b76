package com.github.dfarunner;

/**
 * Thrown when a simulation hits a symbol that belongs to the alphabet but has no transition out of
 * the current state. That can only happen for a DFA that never went through
 * {@link DfaValidator#validate(Dfa)}, or went through it and had the failure ignored, so this is a
 * caller bug rather than a property of the input. Do not catch and carry on.
 */
public final class UndefinedTransitionException extends IllegalStateException {
  private static final long serialVersionUID = 1L;
  private final Object state;
  private final Object symbol;

  public UndefinedTransitionException(final Object state, final Object symbol) {
    super(String.format(
        "Something went wrong when attempting transition from state '%s' on input '%s'", state,
        symbol));
    this.state = state;
    this.symbol = symbol;
  }

  public Object getState() {
    return state;
  }

  public Object getSymbol() {
    return symbol;
  }
}
