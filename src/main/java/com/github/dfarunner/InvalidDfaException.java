package com.github.dfarunner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Thrown by the {@link DfaValidator} when a {@link Dfa} does not satisfy the definition of a
 * complete deterministic automaton. The code enum tells which property failed; the offending
 * states, symbols and, where it helps, the whole transition map ride along so that callers can
 * build a useful diagnostic.
 *
 * A malformed DFA stays malformed, so there is never a point in retrying whatever threw this.
 */
public final class InvalidDfaException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;
  private final Set<Object> offendingStates;
  private final Set<Object> offendingSymbols;
  private final Map<?, ?> transitions;

  public InvalidDfaException(final Code code) {
    this(code, code.getDescription(), Collections.emptySet(), Collections.emptySet(), null);
  }

  public InvalidDfaException(final Code code, final String message,
      final Set<?> offendingStates, final Set<?> offendingSymbols, final Map<?, ?> transitions) {
    super(message);
    this.code = code;
    this.offendingStates =
        Collections.unmodifiableSet(new LinkedHashSet<Object>(offendingStates));
    this.offendingSymbols =
        Collections.unmodifiableSet(new LinkedHashSet<Object>(offendingSymbols));
    this.transitions = transitions == null ? Collections.<Object, Object>emptyMap()
        : Collections.unmodifiableMap(new LinkedHashMap<Object, Object>(transitions));
  }

  public Code getCode() {
    return code;
  }

  /**
   * States that caused the failure: accepting states or transition sources outside of the state
   * set, unknown transition destinations, the missing start state, or the state whose transitions
   * do not cover the alphabet.
   */
  public Set<Object> getOffendingStates() {
    return offendingStates;
  }

  /**
   * Symbols that caused the failure: transition symbols outside of the alphabet, or for an
   * incomplete transition function the symbols on which the offending state's transitions and the
   * alphabet disagree.
   */
  public Set<Object> getOffendingSymbols() {
    return offendingSymbols;
  }

  /**
   * The complete transition map, populated for {@link Code#TRANSITION_TO_UNKNOWN_STATE} only.
   */
  public Map<?, ?> getTransitions() {
    return transitions;
  }

  public static enum Code {
    // 1.
    ACCEPTING_STATES_NOT_IN_STATES("Accepting states should be in the list of states"),
    // 2.
    START_STATE_NOT_IN_STATES("Start state should be in the list of states"),
    // 3.
    TRANSITION_USES_UNKNOWN_SYMBOLS(
        "A transition uses characters that aren't in the DFA's alphabet"),
    // 4.
    TRANSITION_FROM_UNKNOWN_STATE("A transition goes from an invalid state"),
    // 5.
    TRANSITION_TO_UNKNOWN_STATE("A transition goes to an invalid state"),
    // 6.
    INCOMPLETE_TRANSITION_FUNCTION(
        "A state doesn't contain a transition for each character in the alphabet");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
