package com.github.dfarunner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.dfarunner.InvalidDfaException.Code;

/**
 * Proves that a {@link Dfa} is a complete deterministic automaton before anybody runs it.
 *
 * A DFA is valid if:<br>
 * 1. the final states are all in the set of states<br>
 * 2. the start state is in the set of states<br>
 * 3. the transition function only transitions on symbols that are in the alphabet<br>
 * 4. every transition goes from a state in the set of states<br>
 * 5. every transition goes to a state in the set of states<br>
 * 6. every state has a transition for each symbol of the alphabet and for nothing else<br>
 *
 * The checks run in exactly that order and the first failure is thrown; failures are never
 * accumulated. Validation has no side effects besides logging, so validating the same DFA twice
 * yields the same outcome.
 */
public final class DfaValidator {
  private static final Logger logger = LogManager.getLogger(DfaValidator.class.getSimpleName());

  /**
   * Validate the dfa, throwing on the first property it violates.
   */
  public static <S, A> void validate(final Dfa<S, A> dfa) throws InvalidDfaException {
    validateFinalStates(dfa.getStates(), dfa.getFinalStates());
    validateStartState(dfa.getStates(), dfa.getStartState());
    validateTransitions(dfa.getStates(), dfa.getTransitions(), dfa.getAlphabet());
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("Validated dfa with %d states, %d symbols and %d transitions",
          dfa.getStates().size(), dfa.getAlphabet().size(), dfa.getTransitions().size()));
    }
  }

  public static <S> void validateFinalStates(final Set<S> states, final Set<S> finalStates)
      throws InvalidDfaException {
    final Set<S> unknownFinalStates = new LinkedHashSet<>();
    for (final S finalState : finalStates) {
      if (!states.contains(finalState)) {
        unknownFinalStates.add(finalState);
      }
    }
    if (!unknownFinalStates.isEmpty()) {
      throw failure(Code.ACCEPTING_STATES_NOT_IN_STATES,
          Code.ACCEPTING_STATES_NOT_IN_STATES.getDescription() + ": " + unknownFinalStates,
          unknownFinalStates, Collections.emptySet(), null);
    }
  }

  public static <S> void validateStartState(final Set<S> states, final S startState)
      throws InvalidDfaException {
    if (!states.contains(startState)) {
      throw failure(Code.START_STATE_NOT_IN_STATES,
          Code.START_STATE_NOT_IN_STATES.getDescription() + ": '" + startState + "'",
          Collections.singleton(startState), Collections.emptySet(), null);
    }
  }

  /**
   * Checks the transition function against the states and the alphabet: symbols first, then
   * source states, then destination states, and finally totality per state.
   */
  public static <S, A> void validateTransitions(final Set<S> states,
      final Map<TransitionKey<S, A>, S> transitions, final Set<A> alphabet)
      throws InvalidDfaException {
    // all input symbols of the transition function must be in the alphabet
    final Set<A> unknownSymbols = new LinkedHashSet<>();
    for (final TransitionKey<S, A> key : transitions.keySet()) {
      if (!alphabet.contains(key.getSymbol())) {
        unknownSymbols.add(key.getSymbol());
      }
    }
    if (!unknownSymbols.isEmpty()) {
      throw failure(Code.TRANSITION_USES_UNKNOWN_SYMBOLS,
          Code.TRANSITION_USES_UNKNOWN_SYMBOLS.getDescription() + ": " + unknownSymbols,
          Collections.emptySet(), unknownSymbols, null);
    }

    // all source states must be in the set of states
    final Set<S> unknownSources = new LinkedHashSet<>();
    for (final TransitionKey<S, A> key : transitions.keySet()) {
      if (!states.contains(key.getState())) {
        unknownSources.add(key.getState());
      }
    }
    if (!unknownSources.isEmpty()) {
      throw failure(Code.TRANSITION_FROM_UNKNOWN_STATE,
          Code.TRANSITION_FROM_UNKNOWN_STATE.getDescription() + ": " + unknownSources,
          unknownSources, Collections.emptySet(), null);
    }

    // all destination states must be in the set of states
    final Set<S> unknownDestinations = new LinkedHashSet<>();
    for (final S destination : transitions.values()) {
      if (!states.contains(destination)) {
        unknownDestinations.add(destination);
      }
    }
    if (!unknownDestinations.isEmpty()) {
      throw failure(Code.TRANSITION_TO_UNKNOWN_STATE,
          Code.TRANSITION_TO_UNKNOWN_STATE.getDescription() + ".\n" + transitions,
          unknownDestinations, Collections.emptySet(), transitions);
    }

    // every state must have a transition for exactly the symbols of the alphabet. States without
    // any transition at all start out with an empty symbol set and fail here too.
    final Map<S, Set<A>> symbolsByState = new LinkedHashMap<>();
    for (final S state : states) {
      symbolsByState.put(state, new LinkedHashSet<>());
    }
    for (final TransitionKey<S, A> key : transitions.keySet()) {
      symbolsByState.get(key.getState()).add(key.getSymbol());
    }
    for (final Map.Entry<S, Set<A>> stateSymbols : symbolsByState.entrySet()) {
      final Set<A> symbols = stateSymbols.getValue();
      if (!symbols.equals(alphabet)) {
        final Set<A> mismatched = new LinkedHashSet<>();
        for (final A symbol : alphabet) {
          if (!symbols.contains(symbol)) {
            mismatched.add(symbol);
          }
        }
        for (final A symbol : symbols) {
          if (!alphabet.contains(symbol)) {
            mismatched.add(symbol);
          }
        }
        final S state = stateSymbols.getKey();
        throw failure(Code.INCOMPLETE_TRANSITION_FUNCTION, String.format(
            "State '%s' doesn't contain a transition for each character in the alphabet", state),
            Collections.singleton(state), mismatched, null);
      }
    }
  }

  private static InvalidDfaException failure(final Code code, final String message,
      final Set<?> offendingStates, final Set<?> offendingSymbols, final Map<?, ?> transitions) {
    logger.warn(new StringBuilder().append("[").append(code).append("] ").append(message)
        .toString());
    return new InvalidDfaException(code, message, offendingStates, offendingSymbols, transitions);
  }

  private DfaValidator() {}

}
