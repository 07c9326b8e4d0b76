package com.github.dfarunner;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs a {@link Dfa} over a finite input sequence: single pass, no lookahead, no backtracking.
 *
 * Simulation assumes the dfa already passed {@link DfaValidator#validate(Dfa)} and never validates
 * it again. The two ways a lookup can come up empty are treated very differently:<br>
 * 1. the symbol is not in the alphabet: the input is simply not in the language, so the run stops
 * right there and rejects without looking at the remaining symbols<br>
 * 2. the symbol is in the alphabet: the transition function is not total, which a validated dfa
 * rules out, so an {@link UndefinedTransitionException} is thrown<br>
 *
 * The only mutable state of a run is its current state register, which lives on the caller's stack;
 * any number of threads may simulate the same dfa concurrently.
 */
public final class DfaSimulator {
  private static final Logger logger = LogManager.getLogger(DfaSimulator.class.getSimpleName());

  /**
   * Returns true iff the dfa ends up in an accepting state after consuming the whole input. Empty
   * input is accepted iff the start state is accepting.
   */
  public static <S, A> boolean accepts(final Dfa<S, A> dfa, final Iterable<? extends A> input) {
    return run(dfa, input).isAccepted();
  }

  /**
   * Convenience for dfas over one-character string symbols: every code point of the input is one
   * symbol.
   */
  public static <S> boolean accepts(final Dfa<S, String> dfa, final String input) {
    return run(dfa, symbolsOf(input)).isAccepted();
  }

  public static <S, A> SimulationResult<S, A> run(final Dfa<S, A> dfa,
      final Iterable<? extends A> input) {
    final Map<TransitionKey<S, A>, S> transitions = dfa.getTransitions();
    final List<S> route = new ArrayList<>();
    S currentState = dfa.getStartState();
    route.add(currentState);
    int consumed = 0;
    for (final A symbol : input) {
      final TransitionKey<S, A> key = TransitionKey.of(currentState, symbol);
      if (!transitions.containsKey(key)) {
        if (!dfa.getAlphabet().contains(symbol)) {
          if (logger.isDebugEnabled()) {
            logger.debug(String.format("Rejecting on symbol '%s' outside of the alphabet at %d",
                symbol, consumed));
          }
          return new SimulationResult<>(false, route, consumed, symbol);
        }
        logger.error(String.format(
            "No transition from state '%s' on input '%s', was the dfa validated?", currentState,
            symbol));
        throw new UndefinedTransitionException(currentState, symbol);
      }
      final S nextState = transitions.get(key);
      if (logger.isTraceEnabled()) {
        logger.trace(String.format("%s --%s--> %s", currentState, symbol, nextState));
      }
      currentState = nextState;
      route.add(currentState);
      consumed++;
    }
    final boolean accepted = dfa.isFinal(currentState);
    if (logger.isDebugEnabled()) {
      logger.debug(String.format("%s after %d symbols in state '%s'",
          accepted ? "Accepted" : "Rejected", consumed, currentState));
    }
    return new SimulationResult<>(accepted, route, consumed, null);
  }

  /**
   * Splits a string into its code points, each as its own string symbol.
   */
  public static List<String> symbolsOf(final String input) {
    final List<String> symbols = new ArrayList<>(input.length());
    input.codePoints().forEach(codePoint -> symbols.add(new String(Character.toChars(codePoint))));
    return symbols;
  }

  private DfaSimulator() {}

}
