package com.github.dfarunner;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A deterministic finite automaton: the 5-tuple of states, alphabet, transition function, start
 * state and accepting states.
 *
 * Notes for users:<br>
 * 1. instances are immutable; all collections handed out are unmodifiable and keep the order in
 * which elements were supplied<br>
 *
 * 2. construction never checks the structure. A Dfa with a partial transition function or a start
 * state outside of its states is perfectly representable; run it through
 * {@link DfaValidator#validate(Dfa)} before trusting it<br>
 *
 * 3. since nothing about a Dfa ever changes, the same instance can be simulated by any number of
 * threads at once<br>
 *
 * @param <S> type of the states
 * @param <A> type of the alphabet symbols
 */
public final class Dfa<S, A> {
  private final Set<S> states;
  private final Set<A> alphabet;
  private final Map<TransitionKey<S, A>, S> transitions;
  private final S startState;
  private final Set<S> finalStates;

  private Dfa(final Set<S> states, final Set<A> alphabet,
      final Map<TransitionKey<S, A>, S> transitions, final S startState,
      final Set<S> finalStates) {
    this.states = Collections.unmodifiableSet(new LinkedHashSet<>(states));
    this.alphabet = Collections.unmodifiableSet(new LinkedHashSet<>(alphabet));
    this.transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
    this.startState = startState;
    this.finalStates = Collections.unmodifiableSet(new LinkedHashSet<>(finalStates));
  }

  public Set<S> getStates() {
    return states;
  }

  public Set<A> getAlphabet() {
    return alphabet;
  }

  public Map<TransitionKey<S, A>, S> getTransitions() {
    return transitions;
  }

  public S getStartState() {
    return startState;
  }

  public Set<S> getFinalStates() {
    return finalStates;
  }

  /**
   * Destination of the transition out of state on symbol, or null if the transition function has
   * no such entry.
   */
  public S transition(final S state, final A symbol) {
    return transitions.get(TransitionKey.of(state, symbol));
  }

  public boolean isFinal(final S state) {
    return finalStates.contains(state);
  }

  @Override
  public String toString() {
    return "Dfa [states=" + states + ", alphabet=" + alphabet + ", transitions=" + transitions
        + ", startState=" + startState + ", finalStates=" + finalStates + "]";
  }

  public static <S, A> DfaBuilder<S, A> newBuilder() {
    return new DfaBuilder<>();
  }

  /**
   * A simple builder to let users use fluent APIs to describe DFAs.
   */
  public final static class DfaBuilder<S, A> {
    private final Set<S> states = new LinkedHashSet<>();
    private final Set<A> alphabet = new LinkedHashSet<>();
    private final Map<TransitionKey<S, A>, S> transitions = new LinkedHashMap<>();
    private S startState;
    private final Set<S> finalStates = new LinkedHashSet<>();

    public DfaBuilder<S, A> state(final S state) {
      this.states.add(state);
      return this;
    }

    @SafeVarargs
    public final DfaBuilder<S, A> states(final S... states) {
      return states(Arrays.asList(states));
    }

    public DfaBuilder<S, A> states(final Collection<? extends S> states) {
      this.states.addAll(states);
      return this;
    }

    public DfaBuilder<S, A> symbol(final A symbol) {
      this.alphabet.add(symbol);
      return this;
    }

    @SafeVarargs
    public final DfaBuilder<S, A> alphabet(final A... symbols) {
      return alphabet(Arrays.asList(symbols));
    }

    public DfaBuilder<S, A> alphabet(final Collection<? extends A> symbols) {
      this.alphabet.addAll(symbols);
      return this;
    }

    /**
     * Adds fromState --symbol--> toState. A later call for the same (fromState, symbol) replaces
     * the earlier destination, the way a second key in a map would.
     */
    public DfaBuilder<S, A> transition(final S fromState, final A symbol, final S toState) {
      this.transitions.put(TransitionKey.of(fromState, symbol), toState);
      return this;
    }

    public DfaBuilder<S, A> transitions(final Map<TransitionKey<S, A>, S> transitions) {
      this.transitions.putAll(transitions);
      return this;
    }

    public DfaBuilder<S, A> startState(final S startState) {
      this.startState = startState;
      return this;
    }

    public DfaBuilder<S, A> finalState(final S finalState) {
      this.finalStates.add(finalState);
      return this;
    }

    @SafeVarargs
    public final DfaBuilder<S, A> finalStates(final S... finalStates) {
      return finalStates(Arrays.asList(finalStates));
    }

    public DfaBuilder<S, A> finalStates(final Collection<? extends S> finalStates) {
      this.finalStates.addAll(finalStates);
      return this;
    }

    public Dfa<S, A> build() {
      return new Dfa<>(states, alphabet, transitions, startState, finalStates);
    }

    private DfaBuilder() {}
  }

}
