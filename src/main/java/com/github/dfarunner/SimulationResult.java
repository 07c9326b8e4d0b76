package com.github.dfarunner;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * This object encapsulates the outcome of running a {@link Dfa} over an input sequence.
 *
 * The route always starts with the start state and holds one more entry per consumed symbol. A run
 * stopped by a symbol outside of the alphabet is rejected, reports that symbol via
 * {@link #getUnrecognizedSymbol()} and has a route that ends at the state the symbol was read in.
 *
 * Users should not try to sub-class and extend this, it would serve little purpose.
 */
public final class SimulationResult<S, A> {
  private final boolean accepted;
  private final List<S> route;
  private final int consumedSymbols;
  private final A unrecognizedSymbol;

  SimulationResult(final boolean accepted, final List<S> route, final int consumedSymbols,
      final A unrecognizedSymbol) {
    this.accepted = accepted;
    this.route = Collections.unmodifiableList(route);
    this.consumedSymbols = consumedSymbols;
    this.unrecognizedSymbol = unrecognizedSymbol;
  }

  public boolean isAccepted() {
    return accepted;
  }

  public List<S> getRoute() {
    return route;
  }

  /**
   * The state the run ended in.
   */
  public S getLastState() {
    return route.get(route.size() - 1);
  }

  public int getConsumedSymbols() {
    return consumedSymbols;
  }

  public Optional<A> getUnrecognizedSymbol() {
    return Optional.ofNullable(unrecognizedSymbol);
  }

  @Override
  public String toString() {
    return "SimulationResult [accepted=" + accepted + ", route=" + route + ", consumedSymbols="
        + consumedSymbols + ", unrecognizedSymbol=" + unrecognizedSymbol + "]";
  }
}
