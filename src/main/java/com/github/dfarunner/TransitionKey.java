package com.github.dfarunner;

import java.util.Objects;

/**
 * The (state, symbol) argument pair of a transition function. Both halves take part in equality and
 * hashing, so any state and symbol types with sane equals()/hashCode() work as keys.
 */
public final class TransitionKey<S, A> {
  private final S state;
  private final A symbol;

  private TransitionKey(final S state, final A symbol) {
    this.state = state;
    this.symbol = symbol;
  }

  public static <S, A> TransitionKey<S, A> of(final S state, final A symbol) {
    return new TransitionKey<>(state, symbol);
  }

  public S getState() {
    return state;
  }

  public A getSymbol() {
    return symbol;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionKey)) {
      return false;
    }
    TransitionKey<?, ?> other = (TransitionKey<?, ?>) o;
    return Objects.equals(state, other.state) && Objects.equals(symbol, other.symbol);
  }

  @Override
  public int hashCode() {
    return Objects.hash(state, symbol);
  }

  @Override
  public String toString() {
    return "(" + state + ", " + symbol + ")";
  }
}
