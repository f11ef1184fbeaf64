package com.github.automata;

/**
 * A hole in an acceptor's transition table: {@link #getState()} has no edge for
 * {@link #getSymbol()} although the symbol belongs to the alphabet.
 */
public final class MissingTransition {
  private final State state;
  private final Object symbol;

  MissingTransition(final State state, final Object symbol) {
    this.state = state;
    this.symbol = symbol;
  }

  public State getState() {
    return state;
  }

  public Object getSymbol() {
    return symbol;
  }

  @Override
  public String toString() {
    return "MissingTransition [state=" + state.getName() + ", symbol=" + symbol + "]";
  }
}
