package com.github.automata;

import com.github.automata.AutomatonException.Code;

/**
 * One outgoing edge of a {@link State}: consuming {@link #getSymbol()} from {@link #getFromState()}
 * moves the machine to {@link #getToState()}. Edges of a Mealy machine also carry the output symbol
 * emitted while taking them; acceptor and Moore edges leave it null.
 * 
 * Transitions are immutable. Rewiring a state replaces its Transition object.
 */
public final class Transition {
  private final State fromState;
  private final Object symbol;
  private final State toState;
  private final Object output;

  Transition(final State fromState, final Object symbol, final State toState, final Object output)
      throws AutomatonException {
    if (fromState == null || toState == null) {
      throw new AutomatonException(Code.INVALID_STATE);
    }
    if (symbol == null) {
      throw new AutomatonException(Code.UNSUPPORTED_SYMBOL, "Transition symbol cannot be null");
    }
    this.fromState = fromState;
    this.symbol = symbol;
    this.toState = toState;
    this.output = output;
  }

  public State getFromState() {
    return fromState;
  }

  public Object getSymbol() {
    return symbol;
  }

  public State getToState() {
    return toState;
  }

  /**
   * Output emitted while taking this edge, null if the edge emits nothing.
   */
  public Object getOutput() {
    return output;
  }

  public boolean hasOutput() {
    return output != null;
  }

  @Override
  public String toString() {
    return "Transition [fromState=" + fromState.getName() + ", symbol=" + symbol + ", toState="
        + toState.getName() + ", output=" + output + "]";
  }
}
