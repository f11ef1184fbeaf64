package com.github.automata;

import java.util.Collection;
import java.util.Collections;

/**
 * A Moore machine: the output of every step belongs to the state the machine moves into, see
 * {@link State#setOutput(Object)}. Transition outputs are ignored.
 */
public final class MooreMachine extends AbstractTransducer {

  public MooreMachine(final State initial) throws AutomatonException {
    this(initial, Collections.emptyList(), AutomatonConfiguration.defaults());
  }

  public MooreMachine(final State initial, final Collection<?> alphabet)
      throws AutomatonException {
    this(initial, alphabet, AutomatonConfiguration.defaults());
  }

  public MooreMachine(final State initial, final Collection<?> alphabet,
      final AutomatonConfiguration config) throws AutomatonException {
    super(initial, initial, alphabet, config);
  }

  @Override
  Object outputOf(final Transition transition) {
    return transition.getToState().getOutput();
  }

  @Override
  public String toString() {
    return StateGraph.render(getInitialState(), false);
  }
}
