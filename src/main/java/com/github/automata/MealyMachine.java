package com.github.automata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.github.automata.AutomatonException.Code;

/**
 * A Mealy machine: the output of every step is carried by the transition taken, so it depends on
 * both the state the machine was in and the symbol consumed.
 * 
 * A machine can be snapshotted between any two steps with {@link AutomatonCodec} and restored
 * later; the restored machine carries on from the same current state as if it had never stopped.
 */
public final class MealyMachine extends AbstractTransducer {

  public MealyMachine(final State initial) throws AutomatonException {
    this(initial, Collections.emptyList(), AutomatonConfiguration.defaults());
  }

  public MealyMachine(final State initial, final Collection<?> alphabet)
      throws AutomatonException {
    this(initial, alphabet, AutomatonConfiguration.defaults());
  }

  public MealyMachine(final State initial, final Collection<?> alphabet,
      final AutomatonConfiguration config) throws AutomatonException {
    super(initial, initial, alphabet, config);
  }

  // restores a machine mid-run, see AutomatonCodec
  MealyMachine(final State initial, final State current, final Collection<?> alphabet,
      final AutomatonConfiguration config) throws AutomatonException {
    super(initial, current, alphabet, config);
  }

  /**
   * Same as {@link #forward(Object)}.
   */
  public Object step(final Object symbol) throws AutomatonException {
    return forward(symbol);
  }

  /**
   * Run a whole sequence from the current state, collect the outputs that were actually emitted
   * along with the position of the symbol that emitted them and reset the machine afterwards. If a
   * symbol has no transition, the machine is left where it stopped and the failure propagates.
   */
  public List<Emission> process(final List<?> symbols) throws AutomatonException {
    if (symbols == null) {
      throw new AutomatonException(Code.UNSUPPORTED_SYMBOL, "Sequence cannot be null");
    }
    final List<Emission> emissions = new ArrayList<>();
    int position = 0;
    for (final Object symbol : symbols) {
      position++;
      final Object output = forward(symbol);
      if (output != null) {
        emissions.add(new Emission(position, output));
      }
    }
    reset();
    return emissions;
  }

  @Override
  Object outputOf(final Transition transition) {
    return transition.getOutput();
  }

  @Override
  public String toString() {
    return StateGraph.render(getInitialState(), true);
  }
}
