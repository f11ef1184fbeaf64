package com.github.automata;

import java.util.List;
import java.util.Set;

/**
 * A finite state machine that emits one output per input symbol it consumes. Unlike an acceptor,
 * a transducer remembers where it is between calls: every {@link #forward(Object)} moves the
 * current state and that position stays put until the next call or a {@link #reset()}.
 * 
 * Notes for users:<br>
 * 1. a transducer instance is not thread-safe. If several threads drive the same instance, they
 * must serialize access themselves eg. with one lock per transducer<br>
 * 
 * 2. there's no lifecycle to manage. A transducer stays steppable for as long as it is referenced,
 * including after a failed step<br>
 * 
 * 3. a failed step never moves the machine. When {@link #forward(Object)} throws
 * {@link AutomatonException.Code#UNDEFINED_TRANSITION}, {@link #getCurrentState()} is exactly what
 * it was before the call<br>
 * 
 * 4. there's no buffered input. Stepping symbol by symbol and stepping a whole sequence at once
 * leave the machine in the same place, so a machine can be snapshotted between any two steps<br>
 */
public interface Transducer {

  /**
   * Consume one symbol from the current state and return the output it produced, which may be
   * null.
   */
  Object forward(final Object symbol) throws AutomatonException;

  /**
   * Consume symbols left to right, one {@link #forward(Object)} each, and return the outputs in the
   * same order. If a symbol fails, the symbols before it stay consumed.
   */
  List<Object> forward(final List<?> symbols) throws AutomatonException;

  /**
   * Move back to the initial state.
   */
  void reset();

  /**
   * Report the state the machine currently sits in.
   */
  State getCurrentState();

  /**
   * Report the root of the state graph.
   */
  State getInitialState();

  /**
   * All states reachable from the initial state in breadth-first order.
   */
  Set<State> getStates();

  /**
   * The declared alphabet, possibly empty. It is informational; stepping does not consult it.
   */
  List<Object> getAlphabet();

  /**
   * Reports the id of this transducer instance. It's used to tag log lines.
   */
  String getId();

  /**
   * Report statistics for this transducer.
   */
  TransducerStatistics getStatistics();

}
