package com.github.automata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.github.automata.AutomatonException.Code;

/**
 * A named node of a state graph. It holds the initial and accepting flags and an outgoing
 * transition table keyed by input symbol, with at most one transition per symbol.
 * 
 * Notes for users:<br>
 * 1. states are shared by the machines that reference them and by each other via transitions. The
 * graph is generally cyclic and a state may point at itself<br>
 * 
 * 2. equality is object identity. Two states with the same name are still two different nodes,
 * which is what lets graph traversals terminate on cycles without relying on names<br>
 * 
 * 3. the same state type serves acceptors, Mealy machines and Moore machines. Acceptors read
 * {@link #isAccepting()}, Mealy machines read the output on each {@link Transition} and Moore
 * machines read {@link #getOutput()}<br>
 * 
 * 4. the transition table is meant to be wired before execution starts. Running a machine never
 * mutates its states<br>
 */
public final class State {
  final static int maxStateNameLength = 64;

  private final String name;
  private final boolean initial;
  private final boolean accepting;
  private final TransitionMode transitionMode;
  // insertion ordered so that rendering and snapshots come out the same every time
  private final Map<Object, Transition> transitions = new LinkedHashMap<>();
  private Object output; // optional, Moore machines only

  public State(final String name) throws AutomatonException {
    this(name, false, false, TransitionMode.LAST_WRITE_WINS);
  }

  public State(final String name, final boolean initial, final boolean accepting)
      throws AutomatonException {
    this(name, initial, accepting, TransitionMode.LAST_WRITE_WINS);
  }

  public State(final String name, final boolean initial, final boolean accepting,
      final TransitionMode transitionMode) throws AutomatonException {
    if (name == null || name.trim().isEmpty() || name.trim().length() > maxStateNameLength) {
      throw new AutomatonException(Code.INVALID_STATE_NAME);
    }
    this.name = name.trim();
    this.initial = initial;
    this.accepting = accepting;
    this.transitionMode =
        transitionMode == null ? TransitionMode.LAST_WRITE_WINS : transitionMode;
  }

  /**
   * Register the outgoing edge for symbol. Depending on the {@link TransitionMode}, an existing
   * edge for the same symbol is either replaced or refused with
   * {@link Code#DUPLICATE_TRANSITION}.
   */
  public void addTransition(final Object symbol, final State target) throws AutomatonException {
    addTransition(symbol, target, null);
  }

  /**
   * Register the outgoing edge for symbol that emits output when taken.
   */
  public void addTransition(final Object symbol, final State target, final Object output)
      throws AutomatonException {
    final Transition transition = new Transition(this, symbol, target, output);
    if (transitionMode == TransitionMode.STRICT && transitions.containsKey(symbol)) {
      throw new AutomatonException(Code.DUPLICATE_TRANSITION,
          String.format("State %s already has a transition for symbol %s", name, symbol));
    }
    transitions.put(symbol, transition);
  }

  /**
   * Lookup the outgoing edge for symbol. This is the only failure that executing a machine can run
   * into.
   */
  public Transition transitionFor(final Object symbol) throws AutomatonException {
    final Transition transition = symbol == null ? null : transitions.get(symbol);
    if (transition == null) {
      throw new AutomatonException(Code.UNDEFINED_TRANSITION,
          String.format("State %s has no transition for symbol %s", name, symbol));
    }
    return transition;
  }

  public boolean hasTransition(final Object symbol) {
    return symbol != null && transitions.containsKey(symbol);
  }

  public Map<Object, Transition> getTransitions() {
    return Collections.unmodifiableMap(transitions);
  }

  public String getName() {
    return name;
  }

  public boolean isInitial() {
    return initial;
  }

  public boolean isAccepting() {
    return accepting;
  }

  public TransitionMode getTransitionMode() {
    return transitionMode;
  }

  public Object getOutput() {
    return output;
  }

  public void setOutput(final Object output) {
    this.output = output;
  }

  @Override
  public String toString() {
    return "State [name=" + name + ", initial=" + initial + ", accepting=" + accepting + "]";
  }
}
