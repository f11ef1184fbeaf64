package com.github.automata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.AutomatonException.Code;

/**
 * A deterministic finite acceptor over a declared alphabet. It classifies a whole input sequence
 * as accepted or rejected by following one transition per symbol from the initial state and
 * reading the accepting flag of the state it ends up in.
 * 
 * Notes for users:<br>
 * 1. {@link #accept(List)} is pure. Every call starts from the initial state and nothing of it is
 * remembered by the acceptor, so one instance can be shared freely<br>
 * 
 * 2. a symbol without a transition is a configuration bug rather than a rejection.
 * {@link #accept(List)} fails with {@link Code#UNDEFINED_TRANSITION} in that case. Callers that
 * want reject-on-unknown-symbol should {@link #complete()} the acceptor first or catch the
 * exception and treat it as a rejection themselves<br>
 * 
 * 3. totality is not checked at construction unless the {@link AutomatonConfiguration} asks for it
 * via {@link TotalityCheck}<br>
 */
public final class Dfa {
  private static final Logger logger = LogManager.getLogger(Dfa.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final State initial;
  private final List<Object> alphabet;
  private final AutomatonConfiguration config;

  public Dfa(final State initial, final Collection<?> alphabet) throws AutomatonException {
    this(initial, alphabet, AutomatonConfiguration.defaults());
  }

  public Dfa(final State initial, final Collection<?> alphabet,
      final AutomatonConfiguration config) throws AutomatonException {
    if (initial == null) {
      throw new AutomatonException(Code.INVALID_STATE);
    }
    if (!Symbols.validAlphabet(alphabet)) {
      throw new AutomatonException(Code.INVALID_ALPHABET);
    }
    if (config == null) {
      throw new AutomatonException(Code.INVALID_MACHINE_CONFIG, "Configuration cannot be null");
    }
    this.initial = initial;
    this.alphabet = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(alphabet)));
    this.config = config;
    checkTotality();
    logInfo("Assembled acceptor with initial state " + initial.getName() + " over alphabet "
        + this.alphabet);
  }

  /**
   * Run sequence from the initial state and report whether the state reached is accepting. The
   * empty sequence is accepted iff the initial state is accepting.
   */
  public boolean accept(final List<?> sequence) throws AutomatonException {
    if (sequence == null) {
      throw new AutomatonException(Code.UNSUPPORTED_SYMBOL, "Sequence cannot be null");
    }
    State state = initial;
    for (final Object symbol : sequence) {
      state = state.transitionFor(symbol).getToState();
    }
    return state.isAccepting();
  }

  /**
   * Every state reachable from the initial state in breadth-first order.
   */
  public Set<State> getStates() {
    return StateGraph.reachable(initial);
  }

  /**
   * True iff every reachable state has a transition for every symbol of the alphabet.
   */
  public boolean isComplete() {
    return missingTransitions().isEmpty();
  }

  /**
   * The (state, symbol) pairs that keep this acceptor from being complete.
   */
  public List<MissingTransition> missingTransitions() {
    final List<MissingTransition> missing = new ArrayList<>();
    for (final State state : getStates()) {
      for (final Object symbol : alphabet) {
        if (!state.hasTransition(symbol)) {
          missing.add(new MissingTransition(state, symbol));
        }
      }
    }
    return missing;
  }

  /**
   * Build an equivalent acceptor over a copy of this graph where every missing transition leads to
   * a non-accepting sink that loops on itself. This acceptor is left as is.
   */
  public Dfa complete() throws AutomatonException {
    final Map<State, State> copies = StateGraph.copy(initial);
    final List<MissingTransition> missing = missingTransitions();
    if (!missing.isEmpty()) {
      final State sink = new State(sinkName(copies.keySet()));
      for (final Object symbol : alphabet) {
        sink.addTransition(symbol, sink);
      }
      for (final MissingTransition hole : missing) {
        copies.get(hole.getState()).addTransition(hole.getSymbol(), sink);
      }
      logInfo(String.format("Completed acceptor with sink state %s covering %d missing transitions",
          sink.getName(), missing.size()));
    }
    return new Dfa(copies.get(initial), alphabet, config);
  }

  public State getInitialState() {
    return initial;
  }

  public List<Object> getAlphabet() {
    return alphabet;
  }

  public String getId() {
    return machineId;
  }

  public AutomatonConfiguration getConfiguration() {
    return config;
  }

  @Override
  public String toString() {
    return StateGraph.render(initial, false);
  }

  private void checkTotality() throws AutomatonException {
    if (config.getTotalityCheck() == TotalityCheck.NONE) {
      return;
    }
    final List<MissingTransition> missing = missingTransitions();
    if (missing.isEmpty()) {
      return;
    }
    if (config.getTotalityCheck() == TotalityCheck.ENFORCE) {
      throw new AutomatonException(Code.INCOMPLETE_TRANSITIONS,
          String.format("Acceptor is missing %d transitions, first: state %s symbol %s",
              missing.size(), missing.get(0).getState().getName(), missing.get(0).getSymbol()));
    }
    for (final MissingTransition hole : missing) {
      logger.warn(new StringBuilder().append("[m:").append(machineId).append("] State ")
          .append(hole.getState().getName()).append(" has no transition for symbol ")
          .append(hole.getSymbol()).toString());
    }
  }

  private static String sinkName(final Collection<State> states) {
    final Set<String> names = new HashSet<>();
    for (final State state : states) {
      names.add(state.getName());
    }
    String name = "q'";
    while (names.contains(name)) {
      name = name + "'";
    }
    return name;
  }

  private void logInfo(final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }
}
