package com.github.automata;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.automata.AutomatonException.Code;

/**
 * Stepping machinery shared by Mealy and Moore machines. Subclasses only decide which output a
 * taken transition produces.
 */
abstract class AbstractTransducer implements Transducer {
  private static final Logger logger = LogManager.getLogger(Transducer.class.getSimpleName());

  private final String machineId = UUID.randomUUID().toString();
  private final State initial;
  private final List<Object> alphabet;
  private final AutomatonConfiguration config;
  private final TransducerStatistics stats;
  private State current;

  AbstractTransducer(final State initial, final State current, final Collection<?> alphabet,
      final AutomatonConfiguration config) throws AutomatonException {
    if (initial == null || current == null) {
      throw new AutomatonException(Code.INVALID_STATE);
    }
    if (!Symbols.validAlphabet(alphabet)) {
      throw new AutomatonException(Code.INVALID_ALPHABET);
    }
    if (config == null) {
      throw new AutomatonException(Code.INVALID_MACHINE_CONFIG, "Configuration cannot be null");
    }
    this.initial = initial;
    this.current = current;
    this.alphabet = Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(alphabet)));
    this.config = config;
    this.stats = new TransducerStatistics(machineId, config.getRouteHistorySize());
    stats.entered(current);
    logInfo(String.format("Assembled %s with initial state %s, current state %s",
        getClass().getSimpleName(), initial.getName(), current.getName()));
  }

  /**
   * The output produced by taking transition.
   */
  abstract Object outputOf(final Transition transition);

  @Override
  public Object forward(final Object symbol) throws AutomatonException {
    final Transition transition;
    try {
      transition = current.transitionFor(symbol);
    } catch (AutomatonException undefined) {
      stats.transitionFailures++;
      logDebug(undefined.getMessage());
      throw undefined;
    }
    current = transition.getToState();
    stats.transitionSuccesses++;
    stats.entered(current);
    final Object output = outputOf(transition);
    logDebug(String.format("Transitioned %s->%s on %s emitting %s",
        transition.getFromState().getName(), current.getName(), symbol, output));
    return output;
  }

  @Override
  public List<Object> forward(final List<?> symbols) throws AutomatonException {
    if (symbols == null) {
      throw new AutomatonException(Code.UNSUPPORTED_SYMBOL, "Sequence cannot be null");
    }
    final List<Object> outputs = new ArrayList<>(symbols.size());
    for (final Object symbol : symbols) {
      outputs.add(forward(symbol));
    }
    return outputs;
  }

  @Override
  public void reset() {
    current = initial;
    stats.resets++;
    stats.entered(current);
    logDebug("Reset to initial state " + initial.getName());
  }

  @Override
  public State getCurrentState() {
    return current;
  }

  @Override
  public State getInitialState() {
    return initial;
  }

  @Override
  public Set<State> getStates() {
    return StateGraph.reachable(initial);
  }

  @Override
  public List<Object> getAlphabet() {
    return alphabet;
  }

  @Override
  public String getId() {
    return machineId;
  }

  @Override
  public TransducerStatistics getStatistics() {
    return stats;
  }

  public AutomatonConfiguration getConfiguration() {
    return config;
  }

  void logInfo(final String message) {
    logger.info(new StringBuilder().append("[m:").append(machineId).append("] ").append(message)
        .toString());
  }

  private void logDebug(final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[m:").append(machineId).append("] ")
          .append(message).toString());
    }
  }
}
