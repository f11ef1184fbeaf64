package com.github.automata;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * The durable form of a machine: one record per state, edges by target name rather than by
 * reference, plus the name of the current state for transducers. A snapshot is self-contained;
 * every name an edge or {@link #getCurrent()} mentions resolves against {@link #getStates()}.
 * 
 * Serialized with Jackson as:
 * 
 * <pre>
 * {
 *   "states": [
 *     {"name": "p", "initial": true, "transitions": [{"symbol": 0, "target": "p", "output": "ok"}]}
 *   ],
 *   "alphabet": [0, 1],
 *   "current": "p"
 * }
 * </pre>
 * 
 * Acceptor records carry "accepting" and have no "current"; transducer records leave "accepting"
 * out. Absent fields are omitted rather than written as null.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"states", "alphabet", "current"})
public final class Snapshot {
  private final List<StateRecord> states;
  private final List<Object> alphabet;
  private final String current;

  @JsonCreator
  public Snapshot(@JsonProperty("states") final List<StateRecord> states,
      @JsonProperty("alphabet") final List<Object> alphabet,
      @JsonProperty("current") final String current) {
    this.states = states == null ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(states));
    this.alphabet = alphabet == null ? Collections.emptyList()
        : Collections.unmodifiableList(new ArrayList<>(alphabet));
    this.current = current;
  }

  @JsonProperty("states")
  public List<StateRecord> getStates() {
    return states;
  }

  @JsonProperty("alphabet")
  public List<Object> getAlphabet() {
    return alphabet;
  }

  @JsonProperty("current")
  public String getCurrent() {
    return current;
  }

  @Override
  public String toString() {
    return "Snapshot [states=" + states + ", alphabet=" + alphabet + ", current=" + current + "]";
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({"name", "initial", "accepting", "transitions"})
  public static final class StateRecord {
    private final String name;
    private final boolean initial;
    private final Boolean accepting;
    private final List<TransitionRecord> transitions;

    @JsonCreator
    public StateRecord(@JsonProperty("name") final String name,
        @JsonProperty("initial") final boolean initial,
        @JsonProperty("accepting") final Boolean accepting,
        @JsonProperty("transitions") final List<TransitionRecord> transitions) {
      this.name = name;
      this.initial = initial;
      this.accepting = accepting;
      this.transitions = transitions == null ? Collections.emptyList()
          : Collections.unmodifiableList(new ArrayList<>(transitions));
    }

    @JsonProperty("name")
    public String getName() {
      return name;
    }

    @JsonProperty("initial")
    public boolean isInitial() {
      return initial;
    }

    /**
     * Null for transducer records.
     */
    @JsonProperty("accepting")
    public Boolean getAccepting() {
      return accepting;
    }

    @JsonProperty("transitions")
    public List<TransitionRecord> getTransitions() {
      return transitions;
    }

    @Override
    public String toString() {
      return "StateRecord [name=" + name + ", initial=" + initial + ", accepting=" + accepting
          + ", transitions=" + transitions + "]";
    }
  }

  @JsonInclude(JsonInclude.Include.NON_NULL)
  @JsonPropertyOrder({"symbol", "target", "output"})
  public static final class TransitionRecord {
    private final Object symbol;
    private final String target;
    private final Object output;

    @JsonCreator
    public TransitionRecord(@JsonProperty("symbol") final Object symbol,
        @JsonProperty("target") final String target,
        @JsonProperty("output") final Object output) {
      this.symbol = symbol;
      this.target = target;
      this.output = output;
    }

    @JsonProperty("symbol")
    public Object getSymbol() {
      return symbol;
    }

    @JsonProperty("target")
    public String getTarget() {
      return target;
    }

    @JsonProperty("output")
    public Object getOutput() {
      return output;
    }

    @Override
    public String toString() {
      return "TransitionRecord [symbol=" + symbol + ", target=" + target + ", output=" + output
          + "]";
    }
  }
}
