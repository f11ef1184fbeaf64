package com.github.automata;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.github.automata.AutomatonException.Code;
import com.github.automata.Snapshot.StateRecord;
import com.github.automata.Snapshot.TransitionRecord;

/**
 * Converts machines to and from {@link Snapshot}s and reads/writes those as JSON.
 * 
 * Notes for users:<br>
 * 1. saving walks every state reachable from the initial state once, whatever cycles the graph
 * has, and records edges by target name. The record of the machine's initial state is the only
 * one marked initial, whatever flags the caller gave the other states<br>
 * 
 * 2. loading first creates every state and only then wires edges, so records may refer to states
 * declared later in the snapshot. A restored Mealy machine sits on the recorded current state and
 * carries on from there; nothing is replayed<br>
 * 
 * 3. any structural problem with a snapshot is reported as {@link Code#MALFORMED_SNAPSHOT} and no
 * machine is built. Failing to read or write the file is {@link Code#SNAPSHOT_IO_FAILURE}<br>
 * 
 * 4. symbols and outputs must be Strings or Integers, the values JSON gives back unchanged.
 * Saving a machine with anything else fails with {@link Code#UNSUPPORTED_SYMBOL} before any byte
 * is written<br>
 * 
 * 5. saving to a path writes a sibling temporary file and moves it over the destination, so a
 * reader sees either the previous snapshot or the new one. The codec never keeps a handle open past
 * the call<br>
 */
public final class AutomatonCodec {
  private static final Logger logger = LogManager.getLogger(AutomatonCodec.class.getSimpleName());

  private final AutomatonConfiguration config;
  private final ObjectMapper mapper;

  public AutomatonCodec() {
    this.config = AutomatonConfiguration.defaults();
    this.mapper = newMapper();
  }

  public AutomatonCodec(final AutomatonConfiguration config) throws AutomatonException {
    if (config == null) {
      throw new AutomatonException(Code.INVALID_MACHINE_CONFIG, "Configuration cannot be null");
    }
    this.config = config;
    this.mapper = newMapper();
  }

  private static ObjectMapper newMapper() {
    final ObjectMapper mapper = new ObjectMapper();
    // callers passing a Reader or Writer own it
    mapper.configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false);
    mapper.configure(JsonParser.Feature.AUTO_CLOSE_SOURCE, false);
    return mapper;
  }

  ///// Mealy machines /////
  public Snapshot toSnapshot(final MealyMachine machine) throws AutomatonException {
    if (machine == null) {
      throw new AutomatonException(Code.INVALID_STATE, "Machine cannot be null");
    }
    return new Snapshot(records(machine.getInitialState(), false),
        alphabet(machine.getAlphabet()), machine.getCurrentState().getName());
  }

  public MealyMachine mealyMachineFromSnapshot(final Snapshot snapshot)
      throws AutomatonException {
    final Map<String, State> states = materialize(snapshot, false);
    final State initial = initialOf(snapshot, states);
    if (snapshot.getCurrent() == null) {
      throw malformed("Snapshot has no current state");
    }
    final State current = states.get(snapshot.getCurrent());
    if (current == null) {
      throw malformed("Current state " + snapshot.getCurrent() + " is not declared");
    }
    if (!StateGraph.reachable(initial).contains(current)) {
      throw malformed(
          "Current state " + current.getName() + " is not reachable from the initial state");
    }
    return new MealyMachine(initial, current, alphabet(snapshot), config);
  }

  public void save(final MealyMachine machine, final Path destination)
      throws AutomatonException {
    final Snapshot snapshot = toSnapshot(machine);
    writeAtomically(snapshot, destination);
    logger.info(String.format("[m:%s] Saved %d states, current state %s to %s", machine.getId(),
        snapshot.getStates().size(), snapshot.getCurrent(), destination));
  }

  public void write(final MealyMachine machine, final Writer writer) throws AutomatonException {
    write(toSnapshot(machine), writer);
  }

  public MealyMachine loadMealyMachine(final Path source) throws AutomatonException {
    final MealyMachine machine = mealyMachineFromSnapshot(readFile(source));
    logger.info(String.format("[m:%s] Loaded from %s, current state %s", machine.getId(), source,
        machine.getCurrentState().getName()));
    return machine;
  }

  public MealyMachine readMealyMachine(final Reader reader) throws AutomatonException {
    return mealyMachineFromSnapshot(read(reader));
  }

  ///// Acceptors /////
  public Snapshot toSnapshot(final Dfa acceptor) throws AutomatonException {
    if (acceptor == null) {
      throw new AutomatonException(Code.INVALID_STATE, "Acceptor cannot be null");
    }
    return new Snapshot(records(acceptor.getInitialState(), true),
        alphabet(acceptor.getAlphabet()), null);
  }

  public Dfa dfaFromSnapshot(final Snapshot snapshot) throws AutomatonException {
    final Map<String, State> states = materialize(snapshot, true);
    final State initial = initialOf(snapshot, states);
    if (snapshot.getCurrent() != null) {
      throw malformed("Acceptor snapshots carry no current state");
    }
    return new Dfa(initial, alphabet(snapshot), config);
  }

  public void save(final Dfa acceptor, final Path destination) throws AutomatonException {
    final Snapshot snapshot = toSnapshot(acceptor);
    writeAtomically(snapshot, destination);
    logger.info(String.format("[m:%s] Saved %d states to %s", acceptor.getId(),
        snapshot.getStates().size(), destination));
  }

  public void write(final Dfa acceptor, final Writer writer) throws AutomatonException {
    write(toSnapshot(acceptor), writer);
  }

  public Dfa loadDfa(final Path source) throws AutomatonException {
    final Dfa acceptor = dfaFromSnapshot(readFile(source));
    logger.info(String.format("[m:%s] Loaded from %s", acceptor.getId(), source));
    return acceptor;
  }

  public Dfa readDfa(final Reader reader) throws AutomatonException {
    return dfaFromSnapshot(read(reader));
  }

  ///// Snapshot <-> graph /////
  private static List<StateRecord> records(final State initial, final boolean acceptor)
      throws AutomatonException {
    final List<StateRecord> records = new ArrayList<>();
    final Map<String, State> seenNames = new HashMap<>();
    for (final State state : StateGraph.reachable(initial)) {
      if (seenNames.put(state.getName(), state) != null) {
        throw new AutomatonException(Code.INVALID_STATE_NAME,
            "Two reachable states are both named " + state.getName());
      }
      final List<TransitionRecord> transitions = new ArrayList<>();
      for (final Transition transition : state.getTransitions().values()) {
        final Object output = acceptor ? null : transition.getOutput();
        checkRepresentable(transition.getSymbol(), "symbol", state);
        if (output != null) {
          checkRepresentable(output, "output", state);
        }
        transitions.add(new TransitionRecord(transition.getSymbol(),
            transition.getToState().getName(), output));
      }
      records.add(new StateRecord(state.getName(), state == initial,
          acceptor ? Boolean.valueOf(state.isAccepting()) : null, transitions));
    }
    return records;
  }

  private static List<Object> alphabet(final List<Object> alphabet) throws AutomatonException {
    for (final Object symbol : alphabet) {
      if (!Symbols.representable(symbol)) {
        throw new AutomatonException(Code.UNSUPPORTED_SYMBOL, String.format(
            "Alphabet symbol %s of type %s cannot be saved", symbol, symbol.getClass().getName()));
      }
    }
    return alphabet;
  }

  private static List<Object> alphabet(final Snapshot snapshot) throws AutomatonException {
    for (final Object symbol : snapshot.getAlphabet()) {
      if (!Symbols.representable(symbol)) {
        throw malformed("Alphabet symbol " + symbol + " is neither a string nor an integer");
      }
    }
    return snapshot.getAlphabet();
  }

  /**
   * Create one state per record, then wire every edge. Returns the states by name.
   */
  private static Map<String, State> materialize(final Snapshot snapshot, final boolean acceptor)
      throws AutomatonException {
    if (snapshot == null || snapshot.getStates().isEmpty()) {
      throw malformed("Snapshot declares no states");
    }
    final Map<String, State> states = new HashMap<>();
    for (final StateRecord record : snapshot.getStates()) {
      if (record == null || record.getName() == null) {
        throw malformed("State record without a name");
      }
      if (!record.getName().equals(record.getName().trim())) {
        throw malformed("State name '" + record.getName() + "' has surrounding whitespace");
      }
      if (states.containsKey(record.getName())) {
        throw malformed("State " + record.getName() + " is declared more than once");
      }
      final boolean accepting = acceptor && Boolean.TRUE.equals(record.getAccepting());
      final State state;
      try {
        state = new State(record.getName(), record.isInitial(), accepting);
      } catch (AutomatonException invalidName) {
        throw new AutomatonException(Code.MALFORMED_SNAPSHOT,
            "State name " + record.getName() + " is invalid", invalidName);
      }
      states.put(state.getName(), state);
    }
    for (final StateRecord record : snapshot.getStates()) {
      final State state = states.get(record.getName());
      for (final TransitionRecord transition : record.getTransitions()) {
        if (transition == null || transition.getSymbol() == null) {
          throw malformed("State " + state.getName() + " has a transition without a symbol");
        }
        if (!Symbols.representable(transition.getSymbol())) {
          throw malformed("State " + state.getName() + " has a transition on "
              + transition.getSymbol() + " which is neither a string nor an integer");
        }
        if (transition.getOutput() != null && !Symbols.representable(transition.getOutput())) {
          throw malformed("State " + state.getName() + " has a transition emitting "
              + transition.getOutput() + " which is neither a string nor an integer");
        }
        final State target =
            transition.getTarget() == null ? null : states.get(transition.getTarget());
        if (target == null) {
          throw malformed(String.format("State %s has a transition on %s to undeclared state %s",
              state.getName(), transition.getSymbol(), transition.getTarget()));
        }
        if (state.hasTransition(transition.getSymbol())) {
          throw malformed(String.format("State %s has more than one transition on %s",
              state.getName(), transition.getSymbol()));
        }
        state.addTransition(transition.getSymbol(), target,
            acceptor ? null : transition.getOutput());
      }
    }
    return states;
  }

  private static State initialOf(final Snapshot snapshot, final Map<String, State> states)
      throws AutomatonException {
    State initial = null;
    for (final StateRecord record : snapshot.getStates()) {
      if (record.isInitial()) {
        if (initial != null) {
          throw malformed("More than one state is marked initial");
        }
        initial = states.get(record.getName());
      }
    }
    if (initial == null) {
      throw malformed("No state is marked initial");
    }
    return initial;
  }

  private static void checkRepresentable(final Object value, final String what, final State state)
      throws AutomatonException {
    if (!Symbols.representable(value)) {
      throw new AutomatonException(Code.UNSUPPORTED_SYMBOL,
          String.format("Transition %s %s of type %s on state %s cannot be saved", what, value,
              value.getClass().getName(), state.getName()));
    }
  }

  private static AutomatonException malformed(final String message) {
    return new AutomatonException(Code.MALFORMED_SNAPSHOT, message);
  }

  ///// JSON <-> Snapshot /////
  private ObjectWriter jsonWriter() {
    return config.getPrettyPrintSnapshots() ? mapper.writerWithDefaultPrettyPrinter()
        : mapper.writer();
  }

  private void write(final Snapshot snapshot, final Writer writer) throws AutomatonException {
    try {
      jsonWriter().writeValue(writer, snapshot);
      writer.flush();
    } catch (IOException problem) {
      logger.error("Failed to write snapshot", problem);
      throw new AutomatonException(Code.SNAPSHOT_IO_FAILURE, problem);
    }
  }

  private Snapshot read(final Reader reader) throws AutomatonException {
    final Snapshot snapshot;
    try {
      snapshot = mapper.readValue(reader, Snapshot.class);
    } catch (JsonProcessingException problem) {
      throw new AutomatonException(Code.MALFORMED_SNAPSHOT,
          "Snapshot is not valid: " + problem.getOriginalMessage(), problem);
    } catch (CharacterCodingException problem) {
      throw new AutomatonException(Code.MALFORMED_SNAPSHOT, "Snapshot is not valid UTF-8", problem);
    } catch (IOException problem) {
      logger.error("Failed to read snapshot", problem);
      throw new AutomatonException(Code.SNAPSHOT_IO_FAILURE, problem);
    }
    if (snapshot == null) {
      throw malformed("Snapshot is empty");
    }
    return snapshot;
  }

  private Snapshot readFile(final Path source) throws AutomatonException {
    if (source == null) {
      throw new AutomatonException(Code.SNAPSHOT_IO_FAILURE, "Source path cannot be null");
    }
    try (Reader reader = Files.newBufferedReader(source, StandardCharsets.UTF_8)) {
      return read(reader);
    } catch (IOException problem) {
      logger.error("Failed to open snapshot " + source, problem);
      throw new AutomatonException(Code.SNAPSHOT_IO_FAILURE,
          "Failed to open snapshot " + source, problem);
    }
  }

  private void writeAtomically(final Snapshot snapshot, final Path destination)
      throws AutomatonException {
    if (destination == null) {
      throw new AutomatonException(Code.SNAPSHOT_IO_FAILURE, "Destination path cannot be null");
    }
    final Path target = destination.toAbsolutePath();
    Path temporary = null;
    try {
      temporary = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
      try (Writer writer = Files.newBufferedWriter(temporary, StandardCharsets.UTF_8)) {
        write(snapshot, writer);
      }
      keepPermissions(target, temporary);
      try {
        Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING,
            StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException notSupported) {
        logger.warn("Atomic move is not supported for " + target + ", replacing it in place");
        Files.move(temporary, target, StandardCopyOption.REPLACE_EXISTING);
      }
      temporary = null;
    } catch (IOException problem) {
      logger.error("Failed to save snapshot to " + target, problem);
      throw new AutomatonException(Code.SNAPSHOT_IO_FAILURE,
          "Failed to save snapshot to " + target, problem);
    } finally {
      if (temporary != null) {
        try {
          Files.deleteIfExists(temporary);
        } catch (IOException cleanup) {
          logger.warn("Failed to clean up temporary snapshot " + temporary, cleanup);
        }
      }
    }
  }

  /**
   * Temp files are created owner-only; give the replacement whatever permissions the snapshot it
   * replaces had.
   */
  private static void keepPermissions(final Path target, final Path temporary) throws IOException {
    if (Files.exists(target)
        && Files.getFileAttributeView(target, PosixFileAttributeView.class) != null
        && Files.getFileAttributeView(temporary, PosixFileAttributeView.class) != null) {
      Files.setPosixFilePermissions(temporary, Files.getPosixFilePermissions(target));
    }
  }
}
