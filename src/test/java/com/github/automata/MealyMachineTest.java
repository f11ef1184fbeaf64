package com.github.automata;

import static com.github.automata.Fixtures.symbols;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.junit.Test;

import com.github.automata.AutomatonConfiguration.AutomatonConfigurationBuilder;
import com.github.automata.AutomatonException.Code;

/**
 * Tests to maintain the sanity and correctness of the Mealy machine.
 */
public class MealyMachineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  private static final Logger logger = LogManager.getLogger(MealyMachineTest.class.getSimpleName());

  @Test
  public void testForward() throws AutomatonException {
    final MealyMachine machine = Fixtures.erroneousInput();
    assertEquals("Normal operation", machine.forward("a"));
    assertEquals("Detected erroneous input", machine.forward("b"));
    assertEquals("Clearing erroneous input", machine.forward("b"));
    assertEquals("q1", machine.getCurrentState().getName());
    machine.reset();
    assertSame(machine.getInitialState(), machine.getCurrentState());
    assertEquals("Detected erroneous input", machine.step("b"));
    assertEquals("Returning to normal operation", machine.step("a"));
  }

  @Test
  public void testStepIsDeterministic() throws AutomatonException {
    final MealyMachine machine = Fixtures.erroneousInput();
    machine.forward("b");
    final State from = machine.getCurrentState();
    final Object first = machine.step("a");
    final State reached = machine.getCurrentState();

    final MealyMachine again = Fixtures.erroneousInput();
    again.forward("b");
    assertEquals(from.getName(), again.getCurrentState().getName());
    assertEquals(first, again.step("a"));
    assertEquals(reached.getName(), again.getCurrentState().getName());
  }

  @Test
  public void testUndefinedTransitionLeavesPositionUnchanged() throws AutomatonException {
    final MealyMachine machine = Fixtures.erroneousInput();
    machine.forward("b");
    final State before = machine.getCurrentState();
    try {
      machine.forward("c");
      fail("c has no transition");
    } catch (AutomatonException expected) {
      assertEquals(Code.UNDEFINED_TRANSITION, expected.getCode());
    }
    assertSame(before, machine.getCurrentState());
    // the machine stays usable
    assertEquals("Returning to normal operation", machine.forward("a"));
    assertEquals(2, machine.getStatistics().getTransitionSuccesses());
    assertEquals(1, machine.getStatistics().getTransitionFailures());
  }

  @Test
  public void testForwardSequence() throws AutomatonException {
    final MealyMachine machine = Fixtures.lollipops("ok");
    final List<Object> outputs = machine.forward(symbols("ssslllls"));
    assertEquals(Arrays.<Object>asList("ok", "ok", "error", "ok", "ok", "error", "error", "ok"),
        outputs);
    assertEquals("s1", machine.getCurrentState().getName());
    assertTrue(machine.forward(Collections.emptyList()).isEmpty());
    assertEquals("s1", machine.getCurrentState().getName());
  }

  @Test
  public void testForwardSequenceStopsAtFailure() throws AutomatonException {
    final MealyMachine machine = Fixtures.erroneousInput();
    try {
      machine.forward(Arrays.asList("a", "b", "c", "a"));
      fail("c has no transition");
    } catch (AutomatonException expected) {
      assertEquals(Code.UNDEFINED_TRANSITION, expected.getCode());
    }
    // a and b were consumed, c and everything after it were not
    assertEquals("q1", machine.getCurrentState().getName());
  }

  @Test
  public void testTransitionsWithoutOutput() throws AutomatonException {
    final MealyMachine machine = Fixtures.lollipops(null);
    assertNull(machine.forward("s"));
    assertNull(machine.forward("s"));
    assertEquals("error", machine.forward("s"));
  }

  @Test
  public void testProcess() throws AutomatonException {
    final MealyMachine machine = Fixtures.lollipops(null);
    final List<Emission> emissions = machine.process(symbols("sssllll"));
    logger.info("emissions::" + emissions);
    assertEquals(3, emissions.size());
    assertEquals(3, emissions.get(0).getPosition());
    assertEquals(6, emissions.get(1).getPosition());
    assertEquals(7, emissions.get(2).getPosition());
    assertEquals("error", emissions.get(2).getOutput());
    // process resets when it's done
    assertSame(machine.getInitialState(), machine.getCurrentState());
  }

  @Test
  public void testStatisticsRoute() throws AutomatonException {
    final AutomatonConfiguration config =
        AutomatonConfigurationBuilder.newBuilder().routeHistorySize(3).build();
    final MealyMachine lollipops = Fixtures.lollipops("ok");
    final MealyMachine machine =
        new MealyMachine(lollipops.getInitialState(), lollipops.getAlphabet(), config);
    machine.forward(symbols("ssl"));
    // i, s1, s2, l1 bounded to the last three
    assertEquals(Arrays.asList("s1", "s2", "l1"), machine.getStatistics().getStateRoute());
    machine.reset();
    assertEquals(Arrays.asList("s2", "l1", "i"), machine.getStatistics().getStateRoute());
    assertEquals(1, machine.getStatistics().getResets());
    assertEquals(3, machine.getStatistics().getTransitionSuccesses());
    assertEquals(machine.getId(), machine.getStatistics().getMachineId());
    logger.info(machine.getStatistics().toString());
  }

  @Test
  public void testStates() throws AutomatonException {
    final MealyMachine machine = Fixtures.lollipops("ok");
    assertEquals(7, machine.getStates().size());
    assertEquals(Arrays.<Object>asList("s", "l"), machine.getAlphabet());
    assertEquals("i", machine.getStates().iterator().next().getName());
  }

  @Test
  public void testRendering() throws AutomatonException {
    final String expected = "q0\n" //
        + "  a -> q0 [Normal operation]\n" //
        + "  b -> q1 [Detected erroneous input]\n" //
        + "       q1\n" //
        + "         b -> q1 [Clearing erroneous input]\n" //
        + "         a -> q0 [Returning to normal operation]";
    final MealyMachine machine = Fixtures.erroneousInput();
    assertEquals(expected, machine.toString());
    // rendering is read-only
    machine.forward("b");
    assertEquals(expected, machine.toString());
    assertEquals("q1", machine.getCurrentState().getName());
  }

  @Test
  public void testRenderingDeepChain() throws AutomatonException {
    final int length = 50_000;
    final State first = new State("s0", true, false);
    State last = first;
    for (int iter = 1; iter < length; iter++) {
      final State next = new State("s" + iter);
      last.addTransition("a", next, "o");
      last = next;
    }
    final String[] lines = new MealyMachine(first).toString().split("\n");
    assertEquals(2 * length - 1, lines.length);
    assertEquals("s0", lines[0]);
    assertEquals("  a -> s1 [o]", lines[1]);
    assertEquals("       s1", lines[2]);
    // indentation stops growing once the chain gets deep
    final StringBuilder deepest = new StringBuilder();
    for (int iter = 0; iter < StateGraph.maxIndentDepth; iter++) {
      deepest.append("       ");
    }
    assertEquals(deepest + "s" + (length - 1), lines[lines.length - 1]);
  }

  @Test
  public void testInvalidConstruction() throws AutomatonException {
    try {
      new MealyMachine(null);
      fail("null initial state");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
    try {
      new MealyMachine(new State("p"), null);
      fail("null alphabet");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_ALPHABET, expected.getCode());
    }
  }

}
