package com.github.automata;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Iterator;

import org.junit.Test;

import com.github.automata.AutomatonException.Code;

/**
 * Tests for the state and transition table model.
 */
public class StateTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j.properties");
  }

  @Test
  public void testLastWriteWins() throws AutomatonException {
    final State p = new State("p", true, false);
    final State q = new State("q");
    p.addTransition("x", p, "stay");
    p.addTransition("x", q, "move");

    final Transition transition = p.transitionFor("x");
    assertSame(q, transition.getToState());
    assertSame(p, transition.getFromState());
    assertEquals("move", transition.getOutput());
    assertEquals(1, p.getTransitions().size());
  }

  @Test
  public void testStrictModeRefusesDuplicate() throws AutomatonException {
    final State p = new State("p", true, false, TransitionMode.STRICT);
    p.addTransition(0, p);
    try {
      p.addTransition(0, p);
      fail("second transition on the same symbol should be refused");
    } catch (AutomatonException expected) {
      assertEquals(Code.DUPLICATE_TRANSITION, expected.getCode());
    }
    // the original edge survives
    assertSame(p, p.transitionFor(0).getToState());
  }

  @Test
  public void testUndefinedTransition() throws AutomatonException {
    final State p = new State("p");
    p.addTransition("a", p);
    assertTrue(p.hasTransition("a"));
    assertFalse(p.hasTransition("b"));
    try {
      p.transitionFor("b");
      fail("no edge for b");
    } catch (AutomatonException expected) {
      assertEquals(Code.UNDEFINED_TRANSITION, expected.getCode());
    }
    try {
      p.transitionFor(null);
      fail("no edge for null");
    } catch (AutomatonException expected) {
      assertEquals(Code.UNDEFINED_TRANSITION, expected.getCode());
    }
  }

  @Test
  public void testSymbolsCompareByEquality() throws AutomatonException {
    final State p = new State("p");
    p.addTransition(1, p);
    p.addTransition(new String("s"), p);
    assertTrue(p.hasTransition(Integer.valueOf(1)));
    assertTrue(p.hasTransition("s"));
    // 1 and "1" are different symbols
    assertFalse(p.hasTransition("1"));
  }

  @Test
  public void testTransitionsKeepInsertionOrder() throws AutomatonException {
    final State p = new State("p");
    final State q = new State("q");
    p.addTransition("z", q);
    p.addTransition("a", q);
    p.addTransition("m", p);
    final Iterator<Object> symbols = p.getTransitions().keySet().iterator();
    assertEquals(Arrays.asList("z", "a", "m"),
        Arrays.asList(symbols.next(), symbols.next(), symbols.next()));
  }

  @Test
  public void testInvalidStates() throws AutomatonException {
    for (final String name : Arrays.asList(null, "", "   ",
        "a-name-that-is-far-too-long-to-be-a-reasonable-state-name-in-any-machine")) {
      try {
        new State(name);
        fail("name should be refused: " + name);
      } catch (AutomatonException expected) {
        assertEquals(Code.INVALID_STATE_NAME, expected.getCode());
      }
    }
    final State p = new State("  p ");
    assertEquals("p", p.getName());
    try {
      p.addTransition("a", null);
      fail("null target");
    } catch (AutomatonException expected) {
      assertEquals(Code.INVALID_STATE, expected.getCode());
    }
    try {
      p.addTransition(null, p);
      fail("null symbol");
    } catch (AutomatonException expected) {
      assertEquals(Code.UNSUPPORTED_SYMBOL, expected.getCode());
    }
  }

  @Test
  public void testIdentityEquality() throws AutomatonException {
    final State one = new State("same");
    final State two = new State("same");
    assertNotSame(one, two);
    assertFalse(one.equals(two));
    assertNull(one.getOutput());
    assertEquals(TransitionMode.LAST_WRITE_WINS, one.getTransitionMode());
  }

}
