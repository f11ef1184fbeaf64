package com.github.automata;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Machines shared by the tests.
 */
final class Fixtures {

  /**
   * One single-character string per character of input, eg. "ab" -> ["a", "b"].
   */
  static List<Object> symbols(final String input) {
    final List<Object> symbols = new ArrayList<>(input.length());
    for (int iter = 0; iter < input.length(); iter++) {
      symbols.add(String.valueOf(input.charAt(iter)));
    }
    return symbols;
  }

  /**
   * p is initial and accepting, q is not. From either state 0 leads to p and 1 leads to q, so the
   * acceptor takes the empty sequence and every sequence ending in 0.
   */
  static Dfa endsInZero() throws AutomatonException {
    final State p = new State("p", true, true);
    final State q = new State("q");
    p.addTransition(0, p);
    p.addTransition(1, q);
    q.addTransition(0, p);
    q.addTransition(1, q);
    return new Dfa(p, Arrays.asList(0, 1));
  }

  /**
   * q0 -a-> q1 -b-> q2 (b loops) -a-> q3 (accepting). Deliberately incomplete.
   */
  static Dfa abStarA() throws AutomatonException {
    final State q0 = new State("q0", true, false);
    final State q1 = new State("q1");
    final State q2 = new State("q2");
    final State q3 = new State("q3", false, true);
    q0.addTransition("a", q1);
    q1.addTransition("b", q2);
    q2.addTransition("b", q2);
    q2.addTransition("a", q3);
    return new Dfa(q0, Arrays.asList("a", "b"));
  }

  /**
   * Flags the third and any further consecutive strawberry (s) or lemon (l) lollipop. Every step
   * emits okOutput except flagged ones which emit "error".
   */
  static MealyMachine lollipops(final Object okOutput) throws AutomatonException {
    final State i = new State("i", true, false);
    final State s1 = new State("s1");
    final State l1 = new State("l1");
    final State s2 = new State("s2");
    final State l2 = new State("l2");
    final State s3 = new State("s3");
    final State l3 = new State("l3");

    i.addTransition("s", s1, okOutput);
    i.addTransition("l", l1, okOutput);
    s1.addTransition("s", s2, okOutput);
    s1.addTransition("l", l1, okOutput);
    l1.addTransition("l", l2, okOutput);
    l1.addTransition("s", s1, okOutput);
    s2.addTransition("s", s3, "error");
    s2.addTransition("l", l1, okOutput);
    l2.addTransition("l", l3, "error");
    l2.addTransition("s", s1, okOutput);
    s3.addTransition("s", s3, "error");
    s3.addTransition("l", l1, okOutput);
    l3.addTransition("l", l3, "error");
    l3.addTransition("s", s1, okOutput);
    return new MealyMachine(i, Arrays.asList("s", "l"));
  }

  /**
   * q0 keeps emitting on a, b moves to q1 and q1 keeps emitting on b until a moves back.
   */
  static MealyMachine erroneousInput() throws AutomatonException {
    final State q0 = new State("q0", true, false);
    final State q1 = new State("q1");
    q0.addTransition("a", q0, "Normal operation");
    q0.addTransition("b", q1, "Detected erroneous input");
    q1.addTransition("b", q1, "Clearing erroneous input");
    q1.addTransition("a", q0, "Returning to normal operation");
    return new MealyMachine(q0, Arrays.asList("a", "b"));
  }

  private Fixtures() {}
}
