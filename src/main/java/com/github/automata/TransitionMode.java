package com.github.automata;

/**
 * This represents what a state does when a transition is registered for a symbol that already has
 * one.
 */
public enum TransitionMode {
  // replace the prior edge, lets callers rewire a machine while assembling it
  LAST_WRITE_WINS,
  // refuse the second edge with Code.DUPLICATE_TRANSITION
  STRICT;
}
