package com.github.automata;

/**
 * This represents how an acceptor treats missing transitions when it is constructed. Missing
 * transitions always surface as {@link AutomatonException.Code#UNDEFINED_TRANSITION} at the point
 * of use, whatever the mode.
 */
public enum TotalityCheck {
  // don't look
  NONE,
  // log every (state, symbol) hole but build the acceptor anyway
  WARN,
  // refuse to build with Code.INCOMPLETE_TRANSITIONS
  ENFORCE;
}
