package com.github.automata;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Traversals over the graph hanging off an initial state. Every traversal keys its visited set by
 * state identity so it terminates on self-loops and cycles and never confuses two states that
 * happen to share a name.
 */
final class StateGraph {
  private static final String indent = "       ";
  static final int maxIndentDepth = 32;

  /**
   * Breadth-first set of states reachable from initial, initial first. Each state appears exactly
   * once.
   */
  static Set<State> reachable(final State initial) {
    final Set<State> visited = new LinkedHashSet<>();
    final Deque<State> toVisit = new ArrayDeque<>();
    visited.add(initial);
    toVisit.add(initial);
    while (!toVisit.isEmpty()) {
      for (final Transition transition : toVisit.poll().getTransitions().values()) {
        final State target = transition.getToState();
        if (visited.add(target)) {
          toVisit.add(target);
        }
      }
    }
    return Collections.unmodifiableSet(visited);
  }

  /**
   * Copy the graph reachable from initial. The returned map goes from every original state to its
   * copy; copies keep names, flags, outputs, transition modes and edge order.
   */
  static Map<State, State> copy(final State initial) throws AutomatonException {
    final Map<State, State> copies = new IdentityHashMap<>();
    final Set<State> states = reachable(initial);
    for (final State state : states) {
      final State copy = new State(state.getName(), state.isInitial(), state.isAccepting(),
          state.getTransitionMode());
      copy.setOutput(state.getOutput());
      copies.put(state, copy);
    }
    for (final State state : states) {
      for (final Transition transition : state.getTransitions().values()) {
        copies.get(state).addTransition(transition.getSymbol(),
            copies.get(transition.getToState()), transition.getOutput());
      }
    }
    return copies;
  }

  /**
   * Depth-first textual rendering, one line per state and one per edge, each level of depth
   * indented further. A state already printed is not expanded again. Indentation stops growing
   * past {@link #maxIndentDepth} levels so very deep chains stay linear in size.
   */
  static String render(final State initial, final boolean withOutputs) {
    final StringBuilder builder = new StringBuilder();
    final Set<State> visited = Collections.newSetFromMap(new IdentityHashMap<>());
    final Deque<Frame> stack = new ArrayDeque<>();
    visited.add(initial);
    appendLine(builder, repeat(0) + initial.getName());
    stack.push(new Frame(initial, 0));
    while (!stack.isEmpty()) {
      final Frame frame = stack.peek();
      if (!frame.edges.hasNext()) {
        stack.pop();
        continue;
      }
      final Transition transition = frame.edges.next();
      final StringBuilder edge = new StringBuilder(repeat(frame.depth)).append("  ")
          .append(transition.getSymbol()).append(" -> ").append(transition.getToState().getName());
      if (withOutputs && transition.hasOutput()) {
        edge.append(" [").append(transition.getOutput()).append(']');
      }
      appendLine(builder, edge.toString());
      final State target = transition.getToState();
      if (visited.add(target)) {
        appendLine(builder, repeat(frame.depth + 1) + target.getName());
        stack.push(new Frame(target, frame.depth + 1));
      }
    }
    return builder.toString();
  }

  /**
   * A state being expanded, its depth and the edges still to print.
   */
  private static final class Frame {
    private final int depth;
    private final Iterator<Transition> edges;

    private Frame(final State state, final int depth) {
      this.depth = depth;
      this.edges = state.getTransitions().values().iterator();
    }
  }

  private static void appendLine(final StringBuilder builder, final String line) {
    if (builder.length() > 0) {
      builder.append('\n');
    }
    builder.append(line);
  }

  private static String repeat(final int depth) {
    final StringBuilder builder = new StringBuilder();
    for (int iter = 0; iter < Math.min(depth, maxIndentDepth); iter++) {
      builder.append(indent);
    }
    return builder.toString();
  }

  private StateGraph() {}
}
