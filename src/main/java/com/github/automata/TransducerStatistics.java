package com.github.automata;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Simple statistics holder for a transducer. None of this is needed to run or resume a machine and
 * none of it is persisted; a machine restored from a snapshot starts with fresh statistics.
 */
public final class TransducerStatistics {
  private final String machineId;
  private final long startMillis = System.currentTimeMillis();
  private final int routeHistorySize;
  int transitionSuccesses;
  int transitionFailures;
  int resets;
  long lastTouchTimeMillis;
  // names of the most recently entered states, oldest first, bounded by routeHistorySize
  private final Deque<String> boundedStateRoute = new ArrayDeque<>();

  TransducerStatistics(final String machineId, final int routeHistorySize) {
    this.machineId = machineId;
    this.routeHistorySize = routeHistorySize;
  }

  void entered(final State state) {
    lastTouchTimeMillis = System.currentTimeMillis();
    if (routeHistorySize == 0) {
      return;
    }
    if (boundedStateRoute.size() == routeHistorySize) {
      boundedStateRoute.removeFirst();
    }
    boundedStateRoute.addLast(state.getName());
  }

  public String getMachineId() {
    return machineId;
  }

  public int getTransitionSuccesses() {
    return transitionSuccesses;
  }

  public int getTransitionFailures() {
    return transitionFailures;
  }

  public int getResets() {
    return resets;
  }

  public long getLastTouchTimeMillis() {
    return lastTouchTimeMillis;
  }

  public long getAliveTimeMillis() {
    return System.currentTimeMillis() - startMillis;
  }

  public List<String> getStateRoute() {
    return Collections.unmodifiableList(new ArrayList<>(boundedStateRoute));
  }

  @Override
  public String toString() {
    return "TransducerStatistics [machineId=" + machineId + ", transitionSuccesses="
        + transitionSuccesses + ", transitionFailures=" + transitionFailures + ", resets=" + resets
        + ", lastTouchTimeMillis=" + lastTouchTimeMillis + ", aliveTimeMillis="
        + getAliveTimeMillis() + "]";
  }

}
