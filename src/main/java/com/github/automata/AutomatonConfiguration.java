package com.github.automata;

/**
 * This class encapsulates all the configuration parameters shared by acceptors, transducers and the
 * snapshot codec. Use the {@code AutomatonConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. If totalityCheck is not set, acceptors are built without looking for missing transitions.
 * Missing transitions still fail loudly at the point of use.<br>
 * 2. routeHistorySize bounds the route kept in {@link TransducerStatistics}. It defaults to 100
 * entries; 0 keeps no route at all.<br>
 * 3. Snapshots are indented unless prettyPrintSnapshots is turned off.<br>
 */
public final class AutomatonConfiguration {
  private final static int defaultRouteHistorySize = 100;

  private final TotalityCheck totalityCheck;
  private final int routeHistorySize;
  private final boolean prettyPrintSnapshots;

  public TotalityCheck getTotalityCheck() {
    return totalityCheck;
  }

  public int getRouteHistorySize() {
    return routeHistorySize;
  }

  public boolean getPrettyPrintSnapshots() {
    return prettyPrintSnapshots;
  }

  public static AutomatonConfiguration defaults() {
    return new AutomatonConfiguration(TotalityCheck.NONE, defaultRouteHistorySize, true);
  }

  public final static class AutomatonConfigurationBuilder {
    private TotalityCheck totalityCheck = TotalityCheck.NONE;
    private int routeHistorySize = defaultRouteHistorySize;
    private boolean prettyPrintSnapshots = true;

    public static AutomatonConfigurationBuilder newBuilder() {
      return new AutomatonConfigurationBuilder();
    }

    public AutomatonConfigurationBuilder totalityCheck(final TotalityCheck totalityCheck) {
      this.totalityCheck = totalityCheck;
      return this;
    }

    public AutomatonConfigurationBuilder routeHistorySize(int routeHistorySize) {
      this.routeHistorySize = routeHistorySize;
      return this;
    }

    public AutomatonConfigurationBuilder prettyPrintSnapshots(boolean prettyPrintSnapshots) {
      this.prettyPrintSnapshots = prettyPrintSnapshots;
      return this;
    }

    public AutomatonConfiguration build() throws AutomatonException {
      final AutomatonConfiguration config =
          new AutomatonConfiguration(totalityCheck, routeHistorySize, prettyPrintSnapshots);
      config.validate();
      return config;
    }

    private AutomatonConfigurationBuilder() {}
  }

  private void validate() throws AutomatonException {
    StringBuilder messages = new StringBuilder();
    if (totalityCheck == null) {
      messages.append("TotalityCheck cannot be null. ");
    }
    if (routeHistorySize < 0) {
      messages.append("RouteHistorySize cannot be negative. ");
    }
    if (messages.length() > 0) {
      throw new AutomatonException(AutomatonException.Code.INVALID_MACHINE_CONFIG,
          messages.toString().trim());
    }
  }

  @Override
  public String toString() {
    return "AutomatonConfiguration [totalityCheck=" + totalityCheck + ", routeHistorySize="
        + routeHistorySize + ", prettyPrintSnapshots=" + prettyPrintSnapshots + "]";
  }

  private AutomatonConfiguration(final TotalityCheck totalityCheck, final int routeHistorySize,
      final boolean prettyPrintSnapshots) {
    this.totalityCheck = totalityCheck;
    this.routeHistorySize = routeHistorySize;
    this.prettyPrintSnapshots = prettyPrintSnapshots;
  }

}
