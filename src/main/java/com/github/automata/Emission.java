package com.github.automata;

import java.util.Objects;

/**
 * An output emitted by a transducer together with the 1-based position of the input symbol that
 * produced it.
 */
public final class Emission {
  private final int position;
  private final Object output;

  Emission(final int position, final Object output) {
    this.position = position;
    this.output = output;
  }

  public int getPosition() {
    return position;
  }

  public Object getOutput() {
    return output;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof Emission)) {
      return false;
    }
    final Emission other = (Emission) obj;
    return position == other.position && Objects.equals(output, other.output);
  }

  @Override
  public int hashCode() {
    return Objects.hash(position, output);
  }

  @Override
  public String toString() {
    return output + " at position " + position;
  }
}
