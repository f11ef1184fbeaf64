package com.github.automata;

import java.util.Collection;

/**
 * Checks on input symbols and outputs.
 */
final class Symbols {

  /**
   * An alphabet is any non-null collection without null symbols. Some collections refuse
   * contains(null) so this walks it instead.
   */
  static boolean validAlphabet(final Collection<?> alphabet) {
    if (alphabet == null) {
      return false;
    }
    for (final Object symbol : alphabet) {
      if (symbol == null) {
        return false;
      }
    }
    return true;
  }

  /**
   * Strings and Integers are the only values that come back from JSON as the same type and equal
   * value, so they are the only ones a snapshot can carry.
   */
  static boolean representable(final Object value) {
    return value instanceof String || value instanceof Integer;
  }

  private Symbols() {}
}
