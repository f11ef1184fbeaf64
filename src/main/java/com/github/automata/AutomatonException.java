package com.github.automata;

/**
 * Unified single exception that's thrown by this library. The idea is to use the code enum to
 * encapsulate the various error conditions so callers can branch on {@link #getCode()} rather than
 * on a hierarchy of exception types. Stack traces and causes, where available, are not meant to be
 * kept from users.
 */
public final class AutomatonException extends Exception {
  private static final long serialVersionUID = 1L;
  private final Code code;

  public AutomatonException(final Code code) {
    super(code.getDescription());
    this.code = code;
  }

  public AutomatonException(final Code code, final String message) {
    super(message);
    this.code = code;
  }

  public AutomatonException(final Code code, final Throwable throwable) {
    super(code.getDescription(), throwable);
    this.code = code;
  }

  public AutomatonException(final Code code, final String message, final Throwable throwable) {
    super(message, throwable);
    this.code = code;
  }

  public Code getCode() {
    return code;
  }

  public static enum Code {
    // 1.
    INVALID_STATE_NAME(
        "State name cannot be null, blank or longer than " + State.maxStateNameLength
            + " characters"),
    // 2.
    INVALID_STATE("Null state is invalid"),
    // 3.
    INVALID_ALPHABET("Alphabet cannot be null or contain null symbols"),
    // 4.
    UNDEFINED_TRANSITION("No transition is defined for the symbol from the current state"),
    // 5.
    DUPLICATE_TRANSITION("A transition for the symbol is already registered on the state"),
    // 6.
    INCOMPLETE_TRANSITIONS("Acceptor is missing transitions for some alphabet symbols"),
    // 7.
    UNSUPPORTED_SYMBOL("Symbol or output is null or cannot be represented in a snapshot"),
    // 8.
    MALFORMED_SNAPSHOT("Snapshot is structurally inconsistent and cannot be loaded"),
    // 9.
    SNAPSHOT_IO_FAILURE("Failed to read or write snapshot. Check exception cause for details"),
    // 10.
    INVALID_MACHINE_CONFIG("Automaton configuration is invalid");

    private String description;

    private Code(String description) {
      this.description = description;
    }

    public String getDescription() {
      return description;
    }
  }

}
