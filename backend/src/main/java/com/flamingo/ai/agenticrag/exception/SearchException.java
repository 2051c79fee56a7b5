package com.flamingo.ai.agenticrag.exception;

/** Exception thrown when search operations fail. */
public class SearchException extends RuntimeException {

  private final boolean timedOut;
  private final String userMessage;

  public SearchException(String message, Throwable cause) {
    this(message, cause, false);
  }

  public SearchException(String message, Throwable cause, boolean timedOut) {
    super(message, cause);
    this.timedOut = timedOut;
    this.userMessage =
        timedOut
            ? "Search timed out. Please try again."
            : "Search is temporarily unavailable. Please try again.";
  }

  public boolean isTimedOut() {
    return timedOut;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
