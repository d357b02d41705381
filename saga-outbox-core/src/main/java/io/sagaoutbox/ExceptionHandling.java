package io.sagaoutbox;

/**
 * Verdict of a {@link CommandPublisherExceptionHandler}.
 */
public enum ExceptionHandling {
  /** The failure is dealt with; the save completes and delivery is left to a later flush. */
  HANDLED,
  /** The original exception is rethrown to the caller of the save. */
  PROPAGATE
}
