package io.sagaoutbox.model;

/**
 * Outcome of deleting a pending row.
 */
public enum RemoveResult {
  /** This call deleted the row. */
  REMOVED,
  /** The row was already gone, typically deleted by a concurrent flush. */
  ALREADY_GONE;

  public static RemoveResult ofRowCount(int rows) {
    return rows > 0 ? REMOVED : ALREADY_GONE;
  }
}
