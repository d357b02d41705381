package io.sagaoutbox;

import java.util.UUID;

/**
 * Validation for process manager identifiers.
 */
public final class ProcessManagerIds {
  /** The nil UUID, never a valid process manager id. */
  public static final UUID EMPTY = new UUID(0L, 0L);

  private ProcessManagerIds() {
  }

  /**
   * Returns {@code id} if it is usable as a process manager id.
   *
   * @throws IllegalArgumentException if {@code id} is {@code null} or the nil UUID
   */
  public static UUID requireValid(UUID id, String name) {
    if (id == null || EMPTY.equals(id)) {
      throw new IllegalArgumentException(name + " cannot be null or empty");
    }
    return id;
  }
}
