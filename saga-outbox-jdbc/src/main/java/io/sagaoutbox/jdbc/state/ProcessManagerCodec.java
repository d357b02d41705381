package io.sagaoutbox.jdbc.state;

import io.sagaoutbox.ProcessManager;

import java.util.UUID;

/**
 * Converts a process manager's business state to and from the text stored in its row.
 *
 * <p>The id and version live in their own columns and are handed back on decode.
 *
 * @param <T> the process manager type
 */
public interface ProcessManagerCodec<T extends ProcessManager> {

  String encode(T processManager);

  T decode(UUID id, long version, String state);
}
