package io.sagaoutbox.spi;

/**
 * Converts commands to and from the payload stored in pending rows.
 * Implementations must round-trip: {@code deserialize(serialize(c))} equals {@code c}.
 */
public interface MessageSerializer {

  String serialize(Object message);

  Object deserialize(String payload);
}
