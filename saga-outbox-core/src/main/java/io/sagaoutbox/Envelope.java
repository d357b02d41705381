package io.sagaoutbox;

import com.github.f4b6a3.ulid.UlidCreator;

import java.util.Objects;

/**
 * A command together with its delivery metadata.
 *
 * <p>The {@code messageId} is assigned once, when the command is recorded, and survives
 * every redelivery of the same command. Consumers deduplicate on it.
 *
 * @param messageId     unique message id (ULID by default)
 * @param correlationId optional causal correlation token, may be {@code null}
 * @param message       the deserialized command
 */
public record Envelope(String messageId, String correlationId, Object message) {

  public Envelope {
    Objects.requireNonNull(messageId, "messageId");
    if (messageId.isEmpty()) {
      throw new IllegalArgumentException("messageId cannot be empty");
    }
    Objects.requireNonNull(message, "message");
  }

  /**
   * Wraps {@code message} with a fresh monotonic ULID message id.
   */
  public static Envelope create(Object message, String correlationId) {
    return new Envelope(newMessageId(), correlationId, message);
  }

  static String newMessageId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
