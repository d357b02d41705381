/**
 * Service Provider Interfaces (SPI) for the outbox.
 *
 * <p>These interfaces define the collaborators the core talks to: the persistence
 * boundary, the serializer, the two delivery channels and the metrics backend.
 *
 * @see io.sagaoutbox.spi.PendingCommandStore
 * @see io.sagaoutbox.spi.ProcessManagerStore
 * @see io.sagaoutbox.spi.MessageBus
 * @see io.sagaoutbox.spi.ScheduledMessageBus
 * @see io.sagaoutbox.spi.MetricsExporter
 */
package io.sagaoutbox.spi;
