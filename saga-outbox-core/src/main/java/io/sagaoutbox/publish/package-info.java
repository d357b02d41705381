/**
 * Flushing and sweeping of pending commands.
 *
 * @see io.sagaoutbox.publish.OutboxCommandPublisher
 */
package io.sagaoutbox.publish;
