/**
 * Persisted outbox rows.
 *
 * <p>Rows are write-once, delete-once: created in the transaction that persists the
 * owning process manager and deleted after a successful handoff.
 *
 * @see io.sagaoutbox.model.PendingCommand
 * @see io.sagaoutbox.model.PendingScheduledCommand
 */
package io.sagaoutbox.model;
