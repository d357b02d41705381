/**
 * Transactional outbox for process managers.
 *
 * <p>A {@link io.sagaoutbox.ProcessManager} reacts to events by queueing commands.
 * {@link io.sagaoutbox.ProcessManagerDataContext} stores its state and those commands in
 * one transaction, and a {@link io.sagaoutbox.CommandPublisher} delivers the commands
 * afterwards, at least once, in the order they were recorded.
 */
package io.sagaoutbox;
