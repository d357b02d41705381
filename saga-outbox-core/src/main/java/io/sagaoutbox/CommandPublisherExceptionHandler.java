package io.sagaoutbox;

/**
 * Decides whether a flush failure after a successful save should reach the caller.
 *
 * <p>The commands are already durable when the handler runs, so returning
 * {@link ExceptionHandling#HANDLED} only hides the delivery lag: a later flush or sweep
 * delivers them. A handler that throws is treated as {@link ExceptionHandling#PROPAGATE}.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * CommandPublisherExceptionHandler handler = context -> {
 *   alerts.warn("Delayed commands for " + context.processManagerId());
 *   return ExceptionHandling.HANDLED;
 * };
 * }</pre>
 *
 * @see ProcessManagerDataContext
 */
@FunctionalInterface
public interface CommandPublisherExceptionHandler {

  /** Default handler: always propagates. */
  CommandPublisherExceptionHandler PROPAGATE = context -> ExceptionHandling.PROPAGATE;

  /**
   * Inspects a flush failure.
   *
   * @param context the failed instance and the exception
   * @return the verdict; {@code null} is treated as {@link ExceptionHandling#PROPAGATE}
   * @throws Exception if the handler itself fails
   */
  ExceptionHandling handle(CommandPublisherExceptionContext context) throws Exception;
}
