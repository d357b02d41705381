/**
 * Micrometer metrics for the saga outbox.
 */
package io.sagaoutbox.micrometer;
