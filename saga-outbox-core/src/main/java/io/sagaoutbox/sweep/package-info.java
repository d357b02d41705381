/**
 * Background recovery of stranded pending commands.
 */
package io.sagaoutbox.sweep;
