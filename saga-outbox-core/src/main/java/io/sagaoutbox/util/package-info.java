/**
 * Internal helpers.
 */
package io.sagaoutbox.util;
