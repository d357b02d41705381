/**
 * Spring Boot auto-configuration for the saga outbox.
 */
package io.sagaoutbox.spring.boot;
