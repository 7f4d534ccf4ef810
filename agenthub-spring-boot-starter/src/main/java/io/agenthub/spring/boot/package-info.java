/**
 * Spring Boot auto-configuration for the hub: storage backend selection, HTTP
 * collaborators and Micrometer metrics from {@code agenthub.*} properties.
 */
package io.agenthub.spring.boot;
