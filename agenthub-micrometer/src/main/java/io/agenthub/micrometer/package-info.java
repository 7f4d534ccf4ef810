/**
 * Micrometer bridge for hub metrics.
 */
package io.agenthub.micrometer;
