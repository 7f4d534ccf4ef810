/**
 * Built-in dialects and the {@link io.agenthub.jdbc.dialect.Dialects} registry.
 */
package io.agenthub.jdbc.dialect;
