/**
 * Message delivery with idempotent recording, bounded retries and audit reporting.
 */
package io.agenthub.delivery;
