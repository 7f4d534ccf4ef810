/**
 * Conversion between enterprise IM messages and channel (Matrix) events.
 */
package io.agenthub.translate;
