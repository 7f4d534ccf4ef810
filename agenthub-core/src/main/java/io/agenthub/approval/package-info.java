/**
 * Approval request correlation and idempotent callback handling.
 */
package io.agenthub.approval;
