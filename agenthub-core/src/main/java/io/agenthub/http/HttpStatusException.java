package io.agenthub.http;

import io.agenthub.spi.CollaboratorException;

/**
 * A collaborator answered with a non-2xx status.
 */
public final class HttpStatusException extends CollaboratorException {
  private final int statusCode;

  HttpStatusException(int statusCode, String message) {
    super(message, null, statusCode == 429 || statusCode >= 500);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
