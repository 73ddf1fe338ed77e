package com.scholary.videoask.handler.revai;

/**
 * Exception thrown when a call to the transcription provider fails.
 *
 * <p>Covers transport failures, non-2xx responses and responses we cannot parse. The HTTP status
 * is kept when there was one.
 */
public class ProviderException extends RuntimeException {

  private final int statusCode;

  public ProviderException(String message) {
    this(message, -1, null);
  }

  public ProviderException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public ProviderException(String message, int statusCode) {
    this(message, statusCode, null);
  }

  private ProviderException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status returned by the provider, or -1 for transport and parsing failures. */
  public int getStatusCode() {
    return statusCode;
  }
}
