package com.scholary.videoask.handler.media;

/**
 * Thrown when a media URL cannot be accepted for transcription.
 *
 * <p>Always attributable to the caller (bad input or an unsupported format), so it is never
 * retried.
 */
public class MediaValidationException extends RuntimeException {

  public MediaValidationException(String message) {
    super(message);
  }
}
