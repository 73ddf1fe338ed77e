package com.scholary.videoask.handler.storage;

/**
 * Exception thrown when a spreadsheet read or write fails.
 *
 * <p>It never leaves the store: {@link ResultStore#upsert} reports failures as {@code false}.
 */
public class StoreException extends RuntimeException {

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
