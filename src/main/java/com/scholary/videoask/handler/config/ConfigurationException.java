package com.scholary.videoask.handler.config;

/**
 * Thrown when a required setting is missing at the moment it is needed.
 *
 * <p>Examples: no provider API key, or a submission with neither a callback URL nor a synchronous
 * wait. These are never retried; retrying cannot fix configuration.
 */
public class ConfigurationException extends RuntimeException {

  public ConfigurationException(String message) {
    super(message);
  }
}
