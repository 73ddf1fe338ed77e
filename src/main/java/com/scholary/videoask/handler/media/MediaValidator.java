package com.scholary.videoask.handler.media;

import java.net.URI;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Checks a media URL's file extension against the supported-format allow-list.
 *
 * <p>Pure function of the URL and configuration: no network access. The extension is taken from
 * the last path segment, so query strings and fragments never influence the result.
 */
@Component
public class MediaValidator {

  private final Set<String> supportedFormats;
  private final String supportedList;

  public MediaValidator(MediaProperties properties) {
    TreeSet<String> formats = new TreeSet<>();
    for (String format : properties.supportedFormats()) {
      formats.add(format.toLowerCase(Locale.ROOT));
    }
    this.supportedFormats = formats;
    this.supportedList = String.join(", ", formats);
  }

  /**
   * Validate a media URL.
   *
   * @param mediaUrl the URL of the media file
   * @return the validation result, with a human-readable reason either way
   */
  public ValidationResult validate(String mediaUrl) {
    Optional<String> extension = extensionOf(mediaUrl);
    if (extension.isEmpty()) {
      return ValidationResult.invalid("Could not determine file format");
    }
    if (!supportedFormats.contains(extension.get())) {
      return ValidationResult.invalid(
          String.format(
              "Unsupported file format: %s. Supported formats: %s",
              extension.get(), supportedList));
    }
    return ValidationResult.ok();
  }

  /**
   * Validate a media URL, throwing when it is not acceptable.
   *
   * @throws MediaValidationException if the format is missing or unsupported
   */
  public void requireValid(String mediaUrl) {
    ValidationResult result = validate(mediaUrl);
    if (!result.valid()) {
      throw new MediaValidationException(result.reason());
    }
  }

  /**
   * Extract the lowercase file extension from the URL path.
   *
   * @return the extension, or empty if the last path segment has none
   */
  public static Optional<String> extensionOf(String mediaUrl) {
    if (mediaUrl == null || mediaUrl.isBlank()) {
      return Optional.empty();
    }
    String path = pathOf(mediaUrl.trim());
    String segment = path.substring(path.lastIndexOf('/') + 1);
    int dot = segment.lastIndexOf('.');
    if (dot < 0 || dot == segment.length() - 1) {
      return Optional.empty();
    }
    return Optional.of(segment.substring(dot + 1).toLowerCase(Locale.ROOT));
  }

  private static String pathOf(String url) {
    try {
      String path = URI.create(url).getPath();
      return path == null ? "" : path;
    } catch (IllegalArgumentException e) {
      return "";
    }
  }

  /** Outcome of a format check. */
  public record ValidationResult(boolean valid, String reason) {

    static ValidationResult ok() {
      return new ValidationResult(true, "File format is supported");
    }

    static ValidationResult invalid(String reason) {
      return new ValidationResult(false, reason);
    }
  }
}
