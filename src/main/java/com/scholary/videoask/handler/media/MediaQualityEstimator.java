package com.scholary.videoask.handler.media;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Estimates media quality from the file's HTTP headers.
 *
 * <p>Only a HEAD request is issued; the body is never downloaded. The bitrate is estimated from
 * the content length under the assumption that every recording is three minutes long, which makes
 * the resulting tier a rough indicator rather than a measurement.
 *
 * <p>Successful probes are cached per URL in a bounded Caffeine cache, because a callback and a
 * later quality lookup for the same job would otherwise probe the same file twice. Failures are
 * not cached.
 */
@Component
public class MediaQualityEstimator {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaQualityEstimator.class);

  static final int ASSUMED_DURATION_SECONDS = 180;

  private static final Set<String> AUDIO_EXTENSIONS =
      Set.of("mp3", "ogg", "wav", "pcm", "flac", "aac", "m4a", "wma", "aiff");
  private static final Set<String> VIDEO_EXTENSIONS = Set.of("mp4", "mov", "webm");

  private static final Map<String, AudioThresholds> AUDIO_THRESHOLDS =
      Map.of(
          "mp3", new AudioThresholds(192, 128),
          "aac", new AudioThresholds(256, 192));

  private static final Map<String, VideoThresholds> VIDEO_THRESHOLDS =
      Map.of(
          "mp4",
          new VideoThresholds(
              new VideoBand(192, 2000), new VideoBand(128, 1000)));

  private final HttpClient httpClient;
  private final Duration probeTimeout;
  private final Cache<String, MediaQualityReport> cache;

  public MediaQualityEstimator(MediaProperties properties) {
    this.probeTimeout = Duration.ofSeconds(properties.probeTimeout());
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(probeTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.probeCacheSize())
            .expireAfterWrite(Duration.ofMinutes(properties.probeCacheExpireAfterMinutes()))
            .build();
  }

  public MediaQualityReport estimate(String mediaUrl) {
    return estimate(mediaUrl, Map.of());
  }

  /**
   * Estimate the quality tier of a remote media file.
   *
   * <p>Never throws: transport problems produce an UNKNOWN report carrying the error.
   *
   * @param mediaUrl the media URL
   * @param headers extra request headers for the HEAD request
   * @return the quality report
   */
  public MediaQualityReport estimate(String mediaUrl, Map<String, String> headers) {
    Optional<String> extension = MediaValidator.extensionOf(mediaUrl);
    String format = extension.orElse(null);
    String mediaType = mediaTypeOf(format);
    if (mediaType == null) {
      return MediaQualityReport.unknown("Could not determine media type");
    }

    MediaQualityReport cached = cache.getIfPresent(mediaUrl);
    if (cached != null) {
      LOGGER.debug("Media quality cache hit: url={}", mediaUrl);
      return cached;
    }

    OptionalLong contentLength;
    try {
      contentLength = probeContentLength(mediaUrl, headers);
    } catch (IOException | IllegalArgumentException e) {
      LOGGER.warn("Media probe failed: url={}, error={}", mediaUrl, e.getMessage());
      return MediaQualityReport.failed(e.getMessage());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return MediaQualityReport.failed("Media probe interrupted");
    }

    if (contentLength.isEmpty()) {
      return new MediaQualityReport(
          QualityTier.UNKNOWN,
          mediaType,
          format,
          null,
          null,
          List.of("Could not determine content length"),
          null);
    }

    double bitrate = estimateBitrateKbps(contentLength.getAsLong());
    MediaQualityReport report = classify(mediaType, format, bitrate);
    cache.put(mediaUrl, report);

    LOGGER.info(
        "Media quality estimated: url={}, bytes={}, bitrate={}kbps, tier={}",
        mediaUrl,
        contentLength.getAsLong(),
        String.format("%.1f", bitrate),
        report.tier());
    return report;
  }

  /** Bitrate in kbps under the fixed three-minute duration assumption. */
  static double estimateBitrateKbps(long contentLengthBytes) {
    return contentLengthBytes * 8.0 / (ASSUMED_DURATION_SECONDS * 1000.0);
  }

  static MediaQualityReport classify(String mediaType, String format, double bitrate) {
    List<String> warnings = new ArrayList<>();
    QualityTier tier = QualityTier.UNKNOWN;
    String recommended = null;

    if ("audio".equals(mediaType) && AUDIO_THRESHOLDS.containsKey(format)) {
      AudioThresholds thresholds = AUDIO_THRESHOLDS.get(format);
      tier = tierFor(bitrate, thresholds.highKbps(), thresholds.mediumKbps());
      recommended = thresholds.mediumKbps() + " kbps";
      if (tier == QualityTier.LOW) {
        warnings.add("Low quality audio file may result in poor transcription");
        warnings.add("Recommended minimum bitrate: " + recommended);
      }
    } else if ("video".equals(mediaType) && VIDEO_THRESHOLDS.containsKey(format)) {
      VideoThresholds thresholds = VIDEO_THRESHOLDS.get(format);
      tier = tierFor(bitrate, thresholds.high().totalKbps(), thresholds.medium().totalKbps());
      recommended =
          String.format(
              "Audio %d kbps, Video %d kbps",
              thresholds.medium().audioKbps(), thresholds.medium().videoKbps());
      if (tier == QualityTier.LOW) {
        warnings.add("Low quality video file may result in poor transcription");
        warnings.add("Recommended minimum bitrate: " + recommended);
      }
    }

    return new MediaQualityReport(tier, mediaType, format, bitrate, recommended, warnings, null);
  }

  private static QualityTier tierFor(double bitrate, int high, int medium) {
    if (bitrate >= high) {
      return QualityTier.HIGH;
    }
    if (bitrate >= medium) {
      return QualityTier.MEDIUM;
    }
    return QualityTier.LOW;
  }

  private static String mediaTypeOf(String format) {
    if (format == null) {
      return null;
    }
    if (AUDIO_EXTENSIONS.contains(format)) {
      return "audio";
    }
    if (VIDEO_EXTENSIONS.contains(format)) {
      return "video";
    }
    return null;
  }

  private OptionalLong probeContentLength(String mediaUrl, Map<String, String> headers)
      throws IOException, InterruptedException {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(mediaUrl))
            .timeout(probeTimeout)
            .method("HEAD", HttpRequest.BodyPublishers.noBody());
    headers.forEach(builder::header);

    HttpResponse<Void> response =
        httpClient.send(builder.build(), HttpResponse.BodyHandlers.discarding());
    if (response.statusCode() < 200 || response.statusCode() >= 300) {
      throw new IOException("Media HEAD request returned status " + response.statusCode());
    }
    return response.headers().firstValueAsLong("Content-Length");
  }

  /** Audio thresholds in kbps; anything below {@code mediumKbps} is low quality. */
  record AudioThresholds(int highKbps, int mediumKbps) {}

  /** Audio and video component bitrates for one video quality band. */
  record VideoBand(int audioKbps, int videoKbps) {

    int totalKbps() {
      return audioKbps + videoKbps;
    }
  }

  /** Video bands; below medium is low. Tiers compare against the summed audio and video rate. */
  record VideoThresholds(VideoBand high, VideoBand medium) {}
}
