package com.scholary.videoask.handler.revai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.videoask.handler.config.ConfigurationException;
import com.scholary.videoask.handler.job.JobMetadata;
import com.scholary.videoask.handler.job.JobStatus;
import com.scholary.videoask.handler.media.MediaValidator;
import com.scholary.videoask.handler.retry.Sleeper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriUtils;

/**
 * HTTP client for the Rev.ai asynchronous speech-to-text API.
 *
 * <p>This handles the low-level HTTP communication: building job requests, authenticating with the
 * bearer key, parsing job and transcript responses, and mapping every failure to {@link
 * ProviderException}. It does not retry; retries belong to the call site.
 *
 * <p>The synchronous wait polls at a fixed interval. The ceiling is measured on the injected
 * clock, and waits go through the injected {@link Sleeper}.
 */
@Component
public class RevAiClient implements TranscriptionClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(RevAiClient.class);

  static final String TRANSCRIPT_MEDIA_TYPE = "application/vnd.rev.transcript.v1.0+json";
  private static final int MAX_ERROR_DETAIL_LENGTH = 500;

  private final HttpClient httpClient;
  private final RevAiProperties properties;
  private final ObjectMapper objectMapper;
  private final MediaValidator mediaValidator;
  private final Sleeper sleeper;
  private final Clock clock;

  public RevAiClient(
      RevAiProperties properties,
      ObjectMapper objectMapper,
      MediaValidator mediaValidator,
      Sleeper sleeper,
      Clock clock) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.mediaValidator = mediaValidator;
    this.sleeper = sleeper;
    this.clock = clock;

    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Rev.ai client: baseUrl={}, apiKeyConfigured={}, callbackConfigured={}",
        properties.baseUrl(),
        properties.hasApiKey(),
        properties.hasCallbackUrl());
  }

  @Override
  public JobHandle submit(String mediaUrl, JobMetadata metadata, SubmissionOptions options) {
    mediaValidator.requireValid(mediaUrl);
    requireApiKey();
    if (!options.hasCallback() && !options.waitForCompletion()) {
      throw new ConfigurationException(
          "No completion path: configure a callback URL or wait for completion");
    }

    ObjectNode body = objectMapper.createObjectNode();
    body.put("media_url", mediaUrl);
    body.put("metadata", encodeMetadata(metadata));
    if (options.hasCallback()) {
      ObjectNode notification = body.putObject("notification_config");
      notification.put("url", options.callbackUrl());
      notification.put("method", "POST");
    }

    HttpRequest request =
        authorized("/jobs")
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(body.toString()))
            .build();

    RevAiJobResponse job = parseJob(send(request, "submit job"), "submit job");
    if (job.id() == null || job.id().isBlank()) {
      throw new ProviderException("Provider accepted the job but returned no job id");
    }

    LOGGER.info("Submitted transcription job: jobId={}, status={}", job.id(), job.status());
    return new JobHandle(job.id(), JobStatus.fromProvider(job.status()), clock.instant());
  }

  @Override
  public JobDetails pollStatus(String jobId) {
    requireApiKey();
    HttpRequest request = authorized(jobPath(jobId)).GET().build();
    RevAiJobResponse job = parseJob(send(request, "get job " + jobId), "get job " + jobId);
    return toDetails(job);
  }

  @Override
  public Transcript fetchTranscript(String jobId) {
    requireApiKey();
    HttpRequest request =
        authorized(jobPath(jobId) + "/transcript")
            .header("Accept", TRANSCRIPT_MEDIA_TYPE)
            .GET()
            .build();

    String response = send(request, "get transcript " + jobId);
    try {
      Transcript transcript = objectMapper.readValue(response, Transcript.class);
      LOGGER.info(
          "Fetched transcript: jobId={}, monologues={}, words={}",
          jobId,
          transcript.monologues().size(),
          transcript.textElements().size());
      return transcript;
    } catch (JsonProcessingException e) {
      throw new ProviderException("Could not parse transcript for job " + jobId, e);
    }
  }

  @Override
  public CallbackEvent parseCallback(JsonNode payload) {
    if (payload == null || payload.isNull()) {
      throw new ProviderException("Callback payload is empty");
    }
    JsonNode jobNode = payload.has("job") ? payload.get("job") : payload;

    RevAiJobResponse job;
    try {
      job = objectMapper.treeToValue(jobNode, RevAiJobResponse.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new ProviderException("Could not parse callback payload", e);
    }
    if (job == null || job.id() == null || job.id().isBlank()) {
      throw new ProviderException("Callback payload has no job id");
    }

    Transcript embedded = job.transcript();
    if (embedded == null && payload.has("transcript")) {
      try {
        embedded = objectMapper.treeToValue(payload.get("transcript"), Transcript.class);
      } catch (JsonProcessingException | IllegalArgumentException e) {
        throw new ProviderException("Could not parse transcript embedded in callback", e);
      }
    }
    if (embedded != null && embedded.monologues().isEmpty()) {
      embedded = null;
    }

    JobDetails details = toDetails(job);
    return new CallbackEvent(
        details.id(),
        details.status(),
        details.mediaUrl(),
        details.failureDetail(),
        details.metadata(),
        embedded);
  }

  @Override
  public JobDetails awaitCompletion(String jobId, Duration maxWait) {
    Duration interval = Duration.ofSeconds(properties.pollIntervalSeconds());
    Instant deadline = clock.instant().plus(maxWait);

    while (true) {
      JobDetails details = pollStatus(jobId);
      if (details.status() == JobStatus.COMPLETED) {
        return details;
      }
      if (details.status() == JobStatus.FAILED) {
        throw new JobFailedException(jobId, details.failureDetail());
      }

      Duration remaining = Duration.between(clock.instant(), deadline);
      if (remaining.isNegative() || remaining.isZero()) {
        throw new TranscriptionTimeoutException(jobId, maxWait);
      }

      Duration wait = remaining.compareTo(interval) < 0 ? remaining : interval;
      LOGGER.debug(
          "Job not finished: jobId={}, status={}, next poll in {}ms",
          jobId,
          details.status(),
          wait.toMillis());
      try {
        sleeper.sleep(wait);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new TranscriptionTimeoutException(jobId, maxWait);
      }
    }
  }

  private void requireApiKey() {
    if (!properties.hasApiKey()) {
      throw new ConfigurationException("Rev.ai API key not configured");
    }
  }

  private static String jobPath(String jobId) {
    return "/jobs/" + UriUtils.encodePathSegment(jobId, StandardCharsets.UTF_8);
  }

  private HttpRequest.Builder authorized(String path) {
    URI uri;
    try {
      uri = URI.create(properties.baseUrl() + path);
    } catch (IllegalArgumentException e) {
      throw new ProviderException("Invalid provider request URI: " + e.getMessage(), e);
    }
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("Authorization", "Bearer " + properties.apiKey());
  }

  /**
   * Send a request and return the body of a 2xx response.
   *
   * @throws ProviderException for transport failures and non-2xx responses
   */
  private String send(HttpRequest request, String operation) {
    LOGGER.debug("Sending {} request to {}", operation, request.uri());
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new ProviderException(
          String.format("Rev.ai %s failed: %s", operation, e.getMessage()), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ProviderException(String.format("Rev.ai %s interrupted", operation), e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new ProviderException(
          String.format(
              "Rev.ai %s returned status %d: %s", operation, status, errorDetail(response.body())),
          status);
    }
    return response.body();
  }

  private RevAiJobResponse parseJob(String body, String operation) {
    try {
      return objectMapper.readValue(body, RevAiJobResponse.class);
    } catch (JsonProcessingException e) {
      throw new ProviderException("Could not parse Rev.ai response for " + operation, e);
    }
  }

  private JobDetails toDetails(RevAiJobResponse job) {
    String failureDetail = job.failureDetail() != null ? job.failureDetail() : job.failure();
    return new JobDetails(
        job.id(),
        JobStatus.fromProvider(job.status()),
        job.mediaUrl(),
        job.createdOn(),
        failureDetail,
        decodeMetadata(job.metadata()));
  }

  private String encodeMetadata(JobMetadata metadata) {
    try {
      return objectMapper.writeValueAsString(metadata == null ? JobMetadata.empty() : metadata);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Could not encode job metadata", e);
    }
  }

  /**
   * Decode correlation metadata. The provider echoes it as the string we sent; older jobs may
   * carry a JSON object or a plain non-JSON string, which yields empty metadata.
   */
  JobMetadata decodeMetadata(JsonNode metadata) {
    if (metadata == null || metadata.isNull()) {
      return JobMetadata.empty();
    }
    try {
      if (metadata.isObject()) {
        return objectMapper.treeToValue(metadata, JobMetadata.class);
      }
      if (metadata.isTextual() && metadata.asText().trim().startsWith("{")) {
        return objectMapper.readValue(metadata.asText(), JobMetadata.class);
      }
    } catch (JsonProcessingException e) {
      LOGGER.warn("Ignoring unreadable job metadata: {}", e.getOriginalMessage());
    }
    return JobMetadata.empty();
  }

  private String errorDetail(String body) {
    if (body == null || body.isBlank()) {
      return "(no body)";
    }
    try {
      JsonNode node = objectMapper.readTree(body);
      for (String field : new String[] {"detail", "title", "error", "message"}) {
        if (node.hasNonNull(field)) {
          return node.get(field).asText();
        }
      }
    } catch (JsonProcessingException e) {
      LOGGER.debug("Error body is not JSON");
    }
    return body.length() > MAX_ERROR_DETAIL_LENGTH
        ? body.substring(0, MAX_ERROR_DETAIL_LENGTH) + "..."
        : body;
  }
}
