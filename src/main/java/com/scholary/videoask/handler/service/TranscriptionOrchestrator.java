package com.scholary.videoask.handler.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.scholary.videoask.handler.api.ManualTranscriptionRequest;
import com.scholary.videoask.handler.api.WebhookAnswer;
import com.scholary.videoask.handler.api.WebhookEvent;
import com.scholary.videoask.handler.job.JobMetadata;
import com.scholary.videoask.handler.job.JobStatus;
import com.scholary.videoask.handler.job.TranscriptionJob;
import com.scholary.videoask.handler.logging.StructuredLogger;
import com.scholary.videoask.handler.media.MediaQualityEstimator;
import com.scholary.videoask.handler.media.MediaQualityReport;
import com.scholary.videoask.handler.media.MediaValidationException;
import com.scholary.videoask.handler.media.MediaValidator;
import com.scholary.videoask.handler.nlp.EnhancedTranscript;
import com.scholary.videoask.handler.nlp.TextAnalyzer;
import com.scholary.videoask.handler.quality.QualityReport;
import com.scholary.videoask.handler.quality.TranscriptQualityScorer;
import com.scholary.videoask.handler.retry.RetryPolicy;
import com.scholary.videoask.handler.revai.CallbackEvent;
import com.scholary.videoask.handler.revai.JobDetails;
import com.scholary.videoask.handler.revai.JobFailedException;
import com.scholary.videoask.handler.revai.JobHandle;
import com.scholary.videoask.handler.revai.ProviderException;
import com.scholary.videoask.handler.revai.RevAiProperties;
import com.scholary.videoask.handler.revai.SubmissionOptions;
import com.scholary.videoask.handler.revai.Transcript;
import com.scholary.videoask.handler.revai.TranscriptionClient;
import com.scholary.videoask.handler.revai.TranscriptionTimeoutException;
import com.scholary.videoask.handler.storage.ResultStore;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Conducts the transcription pipeline.
 *
 * <p>Three entry points lead into it:
 *
 * <ul>
 *   <li>Webhook: every media answer of a form response is submitted with a callback; failures are
 *       collected per answer and never abort the other answers
 *   <li>Callback: a finished job is reconciled and stored
 *   <li>Manual: a single file is submitted and optionally waited for, then reconciled and stored
 *       inline; batches are submitted in parallel
 * </ul>
 *
 * <p>Callback and synchronous completion converge on {@link #reconcile}, which merges acoustic
 * and linguistic quality and writes the enhanced transcript to the result store. Only the submit
 * call is retried.
 */
@Service
public class TranscriptionOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptionOrchestrator.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  static final String UNKNOWN_QUESTION = "Unknown Question";
  static final String MANUAL_QUESTION = "Manual request";
  static final String BATCH_QUESTION = "Batch request";
  static final String EMPTY_TRANSCRIPT = "Transcript is empty";

  private final TranscriptionClient transcriptionClient;
  private final MediaValidator mediaValidator;
  private final MediaQualityEstimator mediaQualityEstimator;
  private final TranscriptQualityScorer qualityScorer;
  private final TextAnalyzer textAnalyzer;
  private final ResultStore resultStore;
  private final RetryPolicy submitRetryPolicy;
  private final RevAiProperties revAiProperties;
  private final Executor batchExecutor;

  public TranscriptionOrchestrator(
      TranscriptionClient transcriptionClient,
      MediaValidator mediaValidator,
      MediaQualityEstimator mediaQualityEstimator,
      TranscriptQualityScorer qualityScorer,
      TextAnalyzer textAnalyzer,
      ResultStore resultStore,
      RetryPolicy submitRetryPolicy,
      RevAiProperties revAiProperties,
      @Qualifier("batchExecutor") Executor batchExecutor) {
    this.transcriptionClient = transcriptionClient;
    this.mediaValidator = mediaValidator;
    this.mediaQualityEstimator = mediaQualityEstimator;
    this.qualityScorer = qualityScorer;
    this.textAnalyzer = textAnalyzer;
    this.resultStore = resultStore;
    this.submitRetryPolicy = submitRetryPolicy;
    this.revAiProperties = revAiProperties;
    this.batchExecutor = batchExecutor;
  }

  /**
   * Submit every media answer of a form response.
   *
   * <p>Each answer is submitted with the configured callback URL. An answer that fails validation,
   * configuration or submission is reported in the outcome's error list.
   */
  public WebhookOutcome handleWebhook(WebhookEvent event) {
    List<SubmittedJob> jobs = new ArrayList<>();
    List<ItemError> errors = new ArrayList<>();
    List<WebhookAnswer> answers = event.mediaAnswers();

    LOGGER.info(
        "Processing webhook: eventType={}, interactionId={}, mediaAnswers={}",
        event.eventType(),
        event.interactionId(),
        answers.size());

    for (WebhookAnswer answer : answers) {
      String email = event.contactEmail();
      String question =
          isBlank(answer.pollOptionContent()) ? UNKNOWN_QUESTION : answer.pollOptionContent();
      JobMetadata metadata =
          new JobMetadata(
              email,
              question,
              event.interactionId(),
              answer.answerId(),
              answer.shareId() != null ? answer.shareId() : event.shareId(),
              answer.type(),
              event.contactName());

      PipelineRun run = PipelineRun.received();
      try {
        if (isBlank(email)) {
          throw new MediaValidationException("Contact email is missing");
        }
        TranscriptionJob job =
            submit(
                run,
                answer.mediaUrl(),
                metadata,
                SubmissionOptions.callback(revAiProperties.callbackUrl()));
        run.advance(PipelineStage.AWAITING_CALLBACK);
        jobs.add(new SubmittedJob(job.mediaUrl(), job.jobId()));
      } catch (RuntimeException e) {
        failQuietly(run, e.getMessage());
        LOGGER.warn(
            "Webhook item failed: mediaUrl={}, error={}, message={}",
            answer.mediaUrl(),
            e.getClass().getSimpleName(),
            e.getMessage());
        errors.add(new ItemError(answer.mediaUrl(), e.getMessage()));
      }
    }

    return new WebhookOutcome(jobs, errors);
  }

  /**
   * Process a provider callback.
   *
   * <p>Failed jobs surface their failure detail and nothing is stored. Jobs that are not finished
   * are acknowledged without storing. Completed jobs are reconciled with the transcript embedded
   * in the callback when there is one, otherwise with the fetched transcript.
   */
  public CallbackOutcome handleCallback(JsonNode payload) {
    CallbackEvent event;
    try {
      event = transcriptionClient.parseCallback(payload);
    } catch (ProviderException e) {
      LOGGER.warn("Rejected callback: {}", e.getMessage());
      return new CallbackOutcome(null, null, PipelineStage.FAILED, false, e.getMessage());
    }

    PipelineRun run = PipelineRun.awaitingCallback(event.jobId());
    JobMetadata metadata = event.metadata();
    StructuredLogger.setJobContext(event.jobId(), metadata.email(), metadata.question());
    try {
      structuredLogger.logCallbackReceived(event.jobId(), event.status().label());

      if (event.status() == JobStatus.FAILED) {
        String detail =
            isBlank(event.failureDetail()) ? "Transcription failed" : event.failureDetail();
        run.fail(detail);
        LOGGER.warn("Transcription job failed: jobId={}, detail={}", event.jobId(), detail);
        return new CallbackOutcome(event.jobId(), event.status(), run.stage(), false, detail);
      }
      if (event.status() != JobStatus.COMPLETED) {
        LOGGER.info("Job not finished yet: jobId={}, status={}", event.jobId(), event.status());
        return new CallbackOutcome(event.jobId(), event.status(), run.stage(), false, null);
      }

      try {
        Transcript transcript =
            event.transcript().orElseGet(() -> transcriptionClient.fetchTranscript(event.jobId()));
        ReconciledTranscript result =
            reconcile(run, event.toJobDetails(), transcript, metadata, event.mediaUrl());
        return new CallbackOutcome(
            event.jobId(), event.status(), run.stage(), result.stored(), null);
      } catch (RuntimeException e) {
        failQuietly(run, e.getMessage());
        LOGGER.error("Callback processing failed: jobId={}", event.jobId(), e);
        return new CallbackOutcome(
            event.jobId(), event.status(), run.stage(), false, e.getMessage());
      }
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /**
   * Submit a single file and return without waiting. Completion is delivered by callback.
   *
   * @throws MediaValidationException if the format is not supported
   * @throws com.scholary.videoask.handler.config.ConfigurationException if the key or callback URL
   *     is missing
   * @throws ProviderException if submission fails after retries
   */
  public TranscriptionJob submitManual(ManualTranscriptionRequest request) {
    PipelineRun run = PipelineRun.received();
    try {
      TranscriptionJob job =
          submit(
              run,
              request.mediaUrl(),
              JobMetadata.of(request.email(), questionOrDefault(request, MANUAL_QUESTION)),
              SubmissionOptions.callback(revAiProperties.callbackUrl()));
      run.advance(PipelineStage.AWAITING_CALLBACK);
      return job;
    } catch (RuntimeException e) {
      failQuietly(run, e.getMessage());
      throw e;
    }
  }

  /**
   * Submit a single file, wait for it, then reconcile and store the result.
   *
   * <p>The job is submitted without a callback URL so that the result is stored once. On timeout
   * or job failure nothing is stored.
   *
   * @throws TranscriptionTimeoutException if the job does not finish within the wait ceiling
   * @throws JobFailedException if the provider reports the job as failed or the transcript is
   *     empty
   */
  public ReconciledTranscript transcribeAndWait(ManualTranscriptionRequest request) {
    Duration maxWait =
        Duration.ofSeconds(
            request.maxWaitTime() != null
                ? request.maxWaitTime()
                : revAiProperties.defaultMaxWaitSeconds());
    JobMetadata metadata =
        JobMetadata.of(request.email(), questionOrDefault(request, MANUAL_QUESTION));

    PipelineRun run = PipelineRun.received();
    try {
      TranscriptionJob job =
          submit(run, request.mediaUrl(), metadata, SubmissionOptions.waitFor(null));
      run.advance(PipelineStage.POLLING);
      StructuredLogger.setJobContext(job.jobId(), metadata.email(), metadata.question());

      JobDetails details = transcriptionClient.awaitCompletion(job.jobId(), maxWait);
      Transcript transcript = transcriptionClient.fetchTranscript(job.jobId());
      return reconcile(run, details, transcript, metadata, request.mediaUrl());
    } catch (RuntimeException e) {
      failQuietly(run, e.getMessage());
      throw e;
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  /**
   * Submit a batch of files in parallel on the batch executor.
   *
   * <p>Results are returned in request order. Items without a media URL or email are reported as
   * failed without being submitted.
   */
  public List<BatchItemResult> submitBatch(List<ManualTranscriptionRequest> requests) {
    Map<String, String> context = MDC.getCopyOfContextMap();
    List<CompletableFuture<BatchItemResult>> futures = new ArrayList<>();
    for (ManualTranscriptionRequest request : requests) {
      try {
        futures.add(
            CompletableFuture.supplyAsync(() -> submitBatchItem(request, context), batchExecutor));
      } catch (RejectedExecutionException e) {
        LOGGER.warn("Batch executor rejected item: mediaUrl={}", request.mediaUrl());
        futures.add(
            CompletableFuture.completedFuture(
                BatchItemResult.failed(request.mediaUrl(), "Batch capacity exceeded")));
      }
    }

    List<BatchItemResult> results = new ArrayList<>();
    for (CompletableFuture<BatchItemResult> future : futures) {
      results.add(future.join());
    }
    LOGGER.info(
        "Batch submitted: total={}, failed={}",
        results.size(),
        results.stream().filter(BatchItemResult::isFailed).count());
    return results;
  }

  private BatchItemResult submitBatchItem(
      ManualTranscriptionRequest request, Map<String, String> context) {
    Map<String, String> previous = MDC.getCopyOfContextMap();
    if (context != null) {
      MDC.setContextMap(context);
    }
    try {
      if (isBlank(request.mediaUrl())) {
        return BatchItemResult.failed(request.mediaUrl(), "media_url is required");
      }
      if (isBlank(request.email())) {
        return BatchItemResult.failed(request.mediaUrl(), "email is required");
      }

      PipelineRun run = PipelineRun.received();
      try {
        TranscriptionJob job =
            submit(
                run,
                request.mediaUrl(),
                JobMetadata.of(request.email(), questionOrDefault(request, BATCH_QUESTION)),
                SubmissionOptions.callback(revAiProperties.callbackUrl()));
        run.advance(PipelineStage.AWAITING_CALLBACK);
        return BatchItemResult.submitted(job.mediaUrl(), job.jobId());
      } catch (RuntimeException e) {
        failQuietly(run, e.getMessage());
        return BatchItemResult.failed(request.mediaUrl(), e.getMessage());
      }
    } finally {
      if (previous == null) {
        MDC.clear();
      } else {
        MDC.setContextMap(previous);
      }
    }
  }

  /**
   * Quality report for a provider job. Jobs that are not completed get a status-only report.
   *
   * @throws ProviderException if the provider cannot be queried
   */
  public QualityReport qualityFor(String jobId) {
    JobDetails details = transcriptionClient.pollStatus(jobId);
    MediaQualityReport media = mediaQualityEstimator.estimate(details.mediaUrl());
    if (details.status() != JobStatus.COMPLETED) {
      return qualityScorer.score(details, null, media);
    }
    Transcript transcript = transcriptionClient.fetchTranscript(jobId);
    EnhancedTranscript enhanced = textAnalyzer.analyzeAndEnhance(transcript.plainText());
    return qualityScorer.score(details, transcript, media).withLinguistics(enhanced);
  }

  /**
   * Current status of a provider job, enriched with the enhanced transcript and merged quality
   * when completed. Nothing is stored.
   */
  public JobStatusView status(String jobId) {
    JobDetails details = transcriptionClient.pollStatus(jobId);
    if (details.status() != JobStatus.COMPLETED) {
      return new JobStatusView(
          jobId, details.status(), details.createdOn(), details.failureDetail(), null, null);
    }
    Transcript transcript = transcriptionClient.fetchTranscript(jobId);
    EnhancedTranscript enhanced = textAnalyzer.analyzeAndEnhance(transcript.plainText());
    MediaQualityReport media = mediaQualityEstimator.estimate(details.mediaUrl());
    QualityReport quality =
        qualityScorer.score(details, transcript, media).withLinguistics(enhanced);
    return new JobStatusView(
        jobId,
        details.status(),
        details.createdOn(),
        null,
        enhanced.enhancedText(),
        quality);
  }

  private TranscriptionJob submit(
      PipelineRun run, String mediaUrl, JobMetadata metadata, SubmissionOptions options) {
    mediaValidator.requireValid(mediaUrl);
    run.advance(PipelineStage.VALIDATED);

    JobHandle handle =
        submitRetryPolicy.execute(
            "submit job", () -> transcriptionClient.submit(mediaUrl, metadata, options));
    run.submitted(handle.jobId());
    structuredLogger.logJobSubmitted(
        handle.jobId(), mediaUrl, metadata.email(), metadata.question());

    return new TranscriptionJob(
        handle.jobId(),
        mediaUrl,
        metadata.email(),
        metadata.question(),
        metadata,
        handle.status(),
        handle.submittedAt());
  }

  /**
   * Merge transcript quality, media quality and linguistic analysis, then store the enhanced
   * transcript under the job's contact email and question.
   *
   * @throws JobFailedException if the transcript has no text
   */
  ReconciledTranscript reconcile(
      PipelineRun run,
      JobDetails details,
      Transcript transcript,
      JobMetadata metadata,
      String fallbackMediaUrl) {
    String text = transcript.plainText();
    if (text.isBlank()) {
      throw new JobFailedException(details.id(), EMPTY_TRANSCRIPT);
    }
    String mediaUrl = isBlank(details.mediaUrl()) ? fallbackMediaUrl : details.mediaUrl();

    MediaQualityReport media = mediaQualityEstimator.estimate(mediaUrl);
    QualityReport acoustic = qualityScorer.score(details, transcript, media);
    EnhancedTranscript enhanced = textAnalyzer.analyzeAndEnhance(text);
    QualityReport merged = acoustic.withLinguistics(enhanced);
    run.advance(PipelineStage.RECONCILED);

    boolean stored = false;
    if (isBlank(metadata.email()) || isBlank(metadata.question())) {
      LOGGER.warn(
          "Job metadata lacks contact email or question; not storing: jobId={}, email={},"
              + " question={}",
          details.id(),
          metadata.email(),
          metadata.question());
    } else {
      stored =
          resultStore.upsert(
              metadata.email(), metadata.question(), mediaUrl, enhanced.enhancedText(), merged);
    }
    structuredLogger.logRecordStored(details.id(), metadata.email(), metadata.question(), stored);
    if (stored) {
      run.advance(PipelineStage.STORED);
    }
    return new ReconciledTranscript(details.id(), enhanced.enhancedText(), merged, stored);
  }

  private static void failQuietly(PipelineRun run, String reason) {
    if (!run.stage().isTerminal()) {
      run.fail(reason);
    }
  }

  private static String questionOrDefault(ManualTranscriptionRequest request, String fallback) {
    return isBlank(request.question()) ? fallback : request.question();
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
