package com.scholary.videoask.handler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.videoask.handler.api.Contact;
import com.scholary.videoask.handler.api.ManualTranscriptionRequest;
import com.scholary.videoask.handler.api.WebhookAnswer;
import com.scholary.videoask.handler.api.WebhookEvent;
import com.scholary.videoask.handler.config.ConfigurationException;
import com.scholary.videoask.handler.job.JobMetadata;
import com.scholary.videoask.handler.job.JobStatus;
import com.scholary.videoask.handler.job.TranscriptionJob;
import com.scholary.videoask.handler.media.MediaProperties;
import com.scholary.videoask.handler.media.MediaQualityEstimator;
import com.scholary.videoask.handler.media.MediaQualityReport;
import com.scholary.videoask.handler.media.MediaValidator;
import com.scholary.videoask.handler.media.QualityTier;
import com.scholary.videoask.handler.nlp.RuleBasedTextPipeline;
import com.scholary.videoask.handler.nlp.TextAnalyzer;
import com.scholary.videoask.handler.quality.QualityReport;
import com.scholary.videoask.handler.quality.TranscriptQualityScorer;
import com.scholary.videoask.handler.retry.RetryPolicy;
import com.scholary.videoask.handler.revai.CallbackEvent;
import com.scholary.videoask.handler.revai.JobDetails;
import com.scholary.videoask.handler.revai.JobHandle;
import com.scholary.videoask.handler.revai.Monologue;
import com.scholary.videoask.handler.revai.ProviderException;
import com.scholary.videoask.handler.revai.RevAiProperties;
import com.scholary.videoask.handler.revai.SubmissionOptions;
import com.scholary.videoask.handler.revai.Transcript;
import com.scholary.videoask.handler.revai.TranscriptElement;
import com.scholary.videoask.handler.revai.TranscriptionClient;
import com.scholary.videoask.handler.revai.TranscriptionTimeoutException;
import com.scholary.videoask.handler.storage.ResultStore;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TranscriptionOrchestratorTest {

  private static final String MEDIA_URL = "https://media.example.com/test-audio.mp3";
  private static final String EMAIL = "test@example.com";
  private static final String QUESTION = "What is your experience?";
  private static final String CALLBACK_URL = "https://handler.example.com/webhook";

  @Mock private TranscriptionClient transcriptionClient;
  @Mock private MediaQualityEstimator mediaQualityEstimator;
  @Mock private ResultStore resultStore;

  private TranscriptionOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    MediaValidator mediaValidator =
        new MediaValidator(new MediaProperties(Set.of("mp3", "mp4", "wav"), 5, 10, 1));
    RetryPolicy retryPolicy =
        new RetryPolicy(
            3, Duration.ofSeconds(1), 2.0, e -> e instanceof ProviderException, duration -> {});
    RevAiProperties revAiProperties =
        new RevAiProperties("https://api.rev.ai/speechtotext/v1", "", CALLBACK_URL, 5, 5, 1, 300);

    orchestrator =
        new TranscriptionOrchestrator(
            transcriptionClient,
            mediaValidator,
            mediaQualityEstimator,
            new TranscriptQualityScorer(),
            new TextAnalyzer(new RuleBasedTextPipeline()),
            resultStore,
            retryPolicy,
            revAiProperties,
            Runnable::run);
  }

  private static WebhookEvent formResponse(WebhookAnswer... answers) {
    return new WebhookEvent(
        "form_response",
        "int-1",
        "share-1",
        new Contact(EMAIL, "Test User", null),
        List.of(answers));
  }

  private static JobHandle handle(String jobId) {
    return new JobHandle(jobId, JobStatus.IN_PROGRESS, Instant.parse("2024-05-01T10:00:00Z"));
  }

  private static Transcript transcript(String... words) {
    List<TranscriptElement> elements =
        java.util.Arrays.stream(words).map(w -> TranscriptElement.text(w, 0.0, 0.95)).toList();
    return new Transcript(List.of(new Monologue(0, elements)));
  }

  private static MediaQualityReport highQuality() {
    return new MediaQualityReport(
        QualityTier.HIGH, "audio", "mp3", 192.0, "128 kbps", List.of(), null);
  }

  @Test
  void handleWebhook_shouldReportMissingCredentialPerItem() {
    when(transcriptionClient.submit(eq(MEDIA_URL), any(), any()))
        .thenThrow(new ConfigurationException("Rev.ai API key not configured"));

    WebhookOutcome outcome =
        orchestrator.handleWebhook(
            formResponse(new WebhookAnswer("ans-1", MEDIA_URL, "audio", QUESTION, null)));

    assertThat(outcome.jobs()).isEmpty();
    assertThat(outcome.errors())
        .containsExactly(new ItemError(MEDIA_URL, "Rev.ai API key not configured"));
    verify(transcriptionClient, times(1)).submit(any(), any(), any());
  }

  @Test
  void handleWebhook_shouldSubmitMediaAnswersWithCorrelationMetadata() {
    when(transcriptionClient.submit(anyString(), any(), any()))
        .thenReturn(handle("job-1"), handle("job-2"));

    WebhookOutcome outcome =
        orchestrator.handleWebhook(
            formResponse(
                new WebhookAnswer("ans-1", MEDIA_URL, "audio", "Staying Connected", null),
                new WebhookAnswer("ans-2", null, "text", "Name", null),
                new WebhookAnswer(
                    "ans-3", "https://media.example.com/b.mp4", "video", null, null)));

    assertThat(outcome.errors()).isEmpty();
    assertThat(outcome.jobs())
        .containsExactly(
            new SubmittedJob(MEDIA_URL, "job-1"),
            new SubmittedJob("https://media.example.com/b.mp4", "job-2"));

    ArgumentCaptor<JobMetadata> metadata = ArgumentCaptor.forClass(JobMetadata.class);
    ArgumentCaptor<SubmissionOptions> options = ArgumentCaptor.forClass(SubmissionOptions.class);
    verify(transcriptionClient, times(2))
        .submit(anyString(), metadata.capture(), options.capture());

    JobMetadata first = metadata.getAllValues().get(0);
    assertThat(first.email()).isEqualTo(EMAIL);
    assertThat(first.question()).isEqualTo("Staying Connected");
    assertThat(first.interactionId()).isEqualTo("int-1");
    assertThat(first.answerId()).isEqualTo("ans-1");
    assertThat(first.shareId()).isEqualTo("share-1");
    assertThat(first.contactName()).isEqualTo("Test User");
    assertThat(metadata.getAllValues().get(1).question()).isEqualTo("Unknown Question");
    assertThat(options.getValue().callbackUrl()).isEqualTo(CALLBACK_URL);
  }

  @Test
  void handleWebhook_shouldReadAnswersNestedUnderContact() {
    when(transcriptionClient.submit(anyString(), any(), any())).thenReturn(handle("job-1"));
    WebhookEvent event =
        new WebhookEvent(
            "form_response",
            "int-1",
            null,
            new Contact(
                EMAIL,
                null,
                List.of(new WebhookAnswer("ans-1", MEDIA_URL, "audio", QUESTION, null))),
            null);

    assertThat(orchestrator.handleWebhook(event).jobs()).hasSize(1);
  }

  @Test
  void handleWebhook_shouldRetryTransientProviderErrors() {
    when(transcriptionClient.submit(anyString(), any(), any()))
        .thenThrow(new ProviderException("Rev.ai submit job returned status 503: busy", 503))
        .thenThrow(new ProviderException("Rev.ai submit job failed: reset"))
        .thenReturn(handle("job-1"));

    WebhookOutcome outcome =
        orchestrator.handleWebhook(
            formResponse(new WebhookAnswer("ans-1", MEDIA_URL, "audio", QUESTION, null)));

    assertThat(outcome.jobs()).containsExactly(new SubmittedJob(MEDIA_URL, "job-1"));
    verify(transcriptionClient, times(3)).submit(anyString(), any(), any());
  }

  @Test
  void handleWebhook_shouldContinueAfterUnsupportedFormat() {
    when(transcriptionClient.submit(eq(MEDIA_URL), any(), any())).thenReturn(handle("job-1"));

    WebhookOutcome outcome =
        orchestrator.handleWebhook(
            formResponse(
                new WebhookAnswer(
                    "ans-1", "https://media.example.com/a.mkv", "video", QUESTION, null),
                new WebhookAnswer("ans-2", MEDIA_URL, "audio", QUESTION, null)));

    assertThat(outcome.jobs()).containsExactly(new SubmittedJob(MEDIA_URL, "job-1"));
    assertThat(outcome.errors()).hasSize(1);
    assertThat(outcome.errors().get(0).error()).startsWith("Unsupported file format: mkv");
  }

  @Test
  void handleCallback_shouldStoreEmbeddedTranscript() {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    when(transcriptionClient.parseCallback(payload))
        .thenReturn(
            new CallbackEvent(
                "job-1",
                JobStatus.COMPLETED,
                MEDIA_URL,
                null,
                JobMetadata.of(EMAIL, "Staying Connected"),
                transcript("hello", "world")));
    when(mediaQualityEstimator.estimate(MEDIA_URL)).thenReturn(highQuality());
    when(resultStore.upsert(any(), any(), any(), any(), any())).thenReturn(true);

    CallbackOutcome outcome = orchestrator.handleCallback(payload);

    assertThat(outcome.stage()).isEqualTo(PipelineStage.STORED);
    assertThat(outcome.stored()).isTrue();
    assertThat(outcome.error()).isNull();

    ArgumentCaptor<QualityReport> report = ArgumentCaptor.forClass(QualityReport.class);
    verify(resultStore)
        .upsert(
            eq(EMAIL),
            eq("Staying Connected"),
            eq(MEDIA_URL),
            eq("Hello world."),
            report.capture());
    assertThat(report.getValue().overallConfidence()).isEqualTo(0.95);
    assertThat(report.getValue().linguisticQualityScore()).isNotNull();
    assertThat(report.getValue().enhancementWarnings())
        .containsExactly("Added missing sentence-ending punctuation");
    verify(transcriptionClient, never()).fetchTranscript(anyString());
  }

  @Test
  void handleCallback_shouldFetchTranscriptWhenNotEmbedded() {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    when(transcriptionClient.parseCallback(payload))
        .thenReturn(
            new CallbackEvent(
                "job-1",
                JobStatus.COMPLETED,
                MEDIA_URL,
                null,
                JobMetadata.of(EMAIL, QUESTION),
                null));
    when(transcriptionClient.fetchTranscript("job-1")).thenReturn(transcript("Fine."));
    when(mediaQualityEstimator.estimate(MEDIA_URL)).thenReturn(highQuality());
    when(resultStore.upsert(any(), any(), any(), any(), any())).thenReturn(false);

    CallbackOutcome outcome = orchestrator.handleCallback(payload);

    assertThat(outcome.stage()).isEqualTo(PipelineStage.RECONCILED);
    assertThat(outcome.stored()).isFalse();
    verify(transcriptionClient).fetchTranscript("job-1");
  }

  @Test
  void handleCallback_shouldNotStoreWhenMetadataMissing() {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    when(transcriptionClient.parseCallback(payload))
        .thenReturn(
            new CallbackEvent(
                "job-1",
                JobStatus.COMPLETED,
                MEDIA_URL,
                null,
                JobMetadata.empty(),
                transcript("hello", "world")));
    when(mediaQualityEstimator.estimate(MEDIA_URL)).thenReturn(highQuality());

    CallbackOutcome outcome = orchestrator.handleCallback(payload);

    assertThat(outcome.stage()).isEqualTo(PipelineStage.RECONCILED);
    assertThat(outcome.stored()).isFalse();
    assertThat(outcome.error()).isNull();
    verifyNoInteractions(resultStore);
  }

  @Test
  void handleCallback_shouldNotStoreWhenEmailMissing() {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    when(transcriptionClient.parseCallback(payload))
        .thenReturn(
            new CallbackEvent(
                "job-1",
                JobStatus.COMPLETED,
                MEDIA_URL,
                null,
                JobMetadata.of(" ", QUESTION),
                transcript("hello")));
    when(mediaQualityEstimator.estimate(MEDIA_URL)).thenReturn(highQuality());

    CallbackOutcome outcome = orchestrator.handleCallback(payload);

    assertThat(outcome.stored()).isFalse();
    verifyNoInteractions(resultStore);
  }

  @Test
  void handleCallback_shouldSurfaceFailureWithoutStoring() {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    when(transcriptionClient.parseCallback(payload))
        .thenReturn(
            new CallbackEvent(
                "job-1",
                JobStatus.FAILED,
                MEDIA_URL,
                "Unsupported codec",
                JobMetadata.empty(),
                null));

    CallbackOutcome outcome = orchestrator.handleCallback(payload);

    assertThat(outcome.stage()).isEqualTo(PipelineStage.FAILED);
    assertThat(outcome.error()).isEqualTo("Unsupported codec");
    verifyNoInteractions(resultStore, mediaQualityEstimator);
  }

  @Test
  void handleCallback_shouldFailOnEmptyTranscript() {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    when(transcriptionClient.parseCallback(payload))
        .thenReturn(
            new CallbackEvent(
                "job-1",
                JobStatus.COMPLETED,
                MEDIA_URL,
                null,
                JobMetadata.of(EMAIL, QUESTION),
                new Transcript(List.of(new Monologue(0, List.of(TranscriptElement.punct(" ")))))));

    CallbackOutcome outcome = orchestrator.handleCallback(payload);

    assertThat(outcome.stage()).isEqualTo(PipelineStage.FAILED);
    assertThat(outcome.error()).contains("Transcript is empty");
    verifyNoInteractions(resultStore);
  }

  @Test
  void handleCallback_shouldAcknowledgeUnfinishedJob() {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    when(transcriptionClient.parseCallback(payload))
        .thenReturn(
            new CallbackEvent(
                "job-1", JobStatus.IN_PROGRESS, MEDIA_URL, null, JobMetadata.empty(), null));

    CallbackOutcome outcome = orchestrator.handleCallback(payload);

    assertThat(outcome.stage()).isEqualTo(PipelineStage.AWAITING_CALLBACK);
    assertThat(outcome.error()).isNull();
    verifyNoInteractions(resultStore);
  }

  @Test
  void handleCallback_shouldRejectUnparseablePayload() {
    ObjectNode payload = JsonNodeFactory.instance.objectNode();
    when(transcriptionClient.parseCallback(payload))
        .thenThrow(new ProviderException("Callback payload has no job id"));

    CallbackOutcome outcome = orchestrator.handleCallback(payload);

    assertThat(outcome.jobId()).isNull();
    assertThat(outcome.stage()).isEqualTo(PipelineStage.FAILED);
    assertThat(outcome.error()).isEqualTo("Callback payload has no job id");
  }

  @Test
  void transcribeAndWait_shouldStoreCompletedTranscript() {
    ManualTranscriptionRequest request =
        new ManualTranscriptionRequest(MEDIA_URL, EMAIL, null, true, 60);
    when(transcriptionClient.submit(eq(MEDIA_URL), any(), any())).thenReturn(handle("job-1"));
    when(transcriptionClient.awaitCompletion("job-1", Duration.ofSeconds(60)))
        .thenReturn(
            new JobDetails("job-1", JobStatus.COMPLETED, null, null, null, JobMetadata.empty()));
    when(transcriptionClient.fetchTranscript("job-1")).thenReturn(transcript("All", "good."));
    when(mediaQualityEstimator.estimate(MEDIA_URL)).thenReturn(highQuality());
    when(resultStore.upsert(any(), any(), any(), any(), any())).thenReturn(true);

    ReconciledTranscript result = orchestrator.transcribeAndWait(request);

    assertThat(result.jobId()).isEqualTo("job-1");
    assertThat(result.transcript()).isEqualTo("All good.");
    assertThat(result.stored()).isTrue();
    verify(resultStore).upsert(eq(EMAIL), eq("Manual request"), eq(MEDIA_URL), any(), any());

    ArgumentCaptor<SubmissionOptions> options = ArgumentCaptor.forClass(SubmissionOptions.class);
    verify(transcriptionClient).submit(eq(MEDIA_URL), any(), options.capture());
    assertThat(options.getValue().waitForCompletion()).isTrue();
    assertThat(options.getValue().hasCallback()).isFalse();
  }

  @Test
  void transcribeAndWait_shouldNotStoreOnTimeout() {
    ManualTranscriptionRequest request =
        new ManualTranscriptionRequest(MEDIA_URL, EMAIL, QUESTION, true, null);
    when(transcriptionClient.submit(eq(MEDIA_URL), any(), any())).thenReturn(handle("job-1"));
    when(transcriptionClient.awaitCompletion("job-1", Duration.ofSeconds(300)))
        .thenThrow(new TranscriptionTimeoutException("job-1", Duration.ofSeconds(300)));

    assertThatThrownBy(() -> orchestrator.transcribeAndWait(request))
        .isInstanceOf(TranscriptionTimeoutException.class);
    verifyNoInteractions(resultStore);
    verify(transcriptionClient, never()).fetchTranscript(anyString());
  }

  @Test
  void submitManual_shouldSubmitWithCallback() {
    when(transcriptionClient.submit(eq(MEDIA_URL), any(), any())).thenReturn(handle("job-7"));

    TranscriptionJob job =
        orchestrator.submitManual(
            new ManualTranscriptionRequest(MEDIA_URL, EMAIL, null, null, null));

    assertThat(job.jobId()).isEqualTo("job-7");
    assertThat(job.questionLabel()).isEqualTo("Manual request");
    assertThat(job.contactEmail()).isEqualTo(EMAIL);
  }

  @Test
  void submitBatch_shouldKeepRequestOrderAndReportFailures() {
    when(transcriptionClient.submit(eq(MEDIA_URL), any(), any())).thenReturn(handle("job-1"));

    List<BatchItemResult> results =
        orchestrator.submitBatch(
            List.of(
                new ManualTranscriptionRequest(MEDIA_URL, EMAIL, null, null, null),
                new ManualTranscriptionRequest(null, EMAIL, null, null, null),
                new ManualTranscriptionRequest(MEDIA_URL, "", null, null, null)));

    assertThat(results)
        .containsExactly(
            BatchItemResult.submitted(MEDIA_URL, "job-1"),
            BatchItemResult.failed(null, "media_url is required"),
            BatchItemResult.failed(MEDIA_URL, "email is required"));

    ArgumentCaptor<JobMetadata> metadata = ArgumentCaptor.forClass(JobMetadata.class);
    verify(transcriptionClient).submit(eq(MEDIA_URL), metadata.capture(), any());
    assertThat(metadata.getValue().question()).isEqualTo("Batch request");
  }

  @Test
  void qualityFor_shouldReturnStatusOnlyReportForRunningJob() {
    when(transcriptionClient.pollStatus("job-1"))
        .thenReturn(
            new JobDetails("job-1", JobStatus.IN_PROGRESS, MEDIA_URL, null, null, null));
    when(mediaQualityEstimator.estimate(MEDIA_URL)).thenReturn(highQuality());

    QualityReport report = orchestrator.qualityFor("job-1");

    assertThat(report.status()).isEqualTo(JobStatus.IN_PROGRESS);
    assertThat(report.message()).isEqualTo("Transcript not ready yet");
    verify(transcriptionClient, never()).fetchTranscript(anyString());
  }

  @Test
  void status_shouldIncludeEnhancedTranscriptWhenCompleted() {
    when(transcriptionClient.pollStatus("job-1"))
        .thenReturn(
            new JobDetails(
                "job-1", JobStatus.COMPLETED, MEDIA_URL, "2024-05-01T10:00:00Z", null, null));
    when(transcriptionClient.fetchTranscript("job-1")).thenReturn(transcript("it", "works"));
    when(mediaQualityEstimator.estimate(MEDIA_URL)).thenReturn(highQuality());

    JobStatusView view = orchestrator.status("job-1");

    assertThat(view.status()).isEqualTo(JobStatus.COMPLETED);
    assertThat(view.transcript()).isEqualTo("It works.");
    assertThat(view.quality().linguisticAnalysis()).isNotNull();
    verifyNoInteractions(resultStore);
  }
}
