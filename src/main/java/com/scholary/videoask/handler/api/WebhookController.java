package com.scholary.videoask.handler.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.videoask.handler.logging.StructuredLogger;
import com.scholary.videoask.handler.quality.QualityReport;
import com.scholary.videoask.handler.service.CallbackOutcome;
import com.scholary.videoask.handler.service.ItemError;
import com.scholary.videoask.handler.service.TranscriptionOrchestrator;
import com.scholary.videoask.handler.service.WebhookOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Webhook endpoint shared by the survey platform and the transcription provider.
 *
 * <p>A body with a {@code job} envelope is a provider callback; anything else is read as a form
 * response. Both always answer 200 so that neither sender retries; failures are reported in the
 * body.
 */
@RestController
@Tag(name = "Webhook", description = "Form response and provider callback intake")
public class WebhookController {

  private static final Logger LOGGER = LoggerFactory.getLogger(WebhookController.class);

  private final TranscriptionOrchestrator orchestrator;
  private final ObjectMapper objectMapper;

  public WebhookController(TranscriptionOrchestrator orchestrator, ObjectMapper objectMapper) {
    this.orchestrator = orchestrator;
    this.objectMapper = objectMapper;
  }

  @PostMapping("/webhook")
  @Operation(
      summary = "Receive webhook",
      description =
          "Submit the media answers of a form response, or reconcile and store a finished"
              + " provider job")
  public ResponseEntity<?> receive(@RequestBody JsonNode payload) {
    StructuredLogger.setRequestContext(UUID.randomUUID().toString());
    try {
      if (payload.has("job")) {
        CallbackOutcome outcome = orchestrator.handleCallback(payload);
        return ResponseEntity.ok(CallbackResponse.from(outcome));
      }

      WebhookEvent event;
      try {
        event = objectMapper.treeToValue(payload, WebhookEvent.class);
      } catch (JsonProcessingException e) {
        LOGGER.warn("Unreadable form response: {}", e.getOriginalMessage());
        return ResponseEntity.ok(
            new WebhookResponse(
                "processed",
                List.of(),
                List.of(new ItemError(null, "Unreadable form response"))));
      }
      WebhookOutcome outcome = orchestrator.handleWebhook(event);
      return ResponseEntity.ok(WebhookResponse.from(outcome));
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  @GetMapping("/transcript/quality/{job_id}")
  @Operation(
      summary = "Transcript quality",
      description = "Quality report for a provider job; status only while the job is running")
  public ResponseEntity<QualityReport> quality(@PathVariable("job_id") String jobId) {
    LOGGER.info("Quality request: jobId={}", jobId);
    return ResponseEntity.ok(orchestrator.qualityFor(jobId));
  }
}
