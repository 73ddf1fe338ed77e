package com.scholary.videoask.handler.api;

import com.scholary.videoask.handler.logging.StructuredLogger;
import com.scholary.videoask.handler.service.TranscriptionOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for transcription outside the webhook flow.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Submitting a single file, optionally waiting for the transcript
 *   <li>Job status lookup
 *   <li>Batch submission
 * </ul>
 */
@RestController
@RequestMapping("/manual")
@Tag(name = "Manual transcription", description = "Direct and batch transcription requests")
public class ManualTranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ManualTranscriptionController.class);

  private final TranscriptionOrchestrator orchestrator;

  public ManualTranscriptionController(TranscriptionOrchestrator orchestrator) {
    this.orchestrator = orchestrator;
  }

  @PostMapping("/transcribe")
  @Operation(
      summary = "Transcribe a file",
      description =
          "Submit a media file. With wait_for_completion the transcript is reconciled, stored and"
              + " returned; otherwise the job id is returned immediately")
  public ResponseEntity<ManualTranscriptionResponse> transcribe(
      @Valid @RequestBody ManualTranscriptionRequest request) {
    StructuredLogger.setRequestContext(UUID.randomUUID().toString());
    try {
      LOGGER.info(
          "Manual transcription request: mediaUrl={}, email={}, wait={}",
          request.mediaUrl(),
          request.email(),
          request.shouldWait());
      if (request.shouldWait()) {
        return ResponseEntity.ok(
            ManualTranscriptionResponse.completed(orchestrator.transcribeAndWait(request)));
      }
      return ResponseEntity.ok(
          ManualTranscriptionResponse.submitted(orchestrator.submitManual(request)));
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }

  @GetMapping("/status/{job_id}")
  @Operation(
      summary = "Get job status",
      description = "Provider job status; completed jobs include the enhanced transcript")
  public ResponseEntity<JobStatusResponse> status(@PathVariable("job_id") String jobId) {
    return ResponseEntity.ok(JobStatusResponse.from(orchestrator.status(jobId)));
  }

  @PostMapping("/batch")
  @Operation(
      summary = "Submit a batch",
      description = "Submit several files in parallel; failures are reported per item")
  public ResponseEntity<BatchResponse> batch(@Valid @RequestBody BatchRequest request) {
    StructuredLogger.setRequestContext(UUID.randomUUID().toString());
    try {
      LOGGER.info("Batch request: items={}", request.requests().size());
      return ResponseEntity.ok(BatchResponse.of(orchestrator.submitBatch(request.requests())));
    } finally {
      StructuredLogger.clearRequestContext();
    }
  }
}
