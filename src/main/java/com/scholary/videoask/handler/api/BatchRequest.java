package com.scholary.videoask.handler.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;

/**
 * A batch of manual transcription requests.
 *
 * <p>Items are not bean-validated here; each item is checked on its own so that one bad item is
 * reported in the results instead of rejecting the batch.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BatchRequest(@NotEmpty List<ManualTranscriptionRequest> requests) {}
