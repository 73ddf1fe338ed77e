package com.scholary.videoask.handler.nlp;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Original and enhanced transcript text with the analysis that produced it. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EnhancedTranscript(
    String originalText,
    String enhancedText,
    List<String> enhancementWarnings,
    LinguisticAnalysis linguisticAnalysis,
    double qualityScore) {}
