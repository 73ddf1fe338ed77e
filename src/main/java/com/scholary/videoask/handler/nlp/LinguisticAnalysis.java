package com.scholary.videoask.handler.nlp;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/** Linguistic metrics and detected quality issues for one text. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LinguisticAnalysis(
    LinguisticMetrics metrics,
    List<WordFrequency> frequentWords,
    List<EntitySpan> entities,
    List<String> qualityIssues) {

  public LinguisticAnalysis {
    frequentWords = List.copyOf(frequentWords);
    entities = List.copyOf(entities);
    qualityIssues = List.copyOf(qualityIssues);
  }
}
