package com.scholary.videoask.handler.nlp;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LinguisticMetrics(int sentenceCount, int wordCount, double avgWordsPerSentence) {}
