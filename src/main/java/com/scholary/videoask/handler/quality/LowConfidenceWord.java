package com.scholary.videoask.handler.quality;

/** A transcribed word whose confidence fell below the threshold. */
public record LowConfidenceWord(String word, double confidence, Double timestamp) {}
