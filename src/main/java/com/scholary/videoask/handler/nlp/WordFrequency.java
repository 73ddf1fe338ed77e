package com.scholary.videoask.handler.nlp;

/** Occurrence count of a case-folded word. */
public record WordFrequency(String word, int count) {}
