package com.scholary.videoask.handler.nlp;

/** A sentence span; {@code end} is exclusive. */
public record Sentence(String text, int start, int end) {}
