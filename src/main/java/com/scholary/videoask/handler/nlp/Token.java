package com.scholary.videoask.handler.nlp;

/** A token span; {@code end} is exclusive. */
public record Token(String text, int start, int end, boolean punctuation, boolean stopWord) {}
