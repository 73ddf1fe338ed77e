package com.scholary.videoask.handler.nlp;

/** A named entity found in the text, with character offsets ({@code end} exclusive). */
public record EntitySpan(String text, String label, int start, int end) {}
