package com.scholary.videoask.handler.nlp;

import java.util.List;

/** Output of a {@link TextPipeline}: the text with its sentences, tokens and entities. */
public record AnnotatedText(
    String text, List<Sentence> sentences, List<Token> tokens, List<EntitySpan> entities) {

  public AnnotatedText {
    sentences = List.copyOf(sentences);
    tokens = List.copyOf(tokens);
    entities = List.copyOf(entities);
  }
}
