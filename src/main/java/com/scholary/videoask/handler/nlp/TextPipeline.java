package com.scholary.videoask.handler.nlp;

/**
 * Language annotation used by the {@link TextAnalyzer}.
 *
 * <p>Treated as a black box: the analyzer only relies on sentence spans, token spans with
 * punctuation and stop-word flags, and entity spans.
 */
public interface TextPipeline {

  AnnotatedText annotate(String text);
}
