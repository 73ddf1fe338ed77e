package com.scholary.videoask.handler.revai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * A finished transcript as returned by the provider.
 *
 * <p>Produced once, when the job completes, and never modified afterwards.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Transcript(List<Monologue> monologues) {

  public Transcript {
    monologues = monologues == null ? List.of() : List.copyOf(monologues);
  }

  /** All word elements, in order, across all monologues. */
  public List<TranscriptElement> textElements() {
    return monologues.stream()
        .flatMap(monologue -> monologue.elements().stream())
        .filter(TranscriptElement::isText)
        .toList();
  }

  /**
   * Render the transcript as plain text.
   *
   * <p>Element values are concatenated in order. The provider emits spaces as punctuation
   * elements; where two words are adjacent without one, a space is inserted. Monologues are
   * separated by a space and runs of whitespace are collapsed.
   */
  public String plainText() {
    StringBuilder text = new StringBuilder();
    for (Monologue monologue : monologues) {
      if (text.length() > 0) {
        text.append(' ');
      }
      for (TranscriptElement element : monologue.elements()) {
        if (element.value() == null) {
          continue;
        }
        if (element.isText()
            && text.length() > 0
            && !Character.isWhitespace(text.charAt(text.length() - 1))) {
          text.append(' ');
        }
        text.append(element.value());
      }
    }
    return text.toString().replaceAll("\\s+", " ").trim();
  }
}
