package com.scholary.videoask.handler.revai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** A contiguous speaker turn. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Monologue(Integer speaker, List<TranscriptElement> elements) {

  public Monologue {
    elements = elements == null ? List.of() : List.copyOf(elements);
  }
}
