package com.scholary.videoask.handler.nlp;

import java.util.List;

/** Normalised text plus the corrections that were worth reporting. */
public record Enhancement(String text, List<String> warnings) {

  public Enhancement {
    warnings = List.copyOf(warnings);
  }
}
