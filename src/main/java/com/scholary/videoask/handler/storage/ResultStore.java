package com.scholary.videoask.handler.storage;

import com.scholary.videoask.handler.quality.QualityReport;

/**
 * Where finished transcripts end up.
 *
 * <p>Records are keyed by contact email and question. Implementations must not throw: every
 * failure is reported as {@code false}, which callers treat as "not stored".
 */
public interface ResultStore {

  /**
   * Insert or update the transcript for a contact and question.
   *
   * @param contactEmail the contact's email, used to find the row
   * @param questionLabel the question, used to pick the columns
   * @param mediaUrl the answer's media URL
   * @param transcriptText the enhanced transcript text
   * @param qualityReport quality metrics summarised next to the transcript; may be null
   * @return true if both cells were written
   */
  boolean upsert(
      String contactEmail,
      String questionLabel,
      String mediaUrl,
      String transcriptText,
      QualityReport qualityReport);
}
