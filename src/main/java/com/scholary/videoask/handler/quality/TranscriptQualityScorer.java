package com.scholary.videoask.handler.quality;

import com.scholary.videoask.handler.job.JobStatus;
import com.scholary.videoask.handler.media.MediaQualityReport;
import com.scholary.videoask.handler.revai.JobDetails;
import com.scholary.videoask.handler.revai.Transcript;
import com.scholary.videoask.handler.revai.TranscriptElement;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Scores a transcript from the provider's per-word confidence.
 *
 * <p>Every word element across all monologues counts. Words below {@link #LOW_CONFIDENCE} are
 * listed individually. Punctuation elements are ignored.
 */
@Component
public class TranscriptQualityScorer {

  static final double LOW_CONFIDENCE = 0.8;
  static final double UNCERTAIN_WORD_FRACTION = 0.1;

  /**
   * Score a job's transcript.
   *
   * <p>Jobs that are not completed yield a status-only report; the transcript is not consulted
   * and may be null.
   */
  public QualityReport score(JobDetails job, Transcript transcript, MediaQualityReport media) {
    if (job.status() != JobStatus.COMPLETED) {
      return QualityReport.incomplete(job.status(), media);
    }
    return score(transcript, media);
  }

  /** Score the transcript of a completed job. */
  public QualityReport score(Transcript transcript, MediaQualityReport media) {
    List<TranscriptElement> words = transcript.textElements();

    double totalConfidence = 0;
    List<LowConfidenceWord> lowConfidence = new ArrayList<>();
    for (TranscriptElement word : words) {
      double confidence = word.confidenceOrZero();
      totalConfidence += confidence;
      if (confidence < LOW_CONFIDENCE) {
        lowConfidence.add(new LowConfidenceWord(word.value(), confidence, word.ts()));
      }
    }

    int totalWords = words.size();
    double overall = totalWords > 0 ? totalConfidence / totalWords : 0.0;

    List<String> warnings = new ArrayList<>();
    if (overall < LOW_CONFIDENCE) {
      warnings.add("Low overall confidence score");
    }
    if (totalWords > 0 && (double) lowConfidence.size() / totalWords > UNCERTAIN_WORD_FRACTION) {
      warnings.add("High number of uncertain words");
    }

    return new QualityReport(
        JobStatus.COMPLETED,
        null,
        overall,
        totalWords,
        lowConfidence.size(),
        List.copyOf(lowConfidence),
        QualityRating.fromConfidence(overall),
        media.tier(),
        media,
        null,
        null,
        null,
        List.copyOf(warnings));
  }
}
