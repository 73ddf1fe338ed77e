package com.scholary.videoask.handler.quality;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.scholary.videoask.handler.job.JobMetadata;
import com.scholary.videoask.handler.job.JobStatus;
import com.scholary.videoask.handler.media.MediaQualityReport;
import com.scholary.videoask.handler.media.QualityTier;
import com.scholary.videoask.handler.revai.JobDetails;
import com.scholary.videoask.handler.revai.Monologue;
import com.scholary.videoask.handler.revai.Transcript;
import com.scholary.videoask.handler.revai.TranscriptElement;
import java.util.List;
import org.junit.jupiter.api.Test;

class TranscriptQualityScorerTest {

  private final TranscriptQualityScorer scorer = new TranscriptQualityScorer();
  private final MediaQualityReport media =
      new MediaQualityReport(QualityTier.HIGH, "audio", "mp3", 192.0, "128 kbps", List.of(), null);

  private static JobDetails job(JobStatus status) {
    return new JobDetails("job-1", status, "https://m/a.mp3", null, null, JobMetadata.empty());
  }

  @Test
  void score_shouldAverageWordConfidence() {
    Transcript transcript =
        new Transcript(
            List.of(
                new Monologue(
                    0,
                    List.of(
                        TranscriptElement.text("Hello", 0.5, 0.95),
                        TranscriptElement.punct(" "),
                        TranscriptElement.text("world", 1.1, 0.75),
                        TranscriptElement.punct(".")))));

    QualityReport report = scorer.score(job(JobStatus.COMPLETED), transcript, media);

    assertThat(report.overallConfidence()).isCloseTo(0.85, within(1e-9));
    assertThat(report.totalWords()).isEqualTo(2);
    assertThat(report.lowConfidenceCount()).isEqualTo(1);
    assertThat(report.lowConfidenceWords())
        .containsExactly(new LowConfidenceWord("world", 0.75, 1.1));
    assertThat(report.qualityRating()).isEqualTo(QualityRating.FAIR);
    assertThat(report.mediaQualityTier()).isEqualTo(QualityTier.HIGH);
    assertThat(report.warnings()).containsExactly("High number of uncertain words");
    assertThat(report.isComplete()).isTrue();
  }

  @Test
  void score_shouldRateConfidentTranscriptGood() {
    Transcript transcript =
        new Transcript(
            List.of(new Monologue(0, List.of(TranscriptElement.text("Yes", 0.0, 0.99)))));

    QualityReport report = scorer.score(job(JobStatus.COMPLETED), transcript, media);

    assertThat(report.qualityRating()).isEqualTo(QualityRating.GOOD);
    assertThat(report.warnings()).isEmpty();
  }

  @Test
  void score_shouldFlagTranscriptWithoutWords() {
    QualityReport report =
        scorer.score(job(JobStatus.COMPLETED), new Transcript(List.of()), media);

    assertThat(report.overallConfidence()).isZero();
    assertThat(report.qualityRating()).isEqualTo(QualityRating.POOR);
    assertThat(report.warnings()).containsExactly("Low overall confidence score");
  }

  @Test
  void score_shouldReturnStatusOnlyReportForUnfinishedJob() {
    QualityReport report = scorer.score(job(JobStatus.IN_PROGRESS), null, media);

    assertThat(report.status()).isEqualTo(JobStatus.IN_PROGRESS);
    assertThat(report.message()).isEqualTo("Transcript not ready yet");
    assertThat(report.overallConfidence()).isNull();
    assertThat(report.mediaQuality()).isEqualTo(media);
    assertThat(report.isComplete()).isFalse();
  }
}
