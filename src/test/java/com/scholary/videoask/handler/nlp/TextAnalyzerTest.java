package com.scholary.videoask.handler.nlp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class TextAnalyzerTest {

  private final TextAnalyzer analyzer = new TextAnalyzer(new RuleBasedTextPipeline());

  @Test
  void analyze_shouldCountWordsAndFlagShortResponse() {
    LinguisticAnalysis analysis = analyzer.analyze("I like apples.");

    assertThat(analysis.metrics().sentenceCount()).isEqualTo(1);
    assertThat(analysis.metrics().wordCount()).isEqualTo(3);
    assertThat(analysis.frequentWords()).containsExactly(new WordFrequency("apples", 1));
    assertThat(analysis.qualityIssues())
        .containsExactly("Very short response", "Frequent repetition of word 'apples'");
  }

  @Test
  void score_shouldPenaliseShortText() {
    LinguisticAnalysis analysis = analyzer.analyze("I like apples.");

    assertThat(analyzer.score(analysis)).isLessThanOrEqualTo(0.7).isCloseTo(0.6, within(1e-9));
  }

  @Test
  void analyze_shouldReportMissingSentencesForEmptyText() {
    LinguisticAnalysis analysis = analyzer.analyze("");

    assertThat(analysis.qualityIssues())
        .containsExactly("No complete sentences detected", "Very short response");
    assertThat(analysis.metrics().avgWordsPerSentence()).isZero();
    assertThat(analyzer.score(analysis)).isCloseTo(0.3, within(1e-9));
  }

  @Test
  void analyze_shouldFlagRunOnText() {
    String runOn =
        IntStream.rangeClosed(1, 60).mapToObj(i -> "w" + i).collect(Collectors.joining(" "));

    LinguisticAnalysis analysis = analyzer.analyze(runOn);

    assertThat(analysis.metrics().sentenceCount()).isEqualTo(1);
    assertThat(analysis.metrics().wordCount()).isEqualTo(60);
    assertThat(analysis.qualityIssues())
        .containsExactly("Long text without proper sentence breaks");
    assertThat(analyzer.score(analysis)).isCloseTo(0.7, within(1e-9));
  }

  @Test
  void analyze_shouldKeepAtMostTenFrequentWords() {
    String text =
        IntStream.rangeClosed(1, 15).mapToObj(i -> "word" + i).collect(Collectors.joining(" "))
            + ".";

    assertThat(analyzer.analyze(text).frequentWords()).hasSize(TextAnalyzer.TOP_WORDS);
  }

  @Test
  void enhance_shouldCapitaliseAndTerminate() {
    Enhancement enhancement = analyzer.enhance("hello world. this is fine");

    assertThat(enhancement.text()).isEqualTo("Hello world. This is fine.");
    assertThat(enhancement.warnings()).containsExactly("Added missing sentence-ending punctuation");
  }

  @Test
  void enhance_shouldBeIdempotent() {
    String once = analyzer.enhance("hello world. this is fine").text();

    Enhancement twice = analyzer.enhance(once);

    assertThat(twice.text()).isEqualTo(once);
    assertThat(twice.warnings()).isEmpty();
  }

  @Test
  void enhance_shouldGroupLongTextIntoParagraphs() {
    Enhancement enhancement = analyzer.enhance("one. two. three. four. five. six. seven.");

    assertThat(enhancement.text())
        .isEqualTo("One. Two. Three.\n\nFour. Five. Six.\n\nSeven.");
    assertThat(analyzer.enhance(enhancement.text()).text()).isEqualTo(enhancement.text());
  }

  @Test
  void enhance_shouldLeaveBlankTextUnchanged() {
    Enhancement enhancement = analyzer.enhance("   ");

    assertThat(enhancement.text()).isEqualTo("   ");
    assertThat(enhancement.warnings()).isEmpty();
  }

  @Test
  void analyzeAndEnhance_shouldKeepOriginalText() {
    EnhancedTranscript result = analyzer.analyzeAndEnhance("so it went well");

    assertThat(result.originalText()).isEqualTo("so it went well");
    assertThat(result.enhancedText()).isEqualTo("So it went well.");
    assertThat(result.qualityScore()).isBetween(0.0, 1.0);
  }
}
