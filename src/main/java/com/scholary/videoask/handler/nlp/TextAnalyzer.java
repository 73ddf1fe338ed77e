package com.scholary.videoask.handler.nlp;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Linguistic analysis and light normalisation of transcript text.
 *
 * <p>Three operations:
 *
 * <ul>
 *   <li>{@link #analyze}: counts, frequent words, entities and quality issues
 *   <li>{@link #enhance}: sentence capitalisation, terminal punctuation and paragraphing
 *   <li>{@link #score}: a 0..1 linguistic quality score from an analysis
 * </ul>
 */
@Component
public class TextAnalyzer {

  static final int TOP_WORDS = 10;
  static final int RUN_ON_WORDS = 50;
  static final int SHORT_RESPONSE_WORDS = 10;
  static final double REPETITION_FRACTION = 0.1;
  static final int PARAGRAPH_THRESHOLD_SENTENCES = 5;
  static final int SENTENCES_PER_PARAGRAPH = 3;

  private final TextPipeline pipeline;

  public TextAnalyzer(TextPipeline pipeline) {
    this.pipeline = pipeline;
  }

  public LinguisticAnalysis analyze(String text) {
    return analyze(pipeline.annotate(text));
  }

  private LinguisticAnalysis analyze(AnnotatedText annotated) {
    int sentenceCount = annotated.sentences().size();
    int wordCount = 0;
    Map<String, Integer> frequencies = new LinkedHashMap<>();
    for (Token token : annotated.tokens()) {
      if (token.punctuation()) {
        continue;
      }
      wordCount++;
      if (!token.stopWord()) {
        frequencies.merge(token.text().toLowerCase(Locale.ROOT), 1, Integer::sum);
      }
    }
    double average = sentenceCount > 0 ? (double) wordCount / sentenceCount : 0.0;

    // Stable sort keeps first-occurrence order among equal counts
    List<WordFrequency> ranked = new ArrayList<>();
    frequencies.forEach((word, count) -> ranked.add(new WordFrequency(word, count)));
    ranked.sort(Comparator.comparingInt(WordFrequency::count).reversed());

    List<String> issues = new ArrayList<>();
    if (sentenceCount == 0) {
      issues.add("No complete sentences detected");
    } else if (sentenceCount == 1 && wordCount > RUN_ON_WORDS) {
      issues.add("Long text without proper sentence breaks");
    }
    if (wordCount < SHORT_RESPONSE_WORDS) {
      issues.add("Very short response");
    }
    for (WordFrequency frequency : ranked) {
      if (frequency.count() > wordCount * REPETITION_FRACTION) {
        issues.add(String.format("Frequent repetition of word '%s'", frequency.word()));
      }
    }

    return new LinguisticAnalysis(
        new LinguisticMetrics(sentenceCount, wordCount, average),
        ranked.subList(0, Math.min(TOP_WORDS, ranked.size())),
        annotated.entities(),
        issues);
  }

  /**
   * Normalise transcript text.
   *
   * <p>All corrections are applied to one working copy, in order: lowercase sentence openings
   * are capitalised, a period is appended when the text does not end in {@code . ! ?}, and texts
   * of more than five sentences are regrouped into paragraphs of three sentences separated by a
   * blank line. Paragraphs are cut from the corrected text, so earlier fixes are kept. Blank text
   * is returned unchanged.
   */
  public Enhancement enhance(String text) {
    if (text == null || text.isBlank()) {
      return new Enhancement(text == null ? "" : text, List.of());
    }
    List<String> warnings = new ArrayList<>();
    List<Sentence> sentences = pipeline.annotate(text).sentences();

    StringBuilder working = new StringBuilder(text);
    for (Sentence sentence : sentences) {
      char first = working.charAt(sentence.start());
      if (Character.isLowerCase(first)) {
        working.setCharAt(sentence.start(), Character.toUpperCase(first));
      }
    }

    String corrected = working.toString();
    String trimmed = corrected.strip();
    char last = trimmed.charAt(trimmed.length() - 1);
    if (last != '.' && last != '!' && last != '?') {
      corrected = trimmed + ".";
      warnings.add("Added missing sentence-ending punctuation");
    }

    if (sentences.size() > PARAGRAPH_THRESHOLD_SENTENCES) {
      corrected = paragraphs(pipeline.annotate(corrected).sentences());
    }
    return new Enhancement(corrected, warnings);
  }

  private static String paragraphs(List<Sentence> sentences) {
    List<String> paragraphs = new ArrayList<>();
    List<String> current = new ArrayList<>();
    for (Sentence sentence : sentences) {
      current.add(sentence.text().strip());
      if (current.size() == SENTENCES_PER_PARAGRAPH) {
        paragraphs.add(String.join(" ", current));
        current.clear();
      }
    }
    if (!current.isEmpty()) {
      paragraphs.add(String.join(" ", current));
    }
    return String.join("\n\n", paragraphs);
  }

  /** Linguistic quality between 0 and 1; starts at 1 and is reduced per problem found. */
  public double score(LinguisticAnalysis analysis) {
    LinguisticMetrics metrics = analysis.metrics();
    double score = 1.0;

    score -= analysis.qualityIssues().size() * 0.1;

    if (metrics.wordCount() < 20) {
      score -= 0.2;
    } else if (metrics.wordCount() < 50) {
      score -= 0.1;
    }

    if (metrics.sentenceCount() == 0) {
      score -= 0.3;
    } else if (metrics.avgWordsPerSentence() > 40) {
      score -= 0.2;
    }

    return Math.max(0.0, Math.min(1.0, score));
  }

  /** Analyse, enhance and score the text in one go. */
  public EnhancedTranscript analyzeAndEnhance(String text) {
    LinguisticAnalysis analysis = analyze(text);
    Enhancement enhancement = enhance(text);
    return new EnhancedTranscript(
        text, enhancement.text(), enhancement.warnings(), analysis, score(analysis));
  }
}
