package com.scholary.videoask.handler.nlp;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Regex-based English text pipeline.
 *
 * <p>Sentences end at one or more of {@code . ! ?} (optionally followed by closing quotes or
 * brackets) that precede whitespace or the end of the text; a trailing fragment without terminal
 * punctuation is a sentence too. Periods after common abbreviations do not end a sentence.
 *
 * <p>Entities are found with patterns, in priority order: MONEY, PERCENT, DATE, CARDINAL and
 * PROPER_NOUN (runs of capitalised words that do not open a sentence). Earlier labels win on
 * overlap.
 */
@Component
public class RuleBasedTextPipeline implements TextPipeline {

  static final String STOP_WORDS_RESOURCE = "nlp/stopwords-en.txt";

  private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+[\"'”’)\\]]*(?=\\s|$)");

  private static final Pattern TOKEN =
      Pattern.compile(
          "\\p{N}+(?:[.,]\\p{N}+)*(?!\\p{L})"
              + "|[\\p{L}\\p{N}]+(?:['’\\-][\\p{L}\\p{N}]+)*"
              + "|[^\\s\\p{L}\\p{N}]");

  private static final Set<String> ABBREVIATIONS =
      Set.of("mr", "mrs", "ms", "dr", "prof", "sr", "jr", "st", "vs", "etc", "e.g", "i.e");

  private static final String MONTHS =
      "January|February|March|April|May|June|July|August|September|October|November|December";
  private static final String WEEKDAYS = "Monday|Tuesday|Wednesday|Thursday|Friday|Saturday|Sunday";

  private static final Pattern MONEY =
      Pattern.compile(
          "[$€£]\\s?\\d+(?:[.,]\\d+)*(?:\\s?(?:million|billion|thousand|k)\\b)?",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern PERCENT =
      Pattern.compile("\\b\\d+(?:\\.\\d+)?\\s?(?:%|percent\\b)", Pattern.CASE_INSENSITIVE);
  private static final Pattern DATE =
      Pattern.compile(
          "\\b(?:(?:"
              + MONTHS
              + ")(?:\\s+\\d{1,2}(?:st|nd|rd|th)?)?(?:,?\\s+\\d{4})?"
              + "|(?:"
              + WEEKDAYS
              + ")|(?:19|20)\\d{2})\\b");
  private static final Pattern CARDINAL = Pattern.compile("\\b\\d+(?:[.,]\\d+)*\\b");

  private final Set<String> stopWords;

  public RuleBasedTextPipeline() {
    this(loadStopWords(STOP_WORDS_RESOURCE));
  }

  RuleBasedTextPipeline(Set<String> stopWords) {
    this.stopWords = Set.copyOf(stopWords);
  }

  @Override
  public AnnotatedText annotate(String text) {
    String source = text == null ? "" : text;
    List<Sentence> sentences = splitSentences(source);
    List<Token> tokens = tokenize(source);
    List<EntitySpan> entities = recognizeEntities(source, sentences, tokens);
    return new AnnotatedText(source, sentences, tokens, entities);
  }

  List<Sentence> splitSentences(String text) {
    List<Sentence> sentences = new ArrayList<>();
    int start = skipWhitespace(text, 0);
    Matcher matcher = SENTENCE_END.matcher(text);
    int searchFrom = start;

    while (start < text.length() && matcher.find(searchFrom)) {
      int end = matcher.end();
      if (endsWithAbbreviation(text, start, matcher)) {
        searchFrom = end;
        continue;
      }
      sentences.add(new Sentence(text.substring(start, end), start, end));
      start = skipWhitespace(text, end);
      searchFrom = start;
    }

    if (start < text.length()) {
      int end = text.length();
      while (end > start && Character.isWhitespace(text.charAt(end - 1))) {
        end--;
      }
      sentences.add(new Sentence(text.substring(start, end), start, end));
    }
    return sentences;
  }

  List<Token> tokenize(String text) {
    List<Token> tokens = new ArrayList<>();
    Matcher matcher = TOKEN.matcher(text);
    while (matcher.find()) {
      String value = matcher.group();
      boolean punctuation = !Character.isLetterOrDigit(value.codePointAt(0));
      boolean stopWord = !punctuation && stopWords.contains(value.toLowerCase(Locale.ROOT));
      tokens.add(new Token(value, matcher.start(), matcher.end(), punctuation, stopWord));
    }
    return tokens;
  }

  private List<EntitySpan> recognizeEntities(
      String text, List<Sentence> sentences, List<Token> tokens) {
    List<EntitySpan> entities = new ArrayList<>();
    addMatches(entities, text, MONEY, "MONEY");
    addMatches(entities, text, PERCENT, "PERCENT");
    addMatches(entities, text, DATE, "DATE");
    addMatches(entities, text, CARDINAL, "CARDINAL");
    addProperNouns(entities, text, sentences, tokens);
    entities.sort(Comparator.comparingInt(EntitySpan::start));
    return entities;
  }

  private static void addMatches(
      List<EntitySpan> entities, String text, Pattern pattern, String label) {
    Matcher matcher = pattern.matcher(text);
    while (matcher.find()) {
      if (!overlaps(entities, matcher.start(), matcher.end())) {
        entities.add(new EntitySpan(matcher.group(), label, matcher.start(), matcher.end()));
      }
    }
  }

  private static void addProperNouns(
      List<EntitySpan> entities, String text, List<Sentence> sentences, List<Token> tokens) {
    Set<Integer> sentenceStarts = new HashSet<>();
    for (Sentence sentence : sentences) {
      sentenceStarts.add(sentence.start());
    }

    int runStart = -1;
    int runEnd = -1;
    for (Token token : tokens) {
      boolean candidate =
          !token.punctuation()
              && Character.isUpperCase(token.text().codePointAt(0))
              && !token.text().equals("I")
              && !token.text().startsWith("I'")
              && !token.text().startsWith("I’")
              && !sentenceStarts.contains(token.start());
      boolean adjacent = runStart >= 0 && text.substring(runEnd, token.start()).equals(" ");

      if (candidate && (runStart < 0 || adjacent)) {
        if (runStart < 0) {
          runStart = token.start();
        }
        runEnd = token.end();
        continue;
      }
      closeRun(entities, text, runStart, runEnd);
      runStart = candidate ? token.start() : -1;
      runEnd = candidate ? token.end() : -1;
    }
    closeRun(entities, text, runStart, runEnd);
  }

  private static void closeRun(List<EntitySpan> entities, String text, int start, int end) {
    if (start >= 0 && !overlaps(entities, start, end)) {
      entities.add(new EntitySpan(text.substring(start, end), "PROPER_NOUN", start, end));
    }
  }

  private static boolean overlaps(List<EntitySpan> entities, int start, int end) {
    for (EntitySpan entity : entities) {
      if (start < entity.end() && entity.start() < end) {
        return true;
      }
    }
    return false;
  }

  private static boolean endsWithAbbreviation(String text, int sentenceStart, Matcher end) {
    if (!end.group().equals(".")) {
      return false;
    }
    int wordEnd = end.start();
    int wordStart = wordEnd;
    while (wordStart > sentenceStart
        && (Character.isLetter(text.charAt(wordStart - 1)) || text.charAt(wordStart - 1) == '.')) {
      wordStart--;
    }
    String word = text.substring(wordStart, wordEnd).toLowerCase(Locale.ROOT);
    return ABBREVIATIONS.contains(word);
  }

  private static int skipWhitespace(String text, int from) {
    int index = from;
    while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
      index++;
    }
    return index;
  }

  static Set<String> loadStopWords(String resource) {
    InputStream stream = RuleBasedTextPipeline.class.getClassLoader().getResourceAsStream(resource);
    if (stream == null) {
      throw new IllegalStateException("Stop word list not found on classpath: " + resource);
    }
    Set<String> words = new HashSet<>();
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        String word = line.trim().toLowerCase(Locale.ROOT);
        if (!word.isEmpty() && !word.startsWith("#")) {
          words.add(word);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read stop word list: " + resource, e);
    }
    return words;
  }
}
