/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.contextbudget.summarizer;

import static java.util.stream.Collectors.joining;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.contextbudget.context.ContextItem;
import com.google.contextbudget.context.ItemKind;
import com.google.contextbudget.tokens.TokenEstimator;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import javax.annotation.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extractive summarizer: every summary is made of sentences copied verbatim from the source, so it
 * never contains wording that was not in the original.
 *
 * <p>Sentences are scored by the average frequency of their non-stop words across the text, with
 * multiplicative bonuses for position (first, last, early), medium length, and words that tend to
 * carry user intent or outcomes. The best sentences are kept and emitted in their original order.
 */
public final class ExtractiveSummarizer implements ContextSummarizer {

  private static final Logger logger = LoggerFactory.getLogger(ExtractiveSummarizer.class);

  /** Texts shorter than this are returned unchanged. */
  static final int MIN_SUMMARIZABLE_CHARS = 100;

  /** Texts with fewer sentences than this are returned unchanged. */
  static final int MIN_SUMMARIZABLE_SENTENCES = 3;

  static final double CONVERSATION_RATIO = 0.5;
  static final double KNOWLEDGE_RATIO = 0.3;
  static final double EARLIER_SUMMARY_RATIO = 0.5;
  static final int RECENT_TURNS_PER_SIDE = 3;
  static final int RECENT_SYSTEM_NOTES = 2;

  static final String SECTION_SEPARATOR = " | ";
  static final String TRUNCATION_MARKER = "...";

  private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("(?<=[.!?])\\s+");
  private static final Pattern WORD = Pattern.compile("\\b\\w+\\b");

  private static final ImmutableList<Pattern> PRESERVE_PATTERNS =
      ImmutableList.of(
          // personal pronouns
          Pattern.compile("\\b(?:user|you|I|we)\\b", Pattern.CASE_INSENSITIVE),
          // actions
          Pattern.compile(
              "\\b(?:save|open|close|search|help|create|delete)\\b", Pattern.CASE_INSENSITIVE),
          // status
          Pattern.compile("\\b(?:error|warning|success|failed)\\b", Pattern.CASE_INSENSITIVE),
          // intent
          Pattern.compile("\\b(?:please|want|need|would like)\\b", Pattern.CASE_INSENSITIVE));

  static final ImmutableSet<String> STOP_WORDS =
      ImmutableSet.of(
          "the", "a", "an", "is", "are", "was", "were", "be", "been", "being", "have", "has",
          "had", "do", "does", "did", "will", "would", "could", "should", "may", "might", "must",
          "shall", "can", "need", "dare", "ought", "used", "to", "of", "in", "for", "on", "with",
          "at", "by", "from", "as", "into", "through", "during", "before", "after", "above",
          "below", "between", "under", "again", "further", "then", "once", "here", "there",
          "when", "where", "why", "how", "all", "each", "few", "more", "most", "other", "some",
          "such", "no", "nor", "not", "only", "own", "same", "so", "than", "too", "very", "s",
          "t", "just", "don", "now");

  private static final double FIRST_SENTENCE_BONUS = 1.5;
  private static final double LAST_SENTENCE_BONUS = 1.3;
  private static final double EARLY_SENTENCE_BONUS = 1.2;
  private static final double EARLY_FRACTION = 0.2;
  private static final double MEDIUM_LENGTH_BONUS = 1.1;
  private static final int MEDIUM_LENGTH_MIN_WORDS = 10;
  private static final int MEDIUM_LENGTH_MAX_WORDS = 30;
  private static final double PRESERVE_PATTERN_BONUS = 1.3;

  /** A sentence with its score and its position in the source. */
  private record ScoredSentence(String text, double score, int index) {}

  /**
   * Reduces {@code text} to about {@code targetRatio} of its sentences.
   *
   * <p>Null text, text under {@value #MIN_SUMMARIZABLE_CHARS} characters, and text with fewer than
   * {@value #MIN_SUMMARIZABLE_SENTENCES} sentences are returned unchanged. Otherwise the top
   * {@code ceil(sentences × targetRatio)} sentences are kept, at least one, in source order.
   *
   * @param text Text to summarize
   * @param targetRatio Fraction of sentences to keep, e.g. 0.4
   * @return The summary
   */
  @Nullable
  public String summarize(@Nullable String text, double targetRatio) {
    if (text == null || text.length() < MIN_SUMMARIZABLE_CHARS) {
      return text;
    }

    List<String> sentences = splitSentences(text);
    if (sentences.size() < MIN_SUMMARIZABLE_SENTENCES) {
      return text;
    }

    List<ScoredSentence> scored = scoreSentences(sentences);
    int keep = sentencesToKeep(sentences.size(), targetRatio);

    // Stable sort: equal scores keep the earlier sentence.
    return scored.stream()
        .sorted(Comparator.comparingDouble(ScoredSentence::score).reversed())
        .limit(keep)
        .sorted(Comparator.comparingInt(ScoredSentence::index))
        .map(ScoredSentence::text)
        .collect(joining(" "));
  }

  /**
   * Condenses compaction candidates into labelled sections.
   *
   * <ul>
   *   <li>{@code Earlier:} previous summaries, summarized at {@value #EARLIER_SUMMARY_RATIO}
   *   <li>{@code Recent:} the last {@value #RECENT_TURNS_PER_SIDE} inputs and replies in
   *       chronological order, summarized at {@value #CONVERSATION_RATIO}
   *   <li>{@code Context:} the last {@value #RECENT_SYSTEM_NOTES} system notes, verbatim
   *   <li>{@code Knowledge:} all knowledge items, summarized at {@value #KNOWLEDGE_RATIO}
   * </ul>
   *
   * <p>The joined result is then hard-truncated to {@code targetTokens}, so the budget holds even
   * when the sentence selection compresses too little.
   */
  @Override
  public String summarizeItems(
      List<ContextItem> items, int targetTokens, TokenEstimator estimator) {
    if (items.isEmpty()) {
      return "";
    }

    List<ContextItem> chronological = new ArrayList<>(items);
    chronological.sort(
        Comparator.comparing(ContextItem::timestamp).thenComparingLong(ContextItem::sequence));

    List<String> sections = new ArrayList<>();

    String earlier = joinContents(ofKind(chronological, ItemKind.SUMMARY));
    if (!earlier.isEmpty()) {
      sections.add("Earlier: " + summarize(earlier, EARLIER_SUMMARY_RATIO));
    }

    String recent = joinContents(recentConversation(chronological));
    if (!recent.isEmpty()) {
      sections.add("Recent: " + summarize(recent, CONVERSATION_RATIO));
    }

    String systemNotes =
        joinContents(last(ofKind(chronological, ItemKind.SYSTEM_NOTE), RECENT_SYSTEM_NOTES));
    if (!systemNotes.isEmpty()) {
      sections.add("Context: " + systemNotes);
    }

    String knowledge = joinContents(ofKind(chronological, ItemKind.KNOWLEDGE));
    if (!knowledge.isEmpty()) {
      sections.add("Knowledge: " + summarize(knowledge, KNOWLEDGE_RATIO));
    }

    String summary = String.join(SECTION_SEPARATOR, sections);
    String bounded = truncateToBudget(summary, targetTokens, estimator);
    if (bounded.length() < summary.length()) {
      logger.debug(
          "Truncated summary of {} items from {} to {} characters to fit {} tokens",
          items.size(),
          summary.length(),
          bounded.length(),
          targetTokens);
    }
    return bounded;
  }

  /**
   * Cuts {@code text} so that its estimate does not exceed {@code targetTokens}, ending it with
   * {@value #TRUNCATION_MARKER} when anything was removed.
   */
  static String truncateToBudget(String text, int targetTokens, TokenEstimator estimator) {
    if (estimator.estimate(text) <= targetTokens) {
      return text;
    }
    if (targetTokens <= 0) {
      return "";
    }
    long maxChars = (long) targetTokens * estimator.charsPerToken();
    if (maxChars <= TRUNCATION_MARKER.length()) {
      return text.substring(0, (int) maxChars);
    }
    return text.substring(0, (int) maxChars - TRUNCATION_MARKER.length()) + TRUNCATION_MARKER;
  }

  @VisibleForTesting
  static List<String> splitSentences(String text) {
    return SENTENCE_BOUNDARY
        .splitAsStream(text)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toList());
  }

  @VisibleForTesting
  static int sentencesToKeep(int sentenceCount, double targetRatio) {
    // Tolerate products like 5 × 0.4 landing a hair above an integer.
    int keep = (int) Math.ceil(sentenceCount * targetRatio - 1e-9);
    return Math.min(sentenceCount, Math.max(1, keep));
  }

  private List<ScoredSentence> scoreSentences(List<String> sentences) {
    Map<String, Integer> wordFrequency = new HashMap<>();
    for (String sentence : sentences) {
      for (String word : tokenize(sentence)) {
        if (!STOP_WORDS.contains(word)) {
          wordFrequency.merge(word, 1, Integer::sum);
        }
      }
    }

    List<ScoredSentence> scored = new ArrayList<>(sentences.size());
    for (int i = 0; i < sentences.size(); i++) {
      String sentence = sentences.get(i);
      scored.add(
          new ScoredSentence(
              sentence, scoreSentence(sentence, wordFrequency, i, sentences.size()), i));
    }
    return scored;
  }

  @VisibleForTesting
  static double scoreSentence(
      String sentence, Map<String, Integer> wordFrequency, int position, int totalSentences) {
    List<String> words = tokenize(sentence);
    if (words.isEmpty()) {
      return 0.0;
    }

    int frequencySum = 0;
    for (String word : words) {
      if (!STOP_WORDS.contains(word)) {
        frequencySum += wordFrequency.getOrDefault(word, 0);
      }
    }
    double score = frequencySum / (double) words.size();

    if (position == 0) {
      score *= FIRST_SENTENCE_BONUS;
    } else if (position == totalSentences - 1) {
      score *= LAST_SENTENCE_BONUS;
    } else if (position < totalSentences * EARLY_FRACTION) {
      score *= EARLY_SENTENCE_BONUS;
    }

    if (words.size() >= MEDIUM_LENGTH_MIN_WORDS && words.size() <= MEDIUM_LENGTH_MAX_WORDS) {
      score *= MEDIUM_LENGTH_BONUS;
    }

    for (Pattern pattern : PRESERVE_PATTERNS) {
      if (pattern.matcher(sentence).find()) {
        score *= PRESERVE_PATTERN_BONUS;
        break;
      }
    }

    return score;
  }

  private static List<String> tokenize(String text) {
    List<String> words = new ArrayList<>();
    Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      words.add(matcher.group());
    }
    return words;
  }

  private static List<ContextItem> recentConversation(List<ContextItem> chronological) {
    Set<ContextItem> selected = Collections.newSetFromMap(new IdentityHashMap<>());
    selected.addAll(last(ofKind(chronological, ItemKind.INPUT), RECENT_TURNS_PER_SIDE));
    selected.addAll(last(ofKind(chronological, ItemKind.REPLY), RECENT_TURNS_PER_SIDE));
    return chronological.stream().filter(selected::contains).collect(Collectors.toList());
  }

  private static List<ContextItem> ofKind(List<ContextItem> items, ItemKind kind) {
    return items.stream().filter(item -> item.kind() == kind).collect(Collectors.toList());
  }

  private static <T> List<T> last(List<T> list, int count) {
    return list.subList(Math.max(0, list.size() - count), list.size());
  }

  private static String joinContents(List<ContextItem> items) {
    return items.stream()
        .map(ContextItem::content)
        .filter(content -> !content.isEmpty())
        .collect(joining(" "));
  }
}
