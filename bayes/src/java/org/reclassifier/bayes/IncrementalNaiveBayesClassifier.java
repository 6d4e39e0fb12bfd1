/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.reclassifier.bayes;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.lucene.util.InfoStream;
import org.reclassifier.bayes.analysis.TermFrequencyTokenizer;

/**
 * An incrementally trained multinomial naive Bayes classifier over a mutable set of named
 * categories, see <code>http://nlp.stanford.edu/IR-book/html/htmledition/naive-bayes-text-classification-1.html</code>
 * <p>
 * For every category the classifier keeps a ledger of word counts and a document count, plus a
 * global word total across all categories. {@link #train(String, String)} adds a document to a
 * category and {@link #untrain(String, String)} takes it back out again.
 * {@link #scoreAll(String)} computes a log likelihood per category and
 * {@link #classify(String)} picks the one closest to zero.
 * <p>
 * By default no smoothing is applied: words a category has never seen contribute nothing to its
 * score, and a category without training documents scores <code>-Infinity</code> (or
 * <code>NaN</code> when no category has any document). These values are returned as they are,
 * callers needing stricter behavior should check that every category has been trained first.
 * <p>
 * <b>NOTE</b>: instances are not thread-safe. Training and untraining update the ledger and the
 * global total in several steps, so a host sharing an instance across threads must guard every
 * call with the same lock.
 */
public class IncrementalNaiveBayesClassifier implements Classifier<String> {

  /** Component name used for {@link InfoStream} messages. */
  public static final String INFO_STREAM_COMPONENT = "BNB";

  private final BayesClassifierConfig config;
  private final TermFrequencyTokenizer tokenizer;
  private final BayesClassifierConfig.Smoothing smoothing;
  private final InfoStream infoStream;

  // category -> word -> count; iteration order is registration order
  private final Map<String, Map<String, Integer>> ledgers = new LinkedHashMap<>();
  private final Map<String, Integer> documentCounts = new HashMap<>();
  private long totalWords;

  /**
   * Creates a classifier with a default {@link BayesClassifierConfig} and the given categories.
   *
   * @param categories the initial categories, possibly none
   */
  public IncrementalNaiveBayesClassifier(String... categories) {
    this(new BayesClassifierConfig(), categories);
  }

  /**
   * Creates a classifier with the given categories.
   *
   * @param config     the configuration, a private clone is taken
   * @param categories the initial categories, possibly none
   */
  public IncrementalNaiveBayesClassifier(BayesClassifierConfig config, String... categories) {
    this.config = Objects.requireNonNull(config, "config must not be null").clone();
    this.tokenizer = this.config.getTokenizer();
    this.smoothing = this.config.getSmoothing();
    this.infoStream = this.config.getInfoStream();
    for (String category : categories) {
      addCategory(category);
    }
  }

  /** Returns the private clone of the configuration this classifier was created with. */
  public BayesClassifierConfig getConfig() {
    return config;
  }

  /**
   * Registers a category with an empty word ledger.
   * <p>
   * Adding a category that is already registered clears its word ledger, its document count is
   * kept. Categories added to a trained classifier tend to be undertrained, so prefer declaring
   * them at construction.
   *
   * @param category the category name
   * @return the category name
   */
  public String addCategory(String category) {
    Objects.requireNonNull(category, "category must not be null");
    Map<String, Integer> previous = ledgers.put(category, new HashMap<>());
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, (previous == null ? "add category " : "reset category ") + category);
    }
    return category;
  }

  /**
   * Same as {@link #addCategory(String)}.
   */
  public String appendCategory(String category) {
    return addCategory(category);
  }

  /**
   * Unregisters a category, dropping its word ledger and document count. The global word total
   * is left untouched.
   *
   * @param category the category name
   * @return the category name, or <code>null</code> if it was not registered
   */
  public String removeCategory(String category) {
    if (ledgers.remove(category) == null) {
      return null;
    }
    documentCounts.remove(category);
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "remove category " + category);
    }
    return category;
  }

  /**
   * Returns the registered categories in registration order.
   *
   * @return an unmodifiable snapshot of the category names
   */
  public Set<String> listCategories() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(ledgers.keySet()));
  }

  /** Returns <code>true</code> if the category is registered. */
  public boolean hasCategory(String category) {
    return ledgers.containsKey(category);
  }

  /**
   * Trains <code>category</code> with the words of <code>text</code>.
   *
   * @throws UnknownCategoryException if the category is not registered
   * @throws IOException if the text cannot be tokenized
   */
  public void train(String category, String text) throws IOException {
    ledger(category);
    trainWordCounts(category, tokenize(text));
  }

  /**
   * Trains <code>category</code> with already tokenized word counts: the document count goes up by
   * one and every count is added to the category's ledger and to the global word total.
   *
   * @param category   a registered category
   * @param wordCounts word to positive occurrence count
   * @throws UnknownCategoryException if the category is not registered
   */
  public void trainWordCounts(String category, Map<String, Integer> wordCounts) {
    Map<String, Integer> ledger = ledger(category);
    checkWordCounts(wordCounts);
    documentCounts.merge(category, 1, Integer::sum);
    for (Map.Entry<String, Integer> entry : wordCounts.entrySet()) {
      int count = entry.getValue();
      ledger.merge(entry.getKey(), count, Integer::sum);
      totalWords += count;
    }
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "train " + category + ": " + wordCounts.size() + " distinct words, totalWords=" + totalWords);
    }
  }

  /**
   * Reverses an earlier {@link #train(String, String)} of the same text. Use with care: nothing
   * checks the text was trained before, so document counts may go negative.
   *
   * @throws UnknownCategoryException if the category is not registered
   * @throws IOException if the text cannot be tokenized
   */
  public void untrain(String category, String text) throws IOException {
    ledger(category);
    untrainWordCounts(category, tokenize(text));
  }

  /**
   * Untrains <code>category</code> with already tokenized word counts.
   * <p>
   * The document count goes down by one. Each word's count is subtracted from the ledger entry;
   * an entry that drops to zero or below is removed, and in that case the global word total is
   * reduced by the count the entry held rather than by the requested count. Words are only
   * processed while the global word total is not negative.
   *
   * @param category   a registered category
   * @param wordCounts word to positive occurrence count
   * @throws UnknownCategoryException if the category is not registered
   */
  public void untrainWordCounts(String category, Map<String, Integer> wordCounts) {
    Map<String, Integer> ledger = ledger(category);
    checkWordCounts(wordCounts);
    documentCounts.merge(category, -1, Integer::sum);
    for (Map.Entry<String, Integer> entry : wordCounts.entrySet()) {
      if (totalWords < 0) {
        continue;
      }
      String word = entry.getKey();
      Integer stored = ledger.get(word);
      int orig = stored == null ? 0 : stored;
      int remaining = orig - entry.getValue();
      long decrement = entry.getValue();
      if (remaining <= 0) {
        ledger.remove(word);
        decrement = orig;
      } else {
        ledger.put(word, remaining);
      }
      totalWords -= decrement;
    }
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "untrain " + category + ": " + wordCounts.size() + " distinct words, totalWords=" + totalWords);
    }
  }

  /**
   * Returns the score of every registered category for <code>text</code>, in registration order.
   * Higher scores (closer to zero) mean a better match. An empty registry gives an empty map.
   *
   * @throws IOException if the text cannot be tokenized
   */
  public Map<String, Double> scoreAll(String text) throws IOException {
    return scoreWordCounts(tokenize(text));
  }

  /**
   * Same as {@link #scoreAll(String)} for already tokenized word counts.
   */
  public Map<String, Double> scoreWordCounts(Map<String, Integer> wordCounts) {
    Objects.requireNonNull(wordCounts, "wordCounts must not be null");
    Map<String, Double> scores = new LinkedHashMap<>();
    if (ledgers.isEmpty()) {
      return scores;
    }
    double totalDocs = getTotalDocuments();
    int vocabularySize = smoothing == BayesClassifierConfig.Smoothing.LAPLACE ? vocabularySize() : 0;
    for (Map.Entry<String, Map<String, Integer>> category : ledgers.entrySet()) {
      Map<String, Integer> ledger = category.getValue();
      double score = calculateLogLikelihood(wordCounts, ledger, vocabularySize)
          + calculateLogPrior(category.getKey(), totalDocs);
      scores.put(category.getKey(), score);
    }
    return scores;
  }

  /**
   * Returns the category whose score for <code>text</code> is highest. Among equal scores the
   * first registered category wins, and <code>NaN</code> never wins over a number.
   *
   * @throws EmptyRegistryException if no category is registered
   * @throws IOException if the text cannot be tokenized
   */
  public String classify(String text) throws IOException {
    return assignClass(text).getAssignedClass();
  }

  @Override
  public ClassificationResult<String> assignClass(String text) throws IOException {
    List<ClassificationResult<String>> results = scoredClasses(text);
    ClassificationResult<String> retval = null;
    for (ClassificationResult<String> element : results) {
      if (retval == null || (!Double.isNaN(element.getScore())
          && (Double.isNaN(retval.getScore()) || element.getScore() > retval.getScore()))) {
        retval = element;
      }
    }
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "classify: scores=" + results + " winner=" + retval.getAssignedClass());
    }
    return retval;
  }

  @Override
  public List<ClassificationResult<String>> getClasses(String text) throws IOException {
    List<ClassificationResult<String>> results = scoredClasses(text);
    Collections.sort(results);
    return results;
  }

  @Override
  public List<ClassificationResult<String>> getClasses(String text, int max) throws IOException {
    if (max < 0) {
      throw new IllegalArgumentException("max must be >= 0, got " + max);
    }
    List<ClassificationResult<String>> results = getClasses(text);
    return results.subList(0, Math.min(max, results.size()));
  }

  /**
   * Returns every category with its score turned into a probability, sorted by descending
   * probability. The probabilities sum up to one unless a score is not finite, in which case
   * <code>NaN</code> propagates.
   *
   * @throws EmptyRegistryException if no category is registered
   * @throws IOException if the text cannot be tokenized
   */
  public List<ClassificationResult<String>> getNormalizedClasses(String text) throws IOException {
    List<ClassificationResult<String>> dataList = getClasses(text);

    // normalization; the values transforms to a 0-1 range
    List<ClassificationResult<String>> returnList = new ArrayList<>(dataList.size());
    // this is a negative number closest to 0 = a
    double smax = dataList.get(0).getScore();

    double sumLog = 0;
    // log(sum(exp(x_n-a)))
    for (ClassificationResult<String> cr : dataList) {
      // getScore-smax <=0 (both negative, smax is the smallest abs()
      sumLog += Math.exp(cr.getScore() - smax);
    }
    // loga=a+log(sum(exp(x_n-a))) = log(sum(exp(x_n)))
    double loga = smax;
    loga += Math.log(sumLog);

    // 1/sum*x = exp(log(x))*1/sum = exp(log(x)-log(sum))
    for (ClassificationResult<String> cr : dataList) {
      returnList.add(new ClassificationResult<>(cr.getAssignedClass(), Math.exp(cr.getScore() - loga)));
    }
    return returnList;
  }

  /**
   * Returns a copy of the word ledger of a category.
   *
   * @throws UnknownCategoryException if the category is not registered
   */
  public Map<String, Integer> getWordCounts(String category) {
    return Collections.unmodifiableMap(new HashMap<>(ledger(category)));
  }

  /**
   * Returns the number of documents trained (net of untraining) for a category.
   *
   * @throws UnknownCategoryException if the category is not registered
   */
  public int getDocumentCount(String category) {
    ledger(category);
    return documentCounts.getOrDefault(category, 0);
  }

  /** Returns the sum of the document counts of all registered categories. */
  public long getTotalDocuments() {
    long total = 0;
    for (String category : ledgers.keySet()) {
      total += documentCounts.getOrDefault(category, 0);
    }
    return total;
  }

  /**
   * Returns the global word total: every count ever trained, less what untraining took away.
   * Resetting or removing a category does not change it.
   */
  public long getTotalWords() {
    return totalWords;
  }

  private List<ClassificationResult<String>> scoredClasses(String text) throws IOException {
    if (ledgers.isEmpty()) {
      throw new EmptyRegistryException();
    }
    Map<String, Double> scores = scoreAll(text);
    List<ClassificationResult<String>> results = new ArrayList<>(scores.size());
    for (Map.Entry<String, Double> score : scores.entrySet()) {
      results.add(new ClassificationResult<>(score.getKey(), score.getValue()));
    }
    return results;
  }

  private double calculateLogLikelihood(Map<String, Integer> wordCounts, Map<String, Integer> ledger, int vocabularySize) {
    long categoryWords = 0;
    for (int count : ledger.values()) {
      categoryWords += count;
    }
    double result = 0d;
    switch (smoothing) {
      case NONE:
        // log(P(d|c)) = sum of log(P(w|c)) over the distinct words the category knows
        for (String word : wordCounts.keySet()) {
          Integer hits = ledger.get(word);
          if (hits != null) {
            result += Math.log(hits / (double) categoryWords);
          }
        }
        break;
      case LAPLACE:
        for (Map.Entry<String, Integer> entry : wordCounts.entrySet()) {
          // +1 is added because of add 1 smoothing
          double num = ledger.getOrDefault(entry.getKey(), 0) + 1;
          double den = categoryWords + vocabularySize;
          result += entry.getValue() * Math.log(num / den);
        }
        break;
      default:
        throw new AssertionError("unhandled smoothing " + smoothing);
    }
    return result;
  }

  private double calculateLogPrior(String category, double totalDocs) {
    return Math.log(documentCounts.getOrDefault(category, 0) / totalDocs);
  }

  private int vocabularySize() {
    Set<String> vocabulary = new HashSet<>();
    for (Map<String, Integer> ledger : ledgers.values()) {
      vocabulary.addAll(ledger.keySet());
    }
    return vocabulary.size();
  }

  private Map<String, Integer> ledger(String category) {
    Map<String, Integer> ledger = ledgers.get(category);
    if (ledger == null) {
      throw new UnknownCategoryException(category);
    }
    return ledger;
  }

  private Map<String, Integer> tokenize(String text) throws IOException {
    return Objects.requireNonNull(tokenizer.tokenize(text), "tokenizer returned null");
  }

  private static void checkWordCounts(Map<String, Integer> wordCounts) {
    Objects.requireNonNull(wordCounts, "wordCounts must not be null");
    for (Map.Entry<String, Integer> entry : wordCounts.entrySet()) {
      if (entry.getValue() == null || entry.getValue() <= 0) {
        throw new IllegalArgumentException("count for word \"" + entry.getKey() + "\" must be > 0, got " + entry.getValue());
      }
    }
  }
}
