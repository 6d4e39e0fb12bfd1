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

import java.util.Objects;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.util.InfoStream;
import org.reclassifier.bayes.analysis.AnalyzerTermFrequencyTokenizer;
import org.reclassifier.bayes.analysis.TermFrequencyTokenizer;
import org.reclassifier.bayes.analysis.WordHashAnalyzer;

/**
 * Holds all the configuration of {@link IncrementalNaiveBayesClassifier}. You
 * should instantiate this class, call the setters to set your configuration,
 * then pass it to {@link IncrementalNaiveBayesClassifier}. Note that the
 * classifier makes a private clone; if you need to inspect the settings later
 * use {@link IncrementalNaiveBayesClassifier#getConfig}.
 *
 * <p>
 * All setter methods return {@link BayesClassifierConfig} to allow chaining
 * settings conveniently, for example:
 *
 * <pre>
 * BayesClassifierConfig conf = new BayesClassifierConfig(analyzer);
 * conf.setter1().setter2();
 * </pre>
 */
public final class BayesClassifierConfig implements Cloneable {

  /**
   * How word probabilities are estimated when scoring:
   * <ul>
   * <li>{@link #NONE} - words missing from a category's ledger contribute nothing, every
   * distinct input word present in the ledger contributes <code>ln(count / total)</code> once.</li>
   * <li>{@link #LAPLACE} - add-one smoothing over the vocabulary of all categories, every
   * input word occurrence contributes <code>ln((count + 1) / (total + |V|))</code>.</li>
   * </ul>
   */
  public static enum Smoothing { NONE, LAPLACE }

  /** Default value is {@link Smoothing#NONE}. Change using {@link #setSmoothing(Smoothing)}. */
  public static final Smoothing DEFAULT_SMOOTHING = Smoothing.NONE;

  private TermFrequencyTokenizer tokenizer;
  private Smoothing smoothing = DEFAULT_SMOOTHING;
  private InfoStream infoStream = InfoStream.getDefault();

  /**
   * Creates a new config tokenizing text with a {@link WordHashAnalyzer}.
   */
  public BayesClassifierConfig() {
    this(new WordHashAnalyzer());
  }

  /**
   * Creates a new config tokenizing text with the given {@link Analyzer}.
   *
   * @param analyzer the analyzer used to turn text into word counts
   */
  public BayesClassifierConfig(Analyzer analyzer) {
    this(new AnalyzerTermFrequencyTokenizer(analyzer));
  }

  /**
   * Creates a new config with the given tokenizer.
   *
   * @param tokenizer turns text into word counts
   */
  public BayesClassifierConfig(TermFrequencyTokenizer tokenizer) {
    this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
  }

  @Override
  public BayesClassifierConfig clone() {
    try {
      return (BayesClassifierConfig) super.clone();
    } catch (CloneNotSupportedException e) {
      // should not happen
      throw new RuntimeException(e);
    }
  }

  /** Sets the {@link TermFrequencyTokenizer} text is turned into word counts with. */
  public BayesClassifierConfig setTokenizer(TermFrequencyTokenizer tokenizer) {
    this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer must not be null");
    return this;
  }

  /** Returns the current tokenizer. */
  public TermFrequencyTokenizer getTokenizer() {
    return tokenizer;
  }

  /**
   * Sets the {@link Smoothing} applied when scoring.
   * <p>Only takes effect when the classifier is first created.
   */
  public BayesClassifierConfig setSmoothing(Smoothing smoothing) {
    this.smoothing = Objects.requireNonNull(smoothing, "smoothing must not be null");
    return this;
  }

  /** Returns the current smoothing. */
  public Smoothing getSmoothing() {
    return smoothing;
  }

  /**
   * Information about training, untraining and classification decisions is
   * logged to the given {@link InfoStream} under the component name
   * {@link IncrementalNaiveBayesClassifier#INFO_STREAM_COMPONENT}.
   * Pass {@link InfoStream#NO_OUTPUT} to disable it.
   */
  public BayesClassifierConfig setInfoStream(InfoStream infoStream) {
    this.infoStream = Objects.requireNonNull(infoStream, "Cannot set InfoStream implementation to null. "
        + "To disable logging use InfoStream.NO_OUTPUT");
    return this;
  }

  /** Returns the {@link InfoStream} used for debugging. */
  public InfoStream getInfoStream() {
    return infoStream;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    sb.append("tokenizer=").append(tokenizer == null ? "null" : tokenizer.getClass().getName()).append("\n");
    sb.append("smoothing=").append(smoothing).append("\n");
    sb.append("infoStream=").append(infoStream.getClass().getName()).append("\n");
    return sb.toString();
  }
}
