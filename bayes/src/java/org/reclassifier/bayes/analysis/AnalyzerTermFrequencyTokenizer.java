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
package org.reclassifier.bayes.analysis;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

/**
 * A {@link TermFrequencyTokenizer} that counts the terms produced by a Lucene
 * {@link Analyzer}.
 * <p>
 * The analyzer is not owned by this class: closing it is up to the caller.
 */
public class AnalyzerTermFrequencyTokenizer implements TermFrequencyTokenizer {

  /** Field name handed to the analyzer when none is given. */
  public static final String DEFAULT_FIELD_NAME = "text";

  private final Analyzer analyzer;
  private final String fieldName;

  /**
   * Creates a tokenizer analyzing text as the {@link #DEFAULT_FIELD_NAME} field.
   *
   * @param analyzer the {@link Analyzer} used to tokenize / filter the text
   */
  public AnalyzerTermFrequencyTokenizer(Analyzer analyzer) {
    this(analyzer, DEFAULT_FIELD_NAME);
  }

  /**
   * Creates a tokenizer analyzing text as the given field.
   *
   * @param analyzer  the {@link Analyzer} used to tokenize / filter the text
   * @param fieldName the field name passed to {@link Analyzer#tokenStream(String, String)}
   */
  public AnalyzerTermFrequencyTokenizer(Analyzer analyzer, String fieldName) {
    this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
    this.fieldName = Objects.requireNonNull(fieldName, "fieldName must not be null");
    if (fieldName.isEmpty()) {
      throw new IllegalArgumentException("fieldName must not be empty");
    }
  }

  @Override
  public Map<String, Integer> tokenize(String text) throws IOException {
    Objects.requireNonNull(text, "text must not be null");
    Map<String, Integer> counts = new LinkedHashMap<>();
    try (TokenStream tokenStream = analyzer.tokenStream(fieldName, text)) {
      CharTermAttribute charTermAttribute = tokenStream.addAttribute(CharTermAttribute.class);
      tokenStream.reset();
      while (tokenStream.incrementToken()) {
        if (charTermAttribute.length() > 0) {
          counts.merge(charTermAttribute.toString(), 1, Integer::sum);
        }
      }
      tokenStream.end();
    }
    return counts;
  }

  /** Returns the analyzer terms are produced with. */
  public Analyzer getAnalyzer() {
    return analyzer;
  }

  /** Returns the field name text is analyzed as. */
  public String getFieldName() {
    return fieldName;
  }
}
