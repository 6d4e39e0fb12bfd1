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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.MockAnalyzer;
import org.apache.lucene.analysis.MockTokenizer;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.util.LuceneTestCase;

/**
 * Testcase for {@link AnalyzerTermFrequencyTokenizer}
 */
public class TestAnalyzerTermFrequencyTokenizer extends LuceneTestCase {

  public void testCountsTerms() throws Exception {
    MockAnalyzer analyzer = new MockAnalyzer(random(), MockTokenizer.WHITESPACE, true);
    AnalyzerTermFrequencyTokenizer tokenizer = new AnalyzerTermFrequencyTokenizer(analyzer);
    Map<String, Integer> expected = new HashMap<>();
    expected.put("chinese", 3);
    expected.put("tokyo", 1);
    expected.put("japan", 1);
    assertEquals(expected, tokenizer.tokenize("Chinese Chinese Chinese Tokyo Japan"));
    // the analyzer's token stream gets reused
    assertEquals(Collections.singletonMap("macao", 1), tokenizer.tokenize("Macao"));
    analyzer.close();
  }

  public void testEmptyText() throws Exception {
    MockAnalyzer analyzer = new MockAnalyzer(random());
    AnalyzerTermFrequencyTokenizer tokenizer = new AnalyzerTermFrequencyTokenizer(analyzer);
    assertTrue(tokenizer.tokenize("").isEmpty());
    assertTrue(tokenizer.tokenize("   ").isEmpty());
    analyzer.close();
  }

  public void testWordHashAnalyzer() throws Exception {
    Analyzer analyzer = new WordHashAnalyzer();
    AnalyzerTermFrequencyTokenizer tokenizer = new AnalyzerTermFrequencyTokenizer(analyzer);
    Map<String, Integer> expected = new HashMap<>();
    expected.put("cat", 2);
    expected.put("run", 1);
    assertEquals(expected, tokenizer.tokenize("The cat is running with the cats"));
    analyzer.close();
  }

  public void testFieldName() throws Exception {
    final List<String> fields = new ArrayList<>();
    Analyzer analyzer = new Analyzer(Analyzer.PER_FIELD_REUSE_STRATEGY) {
      @Override
      protected TokenStreamComponents createComponents(String fieldName) {
        fields.add(fieldName);
        Tokenizer tokenizer = new MockTokenizer(MockTokenizer.WHITESPACE, false);
        return new TokenStreamComponents(tokenizer);
      }
    };
    new AnalyzerTermFrequencyTokenizer(analyzer).tokenize("some text");
    new AnalyzerTermFrequencyTokenizer(analyzer, "body").tokenize("some text");
    assertEquals(2, fields.size());
    assertEquals(AnalyzerTermFrequencyTokenizer.DEFAULT_FIELD_NAME, fields.get(0));
    assertEquals("body", fields.get(1));
    analyzer.close();
  }

  public void testIllegalArguments() {
    MockAnalyzer analyzer = new MockAnalyzer(random());
    expectThrows(NullPointerException.class, () -> new AnalyzerTermFrequencyTokenizer(null));
    expectThrows(IllegalArgumentException.class, () -> new AnalyzerTermFrequencyTokenizer(analyzer, ""));
    expectThrows(NullPointerException.class, () -> new AnalyzerTermFrequencyTokenizer(analyzer).tokenize(null));
    analyzer.close();
  }
}
