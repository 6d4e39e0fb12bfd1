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

import java.util.Arrays;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.BaseTokenStreamTestCase;
import org.apache.lucene.analysis.CharArraySet;

/**
 * Testcase for {@link WordHashAnalyzer}
 */
public class TestWordHashAnalyzer extends BaseTokenStreamTestCase {

  public void testBasics() throws Exception {
    Analyzer a = new WordHashAnalyzer();
    // stemming
    assertAnalyzesTo(a, "cats running", new String[] {"cat", "run"});
    // lower casing and skip words
    assertAnalyzesTo(a, "The Cats are Running", new String[] {"cat", "run"});
    a.close();
  }

  public void testShortTokensDropped() throws Exception {
    Analyzer a = new WordHashAnalyzer();
    assertAnalyzesTo(a, "Go to my big bank", new String[] {"big", "bank"});
    a.close();
  }

  public void testPunctuation() throws Exception {
    Analyzer a = new WordHashAnalyzer();
    assertAnalyzesTo(a, "Tokyo, Japan!", new String[] {"tokyo", "japan"});
    a.close();
  }

  public void testCustomStopwords() throws Exception {
    CharArraySet stopwords = new CharArraySet(Arrays.asList("bank"), false);
    Analyzer a = new WordHashAnalyzer(stopwords);
    assertAnalyzesTo(a, "the big bank", new String[] {"the", "big"});
    a.close();
  }

  public void testDefaultStopSet() {
    CharArraySet stopwords = WordHashAnalyzer.getDefaultStopSet();
    assertTrue(stopwords.contains("the"));
    assertTrue(stopwords.contains("whether"));
    assertFalse(stopwords.contains("chinese"));
  }

  /** blast some random strings through the analyzer */
  public void testRandomStrings() throws Exception {
    Analyzer analyzer = new WordHashAnalyzer();
    checkRandomData(random(), analyzer, 200 * RANDOM_MULTIPLIER);
    analyzer.close();
  }
}
