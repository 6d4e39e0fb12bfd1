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
import java.util.Map;

/**
 * Turns raw text into a mapping from normalized word token to the number of
 * times it occurs in that text.
 * <p>
 * Implementations must be deterministic for a given input and only return
 * positive counts. Case folding, splitting, stemming and stopword policy are
 * all up to the implementation.
 */
public interface TermFrequencyTokenizer {

  /**
   * Tokenizes <code>text</code> into word counts.
   *
   * @param text the text to tokenize
   * @return a map from word token to its positive occurrence count, never <code>null</code>
   * @throws IOException if the underlying analysis fails
   */
  Map<String, Integer> tokenize(String text) throws IOException;
}
