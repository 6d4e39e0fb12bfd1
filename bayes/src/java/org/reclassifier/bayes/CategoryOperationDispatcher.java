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
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves operation names of the form <code>train_&lt;category&gt;</code> and
 * <code>untrain_&lt;category&gt;</code> into calls to
 * {@link IncrementalNaiveBayesClassifier#train(String, String)} and
 * {@link IncrementalNaiveBayesClassifier#untrain(String, String)}. Categories are
 * looked up in the classifier when the operation is invoked, so categories added
 * later are picked up.
 * <pre>
 * CategoryOperationDispatcher dispatcher = new CategoryOperationDispatcher(classifier);
 * dispatcher.invoke("train_spam", "Buy cheap watches");
 * dispatcher.invoke("untrain_spam", "Buy cheap watches");
 * </pre>
 */
public class CategoryOperationDispatcher {

  private static final Pattern OPERATION = Pattern.compile("(un)?train_(\\w+)");

  private final IncrementalNaiveBayesClassifier classifier;

  public CategoryOperationDispatcher(IncrementalNaiveBayesClassifier classifier) {
    this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
  }

  /**
   * Trains or untrains the category named by <code>operationName</code> with each
   * of the given texts, in order.
   *
   * @param operationName <code>train_&lt;category&gt;</code> or <code>untrain_&lt;category&gt;</code>
   * @param texts         the texts to (un)train, possibly none
   * @throws UnknownCategoryException if the operation names a category that is not registered
   * @throws IllegalArgumentException if <code>operationName</code> is not a train or untrain operation
   * @throws IOException if a text cannot be tokenized
   */
  public void invoke(String operationName, String... texts) throws IOException {
    Matcher matcher = match(operationName);
    String category = matcher.group(2);
    if (classifier.hasCategory(category) == false) {
      throw new UnknownCategoryException(category);
    }
    boolean untrain = matcher.group(1) != null;
    for (String text : texts) {
      if (untrain) {
        classifier.untrain(category, text);
      } else {
        classifier.train(category, text);
      }
    }
  }

  /**
   * Returns <code>true</code> if {@link #invoke} would dispatch <code>operationName</code>
   * to a registered category.
   */
  public boolean respondsTo(String operationName) {
    Matcher matcher = OPERATION.matcher(operationName);
    return matcher.matches() && classifier.hasCategory(matcher.group(2));
  }

  private static Matcher match(String operationName) {
    Objects.requireNonNull(operationName, "operationName must not be null");
    Matcher matcher = OPERATION.matcher(operationName);
    if (matcher.matches() == false) {
      throw new IllegalArgumentException("no such operation: " + operationName);
    }
    return matcher;
  }
}
