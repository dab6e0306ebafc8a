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
package org.wfst.compose;

import java.util.Objects;

import org.wfst.fst.Fst;

/**
 * The two matchers of a composition, built once by a {@link
 * ComposeFilterBuilder} and shared by every filter it builds.
 *
 * @lucene.experimental
 */
public final class SharedDataComposeFilter<W> {

  private final Matcher<W> matcher1;
  private final Matcher<W> matcher2;

  public SharedDataComposeFilter(Matcher<W> matcher1, Matcher<W> matcher2) {
    this.matcher1 = Objects.requireNonNull(matcher1, "matcher1");
    this.matcher2 = Objects.requireNonNull(matcher2, "matcher2");
  }

  /** Matcher over the first operand, matching on its output labels. */
  public Matcher<W> matcher1() {
    return matcher1;
  }

  /** Matcher over the second operand, matching on its input labels. */
  public Matcher<W> matcher2() {
    return matcher2;
  }

  public Fst<W> fst1() {
    return matcher1.fst();
  }

  public Fst<W> fst2() {
    return matcher2.fst();
  }
}
