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

import org.wfst.fst.Tr;
import org.wfst.semiring.Semiring;

/**
 * One match returned by a {@link MatcherIterator}: either a transition
 * stored in the FST or the virtual epsilon self-loop.
 *
 * @lucene.experimental
 */
public final class MatcherItem<W> {

  @SuppressWarnings("rawtypes")
  private static final MatcherItem EPS_LOOP = new MatcherItem<>(null);

  private final Tr<W> tr;

  private MatcherItem(Tr<W> tr) {
    this.tr = tr;
  }

  public static <W> MatcherItem<W> of(Tr<W> tr) {
    if (tr == null) {
      throw new IllegalArgumentException("tr must not be null");
    }
    return new MatcherItem<>(tr);
  }

  @SuppressWarnings("unchecked")
  public static <W> MatcherItem<W> epsLoop() {
    return EPS_LOOP;
  }

  public boolean isEpsLoop() {
    return tr == null;
  }

  /** Returns the stored transition; only valid if this is not the epsilon loop. */
  public Tr<W> tr() {
    assert tr != null;
    return tr;
  }

  /**
   * Returns the transition this item stands for at {@code state}.
   *
   * @throws IllegalArgumentException if this is the epsilon loop and
   *         {@code matchType} cannot synthesize it
   */
  public Tr<W> toTr(int state, MatchType matchType, Semiring<W> semiring) {
    return tr != null ? tr : Matcher.epsLoop(state, matchType, semiring);
  }

  @Override
  public String toString() {
    return tr == null ? "EpsLoop" : tr.toString();
  }
}
