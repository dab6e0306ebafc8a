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
package org.wfst.lazy;

import java.util.List;

import org.wfst.fst.StateIds;
import org.wfst.fst.Tr;

/**
 * Memoizes what a lazily expanded FST computed for each of its states:
 * the start state, the complete list of transitions of a state and its
 * final weight.  The cache only grows: every {@code insert*} method is
 * insert-if-absent, so once a value is cached for a key, later inserts
 * for that key are ignored and every reader keeps seeing the first
 * value.  Implementations must make an insert atomic with respect to
 * readers of the same key; nothing is required across keys.
 *
 * <p>Count accessors return {@code -1} when the transitions of the
 * state are not cached.  Their {@code Unchecked} variants skip that
 * check: calling them on a state whose transitions are not cached is a
 * caller bug and their result is undefined.
 *
 * @lucene.experimental
 */
public interface FstCache<W> {

  /** Start state; a computed {@link StateIds#NO_STATE_ID} means the FST is empty. */
  CacheStatus<Integer> getStart();

  void insertStart(int start);

  /** All transitions leaving {@code state}, as an unmodifiable list. */
  CacheStatus<List<Tr<W>>> getTrs(int state);

  void insertTrs(int state, List<Tr<W>> trs);

  /** Final weight of {@code state}; a computed null means it is not accepting. */
  CacheStatus<W> getFinalWeight(int state);

  void insertFinalWeight(int state, W weight);

  /**
   * One more than the largest state id this cache has seen, as a start
   * state, as a key, or as the destination of a cached transition.
   */
  int numKnownStates();

  int numTrs(int state);

  int numTrsUnchecked(int state);

  int numInputEpsilons(int state);

  int numInputEpsilonsUnchecked(int state);

  int numOutputEpsilons(int state);

  int numOutputEpsilonsUnchecked(int state);

  /** Number of states whose transitions are cached. */
  int lenTrs();

  /** Number of states whose final weight is cached. */
  int lenFinalWeights();

  /** Whether {@code state} is accepting, if its final weight is cached. */
  CacheStatus<Boolean> isFinal(int state);

  boolean isFinalUnchecked(int state);
}
