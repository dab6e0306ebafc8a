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
package org.wfst.fst;

import java.util.List;

import org.wfst.semiring.Semiring;

/**
 * Read access to a weighted finite-state transducer.  States are dense
 * ints; a state only needs to be valid once it was reached from the
 * start state, so implementations may compute states on demand.  Every
 * method may therefore be costly and callers should not ask twice for
 * the same answer.
 *
 * @lucene.experimental
 */
public interface Fst<W> {

  /** The weight algebra of this FST. */
  Semiring<W> semiring();

  /** Returns the start state, or {@link StateIds#NO_STATE_ID} if this FST is empty. */
  int start();

  /** Returns the final weight of {@code state}, or null if it is not accepting. */
  W finalWeight(int state);

  default boolean isFinal(int state) {
    return finalWeight(state) != null;
  }

  /** Returns the unmodifiable list of transitions leaving {@code state}. */
  List<Tr<W>> getTrs(int state);

  int numTrs(int state);

  /** Number of transitions leaving {@code state} whose input label is epsilon. */
  int numInputEpsilons(int state);

  /** Number of transitions leaving {@code state} whose output label is epsilon. */
  int numOutputEpsilons(int state);

  /**
   * Returns the {@link FstProperties} bits known to hold.  A property
   * whose bit (and whose negation's bit) is clear is unknown.
   */
  long properties();
}
