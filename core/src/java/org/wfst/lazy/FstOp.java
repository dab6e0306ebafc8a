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

import org.wfst.fst.Tr;
import org.wfst.semiring.Semiring;

/**
 * Computes the parts of an FST one state at a time, for {@link LazyFst}.
 * A {@link LazyFst} may call these concurrently, and may ask twice for
 * the same state when two threads miss the cache together; both calls
 * must then return the same answer.
 *
 * @lucene.experimental
 */
public interface FstOp<W> {

  Semiring<W> semiring();

  /** Returns the start state, or {@link org.wfst.fst.StateIds#NO_STATE_ID} if the result is empty. */
  int computeStart();

  List<Tr<W>> computeTrs(int state);

  /** Returns the final weight of {@code state}, or null if it is not accepting. */
  W computeFinalWeight(int state);

  /** {@link org.wfst.fst.FstProperties} bits known to hold for the result. */
  long properties();
}
