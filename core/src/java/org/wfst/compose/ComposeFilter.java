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

/**
 * Auxiliary state machine run alongside composition to reject pairings of
 * transitions that would create redundant paths, typically because of
 * the different orders in which epsilon moves of the two operands can
 * interleave.
 *
 * <p>The driver positions the filter on a composed state with {@link
 * #setState}, then proposes every label-matched pair of transitions to
 * {@link #filterTr}.  A {@link FilterState#isNoState() blocked} result
 * means "discard this pair and continue"; any other result becomes part
 * of the destination's key, so the driver creates at most one composed
 * state per (state1, state2, filter state) triple.
 *
 * <p>One side of a proposed pair may be a synthesized self-loop: {@code
 * tr1.olabel == NO_LABEL} means the first operand stays put while the
 * second moves on an input epsilon, {@code tr2.ilabel == NO_LABEL} the
 * reverse.
 *
 * @lucene.experimental
 */
public interface ComposeFilter<W, FS extends FilterState> {

  /** Filter state paired with the operands' start states. */
  FS start();

  /** Positions the filter on the composed state (s1, s2, filterState). */
  void setState(int s1, int s2, FS filterState);

  /** Returns the filter state after taking {@code tr1} and {@code tr2} together, or the blocked sentinel. */
  FS filterTr(Tr<W> tr1, Tr<W> tr2);

  /** May adjust both final weights of the current state jointly. */
  void filterFinal(WeightPair<W> finalWeights);

  SharedDataComposeFilter<W> getSharedData();
}
