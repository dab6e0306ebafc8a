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

import org.wfst.fst.Fst;
import org.wfst.fst.Labels;
import org.wfst.fst.StateIds;
import org.wfst.fst.Tr;

/**
 * Compose filter requiring the epsilons of the first operand to be read
 * before the epsilons of the second.  Filter state 0 is neutral; state 1
 * records that the second operand moved alone while the first one still
 * had epsilon transitions to take, after which the first operand may not
 * move alone until a transition pair consumes a real symbol.
 *
 * @lucene.experimental
 */
public class SequenceComposeFilter<W> implements ComposeFilter<W, IntegerFilterState> {

  static final IntegerFilterState NEUTRAL = IntegerFilterState.of(0);
  static final IntegerFilterState PENDING = IntegerFilterState.of(1);

  private final SharedDataComposeFilter<W> sharedData;

  // Current fst1 state
  private int s1 = StateIds.NO_STATE_ID;
  // Current fst2 state
  private int s2 = StateIds.NO_STATE_ID;
  // Current filter state
  private IntegerFilterState fs = IntegerFilterState.noState();

  // Only output epsilons leaving s1, and s1 is not final
  private boolean alleps1;
  // No output epsilons leaving s1
  private boolean noeps1;

  SequenceComposeFilter(SharedDataComposeFilter<W> sharedData) {
    this.sharedData = sharedData;
  }

  @Override
  public IntegerFilterState start() {
    return NEUTRAL;
  }

  @Override
  public void setState(int s1, int s2, IntegerFilterState filterState) {
    if (this.s1 == s1 && this.s2 == s2 && fs.equals(filterState)) {
      return;
    }
    this.s1 = s1;
    this.s2 = s2;
    this.fs = filterState;
    final Fst<W> fst1 = sharedData.fst1();
    final int na1 = fst1.numTrs(s1);
    final int ne1 = fst1.numOutputEpsilons(s1);
    final boolean fin1 = fst1.isFinal(s1);
    alleps1 = na1 == ne1 && fin1 == false;
    noeps1 = ne1 == 0;
  }

  @Override
  public IntegerFilterState filterTr(Tr<W> tr1, Tr<W> tr2) {
    if (tr1.olabel == Labels.NO_LABEL) {
      // fst2 moves alone on an input epsilon
      if (alleps1) {
        return IntegerFilterState.noState();
      } else if (noeps1) {
        return NEUTRAL;
      } else {
        return PENDING;
      }
    } else if (tr2.ilabel == Labels.NO_LABEL) {
      // fst1 moves alone on an output epsilon
      return fs.equals(NEUTRAL) ? NEUTRAL : IntegerFilterState.noState();
    } else {
      return tr1.olabel == Labels.EPS_LABEL ? IntegerFilterState.noState() : NEUTRAL;
    }
  }

  @Override
  public void filterFinal(WeightPair<W> finalWeights) {
  }

  @Override
  public SharedDataComposeFilter<W> getSharedData() {
    return sharedData;
  }
}
