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

import java.util.Arrays;
import java.util.List;

import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.FixedBitSet;
import org.apache.lucene.util.RamUsageEstimator;
import org.wfst.fst.StateIds;
import org.wfst.fst.Tr;

/**
 * {@link FstCache} holding dense arrays indexed by state id.  Suited to
 * expansions that end up visiting most states.  Every method is
 * synchronized on the cache.
 *
 * @lucene.experimental
 */
public class VecFstCache<W> implements FstCache<W>, Accountable {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(VecFstCache.class);
  private static final long TRS_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(CacheTrs.class);
  private static final long TR_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Tr.class);

  private boolean startComputed;
  private int start = StateIds.NO_STATE_ID;

  @SuppressWarnings("unchecked")
  private CacheTrs<W>[] trs = new CacheTrs[0];
  private int lenTrs;

  // index i holds the cached final weight of state i, if finalComputed.get(i)
  private Object[] finalWeights = new Object[0];
  private FixedBitSet finalComputed = new FixedBitSet(64);
  private int lenFinalWeights;

  private int numKnownStates;

  @Override
  public synchronized CacheStatus<Integer> getStart() {
    return startComputed ? CacheStatus.computed(start) : CacheStatus.notComputed();
  }

  @Override
  public synchronized void insertStart(int state) {
    if (startComputed == false) {
      startComputed = true;
      start = state;
      if (state != StateIds.NO_STATE_ID) {
        knownState(state);
      }
    }
  }

  private CacheTrs<W> cachedTrs(int state) {
    return state < trs.length ? trs[state] : null;
  }

  @Override
  public synchronized CacheStatus<List<Tr<W>>> getTrs(int state) {
    CacheTrs<W> cached = cachedTrs(state);
    return cached == null ? CacheStatus.notComputed() : CacheStatus.computed(cached.trs);
  }

  @Override
  public synchronized void insertTrs(int state, List<Tr<W>> stateTrs) {
    if (cachedTrs(state) != null) {
      return;
    }
    if (state >= trs.length) {
      trs = Arrays.copyOf(trs, ArrayUtil.oversize(state + 1, RamUsageEstimator.NUM_BYTES_OBJECT_REF));
    }
    CacheTrs<W> cached = new CacheTrs<>(stateTrs);
    trs[state] = cached;
    lenTrs++;
    knownState(Math.max(state, cached.maxNextState));
  }

  private boolean finalComputed(int state) {
    return state < finalComputed.length() && finalComputed.get(state);
  }

  @SuppressWarnings("unchecked")
  private W cachedFinalWeight(int state) {
    return (W) finalWeights[state];
  }

  @Override
  public synchronized CacheStatus<W> getFinalWeight(int state) {
    return finalComputed(state) ? CacheStatus.computed(cachedFinalWeight(state)) : CacheStatus.notComputed();
  }

  @Override
  public synchronized void insertFinalWeight(int state, W weight) {
    if (finalComputed(state)) {
      return;
    }
    if (state >= finalWeights.length) {
      finalWeights = Arrays.copyOf(finalWeights, ArrayUtil.oversize(state + 1, RamUsageEstimator.NUM_BYTES_OBJECT_REF));
    }
    finalComputed = FixedBitSet.ensureCapacity(finalComputed, state);
    finalComputed.set(state);
    finalWeights[state] = weight;
    lenFinalWeights++;
    knownState(state);
  }

  private void knownState(int state) {
    numKnownStates = Math.max(numKnownStates, state + 1);
  }

  @Override
  public synchronized int numKnownStates() {
    return numKnownStates;
  }

  @Override
  public synchronized int numTrs(int state) {
    CacheTrs<W> cached = cachedTrs(state);
    return cached == null ? -1 : cached.trs.size();
  }

  @Override
  public synchronized int numTrsUnchecked(int state) {
    return trs[state].trs.size();
  }

  @Override
  public synchronized int numInputEpsilons(int state) {
    CacheTrs<W> cached = cachedTrs(state);
    return cached == null ? -1 : cached.numInputEpsilons;
  }

  @Override
  public synchronized int numInputEpsilonsUnchecked(int state) {
    return trs[state].numInputEpsilons;
  }

  @Override
  public synchronized int numOutputEpsilons(int state) {
    CacheTrs<W> cached = cachedTrs(state);
    return cached == null ? -1 : cached.numOutputEpsilons;
  }

  @Override
  public synchronized int numOutputEpsilonsUnchecked(int state) {
    return trs[state].numOutputEpsilons;
  }

  @Override
  public synchronized int lenTrs() {
    return lenTrs;
  }

  @Override
  public synchronized int lenFinalWeights() {
    return lenFinalWeights;
  }

  @Override
  public synchronized CacheStatus<Boolean> isFinal(int state) {
    return finalComputed(state) ? CacheStatus.computed(finalWeights[state] != null) : CacheStatus.notComputed();
  }

  @Override
  public synchronized boolean isFinalUnchecked(int state) {
    return finalWeights[state] != null;
  }

  @Override
  public synchronized long ramBytesUsed() {
    long bytes = BASE_RAM_BYTES_USED
        + RamUsageEstimator.shallowSizeOf(trs)
        + RamUsageEstimator.shallowSizeOf(finalWeights)
        + finalComputed.ramBytesUsed();
    for (CacheTrs<W> cached : trs) {
      if (cached != null) {
        bytes += TRS_RAM_BYTES_USED + TR_RAM_BYTES_USED * cached.trs.size();
      }
    }
    return bytes;
  }

  @Override
  public synchronized String toString() {
    return getClass().getSimpleName() + "(trs=" + lenTrs + ", finalWeights=" + lenFinalWeights + ")";
  }
}
