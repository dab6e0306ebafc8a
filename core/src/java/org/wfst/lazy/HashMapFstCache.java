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

import static org.apache.lucene.util.RamUsageEstimator.HASHTABLE_RAM_BYTES_PER_ENTRY;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.RamUsageEstimator;
import org.wfst.fst.StateIds;
import org.wfst.fst.Tr;

/**
 * {@link FstCache} keyed by state in concurrent hash maps.  Suited to
 * sparse expansions where only a few of the states of a large FST are
 * ever visited.
 *
 * @lucene.experimental
 */
public class HashMapFstCache<W> implements FstCache<W>, Accountable {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(HashMapFstCache.class);
  private static final long TRS_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(CacheTrs.class);
  private static final long TR_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Tr.class);

  // start is not computed while it holds this value
  private static final int UNSET = -2;

  // stands in for a null final weight, which the maps cannot hold
  private static final Object NON_FINAL = new Object();

  private final AtomicInteger start = new AtomicInteger(UNSET);
  private final ConcurrentMap<Integer, CacheTrs<W>> trs = new ConcurrentHashMap<>();
  private final ConcurrentMap<Integer, Object> finalWeights = new ConcurrentHashMap<>();
  private final AtomicInteger numKnownStates = new AtomicInteger();

  @Override
  public CacheStatus<Integer> getStart() {
    int s = start.get();
    return s == UNSET ? CacheStatus.notComputed() : CacheStatus.computed(s);
  }

  @Override
  public void insertStart(int state) {
    if (start.compareAndSet(UNSET, state) && state != StateIds.NO_STATE_ID) {
      knownState(state);
    }
  }

  @Override
  public CacheStatus<List<Tr<W>>> getTrs(int state) {
    CacheTrs<W> cached = trs.get(state);
    return cached == null ? CacheStatus.notComputed() : CacheStatus.computed(cached.trs);
  }

  @Override
  public void insertTrs(int state, List<Tr<W>> stateTrs) {
    CacheTrs<W> cached = new CacheTrs<>(stateTrs);
    if (trs.putIfAbsent(state, cached) == null) {
      knownState(Math.max(state, cached.maxNextState));
    }
  }

  @Override
  @SuppressWarnings("unchecked")
  public CacheStatus<W> getFinalWeight(int state) {
    Object weight = finalWeights.get(state);
    if (weight == null) {
      return CacheStatus.notComputed();
    }
    return CacheStatus.computed(weight == NON_FINAL ? null : (W) weight);
  }

  @Override
  public void insertFinalWeight(int state, W weight) {
    if (finalWeights.putIfAbsent(state, weight == null ? NON_FINAL : weight) == null) {
      knownState(state);
    }
  }

  private void knownState(int state) {
    numKnownStates.accumulateAndGet(state + 1, Math::max);
  }

  @Override
  public int numKnownStates() {
    return numKnownStates.get();
  }

  @Override
  public int numTrs(int state) {
    CacheTrs<W> cached = trs.get(state);
    return cached == null ? -1 : cached.trs.size();
  }

  @Override
  public int numTrsUnchecked(int state) {
    return trs.get(state).trs.size();
  }

  @Override
  public int numInputEpsilons(int state) {
    CacheTrs<W> cached = trs.get(state);
    return cached == null ? -1 : cached.numInputEpsilons;
  }

  @Override
  public int numInputEpsilonsUnchecked(int state) {
    return trs.get(state).numInputEpsilons;
  }

  @Override
  public int numOutputEpsilons(int state) {
    CacheTrs<W> cached = trs.get(state);
    return cached == null ? -1 : cached.numOutputEpsilons;
  }

  @Override
  public int numOutputEpsilonsUnchecked(int state) {
    return trs.get(state).numOutputEpsilons;
  }

  @Override
  public int lenTrs() {
    return trs.size();
  }

  @Override
  public int lenFinalWeights() {
    return finalWeights.size();
  }

  @Override
  public CacheStatus<Boolean> isFinal(int state) {
    Object weight = finalWeights.get(state);
    return weight == null ? CacheStatus.notComputed() : CacheStatus.computed(weight != NON_FINAL);
  }

  @Override
  public boolean isFinalUnchecked(int state) {
    Object weight = finalWeights.get(state);
    assert weight != null : "final weight of state " + state + " is not cached";
    return weight != NON_FINAL;
  }

  @Override
  public long ramBytesUsed() {
    long bytes = BASE_RAM_BYTES_USED;
    for (CacheTrs<W> cached : trs.values()) {
      bytes += HASHTABLE_RAM_BYTES_PER_ENTRY + TRS_RAM_BYTES_USED + TR_RAM_BYTES_USED * cached.trs.size();
    }
    bytes += HASHTABLE_RAM_BYTES_PER_ENTRY * finalWeights.size();
    return bytes;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "(trs=" + lenTrs() + ", finalWeights=" + lenFinalWeights() + ")";
  }
}
