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
import java.util.Objects;

import org.wfst.fst.Fst;
import org.wfst.fst.Tr;
import org.wfst.semiring.Semiring;

/**
 * {@link Fst} expanded on demand: each query is answered from an
 * {@link FstCache}, and on a miss the {@link FstOp} computes the answer,
 * which is inserted and then read back from the cache.  Reading back
 * means every caller sees whatever was inserted first, even when
 * several threads compute the same state at once.
 *
 * @lucene.experimental
 */
public class LazyFst<W> implements Fst<W> {

  protected final FstOp<W> op;
  protected final FstCache<W> cache;

  public LazyFst(FstOp<W> op, FstCache<W> cache) {
    this.op = Objects.requireNonNull(op);
    this.cache = Objects.requireNonNull(cache);
  }

  /** Returns the operation computing the states of this FST. */
  public FstOp<W> op() {
    return op;
  }

  /** Returns the cache this FST fills. */
  public FstCache<W> cache() {
    return cache;
  }

  @Override
  public Semiring<W> semiring() {
    return op.semiring();
  }

  @Override
  public int start() {
    CacheStatus<Integer> start = cache.getStart();
    if (start.isComputed() == false) {
      cache.insertStart(op.computeStart());
      start = cache.getStart();
    }
    return start.value();
  }

  @Override
  public W finalWeight(int state) {
    CacheStatus<W> weight = cache.getFinalWeight(state);
    if (weight.isComputed() == false) {
      cache.insertFinalWeight(state, op.computeFinalWeight(state));
      weight = cache.getFinalWeight(state);
    }
    return weight.value();
  }

  @Override
  public boolean isFinal(int state) {
    CacheStatus<Boolean> isFinal = cache.isFinal(state);
    if (isFinal.isComputed()) {
      return isFinal.value();
    }
    return finalWeight(state) != null;
  }

  @Override
  public List<Tr<W>> getTrs(int state) {
    CacheStatus<List<Tr<W>>> trs = cache.getTrs(state);
    if (trs.isComputed() == false) {
      cache.insertTrs(state, op.computeTrs(state));
      trs = cache.getTrs(state);
    }
    return trs.value();
  }

  private void expand(int state) {
    if (cache.getTrs(state).isComputed() == false) {
      cache.insertTrs(state, op.computeTrs(state));
    }
  }

  @Override
  public int numTrs(int state) {
    expand(state);
    return cache.numTrsUnchecked(state);
  }

  @Override
  public int numInputEpsilons(int state) {
    expand(state);
    return cache.numInputEpsilonsUnchecked(state);
  }

  @Override
  public int numOutputEpsilons(int state) {
    expand(state);
    return cache.numOutputEpsilonsUnchecked(state);
  }

  @Override
  public long properties() {
    return op.properties();
  }

  /** Number of states discovered so far; grows as the FST is expanded. */
  public int numKnownStates() {
    return cache.numKnownStates();
  }
}
