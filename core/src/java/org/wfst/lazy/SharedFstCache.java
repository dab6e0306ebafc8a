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
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.util.InfoStream;
import org.wfst.fst.Tr;

/**
 * Reference counted handle on an {@link FstCache}, so that several lazy
 * FSTs over the same operation can share what any of them computed.
 * Every read and insert is forwarded unchanged to the wrapped cache.
 *
 * <p>The count starts at 1, held by whoever created the handle.  Each
 * additional holder calls {@link #incRef} and later {@link #decRef};
 * once the count drops to 0 the handle lets go of the wrapped cache and
 * every further access throws {@link AlreadyClosedException}.
 *
 * @lucene.experimental
 */
public final class SharedFstCache<W> implements FstCache<W> {

  /** Component name this cache logs under. */
  public static final String INFO_STREAM_COMPONENT = "CACHE";

  private final AtomicInteger refCount = new AtomicInteger(1);
  private final InfoStream infoStream;
  private volatile FstCache<W> delegate;

  public SharedFstCache(FstCache<W> delegate) {
    this(delegate, InfoStream.getDefault());
  }

  public SharedFstCache(FstCache<W> delegate, InfoStream infoStream) {
    this.delegate = Objects.requireNonNull(delegate);
    this.infoStream = Objects.requireNonNull(infoStream);
  }

  /** Returns the current reference count. */
  public int getRefCount() {
    return refCount.get();
  }

  /**
   * Increments the reference count.
   *
   * @throws AlreadyClosedException if the count already dropped to 0
   */
  public void incRef() {
    if (tryIncRef() == false) {
      ensureOpen();
    }
  }

  /** Increments the reference count unless it already dropped to 0; returns true on success. */
  public boolean tryIncRef() {
    int count;
    while ((count = refCount.get()) > 0) {
      if (refCount.compareAndSet(count, count + 1)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Decrements the reference count, releasing the wrapped cache when it
   * reaches 0.
   *
   * @throws AlreadyClosedException if the count already dropped to 0
   */
  public void decRef() {
    ensureOpen();
    final int rc = refCount.decrementAndGet();
    if (rc == 0) {
      FstCache<W> released = delegate;
      delegate = null;
      if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
        infoStream.message(INFO_STREAM_COMPONENT, "release " + released);
      }
    } else if (rc < 0) {
      throw new IllegalStateException("too many decRef calls: refCount is " + rc + " after decrement");
    }
  }

  private FstCache<W> ensureOpen() {
    FstCache<W> cache = delegate;
    if (refCount.get() <= 0 || cache == null) {
      throw new AlreadyClosedException("this SharedFstCache is closed");
    }
    return cache;
  }

  @Override
  public CacheStatus<Integer> getStart() {
    return ensureOpen().getStart();
  }

  @Override
  public void insertStart(int start) {
    ensureOpen().insertStart(start);
  }

  @Override
  public CacheStatus<List<Tr<W>>> getTrs(int state) {
    return ensureOpen().getTrs(state);
  }

  @Override
  public void insertTrs(int state, List<Tr<W>> trs) {
    ensureOpen().insertTrs(state, trs);
  }

  @Override
  public CacheStatus<W> getFinalWeight(int state) {
    return ensureOpen().getFinalWeight(state);
  }

  @Override
  public void insertFinalWeight(int state, W weight) {
    ensureOpen().insertFinalWeight(state, weight);
  }

  @Override
  public int numKnownStates() {
    return ensureOpen().numKnownStates();
  }

  @Override
  public int numTrs(int state) {
    return ensureOpen().numTrs(state);
  }

  @Override
  public int numTrsUnchecked(int state) {
    return ensureOpen().numTrsUnchecked(state);
  }

  @Override
  public int numInputEpsilons(int state) {
    return ensureOpen().numInputEpsilons(state);
  }

  @Override
  public int numInputEpsilonsUnchecked(int state) {
    return ensureOpen().numInputEpsilonsUnchecked(state);
  }

  @Override
  public int numOutputEpsilons(int state) {
    return ensureOpen().numOutputEpsilons(state);
  }

  @Override
  public int numOutputEpsilonsUnchecked(int state) {
    return ensureOpen().numOutputEpsilonsUnchecked(state);
  }

  @Override
  public int lenTrs() {
    return ensureOpen().lenTrs();
  }

  @Override
  public int lenFinalWeights() {
    return ensureOpen().lenFinalWeights();
  }

  @Override
  public CacheStatus<Boolean> isFinal(int state) {
    return ensureOpen().isFinal(state);
  }

  @Override
  public boolean isFinalUnchecked(int state) {
    return ensureOpen().isFinalUnchecked(state);
  }

  @Override
  public String toString() {
    return "SharedFstCache(refCount=" + refCount.get() + ", " + delegate + ")";
  }
}
