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

import java.util.ArrayList;
import java.util.List;

import org.apache.lucene.store.AlreadyClosedException;
import org.apache.lucene.util.InfoStream;
import org.apache.lucene.util.TestUtil;
import org.wfst.fst.Tr;

public class TestSharedFstCache extends BaseFstCacheTestCase {

  @Override
  protected FstCache<Float> newCache() {
    return new SharedFstCache<>(random().nextBoolean() ? new HashMapFstCache<>() : new VecFstCache<>());
  }

  /** Runs the same random calls on a plain cache and on a shared handle around another one. */
  public void testTransparent() {
    FstCache<Float> plain = random().nextBoolean() ? new HashMapFstCache<>() : new VecFstCache<>();
    FstCache<Float> shared = new SharedFstCache<>(random().nextBoolean() ? new HashMapFstCache<>() : new VecFstCache<>());
    int numStates = TestUtil.nextInt(random(), 1, 50);
    for (int iter = 0; iter < atLeast(500); iter++) {
      int state = random().nextInt(numStates);
      switch (random().nextInt(10)) {
        case 0:
          int start = random().nextInt(numStates);
          plain.insertStart(start);
          shared.insertStart(start);
          break;
        case 1:
        case 2:
          List<Tr<Float>> trs = randomTrs(3, numStates);
          plain.insertTrs(state, trs);
          shared.insertTrs(state, trs);
          break;
        case 3:
        case 4:
          Float weight = random().nextBoolean() ? null : (float) random().nextInt(5);
          plain.insertFinalWeight(state, weight);
          shared.insertFinalWeight(state, weight);
          break;
        default:
          assertEquals(plain.getStart(), shared.getStart());
          assertEquals(plain.getTrs(state), shared.getTrs(state));
          assertEquals(plain.getFinalWeight(state), shared.getFinalWeight(state));
          assertEquals(plain.isFinal(state), shared.isFinal(state));
          assertEquals(plain.numTrs(state), shared.numTrs(state));
          assertEquals(plain.numInputEpsilons(state), shared.numInputEpsilons(state));
          assertEquals(plain.numOutputEpsilons(state), shared.numOutputEpsilons(state));
          if (plain.getTrs(state).isComputed()) {
            assertEquals(plain.numTrsUnchecked(state), shared.numTrsUnchecked(state));
            assertEquals(plain.numInputEpsilonsUnchecked(state), shared.numInputEpsilonsUnchecked(state));
            assertEquals(plain.numOutputEpsilonsUnchecked(state), shared.numOutputEpsilonsUnchecked(state));
          }
          if (plain.getFinalWeight(state).isComputed()) {
            assertEquals(plain.isFinalUnchecked(state), shared.isFinalUnchecked(state));
          }
          assertEquals(plain.lenTrs(), shared.lenTrs());
          assertEquals(plain.lenFinalWeights(), shared.lenFinalWeights());
          assertEquals(plain.numKnownStates(), shared.numKnownStates());
      }
    }
  }

  public void testRefCounting() {
    List<String> messages = new ArrayList<>();
    InfoStream infoStream = new InfoStream() {
      @Override
      public void message(String component, String message) {
        messages.add(component + ": " + message);
      }

      @Override
      public boolean isEnabled(String component) {
        return true;
      }

      @Override
      public void close() {
      }
    };
    SharedFstCache<Float> cache = new SharedFstCache<>(new HashMapFstCache<>(), infoStream);
    assertEquals(1, cache.getRefCount());
    cache.incRef();
    assertTrue(cache.tryIncRef());
    assertEquals(3, cache.getRefCount());
    cache.insertStart(0);
    cache.decRef();
    cache.decRef();
    assertEquals(0, cache.getStart().value().intValue());
    assertTrue(messages.isEmpty());
    cache.decRef();
    assertEquals(0, cache.getRefCount());
    assertEquals(1, messages.size());
    assertTrue(messages.get(0), messages.get(0).startsWith(SharedFstCache.INFO_STREAM_COMPONENT + ": release"));

    assertFalse(cache.tryIncRef());
    expectThrows(AlreadyClosedException.class, cache::incRef);
    expectThrows(AlreadyClosedException.class, cache::decRef);
    expectThrows(AlreadyClosedException.class, cache::getStart);
    expectThrows(AlreadyClosedException.class, () -> cache.getTrs(0));
    expectThrows(AlreadyClosedException.class, () -> cache.insertFinalWeight(0, 1f));
    expectThrows(AlreadyClosedException.class, cache::lenTrs);
  }
}
