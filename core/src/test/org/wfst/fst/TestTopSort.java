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

import org.apache.lucene.util.LuceneTestCase;
import org.apache.lucene.util.TestUtil;
import org.wfst.semiring.TropicalSemiring;

public class TestTopSort extends LuceneTestCase {

  private static final TropicalSemiring SR = TropicalSemiring.getSingleton();

  public void testRandomAcyclic() {
    for (int iter = 0; iter < atLeast(20); iter++) {
      VectorFst<Float> fst = FstTestUtil.randomAcyclic(random(), SR, TestUtil.nextInt(random(), 1, 50), 3);
      int[] order = TopSort.sortStates(fst);
      boolean[] seen = new boolean[order.length];
      for (int state = 0; state < fst.numStates(); state++) {
        assertFalse("rank used twice", seen[order[state]]);
        seen[order[state]] = true;
        for (Tr<Float> tr : fst.getTrs(state)) {
          assertTrue(order[state] < order[tr.nextState]);
        }
      }
      assertTrue(TopSort.isAcyclic(fst));
    }
  }

  public void testStartFirst() {
    VectorFst<Float> fst = new VectorFst<>(SR);
    int s0 = fst.addState();
    int s1 = fst.addState();
    int s2 = fst.addState();
    fst.setStart(s2);
    fst.addTr(s2, new Tr<>(1, 1, 0f, s0));
    fst.addTr(s0, new Tr<>(1, 1, 0f, s1));
    int[] order = TopSort.sortStates(fst);
    assertEquals(0, order[s2]);
    assertEquals(1, order[s0]);
    assertEquals(2, order[s1]);
  }

  public void testCycle() {
    VectorFst<Float> fst = new VectorFst<>(SR);
    int s0 = fst.addState();
    int s1 = fst.addState();
    fst.setStart(s0);
    fst.addTr(s0, new Tr<>(1, 1, 0f, s1));
    fst.addTr(s1, new Tr<>(1, 1, 0f, s0));
    assertFalse(TopSort.isAcyclic(fst));
    expectThrows(IllegalArgumentException.class, () -> TopSort.sortStates(fst));
    assertTrue(FstProperties.contains(FstProperties.compute(fst), FstProperties.CYCLIC));
  }

  public void testLongChain() {
    VectorFst<Float> fst = new VectorFst<>(SR);
    int n = 100000;
    for (int i = 0; i < n; i++) {
      fst.addState();
    }
    fst.setStart(0);
    for (int i = 0; i < n - 1; i++) {
      fst.addTr(i, new Tr<>(1, 1, 0f, i + 1));
    }
    int[] order = TopSort.sortStates(fst);
    for (int i = 0; i < n; i++) {
      assertEquals(i, order[i]);
    }
  }
}
