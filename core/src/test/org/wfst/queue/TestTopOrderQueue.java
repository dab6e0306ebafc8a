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
package org.wfst.queue;

import org.apache.lucene.util.LuceneTestCase;
import org.apache.lucene.util.TestUtil;
import org.wfst.fst.FstTestUtil;
import org.wfst.fst.StateIds;
import org.wfst.fst.TopSort;
import org.wfst.fst.Tr;
import org.wfst.fst.VectorFst;
import org.wfst.semiring.TropicalSemiring;

public class TestTopOrderQueue extends LuceneTestCase {

  public void testRanksNonDecreasing() {
    for (int iter = 0; iter < atLeast(20); iter++) {
      VectorFst<Float> fst = FstTestUtil.randomAcyclic(random(), TropicalSemiring.getSingleton(), TestUtil.nextInt(random(), 1, 100), 3);
      int[] order = TopSort.sortStates(fst);
      TopOrderQueue queue = new TopOrderQueue(fst);
      assertTrue(queue.isEmpty());
      boolean[] pending = new boolean[fst.numStates()];
      int numPending = 0;
      for (int i = 0; i < atLeast(10); i++) {
        int state = random().nextInt(fst.numStates());
        queue.enqueue(state);
        if (pending[state] == false) {
          pending[state] = true;
          numPending++;
        }
      }
      int lastRank = -1;
      while (queue.isEmpty() == false) {
        int state = queue.head();
        assertTrue(pending[state]);
        assertTrue(order[state] >= lastRank);
        lastRank = order[state];
        pending[state] = false;
        numPending--;
        queue.dequeue();
        assertEquals(numPending == 0, queue.isEmpty());
      }
      assertEquals(0, numPending);
      assertEquals(StateIds.NO_STATE_ID, queue.head());
    }
  }

  public void testTraversal() {
    // visiting in topological order reaches every state after all its predecessors
    VectorFst<Float> fst = FstTestUtil.randomAcyclic(random(), TropicalSemiring.getSingleton(), TestUtil.nextInt(random(), 1, 100), 3);
    TopOrderQueue queue = new TopOrderQueue(fst);
    boolean[] visited = new boolean[fst.numStates()];
    boolean[] enqueued = new boolean[fst.numStates()];
    queue.enqueue(fst.start());
    enqueued[fst.start()] = true;
    int[] order = TopSort.sortStates(fst);
    int lastRank = -1;
    while (queue.isEmpty() == false) {
      int state = queue.head();
      queue.dequeue();
      assertTrue(order[state] > lastRank);
      lastRank = order[state];
      visited[state] = true;
      for (Tr<Float> tr : fst.getTrs(state)) {
        assertFalse(visited[tr.nextState]);
        if (enqueued[tr.nextState] == false) {
          enqueued[tr.nextState] = true;
          queue.enqueue(tr.nextState);
        }
      }
    }
  }

  public void testClear() {
    TopOrderQueue queue = new TopOrderQueue(new int[] {2, 0, 1, 3});
    queue.enqueue(0);
    queue.enqueue(3);
    assertEquals(0, queue.head());
    queue.clear();
    assertTrue(queue.isEmpty());
    queue.enqueue(2);
    queue.enqueue(1);
    assertEquals(1, queue.head());
    queue.dequeue();
    assertEquals(2, queue.head());
    queue.clear();
    assertTrue(queue.isEmpty());
    assertEquals(QueueType.TOP_ORDER, queue.queueType());
  }

  public void testCyclic() {
    VectorFst<Float> fst = new VectorFst<>(TropicalSemiring.getSingleton());
    int s = fst.addState();
    fst.setStart(s);
    fst.addTr(s, new Tr<>(1, 1, 0f, s));
    expectThrows(IllegalArgumentException.class, () -> new TopOrderQueue(fst));
  }

  public void testOrderIsCopied() {
    int[] order = new int[] {2, 0, 1};
    TopOrderQueue queue = new TopOrderQueue(order);
    order[0] = 0;
    order[1] = 2;
    queue.enqueue(0);
    queue.enqueue(1);
    queue.enqueue(2);
    assertEquals(1, queue.head());
    queue.dequeue();
    assertEquals(2, queue.head());
    queue.dequeue();
    assertEquals(0, queue.head());
    queue.dequeue();
    assertTrue(queue.isEmpty());
  }
}
