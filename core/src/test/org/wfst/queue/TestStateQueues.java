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

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import org.apache.lucene.util.LuceneTestCase;
import org.apache.lucene.util.TestUtil;
import org.wfst.fst.StateIds;

public class TestStateQueues extends LuceneTestCase {

  private static List<Integer> drain(StateQueue queue) {
    List<Integer> states = new ArrayList<>();
    while (queue.isEmpty() == false) {
      states.add(queue.head());
      queue.dequeue();
    }
    assertEquals(StateIds.NO_STATE_ID, queue.head());
    return states;
  }

  public void testTrivial() {
    TrivialQueue queue = new TrivialQueue();
    assertTrue(queue.isEmpty());
    assertEquals(StateIds.NO_STATE_ID, queue.head());
    queue.enqueue(3);
    assertEquals(3, queue.head());
    queue.enqueue(5);
    assertEquals(5, queue.head());
    queue.dequeue();
    assertTrue(queue.isEmpty());
    assertEquals(QueueType.TRIVIAL, queue.queueType());
  }

  public void testFifo() {
    FifoQueue queue = new FifoQueue();
    List<Integer> expected = new ArrayList<>();
    int upto = 0;
    for (int iter = 0; iter < atLeast(200); iter++) {
      if (random().nextBoolean() || queue.isEmpty()) {
        queue.enqueue(upto);
        expected.add(upto++);
      } else {
        assertEquals(expected.remove(0).intValue(), queue.head());
        queue.dequeue();
      }
      assertEquals(expected.size(), queue.size());
    }
    assertEquals(expected, drain(queue));
    assertEquals(QueueType.FIFO, queue.queueType());
  }

  public void testLifo() {
    LifoQueue queue = new LifoQueue();
    for (int i = 0; i < 10; i++) {
      queue.enqueue(i);
    }
    assertEquals(9, queue.head());
    queue.dequeue();
    queue.enqueue(42);
    List<Integer> states = drain(queue);
    assertEquals(42, states.get(0).intValue());
    assertEquals(8, states.get(1).intValue());
    assertEquals(0, states.get(states.size() - 1).intValue());
    assertEquals(QueueType.LIFO, queue.queueType());
  }

  public void testStateOrder() {
    StateOrderQueue queue = new StateOrderQueue();
    TreeSet<Integer> expected = new TreeSet<>();
    for (int iter = 0; iter < atLeast(200); iter++) {
      if (random().nextInt(3) != 0 || queue.isEmpty()) {
        int state = TestUtil.nextInt(random(), 0, 500);
        queue.enqueue(state);
        expected.add(state);
      } else {
        assertEquals(expected.pollFirst().intValue(), queue.head());
        queue.dequeue();
      }
      assertEquals(expected.isEmpty(), queue.isEmpty());
    }
    assertEquals(new ArrayList<>(expected), drain(queue));
  }

  public void testClear() {
    StateQueue[] queues = new StateQueue[] {
        new TrivialQueue(), new FifoQueue(), new LifoQueue(), new StateOrderQueue()
    };
    for (StateQueue queue : queues) {
      for (int i = 0; i < 5; i++) {
        queue.enqueue(random().nextInt(100));
      }
      queue.clear();
      assertTrue(queue.toString(), queue.isEmpty());
      queue.enqueue(7);
      assertEquals(7, queue.head());
    }
  }
}
