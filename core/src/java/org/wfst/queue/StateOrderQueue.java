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

import org.apache.lucene.util.FixedBitSet;
import org.wfst.fst.StateIds;

/**
 * Serves pending states by increasing id.  Pending states are bits of a
 * growing bitset; the {@code [front, back]} window bounds the set bits.
 * Suitable when state ids are already a topological order.
 *
 * @lucene.experimental
 */
public final class StateOrderQueue implements StateQueue {

  private FixedBitSet enqueued = new FixedBitSet(64);
  private int front = 0;
  private int back = StateIds.NO_STATE_ID;

  @Override
  public int head() {
    return isEmpty() ? StateIds.NO_STATE_ID : front;
  }

  @Override
  public void enqueue(int state) {
    if (isEmpty()) {
      front = back = state;
    } else if (state > back) {
      back = state;
    } else if (state < front) {
      front = state;
    }
    enqueued = FixedBitSet.ensureCapacity(enqueued, state);
    enqueued.set(state);
  }

  @Override
  public void dequeue() {
    assert isEmpty() == false;
    enqueued.clear(front);
    if (front == back) {
      front = back + 1;
    } else {
      front = enqueued.nextSetBit(front + 1);
    }
  }

  @Override
  public void update(int state) {
  }

  @Override
  public boolean isEmpty() {
    return back == StateIds.NO_STATE_ID || front > back;
  }

  @Override
  public void clear() {
    if (isEmpty() == false) {
      enqueued.clear(front, back + 1);
    }
    front = 0;
    back = StateIds.NO_STATE_ID;
  }

  @Override
  public QueueType queueType() {
    return QueueType.STATE_ORDER;
  }
}
