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

import java.util.Arrays;

import org.wfst.fst.ExpandedFst;
import org.wfst.fst.StateIds;
import org.wfst.fst.TopSort;

/**
 * Serves pending states by topological rank.  The FST must be acyclic.
 * Each rank has one slot holding the pending state of that rank, and the
 * {@code [front, back]} window bounds the occupied slots; enqueue and
 * dequeue only ever slide the window's edges, never rescan the order.
 *
 * @lucene.experimental
 */
public final class TopOrderQueue implements StateQueue {

  // order[state] = rank
  private final int[] order;

  // state[rank] = pending state, or NO_STATE_ID
  private final int[] state;

  private int front = 0;
  private int back = StateIds.NO_STATE_ID;

  /**
   * Sorts {@code fst} topologically once.
   *
   * @throws IllegalArgumentException if {@code fst} has a cycle
   */
  public TopOrderQueue(ExpandedFst<?> fst) {
    this(TopSort.sortStates(fst));
  }

  /** Uses a copy of a precomputed order; {@code order[state]} is the rank of {@code state}. */
  public TopOrderQueue(int[] order) {
    this.order = order.clone();
    this.state = new int[order.length];
    Arrays.fill(state, StateIds.NO_STATE_ID);
  }

  @Override
  public int head() {
    return isEmpty() ? StateIds.NO_STATE_ID : state[front];
  }

  @Override
  public void enqueue(int s) {
    final int rank = order[s];
    if (isEmpty()) {
      front = back = rank;
    } else if (rank > back) {
      back = rank;
    } else if (rank < front) {
      front = rank;
    }
    state[rank] = s;
  }

  @Override
  public void dequeue() {
    assert isEmpty() == false;
    state[front] = StateIds.NO_STATE_ID;
    while (front <= back && state[front] == StateIds.NO_STATE_ID) {
      front++;
    }
  }

  @Override
  public void update(int s) {
  }

  @Override
  public boolean isEmpty() {
    return back == StateIds.NO_STATE_ID || front > back;
  }

  @Override
  public void clear() {
    if (back != StateIds.NO_STATE_ID) {
      for (int rank = front; rank <= back; rank++) {
        state[rank] = StateIds.NO_STATE_ID;
      }
    }
    front = 0;
    back = StateIds.NO_STATE_ID;
  }

  @Override
  public QueueType queueType() {
    return QueueType.TOP_ORDER;
  }
}
