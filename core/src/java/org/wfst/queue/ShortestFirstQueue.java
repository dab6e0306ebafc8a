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

import org.apache.lucene.util.ArrayUtil;
import org.wfst.fst.StateIds;

/**
 * Serves the least pending state according to {@link #lessThan}.  Backed
 * by a binary heap that also records the heap position of every pending
 * state, so that {@link #update} can restore the heap after the priority
 * of a pending state changed.  Enqueuing a state that is already pending
 * behaves like {@link #update}.
 *
 * @lucene.experimental
 */
public abstract class ShortestFirstQueue implements StateQueue {

  private int[] heap = new int[16];
  private int size;

  // position[state] = index in heap, or -1 if not pending
  private int[] position = new int[16];

  protected ShortestFirstQueue() {
    Arrays.fill(position, -1);
  }

  /** Determines the ordering of states; must be consistent while they are pending. */
  protected abstract boolean lessThan(int a, int b);

  @Override
  public int head() {
    return size == 0 ? StateIds.NO_STATE_ID : heap[0];
  }

  @Override
  public void enqueue(int state) {
    if (state >= position.length) {
      int oldLength = position.length;
      position = ArrayUtil.grow(position, state + 1);
      Arrays.fill(position, oldLength, position.length, -1);
    }
    if (position[state] != -1) {
      update(state);
      return;
    }
    if (size == heap.length) {
      heap = ArrayUtil.grow(heap, size + 1);
    }
    heap[size] = state;
    position[state] = size;
    size++;
    upHeap(size - 1);
  }

  @Override
  public void dequeue() {
    assert size > 0;
    position[heap[0]] = -1;
    size--;
    if (size > 0) {
      heap[0] = heap[size];
      position[heap[0]] = 0;
      downHeap(0);
    }
  }

  @Override
  public void update(int state) {
    if (state >= position.length || position[state] == -1) {
      enqueue(state);
      return;
    }
    int i = upHeap(position[state]);
    downHeap(i);
  }

  @Override
  public boolean isEmpty() {
    return size == 0;
  }

  @Override
  public void clear() {
    for (int i = 0; i < size; i++) {
      position[heap[i]] = -1;
    }
    size = 0;
  }

  /** Returns how many states are pending. */
  public int size() {
    return size;
  }

  @Override
  public QueueType queueType() {
    return QueueType.SHORTEST_FIRST;
  }

  private int upHeap(int i) {
    final int node = heap[i];
    int parent = (i - 1) >>> 1;
    while (i > 0 && lessThan(node, heap[parent])) {
      heap[i] = heap[parent];
      position[heap[i]] = i;
      i = parent;
      parent = (i - 1) >>> 1;
    }
    heap[i] = node;
    position[node] = i;
    return i;
  }

  private void downHeap(int i) {
    final int node = heap[i];
    int child = 2 * i + 1;
    while (child < size) {
      if (child + 1 < size && lessThan(heap[child + 1], heap[child])) {
        child++;
      }
      if (lessThan(heap[child], node) == false) {
        break;
      }
      heap[i] = heap[child];
      position[heap[i]] = i;
      i = child;
      child = 2 * i + 1;
    }
    heap[i] = node;
    position[node] = i;
  }
}
