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

import org.apache.lucene.util.ArrayUtil;
import org.wfst.fst.StateIds;

/** Last-in, first-out queue discipline: a depth-first visitation order.
 *
 *  @lucene.experimental */
public final class LifoQueue implements StateQueue {

  private int[] stack = new int[8];
  private int size;

  @Override
  public int head() {
    return size == 0 ? StateIds.NO_STATE_ID : stack[size - 1];
  }

  @Override
  public void enqueue(int state) {
    if (size == stack.length) {
      stack = ArrayUtil.grow(stack, size + 1);
    }
    stack[size++] = state;
  }

  @Override
  public void dequeue() {
    assert size > 0;
    size--;
  }

  @Override
  public void update(int state) {
  }

  @Override
  public boolean isEmpty() {
    return size == 0;
  }

  @Override
  public void clear() {
    size = 0;
  }

  @Override
  public QueueType queueType() {
    return QueueType.LIFO;
  }
}
