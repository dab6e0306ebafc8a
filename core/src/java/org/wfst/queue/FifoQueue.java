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

/** First-in, first-out queue discipline, backed by a growing circular buffer.
 *
 *  @lucene.experimental */
public final class FifoQueue implements StateQueue {

  private int[] buffer = new int[8];

  // Array index of the head:
  private int readIndex;

  // How many pending states are held in the buffer:
  private int count;

  @Override
  public int head() {
    return count == 0 ? StateIds.NO_STATE_ID : buffer[readIndex];
  }

  @Override
  public void enqueue(int state) {
    if (count == buffer.length) {
      int[] newBuffer = new int[ArrayUtil.oversize(1 + count, Integer.BYTES)];
      // Unroll so the head lands at index 0:
      System.arraycopy(buffer, readIndex, newBuffer, 0, buffer.length - readIndex);
      System.arraycopy(buffer, 0, newBuffer, buffer.length - readIndex, readIndex);
      buffer = newBuffer;
      readIndex = 0;
    }
    int writeIndex = readIndex + count;
    if (writeIndex >= buffer.length) {
      writeIndex -= buffer.length;
    }
    buffer[writeIndex] = state;
    count++;
  }

  @Override
  public void dequeue() {
    assert count > 0;
    readIndex++;
    if (readIndex == buffer.length) {
      readIndex = 0;
    }
    count--;
  }

  @Override
  public void update(int state) {
  }

  @Override
  public boolean isEmpty() {
    return count == 0;
  }

  @Override
  public void clear() {
    readIndex = 0;
    count = 0;
  }

  /** Returns how many states are pending. */
  public int size() {
    return count;
  }

  @Override
  public QueueType queueType() {
    return QueueType.FIFO;
  }
}
