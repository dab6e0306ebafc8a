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

import org.wfst.fst.StateIds;

/**
 * Visitation-order policy for graph traversals over FST states.  A
 * traversal {@link #enqueue}s states as it discovers them and repeatedly
 * processes {@link #head} and {@link #dequeue}s it until the queue
 * {@link #isEmpty}.  Implementations are not thread-safe; each
 * traversal pass uses its own queue.
 *
 * @lucene.experimental
 */
public interface StateQueue {

  /** Returns the state due next, or {@link StateIds#NO_STATE_ID} if the queue is empty. */
  int head();

  /** Marks {@code state} pending. */
  void enqueue(int state);

  /** Removes the current {@link #head}. */
  void dequeue();

  /**
   * Notifies this queue that the priority of the pending {@code state}
   * changed.  No-op for disciplines whose order does not depend on
   * priorities.
   */
  void update(int state);

  boolean isEmpty();

  /** Removes every pending state. */
  void clear();

  QueueType queueType();
}
