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
 * Holds at most one state; enqueuing replaces the pending state.  Only
 * suitable for traversals that process each state before discovering
 * the next one, such as walks over a string FST.
 *
 * @lucene.experimental
 */
public final class TrivialQueue implements StateQueue {

  private int front = StateIds.NO_STATE_ID;

  @Override
  public int head() {
    return front;
  }

  @Override
  public void enqueue(int state) {
    front = state;
  }

  @Override
  public void dequeue() {
    front = StateIds.NO_STATE_ID;
  }

  @Override
  public void update(int state) {
  }

  @Override
  public boolean isEmpty() {
    return front == StateIds.NO_STATE_ID;
  }

  @Override
  public void clear() {
    front = StateIds.NO_STATE_ID;
  }

  @Override
  public QueueType queueType() {
    return QueueType.TRIVIAL;
  }
}
