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

import java.util.List;

import org.wfst.semiring.Semiring;

/**
 * Shortest-first discipline over a per-state weight list (typically
 * shortest distances being relaxed) under the {@link Semiring#naturalLess
 * natural order} of an idempotent semiring.  States past the end of the
 * list weigh {@link Semiring#zero}.  Callers must {@link #update} a
 * pending state after lowering its weight.
 *
 * @lucene.experimental
 */
public final class NaturalShortestFirstQueue<W> extends ShortestFirstQueue {

  private final Semiring<W> semiring;
  private final List<W> distance;

  public NaturalShortestFirstQueue(Semiring<W> semiring, List<W> distance) {
    this.semiring = semiring;
    this.distance = distance;
  }

  private W weight(int state) {
    return state < distance.size() ? distance.get(state) : semiring.zero();
  }

  @Override
  protected boolean lessThan(int a, int b) {
    return semiring.naturalLess(weight(a), weight(b));
  }
}
