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
package org.wfst.compose;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Numbers composed states: each distinct {@link ComposeStateTuple} gets
 * the next free id, starting at 0, the first time it is looked up.
 */
final class ComposeStateTable<FS extends FilterState> {

  private final Map<ComposeStateTuple<FS>, Integer> ids = new HashMap<>();
  private final List<ComposeStateTuple<FS>> tuples = new ArrayList<>();

  /** Returns the id of {@code tuple}, assigning a new one if it was never seen. */
  synchronized int findState(ComposeStateTuple<FS> tuple) {
    Integer id = ids.get(tuple);
    if (id == null) {
      id = tuples.size();
      ids.put(tuple, id);
      tuples.add(tuple);
    }
    return id;
  }

  synchronized ComposeStateTuple<FS> tuple(int id) {
    return tuples.get(id);
  }

  synchronized int size() {
    return tuples.size();
  }
}
