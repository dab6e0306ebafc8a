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

/**
 * State of the auxiliary automaton a {@link ComposeFilter} runs during
 * composition.  Filter states are compared with {@link Object#equals}
 * only and are part of the key of a composed state, so implementations
 * must be immutable and implement {@code equals}/{@code hashCode}.
 *
 * @lucene.experimental
 */
public interface FilterState {

  /**
   * Returns true for the blocked sentinel: the proposed pair of
   * transitions is illegal and must be discarded.
   */
  boolean isNoState();
}
