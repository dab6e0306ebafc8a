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

import java.util.Objects;

/**
 * A state of a composed FST: a state of each operand plus the filter
 * state reached along the way.
 *
 * @lucene.experimental
 */
public final class ComposeStateTuple<FS extends FilterState> {

  public final int s1;
  public final int s2;
  public final FS filterState;

  public ComposeStateTuple(int s1, int s2, FS filterState) {
    this.s1 = s1;
    this.s2 = s2;
    this.filterState = Objects.requireNonNull(filterState);
  }

  @Override
  public boolean equals(Object other) {
    if (other instanceof ComposeStateTuple == false) {
      return false;
    }
    ComposeStateTuple<?> that = (ComposeStateTuple<?>) other;
    return s1 == that.s1 && s2 == that.s2 && filterState.equals(that.filterState);
  }

  @Override
  public int hashCode() {
    int h = 31 * s1 + s2;
    return 31 * h + filterState.hashCode();
  }

  @Override
  public String toString() {
    return "(" + s1 + ", " + s2 + ", " + filterState + ")";
  }
}
