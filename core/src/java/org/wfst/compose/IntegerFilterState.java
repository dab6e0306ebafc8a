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
 * {@link FilterState} holding a small non-negative int, plus the blocked
 * sentinel which is distinct from every value.
 *
 * @lucene.experimental
 */
public final class IntegerFilterState implements FilterState {

  private static final IntegerFilterState NO_STATE = new IntegerFilterState(-1);

  private static final IntegerFilterState[] CACHE = new IntegerFilterState[] {
      new IntegerFilterState(0), new IntegerFilterState(1), new IntegerFilterState(2)
  };

  private final int value;

  private IntegerFilterState(int value) {
    this.value = value;
  }

  public static IntegerFilterState of(int value) {
    if (value < 0) {
      throw new IllegalArgumentException("filter state value must be >= 0; got " + value);
    }
    return value < CACHE.length ? CACHE[value] : new IntegerFilterState(value);
  }

  public static IntegerFilterState noState() {
    return NO_STATE;
  }

  @Override
  public boolean isNoState() {
    return value == -1;
  }

  /** Returns the value; not defined for the blocked sentinel. */
  public int value() {
    assert isNoState() == false;
    return value;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof IntegerFilterState && ((IntegerFilterState) other).value == value;
  }

  @Override
  public int hashCode() {
    return value;
  }

  @Override
  public String toString() {
    return isNoState() ? "NoState" : Integer.toString(value);
  }
}
