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
package org.wfst.fst;

import java.util.Objects;

/**
 * Holds one transition of an FST: the input label, output label and
 * weight of the move, and the destination state.  Instances are
 * immutable and compare by value.
 *
 * @lucene.experimental
 */
public final class Tr<W> {

  /** Input label. */
  public final int ilabel;

  /** Output label. */
  public final int olabel;

  /** Weight of this transition. */
  public final W weight;

  /** Destination state. */
  public final int nextState;

  public Tr(int ilabel, int olabel, W weight, int nextState) {
    this.ilabel = ilabel;
    this.olabel = olabel;
    this.weight = Objects.requireNonNull(weight, "weight");
    this.nextState = nextState;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (other instanceof Tr == false) {
      return false;
    }
    Tr<?> that = (Tr<?>) other;
    return ilabel == that.ilabel
        && olabel == that.olabel
        && nextState == that.nextState
        && weight.equals(that.weight);
  }

  @Override
  public int hashCode() {
    int h = ilabel;
    h = 31 * h + olabel;
    h = 31 * h + nextState;
    return 31 * h + weight.hashCode();
  }

  @Override
  public String toString() {
    return Labels.toString(ilabel) + ":" + Labels.toString(olabel) + "/" + weight + " -> " + nextState;
  }
}
