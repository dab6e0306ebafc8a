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

/**
 * Reserved label values.  Real labels are non-negative; label {@code 0}
 * is the epsilon symbol.
 *
 * @lucene.experimental
 */
public final class Labels {

  /** The epsilon label: no symbol is consumed on this side. */
  public static final int EPS_LABEL = 0;

  /**
   * Marks a transition synthesized during composition to represent a
   * one-sided move.  Never stored in an FST.
   */
  public static final int NO_LABEL = -1;

  private Labels() {
  }

  /** Returns true if {@code label} may be stored on a transition. */
  public static boolean isValid(int label) {
    return label >= 0;
  }

  public static String toString(int label) {
    if (label == EPS_LABEL) {
      return "<eps>";
    } else if (label == NO_LABEL) {
      return "<none>";
    }
    return Integer.toString(label);
  }
}
