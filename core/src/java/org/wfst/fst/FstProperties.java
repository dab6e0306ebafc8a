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

import java.util.List;

/**
 * Structural properties of an FST, as {@code long} bits.  Each property
 * comes with a bit for its negation so that "unknown" (both clear) can
 * be told apart from "false".
 *
 * @lucene.experimental
 */
public final class FstProperties {

  public static final long ACYCLIC = 1L;
  public static final long CYCLIC = 1L << 1;

  /** Transitions of every state are sorted by input label. */
  public static final long I_LABEL_SORTED = 1L << 2;
  public static final long NOT_I_LABEL_SORTED = 1L << 3;

  /** Transitions of every state are sorted by output label. */
  public static final long O_LABEL_SORTED = 1L << 4;
  public static final long NOT_O_LABEL_SORTED = 1L << 5;

  public static final long I_EPSILONS = 1L << 6;
  public static final long NO_I_EPSILONS = 1L << 7;

  public static final long O_EPSILONS = 1L << 8;
  public static final long NO_O_EPSILONS = 1L << 9;

  /** Every property this class knows how to compute. */
  public static final long ALL = ACYCLIC | CYCLIC
      | I_LABEL_SORTED | NOT_I_LABEL_SORTED
      | O_LABEL_SORTED | NOT_O_LABEL_SORTED
      | I_EPSILONS | NO_I_EPSILONS
      | O_EPSILONS | NO_O_EPSILONS;

  /** Properties of an FST without transitions. */
  public static final long EMPTY_PROPERTIES = ACYCLIC | I_LABEL_SORTED | O_LABEL_SORTED | NO_I_EPSILONS | NO_O_EPSILONS;

  private FstProperties() {
  }

  /** Returns true if every bit of {@code mask} is set in {@code props}. */
  public static boolean contains(long props, long mask) {
    return (props & mask) == mask;
  }

  /** Tests every property on {@code fst}, visiting all of its states. */
  public static long compute(ExpandedFst<?> fst) {
    long props = 0;
    boolean iSorted = true;
    boolean oSorted = true;
    boolean iEps = false;
    boolean oEps = false;
    final int numStates = fst.numStates();
    for (int state = 0; state < numStates; state++) {
      List<? extends Tr<?>> trs = fst.getTrs(state);
      int prevI = Integer.MIN_VALUE;
      int prevO = Integer.MIN_VALUE;
      for (Tr<?> tr : trs) {
        if (tr.ilabel < prevI) {
          iSorted = false;
        }
        if (tr.olabel < prevO) {
          oSorted = false;
        }
        if (tr.ilabel == Labels.EPS_LABEL) {
          iEps = true;
        }
        if (tr.olabel == Labels.EPS_LABEL) {
          oEps = true;
        }
        prevI = tr.ilabel;
        prevO = tr.olabel;
      }
    }
    props |= iSorted ? I_LABEL_SORTED : NOT_I_LABEL_SORTED;
    props |= oSorted ? O_LABEL_SORTED : NOT_O_LABEL_SORTED;
    props |= iEps ? I_EPSILONS : NO_I_EPSILONS;
    props |= oEps ? O_EPSILONS : NO_O_EPSILONS;
    props |= TopSort.isAcyclic(fst) ? ACYCLIC : CYCLIC;
    return props;
  }
}
