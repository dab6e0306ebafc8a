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
package org.wfst.lazy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.wfst.fst.Labels;
import org.wfst.fst.Tr;

/** Cached transitions of one state, with the epsilon counts taken once at insert time. */
final class CacheTrs<W> {

  final List<Tr<W>> trs;
  final int numInputEpsilons;
  final int numOutputEpsilons;
  final int maxNextState;

  CacheTrs(List<Tr<W>> trs) {
    this.trs = Collections.unmodifiableList(new ArrayList<>(trs));
    int ni = 0;
    int no = 0;
    int max = -1;
    for (Tr<W> tr : this.trs) {
      if (tr.ilabel == Labels.EPS_LABEL) {
        ni++;
      }
      if (tr.olabel == Labels.EPS_LABEL) {
        no++;
      }
      max = Math.max(max, tr.nextState);
    }
    this.numInputEpsilons = ni;
    this.numOutputEpsilons = no;
    this.maxNextState = max;
  }
}
