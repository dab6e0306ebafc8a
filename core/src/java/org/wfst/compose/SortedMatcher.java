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

import java.util.List;

import org.wfst.fst.ExpandedFst;
import org.wfst.fst.Fst;
import org.wfst.fst.FstProperties;
import org.wfst.fst.Labels;
import org.wfst.fst.Tr;

/**
 * {@link Matcher} for an FST whose transitions are sorted on the matched
 * side.  The first candidate is located by binary search, the following
 * ones are read in order until the label changes.
 *
 * <p>The matcher remembers the state it was last positioned on and its
 * transition list, so the transitions of a state are fetched once for
 * {@link #priority} and the queries that follow it.  The pair is published
 * as one immutable holder, so a matcher may be shared across threads.
 *
 * @lucene.experimental
 */
public class SortedMatcher<W> implements Matcher<W> {

  private final Fst<W> fst;
  private final MatchType matchType;

  private static final class Position<W> {
    final int state;
    final List<Tr<W>> trs;

    Position(int state, List<Tr<W>> trs) {
      this.state = state;
      this.trs = trs;
    }
  }

  private volatile Position<W> position;

  /**
   * @throws IllegalArgumentException unless {@code matchType} is {@link
   *         MatchType#MATCH_INPUT} or {@link MatchType#MATCH_OUTPUT}
   */
  public SortedMatcher(Fst<W> fst, MatchType matchType) {
    if (matchType != MatchType.MATCH_INPUT && matchType != MatchType.MATCH_OUTPUT) {
      throw new IllegalArgumentException("SortedMatcher cannot match with " + matchType);
    }
    this.fst = fst;
    this.matchType = matchType;
  }

  private List<Tr<W>> setState(int s) {
    Position<W> current = position;
    if (current == null || current.state != s) {
      current = new Position<>(s, fst.getTrs(s));
      position = current;
    }
    return current.trs;
  }

  private int label(Tr<W> tr) {
    return matchType == MatchType.MATCH_INPUT ? tr.ilabel : tr.olabel;
  }

  @Override
  public Fst<W> fst() {
    return fst;
  }

  @Override
  public MatcherIterator<W> iter(int s, int label) {
    final List<Tr<W>> stateTrs = setState(s);
    final int matchLabel = label == Labels.NO_LABEL ? Labels.EPS_LABEL : label;
    // Binary search for the first transition carrying matchLabel:
    int low = 0;
    int high = stateTrs.size();
    while (low < high) {
      int mid = (low + high) >>> 1;
      if (label(stateTrs.get(mid)) < matchLabel) {
        low = mid + 1;
      } else {
        high = mid;
      }
    }
    final int first = low;
    return new MatcherIterator<W>() {
      boolean loop = label == Labels.EPS_LABEL;
      int pos = first;

      @Override
      public MatcherItem<W> next() {
        if (loop) {
          loop = false;
          return MatcherItem.epsLoop();
        }
        if (pos < stateTrs.size()) {
          Tr<W> tr = stateTrs.get(pos);
          if (label(tr) == matchLabel) {
            pos++;
            return MatcherItem.of(tr);
          }
        }
        return null;
      }
    };
  }

  @Override
  public W finalWeight(int s) {
    return fst.finalWeight(s);
  }

  @Override
  public MatchType matchType(boolean test) {
    final long trueProp = matchType == MatchType.MATCH_INPUT ? FstProperties.I_LABEL_SORTED : FstProperties.O_LABEL_SORTED;
    final long falseProp = matchType == MatchType.MATCH_INPUT ? FstProperties.NOT_I_LABEL_SORTED : FstProperties.NOT_O_LABEL_SORTED;
    long props = fst.properties();
    if (test && (props & (trueProp | falseProp)) == 0 && fst instanceof ExpandedFst) {
      props = FstProperties.compute((ExpandedFst<W>) fst);
    }
    if ((props & trueProp) != 0) {
      return matchType;
    } else if ((props & falseProp) != 0) {
      return MatchType.MATCH_NONE;
    } else {
      return MatchType.MATCH_UNKNOWN;
    }
  }

  @Override
  public MatcherFlags flags() {
    return MatcherFlags.EMPTY;
  }

  @Override
  public int priority(int s) {
    return setState(s).size();
  }

  @Override
  public String toString() {
    return "SortedMatcher(" + matchType + ")";
  }
}
