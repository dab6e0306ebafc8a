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
import java.util.List;
import java.util.Objects;

import org.apache.lucene.util.InfoStream;
import org.wfst.fst.Fst;
import org.wfst.fst.FstProperties;
import org.wfst.fst.Labels;
import org.wfst.fst.StateIds;
import org.wfst.fst.Tr;
import org.wfst.lazy.FstOp;
import org.wfst.semiring.Semiring;

/**
 * Computes the composition of two FSTs one state at a time.  At each
 * composed state one operand is searched through its matcher while the
 * transitions of the other operand are enumerated, its implicit epsilon
 * self-loop first; the {@link ComposeFilter} decides which transition
 * pairs survive and which filter state they lead to.
 *
 * <p>All methods are synchronized: matchers and filters keep the state
 * they were last positioned on.
 *
 * @lucene.experimental
 */
public class ComposeFstOp<W, FS extends FilterState> implements FstOp<W> {

  /** Component name this operation logs under. */
  public static final String INFO_STREAM_COMPONENT = "COMPOSE";

  private final ComposeFilter<W, FS> filter;
  private final Matcher<W> matcher1;
  private final Matcher<W> matcher2;
  private final Fst<W> fst1;
  private final Fst<W> fst2;
  private final Semiring<W> semiring;
  private final MatchType matchType;
  private final ComposeStateTable<FS> stateTable = new ComposeStateTable<>();
  private final InfoStream infoStream;

  /**
   * @throws IllegalArgumentException if neither operand can be searched
   *         by its matcher, or if the operands do not share a semiring
   */
  public ComposeFstOp(ComposeFilterBuilder<W, FS, ? extends ComposeFilter<W, FS>> filterBuilder, InfoStream infoStream) {
    this.filter = filterBuilder.build();
    this.infoStream = Objects.requireNonNull(infoStream);
    SharedDataComposeFilter<W> sharedData = filter.getSharedData();
    this.matcher1 = sharedData.matcher1();
    this.matcher2 = sharedData.matcher2();
    this.fst1 = sharedData.fst1();
    this.fst2 = sharedData.fst2();
    if (fst1.semiring().equals(fst2.semiring()) == false) {
      throw new IllegalArgumentException("cannot compose FSTs over different semirings: "
          + fst1.semiring() + " and " + fst2.semiring());
    }
    this.semiring = fst1.semiring();
    this.matchType = matchType(matcher1, matcher2);
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "matcher1=" + matcher1 + " matcher2=" + matcher2 + " matchType=" + matchType);
    }
  }

  private static MatchType matchType(Matcher<?> matcher1, Matcher<?> matcher2) {
    MatchType type = matchType(matcher1.matchType(false), matcher2.matchType(false));
    if (type == null) {
      type = matchType(matcher1.matchType(true), matcher2.matchType(true));
    }
    if (type == null) {
      throw new IllegalArgumentException("cannot compose: neither the output labels of the first FST"
          + " nor the input labels of the second can be matched (sort?)");
    }
    return type;
  }

  private static MatchType matchType(MatchType type1, MatchType type2) {
    if (type1 == MatchType.MATCH_OUTPUT && type2 == MatchType.MATCH_INPUT) {
      return MatchType.MATCH_BOTH;
    } else if (type1 == MatchType.MATCH_OUTPUT) {
      return MatchType.MATCH_OUTPUT;
    } else if (type2 == MatchType.MATCH_INPUT) {
      return MatchType.MATCH_INPUT;
    }
    return null;
  }

  /** Returns {@link MatchType#MATCH_INPUT} when the second operand is searched, {@link MatchType#MATCH_OUTPUT} when the first is, or {@link MatchType#MATCH_BOTH} when it is decided per state. */
  public MatchType matchType() {
    return matchType;
  }

  /** Number of composed states discovered so far. */
  public int numStates() {
    return stateTable.size();
  }

  /** Returns the operand states and filter state behind composed state {@code state}. */
  public ComposeStateTuple<FS> tuple(int state) {
    return stateTable.tuple(state);
  }

  @Override
  public Semiring<W> semiring() {
    return semiring;
  }

  @Override
  public synchronized int computeStart() {
    int start1 = fst1.start();
    if (start1 == StateIds.NO_STATE_ID) {
      return StateIds.NO_STATE_ID;
    }
    int start2 = fst2.start();
    if (start2 == StateIds.NO_STATE_ID) {
      return StateIds.NO_STATE_ID;
    }
    return stateTable.findState(new ComposeStateTuple<>(start1, start2, filter.start()));
  }

  @Override
  public synchronized W computeFinalWeight(int state) {
    ComposeStateTuple<FS> tuple = stateTable.tuple(state);
    W final1 = matcher1.finalWeight(tuple.s1);
    if (final1 == null) {
      return null;
    }
    W final2 = matcher2.finalWeight(tuple.s2);
    if (final2 == null) {
      return null;
    }
    filter.setState(tuple.s1, tuple.s2, tuple.filterState);
    WeightPair<W> weights = new WeightPair<>(final1, final2);
    filter.filterFinal(weights);
    if (weights.weight1 == null || weights.weight2 == null) {
      return null;
    }
    W weight = semiring.times(weights.weight1, weights.weight2);
    return semiring.isZero(weight) ? null : weight;
  }

  @Override
  public synchronized List<Tr<W>> computeTrs(int state) {
    ComposeStateTuple<FS> tuple = stateTable.tuple(state);
    int s1 = tuple.s1;
    int s2 = tuple.s2;
    filter.setState(s1, s2, tuple.filterState);
    List<Tr<W>> trs = new ArrayList<>();
    boolean matchInput = matchInput(s1, s2);
    if (matchInput) {
      orderedExpand(trs, fst1, s1, matcher2, s2, true);
    } else {
      orderedExpand(trs, fst2, s2, matcher1, s1, false);
    }
    if (infoStream.isEnabled(INFO_STREAM_COMPONENT)) {
      infoStream.message(INFO_STREAM_COMPONENT, "expand state " + state + " " + tuple
          + " matching on " + (matchInput ? "fst2" : "fst1") + ": " + trs.size() + " trs");
    }
    return trs;
  }

  @Override
  public long properties() {
    // each composed transition advances at least one operand
    if (FstProperties.contains(fst1.properties(), FstProperties.ACYCLIC)
        && FstProperties.contains(fst2.properties(), FstProperties.ACYCLIC)) {
      return FstProperties.ACYCLIC;
    }
    return 0L;
  }

  // true when fst2 is searched through matcher2 while fst1's transitions are enumerated
  private boolean matchInput(int s1, int s2) {
    switch (matchType) {
      case MATCH_INPUT:
        return true;
      case MATCH_OUTPUT:
        return false;
      default:
        int priority1 = matcher1.priority(s1);
        int priority2 = matcher2.priority(s2);
        if (priority1 == Matcher.REQUIRE_PRIORITY && priority2 == Matcher.REQUIRE_PRIORITY) {
          throw new IllegalStateException("both matchers require to drive matching at state (" + s1 + ", " + s2 + ")");
        }
        if (priority1 == Matcher.REQUIRE_PRIORITY) {
          return false;
        }
        if (priority2 == Matcher.REQUIRE_PRIORITY) {
          return true;
        }
        return priority1 <= priority2;
    }
  }

  /**
   * Enumerates the transitions of {@code fstB} leaving {@code sb},
   * preceded by its epsilon self-loop, and searches each one's label in
   * {@code matcherA} at {@code sa}.
   */
  private void orderedExpand(List<Tr<W>> trs, Fst<W> fstB, int sb, Matcher<W> matcherA, int sa, boolean matchInput) {
    Tr<W> loop = matchInput
        ? new Tr<>(Labels.EPS_LABEL, Labels.NO_LABEL, semiring.one(), sb)
        : new Tr<>(Labels.NO_LABEL, Labels.EPS_LABEL, semiring.one(), sb);
    matchTr(trs, matcherA, sa, loop, matchInput);
    for (Tr<W> trB : fstB.getTrs(sb)) {
      matchTr(trs, matcherA, sa, trB, matchInput);
    }
  }

  private void matchTr(List<Tr<W>> trs, Matcher<W> matcherA, int sa, Tr<W> trB, boolean matchInput) {
    final int label = matchInput ? trB.olabel : trB.ilabel;
    final MatchType typeA = matchInput ? MatchType.MATCH_INPUT : MatchType.MATCH_OUTPUT;
    MatcherIterator<W> it = matcherA.iter(sa, label);
    MatcherItem<W> item;
    while ((item = it.next()) != null) {
      Tr<W> trA = item.toTr(sa, typeA, semiring);
      if (matchInput) {
        addTr(trs, trB, trA);
      } else {
        addTr(trs, trA, trB);
      }
    }
  }

  private void addTr(List<Tr<W>> trs, Tr<W> tr1, Tr<W> tr2) {
    FS next = filter.filterTr(tr1, tr2);
    if (next.isNoState()) {
      return;
    }
    int nextState = stateTable.findState(new ComposeStateTuple<>(tr1.nextState, tr2.nextState, next));
    trs.add(new Tr<>(tr1.ilabel, tr2.olabel, semiring.times(tr1.weight, tr2.weight), nextState));
  }

  @Override
  public String toString() {
    return "ComposeFstOp(" + matcher1 + ", " + matcher2 + ", " + matchType + ")";
  }
}
