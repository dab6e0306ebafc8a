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

import org.apache.lucene.util.LuceneTestCase;
import org.wfst.fst.FstTestUtil.CountingFst;
import org.wfst.fst.Labels;
import org.wfst.fst.Tr;
import org.wfst.fst.VectorFst;
import org.wfst.semiring.TropicalSemiring;

public class TestSequenceComposeFilter extends LuceneTestCase {

  private static final TropicalSemiring SR = TropicalSemiring.getSingleton();

  private static final int ALL_EPS = 0;
  private static final int NO_EPS = 1;
  private static final int MIXED = 2;
  private static final int ALL_EPS_FINAL = 3;
  private static final int SINK = 4;

  private static VectorFst<Float> first() {
    VectorFst<Float> fst = new VectorFst<>(SR);
    for (int i = 0; i <= SINK; i++) {
      fst.addState();
    }
    fst.setStart(ALL_EPS);
    fst.addTr(ALL_EPS, new Tr<>(1, 0, 0f, SINK));
    fst.addTr(ALL_EPS, new Tr<>(2, 0, 0f, SINK));
    fst.addTr(NO_EPS, new Tr<>(1, 5, 0f, SINK));
    fst.addTr(MIXED, new Tr<>(1, 0, 0f, SINK));
    fst.addTr(MIXED, new Tr<>(1, 6, 0f, SINK));
    fst.addTr(ALL_EPS_FINAL, new Tr<>(1, 0, 0f, SINK));
    fst.setFinal(ALL_EPS_FINAL, 0f);
    fst.setFinal(SINK, 0f);
    fst.sortTrs(VectorFst.OLABEL_COMPARATOR);
    return fst;
  }

  private static VectorFst<Float> second() {
    VectorFst<Float> fst = new VectorFst<>(SR);
    int s = fst.addState();
    fst.setStart(s);
    fst.setFinal(s, 0f);
    fst.addTr(s, new Tr<>(0, 7, 0f, s));
    fst.addTr(s, new Tr<>(5, 8, 0f, s));
    return fst;
  }

  private static final Tr<Float> LOOP1 = Matcher.epsLoop(0, MatchType.MATCH_OUTPUT, SR);
  private static final Tr<Float> LOOP2 = Matcher.epsLoop(0, MatchType.MATCH_INPUT, SR);
  private static final Tr<Float> EPS_OUT1 = new Tr<>(1, 0, 0f, SINK);
  private static final Tr<Float> REAL1 = new Tr<>(1, 5, 0f, SINK);
  private static final Tr<Float> EPS_IN2 = new Tr<>(0, 7, 0f, 0);
  private static final Tr<Float> REAL2 = new Tr<>(5, 8, 0f, 0);

  private static SequenceComposeFilter<Float> newFilter() {
    return new SequenceComposeFilterBuilder<>(first(), second()).build();
  }

  public void testStart() {
    assertEquals(SequenceComposeFilter.NEUTRAL, newFilter().start());
    assertEquals(0, newFilter().start().value());
  }

  public void testSecondMovesAlone() {
    SequenceComposeFilter<Float> filter = newFilter();
    for (IntegerFilterState fs : new IntegerFilterState[] {SequenceComposeFilter.NEUTRAL, SequenceComposeFilter.PENDING}) {
      filter.setState(ALL_EPS, 0, fs);
      assertTrue(filter.filterTr(LOOP1, EPS_IN2).isNoState());
      filter.setState(NO_EPS, 0, fs);
      assertEquals(SequenceComposeFilter.NEUTRAL, filter.filterTr(LOOP1, EPS_IN2));
      filter.setState(MIXED, 0, fs);
      assertEquals(SequenceComposeFilter.PENDING, filter.filterTr(LOOP1, EPS_IN2));
      filter.setState(ALL_EPS_FINAL, 0, fs);
      assertEquals(SequenceComposeFilter.PENDING, filter.filterTr(LOOP1, EPS_IN2));
      filter.setState(SINK, 0, fs);
      assertEquals(SequenceComposeFilter.NEUTRAL, filter.filterTr(LOOP1, EPS_IN2));
    }
  }

  public void testFirstMovesAlone() {
    SequenceComposeFilter<Float> filter = newFilter();
    filter.setState(MIXED, 0, SequenceComposeFilter.NEUTRAL);
    assertEquals(SequenceComposeFilter.NEUTRAL, filter.filterTr(EPS_OUT1, LOOP2));
    filter.setState(MIXED, 0, SequenceComposeFilter.PENDING);
    assertTrue(filter.filterTr(EPS_OUT1, LOOP2).isNoState());
  }

  public void testBothMove() {
    SequenceComposeFilter<Float> filter = newFilter();
    for (IntegerFilterState fs : new IntegerFilterState[] {SequenceComposeFilter.NEUTRAL, SequenceComposeFilter.PENDING}) {
      filter.setState(MIXED, 0, fs);
      assertTrue(filter.filterTr(EPS_OUT1, EPS_IN2).isNoState());
      filter.setState(NO_EPS, 0, fs);
      assertEquals(SequenceComposeFilter.NEUTRAL, filter.filterTr(REAL1, REAL2));
    }
  }

  /** Once pending, only the second operand may move alone, until a real match resets the filter. */
  public void testPendingBlocksFirstOperand() {
    VectorFst<Float> fst1 = first();
    SequenceComposeFilter<Float> filter = new SequenceComposeFilterBuilder<>(fst1, second()).build();
    for (int iter = 0; iter < atLeast(100); iter++) {
      int s1 = random().nextInt(SINK + 1);
      IntegerFilterState fs = filter.start();
      List<String> moves = new ArrayList<>();
      for (int step = 0; step < 10 && fs.isNoState() == false; step++) {
        filter.setState(s1, 0, fs);
        int kind = random().nextInt(3);
        IntegerFilterState next;
        if (kind == 0) {
          next = filter.filterTr(LOOP1, EPS_IN2);
          moves.add("second");
        } else if (kind == 1 && fst1.numOutputEpsilons(s1) > 0) {
          next = filter.filterTr(EPS_OUT1, LOOP2);
          moves.add("first");
          if (fs.equals(SequenceComposeFilter.PENDING)) {
            assertTrue(moves.toString(), next.isNoState());
          }
        } else {
          next = filter.filterTr(REAL1, REAL2);
          moves.add("both");
          assertEquals(SequenceComposeFilter.NEUTRAL, next);
        }
        fs = next;
      }
    }
  }

  public void testFinalWeightsUnchanged() {
    SequenceComposeFilter<Float> filter = newFilter();
    filter.setState(SINK, 0, SequenceComposeFilter.NEUTRAL);
    WeightPair<Float> weights = new WeightPair<>(1.5f, 2.5f);
    filter.filterFinal(weights);
    assertEquals(1.5f, weights.weight1, 0f);
    assertEquals(2.5f, weights.weight2, 0f);
  }

  public void testSetStateMemoized() {
    CountingFst<Float> fst1 = new CountingFst<>(first());
    SequenceComposeFilter<Float> filter = new SequenceComposeFilterBuilder<>(fst1, second()).build();
    filter.setState(MIXED, 0, SequenceComposeFilter.NEUTRAL);
    int calls = fst1.total();
    assertTrue(calls > 0);
    filter.setState(MIXED, 0, SequenceComposeFilter.NEUTRAL);
    filter.setState(MIXED, 0, IntegerFilterState.of(0));
    assertEquals(calls, fst1.total());
    filter.setState(MIXED, 0, SequenceComposeFilter.PENDING);
    assertTrue(fst1.total() > calls);
    calls = fst1.total();
    filter.setState(NO_EPS, 0, SequenceComposeFilter.PENDING);
    assertTrue(fst1.total() > calls);
  }

  public void testBuilder() {
    VectorFst<Float> fst1 = first();
    VectorFst<Float> fst2 = second();
    SequenceComposeFilterBuilder<Float> builder = new SequenceComposeFilterBuilder<>(fst1, fst2);
    SharedDataComposeFilter<Float> shared = builder.getSharedData();
    assertSame(fst1, shared.fst1());
    assertSame(fst2, shared.fst2());
    assertEquals(MatchType.MATCH_OUTPUT, shared.matcher1().matchType(false));
    assertTrue(shared.matcher1() instanceof SortedMatcher);
    assertTrue(shared.matcher2() instanceof SortedMatcher);

    SequenceComposeFilter<Float> a = builder.build();
    SequenceComposeFilter<Float> b = builder.build();
    assertNotSame(a, b);
    assertSame(shared, a.getSharedData());
    assertSame(shared, b.getSharedData());

    LinearMatcher<Float> linear = new LinearMatcher<>(fst2, MatchType.MATCH_INPUT);
    builder = new SequenceComposeFilterBuilder<>(fst1, fst2, null, linear);
    assertSame(linear, builder.getSharedData().matcher2());

    expectThrows(IllegalArgumentException.class,
        () -> new SequenceComposeFilterBuilder<>(fst1, fst2, new LinearMatcher<>(fst2, MatchType.MATCH_OUTPUT), null));
  }

  public void testIntegerFilterState() {
    assertSame(IntegerFilterState.of(1), IntegerFilterState.of(1));
    assertEquals(IntegerFilterState.of(17), IntegerFilterState.of(17));
    assertFalse(IntegerFilterState.of(0).equals(IntegerFilterState.of(1)));
    assertTrue(IntegerFilterState.noState().isNoState());
    assertFalse(IntegerFilterState.of(0).isNoState());
    assertFalse(IntegerFilterState.noState().equals(IntegerFilterState.of(0)));
    expectThrows(IllegalArgumentException.class, () -> IntegerFilterState.of(-1));
    assertEquals(Labels.NO_LABEL, LOOP1.olabel);
    assertEquals(Labels.NO_LABEL, LOOP2.ilabel);
  }
}
