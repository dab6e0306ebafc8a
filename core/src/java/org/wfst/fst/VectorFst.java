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

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import org.apache.lucene.util.Accountable;
import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.RamUsageEstimator;
import org.wfst.queue.FifoQueue;
import org.wfst.queue.StateQueue;
import org.wfst.semiring.Semiring;

// TODO
//   - could pack labels and destinations into parallel int[] arrays,
//     keeping only the weights as objects

/** Mutable, fully expanded FST.  States are ints created using {@link
 *  #addState}.  Mark a state as accepting using {@link #setFinal}.  Add
 *  transitions using {@link #addTr}, in any state order; the sortedness
 *  and epsilon properties are kept up to date as transitions are added,
 *  and {@link #sortTrs} sorts them for the sorted matchers.
 *
 * @lucene.experimental */
public class VectorFst<W> implements ExpandedFst<W>, Accountable {

  private static final long BASE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(VectorFst.class);
  private static final long STATE_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(VectorState.class);
  private static final long TR_RAM_BYTES_USED = RamUsageEstimator.shallowSizeOfInstance(Tr.class);

  /** Orders transitions by input label, then output label. */
  public static final Comparator<Tr<?>> ILABEL_COMPARATOR = (a, b) -> {
    int cmp = Integer.compare(a.ilabel, b.ilabel);
    return cmp != 0 ? cmp : Integer.compare(a.olabel, b.olabel);
  };

  /** Orders transitions by output label, then input label. */
  public static final Comparator<Tr<?>> OLABEL_COMPARATOR = (a, b) -> {
    int cmp = Integer.compare(a.olabel, b.olabel);
    return cmp != 0 ? cmp : Integer.compare(a.ilabel, b.ilabel);
  };

  private final Semiring<W> semiring;

  private VectorState<W>[] states;

  private int numStates;

  private int start = StateIds.NO_STATE_ID;

  private long properties = FstProperties.EMPTY_PROPERTIES;

  /** Sole constructor; creates an FST with no states. */
  public VectorFst(Semiring<W> semiring) {
    this.semiring = Objects.requireNonNull(semiring);
    @SuppressWarnings("unchecked") VectorState<W>[] initial = (VectorState<W>[]) new VectorState[4];
    states = initial;
  }

  /** Create a new state. */
  public int addState() {
    if (numStates == states.length) {
      states = Arrays.copyOf(states, ArrayUtil.oversize(numStates + 1, RamUsageEstimator.NUM_BYTES_OBJECT_REF));
    }
    states[numStates] = new VectorState<>();
    return numStates++;
  }

  public void setStart(int state) {
    Objects.checkIndex(state, numStates);
    start = state;
  }

  /** Sets the final weight of this state; null or {@link Semiring#zero} makes it non-accepting. */
  public void setFinal(int state, W weight) {
    Objects.checkIndex(state, numStates);
    states[state].finalWeight = weight == null || semiring.isZero(weight) ? null : weight;
  }

  /** Add a new transition leaving {@code state}. */
  public void addTr(int state, Tr<W> tr) {
    Objects.checkIndex(state, numStates);
    Objects.checkIndex(tr.nextState, numStates);
    if (Labels.isValid(tr.ilabel) == false || Labels.isValid(tr.olabel) == false) {
      throw new IllegalArgumentException("invalid label on transition " + tr);
    }
    VectorState<W> s = states[state];
    if (s.numTrs > 0) {
      Tr<W> prev = s.trs[s.numTrs - 1];
      if (prev.ilabel > tr.ilabel) {
        properties = (properties & ~FstProperties.I_LABEL_SORTED) | FstProperties.NOT_I_LABEL_SORTED;
      }
      if (prev.olabel > tr.olabel) {
        properties = (properties & ~FstProperties.O_LABEL_SORTED) | FstProperties.NOT_O_LABEL_SORTED;
      }
    }
    if (tr.ilabel == Labels.EPS_LABEL) {
      s.numInputEpsilons++;
      properties = (properties & ~FstProperties.NO_I_EPSILONS) | FstProperties.I_EPSILONS;
    }
    if (tr.olabel == Labels.EPS_LABEL) {
      s.numOutputEpsilons++;
      properties = (properties & ~FstProperties.NO_O_EPSILONS) | FstProperties.O_EPSILONS;
    }
    if (tr.nextState == state) {
      properties = (properties & ~FstProperties.ACYCLIC) | FstProperties.CYCLIC;
    } else {
      // May have closed a cycle; no longer known either way unless already cyclic:
      properties &= ~FstProperties.ACYCLIC;
    }
    s.add(tr);
  }

  /**
   * Sorts the transitions of every state.  With {@link #ILABEL_COMPARATOR}
   * or {@link #OLABEL_COMPARATOR} the matching sorted property is set.
   */
  public void sortTrs(Comparator<? super Tr<W>> comparator) {
    for (int state = 0; state < numStates; state++) {
      VectorState<W> s = states[state];
      ArrayUtil.timSort(s.trs, 0, s.numTrs, comparator);
    }
    long sortedBits = FstProperties.I_LABEL_SORTED | FstProperties.NOT_I_LABEL_SORTED
        | FstProperties.O_LABEL_SORTED | FstProperties.NOT_O_LABEL_SORTED;
    properties &= ~sortedBits;
    Object c = comparator;
    if (c == ILABEL_COMPARATOR) {
      properties |= FstProperties.I_LABEL_SORTED;
    } else if (c == OLABEL_COMPARATOR) {
      properties |= FstProperties.O_LABEL_SORTED;
    }
  }

  /** Replaces the known properties with ones computed over every state. */
  public long computeProperties() {
    properties = FstProperties.compute(this);
    return properties;
  }

  @Override
  public Semiring<W> semiring() {
    return semiring;
  }

  @Override
  public int start() {
    return start;
  }

  @Override
  public W finalWeight(int state) {
    return states[state].finalWeight;
  }

  @Override
  public List<Tr<W>> getTrs(int state) {
    VectorState<W> s = states[state];
    return Collections.unmodifiableList(Arrays.asList(s.trs).subList(0, s.numTrs));
  }

  @Override
  public int numTrs(int state) {
    return states[state].numTrs;
  }

  @Override
  public int numInputEpsilons(int state) {
    return states[state].numInputEpsilons;
  }

  @Override
  public int numOutputEpsilons(int state) {
    return states[state].numOutputEpsilons;
  }

  @Override
  public long properties() {
    return properties;
  }

  /** How many states this FST has. */
  @Override
  public int numStates() {
    return numStates;
  }

  /** How many transitions this FST has. */
  public int numTrs() {
    int count = 0;
    for (int state = 0; state < numStates; state++) {
      count += states[state].numTrs;
    }
    return count;
  }

  @Override
  public long ramBytesUsed() {
    long bytes = BASE_RAM_BYTES_USED
        + RamUsageEstimator.alignObjectSize(RamUsageEstimator.NUM_BYTES_ARRAY_HEADER + (long) RamUsageEstimator.NUM_BYTES_OBJECT_REF * states.length);
    for (int state = 0; state < numStates; state++) {
      VectorState<W> s = states[state];
      bytes += STATE_RAM_BYTES_USED
          + RamUsageEstimator.alignObjectSize(RamUsageEstimator.NUM_BYTES_ARRAY_HEADER + (long) RamUsageEstimator.NUM_BYTES_OBJECT_REF * s.trs.length)
          + TR_RAM_BYTES_USED * s.numTrs;
    }
    return bytes;
  }

  /** Returns the dot (graphviz) representation of this FST.
   *  This is extremely useful for visualizing the FST. */
  public String toDot() {
    StringBuilder b = new StringBuilder();
    b.append("digraph FST {\n");
    b.append("  rankdir = LR\n");
    b.append("  node [width=0.2, height=0.2, fontsize=8]\n");
    if (start != StateIds.NO_STATE_ID) {
      b.append("  initial [shape=plaintext,label=\"\"]\n");
      b.append("  initial -> ").append(start).append('\n');
    }
    for (int state = 0; state < numStates; state++) {
      VectorState<W> s = states[state];
      b.append("  ").append(state);
      if (s.finalWeight != null) {
        b.append(" [shape=doublecircle,label=\"").append(state).append('/')
            .append(semiring.weightToString(s.finalWeight)).append("\"]\n");
      } else {
        b.append(" [shape=circle,label=\"").append(state).append("\"]\n");
      }
      for (int i = 0; i < s.numTrs; i++) {
        Tr<W> tr = s.trs[i];
        b.append("  ").append(state).append(" -> ").append(tr.nextState);
        b.append(" [label=\"").append(Labels.toString(tr.ilabel)).append(':').append(Labels.toString(tr.olabel));
        if (semiring.isOne(tr.weight) == false) {
          b.append('/').append(semiring.weightToString(tr.weight));
        }
        b.append("\"]\n");
      }
    }
    b.append('}');
    return b.toString();
  }

  /**
   * Copies every state reachable from the start state of {@code fst},
   * keeping state ids.  Works on lazy FSTs too: states are visited
   * breadth first, each one asked once for its transitions and final
   * weight.
   */
  public static <W> VectorFst<W> copyOf(Fst<W> fst) {
    VectorFst<W> copy = new VectorFst<>(fst.semiring());
    int start = fst.start();
    if (start == StateIds.NO_STATE_ID) {
      return copy;
    }
    copy.ensureState(start);
    copy.setStart(start);
    StateQueue queue = new FifoQueue();
    queue.enqueue(start);
    boolean[] enqueued = new boolean[start + 1];
    enqueued[start] = true;
    while (queue.isEmpty() == false) {
      int state = queue.head();
      queue.dequeue();
      copy.setFinal(state, fst.finalWeight(state));
      for (Tr<W> tr : fst.getTrs(state)) {
        copy.ensureState(tr.nextState);
        if (tr.nextState >= enqueued.length) {
          enqueued = Arrays.copyOf(enqueued, ArrayUtil.oversize(tr.nextState + 1, 1));
        }
        if (enqueued[tr.nextState] == false) {
          enqueued[tr.nextState] = true;
          queue.enqueue(tr.nextState);
        }
        copy.addTr(state, tr);
      }
    }
    return copy;
  }

  private void ensureState(int state) {
    while (numStates <= state) {
      addState();
    }
  }

  private static final class VectorState<W> {
    W finalWeight;
    @SuppressWarnings("unchecked") Tr<W>[] trs = (Tr<W>[]) new Tr[2];
    int numTrs;
    int numInputEpsilons;
    int numOutputEpsilons;

    void add(Tr<W> tr) {
      if (numTrs == trs.length) {
        trs = Arrays.copyOf(trs, ArrayUtil.oversize(numTrs + 1, RamUsageEstimator.NUM_BYTES_OBJECT_REF));
      }
      trs[numTrs++] = tr;
    }
  }
}
