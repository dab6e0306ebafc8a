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

import org.apache.lucene.util.ArrayUtil;
import org.apache.lucene.util.FixedBitSet;

/**
 * Depth-first topological sort of all states of an expanded FST.
 *
 * @lucene.experimental
 */
public final class TopSort {

  private TopSort() {
  }

  /**
   * Returns {@code order} with {@code order[state]} the topological rank
   * of {@code state}: every transition goes from a lower rank to a higher
   * one.  The start state is explored first, then every state that is
   * not reachable from it, by increasing id.
   *
   * @throws IllegalArgumentException if {@code fst} has a cycle
   */
  public static int[] sortStates(ExpandedFst<?> fst) {
    int[] order = new int[fst.numStates()];
    if (dfs(fst, order) == false) {
      throw new IllegalArgumentException("FST has cycles; cannot sort its states topologically");
    }
    return order;
  }

  /** Returns true if {@code fst} has no cycle. */
  public static boolean isAcyclic(ExpandedFst<?> fst) {
    return dfs(fst, new int[fst.numStates()]);
  }

  // Iterative: a recursive walk overflows the stack on long chains.
  private static boolean dfs(ExpandedFst<?> fst, int[] order) {
    final int numStates = fst.numStates();
    if (numStates == 0) {
      return true;
    }
    final FixedBitSet visited = new FixedBitSet(numStates);
    final FixedBitSet onStack = new FixedBitSet(numStates);
    int[] stack = new int[8];
    int[] trUpto = new int[8];
    int finished = 0;

    int root = fst.start() == StateIds.NO_STATE_ID ? 0 : fst.start();
    int nextRoot = 0;
    while (true) {
      if (visited.get(root) == false) {
        int depth = 0;
        stack[0] = root;
        trUpto[0] = 0;
        visited.set(root);
        onStack.set(root);
        while (depth >= 0) {
          int state = stack[depth];
          List<? extends Tr<?>> trs = fst.getTrs(state);
          if (trUpto[depth] < trs.size()) {
            int dest = trs.get(trUpto[depth]++).nextState;
            if (onStack.get(dest)) {
              return false;
            }
            if (visited.get(dest) == false) {
              visited.set(dest);
              onStack.set(dest);
              depth++;
              if (depth == stack.length) {
                stack = ArrayUtil.grow(stack, depth + 1);
                trUpto = ArrayUtil.grow(trUpto, depth + 1);
              }
              stack[depth] = dest;
              trUpto[depth] = 0;
            }
          } else {
            onStack.clear(state);
            // Finishing order reversed is a topological order:
            order[state] = numStates - 1 - finished;
            finished++;
            depth--;
          }
        }
      }
      while (nextRoot < numStates && visited.get(nextRoot)) {
        nextRoot++;
      }
      if (nextRoot == numStates) {
        break;
      }
      root = nextRoot;
    }
    assert finished == numStates;
    return true;
  }
}
