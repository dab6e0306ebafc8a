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

import org.apache.lucene.util.InfoStream;
import org.wfst.fst.Fst;
import org.wfst.lazy.FstCache;
import org.wfst.lazy.HashMapFstCache;
import org.wfst.lazy.LazyFst;

/**
 * Lazy composition of two FSTs.  A state of the result is computed the
 * first time it is asked for and then answered from the cache; nothing
 * is computed up front.  With the default filter, a path of the result
 * exists for each distinct way of pairing a path of the first operand
 * with a path of the second on the first one's output labels, so
 * epsilon transitions do not create redundant paths.
 *
 * <p>The default matchers need the first operand sorted by output label
 * and the second by input label; one of the two is enough.
 *
 * @lucene.experimental
 */
public class ComposeFst<W> extends LazyFst<W> {

  /** Composes with the default {@link ComposeConfig}. */
  public static <W> ComposeFst<W> compose(Fst<W> fst1, Fst<W> fst2) {
    return compose(fst1, fst2, new ComposeConfig<>());
  }

  /**
   * Composes {@code fst1} with {@code fst2} using a {@link
   * SequenceComposeFilter}.
   *
   * @throws IllegalArgumentException if neither operand can be matched,
   *         typically because neither is sorted on the composed side
   */
  public static <W> ComposeFst<W> compose(Fst<W> fst1, Fst<W> fst2, ComposeConfig<W> config) {
    SequenceComposeFilterBuilder<W> builder = new SequenceComposeFilterBuilder<>(fst1, fst2, config.getMatcher1(), config.getMatcher2());
    FstCache<W> cache = config.getCache() != null ? config.getCache() : new HashMapFstCache<>();
    return new ComposeFst<>(builder, cache, config.getInfoStream());
  }

  /** Composes with any filter. */
  public <FS extends FilterState> ComposeFst(ComposeFilterBuilder<W, FS, ? extends ComposeFilter<W, FS>> filterBuilder,
                                             FstCache<W> cache, InfoStream infoStream) {
    super(new ComposeFstOp<>(filterBuilder, infoStream), cache);
  }

  /** The operation computing composed states. */
  @Override
  public ComposeFstOp<W, ?> op() {
    return (ComposeFstOp<W, ?>) op;
  }

  @Override
  public String toString() {
    return "ComposeFst(" + op + ", " + cache + ")";
  }
}
