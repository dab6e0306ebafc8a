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

import java.util.Objects;

import org.apache.lucene.util.InfoStream;
import org.wfst.lazy.FstCache;
import org.wfst.lazy.HashMapFstCache;

/**
 * Holds the settings used by {@link ComposeFst#compose(org.wfst.fst.Fst,
 * org.wfst.fst.Fst, ComposeConfig)}.  Setters return this config, so
 * calls can be chained:
 *
 * <pre class="prettyprint">
 * ComposeConfig&lt;Float&gt; conf = new ComposeConfig&lt;Float&gt;()
 *     .setMatcher2(new LinearMatcher&lt;&gt;(fst2, MatchType.MATCH_INPUT))
 *     .setInfoStream(new PrintStreamInfoStream(System.out));
 * </pre>
 *
 * @lucene.experimental
 */
public final class ComposeConfig<W> {

  private Matcher<W> matcher1;
  private Matcher<W> matcher2;
  private FstCache<W> cache;
  private InfoStream infoStream = InfoStream.getDefault();

  /** Creates a config with the default matchers, a fresh {@link HashMapFstCache} per composition and the default {@link InfoStream}. */
  public ComposeConfig() {
  }

  /** Matcher over the first operand; null (the default) means a {@link SortedMatcher} on output labels. */
  public ComposeConfig<W> setMatcher1(Matcher<W> matcher1) {
    this.matcher1 = matcher1;
    return this;
  }

  public Matcher<W> getMatcher1() {
    return matcher1;
  }

  /** Matcher over the second operand; null (the default) means a {@link SortedMatcher} on input labels. */
  public ComposeConfig<W> setMatcher2(Matcher<W> matcher2) {
    this.matcher2 = matcher2;
    return this;
  }

  public Matcher<W> getMatcher2() {
    return matcher2;
  }

  /**
   * Cache the composed FST fills.  Null (the default) creates a new
   * {@link HashMapFstCache} for every composition.  A cache must not be
   * shared between two compositions: composed state ids are only
   * meaningful to the operation that assigned them.
   */
  public ComposeConfig<W> setCache(FstCache<W> cache) {
    this.cache = cache;
    return this;
  }

  public FstCache<W> getCache() {
    return cache;
  }

  /** Where composition logs its progress; {@link InfoStream#NO_OUTPUT} disables logging. */
  public ComposeConfig<W> setInfoStream(InfoStream infoStream) {
    this.infoStream = Objects.requireNonNull(infoStream, "infoStream must not be null; use InfoStream.NO_OUTPUT to disable logging");
    return this;
  }

  public InfoStream getInfoStream() {
    return infoStream;
  }

  @Override
  public String toString() {
    return "matcher1=" + matcher1 + "\nmatcher2=" + matcher2 + "\ncache=" + cache + "\ninfoStream=" + infoStream.getClass().getName() + "\n";
  }
}
