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

/**
 * {@link MatcherIterator} with a one-item lookahead buffer, so that a
 * caller can test whether another match exists without losing it.
 *
 * @lucene.experimental
 */
public final class MatcherPeekable<W> implements MatcherIterator<W> {

  private final MatcherIterator<W> in;
  private MatcherItem<W> buffered;

  MatcherPeekable(MatcherIterator<W> in) {
    this.in = in;
  }

  /** Returns the next match without consuming it, or null when exhausted. */
  public MatcherItem<W> peek() {
    if (buffered == null) {
      buffered = in.next();
    }
    return buffered;
  }

  @Override
  public MatcherItem<W> next() {
    if (buffered != null) {
      MatcherItem<W> item = buffered;
      buffered = null;
      return item;
    }
    return in.next();
  }

  @Override
  public MatcherPeekable<W> peekable() {
    return this;
  }
}
