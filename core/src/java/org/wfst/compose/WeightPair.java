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

/** Mutable pair of final weights, adjusted in place by {@link ComposeFilter#filterFinal}. */
public final class WeightPair<W> {

  /** Final weight on the first operand. */
  public W weight1;

  /** Final weight on the second operand. */
  public W weight2;

  public WeightPair(W weight1, W weight2) {
    this.weight1 = weight1;
    this.weight2 = weight2;
  }

  @Override
  public String toString() {
    return "(" + weight1 + ", " + weight2 + ")";
  }
}
