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
package org.wfst.semiring;

/**
 * Unweighted semiring: an FST over it is a plain (unweighted) transducer.
 *
 * @lucene.experimental
 */
public final class BooleanSemiring extends Semiring<Boolean> {

  private final static BooleanSemiring singleton = new BooleanSemiring();

  private BooleanSemiring() {
  }

  public static BooleanSemiring getSingleton() {
    return singleton;
  }

  @Override
  public Boolean zero() {
    return Boolean.FALSE;
  }

  @Override
  public Boolean one() {
    return Boolean.TRUE;
  }

  @Override
  public Boolean times(Boolean a, Boolean b) {
    return a && b;
  }

  @Override
  public Boolean plus(Boolean a, Boolean b) {
    return a || b;
  }

  @Override
  public String toString() {
    return "BooleanSemiring";
  }
}
