/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.variform.domain;

import static java.util.Objects.requireNonNull;

import com.google.common.primitives.ImmutableIntArray;
import java.util.Objects;

/** Space of functions on a domain, in which form arguments and coefficients
 * live. */
public final class FunctionSpace {
  public final Domain domain;
  public final SobolevSpace sobolevSpace;
  public final ImmutableIntArray valueShape;

  private FunctionSpace(Domain domain, SobolevSpace sobolevSpace,
      ImmutableIntArray valueShape) {
    this.domain = requireNonNull(domain);
    this.sobolevSpace = requireNonNull(sobolevSpace);
    this.valueShape = requireNonNull(valueShape);
  }

  /** Creates a function space. */
  public static FunctionSpace of(Domain domain, SobolevSpace sobolevSpace,
      int... valueShape) {
    return new FunctionSpace(domain, sobolevSpace,
        ImmutableIntArray.copyOf(valueShape));
  }

  /** Returns whether functions in this space are continuous across
   * facets. */
  public boolean isContinuous() {
    return sobolevSpace.isSubspaceOf(SobolevSpace.H1);
  }

  @Override public int hashCode() {
    return Objects.hash(domain, sobolevSpace, valueShape);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof FunctionSpace
        && domain.equals(((FunctionSpace) o).domain)
        && sobolevSpace == ((FunctionSpace) o).sobolevSpace
        && valueShape.equals(((FunctionSpace) o).valueShape);
  }

  @Override public String toString() {
    return "FunctionSpace(" + domain + ", " + sobolevSpace + ")";
  }
}

// End FunctionSpace.java
