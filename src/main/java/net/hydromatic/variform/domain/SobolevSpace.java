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

import com.google.common.collect.ImmutableList;

/** Sobolev space; describes the continuity of the functions in a finite
 * element space.
 *
 * <p>A space is a subspace of each of its parents. */
public enum SobolevSpace {
  L2("L2"),
  HDIV("HDiv", L2),
  HCURL("HCurl", L2),
  H1("H1", HDIV, HCURL, L2),
  H2("H2", H1, HDIV, HCURL, L2),
  HINF("HInf", H2, H1, HDIV, HCURL, L2);

  public final String displayName;
  private final ImmutableList<SobolevSpace> parents;

  SobolevSpace(String displayName, SobolevSpace... parents) {
    this.displayName = displayName;
    this.parents = ImmutableList.copyOf(parents);
  }

  /** Returns whether every function in this space is also in
   * {@code space}. */
  public boolean isSubspaceOf(SobolevSpace space) {
    return this == space || parents.contains(space);
  }

  @Override public String toString() {
    return displayName;
  }
}

// End SobolevSpace.java
