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
package net.hydromatic.variform.form;

import com.google.common.collect.ImmutableMap;

/** Type of integral; determines the set of entities (cells, facets,
 * vertices) that an integral ranges over. */
public enum IntegralType {
  CELL("cell"),
  EXTERIOR_FACET("exterior_facet"),
  INTERIOR_FACET("interior_facet"),
  VERTEX("vertex"),
  CUSTOM("custom"),
  CUTCELL("cutcell"),
  INTERFACE("interface"),
  OVERLAP("overlap"),
  EXTERIOR_FACET_TOP("exterior_facet_top"),
  EXTERIOR_FACET_BOTTOM("exterior_facet_bottom"),
  EXTERIOR_FACET_VERT("exterior_facet_vert"),
  INTERIOR_FACET_HORIZ("interior_facet_horiz"),
  INTERIOR_FACET_VERT("interior_facet_vert");

  /** Name of the integral type, e.g. "interior_facet". */
  public final String typeName;

  private static final ImmutableMap<String, IntegralType> BY_TYPE_NAME;

  static {
    final ImmutableMap.Builder<String, IntegralType> b =
        ImmutableMap.builder();
    for (IntegralType type : values()) {
      b.put(type.typeName, type);
    }
    BY_TYPE_NAME = b.build();
  }

  IntegralType(String typeName) {
    this.typeName = typeName;
  }

  /** Looks up a type by name. Throws if not found; never returns null. */
  public static IntegralType of(String typeName) {
    final IntegralType type = BY_TYPE_NAME.get(typeName);
    if (type == null) {
      throw new IllegalArgumentException("unknown integral type '"
          + typeName + "'");
    }
    return type;
  }

  /** Returns whether this is a type whose quadrature points are supplied at
   * run time. */
  public boolean isCustom() {
    switch (this) {
    case CUSTOM:
    case CUTCELL:
    case INTERFACE:
    case OVERLAP:
      return true;
    default:
      return false;
    }
  }

  /** Returns whether integrals of this type are evaluated at points. */
  public boolean isPoint() {
    return this == VERTEX;
  }

  /** Returns whether integrals of this type range over facets shared by two
   * cells, and so have a "+" and a "-" side. */
  public boolean isInteriorFacet() {
    return typeName.startsWith("interior_facet");
  }

  @Override public String toString() {
    return typeName;
  }
}

// End IntegralType.java
