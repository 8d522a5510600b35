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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/** Mesh; a domain whose coordinates are a finite element field.
 *
 * <p>Meshes are compared by identity. */
public final class Mesh implements Domain {
  public final String name;
  private final CoordinateElement element;
  private final int geometricDimension;

  private Mesh(String name, CoordinateElement element,
      int geometricDimension) {
    this.name = requireNonNull(name);
    this.element = requireNonNull(element);
    this.geometricDimension = geometricDimension;
    checkArgument(geometricDimension >= element.cell.topologicalDimension,
        "geometric dimension %s is less than topological dimension of %s",
        geometricDimension, element.cell);
  }

  /** Creates a mesh with a given coordinate element. */
  public static Mesh of(String name, CoordinateElement element,
      int geometricDimension) {
    return new Mesh(name, element, geometricDimension);
  }

  /** Creates a mesh with piecewise linear (or multilinear) coordinates. */
  public static Mesh linear(String name, CellType cell,
      int geometricDimension) {
    return of(name, CoordinateElement.lagrange(cell, 1), geometricDimension);
  }

  /** Creates a mesh with piecewise linear coordinates, embedded in a space of
   * the same dimension as the cells. */
  public static Mesh linear(String name, CellType cell) {
    return linear(name, cell, cell.topologicalDimension);
  }

  @Override public int topologicalDimension() {
    return element.cell.topologicalDimension;
  }

  @Override public int geometricDimension() {
    return geometricDimension;
  }

  @Override public CellType cell() {
    return element.cell;
  }

  @Override public CoordinateElement coordinateElement() {
    return element;
  }

  @Override public String toString() {
    return name;
  }
}

// End Mesh.java
