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

import java.util.Objects;

/** Finite element that describes the coordinate field of a mesh.
 *
 * <p>Only the properties that geometry algorithms need are modeled: the
 * polynomial degrees, the Sobolev space, and whether values are pulled back
 * by the identity map. */
public final class CoordinateElement {
  public final String family;
  public final CellType cell;
  /** Degree of the highest-degree complete polynomial space contained in this
   * element's space. */
  public final int embeddedSubdegree;
  /** Degree of the lowest-degree polynomial space that contains this
   * element's space. */
  public final int embeddedSuperdegree;
  public final SobolevSpace sobolevSpace;
  public final boolean identityPullback;

  private CoordinateElement(String family, CellType cell,
      int embeddedSubdegree, int embeddedSuperdegree,
      SobolevSpace sobolevSpace, boolean identityPullback) {
    this.family = requireNonNull(family);
    this.cell = requireNonNull(cell);
    this.embeddedSubdegree = embeddedSubdegree;
    this.embeddedSuperdegree = embeddedSuperdegree;
    this.sobolevSpace = requireNonNull(sobolevSpace);
    this.identityPullback = identityPullback;
    checkArgument(embeddedSubdegree <= embeddedSuperdegree,
        "subdegree %s exceeds superdegree %s", embeddedSubdegree,
        embeddedSuperdegree);
  }

  /** Creates an element with all properties given explicitly. */
  public static CoordinateElement of(String family, CellType cell,
      int embeddedSubdegree, int embeddedSuperdegree,
      SobolevSpace sobolevSpace, boolean identityPullback) {
    return new CoordinateElement(family, cell, embeddedSubdegree,
        embeddedSuperdegree, sobolevSpace, identityPullback);
  }

  /** Creates a continuous Lagrange element.
   *
   * <p>On a tensor-product cell, a degree {@code k} element contains
   * polynomials of degree {@code k * tdim}. */
  public static CoordinateElement lagrange(CellType cell, int degree) {
    return new CoordinateElement("Lagrange", cell, degree,
        superdegree(cell, degree), SobolevSpace.H1, true);
  }

  /** Creates a discontinuous Lagrange element. */
  public static CoordinateElement discontinuousLagrange(CellType cell,
      int degree) {
    return new CoordinateElement("Discontinuous Lagrange", cell, degree,
        superdegree(cell, degree), SobolevSpace.L2, true);
  }

  private static int superdegree(CellType cell, int degree) {
    return cell.simplex ? degree : degree * cell.topologicalDimension;
  }

  /** Returns a copy of this element with a different pullback. */
  public CoordinateElement withIdentityPullback(boolean identityPullback) {
    return identityPullback == this.identityPullback ? this
        : new CoordinateElement(family, cell, embeddedSubdegree,
            embeddedSuperdegree, sobolevSpace, identityPullback);
  }

  @Override public int hashCode() {
    return Objects.hash(family, cell, embeddedSubdegree, embeddedSuperdegree,
        sobolevSpace, identityPullback);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof CoordinateElement
        && family.equals(((CoordinateElement) o).family)
        && cell == ((CoordinateElement) o).cell
        && embeddedSubdegree == ((CoordinateElement) o).embeddedSubdegree
        && embeddedSuperdegree == ((CoordinateElement) o).embeddedSuperdegree
        && sobolevSpace == ((CoordinateElement) o).sobolevSpace
        && identityPullback == ((CoordinateElement) o).identityPullback;
  }

  @Override public String toString() {
    return family + "(" + cell + ", " + embeddedSubdegree + ")";
  }
}

// End CoordinateElement.java
