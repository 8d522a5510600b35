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

/** Domain on which a form is integrated; usually a {@link Mesh}. */
public interface Domain {
  /** Returns the dimension of the cells. */
  int topologicalDimension();

  /** Returns the dimension of the space in which the cells are embedded. */
  int geometricDimension();

  /** Returns the reference cell type. */
  CellType cell();

  /** Returns the name of the cell type, e.g. "triangle". */
  default String cellName() {
    return cell().cellName;
  }

  /** Returns the element of the coordinate field. */
  CoordinateElement coordinateElement();

  /** Returns whether every cell is an affine image of a reference
   * simplex. */
  default boolean isPiecewiseLinearSimplexDomain() {
    return coordinateElement().embeddedSuperdegree <= 1 && cell().simplex;
  }
}

// End Domain.java
