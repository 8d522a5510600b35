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

/** Shape of the reference cell of a mesh. */
public enum CellType {
  VERTEX("vertex", 0, 1, 0, 0, true),
  INTERVAL("interval", 1, 2, 1, 0, true),
  TRIANGLE("triangle", 2, 3, 3, 1, true),
  TETRAHEDRON("tetrahedron", 3, 4, 6, 3, true),
  QUADRILATERAL("quadrilateral", 2, 4, 4, 1, false),
  HEXAHEDRON("hexahedron", 3, 8, 12, 4, false);

  public final String cellName;
  public final int topologicalDimension;
  public final int numVertices;
  public final int numEdges;
  /** Number of edges of each facet. */
  public final int numFacetEdges;
  public final boolean simplex;

  CellType(String cellName, int topologicalDimension, int numVertices,
      int numEdges, int numFacetEdges, boolean simplex) {
    this.cellName = cellName;
    this.topologicalDimension = topologicalDimension;
    this.numVertices = numVertices;
    this.numEdges = numEdges;
    this.numFacetEdges = numFacetEdges;
    this.simplex = simplex;
  }

  @Override public String toString() {
    return cellName;
  }
}

// End CellType.java
