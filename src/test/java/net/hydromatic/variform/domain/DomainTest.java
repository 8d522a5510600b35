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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/** Tests for meshes, coordinate elements, function spaces and Sobolev
 * spaces. */
public class DomainTest {
  @Test void testSobolevSpaces() {
    assertThat(SobolevSpace.H1.isSubspaceOf(SobolevSpace.L2), is(true));
    assertThat(SobolevSpace.H1.isSubspaceOf(SobolevSpace.HDIV), is(true));
    assertThat(SobolevSpace.H1.isSubspaceOf(SobolevSpace.H1), is(true));
    assertThat(SobolevSpace.HINF.isSubspaceOf(SobolevSpace.H1), is(true));
    assertThat(SobolevSpace.L2.isSubspaceOf(SobolevSpace.H1), is(false));
    assertThat(SobolevSpace.HDIV.isSubspaceOf(SobolevSpace.HCURL), is(false));
    assertThat(SobolevSpace.HCURL.toString(), is("HCurl"));
  }

  @Test void testFunctionSpaceContinuity() {
    final Mesh mesh = Mesh.linear("mesh", CellType.TRIANGLE);
    assertThat(FunctionSpace.of(mesh, SobolevSpace.H1).isContinuous(),
        is(true));
    assertThat(FunctionSpace.of(mesh, SobolevSpace.H2).isContinuous(),
        is(true));
    assertThat(FunctionSpace.of(mesh, SobolevSpace.L2).isContinuous(),
        is(false));
    assertThat(FunctionSpace.of(mesh, SobolevSpace.HDIV).isContinuous(),
        is(false));
  }

  /** A degree k element on a tensor-product cell contains polynomials of
   * degree k * tdim. */
  @Test void testDegrees() {
    final CoordinateElement q1 =
        CoordinateElement.lagrange(CellType.QUADRILATERAL, 1);
    assertThat(q1.embeddedSubdegree, is(1));
    assertThat(q1.embeddedSuperdegree, is(2));
    assertThat(
        CoordinateElement.lagrange(CellType.HEXAHEDRON, 2).embeddedSuperdegree,
        is(6));
    assertThat(
        CoordinateElement.lagrange(CellType.TRIANGLE, 2).embeddedSuperdegree,
        is(2));
    final CoordinateElement dg =
        CoordinateElement.discontinuousLagrange(CellType.TRIANGLE, 1);
    assertThat(dg.sobolevSpace, is(SobolevSpace.L2));
    assertThrows(IllegalArgumentException.class,
        () -> CoordinateElement.of("Bad", CellType.TRIANGLE, 2, 1,
            SobolevSpace.H1, true));
  }

  @Test void testPiecewiseLinearSimplexDomain() {
    assertThat(
        Mesh.linear("m", CellType.TRIANGLE).isPiecewiseLinearSimplexDomain(),
        is(true));
    assertThat(
        Mesh.linear("m", CellType.TRIANGLE, 3)
            .isPiecewiseLinearSimplexDomain(),
        is(true));
    assertThat(
        Mesh.linear("m", CellType.QUADRILATERAL)
            .isPiecewiseLinearSimplexDomain(),
        is(false));
    final Mesh curved =
        Mesh.of("curved", CoordinateElement.lagrange(CellType.TRIANGLE, 2), 2);
    assertThat(curved.isPiecewiseLinearSimplexDomain(), is(false));
  }

  @Test void testMesh() {
    final Mesh mesh = Mesh.linear("mesh", CellType.TETRAHEDRON);
    assertThat(mesh.topologicalDimension(), is(3));
    assertThat(mesh.geometricDimension(), is(3));
    assertThat(mesh.cellName(), is("tetrahedron"));
    assertThat(mesh.toString(), is("mesh"));

    // Meshes are compared by identity.
    assertThat(Mesh.linear("mesh", CellType.TETRAHEDRON), not(is(mesh)));

    assertThrows(IllegalArgumentException.class,
        () -> Mesh.linear("flat", CellType.TETRAHEDRON, 2));
  }

  @Test void testIdentityPullback() {
    final CoordinateElement p1 =
        CoordinateElement.lagrange(CellType.TRIANGLE, 1);
    assertThat(p1.identityPullback, is(true));
    assertThat(p1.withIdentityPullback(true), is(p1));
    final CoordinateElement piola = p1.withIdentityPullback(false);
    assertThat(piola.identityPullback, is(false));
    assertThat(piola, not(is(p1)));
  }
}

// End DomainTest.java
