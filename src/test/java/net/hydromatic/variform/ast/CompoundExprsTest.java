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
package net.hydromatic.variform.ast;

import static net.hydromatic.variform.Matchers.near;
import static net.hydromatic.variform.ast.CompoundExprs.cross;
import static net.hydromatic.variform.ast.CompoundExprs.determinant;
import static net.hydromatic.variform.ast.CompoundExprs.inverse;
import static net.hydromatic.variform.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.primitives.ImmutableIntArray;
import net.hydromatic.variform.ExprEvaluator;
import net.hydromatic.variform.domain.CellType;
import net.hydromatic.variform.domain.Mesh;
import org.junit.jupiter.api.Test;

/** Tests for {@link CompoundExprs}. */
public class CompoundExprsTest {
  private final Mesh mesh = Mesh.linear("mesh", CellType.TETRAHEDRON);

  /** Returns a constant matrix of a given shape. */
  private Expr matrix(int count, int rows, int columns) {
    return expr.constant(mesh, count, rows, columns);
  }

  @Test void testDeterminant2x2() {
    final Expr a = matrix(0, 2, 2);
    assertThat(determinant(a).toString(),
        is("c_0[0, 0] * c_0[1, 1] + -1 * (c_0[0, 1] * c_0[1, 0])"));
  }

  @Test void testDeterminant3x3() {
    final Expr a = matrix(0, 3, 3);
    final double value = new ExprEvaluator()
        .bindMatrix(a, new double[][] {{2, 0, 1}, {1, 3, 2}, {1, 1, 2}})
        .scalar(determinant(a));
    assertThat(value, near(6d));
  }

  @Test void testDeterminantOfScalar() {
    final Expr s = expr.constant(mesh, 1);
    assertThat(determinant(s), sameInstance(s));
    assertThrows(IllegalArgumentException.class,
        () -> determinant(expr.constant(mesh, 2, 3)));
  }

  @Test void testEmptyMatrix() {
    final Expr empty = matrix(0, 2, 0);
    final IllegalArgumentException x =
        assertThrows(IllegalArgumentException.class,
            () -> determinant(empty));
    assertThat(x.getMessage(), is("determinant of empty matrix"));
    final IllegalArgumentException x2 =
        assertThrows(IllegalArgumentException.class, () -> inverse(empty));
    assertThat(x2.getMessage(), is("inverse of empty matrix"));
  }

  /** The pseudo-determinant of an immersed matrix is the volume scaling
   * factor. */
  @Test void testPseudoDeterminant() {
    final Expr a = matrix(0, 3, 2);
    final double value = new ExprEvaluator()
        .bindMatrix(a, new double[][] {{1, 0}, {0, 1}, {0, 0}})
        .scalar(determinant(a));
    assertThat(value, near(1d));

    final Expr b = matrix(1, 2, 1);
    final double value2 = new ExprEvaluator()
        .bindMatrix(b, new double[][] {{3}, {4}})
        .scalar(determinant(b));
    assertThat(value2, near(5d));
  }

  @Test void testInverse2x2() {
    final Expr a = matrix(0, 2, 2);
    final double[][] value = new ExprEvaluator()
        .bindMatrix(a, new double[][] {{2, 1}, {1, 1}})
        .matrix(inverse(a));
    assertThat(value[0], near(1d, -1d));
    assertThat(value[1], near(-1d, 2d));
  }

  @Test void testInverse3x3() {
    final Expr a = matrix(0, 3, 3);
    final double[][] m = {{2, 0, 1}, {1, 3, 2}, {1, 1, 2}};
    final double[][] value = new ExprEvaluator()
        .bindMatrix(a, m)
        .matrix(inverse(a));
    for (int i = 0; i < 3; i++) {
      final double[] row = new double[3];
      for (int j = 0; j < 3; j++) {
        for (int k = 0; k < 3; k++) {
          row[j] += m[i][k] * value[k][j];
        }
      }
      final double[] identityRow = new double[3];
      identityRow[i] = 1d;
      assertThat(row, near(identityRow));
    }
  }

  @Test void testInverse1x1() {
    final Expr a = matrix(0, 1, 1);
    final Expr inverse = inverse(a);
    assertThat(inverse.shape, is(ImmutableIntArray.of(1, 1)));
    final double[][] value = new ExprEvaluator()
        .bindMatrix(a, new double[][] {{4}})
        .matrix(inverse);
    assertThat(value[0][0], near(0.25d));
  }

  /** The pseudo-inverse of a column vector {@code a} is
   * {@code a^T / |a|^2}. */
  @Test void testPseudoInverse() {
    final Expr a = matrix(0, 2, 1);
    final Expr inverse = inverse(a);
    assertThat(inverse.shape, is(ImmutableIntArray.of(1, 2)));
    final double[][] value = new ExprEvaluator()
        .bindMatrix(a, new double[][] {{3}, {4}})
        .matrix(inverse);
    assertThat(value[0], near(0.12d, 0.16d));
  }

  @Test void testAdjugate() {
    final Expr a = matrix(0, 2, 2);
    final double[][] value = new ExprEvaluator()
        .bindMatrix(a, new double[][] {{1, 2}, {3, 4}})
        .matrix(CompoundExprs.adjugate(a));
    assertThat(value[0], near(4d, -2d));
    assertThat(value[1], near(-3d, 1d));
  }

  @Test void testCross() {
    final Expr u = expr.constant(mesh, 0, 3);
    final Expr v = expr.constant(mesh, 1, 3);
    final double[] value = new ExprEvaluator()
        .bindVector(u, 1, 2, 3)
        .bindVector(v, 4, 5, 6)
        .vector(cross(u, v));
    assertThat(value, near(-3d, 6d, -3d));
    assertThrows(IllegalArgumentException.class,
        () -> cross(expr.constant(mesh, 2, 2), v));
  }
}

// End CompoundExprsTest.java
