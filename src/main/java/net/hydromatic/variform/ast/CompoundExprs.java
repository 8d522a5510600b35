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

import static com.google.common.base.Preconditions.checkArgument;
import static net.hydromatic.variform.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Builders for compound tensor-algebra expressions: cross product,
 * determinant and inverse.
 *
 * <p>The results are expressed in terms of components of the operands, and
 * are valid for any operands of the right shape. */
public class CompoundExprs {
  private CompoundExprs() {}

  /** Creates the cross product of two 3-vectors. */
  public static Expr cross(Expr a, Expr b) {
    checkArgument(a.rank() == 1 && a.shape.get(0) == 3
            && b.rank() == 1 && b.shape.get(0) == 3,
        "cross product requires 3-vectors, got shapes %s and %s",
        a.shape, b.shape);
    return expr.listTensor(
        component(a, 1, b, 2, a, 2, b, 1),
        component(a, 2, b, 0, a, 0, b, 2),
        component(a, 0, b, 1, a, 1, b, 0));
  }

  /** Returns {@code a[i] * b[j] - c[k] * d[l]}. */
  private static Expr component(Expr a, int i, Expr b, int j, Expr c, int k,
      Expr d, int l) {
    return expr.minus(
        expr.times(expr.indexed(a, i), expr.indexed(b, j)),
        expr.times(expr.indexed(c, k), expr.indexed(d, l)));
  }

  /** Creates the determinant of a matrix.
   *
   * <p>For a scalar, returns the scalar. For a non-square matrix, returns the
   * pseudo-determinant, {@code sqrt(det(A^T A))}. */
  public static Expr determinant(Expr a) {
    if (a.rank() == 0) {
      return a;
    }
    checkArgument(a.rank() == 2, "determinant of tensor of rank %s",
        a.rank());
    final int m = a.shape.get(0);
    final int n = a.shape.get(1);
    checkArgument(m > 0 && n > 0, "determinant of empty matrix");
    if (m == n) {
      return determinant(a, range(m), range(n));
    }
    return pseudoDeterminant(a);
  }

  /** Creates {@code sqrt(det(A^T A))}. */
  private static Expr pseudoDeterminant(Expr a) {
    return expr.sqrt(determinant(transposeTimesSelf(a)));
  }

  /** Creates {@code as_tensor(A[k, i] * A[k, j], (i, j))}. */
  private static Expr transposeTimesSelf(Expr a) {
    final Index i = Index.create();
    final Index j = Index.create();
    final Index k = Index.create();
    return expr.componentTensor(
        expr.times(expr.indexed(a, k, i), expr.indexed(a, k, j)), i, j);
  }

  /** Determinant of the sub-matrix with given rows and columns, by expansion
   * along its first row. */
  private static Expr determinant(Expr a, List<Integer> rows,
      List<Integer> columns) {
    final int row = rows.get(0);
    if (rows.size() == 1) {
      return expr.indexed(a, row, columns.get(0));
    }
    final List<Integer> otherRows = rows.subList(1, rows.size());
    Expr sum = null;
    for (int k = 0; k < columns.size(); k++) {
      final int column = columns.get(k);
      final Expr term =
          expr.times(expr.indexed(a, row, column),
              determinant(a, otherRows, without(columns, k)));
      sum = sum == null ? term
          : k % 2 == 0 ? expr.plus(sum, term)
          : expr.minus(sum, term);
    }
    return sum;
  }

  /** Creates the inverse of a square matrix, or the pseudo-inverse
   * {@code (A^T A)^-1 A^T} of a non-square matrix. */
  public static Expr inverse(Expr a) {
    checkArgument(a.rank() == 2, "inverse of tensor of rank %s", a.rank());
    final int m = a.shape.get(0);
    final int n = a.shape.get(1);
    checkArgument(m > 0 && n > 0, "inverse of empty matrix");
    if (m != n) {
      return pseudoInverse(a);
    }
    if (m == 1) {
      return expr.listTensor(
          expr.listTensor(expr.divide(expr.floatValue(1d),
              expr.indexed(a, 0, 0))));
    }
    return expr.divide(adjugate(a), determinant(a));
  }

  private static Expr pseudoInverse(Expr a) {
    final Expr ataInverse = inverse(transposeTimesSelf(a));
    final Index q = Index.create();
    final Index r = Index.create();
    final Index s = Index.create();
    return expr.componentTensor(
        expr.times(expr.indexed(ataInverse, r, q), expr.indexed(a, s, q)),
        r, s);
  }

  /** Creates the adjugate (transposed cofactor matrix) of a square
   * matrix. */
  public static Expr adjugate(Expr a) {
    final int n = a.shape.get(0);
    final List<Integer> all = range(n);
    final List<Expr> rows = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      final List<Expr> row = new ArrayList<>();
      for (int j = 0; j < n; j++) {
        // Entry (i, j) is the cofactor of entry (j, i).
        final Expr minor = determinant(a, without(all, j), without(all, i));
        row.add((i + j) % 2 == 0 ? minor : expr.negate(minor));
      }
      rows.add(expr.listTensor(row));
    }
    return expr.listTensor(rows);
  }

  private static List<Integer> range(int n) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int i = 0; i < n; i++) {
      b.add(i);
    }
    return b.build();
  }

  private static List<Integer> without(List<Integer> list, int k) {
    final ImmutableList.Builder<Integer> b = ImmutableList.builder();
    for (int i = 0; i < list.size(); i++) {
      if (i != k) {
        b.add(list.get(i));
      }
    }
    return b.build();
  }
}

// End CompoundExprs.java
