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
package net.hydromatic.variform.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.variform.ast.CompoundExprs.cross;
import static net.hydromatic.variform.ast.CompoundExprs.determinant;
import static net.hydromatic.variform.ast.CompoundExprs.inverse;
import static net.hydromatic.variform.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BinaryOperator;
import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.ast.Exprs.GeometricQuantity;
import net.hydromatic.variform.ast.FixedIndex;
import net.hydromatic.variform.ast.Index;
import net.hydromatic.variform.ast.Op;
import net.hydromatic.variform.domain.CellType;
import net.hydromatic.variform.domain.Domain;
import net.hydromatic.variform.rewrite.RuleSet;
import net.hydromatic.variform.rewrite.RuleTable;

/** Rule set that rewrites geometric quantities in terms of the Jacobian and
 * reference-cell data.
 *
 * <p>Each quantity whose kind is in the preserve set is left unchanged.
 * Other quantities are replaced by their definition, which refers to
 * lower-level quantities; those are lowered in turn (unless preserved), once
 * per pass. Quantities with no definition, such as the cell orientation and
 * the reference normal, are left unchanged.
 *
 * <p>Lowering assumes that derivatives have been expanded. */
public class GeometryLowerer extends RuleSet {
  private static final RuleTable<GeometryLowerer> TABLE =
      RuleTable.<GeometryLowerer>builder()
          .terminalDefault((lowerer, e) -> e)
          .node(Op.JACOBIAN, memo(GeometryLowerer::jacobian))
          .node(Op.JACOBIAN_INVERSE, memo(GeometryLowerer::jacobianInverse))
          .node(Op.JACOBIAN_DETERMINANT,
              memo(GeometryLowerer::jacobianDeterminant))
          .node(Op.FACET_JACOBIAN, memo(GeometryLowerer::facetJacobian))
          .node(Op.FACET_JACOBIAN_INVERSE,
              memo(GeometryLowerer::facetJacobianInverse))
          .node(Op.FACET_JACOBIAN_DETERMINANT,
              memo(GeometryLowerer::facetJacobianDeterminant))
          .node(Op.RIDGE_JACOBIAN, memo(GeometryLowerer::ridgeJacobian))
          .node(Op.RIDGE_JACOBIAN_INVERSE,
              memo(GeometryLowerer::ridgeJacobianInverse))
          .node(Op.RIDGE_JACOBIAN_DETERMINANT,
              memo(GeometryLowerer::ridgeJacobianDeterminant))
          .node(Op.SPATIAL_COORDINATE,
              memo(GeometryLowerer::spatialCoordinate))
          .node(Op.CELL_COORDINATE, memo(GeometryLowerer::cellCoordinate))
          .node(Op.FACET_CELL_COORDINATE,
              memo(GeometryLowerer::facetCellCoordinate))
          .node(Op.CELL_VOLUME, memo(GeometryLowerer::cellVolume))
          .node(Op.FACET_AREA, memo(GeometryLowerer::facetArea))
          .node(Op.CIRCUMRADIUS, memo(GeometryLowerer::circumradius))
          .node(Op.MAX_CELL_EDGE_LENGTH,
              memo((lowerer, q) -> lowerer.cellEdgeLength(q, expr::maxValue)))
          .node(Op.MIN_CELL_EDGE_LENGTH,
              memo((lowerer, q) -> lowerer.cellEdgeLength(q, expr::minValue)))
          .node(Op.CELL_DIAMETER, memo(GeometryLowerer::cellDiameter))
          .node(Op.MAX_FACET_EDGE_LENGTH,
              memo((lowerer, q) -> lowerer.facetEdgeLength(q, expr::maxValue)))
          .node(Op.MIN_FACET_EDGE_LENGTH,
              memo((lowerer, q) -> lowerer.facetEdgeLength(q, expr::minValue)))
          .node(Op.CELL_NORMAL, memo(GeometryLowerer::cellNormal))
          .node(Op.FACET_NORMAL, memo(GeometryLowerer::facetNormal))
          .build();

  private final ImmutableSet<Op> preserve;
  private final Tracer tracer;

  /** Lowered quantities, keyed by quantity. Quantities are equal if they have
   * the same kind and domain, so a quantity created during lowering finds
   * the value computed for an equal quantity in the expression. */
  private final Map<GeometricQuantity, Expr> memo = new HashMap<>();

  /** Creates a GeometryLowerer.
   *
   * @param preserve Kinds of geometric quantity to leave unchanged
   * @param tracer Receives warnings about quantities that cannot be lowered
   */
  public GeometryLowerer(Set<Op> preserve, Tracer tracer) {
    this.preserve = Sets.immutableEnumSet(preserve);
    this.tracer = requireNonNull(tracer);
  }

  @Override protected RuleTable<GeometryLowerer> table() {
    return TABLE;
  }

  private static RuleTable.NodeRule<GeometryLowerer> memo(
      Definition definition) {
    return (lowerer, e) -> lowerer.memo((GeometricQuantity) e, definition);
  }

  private Expr memo(GeometricQuantity q, Definition definition) {
    if (preserve.contains(q.op)) {
      return q;
    }
    // Not computeIfAbsent; a definition lowers other quantities.
    final Expr cached = memo.get(q);
    if (cached != null) {
      return cached;
    }
    final Expr e = definition.define(this, q);
    memo.put(q, e);
    return e;
  }

  /** Lowers the quantity of a given kind on a given domain. */
  private Expr lower(Op op, Domain domain) {
    return apply(expr.geometric(op, domain), ImmutableList.of());
  }

  /** Reports that a quantity was not lowered, and returns it. */
  private Expr warn(GeometricQuantity q, String message) {
    tracer.onWarning(new LoweringWarning(message, q.op));
    return q;
  }

  private static void checkIdentityPullback(GeometricQuantity q) {
    if (!q.domain.coordinateElement().identityPullback) {
      throw new UnsupportedGeometryException(
          "Piola mapped coordinates are not implemented", q.op);
    }
  }

  /** Returns {@code as_tensor(A[i, k] * B[k, j], (i, j))}. */
  private static Expr contract(Expr a, Expr b) {
    final Index i = Index.create();
    final Index j = Index.create();
    final Index k = Index.create();
    return expr.componentTensor(
        expr.times(expr.indexed(a, i, k), expr.indexed(b, k, j)), i, j);
  }

  // Jacobians

  private Expr jacobian(GeometricQuantity q) {
    checkIdentityPullback(q);
    // The spatial coordinate is always kept, so the Jacobian is its
    // reference gradient.
    final Expr x = lower(Op.SPATIAL_COORDINATE, q.domain);
    return expr.referenceGrad(x);
  }

  private Expr jacobianInverse(GeometricQuantity q) {
    return inverse(lower(Op.JACOBIAN, q.domain));
  }

  private Expr jacobianDeterminant(GeometricQuantity q) {
    final Domain domain = q.domain;
    final Expr detJ = determinant(lower(Op.JACOBIAN, domain));
    if (domain.topologicalDimension() < domain.geometricDimension()) {
      // Pseudo-determinant of an immersed cell is signed by its orientation.
      return expr.times(expr.geometric(Op.CELL_ORIENTATION, domain), detJ);
    }
    return detJ;
  }

  private Expr facetJacobian(GeometricQuantity q) {
    return contract(lower(Op.JACOBIAN, q.domain),
        expr.geometric(Op.CELL_FACET_JACOBIAN, q.domain));
  }

  private Expr facetJacobianInverse(GeometricQuantity q) {
    return inverse(lower(Op.FACET_JACOBIAN, q.domain));
  }

  /** Unsigned, even on an immersed cell. */
  private Expr facetJacobianDeterminant(GeometricQuantity q) {
    return determinant(lower(Op.FACET_JACOBIAN, q.domain));
  }

  private static void checkHasRidges(GeometricQuantity q) {
    if (q.domain.topologicalDimension() < 3) {
      throw new DegenerateInputException("Ridge quantities only make sense "
          + "for topological dimension >= 3", q.op);
    }
  }

  private Expr ridgeJacobian(GeometricQuantity q) {
    checkHasRidges(q);
    return contract(lower(Op.JACOBIAN, q.domain),
        expr.geometric(Op.CELL_RIDGE_JACOBIAN, q.domain));
  }

  private Expr ridgeJacobianInverse(GeometricQuantity q) {
    checkHasRidges(q);
    return inverse(lower(Op.RIDGE_JACOBIAN, q.domain));
  }

  private Expr ridgeJacobianDeterminant(GeometricQuantity q) {
    checkHasRidges(q);
    return determinant(lower(Op.RIDGE_JACOBIAN, q.domain));
  }

  // Coordinates

  private Expr spatialCoordinate(GeometricQuantity q) {
    checkIdentityPullback(q);
    return q;
  }

  /** Computes reference coordinates from physical coordinates,
   * {@code X = K (x - x0)}. */
  private Expr cellCoordinate(GeometricQuantity q) {
    final Expr k = lower(Op.JACOBIAN_INVERSE, q.domain);
    final Expr x = lower(Op.SPATIAL_COORDINATE, q.domain);
    final Expr x0 = expr.geometric(Op.CELL_ORIGIN, q.domain);
    final Index i = Index.create();
    final Index j = Index.create();
    return expr.componentTensor(
        expr.times(expr.indexed(k, i, j),
            expr.minus(expr.indexed(x, j), expr.indexed(x0, j))),
        i);
  }

  private Expr facetCellCoordinate(GeometricQuantity q) {
    throw new UnsupportedGeometryException("Missing computation of facet "
        + "reference coordinates from physical coordinates via mappings",
        q.op);
  }

  // Volumes and areas

  private Expr cellVolume(GeometricQuantity q) {
    final Domain domain = q.domain;
    if (!domain.isPiecewiseLinearSimplexDomain()) {
      return warn(q,
          "Only know how to compute the cell volume of an affine cell.");
    }
    final Expr r = lower(Op.JACOBIAN_DETERMINANT, domain);
    final Expr r0 = expr.geometric(Op.REFERENCE_CELL_VOLUME, domain);
    return expr.abs(expr.times(r, r0));
  }

  private Expr facetArea(GeometricQuantity q) {
    final Domain domain = q.domain;
    if (domain.topologicalDimension() == 1) {
      // The "area" of a vertex.
      return expr.floatValue(1d);
    }
    if (!domain.isPiecewiseLinearSimplexDomain()) {
      return warn(q,
          "Only know how to compute the facet area of an affine cell.");
    }
    final Expr r = lower(Op.FACET_JACOBIAN_DETERMINANT, domain);
    final Expr r0 = expr.geometric(Op.REFERENCE_FACET_VOLUME, domain);
    return expr.abs(expr.times(r, r0));
  }

  private Expr circumradius(GeometricQuantity q) {
    final Domain domain = q.domain;
    if (!domain.isPiecewiseLinearSimplexDomain()) {
      throw new DegenerateInputException(
          "Circumradius only makes sense for affine simplex cells", q.op);
    }
    final Expr volume = lower(Op.CELL_VOLUME, domain);
    final CellType cell = domain.cell();
    if (cell == CellType.INTERVAL) {
      return expr.times(expr.floatValue(0.5d), volume);
    }
    final List<Expr> lengths =
        edgeLengths(expr.geometric(Op.CELL_EDGE_VECTORS, domain));
    switch (cell) {
    case TRIANGLE:
      return expr.divide(
          expr.times(expr.times(lengths.get(0), lengths.get(1)),
              lengths.get(2)),
          expr.times(expr.floatValue(4d), volume));

    case TETRAHEDRON:
      // Sides of an intermediate triangle, from products of the lengths of
      // opposite edges in the reference numbering.
      final Expr la = expr.times(lengths.get(3), lengths.get(2));
      final Expr lb = expr.times(lengths.get(4), lengths.get(1));
      final Expr lc = expr.times(lengths.get(5), lengths.get(0));
      final Expr p = expr.plus(expr.plus(la, lb), lc);
      final Expr s = expr.divide(p, expr.intValue(2));
      final Expr area =
          expr.sqrt(
              expr.times(
                  expr.times(expr.times(s, expr.minus(s, la)),
                      expr.minus(s, lb)),
                  expr.minus(s, lc)));
      return expr.divide(area, expr.times(expr.floatValue(6d), volume));

    default:
      throw new DegenerateInputException("Circumradius is not defined for "
          + cell, q.op);
    }
  }

  // Edge lengths and diameter

  /** Returns the squared length of each row of a matrix of edge vectors. */
  private static List<Expr> squaredEdgeLengths(Expr edges) {
    final List<Expr> list = new ArrayList<>();
    for (int e = 0; e < edges.shape.get(0); e++) {
      list.add(squaredNorm(edges, e));
    }
    return list;
  }

  /** Returns {@code real(edges[e, j] * conj(edges[e, j]))}. */
  private static Expr squaredNorm(Expr edges, int e) {
    final Index j = Index.create();
    final Expr c = expr.indexed(edges, FixedIndex.of(e), j);
    return expr.real(expr.times(c, expr.conj(c)));
  }

  private static List<Expr> edgeLengths(Expr edges) {
    final List<Expr> list = new ArrayList<>();
    for (Expr e2 : squaredEdgeLengths(edges)) {
      list.add(expr.real(expr.sqrt(e2)));
    }
    return list;
  }

  /** Returns {@code real(sqrt(reduce(reduction, values)))}. */
  private static Expr reduceLength(List<Expr> squaredLengths,
      BinaryOperator<Expr> reduction) {
    Expr r = squaredLengths.get(0);
    for (Expr e : squaredLengths.subList(1, squaredLengths.size())) {
      r = reduction.apply(r, e);
    }
    return expr.real(expr.sqrt(r));
  }

  private Expr cellEdgeLength(GeometricQuantity q,
      BinaryOperator<Expr> reduction) {
    final Domain domain = q.domain;
    if (domain.cell().numEdges == 0) {
      throw new DegenerateInputException("Cell edge lengths are not defined "
          + "for " + domain.cell(), q.op);
    }
    if (domain.coordinateElement().embeddedSubdegree > 1) {
      return warn(q,
          "Only know how to compute cell edge lengths of P1 or Q1 cell.");
    }
    if (domain.cell() == CellType.INTERVAL) {
      // The only edge is the cell.
      return lower(Op.CELL_VOLUME, domain);
    }
    final Expr edges = expr.geometric(Op.CELL_EDGE_VECTORS, domain);
    return reduceLength(squaredEdgeLengths(edges), reduction);
  }

  private Expr cellDiameter(GeometricQuantity q) {
    final Domain domain = q.domain;
    if (domain.cell().numVertices < 2) {
      throw new DegenerateInputException("Cell diameter is not defined for "
          + domain.cell(), q.op);
    }
    if (domain.coordinateElement().embeddedSubdegree > 1) {
      return warn(q,
          "Only know how to compute cell diameter of P1 or Q1 cell.");
    }
    if (domain.isPiecewiseLinearSimplexDomain()) {
      return lower(Op.MAX_CELL_EDGE_LENGTH, domain);
    }
    // Greatest distance between any two vertices.
    final Expr vertices = expr.geometric(Op.CELL_VERTICES, domain);
    final List<Expr> rows = new ArrayList<>();
    for (int v = 0; v < vertices.shape.get(0); v++) {
      rows.add(expr.row(vertices, v));
    }
    final List<Expr> squaredLengths = new ArrayList<>();
    for (int v0 = 0; v0 < rows.size(); v0++) {
      for (int v1 = v0 + 1; v1 < rows.size(); v1++) {
        final Expr d = expr.minus(rows.get(v0), rows.get(v1));
        final Index j = Index.create();
        final Expr c = expr.indexed(d, j);
        squaredLengths.add(expr.real(expr.times(c, expr.conj(c))));
      }
    }
    return reduceLength(squaredLengths, expr::maxValue);
  }

  private Expr facetEdgeLength(GeometricQuantity q,
      BinaryOperator<Expr> reduction) {
    final Domain domain = q.domain;
    if (domain.topologicalDimension() < 3) {
      throw new DegenerateInputException("Facet edge lengths only make sense "
          + "for topological dimension >= 3", q.op);
    }
    if (domain.coordinateElement().embeddedSubdegree > 1) {
      return warn(q,
          "Only know how to compute facet edge lengths of P1 or Q1 cell.");
    }
    final Expr edges = expr.geometric(Op.FACET_EDGE_VECTORS, domain);
    return reduceLength(squaredEdgeLengths(edges), reduction);
  }

  // Normals

  private Expr cellNormal(GeometricQuantity q) {
    final Domain domain = q.domain;
    final int gdim = domain.geometricDimension();
    final int tdim = domain.topologicalDimension();
    if (tdim != gdim - 1) {
      throw new UnsupportedGeometryException("Cell normal undefined for tdim "
          + tdim + ", gdim " + gdim, q.op);
    }
    final Expr j;
    final Expr n;
    switch (tdim) {
    case 2:
      // Surface in 3D
      j = lower(Op.JACOBIAN, domain);
      n = cross(expr.column(j, 0), expr.column(j, 1));
      break;
    case 1:
      // Line in 2D; the normal points "up" for a line pointing "right"
      j = lower(Op.JACOBIAN, domain);
      n = expr.listTensor(expr.negate(expr.indexed(j, 1, 0)),
          expr.indexed(j, 0, 0));
      break;
    default:
      throw new UnsupportedGeometryException("Cell normal not implemented "
          + "for tdim " + tdim + ", gdim " + gdim, q.op);
    }
    final Index i = Index.create();
    final Expr c = expr.indexed(n, i);
    final Expr co = expr.geometric(Op.CELL_ORIENTATION, domain);
    return expr.divide(expr.times(co, n), expr.sqrt(expr.times(c, c)));
  }

  private Expr facetNormal(GeometricQuantity q) {
    final Domain domain = q.domain;
    final Expr rn = expr.geometric(Op.REFERENCE_NORMAL, domain);
    final Expr n;
    if (domain.topologicalDimension() == 1) {
      // The normal of a (possibly immersed) interval is in the direction of
      // J, signed by the reference normal (+1 or -1).
      final Expr j = lower(Op.JACOBIAN, domain);
      final Expr ndir = expr.column(j, 0);
      final Expr length;
      if (domain.geometricDimension() == 1) {
        length = expr.abs(expr.indexed(ndir, 0));
      } else {
        final Index i = Index.create();
        final Expr c = expr.indexed(ndir, i);
        length = expr.sqrt(expr.times(c, c));
      }
      n = expr.divide(expr.times(expr.indexed(rn, 0), ndir), length);
    } else {
      // The covariant Piola transform u -> K^T u preserves tangential
      // components, and the normal has no tangential component.
      final Expr k = lower(Op.JACOBIAN_INVERSE, domain);
      final Index i = Index.create();
      final Index j = Index.create();
      final Expr ndir =
          expr.componentTensor(
              expr.times(expr.indexed(k, j, i), expr.indexed(rn, j)), i);
      final Index i2 = Index.create();
      final Expr c = expr.indexed(ndir, i2);
      n = expr.divide(ndir, expr.sqrt(expr.times(c, c)));
    }
    if (!n.shape.equals(q.shape)) {
      throw new UnsupportedGeometryException("Inconsistent dimensions (in="
          + q.shape + ", out=" + n.shape + ")", q.op);
    }
    return n;
  }

  /** Definition of a geometric quantity in terms of lower-level
   * quantities. */
  @FunctionalInterface
  private interface Definition {
    Expr define(GeometryLowerer lowerer, GeometricQuantity q);
  }
}

// End GeometryLowerer.java
