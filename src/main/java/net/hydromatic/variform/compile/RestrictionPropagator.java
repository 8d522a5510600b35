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

import static net.hydromatic.variform.ast.ExprBuilder.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;
import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.ast.Exprs;
import net.hydromatic.variform.ast.Op;
import net.hydromatic.variform.ast.Side;
import net.hydromatic.variform.domain.CoordinateElement;
import net.hydromatic.variform.domain.Domain;
import net.hydromatic.variform.domain.SobolevSpace;
import net.hydromatic.variform.rewrite.DagMapper;
import net.hydromatic.variform.rewrite.RuleSet;
import net.hydromatic.variform.rewrite.RuleTable;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Rule set that moves restrictions from the root of a sub-expression to its
 * terminals.
 *
 * <p>After propagation, each restriction directly wraps a terminal (or a
 * gradient, or the reference value of a terminal). Quantities that have the
 * same value on both sides of a facet lose their restriction; continuous
 * quantities that are not restricted are restricted to the default side.
 *
 * <p>A propagator created by the public constructor has no current side. It
 * owns a child propagator for each side, and each child has its own caches,
 * so that a sub-expression that occurs on both sides is rewritten once per
 * side. */
public class RestrictionPropagator extends RuleSet {
  /** Side used for continuous quantities that are not restricted. */
  public static final Side DEFAULT_SIDE = Side.PLUS;

  /** Kinds that have the same value on either side of a facet. */
  static final ImmutableSet<Op> IGNORE =
      Sets.immutableEnumSet(Op.MULTI_INDEX, Op.LABEL, Op.FLOAT_VALUE,
          Op.INT_VALUE, Op.ZERO, Op.CONSTANT, Op.FACET_COORDINATE,
          Op.QUADRATURE_WEIGHT, Op.REFERENCE_CELL_VOLUME,
          Op.REFERENCE_FACET_VOLUME);

  /** Kinds that have the same value on either side of a facet, but that must
   * be computed from the data of one side. */
  static final ImmutableSet<Op> DEFAULT =
      Sets.immutableEnumSet(Op.SPATIAL_COORDINATE, Op.FACET_JACOBIAN,
          Op.FACET_JACOBIAN_DETERMINANT, Op.FACET_JACOBIAN_INVERSE,
          Op.FACET_AREA, Op.MIN_FACET_EDGE_LENGTH, Op.MAX_FACET_EDGE_LENGTH,
          Op.FACET_ORIGIN);

  /** Kinds whose value is discontinuous across a facet: the arguments of the
   * form and every geometric quantity that is not otherwise classified. */
  static final ImmutableSet<Op> REQUIRE =
      Sets.immutableEnumSet(
          Sets.union(ImmutableSet.of(Op.ARGUMENT),
              Sets.difference(Op.inCategory(Op.Category.GEOMETRIC),
                  Sets.union(Sets.union(IGNORE, DEFAULT),
                      ImmutableSet.of(Op.FACET_NORMAL)))));

  private static final RuleTable<RestrictionPropagator> TABLE =
      RuleTable.<RestrictionPropagator>builder()
          .node(Op.RESTRICTED, RestrictionPropagator::restricted)
          .node(IGNORE, (propagator, e) -> e)
          .node(REQUIRE, RestrictionPropagator::require)
          .node(DEFAULT, RestrictionPropagator::defaultRestricted)
          .node(Op.COEFFICIENT, RestrictionPropagator::coefficient)
          .node(Op.FACET_NORMAL, RestrictionPropagator::facetNormal)
          // Derivatives have been expanded, so a gradient wraps a terminal;
          // it is discontinuous, whatever the terminal.
          .node(Op.GRAD, RestrictionPropagator::require)
          .node(Op.REFERENCE_VALUE, RestrictionPropagator::referenceValue)
          .operand(Op.VARIABLE, (propagator, e, operands) -> operands.get(0))
          .build();

  /** Current side, or null if outside any restriction. */
  private final @Nullable Side side;
  private final boolean useDefaultSide;

  /** Propagators for each side; empty if {@link #side} is not null. */
  private final Map<Side, RestrictionPropagator> children =
      new EnumMap<>(Side.class);
  private final Map<Side, Map<Expr, Expr>> vcaches = new EnumMap<>(Side.class);
  private final Map<Side, Map<Expr, Expr>> rcaches = new EnumMap<>(Side.class);

  /** Creates a RestrictionPropagator with no current side.
   *
   * @param useDefaultSide Whether to restrict continuous quantities that are
   *   not inside a restriction to {@link #DEFAULT_SIDE}
   */
  public RestrictionPropagator(boolean useDefaultSide) {
    this(null, useDefaultSide);
  }

  private RestrictionPropagator(@Nullable Side side, boolean useDefaultSide) {
    this.side = side;
    this.useDefaultSide = useDefaultSide;
    if (side == null) {
      for (Side s : Side.values()) {
        children.put(s, new RestrictionPropagator(s, useDefaultSide));
        vcaches.put(s, new IdentityHashMap<>());
        rcaches.put(s, new HashMap<>());
      }
    }
  }

  @Override protected RuleTable<RestrictionPropagator> table() {
    return TABLE;
  }

  /** Returns the current side, or null. */
  public @Nullable Side side() {
    return side;
  }

  /** Rewrites the operand of a restriction using the propagator for its
   * side. */
  private Expr restricted(Expr e) {
    if (side != null) {
      throw new RestrictionException(
          RestrictionException.Reason.DOUBLE_RESTRICTION, e.op);
    }
    final Side s = ((Exprs.Restricted) e).side;
    final Expr r =
        DagMapper.map(e.operand(0), children.get(s), vcaches.get(s),
            rcaches.get(s));
    if (r instanceof Exprs.Restricted
        && ((Exprs.Restricted) r).side == s
        && r.operand(0) == e.operand(0)) {
      // Already propagated; keep the original node.
      return e;
    }
    return r;
  }

  /** Restricts a discontinuous quantity to the current side, which must be
   * set. */
  private Expr require(Expr e) {
    if (side == null) {
      throw new RestrictionException(
          RestrictionException.Reason.MUST_BE_RESTRICTED, e.op);
    }
    return expr.restricted(e, side);
  }

  /** Restricts a continuous quantity to the current side, or to the default
   * side if there is no current side. */
  private Expr defaultRestricted(Expr e) {
    if (side != null) {
      return expr.restricted(e, side);
    }
    if (useDefaultSide) {
      return expr.restricted(e, DEFAULT_SIDE);
    }
    return e;
  }

  /** Restricts a quantity to the default side, and negates it if the current
   * side is the other side. The current side must be set. */
  private Expr opposite(Expr e) {
    if (side == null) {
      throw new RestrictionException(
          RestrictionException.Reason.MUST_BE_RESTRICTED, e.op);
    }
    final Expr r = expr.restricted(e, DEFAULT_SIDE);
    return side == DEFAULT_SIDE ? r : expr.negate(r);
  }

  /** A coefficient whose value is continuous may be evaluated on either
   * side. */
  private Expr coefficient(Expr e) {
    if (((Exprs.Coefficient) e).space.isContinuous()) {
      return defaultRestricted(e);
    }
    return require(e);
  }

  /** On a mesh with continuous, linear, non-manifold coordinates, the normal
   * on the "-" side is the negation of the normal on the "+" side. */
  private Expr facetNormal(Expr e) {
    final Domain domain = ((Exprs.GeometricQuantity) e).domain;
    final CoordinateElement element = domain.coordinateElement();
    if (element.embeddedSuperdegree <= 1
        && element.sobolevSpace.isSubspaceOf(SobolevSpace.H1)
        && domain.geometricDimension() == domain.topologicalDimension()) {
      return opposite(e);
    }
    return require(e);
  }

  /** The reference value of a terminal has the same restriction as the
   * terminal. */
  private Expr referenceValue(Expr e) {
    final Expr f = e.operand(0);
    final Expr g = apply(f, ImmutableList.of());
    if (g instanceof Exprs.Restricted) {
      return expr.restricted(e, ((Exprs.Restricted) g).side);
    }
    return e;
  }
}

// End RestrictionPropagator.java
