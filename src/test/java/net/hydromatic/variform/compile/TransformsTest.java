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

import static net.hydromatic.variform.Matchers.containsNode;
import static net.hydromatic.variform.Matchers.containsOp;
import static net.hydromatic.variform.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.ast.Op;
import net.hydromatic.variform.ast.Side;
import net.hydromatic.variform.domain.CellType;
import net.hydromatic.variform.domain.FunctionSpace;
import net.hydromatic.variform.domain.Mesh;
import net.hydromatic.variform.domain.SobolevSpace;
import net.hydromatic.variform.form.Form;
import net.hydromatic.variform.form.Integral;
import net.hydromatic.variform.form.IntegralType;
import net.hydromatic.variform.rewrite.RewriteException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Transforms}, the entry points to the passes. */
public class TransformsTest {
  private final Mesh mesh = Mesh.linear("mesh", CellType.TRIANGLE);
  private final FunctionSpace h1 = FunctionSpace.of(mesh, SobolevSpace.H1);
  private final Expr v = expr.argument(h1, 0);
  private final Expr f = expr.coefficient(h1, 1);
  private final Expr j = expr.geometric(Op.JACOBIAN, mesh);
  private final Expr cellCoordinate =
      expr.indexed(expr.geometric(Op.CELL_COORDINATE, mesh), 0);

  @Test void testAutomaticPreserve() {
    assertThat(Transforms.automaticPreserve(IntegralType.CELL),
        is(ImmutableSet.of(Op.CELL_COORDINATE)));
    assertThat(Transforms.automaticPreserve(IntegralType.INTERIOR_FACET),
        is(ImmutableSet.of(Op.CELL_COORDINATE)));
    assertThat(Transforms.automaticPreserve(IntegralType.CUTCELL),
        is(ImmutableSet.of(Op.SPATIAL_COORDINATE, Op.JACOBIAN)));
    assertThat(Transforms.automaticPreserve(IntegralType.VERTEX),
        is(ImmutableSet.of(Op.SPATIAL_COORDINATE, Op.JACOBIAN)));
  }

  @Test void testParsePreserve() {
    assertThat(Transforms.parsePreserve("jacobian, CELL_VOLUME"),
        is(ImmutableSet.of(Op.JACOBIAN, Op.CELL_VOLUME)));
    assertThat(Transforms.parsePreserve("").isEmpty(), is(true));
    assertThat(Transforms.parsePreserve(" facetNormal,,").size(), is(1));

    final IllegalArgumentException x =
        assertThrows(IllegalArgumentException.class,
            () -> Transforms.parsePreserve("jacobian,sum"));
    assertThat(x.getMessage(), is("not a geometric quantity: sum"));
    final IllegalArgumentException x2 =
        assertThrows(IllegalArgumentException.class,
            () -> Transforms.parsePreserve("jacobean"));
    assertThat(x2.getMessage(), is("unknown expression kind 'jacobean'"));
  }

  /** The cell coordinate is preserved in a cell integral, but lowered in a
   * custom integral, where the Jacobian is preserved instead. */
  @Test void testLowerGeometryPreservesPerIntegralType() {
    final Integral cell = Integral.of(cellCoordinate, IntegralType.CELL, mesh);
    final Form form = Form.of(cell);
    assertThat(Transforms.lowerGeometry(form, ImmutableSet.of()),
        sameInstance(form));

    final Integral custom =
        Integral.of(cellCoordinate, IntegralType.CUSTOM, mesh, "1",
            ImmutableMap.of("quadrature_degree", 2));
    final Form form2 =
        Transforms.lowerGeometry(Form.of(custom), ImmutableSet.of());
    assertThat(form2.integrals, hasSize(1));
    final Integral custom2 = form2.integrals.get(0);
    assertThat(custom2.integrand, not(containsOp(Op.CELL_COORDINATE)));
    assertThat(custom2.integrand, containsNode(j));
    assertThat(custom2.type, is(IntegralType.CUSTOM));
    assertThat(custom2.subdomainId, is("1"));
    assertThat(custom2.metadata.get("quadrature_degree"), is((Object) 2));
  }

  /** Restriction propagation removes integrals that are zero; geometry
   * lowering keeps them. */
  @Test void testZeroIntegrands() {
    final Integral zero = Integral.of(expr.zero(), IntegralType.CELL, mesh);
    final Integral volume =
        Integral.of(expr.geometric(Op.CELL_VOLUME, mesh), IntegralType.CELL,
            mesh);
    final Form form =
        Transforms.lowerGeometry(Form.of(zero, volume), ImmutableSet.of());
    assertThat(form.integrals, hasSize(2));
    assertThat(form.integrals.get(0), sameInstance(zero));
    assertThat(form.integrals.get(1).integrand.op, is(Op.ABS));

    final Form form2 =
        Transforms.propagateRestrictions(Form.of(zero), true);
    assertThat(form2.isEmpty(), is(true));

    // A literal 0.0 is not the zero expression, and is kept.
    final Integral zeroFloat =
        Integral.of(expr.floatValue(0d), IntegralType.INTERIOR_FACET, mesh);
    final Form form3 = Form.of(zeroFloat);
    assertThat(Transforms.propagateRestrictions(form3, true),
        sameInstance(form3));
  }

  @Test void testPropagateRestrictionsOnlyOnInteriorFacets() {
    final Integral cell = Integral.of(expr.times(v, f), IntegralType.CELL,
        mesh);
    final Integral exteriorFacet =
        Integral.of(expr.times(v, f), IntegralType.EXTERIOR_FACET, mesh);
    final Form form = Form.of(cell, exteriorFacet);
    assertThat(Transforms.propagateRestrictions(form, true),
        sameInstance(form));

    final Integral interiorFacet =
        Integral.of(expr.times(expr.restricted(v, Side.MINUS), f),
            IntegralType.INTERIOR_FACET, mesh);
    final Form form2 =
        Transforms.propagateRestrictions(Form.of(cell, interiorFacet), true);
    assertThat(form2.integrals.get(0), sameInstance(cell));
    assertThat(form2.integrals.get(1).integrand,
        is(
            expr.times(expr.restricted(v, Side.MINUS),
                expr.restricted(f, Side.PLUS))));

    final Form form3 =
        Form.of(
            Integral.of(expr.times(v, f), IntegralType.INTERIOR_FACET_HORIZ,
                mesh));
    assertThrows(RestrictionException.class,
        () -> Transforms.propagateRestrictions(form3, true));
  }

  @Test void testTracer() {
    final List<RewriteException> warnings = new ArrayList<>();
    final List<Expr> lowered = new ArrayList<>();
    final List<Expr> propagated = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnRewrite(
            Tracers.withOnRewrite(
                Tracers.withOnWarning(Tracers.empty(), warnings::add),
                Transforms.PROPAGATE_RESTRICTIONS, propagated::add),
            Transforms.LOWER_GEOMETRY, lowered::add);

    final Mesh quadrilateral =
        Mesh.linear("quadrilateral", CellType.QUADRILATERAL);
    final Expr volume = expr.geometric(Op.CELL_VOLUME, quadrilateral);
    final Form form =
        Form.of(Integral.of(volume, IntegralType.CELL, quadrilateral));
    assertThat(Transforms.lowerGeometry(form, ImmutableSet.of(), tracer),
        sameInstance(form));
    assertThat(warnings, hasSize(1));
    assertThat(warnings.get(0).op(), is(Op.CELL_VOLUME));
    assertThat(lowered, hasSize(1));
    assertThat(lowered.get(0), sameInstance(volume));
    assertThat(propagated.isEmpty(), is(true));

    final Form form2 =
        Form.of(
            Integral.of(expr.restricted(v, Side.PLUS),
                IntegralType.INTERIOR_FACET, mesh));
    Transforms.propagateRestrictions(form2, true, tracer);
    assertThat(propagated, hasSize(1));
    assertThat(lowered, hasSize(1));
  }

  @Test void testPropertiesFromSettings() {
    final Map<Prop, Object> props =
        Transforms.properties(
            ImmutableMap.of("USE_DEFAULT_SIDE", "false",
                "preserve", "jacobian"));
    assertThat(props.get(Prop.USE_DEFAULT_SIDE), is((Object) false));
    assertThat(Transforms.showProperties(props).toString(),
        is("{preserve=jacobian, useDefaultSide=false}"));
    assertThat(
        Transforms.showProperties(new EnumMap<>(Prop.class)).toString(),
        is("{preserve=, useDefaultSide=true}"));

    final IllegalArgumentException x =
        assertThrows(IllegalArgumentException.class,
            () -> Transforms.properties(ImmutableMap.of("sides", "true")));
    assertThat(x.getMessage(), is("property sides not found"));
    assertThrows(IllegalArgumentException.class,
        () -> Transforms.properties(
            ImmutableMap.of("useDefaultSide", "maybe")));
  }

  @Test void testProperties() {
    final Map<Prop, Object> props = new EnumMap<>(Prop.class);
    Prop.PRESERVE.set(props, "jacobian");
    final Form form =
        Form.of(
            Integral.of(expr.geometric(Op.JACOBIAN_DETERMINANT, mesh),
                IntegralType.CELL, mesh));
    final Form form2 =
        Transforms.lowerGeometry(form, props, Tracers.empty());
    assertThat(form2.integrals.get(0).integrand, containsNode(j));

    final Form form3 =
        Form.of(
            Integral.of(expr.times(expr.restricted(v, Side.PLUS), f),
                IntegralType.INTERIOR_FACET, mesh));
    Prop.USE_DEFAULT_SIDE.setLenient(props, "false");
    final Form form4 =
        Transforms.propagateRestrictions(form3, props, Tracers.empty());
    assertThat(form4, sameInstance(form3));

    Prop.USE_DEFAULT_SIDE.set(props, null);
    final Form form5 =
        Transforms.propagateRestrictions(form3, props, Tracers.empty());
    assertThat(form5.integrals.get(0).integrand,
        containsNode(expr.restricted(f, Side.PLUS)));
  }
}

// End TransformsTest.java
