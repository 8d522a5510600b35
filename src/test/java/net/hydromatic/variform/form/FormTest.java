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
package net.hydromatic.variform.form;

import static net.hydromatic.variform.ast.ExprBuilder.expr;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.core.Is.is;
import static org.hamcrest.core.IsSame.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.ast.Op;
import net.hydromatic.variform.domain.CellType;
import net.hydromatic.variform.domain.FunctionSpace;
import net.hydromatic.variform.domain.Mesh;
import net.hydromatic.variform.domain.SobolevSpace;
import org.junit.jupiter.api.Test;

/** Tests for {@link Form}, {@link Integral} and {@link IntegralType}. */
public class FormTest {
  private final Mesh mesh = Mesh.linear("mesh", CellType.TRIANGLE);
  private final Expr f =
      expr.coefficient(FunctionSpace.of(mesh, SobolevSpace.H1), 1);
  private final Expr g =
      expr.coefficient(FunctionSpace.of(mesh, SobolevSpace.H1), 2);

  @Test void testIntegralType() {
    assertThat(IntegralType.of("interior_facet"),
        is(IntegralType.INTERIOR_FACET));
    assertThat(IntegralType.INTERIOR_FACET_VERT.isInteriorFacet(), is(true));
    assertThat(IntegralType.EXTERIOR_FACET.isInteriorFacet(), is(false));
    assertThat(IntegralType.CUTCELL.isCustom(), is(true));
    assertThat(IntegralType.CELL.isCustom(), is(false));
    assertThat(IntegralType.VERTEX.isPoint(), is(true));
    final IllegalArgumentException x =
        assertThrows(IllegalArgumentException.class,
            () -> IntegralType.of("surface"));
    assertThat(x.getMessage(), is("unknown integral type 'surface'"));
  }

  @Test void testReconstruct() {
    final Integral integral = Integral.of(f, IntegralType.CELL, mesh);
    assertThat(integral.subdomainId, is(Integral.EVERYWHERE));
    assertThat(integral.reconstruct(f), sameInstance(integral));
    final Integral integral2 = integral.reconstruct(g);
    assertThat(integral2.integrand, sameInstance(g));
    assertThat(integral2.type, is(IntegralType.CELL));
    assertThat(integral2.domain, sameInstance(mesh));
  }

  @Test void testMap() {
    final Form form =
        Form.of(Integral.of(f, IntegralType.CELL, mesh),
            Integral.of(g, IntegralType.EXTERIOR_FACET, mesh));
    assertThat(form.map(i -> i), sameInstance(form));

    final Form form2 =
        form.map(i -> i.integrand == g ? i.reconstruct(f) : i);
    assertThat(form2.integrals, hasSize(2));
    assertThat(form2.integrals.get(0), sameInstance(form.integrals.get(0)));
    assertThat(form2.integrals.get(1).integrand, sameInstance(f));

    final Form form3 = form.map(i -> i.reconstruct(expr.zero()));
    assertThat(form3.integrals, hasSize(2));
    assertThat(form3.integrals.get(0).integrand.op, is(Op.ZERO));
  }

  @Test void testRemoveZeroIntegrals() {
    final Integral zero = Integral.of(expr.zero(), IntegralType.CELL, mesh);
    final Integral one = Integral.of(f, IntegralType.CELL, mesh);
    final Form form = Form.of(zero, one, zero);
    final Form form2 = form.removeZeroIntegrals();
    assertThat(form2.integrals, hasSize(1));
    assertThat(form2.integrals.get(0), sameInstance(one));
    assertThat(form2.removeZeroIntegrals(), sameInstance(form2));
    assertThat(Form.of(zero).removeZeroIntegrals().isEmpty(), is(true));

    // Only the zero expression is removed, not a literal 0.
    final Form form3 =
        Form.of(Integral.of(expr.intValue(0), IntegralType.CELL, mesh));
    assertThat(form3.removeZeroIntegrals(), sameInstance(form3));
  }
}

// End FormTest.java
