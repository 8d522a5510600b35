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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.ast.Op;
import net.hydromatic.variform.form.Form;
import net.hydromatic.variform.form.Integral;
import net.hydromatic.variform.form.IntegralType;
import net.hydromatic.variform.rewrite.DagMapper;

/** Entry points for the passes that rewrite forms and expressions. */
public abstract class Transforms {
  /** Name of the geometry lowering pass, as reported to
   * {@link Tracer#onRewrite}. */
  public static final String LOWER_GEOMETRY = "lowerGeometry";

  /** Name of the restriction propagation pass. */
  public static final String PROPAGATE_RESTRICTIONS = "propagateRestrictions";

  private static final ImmutableSet<Op> CUSTOM_PRESERVE =
      Sets.immutableEnumSet(Op.SPATIAL_COORDINATE, Op.JACOBIAN);

  private static final ImmutableSet<Op> DEFAULT_PRESERVE =
      Sets.immutableEnumSet(Op.CELL_COORDINATE);

  private Transforms() {}

  /** Returns the kinds of geometric quantity that are always preserved when
   * lowering an integral of a given type.
   *
   * <p>Custom and point integrals keep the spatial coordinate and the
   * Jacobian; other integrals keep the cell coordinate. */
  public static Set<Op> automaticPreserve(IntegralType type) {
    return type.isCustom() || type.isPoint()
        ? CUSTOM_PRESERVE
        : DEFAULT_PRESERVE;
  }

  /** Parses a comma-separated list of geometric quantity kinds, such as
   * "jacobian, CELL_VOLUME".
   *
   * @throws IllegalArgumentException if a name is not a kind, or is not a
   * geometric kind
   */
  public static Set<Op> parsePreserve(String s) {
    final Set<Op> set = EnumSet.noneOf(Op.class);
    for (String name : Splitter.on(',').trimResults().omitEmptyStrings()
        .split(s)) {
      final Op op = Op.lookup(name);
      checkArgument(op.isGeometric(), "not a geometric quantity: %s", name);
      set.add(op);
    }
    return Sets.immutableEnumSet(set);
  }

  /** Creates a property map from name-value pairs such as
   * {@code ("useDefaultSide", "false")}. A name may be in camel or upper
   * case; a string value is converted to the property's type.
   *
   * @throws IllegalArgumentException if a name is not a property, or a
   * value is not valid for its property
   */
  public static Map<Prop, Object> properties(Map<String, ?> settings) {
    final Map<Prop, Object> props = new EnumMap<>(Prop.class);
    settings.forEach((name, value) ->
        Prop.lookup(name).setLenient(props, value));
    return props;
  }

  /** Returns the value of every property, including those that have their
   * default value, keyed by camel name and sorted by name. */
  public static Map<String, Object> showProperties(Map<Prop, Object> props) {
    final ImmutableMap.Builder<String, Object> b = ImmutableMap.builder();
    for (Prop prop : Prop.BY_CAMEL_NAME) {
      b.put(prop.camelName, prop.get(props));
    }
    return b.build();
  }

  // Geometry lowering

  /** Lowers the geometric quantities in each integral of a form, printing
   * warnings to {@link System#err}. */
  public static Form lowerGeometry(Form form, Set<Op> preserve) {
    return lowerGeometry(form, preserve, Tracers.printWarnings(System.err));
  }

  /** Lowers the geometric quantities in each integral of a form, taking the
   * extra kinds to preserve from the {@link Prop#PRESERVE} property. */
  public static Form lowerGeometry(Form form, Map<Prop, Object> props,
      Tracer tracer) {
    return lowerGeometry(form,
        parsePreserve(Prop.PRESERVE.stringValue(props)), tracer);
  }

  /** Lowers the geometric quantities in each integral of a form.
   *
   * @param form Form
   * @param preserve Kinds to preserve, in addition to those that are always
   *   preserved for each integral's type
   * @param tracer Receives warnings
   * @return Form with lowered integrands
   */
  public static Form lowerGeometry(Form form, Set<Op> preserve,
      Tracer tracer) {
    return form.map(integral -> lowerGeometry(integral, preserve, tracer));
  }

  /** Lowers the geometric quantities in the integrand of an integral. */
  public static Integral lowerGeometry(Integral integral, Set<Op> preserve,
      Tracer tracer) {
    final Set<Op> preserve2 =
        Sets.union(preserve, automaticPreserve(integral.type));
    return integral.reconstruct(
        lowerGeometry(integral.integrand, preserve2, tracer));
  }

  /** Lowers the geometric quantities in an expression, printing warnings to
   * {@link System#err}. No kinds are preserved automatically. */
  public static Expr lowerGeometry(Expr e, Set<Op> preserve) {
    return lowerGeometry(e, preserve, Tracers.printWarnings(System.err));
  }

  /** Lowers the geometric quantities in an expression. No kinds are
   * preserved automatically. */
  public static Expr lowerGeometry(Expr e, Set<Op> preserve, Tracer tracer) {
    final GeometryLowerer lowerer = new GeometryLowerer(preserve, tracer);
    final Expr e2 = DagMapper.map(e, lowerer);
    tracer.onRewrite(LOWER_GEOMETRY, e, e2);
    return e2;
  }

  // Restriction propagation

  /** Propagates restrictions towards the terminals in each interior-facet
   * integral of a form. Other integrals are unchanged. */
  public static Form propagateRestrictions(Form form, boolean useDefaultSide) {
    return propagateRestrictions(form, useDefaultSide, Tracers.empty());
  }

  /** Propagates restrictions, taking the "use default side" flag from the
   * {@link Prop#USE_DEFAULT_SIDE} property. */
  public static Form propagateRestrictions(Form form,
      Map<Prop, Object> props, Tracer tracer) {
    return propagateRestrictions(form,
        Prop.USE_DEFAULT_SIDE.booleanValue(props), tracer);
  }

  /** Propagates restrictions towards the terminals in each interior-facet
   * integral of a form, and removes integrals that are zero.
   *
   * <p>One propagator is shared by all integrals, so a sub-expression that
   * occurs in several integrals is rewritten once per side. */
  public static Form propagateRestrictions(Form form, boolean useDefaultSide,
      Tracer tracer) {
    final RestrictionPropagator propagator =
        new RestrictionPropagator(useDefaultSide);
    return form.map(integral -> {
      if (!integral.type.isInteriorFacet()) {
        return integral;
      }
      return integral.reconstruct(
          propagateRestrictions(integral.integrand, propagator, tracer));
    }).removeZeroIntegrals();
  }

  /** Propagates restrictions towards the terminals of an expression,
   * restricting unrestricted continuous quantities to the default side. */
  public static Expr propagateRestrictions(Expr e) {
    return propagateRestrictions(e, true);
  }

  /** Propagates restrictions towards the terminals of an expression. */
  public static Expr propagateRestrictions(Expr e, boolean useDefaultSide) {
    return propagateRestrictions(e, new RestrictionPropagator(useDefaultSide),
        Tracers.empty());
  }

  private static Expr propagateRestrictions(Expr e,
      RestrictionPropagator propagator, Tracer tracer) {
    final Expr e2 = DagMapper.map(e, propagator);
    tracer.onRewrite(PROPAGATE_RESTRICTIONS, e, e2);
    return e2;
  }
}

// End Transforms.java
