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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.UnaryOperator;
import net.hydromatic.variform.ast.Op;

/** Variational form; a sum of integrals. */
public final class Form {
  public final ImmutableList<Integral> integrals;

  private Form(ImmutableList<Integral> integrals) {
    this.integrals = integrals;
  }

  /** Creates a form. */
  public static Form of(List<Integral> integrals) {
    return new Form(ImmutableList.copyOf(integrals));
  }

  /** Creates a form. */
  public static Form of(Integral... integrals) {
    return new Form(ImmutableList.copyOf(integrals));
  }

  /** Returns whether this form has no integrals. */
  public boolean isEmpty() {
    return integrals.isEmpty();
  }

  /** Applies a transformation to each integral, and returns a form of the
   * results. Returns this form if every integral is unchanged. */
  public Form map(UnaryOperator<Integral> transform) {
    final ImmutableList.Builder<Integral> b = ImmutableList.builder();
    boolean changed = false;
    for (Integral integral : integrals) {
      final Integral integral2 = transform.apply(integral);
      if (integral2 != integral) {
        changed = true;
      }
      b.add(integral2);
    }
    return changed ? new Form(b.build()) : this;
  }

  /** Returns a form without the integrals whose integrand is
   * {@link Op#ZERO}, or this form if there are none. */
  public Form removeZeroIntegrals() {
    final ImmutableList.Builder<Integral> b = ImmutableList.builder();
    boolean changed = false;
    for (Integral integral : integrals) {
      if (integral.integrand.op == Op.ZERO) {
        changed = true;
      } else {
        b.add(integral);
      }
    }
    return changed ? new Form(b.build()) : this;
  }

  @Override public int hashCode() {
    return integrals.hashCode();
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Form
        && integrals.equals(((Form) o).integrals);
  }

  @Override public String toString() {
    return integrals.toString();
  }
}

// End Form.java
