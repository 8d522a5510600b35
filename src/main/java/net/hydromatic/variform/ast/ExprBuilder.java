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

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.variform.domain.Domain;
import net.hydromatic.variform.domain.FunctionSpace;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds expression nodes.
 *
 * <p>Arithmetic on two numeric literals is folded. Products of tensors with
 * scalars are expressed via indices, and an index that occurs in both
 * operands of a product is summed over. */
public enum ExprBuilder {
  /** The singleton instance of the expression builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  expr;

  private final Exprs.IntValue minusOne = new Exprs.IntValue(-1);

  private final Exprs.IntValue one = new Exprs.IntValue(1);

  private final Exprs.Zero scalarZero =
      new Exprs.Zero(Exprs.SCALAR, Exprs.NO_FREE_INDICES);

  // terminals

  /** Creates a geometric quantity of a given kind on a domain. */
  public Exprs.GeometricQuantity geometric(Op op, Domain domain) {
    return new Exprs.GeometricQuantity(op, domain);
  }

  /** Creates an argument (test or trial function). */
  public Exprs.Argument argument(FunctionSpace space, int number) {
    return new Exprs.Argument(space, number, null);
  }

  /** Creates an argument that is a part of a mixed argument. */
  public Exprs.Argument argument(FunctionSpace space, int number,
      @Nullable Integer part) {
    return new Exprs.Argument(space, number, part);
  }

  /** Creates a coefficient. */
  public Exprs.Coefficient coefficient(FunctionSpace space, int count) {
    return new Exprs.Coefficient(space, count);
  }

  /** Creates a constant. */
  public Exprs.Constant constant(Domain domain, int count, int... shape) {
    return new Exprs.Constant(domain, count, ImmutableIntArray.copyOf(shape));
  }

  /** Creates a floating-point literal. */
  public Exprs.FloatValue floatValue(double value) {
    return new Exprs.FloatValue(value);
  }

  /** Creates an integer literal. */
  public Exprs.IntValue intValue(long value) {
    return value == -1 ? minusOne
        : value == 1 ? one
        : new Exprs.IntValue(value);
  }

  /** Creates a scalar zero. */
  public Exprs.Zero zero() {
    return scalarZero;
  }

  /** Creates a zero tensor. */
  public Exprs.Zero zero(int... shape) {
    return shape.length == 0 ? scalarZero
        : new Exprs.Zero(ImmutableIntArray.copyOf(shape),
            Exprs.NO_FREE_INDICES);
  }

  /** Creates a multi-index. */
  public Exprs.MultiIndex multiIndex(IndexBase... indices) {
    return new Exprs.MultiIndex(ImmutableList.copyOf(indices));
  }

  /** Creates a multi-index. */
  public Exprs.MultiIndex multiIndex(List<? extends IndexBase> indices) {
    return new Exprs.MultiIndex(ImmutableList.copyOf(indices));
  }

  /** Creates a label. */
  public Exprs.Label label(int count) {
    return new Exprs.Label(count);
  }

  // arithmetic

  /** Creates {@code a + b}. */
  public Expr plus(Expr a, Expr b) {
    if (a instanceof Exprs.ScalarValue && b instanceof Exprs.ScalarValue) {
      if (a instanceof Exprs.IntValue && b instanceof Exprs.IntValue) {
        return intValue(((Exprs.IntValue) a).value
            + ((Exprs.IntValue) b).value);
      }
      return floatValue(((Exprs.ScalarValue) a).doubleValue()
          + ((Exprs.ScalarValue) b).doubleValue());
    }
    if (a.op == Op.ZERO && a.shape.equals(b.shape)
        && a.freeIndices.equals(b.freeIndices)) {
      return b;
    }
    if (b.op == Op.ZERO && a.shape.equals(b.shape)
        && a.freeIndices.equals(b.freeIndices)) {
      return a;
    }
    return Exprs.Binary.create(Op.SUM, a, b);
  }

  /** Creates {@code a - b}. */
  public Expr minus(Expr a, Expr b) {
    return plus(a, negate(b));
  }

  /** Creates {@code -a}, represented as {@code -1 * a}. */
  public Expr negate(Expr a) {
    return times(minusOne, a);
  }

  /** Creates {@code a * b}.
   *
   * <p>If one operand is a tensor and the other a scalar, the result is
   * a component tensor; indices repeated in two scalar operands are summed
   * over.
   *
   * @throws IllegalArgumentException if both operands are tensors
   */
  public Expr times(Expr a, Expr b) {
    if (a.shape.isEmpty() && b.shape.isEmpty()) {
      if (a instanceof Exprs.ScalarValue && b instanceof Exprs.ScalarValue) {
        if (a instanceof Exprs.IntValue && b instanceof Exprs.IntValue) {
          return intValue(((Exprs.IntValue) a).value
              * ((Exprs.IntValue) b).value);
        }
        return floatValue(((Exprs.ScalarValue) a).doubleValue()
            * ((Exprs.ScalarValue) b).doubleValue());
      }
      final List<Index> repeated = new ArrayList<>();
      for (Index index : a.freeIndices.keySet()) {
        if (b.freeIndices.containsKey(index)) {
          repeated.add(index);
        }
      }
      Expr p = Exprs.Binary.create(Op.PRODUCT, a, b);
      for (Index index : repeated) {
        p = Exprs.IndexSum.create(p, multiIndex(index));
      }
      return p;
    }
    if (a.shape.isEmpty()) {
      final Index[] indices = Index.indices(b.rank());
      return componentTensor(times(a, indexed(b, indices)), indices);
    }
    if (b.shape.isEmpty()) {
      final Index[] indices = Index.indices(a.rank());
      return componentTensor(times(indexed(a, indices), b), indices);
    }
    throw new IllegalArgumentException("cannot multiply tensors of shape "
        + a.shape + " and " + b.shape + "; use indices");
  }

  /** Creates {@code a / b}, where {@code b} is a scalar. */
  public Expr divide(Expr a, Expr b) {
    checkArgument(b.shape.isEmpty(), "cannot divide by a tensor");
    if (a instanceof Exprs.ScalarValue && b instanceof Exprs.ScalarValue) {
      return floatValue(((Exprs.ScalarValue) a).doubleValue()
          / ((Exprs.ScalarValue) b).doubleValue());
    }
    if (!a.shape.isEmpty()) {
      final Index[] indices = Index.indices(a.rank());
      return componentTensor(divide(indexed(a, indices), b), indices);
    }
    return Exprs.Binary.create(Op.DIVISION, a, b);
  }

  /** Creates {@code a ** b}. */
  public Expr power(Expr a, Expr b) {
    if (a instanceof Exprs.ScalarValue && b instanceof Exprs.ScalarValue) {
      return floatValue(
          Math.pow(((Exprs.ScalarValue) a).doubleValue(),
              ((Exprs.ScalarValue) b).doubleValue()));
    }
    return Exprs.Binary.create(Op.POWER, a, b);
  }

  /** Creates {@code max_value(a, b)}. */
  public Expr maxValue(Expr a, Expr b) {
    if (a instanceof Exprs.ScalarValue && b instanceof Exprs.ScalarValue) {
      return floatValue(Math.max(((Exprs.ScalarValue) a).doubleValue(),
          ((Exprs.ScalarValue) b).doubleValue()));
    }
    return Exprs.Binary.create(Op.MAX_VALUE, a, b);
  }

  /** Creates {@code min_value(a, b)}. */
  public Expr minValue(Expr a, Expr b) {
    if (a instanceof Exprs.ScalarValue && b instanceof Exprs.ScalarValue) {
      return floatValue(Math.min(((Exprs.ScalarValue) a).doubleValue(),
          ((Exprs.ScalarValue) b).doubleValue()));
    }
    return Exprs.Binary.create(Op.MIN_VALUE, a, b);
  }

  /** Creates {@code abs(a)}. */
  public Expr abs(Expr a) {
    if (a instanceof Exprs.ScalarValue) {
      return floatValue(Math.abs(((Exprs.ScalarValue) a).doubleValue()));
    }
    return Exprs.Unary.create(Op.ABS, a);
  }

  /** Creates {@code sqrt(a)}. */
  public Expr sqrt(Expr a) {
    if (a instanceof Exprs.ScalarValue) {
      return floatValue(Math.sqrt(((Exprs.ScalarValue) a).doubleValue()));
    }
    return Exprs.Unary.create(Op.SQRT, a);
  }

  /** Creates {@code real(a)}. */
  public Expr real(Expr a) {
    if (a instanceof Exprs.ScalarValue) {
      return a;
    }
    return Exprs.Unary.create(Op.REAL, a);
  }

  /** Creates {@code conj(a)}. */
  public Expr conj(Expr a) {
    if (a instanceof Exprs.ScalarValue) {
      return a;
    }
    return Exprs.Unary.create(Op.CONJ, a);
  }

  // tensor algebra

  /** Creates {@code a[i, j, ...]}. */
  public Expr indexed(Expr a, IndexBase... indices) {
    if (indices.length == 0 && a.rank() == 0) {
      return a;
    }
    if (a instanceof Exprs.ListTensor
        && indices.length > 0
        && indices[0] instanceof FixedIndex) {
      final Expr item =
          a.operand(((FixedIndex) indices[0]).value);
      final IndexBase[] rest = new IndexBase[indices.length - 1];
      System.arraycopy(indices, 1, rest, 0, rest.length);
      return indexed(item, rest);
    }
    return Exprs.Indexed.create(a, multiIndex(indices));
  }

  /** Creates {@code a[i, j, ...]} with fixed indices. */
  public Expr indexed(Expr a, int... indices) {
    final IndexBase[] fixedIndices = new IndexBase[indices.length];
    for (int i = 0; i < indices.length; i++) {
      fixedIndices[i] = FixedIndex.of(indices[i]);
    }
    return indexed(a, fixedIndices);
  }

  /** Creates {@code as_tensor(e, (i, j, ...))}. */
  public Expr componentTensor(Expr e, Index... indices) {
    if (indices.length == 0) {
      return e;
    }
    return Exprs.ComponentTensor.create(e, multiIndex(indices));
  }

  /** Creates the sum of {@code e} over the range of index {@code i}. */
  public Expr indexSum(Expr e, Index index) {
    return Exprs.IndexSum.create(e, multiIndex(index));
  }

  /** Creates a vector (or higher-rank tensor) from its components. */
  public Expr listTensor(List<? extends Expr> items) {
    return Exprs.ListTensor.create(ImmutableList.copyOf(items));
  }

  /** Creates a vector (or higher-rank tensor) from its components. */
  public Expr listTensor(Expr... items) {
    return Exprs.ListTensor.create(ImmutableList.copyOf(items));
  }

  /** Creates the vector {@code A[:, c]}, column {@code c} of a matrix. */
  public Expr column(Expr a, int c) {
    checkArgument(a.rank() == 2, "not a matrix: %s", a);
    final Index i = Index.create();
    return componentTensor(indexed(a, i, FixedIndex.of(c)), i);
  }

  /** Creates the tensor {@code A[r, ...]}, one slice along the first axis of
   * a tensor. */
  public Expr row(Expr a, int r) {
    checkArgument(a.rank() >= 1, "not a tensor: %s", a);
    final Index[] indices = Index.indices(a.rank() - 1);
    final IndexBase[] all = new IndexBase[a.rank()];
    all[0] = FixedIndex.of(r);
    System.arraycopy(indices, 0, all, 1, indices.length);
    return componentTensor(indexed(a, all), indices);
  }

  // derivatives, restrictions and labels

  /** Creates the gradient of {@code e} with respect to physical
   * coordinates. */
  public Expr grad(Expr e) {
    final Domain domain = Exprs.extractUniqueDomain(e);
    return Exprs.Derivative.create(Op.GRAD, e, domain.geometricDimension());
  }

  /** Creates the gradient of {@code e} with respect to reference
   * coordinates. */
  public Expr referenceGrad(Expr e) {
    final Domain domain = Exprs.extractUniqueDomain(e);
    return Exprs.Derivative.create(Op.REFERENCE_GRAD, e,
        domain.topologicalDimension());
  }

  /** Creates the reference value of a form argument. */
  public Expr referenceValue(Expr f) {
    return Exprs.Unary.create(Op.REFERENCE_VALUE, f);
  }

  /** Creates a labeled expression. */
  public Expr variable(Expr e, Exprs.Label label) {
    return Exprs.Variable.create(e, label);
  }

  /** Creates {@code e('+')} or {@code e('-')}.
   *
   * <p>Does not check whether {@code e} is already restricted. */
  public Exprs.Restricted restricted(Expr e, Side side) {
    return Exprs.Restricted.create(e, side);
  }
}

// End ExprBuilder.java
