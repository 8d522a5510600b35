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
package net.hydromatic.variform;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.ImmutableIntArray;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.ast.Exprs;
import net.hydromatic.variform.ast.FixedIndex;
import net.hydromatic.variform.ast.Index;
import net.hydromatic.variform.ast.IndexBase;

/** Evaluates an expression numerically, given values for its terminals.
 *
 * <p>A value may be bound to any node, not just a terminal; for example, to
 * the reference gradient of the spatial coordinate. Bindings are found by
 * structural equality. Complex conjugate and real part are treated as the
 * identity. */
public class ExprEvaluator {
  private final Map<Expr, Tensor> bindings = new HashMap<>();

  /** Binds a scalar value to a node. */
  public ExprEvaluator bind(Expr e, double value) {
    return bind(e, new Tensor(ImmutableIntArray.of(), new double[] {value}));
  }

  /** Binds a vector value to a node. */
  public ExprEvaluator bindVector(Expr e, double... values) {
    return bind(e, new Tensor(ImmutableIntArray.of(values.length), values));
  }

  /** Binds a matrix value to a node. */
  public ExprEvaluator bindMatrix(Expr e, double[][] rows) {
    final int m = rows.length;
    final int n = rows[0].length;
    final double[] values = new double[m * n];
    for (int i = 0; i < m; i++) {
      System.arraycopy(rows[i], 0, values, i * n, n);
    }
    return bind(e, new Tensor(ImmutableIntArray.of(m, n), values));
  }

  private ExprEvaluator bind(Expr e, Tensor t) {
    checkArgument(e.shape.equals(t.shape),
        "value of shape %s for node %s of shape %s", t.shape, e, e.shape);
    bindings.put(e, t);
    return this;
  }

  /** Evaluates a scalar expression. */
  public double scalar(Expr e) {
    checkArgument(e.isTrueScalar(), "not a scalar: %s", e);
    return evaluate(e, ImmutableMap.of()).values[0];
  }

  /** Evaluates a vector expression. */
  public double[] vector(Expr e) {
    checkArgument(e.rank() == 1, "not a vector: %s", e);
    return evaluate(e, ImmutableMap.of()).values;
  }

  /** Evaluates a matrix expression. */
  public double[][] matrix(Expr e) {
    checkArgument(e.rank() == 2, "not a matrix: %s", e);
    final Tensor t = evaluate(e, ImmutableMap.of());
    final int m = t.shape.get(0);
    final int n = t.shape.get(1);
    final double[][] rows = new double[m][n];
    for (int i = 0; i < m; i++) {
      System.arraycopy(t.values, i * n, rows[i], 0, n);
    }
    return rows;
  }

  private Tensor evaluate(Expr e, Map<Index, Integer> env) {
    final Tensor bound = bindings.get(e);
    if (bound != null) {
      return bound;
    }
    switch (e.op) {
    case FLOAT_VALUE:
    case INT_VALUE:
      return Tensor.scalar(((Exprs.ScalarValue) e).doubleValue());

    case ZERO:
      return new Tensor(e.shape, new double[size(e.shape)]);

    case SUM:
      return zip(evaluate(e.operand(0), env), evaluate(e.operand(1), env),
          Double::sum);

    case PRODUCT:
      return zip(evaluate(e.operand(0), env), evaluate(e.operand(1), env),
          (a, b) -> a * b);

    case DIVISION:
      return zip(evaluate(e.operand(0), env), evaluate(e.operand(1), env),
          (a, b) -> a / b);

    case POWER:
      return zip(evaluate(e.operand(0), env), evaluate(e.operand(1), env),
          Math::pow);

    case MIN_VALUE:
      return zip(evaluate(e.operand(0), env), evaluate(e.operand(1), env),
          Math::min);

    case MAX_VALUE:
      return zip(evaluate(e.operand(0), env), evaluate(e.operand(1), env),
          Math::max);

    case ABS:
      return zip(evaluate(e.operand(0), env), Tensor.scalar(0d),
          (a, b) -> Math.abs(a));

    case SQRT:
      return zip(evaluate(e.operand(0), env), Tensor.scalar(0d),
          (a, b) -> Math.sqrt(a));

    case REAL:
    case CONJ:
    case VARIABLE:
      return evaluate(e.operand(0), env);

    case INDEXED:
      final Exprs.Indexed indexed = (Exprs.Indexed) e;
      final Tensor t = evaluate(indexed.tensor(), env);
      final List<IndexBase> indices = indexed.multiIndex().indices;
      final int[] position = new int[indices.size()];
      for (int k = 0; k < position.length; k++) {
        final IndexBase index = indices.get(k);
        position[k] = index instanceof FixedIndex
            ? ((FixedIndex) index).value
            : env.get((Index) index);
      }
      return Tensor.scalar(t.get(position));

    case COMPONENT_TENSOR:
      final Exprs.ComponentTensor c = (Exprs.ComponentTensor) e;
      final List<Index> componentIndices = c.multiIndex().freeIndexList();
      final double[] values = new double[size(c.shape)];
      for (int flat = 0; flat < values.length; flat++) {
        final Map<Index, Integer> env2 = new HashMap<>(env);
        int remainder = flat;
        for (int k = componentIndices.size() - 1; k >= 0; k--) {
          final int dim = c.shape.get(k);
          env2.put(componentIndices.get(k), remainder % dim);
          remainder /= dim;
        }
        values[flat] = evaluate(c.expression(), env2).values[0];
      }
      return new Tensor(c.shape, values);

    case INDEX_SUM:
      final Exprs.IndexSum sum = (Exprs.IndexSum) e;
      double total = 0d;
      for (int k = 0; k < sum.dimension(); k++) {
        final Map<Index, Integer> env2 = new HashMap<>(env);
        env2.put(sum.index(), k);
        total += evaluate(sum.summand(), env2).values[0];
      }
      return Tensor.scalar(total);

    case LIST_TENSOR:
      final double[] items = new double[size(e.shape)];
      int offset = 0;
      for (Expr item : e.operands()) {
        final Tensor itemValue = evaluate(item, env);
        System.arraycopy(itemValue.values, 0, items, offset,
            itemValue.values.length);
        offset += itemValue.values.length;
      }
      return new Tensor(e.shape, items);

    default:
      throw new IllegalArgumentException("no value for " + e);
    }
  }

  private static int size(ImmutableIntArray shape) {
    int n = 1;
    for (int i = 0; i < shape.length(); i++) {
      n *= shape.get(i);
    }
    return n;
  }

  /** Applies an operator to corresponding elements of two tensors of the
   * same shape, or of a tensor and a scalar. */
  private static Tensor zip(Tensor a, Tensor b, DoubleBinaryOperator op) {
    final double[] values = new double[a.values.length];
    for (int i = 0; i < values.length; i++) {
      values[i] =
          op.applyAsDouble(a.values[i],
              b.values.length == 1 ? b.values[0] : b.values[i]);
    }
    return new Tensor(a.shape, values);
  }

  /** Value of a node; a tensor stored in row-major order. */
  private static class Tensor {
    final ImmutableIntArray shape;
    final double[] values;

    Tensor(ImmutableIntArray shape, double[] values) {
      checkArgument(values.length == size(shape));
      this.shape = shape;
      this.values = values;
    }

    static Tensor scalar(double value) {
      return new Tensor(ImmutableIntArray.of(), new double[] {value});
    }

    double get(int... position) {
      int flat = 0;
      for (int k = 0; k < position.length; k++) {
        flat = flat * shape.get(k) + position[k];
      }
      return values[flat];
    }
  }
}

// End ExprEvaluator.java
