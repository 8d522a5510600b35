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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.primitives.ImmutableIntArray;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import net.hydromatic.variform.domain.CellType;
import net.hydromatic.variform.domain.Domain;
import net.hydromatic.variform.domain.FunctionSpace;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Expression nodes.
 *
 * <p>This class functions as a namespace, so that we can keep the class names
 * short. Use {@link ExprBuilder#expr} to create nodes. */
public class Exprs {
  private Exprs() {}

  static final ImmutableIntArray SCALAR = ImmutableIntArray.of();

  static final ImmutableSortedMap<Index, Integer> NO_FREE_INDICES =
      ImmutableSortedMap.of();

  /** Returns the unique domain referenced by the terminals of an expression.
   *
   * @throws IllegalArgumentException if there is no domain, or more than one
   */
  public static Domain extractUniqueDomain(Expr e) {
    final Set<Domain> domains = new LinkedHashSet<>();
    final Map<Expr, Boolean> seen = new IdentityHashMap<>();
    final Deque<Expr> stack = new ArrayDeque<>();
    stack.push(e);
    while (!stack.isEmpty()) {
      final Expr e2 = stack.pop();
      if (seen.put(e2, true) != null) {
        continue;
      }
      final @Nullable Domain domain = domainOf(e2);
      if (domain != null) {
        domains.add(domain);
      }
      e2.operands().forEach(stack::push);
    }
    checkArgument(domains.size() == 1,
        "expected exactly one domain in %s, found %s", e, domains);
    return domains.iterator().next();
  }

  private static @Nullable Domain domainOf(Expr e) {
    if (e instanceof GeometricQuantity) {
      return ((GeometricQuantity) e).domain;
    } else if (e instanceof FormArgument) {
      return ((FormArgument) e).space.domain;
    } else if (e instanceof Constant) {
      return ((Constant) e).domain;
    } else {
      return null;
    }
  }

  /** Merges the free indices of two expressions. */
  static ImmutableSortedMap<Index, Integer> merge(Expr a, Expr b) {
    if (b.freeIndices.isEmpty()) {
      return a.freeIndices;
    }
    if (a.freeIndices.isEmpty()) {
      return b.freeIndices;
    }
    final TreeMap<Index, Integer> map = new TreeMap<>(a.freeIndices);
    b.freeIndices.forEach((index, dim) -> {
      final Integer previous = map.put(index, dim);
      checkArgument(previous == null || previous.equals(dim),
          "index %s has dimension %s and %s", index, previous, dim);
    });
    return ImmutableSortedMap.copyOfSorted(map);
  }

  /** Removes indices from a map of free indices. */
  static ImmutableSortedMap<Index, Integer> minus(
      ImmutableSortedMap<Index, Integer> freeIndices, List<Index> indices) {
    final TreeMap<Index, Integer> map = new TreeMap<>(freeIndices);
    for (Index index : indices) {
      checkArgument(map.remove(index) != null, "index %s is not free", index);
    }
    return ImmutableSortedMap.copyOfSorted(map);
  }

  private static ImmutableIntArray dims(Op op, int... dims) {
    for (int dim : dims) {
      checkArgument(dim >= 0, "%s is not defined for this cell", op);
    }
    return ImmutableIntArray.copyOf(dims);
  }

  /** Base class of nodes that have no operands. */
  public abstract static class Terminal extends Expr {
    Terminal(Op op, ImmutableIntArray shape) {
      this(op, shape, NO_FREE_INDICES);
    }

    Terminal(Op op, ImmutableIntArray shape,
        ImmutableSortedMap<Index, Integer> freeIndices) {
      super(op, shape, freeIndices);
      checkArgument(op.isTerminal(), "not a terminal: %s", op);
    }

    @Override public List<Expr> operands() {
      return ImmutableList.of();
    }

    @Override Expr reconstruct(ImmutableList<Expr> operands) {
      checkArgument(operands.isEmpty(), "terminal has no operands");
      return this;
    }
  }

  /** Geometric quantity of a domain, such as its Jacobian or the facet
   * normal. */
  public static class GeometricQuantity extends Terminal {
    public final Domain domain;

    GeometricQuantity(Op op, Domain domain) {
      super(op, shapeOf(op, domain));
      this.domain = requireNonNull(domain);
      checkArgument(op.isGeometric(), "not geometric: %s", op);
    }

    /** Returns the shape of a quantity of a given kind on a given domain. */
    static ImmutableIntArray shapeOf(Op op, Domain domain) {
      final int gdim = domain.geometricDimension();
      final int tdim = domain.topologicalDimension();
      final CellType cell = domain.cell();
      switch (op) {
      case SPATIAL_COORDINATE:
      case CELL_ORIGIN:
      case FACET_ORIGIN:
      case CELL_NORMAL:
      case FACET_NORMAL:
        return dims(op, gdim);
      case CELL_COORDINATE:
      case FACET_CELL_COORDINATE:
      case CELL_FACET_ORIGIN:
      case REFERENCE_NORMAL:
        return dims(op, tdim);
      case FACET_COORDINATE:
        return dims(op, tdim - 1);
      case JACOBIAN:
        return dims(op, gdim, tdim);
      case FACET_JACOBIAN:
        return dims(op, gdim, tdim - 1);
      case RIDGE_JACOBIAN:
        return dims(op, gdim, tdim - 2);
      case JACOBIAN_INVERSE:
        return dims(op, tdim, gdim);
      case FACET_JACOBIAN_INVERSE:
        return dims(op, tdim - 1, gdim);
      case RIDGE_JACOBIAN_INVERSE:
        return dims(op, tdim - 2, gdim);
      case CELL_FACET_JACOBIAN:
        return dims(op, tdim, tdim - 1);
      case CELL_RIDGE_JACOBIAN:
        return dims(op, tdim, tdim - 2);
      case REFERENCE_CELL_EDGE_VECTORS:
        return dims(op, cell.numEdges, tdim);
      case REFERENCE_FACET_EDGE_VECTORS:
        return dims(op, cell.numFacetEdges, tdim);
      case CELL_VERTICES:
        return dims(op, cell.numVertices, gdim);
      case CELL_EDGE_VECTORS:
        return dims(op, cell.numEdges, gdim);
      case FACET_EDGE_VECTORS:
        return dims(op, cell.numFacetEdges, gdim);
      default:
        return SCALAR;
      }
    }

    @Override boolean payloadEquals(Expr e) {
      return domain.equals(((GeometricQuantity) e).domain);
    }

    @Override int payloadHashCode() {
      return domain.hashCode();
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(op.symbol);
    }
  }

  /** Argument or coefficient of a form; a function in a function space. */
  public abstract static class FormArgument extends Terminal {
    public final FunctionSpace space;

    FormArgument(Op op, FunctionSpace space) {
      super(op, space.valueShape);
      this.space = requireNonNull(space);
    }
  }

  /** Argument of a form (test or trial function). */
  public static class Argument extends FormArgument {
    public final int number;
    public final @Nullable Integer part;

    Argument(FunctionSpace space, int number, @Nullable Integer part) {
      super(Op.ARGUMENT, space);
      this.number = number;
      this.part = part;
    }

    @Override boolean payloadEquals(Expr e) {
      final Argument that = (Argument) e;
      return number == that.number
          && Objects.equals(part, that.part)
          && space.equals(that.space);
    }

    @Override int payloadHashCode() {
      return Objects.hash(number, part, space);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(op.symbol).append("_").append(Integer.toString(number));
    }
  }

  /** Coefficient of a form; a known function. */
  public static class Coefficient extends FormArgument {
    public final int count;

    Coefficient(FunctionSpace space, int count) {
      super(Op.COEFFICIENT, space);
      this.count = count;
    }

    @Override boolean payloadEquals(Expr e) {
      final Coefficient that = (Coefficient) e;
      return count == that.count && space.equals(that.space);
    }

    @Override int payloadHashCode() {
      return Objects.hash(count, space);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(op.symbol).append("_").append(Integer.toString(count));
    }
  }

  /** Constant over a domain, whose value is provided later. */
  public static class Constant extends Terminal {
    public final Domain domain;
    public final int count;

    Constant(Domain domain, int count, ImmutableIntArray shape) {
      super(Op.CONSTANT, shape);
      this.domain = requireNonNull(domain);
      this.count = count;
    }

    @Override boolean payloadEquals(Expr e) {
      final Constant that = (Constant) e;
      return count == that.count && domain.equals(that.domain);
    }

    @Override int payloadHashCode() {
      return Objects.hash(count, domain);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(op.symbol).append("_").append(Integer.toString(count));
    }
  }

  /** Scalar literal. */
  public abstract static class ScalarValue extends Terminal {
    ScalarValue(Op op) {
      super(op, SCALAR);
    }

    /** Returns the value as a {@code double}. */
    public abstract double doubleValue();
  }

  /** Floating-point literal. */
  public static class FloatValue extends ScalarValue {
    public final double value;

    FloatValue(double value) {
      super(Op.FLOAT_VALUE);
      this.value = value;
    }

    @Override public double doubleValue() {
      return value;
    }

    @Override boolean payloadEquals(Expr e) {
      return Double.compare(value, ((FloatValue) e).value) == 0;
    }

    @Override int payloadHashCode() {
      return Double.hashCode(value);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(Double.toString(value));
    }
  }

  /** Integer literal. */
  public static class IntValue extends ScalarValue {
    public final long value;

    IntValue(long value) {
      super(Op.INT_VALUE);
      this.value = value;
    }

    @Override public double doubleValue() {
      return value;
    }

    @Override boolean payloadEquals(Expr e) {
      return value == ((IntValue) e).value;
    }

    @Override int payloadHashCode() {
      return Long.hashCode(value);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(Long.toString(value));
    }
  }

  /** Zero tensor of a given shape. */
  public static class Zero extends Terminal {
    Zero(ImmutableIntArray shape,
        ImmutableSortedMap<Index, Integer> freeIndices) {
      super(Op.ZERO, shape, freeIndices);
    }

    @Override boolean payloadEquals(Expr e) {
      return true;
    }

    @Override int payloadHashCode() {
      return 0;
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(op.symbol);
    }
  }

  /** Sequence of indices; the second operand of {@link Indexed},
   * {@link ComponentTensor} and {@link IndexSum}. */
  public static class MultiIndex extends Terminal {
    public final ImmutableList<IndexBase> indices;

    MultiIndex(ImmutableList<IndexBase> indices) {
      super(Op.MULTI_INDEX, SCALAR);
      this.indices = requireNonNull(indices);
    }

    /** Returns the indices, all of which must be free. */
    public ImmutableList<Index> freeIndexList() {
      final ImmutableList.Builder<Index> b = ImmutableList.builder();
      for (IndexBase index : indices) {
        checkArgument(index instanceof Index, "not a free index: %s", index);
        b.add((Index) index);
      }
      return b.build();
    }

    @Override boolean payloadEquals(Expr e) {
      return indices.equals(((MultiIndex) e).indices);
    }

    @Override int payloadHashCode() {
      return indices.hashCode();
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.list("(", indices, ")");
    }
  }

  /** Label of a {@link Variable}. */
  public static class Label extends Terminal {
    public final int count;

    Label(int count) {
      super(Op.LABEL, SCALAR);
      this.count = count;
    }

    @Override boolean payloadEquals(Expr e) {
      return count == ((Label) e).count;
    }

    @Override int payloadHashCode() {
      return count;
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(op.symbol).append("_").append(Integer.toString(count));
    }
  }

  /** Base class of nodes that have operands. */
  public abstract static class Operator extends Expr {
    final ImmutableList<Expr> operands;

    Operator(Op op, ImmutableIntArray shape,
        ImmutableSortedMap<Index, Integer> freeIndices,
        ImmutableList<Expr> operands) {
      super(op, shape, freeIndices);
      this.operands = requireNonNull(operands);
      checkArgument(!op.isTerminal(), "not an operator: %s", op);
    }

    @Override public List<Expr> operands() {
      return operands;
    }

    @Override boolean payloadEquals(Expr e) {
      return true;
    }

    @Override int payloadHashCode() {
      return 0;
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.call(op.symbol, operands);
    }
  }

  /** Operator with two scalar-valued operands: sum, product, division,
   * power, minimum and maximum. */
  public static class Binary extends Operator {
    private Binary(Op op, ImmutableIntArray shape,
        ImmutableSortedMap<Index, Integer> freeIndices, Expr a, Expr b) {
      super(op, shape, freeIndices, ImmutableList.of(a, b));
    }

    static Binary create(Op op, Expr a, Expr b) {
      switch (op) {
      case SUM:
        checkArgument(a.shape.equals(b.shape),
            "cannot add tensors of shape %s and %s", a.shape, b.shape);
        checkArgument(a.freeIndices.equals(b.freeIndices),
            "cannot add expressions with free indices %s and %s",
            a.freeIndices.keySet(), b.freeIndices.keySet());
        return new Binary(op, a.shape, a.freeIndices, a, b);
      case PRODUCT:
      case DIVISION:
      case MIN_VALUE:
      case MAX_VALUE:
        checkArgument(a.shape.isEmpty() && b.shape.isEmpty(),
            "operands of %s must be scalar", op);
        return new Binary(op, SCALAR, merge(a, b), a, b);
      case POWER:
        checkArgument(a.shape.isEmpty() && b.isTrueScalar(),
            "operands of %s must be scalar", op);
        return new Binary(op, SCALAR, a.freeIndices, a, b);
      default:
        throw new AssertionError("not binary: " + op);
      }
    }

    @Override Expr reconstruct(ImmutableList<Expr> operands) {
      return create(op, operands.get(0), operands.get(1));
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      if (op.padded != null) {
        return w.infix(left, operands.get(0), op, operands.get(1), right);
      }
      return super.unparse(w, left, right);
    }
  }

  /** Operator with one operand: absolute value, square root, real part,
   * complex conjugate, and reference value. */
  public static class Unary extends Operator {
    private Unary(Op op, ImmutableIntArray shape,
        ImmutableSortedMap<Index, Integer> freeIndices, Expr a) {
      super(op, shape, freeIndices, ImmutableList.of(a));
    }

    static Unary create(Op op, Expr a) {
      switch (op) {
      case ABS:
      case REAL:
      case CONJ:
        break;
      case SQRT:
        checkArgument(a.shape.isEmpty(), "operand of %s must be scalar", op);
        break;
      case REFERENCE_VALUE:
        checkArgument(a instanceof FormArgument,
            "operand of %s must be a form argument", op);
        break;
      default:
        throw new AssertionError("not unary: " + op);
      }
      return new Unary(op, a.shape, a.freeIndices, a);
    }

    @Override Expr reconstruct(ImmutableList<Expr> operands) {
      return create(op, operands.get(0));
    }
  }

  /** Gradient with respect to physical or reference coordinates.
   *
   * <p>Adds a dimension of size {@link #dim} to the shape of its operand. */
  public static class Derivative extends Operator {
    public final int dim;

    private Derivative(Op op, Expr a, int dim) {
      super(op, ImmutableIntArray.builder().addAll(a.shape).add(dim).build(),
          a.freeIndices, ImmutableList.of(a));
      this.dim = dim;
      checkArgument(op == Op.GRAD || op == Op.REFERENCE_GRAD);
    }

    static Derivative create(Op op, Expr a, int dim) {
      return new Derivative(op, a, dim);
    }

    @Override Expr reconstruct(ImmutableList<Expr> operands) {
      return create(op, operands.get(0), dim);
    }

    @Override boolean payloadEquals(Expr e) {
      return dim == ((Derivative) e).dim;
    }

    @Override int payloadHashCode() {
      return dim;
    }
  }

  /** Component of a tensor, {@code A[i, 0]}. */
  public static class Indexed extends Operator {
    private Indexed(ImmutableSortedMap<Index, Integer> freeIndices,
        Expr tensor, MultiIndex multiIndex) {
      super(Op.INDEXED, SCALAR, freeIndices,
          ImmutableList.of(tensor, multiIndex));
    }

    static Indexed create(Expr tensor, Expr multiIndex) {
      checkArgument(multiIndex instanceof MultiIndex,
          "expected multi-index, got %s", multiIndex);
      final List<IndexBase> indices = ((MultiIndex) multiIndex).indices;
      checkArgument(indices.size() == tensor.rank(),
          "tensor of rank %s requires %s indices, got %s", tensor.rank(),
          tensor.rank(), indices);
      final TreeMap<Index, Integer> map = new TreeMap<>(tensor.freeIndices);
      for (int k = 0; k < indices.size(); k++) {
        final IndexBase index = indices.get(k);
        final int dim = tensor.shape.get(k);
        if (index instanceof FixedIndex) {
          checkArgument(((FixedIndex) index).value < dim,
              "index %s out of range for dimension %s", index, dim);
        } else {
          checkArgument(map.put((Index) index, dim) == null,
              "repeated index %s", index);
        }
      }
      return new Indexed(ImmutableSortedMap.copyOfSorted(map), tensor,
          (MultiIndex) multiIndex);
    }

    public Expr tensor() {
      return operands.get(0);
    }

    public MultiIndex multiIndex() {
      return (MultiIndex) operands.get(1);
    }

    @Override Expr reconstruct(ImmutableList<Expr> operands) {
      return create(operands.get(0), operands.get(1));
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(tensor(), 0, 99).list("[", multiIndex().indices, "]");
    }
  }

  /** Tensor built from a scalar expression with free indices,
   * {@code as_tensor(e, (i, j))}. */
  public static class ComponentTensor extends Operator {
    private ComponentTensor(ImmutableIntArray shape,
        ImmutableSortedMap<Index, Integer> freeIndices, Expr e,
        MultiIndex multiIndex) {
      super(Op.COMPONENT_TENSOR, shape, freeIndices,
          ImmutableList.of(e, multiIndex));
    }

    static ComponentTensor create(Expr e, Expr multiIndex) {
      checkArgument(multiIndex instanceof MultiIndex,
          "expected multi-index, got %s", multiIndex);
      checkArgument(e.shape.isEmpty(), "expected scalar, got shape %s",
          e.shape);
      final List<Index> indices = ((MultiIndex) multiIndex).freeIndexList();
      final ImmutableIntArray.Builder shape = ImmutableIntArray.builder();
      for (Index index : indices) {
        final Integer dim = e.freeIndices.get(index);
        checkArgument(dim != null, "index %s is not free in %s", index, e);
        shape.add(dim);
      }
      return new ComponentTensor(shape.build(),
          minus(e.freeIndices, indices), e, (MultiIndex) multiIndex);
    }

    public Expr expression() {
      return operands.get(0);
    }

    public MultiIndex multiIndex() {
      return (MultiIndex) operands.get(1);
    }

    @Override Expr reconstruct(ImmutableList<Expr> operands) {
      return create(operands.get(0), operands.get(1));
    }
  }

  /** Sum of a scalar expression over the range of one of its free
   * indices. */
  public static class IndexSum extends Operator {
    private IndexSum(ImmutableSortedMap<Index, Integer> freeIndices,
        Expr summand, MultiIndex multiIndex) {
      super(Op.INDEX_SUM, SCALAR, freeIndices,
          ImmutableList.of(summand, multiIndex));
    }

    static IndexSum create(Expr summand, Expr multiIndex) {
      checkArgument(multiIndex instanceof MultiIndex,
          "expected multi-index, got %s", multiIndex);
      checkArgument(summand.shape.isEmpty(), "expected scalar summand");
      final List<Index> indices = ((MultiIndex) multiIndex).freeIndexList();
      checkArgument(indices.size() == 1, "expected one index, got %s",
          indices);
      return new IndexSum(minus(summand.freeIndices, indices), summand,
          (MultiIndex) multiIndex);
    }

    public Expr summand() {
      return operands.get(0);
    }

    public Index index() {
      return ((MultiIndex) operands.get(1)).freeIndexList().get(0);
    }

    /** Returns the number of values that the summation index takes. */
    public int dimension() {
      return requireNonNull(summand().freeIndices.get(index()));
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append("sum_").append(index().toString()).append("(")
          .append(summand(), 0, 0).append(")");
    }

    @Override Expr reconstruct(ImmutableList<Expr> operands) {
      return create(operands.get(0), operands.get(1));
    }
  }

  /** Tensor whose components along the first axis are given,
   * {@code [a, b, c]}. */
  public static class ListTensor extends Operator {
    private ListTensor(ImmutableIntArray shape,
        ImmutableSortedMap<Index, Integer> freeIndices,
        ImmutableList<Expr> items) {
      super(Op.LIST_TENSOR, shape, freeIndices, items);
    }

    static ListTensor create(ImmutableList<Expr> items) {
      checkArgument(!items.isEmpty(), "empty list tensor");
      final Expr first = items.get(0);
      for (Expr item : items) {
        checkArgument(item.shape.equals(first.shape),
            "inconsistent shapes in list tensor");
        checkArgument(item.freeIndices.equals(first.freeIndices),
            "inconsistent free indices in list tensor");
      }
      final ImmutableIntArray shape = ImmutableIntArray.builder()
          .add(items.size()).addAll(first.shape).build();
      return new ListTensor(shape, first.freeIndices, items);
    }

    @Override Expr reconstruct(ImmutableList<Expr> operands) {
      return create(operands);
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      w.append("[");
      for (int i = 0; i < operands.size(); i++) {
        w.append(i == 0 ? "" : ", ").append(operands.get(i), 0, 0);
      }
      return w.append("]");
    }
  }

  /** Expression with a label, so that it can be differentiated with respect
   * to. */
  public static class Variable extends Operator {
    private Variable(Expr e, Label label) {
      super(Op.VARIABLE, e.shape, e.freeIndices, ImmutableList.of(e, label));
    }

    static Variable create(Expr e, Expr label) {
      checkArgument(label instanceof Label, "expected label, got %s", label);
      return new Variable(e, (Label) label);
    }

    public Expr expression() {
      return operands.get(0);
    }

    public Label label() {
      return (Label) operands.get(1);
    }

    @Override Expr reconstruct(ImmutableList<Expr> operands) {
      return create(operands.get(0), operands.get(1));
    }
  }

  /** Expression evaluated on one side of an interior facet,
   * {@code e('+')}. */
  public static class Restricted extends Operator {
    public final Side side;

    private Restricted(Expr e, Side side) {
      super(Op.RESTRICTED, e.shape, e.freeIndices, ImmutableList.of(e));
      this.side = requireNonNull(side);
    }

    static Restricted create(Expr e, Side side) {
      return new Restricted(e, side);
    }

    public Expr expression() {
      return operands.get(0);
    }

    @Override Expr reconstruct(ImmutableList<Expr> operands) {
      return create(operands.get(0), side);
    }

    @Override boolean payloadEquals(Expr e) {
      return side == ((Restricted) e).side;
    }

    @Override int payloadHashCode() {
      return side.hashCode();
    }

    @Override ExprWriter unparse(ExprWriter w, int left, int right) {
      return w.append(expression(), 0, 99)
          .append("('").append(side.symbol).append("')");
    }
  }
}

// End Exprs.java
