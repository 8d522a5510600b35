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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.primitives.ImmutableIntArray;
import java.util.List;
import java.util.Objects;

/** Node in an expression DAG.
 *
 * <p>Nodes are immutable, and may be shared by several parents. Two nodes are
 * {@link #equals equal} if they have the same structure; rewriting algorithms
 * memoize by identity, and treat a node as unchanged only if the rewritten node
 * is the same object.
 *
 * <p>Each node has a shape (the dimensions of the tensor it represents) and a
 * set of free indices (each with the dimension it ranges over). Neither changes
 * after construction. */
public abstract class Expr {
  public final Op op;
  public final ImmutableIntArray shape;
  public final ImmutableSortedMap<Index, Integer> freeIndices;

  /** Cached hash code; zero if not yet computed. */
  private int hash;

  Expr(Op op, ImmutableIntArray shape,
      ImmutableSortedMap<Index, Integer> freeIndices) {
    this.op = requireNonNull(op);
    this.shape = requireNonNull(shape);
    this.freeIndices = requireNonNull(freeIndices);
  }

  /** Returns the operands of this node; empty if it is a terminal. */
  public abstract List<Expr> operands();

  /** Returns the {@code i}th operand. */
  public Expr operand(int i) {
    return operands().get(i);
  }

  /** Returns whether this node has no operands. */
  public boolean isTerminal() {
    return op.isTerminal();
  }

  /** Returns the number of dimensions of this tensor; 0 for a scalar. */
  public int rank() {
    return shape.length();
  }

  /** Returns whether this is a scalar with no free indices. */
  public boolean isTrueScalar() {
    return shape.isEmpty() && freeIndices.isEmpty();
  }

  /** Creates a copy of this node with given operands, or {@code this} if the
   * operands are the same objects as the current operands.
   *
   * <p>The copy has the same kind and payload. */
  public Expr copy(List<Expr> operands) {
    final List<Expr> current = operands();
    if (operands.size() == current.size()) {
      boolean same = true;
      for (int i = 0; i < operands.size(); i++) {
        if (operands.get(i) != current.get(i)) {
          same = false;
          break;
        }
      }
      if (same) {
        return this;
      }
    }
    return reconstruct(ImmutableList.copyOf(operands));
  }

  /** Creates a node of the same kind and payload with new operands. */
  abstract Expr reconstruct(ImmutableList<Expr> operands);

  /** Returns whether this node's payload (the data that is not in its kind,
   * shape, free indices or operands) equals another's. */
  abstract boolean payloadEquals(Expr e);

  abstract int payloadHashCode();

  @Override public final int hashCode() {
    int h = hash;
    if (h == 0) {
      h = Objects.hash(op, shape, freeIndices, payloadHashCode(), operands());
      if (h == 0) {
        h = 1;
      }
      hash = h;
    }
    return h;
  }

  @Override public final boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Expr)) {
      return false;
    }
    final Expr e = (Expr) o;
    return op == e.op
        && hashCode() == e.hashCode()
        && shape.equals(e.shape)
        && freeIndices.equals(e.freeIndices)
        && payloadEquals(e)
        && operands().equals(e.operands());
  }

  /** Converts this node into a string.
   *
   * <p>Marked final; override {@link #unparse(ExprWriter, int, int)}. */
  @Override public final String toString() {
    return unparse(new ExprWriter(), 0, 0).toString();
  }

  abstract ExprWriter unparse(ExprWriter w, int left, int right);
}

// End Expr.java
