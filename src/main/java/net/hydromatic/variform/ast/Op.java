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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableMap;
import java.util.EnumSet;
import java.util.Set;

/** Kinds of {@link Expr}.
 *
 * <p>The set is closed; rule tables are keyed by it. */
public enum Op {
  // geometric quantities
  SPATIAL_COORDINATE(Category.GEOMETRIC, "x"),
  CELL_COORDINATE(Category.GEOMETRIC, "X"),
  FACET_COORDINATE(Category.GEOMETRIC, "Xf"),
  /** Reference coordinate, in the cell, of a point on a facet. */
  FACET_CELL_COORDINATE(Category.GEOMETRIC, "XF"),
  CELL_ORIGIN(Category.GEOMETRIC, "x0"),
  FACET_ORIGIN(Category.GEOMETRIC, "x0f"),
  CELL_FACET_ORIGIN(Category.GEOMETRIC, "X0f"),
  JACOBIAN(Category.GEOMETRIC, "J"),
  JACOBIAN_DETERMINANT(Category.GEOMETRIC, "detJ"),
  JACOBIAN_INVERSE(Category.GEOMETRIC, "K"),
  FACET_JACOBIAN(Category.GEOMETRIC, "FJ"),
  FACET_JACOBIAN_DETERMINANT(Category.GEOMETRIC, "detFJ"),
  FACET_JACOBIAN_INVERSE(Category.GEOMETRIC, "FK"),
  CELL_FACET_JACOBIAN(Category.GEOMETRIC, "CFJ"),
  RIDGE_JACOBIAN(Category.GEOMETRIC, "RJ"),
  RIDGE_JACOBIAN_DETERMINANT(Category.GEOMETRIC, "detRJ"),
  RIDGE_JACOBIAN_INVERSE(Category.GEOMETRIC, "RK"),
  CELL_RIDGE_JACOBIAN(Category.GEOMETRIC, "CRJ"),
  REFERENCE_CELL_VOLUME(Category.GEOMETRIC, "reference_cell_volume"),
  REFERENCE_FACET_VOLUME(Category.GEOMETRIC, "reference_facet_volume"),
  REFERENCE_CELL_EDGE_VECTORS(Category.GEOMETRIC, "RCEV"),
  REFERENCE_FACET_EDGE_VECTORS(Category.GEOMETRIC, "RFEV"),
  REFERENCE_NORMAL(Category.GEOMETRIC, "reference_normal"),
  CELL_VERTICES(Category.GEOMETRIC, "CV"),
  CELL_EDGE_VECTORS(Category.GEOMETRIC, "CEV"),
  FACET_EDGE_VECTORS(Category.GEOMETRIC, "FEV"),
  CELL_NORMAL(Category.GEOMETRIC, "cell_normal"),
  FACET_NORMAL(Category.GEOMETRIC, "n"),
  CELL_VOLUME(Category.GEOMETRIC, "volume"),
  CIRCUMRADIUS(Category.GEOMETRIC, "circumradius"),
  CELL_DIAMETER(Category.GEOMETRIC, "diameter"),
  FACET_AREA(Category.GEOMETRIC, "facetarea"),
  MIN_CELL_EDGE_LENGTH(Category.GEOMETRIC, "mincelledgelength"),
  MAX_CELL_EDGE_LENGTH(Category.GEOMETRIC, "maxcelledgelength"),
  MIN_FACET_EDGE_LENGTH(Category.GEOMETRIC, "minfacetedgelength"),
  MAX_FACET_EDGE_LENGTH(Category.GEOMETRIC, "maxfacetedgelength"),
  CELL_ORIENTATION(Category.GEOMETRIC, "cell_orientation"),
  FACET_ORIENTATION(Category.GEOMETRIC, "facet_orientation"),
  QUADRATURE_WEIGHT(Category.GEOMETRIC, "weight"),

  // form arguments and constants
  ARGUMENT(Category.FORM_ARGUMENT, "v"),
  COEFFICIENT(Category.FORM_ARGUMENT, "w"),
  CONSTANT(Category.LITERAL, "c"),

  // literals
  FLOAT_VALUE(Category.LITERAL, ""),
  INT_VALUE(Category.LITERAL, ""),
  ZERO(Category.LITERAL, "0"),

  // placeholders
  MULTI_INDEX(Category.PLACEHOLDER, ""),
  LABEL(Category.PLACEHOLDER, "l"),

  // operators
  SUM(" + ", 6),
  PRODUCT(" * ", 7),
  DIVISION(" / ", 7),
  POWER(" ** ", 9, false),
  ABS("abs"),
  SQRT("sqrt"),
  REAL("real"),
  CONJ("conj"),
  MIN_VALUE("min_value"),
  MAX_VALUE("max_value"),
  INDEXED,
  COMPONENT_TENSOR("as_tensor"),
  INDEX_SUM("sum"),
  LIST_TENSOR,
  GRAD("grad"),
  REFERENCE_GRAD("reference_grad"),
  REFERENCE_VALUE("reference_value"),
  VARIABLE("variable"),
  RESTRICTED;

  /** Category of this kind of expression. */
  public final Category category;
  /** Symbol for a terminal, or function name for a prefix operator. */
  public final String symbol;
  /** Padded name of an infix operator, e.g. " + "; otherwise null. */
  public final String padded;
  /** Left precedence. */
  public final int left;
  /** Right precedence. */
  public final int right;
  /** Name in lower camel case, e.g. "jacobianInverse". */
  public final String camelName;

  /** Map of all kinds, keyed by both {@link #name()} and
   * {@link #camelName}. */
  public static final ImmutableMap<String, Op> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Op> b = ImmutableMap.builder();
    for (Op op : values()) {
      b.put(op.name(), op);
      b.put(op.camelName, op);
    }
    BY_NAME = b.build();
  }

  /** Creates a terminal kind. */
  Op(Category category, String symbol) {
    this(category, symbol, null, 99, 99);
    checkArgument(category != Category.OPERATOR);
  }

  /** Creates a left-associative infix operator. */
  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(Category.OPERATOR, padded.trim(), padded,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  /** Creates an operator written as a function call, e.g. "sqrt(x)". */
  Op(String symbol) {
    this(Category.OPERATOR, symbol, null, 99, 99);
  }

  /** Creates an operator with its own syntax, e.g. "A[i, j]". */
  Op() {
    this(Category.OPERATOR, "", null, 99, 99);
  }

  Op(Category category, String symbol, String padded, int left, int right) {
    this.category = category;
    this.symbol = symbol;
    this.padded = padded;
    this.left = left;
    this.right = right;
    this.camelName =
        CaseFormat.UPPER_UNDERSCORE.to(CaseFormat.LOWER_CAMEL, name());
  }

  /** Returns whether expressions of this kind have no operands. */
  public boolean isTerminal() {
    return category != Category.OPERATOR;
  }

  /** Returns whether this is a geometric quantity. */
  public boolean isGeometric() {
    return category == Category.GEOMETRIC;
  }

  /** Returns all kinds in a given category. */
  public static Set<Op> inCategory(Category category) {
    final Set<Op> set = EnumSet.noneOf(Op.class);
    for (Op op : values()) {
      if (op.category == category) {
        set.add(op);
      }
    }
    return set;
  }

  /** Looks up a kind by name. Throws if not found; never returns null. */
  public static Op lookup(String name) {
    final Op op = BY_NAME.get(name.trim());
    if (op == null) {
      throw new IllegalArgumentException("unknown expression kind '" + name
          + "'");
    }
    return op;
  }

  /** Category of expression kind. */
  public enum Category {
    /** Quantity derived from the geometry of a cell or facet. */
    GEOMETRIC,
    /** Argument or coefficient of a form. */
    FORM_ARGUMENT,
    /** Value that is the same everywhere. */
    LITERAL,
    /** Index or label that only has meaning inside an expression. */
    PLACEHOLDER,
    /** Node with operands. */
    OPERATOR
  }
}

// End Op.java
