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

import java.util.List;

/** Context for writing an expression out as a string. */
public class ExprWriter {
  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public ExprWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an expression. */
  public ExprWriter append(Expr e, int left, int right) {
    return e.unparse(this, left, right);
  }

  /** Appends a call to an infix operator. */
  public ExprWriter infix(int left, Expr a0, Op op, Expr a1, int right) {
    if (left > op.left || op.right < right) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix function, e.g. "sqrt(x)". */
  public ExprWriter call(String name, List<? extends Expr> args) {
    append(name).append("(");
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      args.get(i).unparse(this, 0, 0);
    }
    return append(")");
  }

  /** Appends a list of objects separated by commas. */
  public ExprWriter list(String open, List<?> list, String close) {
    append(open);
    for (int i = 0; i < list.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      append(String.valueOf(list.get(i)));
    }
    return append(close);
  }

  @Override public String toString() {
    return b.toString();
  }
}

// End ExprWriter.java
