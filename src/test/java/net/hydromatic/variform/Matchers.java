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

import static org.hamcrest.Matchers.closeTo;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Predicate;
import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.ast.Op;
import org.hamcrest.Description;
import org.hamcrest.Matcher;
import org.hamcrest.TypeSafeMatcher;

/** Matchers for use in Variform tests. */
public abstract class Matchers {
  private Matchers() {}

  /** Tolerance for comparing evaluated expressions. */
  private static final double EPSILON = 1e-12;

  /** Matches an expression that contains a node of a given kind. */
  public static Matcher<Expr> containsOp(Op op) {
    return containsNode("node of kind " + op, e -> e.op == op);
  }

  /** Matches an expression that contains a node equal to a given node. */
  public static Matcher<Expr> containsNode(Expr node) {
    return containsNode("node " + node, node::equals);
  }

  private static Matcher<Expr> containsNode(String text,
      Predicate<Expr> predicate) {
    return new TypeSafeMatcher<Expr>() {
      protected boolean matchesSafely(Expr e) {
        final Deque<Expr> stack = new ArrayDeque<>();
        stack.push(e);
        while (!stack.isEmpty()) {
          final Expr e2 = stack.pop();
          if (predicate.test(e2)) {
            return true;
          }
          e2.operands().forEach(stack::push);
        }
        return false;
      }

      public void describeTo(Description description) {
        description.appendText("expression containing " + text);
      }
    };
  }

  /** Matches a number close to an expected value. */
  public static Matcher<Double> near(double expected) {
    return closeTo(expected, EPSILON);
  }

  /** Matches a vector whose elements are close to expected values. */
  public static Matcher<double[]> near(double... expected) {
    return new TypeSafeMatcher<double[]>() {
      protected boolean matchesSafely(double[] actual) {
        if (actual.length != expected.length) {
          return false;
        }
        for (int i = 0; i < actual.length; i++) {
          if (Math.abs(actual[i] - expected[i]) > EPSILON) {
            return false;
          }
        }
        return true;
      }

      public void describeTo(Description description) {
        description.appendText("vector near ").appendValue(expected);
      }
    };
  }
}

// End Matchers.java
