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
package net.hydromatic.variform.rewrite;

import java.util.List;
import net.hydromatic.variform.ast.Expr;

/** Set of rules that rewrite an expression, one rule per kind of node.
 *
 * <p>Sub-classes hold the state of one rewrite (configuration, memo tables)
 * and supply a {@link RuleTable} that is shared by all instances.
 *
 * @see DagMapper */
public abstract class RuleSet {
  /** Returns the table of rules for this class. */
  protected abstract RuleTable<? extends RuleSet> table();

  /** Returns the name of this rule set, for error messages. */
  public String name() {
    return getClass().getSimpleName();
  }

  /** Returns whether nodes of a given kind are rewritten without first
   * rewriting their operands. */
  boolean isCutoff(Expr e) {
    return table().isCutoff(e.op);
  }

  /** Applies the rule for a node, given its rewritten operands.
   *
   * <p>A rule may call this method to rewrite a node that it has created, for
   * example a quantity that its own definition depends on. */
  @SuppressWarnings("unchecked")
  protected final Expr apply(Expr e, List<Expr> operands) {
    final RuleTable<RuleSet> table = (RuleTable<RuleSet>) table();
    return table.apply(this, e, operands);
  }

  /** Default rule for operators. Returns the node itself if each of the
   * rewritten operands is the same object as the original operand, otherwise
   * a new node of the same kind with the rewritten operands. */
  public static Expr reuseIfUntouched(Expr e, List<Expr> operands) {
    return e.copy(operands);
  }
}

// End RuleSet.java
