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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.ast.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Table of rules, keyed by the kind of node they apply to.
 *
 * <p>A rule set builds its table once, in a static initializer, and returns it
 * from {@link RuleSet#table()}. Rules are method references on the rule set
 * class, so dispatch is a map lookup rather than reflection.
 *
 * <p>There are two kinds of rule. An {@link OperandRule} is called after the
 * engine has rewritten the operands of the node, and receives the rewritten
 * operands. A {@link NodeRule} receives only the original node; if registered
 * for an operator, the engine does not rewrite the operands first, and the rule
 * is responsible for the whole subtree (a "cutoff" rule).
 *
 * @param <R> rule set type
 */
public final class RuleTable<R extends RuleSet> {
  private final ImmutableMap<Op, NodeRule<R>> nodeRules;
  private final ImmutableMap<Op, OperandRule<R>> operandRules;
  private final @Nullable NodeRule<R> terminalDefault;
  private final @Nullable OperandRule<R> operatorDefault;

  private RuleTable(Map<Op, NodeRule<R>> nodeRules,
      Map<Op, OperandRule<R>> operandRules,
      @Nullable NodeRule<R> terminalDefault,
      @Nullable OperandRule<R> operatorDefault) {
    this.nodeRules = Maps.immutableEnumMap(nodeRules);
    this.operandRules = Maps.immutableEnumMap(operandRules);
    this.terminalDefault = terminalDefault;
    this.operatorDefault = operatorDefault;
  }

  /** Creates a builder. Its operator default is
   * {@link RuleSet#reuseIfUntouched}; it has no terminal default. */
  public static <R extends RuleSet> Builder<R> builder() {
    return new Builder<>();
  }

  /** Returns whether the engine should skip the operands of a node of a given
   * kind, and let the rule handle the whole subtree. */
  boolean isCutoff(Op op) {
    return !op.isTerminal() && nodeRules.containsKey(op);
  }

  /** Applies the rule for a node. */
  Expr apply(R ruleSet, Expr e, List<Expr> operands) {
    final NodeRule<R> nodeRule = nodeRules.get(e.op);
    if (nodeRule != null) {
      return nodeRule.apply(ruleSet, e);
    }
    if (e.isTerminal()) {
      if (terminalDefault != null) {
        return terminalDefault.apply(ruleSet, e);
      }
    } else {
      final OperandRule<R> operandRule = operandRules.get(e.op);
      if (operandRule != null) {
        return operandRule.apply(ruleSet, e, operands);
      }
      if (operatorDefault != null) {
        return operatorDefault.apply(ruleSet, e, operands);
      }
    }
    throw new MissingRuleException(ruleSet.name(), e.op);
  }

  /** Returns the kinds of node for which this table has no rule, neither a
   * specific rule nor a default. */
  public Set<Op> uncovered() {
    final Set<Op> set = EnumSet.noneOf(Op.class);
    for (Op op : Op.values()) {
      if (nodeRules.containsKey(op)) {
        continue;
      }
      if (op.isTerminal()
          ? terminalDefault == null
          : operatorDefault == null && !operandRules.containsKey(op)) {
        set.add(op);
      }
    }
    return Sets.immutableEnumSet(set);
  }

  /** Rule that rewrites a node without first rewriting its operands.
   *
   * @param <R> rule set type */
  @FunctionalInterface
  public interface NodeRule<R> {
    Expr apply(R ruleSet, Expr e);
  }

  /** Rule that rewrites a node given its rewritten operands.
   *
   * @param <R> rule set type */
  @FunctionalInterface
  public interface OperandRule<R> {
    Expr apply(R ruleSet, Expr e, List<Expr> operands);
  }

  /** Builder for {@link RuleTable}.
   *
   * @param <R> rule set type */
  public static class Builder<R extends RuleSet> {
    private final Map<Op, NodeRule<R>> nodeRules = new EnumMap<>(Op.class);
    private final Map<Op, OperandRule<R>> operandRules =
        new EnumMap<>(Op.class);
    private @Nullable NodeRule<R> terminalDefault;
    private @Nullable OperandRule<R> operatorDefault =
        (ruleSet, e, operands) -> RuleSet.reuseIfUntouched(e, operands);

    private Builder() {}

    /** Sets the rule for terminals that have no specific rule. If null (the
     * default), such terminals cause {@link MissingRuleException}. */
    public Builder<R> terminalDefault(@Nullable NodeRule<R> rule) {
      this.terminalDefault = rule;
      return this;
    }

    /** Sets the rule for operators that have no specific rule. */
    public Builder<R> operatorDefault(@Nullable OperandRule<R> rule) {
      this.operatorDefault = rule;
      return this;
    }

    /** Registers a rule that receives the original node. */
    public Builder<R> node(Op op, NodeRule<R> rule) {
      checkArgument(!operandRules.containsKey(op)
              && nodeRules.put(op, rule) == null,
          "duplicate rule for %s", op);
      return this;
    }

    /** Registers a rule for several kinds of node. */
    public Builder<R> node(Iterable<Op> ops, NodeRule<R> rule) {
      for (Op op : ops) {
        node(op, rule);
      }
      return this;
    }

    /** Registers a rule that receives the rewritten operands. */
    public Builder<R> operand(Op op, OperandRule<R> rule) {
      checkArgument(!op.isTerminal(), "terminal %s has no operands", op);
      checkArgument(!nodeRules.containsKey(op)
              && operandRules.put(op, rule) == null,
          "duplicate rule for %s", op);
      return this;
    }

    public RuleTable<R> build() {
      return new RuleTable<>(nodeRules, operandRules, terminalDefault,
          operatorDefault);
    }
  }
}

// End RuleTable.java
