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

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.variform.ast.Expr;

/** Applies a {@link RuleSet} to an expression DAG.
 *
 * <p>The walk is post-order: the operands of a node are rewritten before the
 * node itself, except for nodes that have a cutoff rule. Each distinct node
 * (by identity) is rewritten once, and its result is reused wherever the node
 * occurs.
 *
 * <p>Two caches hold the state of a walk. The value cache maps each node
 * visited to its result, by identity. The result cache maps each result to a
 * canonical equal result, so that equal new nodes are shared. A caller that
 * wants several walks to share state (for example, a rule that calls back
 * into the engine) passes the same caches to each call. */
public class DagMapper {
  private DagMapper() {}

  /** Rewrites an expression using fresh caches. */
  public static Expr map(Expr e, RuleSet ruleSet) {
    return map(e, ruleSet, new IdentityHashMap<>(), new HashMap<>());
  }

  /** Rewrites an expression using given caches.
   *
   * @param e Root of the expression
   * @param ruleSet Rules
   * @param vcache Value cache, keyed by identity (typically an
   *   {@link IdentityHashMap})
   * @param rcache Result cache, keyed by equality
   * @return Rewritten expression
   */
  public static Expr map(Expr e, RuleSet ruleSet, Map<Expr, Expr> vcache,
      Map<Expr, Expr> rcache) {
    final Expr cached = vcache.get(e);
    if (cached != null) {
      return cached;
    }
    final Deque<Frame> stack = new ArrayDeque<>();
    stack.push(new Frame(e));
    while (!stack.isEmpty()) {
      final Frame frame = stack.peek();
      final Expr node = frame.node;
      if (vcache.containsKey(node)) {
        // Already done; the node occurs more than once below the root.
        stack.pop();
        continue;
      }
      if (node.isTerminal() || ruleSet.isCutoff(node)) {
        stack.pop();
        store(node, ruleSet.apply(node, node.operands()), ruleSet, vcache,
            rcache);
        continue;
      }
      if (!frame.expanded) {
        frame.expanded = true;
        final List<Expr> operands = node.operands();
        for (int i = operands.size() - 1; i >= 0; i--) {
          final Expr operand = operands.get(i);
          if (!vcache.containsKey(operand)) {
            stack.push(new Frame(operand));
          }
        }
        continue;
      }
      stack.pop();
      final ImmutableList.Builder<Expr> operands = ImmutableList.builder();
      for (Expr operand : node.operands()) {
        operands.add(vcache.get(operand));
      }
      store(node, ruleSet.apply(node, operands.build()), ruleSet, vcache,
          rcache);
    }
    return vcache.get(e);
  }

  /** Records the result of rewriting a node. */
  private static void store(Expr node, Expr result, RuleSet ruleSet,
      Map<Expr, Expr> vcache, Map<Expr, Expr> rcache) {
    if (!result.shape.equals(node.shape)) {
      throw new RewriteException("shape changed from " + node.shape + " to "
          + result.shape + " in " + ruleSet.name(), node.op);
    }
    final Expr r;
    if (result == node) {
      // Keep an untouched node, even if an equal node was seen earlier.
      rcache.putIfAbsent(node, node);
      r = node;
    } else {
      final Expr previous = rcache.putIfAbsent(result, result);
      r = previous != null ? previous : result;
    }
    vcache.put(node, r);
  }

  /** Entry on the stack of nodes to be rewritten. */
  private static class Frame {
    final Expr node;
    boolean expanded;

    Frame(Expr node) {
      this.node = node;
    }
  }
}

// End DagMapper.java
